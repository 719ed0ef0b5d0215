package com.autonomous.commit.service;

import com.autonomous.commit.config.MemoryConfig;
import com.autonomous.commit.exception.AllocationException;
import com.autonomous.commit.model.AllocationCategory;
import com.autonomous.commit.model.AllocationInfo;
import com.autonomous.commit.model.EvictionStrategy;
import com.autonomous.commit.model.MemoryPressure;
import com.autonomous.commit.model.MemoryStats;
import lombok.extern.slf4j.Slf4j;

import java.io.*;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Byte-accurate table of named allocations checked against a fixed budget.
 * <p>
 * The table and the usage counter change together under the write lock, so
 * {@link #getCurrentUsage()} always equals the sum of live allocation sizes once a writer
 * has returned. Eviction listeners are invoked after the lock is released, which lets owners
 * of evicted allocations (the cache) take their own locks without ordering problems.
 */
@Slf4j
public class MemoryManager implements AutoCloseable {

    private final MemoryConfig config;
    private final Comparator<Allocation> evictionOrder;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Allocation> allocations = new HashMap<>();

    private final AtomicLong currentUsage = new AtomicLong();
    private final AtomicLong peakUsage = new AtomicLong();
    private final AtomicLong totalAllocations = new AtomicLong();
    private final AtomicLong totalDeallocations = new AtomicLong();
    private final AtomicLong allocatedBytes = new AtomicLong();
    private final AtomicLong cleanupOperations = new AtomicLong();
    private final AtomicLong pressureEvents = new AtomicLong();
    private final AtomicLong accessSequence = new AtomicLong();
    private final AtomicBoolean cleanupPending = new AtomicBoolean();
    private volatile Instant lastCleanup;

    private final List<Consumer<AllocationInfo>> evictionListeners = new CopyOnWriteArrayList<>();
    private final ScheduledExecutorService cleanupExecutor;

    public MemoryManager(MemoryConfig config) {
        config.validate();
        this.config = config;
        this.evictionOrder = evictionOrder(config.getEvictionStrategy());

        if (config.isBackgroundCleanup()) {
            String threadName = "memory-cleanup-" + Integer.toHexString(System.identityHashCode(this));
            this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread thread = new Thread(r, threadName);
                thread.setDaemon(true);
                return thread;
            });
            long intervalMs = config.getCleanupInterval().toMillis();
            cleanupExecutor.scheduleWithFixedDelay(this::cleanupTick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        } else {
            this.cleanupExecutor = null;
        }
    }

    public MemoryConfig getConfig() {
        return config;
    }

    public void allocate(String id, long size, AllocationCategory category) throws AllocationException {
        allocate(id, size, category, false);
    }

    void allocate(String id, long size, AllocationCategory category, boolean pinned) throws AllocationException {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(category, "category");
        if (size < 0) {
            throw new IllegalArgumentException("Allocation size must not be negative: " + size);
        }

        long newUsage;
        lock.writeLock().lock();
        try {
            if (allocations.containsKey(id)) {
                throw AllocationException.duplicate(id);
            }
            long current = currentUsage.get();
            if (current + size > config.getMaxMemoryUsage()) {
                pressureEvents.incrementAndGet();
                log.debug("Rejected allocation {} ({} bytes): usage {} of {}",
                    id, size, current, config.getMaxMemoryUsage());
                throw AllocationException.overLimit(id, current, size, config.getMaxMemoryUsage());
            }

            allocations.put(id, new Allocation(id, size, category, pinned ? 1 : 0, accessSequence.incrementAndGet()));
            newUsage = currentUsage.addAndGet(size);
            peakUsage.accumulateAndGet(newUsage, Math::max);
            totalAllocations.incrementAndGet();
            allocatedBytes.addAndGet(size);
        } finally {
            lock.writeLock().unlock();
        }

        log.debug("Allocated {} ({} bytes, {}), usage now {}", id, size, category, newUsage);

        if (config.isBackgroundCleanup() && newUsage >= config.cleanupThresholdBytes()) {
            scheduleCleanup();
        }
    }

    public long deallocate(String id) throws AllocationException {
        lock.writeLock().lock();
        try {
            Allocation allocation = allocations.remove(id);
            if (allocation == null) {
                throw AllocationException.notFound(id);
            }
            currentUsage.addAndGet(-allocation.size);
            totalDeallocations.incrementAndGet();
            return allocation.size;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Releases an allocation owned by a scoped resource. A missing id is logged, not raised.
     */
    void release(String id) {
        try {
            deallocate(id);
        } catch (AllocationException e) {
            log.warn("Release of {} skipped: {}", id, e.getMessage());
        }
    }

    public void touch(String id) {
        if (!config.isTrackAllocations()) {
            return;
        }
        lock.writeLock().lock();
        try {
            Allocation allocation = allocations.get(id);
            if (allocation != null) {
                allocation.lastAccessedAt = Instant.now();
                allocation.accessCount++;
                allocation.accessSequence = accessSequence.incrementAndGet();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void pin(String id) throws AllocationException {
        lock.writeLock().lock();
        try {
            Allocation allocation = allocations.get(id);
            if (allocation == null) {
                throw AllocationException.notFound(id);
            }
            allocation.pinCount++;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean unpin(String id) {
        lock.writeLock().lock();
        try {
            Allocation allocation = allocations.get(id);
            if (allocation == null || allocation.pinCount == 0) {
                return false;
            }
            allocation.pinCount--;
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void addEvictionListener(Consumer<AllocationInfo> listener) {
        evictionListeners.add(listener);
    }

    public long getCurrentUsage() {
        return currentUsage.get();
    }

    public long getPeakUsage() {
        return peakUsage.get();
    }

    public double getUsagePercentage() {
        return currentUsage.get() * 100.0 / config.getMaxMemoryUsage();
    }

    public long getUsageByCategory(AllocationCategory category) {
        lock.readLock().lock();
        try {
            return allocations.values().stream()
                .filter(a -> a.category == category)
                .mapToLong(a -> a.size)
                .sum();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean checkMemoryUsage() {
        return currentUsage.get() <= config.getMaxMemoryUsage();
    }

    public boolean needsCleanup() {
        return currentUsage.get() >= config.cleanupThresholdBytes();
    }

    public MemoryPressure getMemoryPressure() {
        return pressureFor(getUsagePercentage());
    }

    MemoryPressure pressureFor(double usagePercent) {
        if (usagePercent >= config.getCriticalPressurePercent()) {
            return MemoryPressure.CRITICAL;
        } else if (usagePercent >= config.getHighPressurePercent()) {
            return MemoryPressure.HIGH;
        } else if (usagePercent >= config.getMediumPressurePercent()) {
            return MemoryPressure.MEDIUM;
        }
        return MemoryPressure.LOW;
    }

    /**
     * Evicts unpinned allocations, lowest category rank first and in
     * {@link MemoryConfig#getEvictionStrategy()} order within a rank, until usage drops below
     * the cleanup threshold.
     *
     * @return bytes freed; 0 when usage is already below the threshold or nothing is evictable
     */
    public long forceCleanup() {
        List<AllocationInfo> evicted = new ArrayList<>();
        long freed = 0;

        lock.writeLock().lock();
        try {
            long target = config.cleanupThresholdBytes();
            if (currentUsage.get() >= target) {
                List<Allocation> candidates = allocations.values().stream()
                    .filter(a -> a.pinCount == 0)
                    .sorted(evictionOrder)
                    .collect(Collectors.toList());

                for (Allocation allocation : candidates) {
                    if (currentUsage.get() < target) {
                        break;
                    }
                    allocations.remove(allocation.id);
                    currentUsage.addAndGet(-allocation.size);
                    totalDeallocations.incrementAndGet();
                    freed += allocation.size;
                    evicted.add(allocation.snapshot());
                }
            }

            cleanupOperations.incrementAndGet();
            lastCleanup = Instant.now();
            if (freed > 0) {
                pressureEvents.incrementAndGet();
            }
        } finally {
            lock.writeLock().unlock();
        }

        if (!evicted.isEmpty()) {
            log.info("Memory cleanup evicted {} allocations, freed {} bytes", evicted.size(), freed);
            notifyEvicted(evicted);
        }
        return freed;
    }

    public boolean shouldStreamFile(long fileSize) {
        return fileSize > config.getLargeFileThreshold();
    }

    public StreamingFileReader streamReadFile(Path path) throws IOException, AllocationException {
        long fileSize = Files.size(path);
        int bufferSize = (int) Math.min(config.getStreamBufferSize(), fileSize);

        String allocationId = "stream_buffer_" + UUID.randomUUID();
        allocate(allocationId, bufferSize, AllocationCategory.TEMPORARY_BUFFER, true);

        InputStream input;
        try {
            input = Files.newInputStream(path);
        } catch (IOException e) {
            release(allocationId);
            throw e;
        }
        return new StreamingFileReader(this, allocationId, input, fileSize, config.getStreamBufferSize());
    }

    public ManagedBuffer createManagedBuffer(int capacity, AllocationCategory category) throws AllocationException {
        if (capacity < 0) {
            throw new IllegalArgumentException("Buffer capacity must not be negative: " + capacity);
        }
        String allocationId = "buffer_" + UUID.randomUUID();
        allocate(allocationId, capacity, category, true);
        return new ManagedBuffer(this, allocationId, capacity);
    }

    public Optional<AllocationInfo> getAllocation(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(allocations.get(id)).map(Allocation::snapshot);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<AllocationCategory, List<AllocationInfo>> getAllocationsByCategory() {
        if (!config.isTrackAllocations()) {
            return Map.of();
        }
        lock.readLock().lock();
        try {
            return allocations.values().stream()
                .map(Allocation::snapshot)
                .collect(Collectors.groupingBy(AllocationInfo::getCategory,
                    () -> new EnumMap<>(AllocationCategory.class), Collectors.toList()));
        } finally {
            lock.readLock().unlock();
        }
    }

    public MemoryStats getStats() {
        Map<AllocationCategory, Long> byCategory = new EnumMap<>(AllocationCategory.class);
        long current;
        lock.readLock().lock();
        try {
            for (Allocation allocation : allocations.values()) {
                byCategory.merge(allocation.category, allocation.size, Long::sum);
            }
            current = currentUsage.get();
        } finally {
            lock.readLock().unlock();
        }

        long allocationCount = totalAllocations.get();
        return MemoryStats.builder()
            .currentUsage(current)
            .peakUsage(peakUsage.get())
            .totalAllocations(allocationCount)
            .totalDeallocations(totalDeallocations.get())
            .cleanupOperations(cleanupOperations.get())
            .pressureEvents(pressureEvents.get())
            .averageAllocationSize(allocationCount == 0 ? 0.0 : (double) allocatedBytes.get() / allocationCount)
            .lastCleanup(lastCleanup)
            .usageByCategory(byCategory)
            .build();
    }

    @Override
    public void close() {
        if (cleanupExecutor != null) {
            cleanupExecutor.shutdownNow();
        }
    }

    void cleanupTick() {
        try {
            MemoryPressure pressure = getMemoryPressure();
            if (pressure.isAtLeast(config.getCleanupTriggerPressure())) {
                long freed = forceCleanup();
                log.debug("Scheduled cleanup at {} pressure freed {} bytes", pressure, freed);
            }
        } catch (RuntimeException e) {
            log.warn("Scheduled memory cleanup failed, will retry next interval", e);
        }
    }

    private void scheduleCleanup() {
        if (!cleanupPending.compareAndSet(false, true)) {
            return;
        }
        try {
            cleanupExecutor.execute(() -> {
                try {
                    forceCleanup();
                } catch (RuntimeException e) {
                    log.warn("Threshold-triggered memory cleanup failed", e);
                } finally {
                    cleanupPending.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            cleanupPending.set(false);
            log.debug("Cleanup executor is shut down, skipping threshold cleanup");
        }
    }

    private static Comparator<Allocation> evictionOrder(EvictionStrategy strategy) {
        Comparator<Allocation> byRank = Comparator.comparingInt((Allocation a) -> a.category.getEvictionRank());
        switch (strategy) {
            case LFU:
                return byRank.thenComparingLong(a -> a.accessCount).thenComparingLong(a -> a.accessSequence);
            case FIFO:
            case TTL:
                return byRank.thenComparingLong(a -> a.sequence);
            default:
                return byRank.thenComparingLong(a -> a.accessSequence);
        }
    }

    private void notifyEvicted(List<AllocationInfo> evicted) {
        for (Consumer<AllocationInfo> listener : evictionListeners) {
            for (AllocationInfo info : evicted) {
                try {
                    listener.accept(info);
                } catch (RuntimeException e) {
                    log.warn("Eviction listener failed for {}", info.getId(), e);
                }
            }
        }
    }

    private static final class Allocation {
        final String id;
        final long size;
        final AllocationCategory category;
        final Instant createdAt;
        Instant lastAccessedAt;
        long accessCount;
        final long sequence;
        int pinCount;
        long accessSequence;

        Allocation(String id, long size, AllocationCategory category, int pinCount, long accessSequence) {
            this.id = id;
            this.size = size;
            this.category = category;
            this.createdAt = Instant.now();
            this.lastAccessedAt = createdAt;
            this.pinCount = pinCount;
            this.sequence = accessSequence;
            this.accessSequence = accessSequence;
        }

        AllocationInfo snapshot() {
            return AllocationInfo.builder()
                .id(id)
                .size(size)
                .category(category)
                .createdAt(createdAt)
                .lastAccessedAt(lastAccessedAt)
                .accessCount(accessCount)
                .pinned(pinCount > 0)
                .build();
        }
    }
}
