package com.autonomous.commit.service;

import com.autonomous.commit.config.CacheConfig;
import com.autonomous.commit.config.ParallelConfig;
import com.autonomous.commit.exception.AllocationException;
import com.autonomous.commit.exception.CacheSerializationException;
import com.autonomous.commit.model.AllocationCategory;
import com.autonomous.commit.model.AllocationInfo;
import com.autonomous.commit.model.CacheEntry;
import com.autonomous.commit.model.CacheStats;
import com.autonomous.commit.model.MemoryPressure;
import com.autonomous.commit.model.MemoryStats;
import com.autonomous.commit.model.ParallelStats;
import com.autonomous.commit.model.ScheduledTask;
import com.autonomous.commit.model.TaskMetadata;
import com.autonomous.commit.model.TaskResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Key/value cache whose entries are charged against a {@link MemoryManager} as
 * {@link AllocationCategory#CACHE} allocations.
 * <p>
 * The entry table has its own lock. It is never held while calling into the memory manager,
 * so the two locks are never nested: {@code set} serializes and allocates first, then takes
 * the cache lock to insert, and releases replaced or evicted allocations after unlocking.
 * A new allocation stays pinned until its entry is in the table, so memory cleanup can never
 * evict it before the cache knows about it. Allocations the memory manager evicts on its own
 * are reported back through an eviction listener and their entries dropped.
 */
@Slf4j
public class CacheManager implements AutoCloseable {

    private final CacheConfig config;
    private final CacheStrategy strategy;
    private final MemoryManager memoryManager;
    private final ParallelProcessor processor;
    private final boolean ownsMemoryManager;
    private final boolean ownsProcessor;
    private final FileCacheStore fileStore;
    private final ObjectMapper mapper;
    private final ScheduledExecutorService expiryExecutor;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    // access-ordered, so iteration starts at the least recently used entry
    private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>(16, 0.75f, true);
    private final Map<String, String> keysByAllocation = new ConcurrentHashMap<>();
    private final Set<String> pinnedAllocations = ConcurrentHashMap.newKeySet();

    private final AtomicLong allocationSequence = new AtomicLong();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public CacheManager(CacheConfig config) {
        this(config, newMemoryManager(config), null, true, false);
    }

    public CacheManager(CacheConfig config, ParallelConfig parallelConfig) {
        this(config, newMemoryManager(config, parallelConfig), new ParallelProcessor(parallelConfig), true, true);
    }

    /**
     * Builds a cache on shared components. The caller keeps ownership of both and closes them.
     *
     * @param processor may be {@code null} when parallel population is not needed
     */
    public CacheManager(CacheConfig config, MemoryManager memoryManager, ParallelProcessor processor) {
        this(config, memoryManager, processor, false, false);
    }

    private CacheManager(CacheConfig config, MemoryManager memoryManager, ParallelProcessor processor,
                         boolean ownsMemoryManager, boolean ownsProcessor) {
        config.validate();
        this.config = config;
        this.strategy = new CacheStrategy(config);
        this.memoryManager = memoryManager;
        this.processor = processor;
        this.ownsMemoryManager = ownsMemoryManager;
        this.ownsProcessor = ownsProcessor;
        this.fileStore = config.isEnableFsCache() ? new FileCacheStore(Path.of(config.getFsCacheDir())) : null;

        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        this.expiryExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "cache-expiry-" + Integer.toHexString(System.identityHashCode(this)));
            thread.setDaemon(true);
            return thread;
        });
        long interval = config.getCleanupInterval().toMillis();
        expiryExecutor.scheduleWithFixedDelay(this::expiryTick, interval, interval, TimeUnit.MILLISECONDS);

        memoryManager.addEvictionListener(this::onAllocationEvicted);
    }

    private static MemoryManager newMemoryManager(CacheConfig config) {
        config.validate();
        return new MemoryManager(config.toMemoryConfig());
    }

    // validates the processor settings before the memory manager starts its cleanup thread
    private static MemoryManager newMemoryManager(CacheConfig config, ParallelConfig parallelConfig) {
        parallelConfig.validate();
        return newMemoryManager(config);
    }

    public boolean isParallelEnabled() {
        return processor != null;
    }

    public void set(String key, Object value) throws AllocationException {
        byte[] data = serialize(key, value);
        put(key, data, strategy.calculateTtl(key, data.length), false);
    }

    /**
     * A value the strategy refuses to cache is not stored, and the previous one is removed.
     *
     * @param ttl {@code null} keeps the entry until it is removed or evicted
     * @throws AllocationException if the entry does not fit even after one cleanup
     */
    public void set(String key, Object value, Duration ttl) throws AllocationException {
        put(key, serialize(key, value), ttl, false);
    }

    public CacheStrategy getStrategy() {
        return strategy;
    }

    public <V> Optional<V> get(String key, Class<V> type) {
        return get(key, mapper.constructType(type));
    }

    public <V> Optional<V> get(String key, TypeReference<V> type) {
        return get(key, mapper.constructType(type));
    }

    private <V> Optional<V> get(String key, JavaType type) {
        CacheEntry entry;
        CacheEntry expired = null;
        lock.writeLock().lock();
        try {
            entry = entries.get(key);
            if (entry != null && entry.isExpired()) {
                expired = detach(key);
                entry = null;
            }
            if (entry != null) {
                entry.touch();
            }
        } finally {
            lock.writeLock().unlock();
        }

        if (expired != null) {
            log.debug("Entry {} expired", key);
            release(List.of(expired));
            deleteFromFileStore(key);
        }

        if (entry != null) {
            memoryManager.touch(entry.getAllocationId());
            hits.incrementAndGet();
            return Optional.of(deserialize(key, entry.getData(), type));
        }

        Optional<CacheEntry> stored = readFromFileStore(key);
        if (stored.isPresent()) {
            hits.incrementAndGet();
            promote(stored.get());
            return Optional.of(deserialize(key, stored.get().getData(), type));
        }

        misses.incrementAndGet();
        return Optional.empty();
    }

    public boolean remove(String key) {
        CacheEntry removed;
        lock.writeLock().lock();
        try {
            removed = detach(key);
        } finally {
            lock.writeLock().unlock();
        }
        if (removed != null) {
            release(List.of(removed));
        }
        boolean removedFromDisk = deleteFromFileStore(key);
        return removed != null || removedFromDisk;
    }

    public boolean containsKey(String key) {
        // get() reorders an access-ordered map, so even lookups take the write lock
        lock.writeLock().lock();
        try {
            CacheEntry entry = entries.get(key);
            return entry != null && !entry.isExpired();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // least recently used first
    public List<String> keys() {
        lock.readLock().lock();
        try {
            List<String> keys = new ArrayList<>(entries.size());
            for (CacheEntry entry : entries.values()) {
                if (!entry.isExpired()) {
                    keys.add(entry.getKey());
                }
            }
            return keys;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clear() {
        clearPrefix("");
    }

    /**
     * @return number of in-memory entries removed; matching files are deleted too
     */
    public int clearPrefix(String prefix) {
        List<CacheEntry> removed = new ArrayList<>();
        lock.writeLock().lock();
        try {
            Iterator<Map.Entry<String, CacheEntry>> iterator = entries.entrySet().iterator();
            while (iterator.hasNext()) {
                CacheEntry entry = iterator.next().getValue();
                if (entry.getKey().startsWith(prefix)) {
                    iterator.remove();
                    keysByAllocation.remove(entry.getAllocationId());
                    removed.add(entry);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        release(removed);

        if (fileStore != null) {
            try {
                fileStore.clearPrefix(prefix);
            } catch (IOException e) {
                log.warn("Failed to clear file cache prefix '{}': {}", prefix, e.getMessage());
            }
        }
        log.debug("Cleared {} entries with prefix '{}'", removed.size(), prefix);
        return removed.size();
    }

    public long getMemoryUsage() {
        return memoryManager.getUsageByCategory(AllocationCategory.CACHE);
    }

    public double getMemoryUsagePercentage() {
        return getMemoryUsage() * 100.0 / memoryManager.getConfig().getMaxMemoryUsage();
    }

    public MemoryPressure getMemoryPressure() {
        return memoryManager.pressureFor(getMemoryUsagePercentage());
    }

    /**
     * Drops expired entries, then runs the memory manager's eviction. Entries pinned by a
     * running {@link #populateParallel} survive it.
     */
    public long forceMemoryCleanup() {
        long freed = purgeExpired();
        freed += memoryManager.forceCleanup();
        log.debug("Cache memory cleanup freed {} bytes", freed);
        return freed;
    }

    public long purgeExpired() {
        List<CacheEntry> expired = new ArrayList<>();
        lock.writeLock().lock();
        try {
            Iterator<Map.Entry<String, CacheEntry>> iterator = entries.entrySet().iterator();
            while (iterator.hasNext()) {
                CacheEntry entry = iterator.next().getValue();
                if (entry.isExpired()) {
                    iterator.remove();
                    keysByAllocation.remove(entry.getAllocationId());
                    expired.add(entry);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (!expired.isEmpty()) {
            log.debug("Purged {} expired cache entries", expired.size());
        }
        return release(expired);
    }

    /**
     * Each stored entry stays pinned until the whole batch has finished.
     *
     * @return one result per distinct key, in the order given
     */
    public <V> Map<String, TaskResult<V>> populateParallel(List<String> keys, TaskFunction<String, V> loader,
                                                           Duration ttl) {
        if (processor == null) {
            throw new IllegalStateException("Parallel population needs a cache built with a ParallelProcessor");
        }
        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(keys));
        List<ScheduledTask<String>> tasks = new ArrayList<>(distinct.size());
        for (int i = 0; i < distinct.size(); i++) {
            tasks.add(ScheduledTask.of(TaskMetadata.of("populate_" + i), distinct.get(i)));
        }

        Set<String> pinnedHere = ConcurrentHashMap.newKeySet();
        List<TaskResult<V>> results;
        try {
            results = processor.processWithScheduler(tasks, key -> {
                V value = loader.apply(key);
                put(key, serialize(key, value), ttl, true).ifPresent(pinnedHere::add);
                return value;
            });
        } finally {
            for (String allocationId : pinnedHere) {
                pinnedAllocations.remove(allocationId);
                memoryManager.unpin(allocationId);
            }
        }

        Map<String, TaskResult<V>> byKey = new LinkedHashMap<>();
        for (int i = 0; i < distinct.size(); i++) {
            byKey.put(distinct.get(i), results.get(i));
        }
        log.info("Populated {} of {} cache keys in parallel",
            results.stream().filter(TaskResult::isSuccess).count(), distinct.size());
        return byKey;
    }

    public CacheStats stats() {
        int count;
        lock.readLock().lock();
        try {
            count = entries.size();
        } finally {
            lock.readLock().unlock();
        }
        return CacheStats.builder()
            .hits(hits.get())
            .misses(misses.get())
            .evictions(evictions.get())
            .memoryUsage(getMemoryUsage())
            .entryCount(count)
            .build();
    }

    public MemoryStats getMemoryStats() {
        return memoryManager.getStats();
    }

    public Optional<ParallelStats> getParallelStats() {
        return Optional.ofNullable(processor).map(ParallelProcessor::getStats);
    }

    public MemoryManager getMemoryManager() {
        return memoryManager;
    }

    public CacheConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        expiryExecutor.shutdownNow();
        if (ownsProcessor) {
            processor.close();
        }
        if (ownsMemoryManager) {
            memoryManager.close();
        }
    }

    /**
     * @param keepPinned leave the new allocation pinned, for {@link #populateParallel}
     * @return id of the allocation now backing {@code key}, empty if the value was not cached
     */
    private Optional<String> put(String key, byte[] data, Duration ttl, boolean keepPinned)
            throws AllocationException {
        if (!strategy.shouldCache(key, data.length)) {
            log.debug("Not caching {} ({} bytes)", key, data.length);
            remove(key);
            return Optional.empty();
        }

        String allocationId = nextAllocationId(key);
        allocateWithRetry(allocationId, data.length);

        CacheEntry entry = CacheEntry.create(key, data, ttl, allocationId);
        List<CacheEntry> dropped;
        try {
            dropped = insert(entry, keepPinned);
        } finally {
            if (!keepPinned) {
                memoryManager.unpin(allocationId);
            }
        }
        release(dropped);

        if (fileStore != null) {
            try {
                fileStore.write(entry);
            } catch (IOException e) {
                log.warn("Failed to write {} to the file cache: {}", key, e.getMessage());
            }
        }
        return Optional.of(allocationId);
    }

    private String nextAllocationId(String key) {
        return "cache:" + key + "#" + allocationSequence.incrementAndGet();
    }

    /** Allocates pinned; the caller unpins once the entry is in the table. */
    private void allocateWithRetry(String allocationId, long size) throws AllocationException {
        try {
            memoryManager.allocate(allocationId, size, AllocationCategory.CACHE, true);
        } catch (AllocationException e) {
            if (!e.isOverLimit()) {
                throw e;
            }
            log.debug("Cache allocation {} over limit, cleaning up once before retrying", allocationId);
            forceMemoryCleanup();
            makeRoom(size);
            memoryManager.allocate(allocationId, size, AllocationCategory.CACHE, true);
        }
    }

    /**
     * Evicts unpinned entries in eviction-strategy order until {@code size} more bytes fit
     * the memory budget or no candidate is left. Nothing is evicted for an entry larger than
     * the whole budget.
     */
    private void makeRoom(long size) {
        long max = memoryManager.getConfig().getMaxMemoryUsage();
        if (size > max) {
            return;
        }
        List<CacheEntry> victims = new ArrayList<>();
        long reclaimed = 0;
        lock.writeLock().lock();
        try {
            for (CacheEntry entry : strategy.evictionOrder(entries.values())) {
                if (memoryManager.getCurrentUsage() - reclaimed + size <= max) {
                    break;
                }
                if (pinnedAllocations.contains(entry.getAllocationId())) {
                    continue;
                }
                detach(entry.getKey());
                victims.add(entry);
                reclaimed += entry.getSize();
            }
        } finally {
            lock.writeLock().unlock();
        }
        evictions.addAndGet(victims.size());
        release(victims);
    }

    // returns replaced and count-evicted entries, to be released after the lock is gone
    private List<CacheEntry> insert(CacheEntry entry, boolean keepPinned) {
        List<CacheEntry> dropped = new ArrayList<>();
        lock.writeLock().lock();
        try {
            entry.setSequence(allocationSequence.incrementAndGet());
            CacheEntry previous = entries.put(entry.getKey(), entry);
            keysByAllocation.put(entry.getAllocationId(), entry.getKey());
            if (keepPinned) {
                pinnedAllocations.add(entry.getAllocationId());
            }
            if (previous != null) {
                keysByAllocation.remove(previous.getAllocationId());
                dropped.add(previous);
            }

            if (entries.size() > config.getMemoryCacheSize()) {
                for (CacheEntry candidate : strategy.evictionOrder(entries.values())) {
                    if (entries.size() <= config.getMemoryCacheSize()) {
                        break;
                    }
                    if (candidate == entry || pinnedAllocations.contains(candidate.getAllocationId())) {
                        continue;
                    }
                    detach(candidate.getKey());
                    dropped.add(candidate);
                    evictions.incrementAndGet();
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        return dropped;
    }

    private void promote(CacheEntry stored) {
        if (stored.isExpired()) {
            return;
        }
        String allocationId = nextAllocationId(stored.getKey());
        try {
            memoryManager.allocate(allocationId, stored.getData().length, AllocationCategory.CACHE, true);
        } catch (AllocationException e) {
            log.debug("Not promoting {} from the file cache: {}", stored.getKey(), e.getMessage());
            return;
        }
        Duration remaining = stored.getExpiresAt() == null ? null : Duration.between(Instant.now(), stored.getExpiresAt());
        List<CacheEntry> dropped;
        try {
            dropped = insert(CacheEntry.create(stored.getKey(), stored.getData(), remaining, allocationId), false);
        } finally {
            memoryManager.unpin(allocationId);
        }
        release(dropped);
    }

    /** Removes a key from the table; caller holds the write lock. */
    private CacheEntry detach(String key) {
        CacheEntry entry = entries.remove(key);
        if (entry != null) {
            keysByAllocation.remove(entry.getAllocationId());
        }
        return entry;
    }

    private long release(List<CacheEntry> dropped) {
        long freed = 0;
        for (CacheEntry entry : dropped) {
            try {
                freed += memoryManager.deallocate(entry.getAllocationId());
            } catch (AllocationException e) {
                log.debug("Allocation {} was already released", entry.getAllocationId());
            }
        }
        return freed;
    }

    private void onAllocationEvicted(AllocationInfo info) {
        String key = keysByAllocation.get(info.getId());
        if (key == null) {
            return;
        }
        lock.writeLock().lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry != null && info.getId().equals(entry.getAllocationId())) {
                detach(key);
                evictions.incrementAndGet();
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Dropped cache entry {} after its allocation was evicted", key);
    }

    private void expiryTick() {
        try {
            purgeExpired();
        } catch (RuntimeException e) {
            log.warn("Scheduled cache expiry failed, will retry next interval", e);
        }
    }

    private byte[] serialize(String key, Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new CacheSerializationException(key, e);
        }
    }

    private <V> V deserialize(String key, byte[] data, JavaType type) {
        try {
            return mapper.readValue(data, type);
        } catch (IOException e) {
            throw new CacheSerializationException(key, e);
        }
    }

    private Optional<CacheEntry> readFromFileStore(String key) {
        if (fileStore == null) {
            return Optional.empty();
        }
        try {
            Optional<CacheEntry> stored = fileStore.read(key);
            if (stored.isPresent() && stored.get().isExpired()) {
                fileStore.delete(key);
                return Optional.empty();
            }
            return stored;
        } catch (IOException e) {
            log.warn("Failed to read {} from the file cache: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private boolean deleteFromFileStore(String key) {
        if (fileStore == null) {
            return false;
        }
        try {
            return fileStore.delete(key);
        } catch (IOException e) {
            log.warn("Failed to delete {} from the file cache: {}", key, e.getMessage());
            return false;
        }
    }
}
