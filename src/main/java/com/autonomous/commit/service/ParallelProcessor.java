package com.autonomous.commit.service;

import com.autonomous.commit.config.ParallelConfig;
import com.autonomous.commit.exception.AllocationException;
import com.autonomous.commit.model.AllocationCategory;
import com.autonomous.commit.model.ParallelStats;
import com.autonomous.commit.model.ScheduledTask;
import com.autonomous.commit.model.TaskError;
import com.autonomous.commit.model.TaskErrorKind;
import com.autonomous.commit.model.TaskMetadata;
import com.autonomous.commit.model.TaskResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs a caller-supplied function over a batch of tasks with bounded concurrency.
 * <p>
 * The calling thread coordinates the batch: it dispatches ready tasks by priority, holds
 * tasks whose memory requirement does not fit, and resolves dependents as results arrive.
 * Each admitted task gets a supervisor that drives its attempts on a fixed pool of
 * {@code maxConcurrentTasks} worker threads, so no more than that many invocations of the
 * function ever run at once, even when a timed-out attempt ignores its interrupt. The timeout
 * covers only the time an attempt spends running, not the time it waits for a worker, and a
 * task's slot stays taken until its last attempt has really returned.
 */
@Slf4j
public class ParallelProcessor implements AutoCloseable {

    public static final String UNGROUPED = "ungrouped";

    private static final long ADMISSION_POLL_MS = 50;

    private final ParallelConfig config;
    private final ResourceMonitor resourceMonitor;
    private final MemoryManager memoryManager;
    private final ExecutorService workers;
    private final ExecutorService supervisors;

    private final AtomicLong batchSequence = new AtomicLong();
    private final AtomicLong totalTasks = new AtomicLong();
    private final AtomicLong completedTasks = new AtomicLong();
    private final AtomicLong failedTasks = new AtomicLong();
    private final AtomicLong retriedTasks = new AtomicLong();
    private final AtomicLong completedNanos = new AtomicLong();
    private volatile long statsStartNanos = System.nanoTime();

    public ParallelProcessor(ParallelConfig config) {
        this(config, null);
    }

    /**
     * @param memoryManager when set, tasks with a memory requirement are also charged against it
     *                      as pinned {@link AllocationCategory#TEMPORARY_BUFFER} allocations
     */
    public ParallelProcessor(ParallelConfig config, MemoryManager memoryManager) {
        config.validate();
        this.config = config;
        this.memoryManager = memoryManager;
        this.resourceMonitor = new ResourceMonitor(config);
        this.workers = Executors.newFixedThreadPool(config.getMaxConcurrentTasks(), threadFactory("task-worker-"));
        this.supervisors = Executors.newCachedThreadPool(threadFactory("task-supervisor-"));
    }

    public ParallelConfig getConfig() {
        return config;
    }

    public ResourceMonitor getResourceMonitor() {
        return resourceMonitor;
    }

    /**
     * Runs every task once its dependencies have succeeded.
     *
     * @return one result per submitted task, in submission order
     */
    public <T, R> List<TaskResult<R>> processWithScheduler(List<ScheduledTask<T>> tasks, TaskFunction<T, R> function) {
        if (tasks.isEmpty()) {
            return List.of();
        }
        TaskGraph<T> graph = new TaskGraph<>(tasks);

        log.info("Starting scheduled processing of {} tasks", graph.size());
        totalTasks.addAndGet(graph.size());

        List<TaskResult<R>> results = new BatchRun<>(graph, function, batchSequence.incrementAndGet()).run();

        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        log.info("Completed scheduled processing of {} tasks ({} failed)", results.size(), failed);
        return results;
    }

    /**
     * Runs tasks in the shared pool and buckets their results by group. Tasks without a group,
     * or every task when grouping is disabled, land in {@link #UNGROUPED}.
     */
    public <T, R> Map<String, List<TaskResult<R>>> processByGroups(List<ScheduledTask<T>> tasks,
                                                                   TaskFunction<T, R> function) {
        List<TaskResult<R>> results = processWithScheduler(tasks, function);

        Map<String, List<TaskResult<R>>> grouped = new LinkedHashMap<>();
        for (int i = 0; i < results.size(); i++) {
            String group = config.isEnableTaskGrouping()
                ? tasks.get(i).getMetadata().getGroupName().orElse(UNGROUPED)
                : UNGROUPED;
            grouped.computeIfAbsent(group, g -> new ArrayList<>()).add(results.get(i));
        }
        return grouped;
    }

    public <R> List<TaskResult<R>> processFilesParallel(List<String> files, TaskFunction<String, R> function) {
        List<ScheduledTask<String>> tasks = new ArrayList<>(files.size());
        for (int i = 0; i < files.size(); i++) {
            tasks.add(ScheduledTask.of(TaskMetadata.of("file_task_" + i), files.get(i)));
        }
        return processWithScheduler(tasks, function);
    }

    public <T, R> List<TaskResult<R>> processBatchesParallel(List<T> items, TaskFunction<List<T>, R> function) {
        if (items.isEmpty()) {
            return List.of();
        }
        int batchSize = config.getBatchSize();
        List<ScheduledTask<List<T>>> tasks = new ArrayList<>();
        for (int start = 0, index = 0; start < items.size(); start += batchSize, index++) {
            List<T> chunk = List.copyOf(items.subList(start, Math.min(start + batchSize, items.size())));
            tasks.add(ScheduledTask.of(TaskMetadata.of("batch_task_" + index), chunk));
        }
        log.info("Created {} batches with batch size {}", tasks.size(), batchSize);
        return processWithScheduler(tasks, function);
    }

    public ParallelStats getStats() {
        long completed = completedTasks.get();
        double elapsedSeconds = (System.nanoTime() - statsStartNanos) / 1_000_000_000.0;
        return ParallelStats.builder()
            .totalTasks(totalTasks.get())
            .completedTasks(completed)
            .failedTasks(failedTasks.get())
            .retriedTasks(retriedTasks.get())
            .averageExecutionTime(completed == 0 ? Duration.ZERO : Duration.ofNanos(completedNanos.get() / completed))
            .peakMemoryUsage(resourceMonitor.getPeakMemoryUsage())
            .currentActiveTasks(resourceMonitor.getCurrentUsage().getActiveTasks())
            .throughputPerSecond(elapsedSeconds > 0 ? completed / elapsedSeconds : 0.0)
            .build();
    }

    public void resetStats() {
        totalTasks.set(0);
        completedTasks.set(0);
        failedTasks.set(0);
        retriedTasks.set(0);
        completedNanos.set(0);
        statsStartNanos = System.nanoTime();
        resourceMonitor.resetPeak();
    }

    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (resourceMonitor.getCurrentUsage().getActiveTasks() > 0) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            Thread.sleep(ADMISSION_POLL_MS);
        }
        return true;
    }

    @Override
    public void close() {
        supervisors.shutdownNow();
        workers.shutdownNow();
    }

    private static ThreadFactory threadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Coordination state of one {@link #processWithScheduler} call. All fields are guarded by
     * {@code lock}; supervisors only touch them through {@link #onFinished}.
     */
    private final class BatchRun<T, R> {

        private final TaskGraph<T> graph;
        private final TaskFunction<T, R> function;
        private final long batchId;
        private final ReentrantLock lock = new ReentrantLock();
        private final Condition changed = lock.newCondition();
        private final List<TaskResult<R>> results;
        private final int[] pendingDependencies;
        private final Future<?>[] supervisorFutures;
        private final PriorityQueue<Integer> ready;
        private int resolved;

        BatchRun(TaskGraph<T> graph, TaskFunction<T, R> function, long batchId) {
            this.graph = graph;
            this.function = function;
            this.batchId = batchId;
            this.results = new ArrayList<>(Collections.nCopies(graph.size(), null));
            this.pendingDependencies = new int[graph.size()];
            this.supervisorFutures = new Future<?>[graph.size()];
            // highest priority first, then submission order
            this.ready = new PriorityQueue<>(Comparator
                .comparing((Integer i) -> graph.task(i).getMetadata().getPriority(), Comparator.reverseOrder())
                .thenComparing(Comparator.naturalOrder()));
        }

        List<TaskResult<R>> run() {
            lock.lock();
            try {
                for (int i = 0; i < graph.size(); i++) {
                    pendingDependencies[i] = graph.dependenciesOf(i).size();
                    if (pendingDependencies[i] == 0) {
                        ready.add(i);
                    }
                }

                while (resolved < graph.size()) {
                    dispatchReady();
                    if (resolved < graph.size()) {
                        changed.await(ADMISSION_POLL_MS, TimeUnit.MILLISECONDS);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                abandon();
            } finally {
                lock.unlock();
            }
            return results;
        }

        private void dispatchReady() {
            List<Integer> held = new ArrayList<>();
            while (!ready.isEmpty()) {
                int index = ready.poll();
                TaskMetadata metadata = graph.task(index).getMetadata();
                Long requirement = metadata.getMemoryRequirement();

                if (requirement != null && requirement > admissionLimit()) {
                    log.warn("Task {} needs {} bytes, more than the memory limit", metadata.getId(), requirement);
                    resolve(index, TaskResult.failure(metadata.getId(),
                        TaskError.rejected(requirement, admissionLimit()), Duration.ZERO, 0, requirement));
                    continue;
                }

                if (!resourceMonitor.tryStartTask(requirement)) {
                    held.add(index);
                    if (resourceMonitor.getCurrentUsage().getActiveTasks() >= config.getMaxConcurrentTasks()) {
                        break;
                    }
                    continue;
                }

                String reservation = reserveMemory(metadata);
                if (requirement != null && memoryManager != null && reservation == null) {
                    resourceMonitor.finishTask(requirement);
                    held.add(index);
                    continue;
                }

                log.debug("Dispatching task {} ({})", metadata.getId(), metadata.getPriority());
                supervisorFutures[index] = supervisors.submit(() -> supervise(index, reservation));
            }
            ready.addAll(held);
        }

        private long admissionLimit() {
            long limit = config.memoryLimitBytes();
            return memoryManager != null ? Math.min(limit, memoryManager.getConfig().getMaxMemoryUsage()) : limit;
        }

        private String reserveMemory(TaskMetadata metadata) {
            if (memoryManager == null || metadata.getMemoryRequirement() == null) {
                return null;
            }
            String allocationId = "task_" + batchId + "_" + metadata.getId();
            try {
                memoryManager.allocate(allocationId, metadata.getMemoryRequirement(),
                    AllocationCategory.TEMPORARY_BUFFER, true);
                return allocationId;
            } catch (AllocationException e) {
                log.debug("Holding task {}: {}", metadata.getId(), e.getMessage());
                return null;
            }
        }

        private void supervise(int index, String reservation) {
            ScheduledTask<T> task = graph.task(index);
            String taskId = task.getId();
            Long requirement = task.getMetadata().getMemoryRequirement();
            long started = System.nanoTime();
            int retries = 0;
            List<Attempt> attempts = new ArrayList<>();
            TaskResult<R> result;

            try {
                while (true) {
                    TaskError error;
                    Attempt attempt = new Attempt(task.getPayload());
                    attempts.add(attempt);
                    Future<R> future = workers.submit(attempt);
                    try {
                        attempt.awaitStart();
                        R value = future.get(config.getTaskTimeoutSeconds(), TimeUnit.SECONDS);
                        result = TaskResult.success(taskId, value, elapsedSince(started), retries, requirement);
                        break;
                    } catch (TimeoutException e) {
                        future.cancel(true);
                        error = TaskError.timeout(config.getTaskTimeoutSeconds());
                    } catch (ExecutionException e) {
                        error = TaskError.failed(e.getCause());
                    } catch (InterruptedException e) {
                        future.cancel(true);
                        throw e;
                    }

                    if (retries >= config.getMaxRetries()) {
                        TaskError finalError = retries == 0 ? error : TaskError.retriesExhausted(retries, error);
                        log.error("Task {} failed after {} retries: {}", taskId, retries, error.getMessage());
                        result = TaskResult.failure(taskId, finalError, elapsedSince(started), retries, requirement);
                        break;
                    }

                    retries++;
                    retriedTasks.incrementAndGet();
                    log.warn("Task {} {} (attempt {}), retrying: {}", taskId,
                        error.getKind() == TaskErrorKind.TIMEOUT ? "timed out" : "failed", retries, error.getMessage());
                    if (config.getRetryDelayMs() > 0) {
                        Thread.sleep(config.getRetryDelayMs());
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                result = TaskResult.failure(taskId, TaskError.failed(e), elapsedSince(started), retries, requirement);
            } catch (RuntimeException e) {
                log.error("Task {} could not be executed", taskId, e);
                result = TaskResult.failure(taskId, TaskError.failed(e), elapsedSince(started), retries, requirement);
            }

            List<Attempt> stragglers = new ArrayList<>();
            for (Attempt attempt : attempts) {
                if (attempt.isRunning()) {
                    stragglers.add(attempt);
                }
            }
            if (stragglers.isEmpty()) {
                releaseSlot(requirement, reservation);
            }
            onFinished(index, result);

            if (!stragglers.isEmpty()) {
                log.warn("Task {} is still running after it was cancelled, holding its slot", taskId);
                try {
                    for (Attempt straggler : stragglers) {
                        straggler.awaitFinish();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Stopped waiting for task {} to return, releasing its slot", taskId);
                } finally {
                    releaseSlot(requirement, reservation);
                    signalChange();
                }
            }
        }

        private void releaseSlot(Long requirement, String reservation) {
            resourceMonitor.finishTask(requirement);
            if (reservation != null) {
                memoryManager.release(reservation);
            }
        }

        private void signalChange() {
            lock.lock();
            try {
                changed.signalAll();
            } finally {
                lock.unlock();
            }
        }

        private void onFinished(int index, TaskResult<R> result) {
            lock.lock();
            try {
                resolve(index, result);
                changed.signalAll();
            } finally {
                lock.unlock();
            }
        }

        // successful tasks release their dependents, failed ones fail them without running
        private void resolve(int index, TaskResult<R> result) {
            Deque<Integer> failedDependents = new ArrayDeque<>();
            record(index, result);
            propagate(index, result.isSuccess(), failedDependents);

            while (!failedDependents.isEmpty()) {
                int dependent = failedDependents.poll();
                if (results.get(dependent) != null) {
                    continue;
                }
                String dependencyId = graph.dependenciesOf(dependent).stream()
                    .filter(d -> results.get(d) != null && !results.get(d).isSuccess())
                    .map(d -> graph.task(d).getId())
                    .findFirst()
                    .orElse("?");
                TaskMetadata metadata = graph.task(dependent).getMetadata();
                log.debug("Skipping task {}: dependency {} failed", metadata.getId(), dependencyId);
                record(dependent, TaskResult.failure(metadata.getId(), TaskError.dependencyFailed(dependencyId),
                    Duration.ZERO, 0, null));
                propagate(dependent, false, failedDependents);
            }
        }

        private void record(int index, TaskResult<R> result) {
            if (results.get(index) != null) {
                return;
            }
            results.set(index, result);
            resolved++;
            if (result.isSuccess()) {
                completedTasks.incrementAndGet();
                completedNanos.addAndGet(result.getExecutionTime().toNanos());
            } else {
                failedTasks.incrementAndGet();
            }
        }

        private void propagate(int index, boolean success, Deque<Integer> failedDependents) {
            for (int dependent : graph.dependentsOf(index)) {
                if (results.get(dependent) != null) {
                    continue;
                }
                if (success) {
                    if (--pendingDependencies[dependent] == 0) {
                        ready.add(dependent);
                    }
                } else {
                    failedDependents.add(dependent);
                }
            }
        }

        private void abandon() {
            log.warn("Batch {} interrupted, abandoning {} unfinished tasks", batchId, graph.size() - resolved);
            for (int i = 0; i < graph.size(); i++) {
                if (supervisorFutures[i] != null) {
                    supervisorFutures[i].cancel(true);
                }
            }
            InterruptedException cause = new InterruptedException("Batch " + batchId + " interrupted");
            for (int i = 0; i < graph.size(); i++) {
                if (results.get(i) == null) {
                    record(i, TaskResult.failure(graph.task(i).getId(), TaskError.failed(cause),
                        Duration.ZERO, 0, null));
                }
            }
            ready.clear();
        }

        private Duration elapsedSince(long startNanos) {
            return Duration.ofNanos(System.nanoTime() - startNanos);
        }

        private final class Attempt implements Callable<R> {

            private final T payload;
            private final CountDownLatch started = new CountDownLatch(1);
            private final CountDownLatch finished = new CountDownLatch(1);

            Attempt(T payload) {
                this.payload = payload;
            }

            @Override
            public R call() throws Exception {
                started.countDown();
                try {
                    return function.apply(payload);
                } finally {
                    finished.countDown();
                }
            }

            void awaitStart() throws InterruptedException {
                started.await();
            }

            void awaitFinish() throws InterruptedException {
                finished.await();
            }

            boolean isRunning() {
                return started.getCount() == 0 && finished.getCount() > 0;
            }
        }
    }
}
