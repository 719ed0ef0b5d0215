package com.autonomous.commit.service;

import com.autonomous.commit.config.ParallelConfig;
import com.autonomous.commit.model.ResourceUsage;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks memory reserved by running tasks and the number of tasks running.
 * Reads are lock-free; reservations are check-and-add under the monitor's own lock so two
 * admissions cannot both squeeze under the same budget.
 */
public class ResourceMonitor {

    private final ParallelConfig config;
    private final AtomicLong memoryUsage = new AtomicLong();
    private final AtomicLong peakMemoryUsage = new AtomicLong();
    private final AtomicInteger activeTasks = new AtomicInteger();

    public ResourceMonitor(ParallelConfig config) {
        this.config = config;
    }

    public ResourceUsage getCurrentUsage() {
        return new ResourceUsage(memoryUsage.get(), activeTasks.get());
    }

    public long getPeakMemoryUsage() {
        return peakMemoryUsage.get();
    }

    public boolean canStartTask(Long memoryRequirement) {
        if (activeTasks.get() >= config.getMaxConcurrentTasks()) {
            return false;
        }
        return memoryRequirement == null
            || memoryUsage.get() + memoryRequirement <= config.memoryLimitBytes();
    }

    /**
     * Reserves a task slot and its memory if both fit.
     *
     * @return {@code false} when either the slot or the memory budget is exhausted
     */
    public synchronized boolean tryStartTask(Long memoryRequirement) {
        if (!canStartTask(memoryRequirement)) {
            return false;
        }
        startTask(memoryRequirement);
        return true;
    }

    public synchronized void startTask(Long memoryRequirement) {
        if (memoryRequirement != null) {
            long usage = memoryUsage.addAndGet(memoryRequirement);
            peakMemoryUsage.accumulateAndGet(usage, Math::max);
        }
        activeTasks.incrementAndGet();
    }

    public synchronized void finishTask(Long memoryRequirement) {
        if (memoryRequirement != null) {
            memoryUsage.updateAndGet(current -> Math.max(0, current - memoryRequirement));
        }
        activeTasks.updateAndGet(current -> Math.max(0, current - 1));
    }

    void resetPeak() {
        peakMemoryUsage.set(memoryUsage.get());
    }
}
