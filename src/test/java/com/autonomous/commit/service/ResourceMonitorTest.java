package com.autonomous.commit.service;

import com.autonomous.commit.config.ParallelConfig;
import com.autonomous.commit.model.ResourceUsage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResourceMonitorTest {

    private static final long ONE_MB = 1024 * 1024;

    private ResourceMonitor monitor;

    @BeforeEach
    void setUp() {
        monitor = new ResourceMonitor(ParallelConfig.builder()
            .maxConcurrentTasks(2)
            .memoryLimitMb(10)
            .build());
    }

    @Test
    void shouldStartEmpty() {
        ResourceUsage usage = monitor.getCurrentUsage();

        assertEquals(0, usage.getMemoryBytes());
        assertEquals(0, usage.getActiveTasks());
    }

    @Test
    void shouldLimitConcurrentTasks() {
        assertTrue(monitor.tryStartTask(null));
        assertTrue(monitor.tryStartTask(null));
        assertFalse(monitor.tryStartTask(null));
        assertFalse(monitor.canStartTask(null));

        monitor.finishTask(null);

        assertTrue(monitor.canStartTask(null));
    }

    @Test
    void shouldLimitReservedMemory() {
        assertTrue(monitor.tryStartTask(6 * ONE_MB));
        assertFalse(monitor.tryStartTask(5 * ONE_MB));
        assertTrue(monitor.tryStartTask(4 * ONE_MB));

        assertEquals(10 * ONE_MB, monitor.getCurrentUsage().getMemoryBytes());
        assertEquals(10 * ONE_MB, monitor.getPeakMemoryUsage());

        monitor.finishTask(6 * ONE_MB);

        assertEquals(4 * ONE_MB, monitor.getCurrentUsage().getMemoryBytes());
        assertEquals(10 * ONE_MB, monitor.getPeakMemoryUsage());
    }

    @Test
    void shouldNotGoNegativeOnExtraFinish() {
        monitor.finishTask(ONE_MB);

        assertEquals(0, monitor.getCurrentUsage().getMemoryBytes());
        assertEquals(0, monitor.getCurrentUsage().getActiveTasks());
    }
}
