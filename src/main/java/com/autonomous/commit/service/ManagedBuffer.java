package com.autonomous.commit.service;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fixed-capacity byte buffer backed by a pinned allocation. Closing it releases the
 * allocation exactly once; use it with try-with-resources.
 */
public class ManagedBuffer implements AutoCloseable {

    private final MemoryManager memoryManager;
    private final String allocationId;
    private final ByteBuffer data;
    private final AtomicBoolean released = new AtomicBoolean();

    ManagedBuffer(MemoryManager memoryManager, String allocationId, int capacity) {
        this.memoryManager = memoryManager;
        this.allocationId = allocationId;
        this.data = ByteBuffer.allocate(capacity);
    }

    /**
     * Appends bytes after the current content.
     *
     * @throws java.nio.BufferOverflowException if the bytes do not fit in the remaining capacity
     */
    public synchronized ManagedBuffer write(byte[] bytes) {
        ensureOpen();
        data.put(bytes);
        return this;
    }

    public synchronized byte[] data() {
        return Arrays.copyOf(data.array(), data.position());
    }

    public synchronized int length() {
        return data.position();
    }

    public int capacity() {
        return data.capacity();
    }

    public synchronized boolean isEmpty() {
        return data.position() == 0;
    }

    public void touch() {
        ensureOpen();
        memoryManager.touch(allocationId);
    }

    public String getAllocationId() {
        return allocationId;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            memoryManager.release(allocationId);
        }
    }

    private void ensureOpen() {
        if (released.get()) {
            throw new IllegalStateException("Buffer " + allocationId + " has been released");
        }
    }
}
