package com.autonomous.commit.service;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reads a file as a finite sequence of chunks no larger than the configured stream buffer.
 * Every chunk except the last is full. The sequence is bounded by the size the file had when
 * it was opened and cannot be restarted.
 */
public class StreamingFileReader implements AutoCloseable {

    private final MemoryManager memoryManager;
    private final String allocationId;
    private final InputStream input;
    private final long fileSize;
    private final int chunkSize;
    private final AtomicBoolean closed = new AtomicBoolean();
    private long bytesRead;

    StreamingFileReader(MemoryManager memoryManager, String allocationId, InputStream input,
                        long fileSize, int chunkSize) {
        this.memoryManager = memoryManager;
        this.allocationId = allocationId;
        this.input = input;
        this.fileSize = fileSize;
        this.chunkSize = chunkSize;
    }

    /**
     * Blocks until the next chunk is read.
     *
     * @return the chunk, or empty once the whole file has been read
     */
    public synchronized Optional<byte[]> readChunk() throws IOException {
        if (closed.get()) {
            throw new IOException("Reader for " + allocationId + " is closed");
        }
        if (bytesRead >= fileSize) {
            return Optional.empty();
        }

        int toRead = (int) Math.min(chunkSize, fileSize - bytesRead);
        byte[] chunk = input.readNBytes(toRead);
        if (chunk.length == 0) {
            return Optional.empty();
        }
        bytesRead += chunk.length;
        memoryManager.touch(allocationId);
        return Optional.of(chunk);
    }

    /**
     * Percentage of the file read so far; an empty file counts as fully read.
     */
    public synchronized double progress() {
        if (fileSize == 0) {
            return 100.0;
        }
        return bytesRead * 100.0 / fileSize;
    }

    public long getFileSize() {
        return fileSize;
    }

    public synchronized long getBytesRead() {
        return bytesRead;
    }

    public String getAllocationId() {
        return allocationId;
    }

    @Override
    public void close() throws IOException {
        if (closed.compareAndSet(false, true)) {
            try {
                input.close();
            } finally {
                memoryManager.release(allocationId);
            }
        }
    }
}
