package com.autonomous.commit.exception;

/**
 * Raised by the memory manager when an allocation cannot be recorded or released.
 */
public class AllocationException extends Exception {

    public enum Reason {
        OVER_LIMIT,
        NOT_FOUND,
        DUPLICATE_ID
    }

    private final Reason reason;
    private final String allocationId;

    public AllocationException(Reason reason, String allocationId, String message) {
        super(message);
        this.reason = reason;
        this.allocationId = allocationId;
    }

    public static AllocationException overLimit(String id, long current, long size, long max) {
        return new AllocationException(Reason.OVER_LIMIT, id,
            String.format("Memory allocation would exceed limit: %d + %d > %d", current, size, max));
    }

    public static AllocationException notFound(String id) {
        return new AllocationException(Reason.NOT_FOUND, id, "Allocation not found: " + id);
    }

    public static AllocationException duplicate(String id) {
        return new AllocationException(Reason.DUPLICATE_ID, id, "Allocation already exists: " + id);
    }

    public Reason getReason() {
        return reason;
    }

    public String getAllocationId() {
        return allocationId;
    }

    public boolean isOverLimit() {
        return reason == Reason.OVER_LIMIT;
    }
}
