package com.autonomous.commit.exception;

public class CacheSerializationException extends RuntimeException {

    private final String key;

    public CacheSerializationException(String key, Throwable cause) {
        super("Failed to (de)serialize cache entry '" + key + "': " + cause.getMessage(), cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
