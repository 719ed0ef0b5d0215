package com.autonomous.commit.service;

import com.autonomous.commit.model.CacheEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FileCacheStoreTest {

    private FileCacheStore store;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        store = new FileCacheStore(tempDir.resolve("cache"));
    }

    private static CacheEntry entry(String key, String json) {
        return CacheEntry.create(key, json.getBytes(StandardCharsets.UTF_8), Duration.ofHours(1), "cache:" + key + "#1");
    }

    @Test
    void shouldWriteOneDocumentPerKey() throws Exception {
        store.write(entry("diff:HEAD", "\"patch\""));

        Optional<CacheEntry> read = store.read("diff:HEAD");

        assertTrue(read.isPresent());
        assertEquals("diff:HEAD", read.get().getKey());
        assertEquals("\"patch\"", new String(read.get().getData(), StandardCharsets.UTF_8));
        assertNotNull(read.get().getExpiresAt());
        assertFalse(read.get().isExpired());
    }

    @Test
    void shouldReturnEmptyForUnknownKey() throws Exception {
        assertTrue(store.read("status:porcelain").isEmpty());
        assertFalse(store.delete("status:porcelain"));
    }

    @Test
    void shouldOverwriteExistingDocument() throws Exception {
        store.write(entry("k", "1"));
        store.write(entry("k", "22"));

        assertEquals(2, store.read("k").get().getSize());
    }

    @Test
    void shouldClearByPrefix() throws Exception {
        store.write(entry("diff:HEAD", "1"));
        store.write(entry("diff:main", "2"));
        store.write(entry("branches:all", "3"));

        assertEquals(2, store.clearPrefix("diff:"));
        assertTrue(store.read("branches:all").isPresent());
        assertEquals(1, store.clear());
    }

    @Test
    void shouldClearMissingDirectory() throws Exception {
        assertEquals(0, store.clear());
    }
}
