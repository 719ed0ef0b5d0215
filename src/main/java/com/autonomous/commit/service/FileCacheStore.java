package com.autonomous.commit.service;

import com.autonomous.commit.model.CacheEntry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Second cache tier: one JSON document per key under a directory. File names are the
 * URL-encoded key plus {@code .json}.
 */
@Slf4j
public class FileCacheStore {

    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper mapper;

    public FileCacheStore(Path directory) {
        this.directory = directory;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public Path getDirectory() {
        return directory;
    }

    public void write(CacheEntry entry) throws IOException {
        Files.createDirectories(directory);
        Path target = pathFor(entry.getKey());
        Path temp = Files.createTempFile(directory, "entry", ".tmp");
        try {
            mapper.writeValue(temp.toFile(), entry);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    public Optional<CacheEntry> read(String key) throws IOException {
        Path file = pathFor(key);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(mapper.readValue(file.toFile(), CacheEntry.class));
    }

    public boolean delete(String key) throws IOException {
        return Files.deleteIfExists(pathFor(key));
    }

    /**
     * @return number of documents removed whose key starts with {@code prefix}
     */
    public int clearPrefix(String prefix) throws IOException {
        if (!Files.isDirectory(directory)) {
            return 0;
        }
        List<Path> matching;
        try (Stream<Path> files = Files.list(directory)) {
            matching = files
                .filter(f -> f.getFileName().toString().endsWith(SUFFIX))
                .filter(f -> keyOf(f).startsWith(prefix))
                .collect(Collectors.toList());
        }
        int removed = 0;
        for (Path file : matching) {
            if (Files.deleteIfExists(file)) {
                removed++;
            }
        }
        log.debug("Removed {} file cache entries with prefix '{}'", removed, prefix);
        return removed;
    }

    public int clear() throws IOException {
        return clearPrefix("");
    }

    private Path pathFor(String key) {
        return directory.resolve(URLEncoder.encode(key, StandardCharsets.UTF_8) + SUFFIX);
    }

    private static String keyOf(Path file) {
        String name = file.getFileName().toString();
        return URLDecoder.decode(name.substring(0, name.length() - SUFFIX.length()), StandardCharsets.UTF_8);
    }
}
