package com.autonomous.commit.service;

import lombok.extern.slf4j.Slf4j;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@code git} in a working tree and returns its standard output.
 */
@Slf4j
public class GitCommandRunner {

    private final File repoPath;
    private final Duration timeout;

    public GitCommandRunner(File repoPath, Duration timeout) {
        this.repoPath = repoPath;
        this.timeout = timeout;
    }

    public File getRepoPath() {
        return repoPath;
    }

    /**
     * @param args arguments after {@code git}
     * @throws IOException if git cannot be started, times out or exits non-zero
     */
    public String run(String... args) throws IOException {
        List<String> command = new ArrayList<>(args.length + 1);
        command.add("git");
        command.addAll(List.of(args));

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(repoPath);
        pb.redirectErrorStream(true);

        Process process = pb.start();
        String output = readProcessOutput(process);
        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new IOException("git " + args[0] + " timed out after " + timeout.toSeconds() + "s");
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for git " + args[0]);
        }

        if (process.exitValue() != 0) {
            throw new IOException("git " + String.join(" ", args) + " exited with "
                + process.exitValue() + ": " + output.trim());
        }
        log.debug("git {} in {}", String.join(" ", args), repoPath);
        return output;
    }

    private String readProcessOutput(Process process) throws IOException {
        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.append(line).append("\n");
            }
        }
        return output.toString();
    }
}
