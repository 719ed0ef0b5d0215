package com.autonomous.commit.service;

import com.autonomous.commit.exception.AllocationException;
import com.autonomous.commit.model.CommitSummary;
import com.autonomous.commit.model.TaskResult;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Git reads served from a {@link CacheManager}, keyed {@code "<operation>:<params>"}.
 * Every mutating call drops the keys whose output it can change.
 */
@Slf4j
public class CachedGitService {

    static final String COMMITS = "commits:";
    static final String BRANCHES = "branches:";
    static final String STATUS = "status:";
    static final String DIFF = "diff:";
    static final String CURRENT_BRANCH = "current_branch:";

    private static final String FIELD_SEPARATOR = "\u001f";

    private static final Pattern DIFF_STATS_PATTERN =
        Pattern.compile("(\\d+) files? changed(?:, (\\d+) insertions?\\(\\+\\))?(?:, (\\d+) deletions?\\(-\\))?");

    private final GitCommandRunner git;
    private final CacheManager cache;

    public CachedGitService(GitCommandRunner git, CacheManager cache) {
        this.git = git;
        this.cache = cache;
    }

    public List<CommitSummary> getRecentCommits(int limit) throws IOException {
        return cached(COMMITS + limit, new TypeReference<List<CommitSummary>>() { },
            () -> parseLog(git.run("log", "-n", String.valueOf(limit), "--pretty=format:%H%x1f%an%x1f%s")));
    }

    public List<String> getBranches() throws IOException {
        return cached(BRANCHES + "all", new TypeReference<List<String>>() { },
            () -> lines(git.run("branch", "--all", "--format=%(refname:short)")));
    }

    public String getStatus() throws IOException {
        return cached(STATUS + "porcelain", new TypeReference<String>() { },
            () -> git.run("status", "--porcelain"));
    }

    public String getDiff(String ref) throws IOException {
        return cached(DIFF + ref, new TypeReference<String>() { }, () -> git.run("diff", ref));
    }

    /**
     * One-line summary of {@code git diff --stat base..HEAD}, e.g. {@code "4 files (+234 / -12)"}.
     */
    public String getDiffStats(String baseBranch) throws IOException {
        return cached(DIFF + "stat:" + baseBranch, new TypeReference<String>() { },
            () -> parseDiffStats(git.run("diff", "--stat", baseBranch + "..HEAD")));
    }

    public String getCurrentBranch() throws IOException {
        return cached(CURRENT_BRANCH, new TypeReference<String>() { },
            () -> git.run("rev-parse", "--abbrev-ref", "HEAD").trim());
    }

    public void switchBranch(String branch) throws IOException {
        git.run("checkout", branch);
        cache.clear();
    }

    public void stageFile(String path) throws IOException {
        git.run("add", "--", path);
        invalidateWorkingTree();
    }

    public void unstageFile(String path) throws IOException {
        git.run("restore", "--staged", "--", path);
        invalidateWorkingTree();
    }

    public void stageAll() throws IOException {
        git.run("add", "-A");
        invalidateWorkingTree();
    }

    public void createBranch(String branch) throws IOException {
        git.run("branch", branch);
        cache.clearPrefix(BRANCHES);
    }

    public void deleteBranch(String branch) throws IOException {
        git.run("branch", "-d", branch);
        cache.clearPrefix(BRANCHES);
    }

    public void commit(String message) throws IOException {
        git.run("commit", "-m", message);
        invalidateWorkingTree();
        cache.clearPrefix(COMMITS);
    }

    /**
     * Loads the diff of every ref into the cache in parallel.
     *
     * @return number of refs whose diff was cached
     */
    public int warmCache(List<String> refs) {
        List<String> keys = refs.stream().map(ref -> DIFF + ref).collect(Collectors.toList());
        Map<String, TaskResult<String>> results = cache.populateParallel(keys,
            key -> git.run("diff", key.substring(DIFF.length())), cache.getConfig().getDefaultTtl());

        int warmed = 0;
        for (Map.Entry<String, TaskResult<String>> result : results.entrySet()) {
            if (result.getValue().isSuccess()) {
                warmed++;
            } else {
                log.warn("Could not warm {}: {}", result.getKey(), result.getValue().getError().getMessage());
            }
        }
        return warmed;
    }

    public String parseDiffStats(String diffOutput) {
        Matcher matcher = DIFF_STATS_PATTERN.matcher(diffOutput);
        if (matcher.find()) {
            int files = Integer.parseInt(matcher.group(1));
            int insertions = matcher.group(2) != null ? Integer.parseInt(matcher.group(2)) : 0;
            int deletions = matcher.group(3) != null ? Integer.parseInt(matcher.group(3)) : 0;
            return String.format("%d files (+%d / -%d)", files, insertions, deletions);
        }
        return "no changes";
    }

    List<CommitSummary> parseLog(String output) {
        List<CommitSummary> commits = new ArrayList<>();
        for (String line : lines(output)) {
            String[] fields = line.split(FIELD_SEPARATOR, 3);
            if (fields.length < 3) {
                continue;
            }
            commits.add(new CommitSummary(fields[0], fields[1], fields[2]));
        }
        return commits;
    }

    private void invalidateWorkingTree() {
        cache.clearPrefix(STATUS);
        cache.clearPrefix(DIFF);
    }

    private <V> V cached(String key, TypeReference<V> type, GitCall<V> call) throws IOException {
        Optional<V> hit = cache.get(key, type);
        if (hit.isPresent()) {
            return hit.get();
        }
        V value = call.load();
        try {
            cache.set(key, value);
        } catch (AllocationException e) {
            log.warn("Not caching {}: {}", key, e.getMessage());
        }
        return value;
    }

    private static List<String> lines(String output) {
        return Arrays.stream(output.split("\n"))
            .map(String::trim)
            .filter(line -> !line.isEmpty())
            .collect(Collectors.toList());
    }

    @FunctionalInterface
    private interface GitCall<V> {
        V load() throws IOException;
    }
}
