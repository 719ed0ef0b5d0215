package com.autonomous.commit.service;

import com.autonomous.commit.config.CacheConfig;
import com.autonomous.commit.config.MemoryConfig;
import com.autonomous.commit.config.ParallelConfig;
import com.autonomous.commit.model.CommitSummary;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CachedGitServiceTest {

    @Mock
    private GitCommandRunner git;

    private MemoryManager memoryManager;
    private ParallelProcessor processor;
    private CacheManager cache;
    private CachedGitService gitService;

    @BeforeEach
    void setUp() {
        memoryManager = new MemoryManager(MemoryConfig.builder().backgroundCleanup(false).build());
        processor = new ParallelProcessor(ParallelConfig.builder().maxConcurrentTasks(2).maxRetries(0).build());
        cache = new CacheManager(CacheConfig.defaults(), memoryManager, processor);
        gitService = new CachedGitService(git, cache);
    }

    @AfterEach
    void tearDown() {
        cache.close();
        processor.close();
        memoryManager.close();
    }

    @Test
    void shouldCacheStatusUntilFileIsStaged() throws Exception {
        when(git.run("status", "--porcelain")).thenReturn(" M src/App.java\n", "M  src/App.java\n");

        assertEquals(" M src/App.java\n", gitService.getStatus());
        assertEquals(" M src/App.java\n", gitService.getStatus());
        verify(git, times(1)).run("status", "--porcelain");

        gitService.stageFile("src/App.java");

        assertEquals("M  src/App.java\n", gitService.getStatus());
        verify(git).run("add", "--", "src/App.java");
        verify(git, times(2)).run("status", "--porcelain");
    }

    @Test
    void shouldParseAndCacheRecentCommits() throws Exception {
        when(git.run("log", "-n", "50", "--pretty=format:%H%x1f%an%x1f%s"))
            .thenReturn("a1\u001fAda\u001fAdd cache\nb2\u001fLin\u001fFix: split on | chars\n");

        List<CommitSummary> commits = gitService.getRecentCommits(50);
        List<CommitSummary> again = gitService.getRecentCommits(50);

        assertEquals(2, commits.size());
        assertEquals(new CommitSummary("b2", "Lin", "Fix: split on | chars"), commits.get(1));
        assertEquals(commits, again);
        assertTrue(cache.containsKey("commits:50"));
        verify(git, times(1)).run("log", "-n", "50", "--pretty=format:%H%x1f%an%x1f%s");
    }

    @Test
    void shouldClearEverythingOnBranchSwitch() throws Exception {
        when(git.run("rev-parse", "--abbrev-ref", "HEAD")).thenReturn("main\n", "feature\n");
        when(git.run("diff", "HEAD")).thenReturn("diff --git a/x b/x\n");

        assertEquals("main", gitService.getCurrentBranch());
        gitService.getDiff("HEAD");
        assertEquals(List.of("current_branch:", "diff:HEAD"), cache.keys());

        gitService.switchBranch("feature");

        assertTrue(cache.keys().isEmpty());
        assertEquals("feature", gitService.getCurrentBranch());
        verify(git).run("checkout", "feature");
    }

    @Test
    void shouldInvalidateOnlyBranchesOnBranchChanges() throws Exception {
        when(git.run("branch", "--all", "--format=%(refname:short)")).thenReturn("main\n", "main\ntopic\n");
        when(git.run("status", "--porcelain")).thenReturn("");

        assertEquals(List.of("main"), gitService.getBranches());
        gitService.getStatus();

        gitService.createBranch("topic");

        assertTrue(cache.containsKey("status:porcelain"));
        assertFalse(cache.containsKey("branches:all"));
        assertEquals(List.of("main", "topic"), gitService.getBranches());
    }

    @Test
    void shouldInvalidateWorkingTreeOnStageAllAndUnstage() throws Exception {
        cache.set("status:porcelain", "");
        cache.set("diff:HEAD", "old");
        cache.set("diff:stat:main", "1 files (+1 / -0)");
        cache.set("branches:all", List.of("main"));

        gitService.stageAll();
        assertEquals(List.of("branches:all"), cache.keys());

        cache.set("status:porcelain", "");
        gitService.unstageFile("README.md");

        assertFalse(cache.containsKey("status:porcelain"));
        verify(git).run("add", "-A");
        verify(git).run("restore", "--staged", "--", "README.md");
    }

    @Test
    void shouldNotCacheFailedCommands() throws Exception {
        when(git.run("diff", "nope")).thenThrow(new IOException("git diff nope exited with 128"));

        assertThrows(IOException.class, () -> gitService.getDiff("nope"));
        assertFalse(cache.containsKey("diff:nope"));
    }

    @Test
    void shouldWarmDiffsInParallel() throws Exception {
        when(git.run("diff", "HEAD~1")).thenReturn("diff one\n");
        when(git.run("diff", "HEAD~2")).thenReturn("diff two\n");
        when(git.run("diff", "gone")).thenThrow(new IOException("unknown revision"));

        int warmed = gitService.warmCache(List.of("HEAD~1", "HEAD~2", "gone"));

        assertEquals(2, warmed);
        assertEquals("diff two\n", gitService.getDiff("HEAD~2"));
        verify(git, times(1)).run("diff", "HEAD~2");
    }

    @Test
    void shouldSummarizeDiffStats() throws Exception {
        when(git.run("diff", "--stat", "main..HEAD"))
            .thenReturn(" src/A.java | 3 ++-\n 4 files changed, 234 insertions(+), 12 deletions(-)\n");

        assertEquals("4 files (+234 / -12)", gitService.getDiffStats("main"));
        assertEquals("no changes", gitService.parseDiffStats(""));
    }

    @Test
    void shouldRefreshCommitsAfterCommit() throws Exception {
        cache.set("commits:10", List.of());

        gitService.commit("Add engine");

        assertFalse(cache.containsKey("commits:10"));
        verify(git).run("commit", "-m", "Add engine");
    }
}
