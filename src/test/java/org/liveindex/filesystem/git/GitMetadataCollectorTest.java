package org.liveindex.filesystem.git;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.liveindex.filesystem.CanonicalPaths;
import org.liveindex.filesystem.IndexFixture;
import org.liveindex.filesystem.dto.GitMetadata;
import org.liveindex.filesystem.dto.GitRemote;
import org.liveindex.filesystem.store.EntryStore;
import org.liveindex.filesystem.store.IndexDatabase;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class GitMetadataCollectorTest {

    @TempDir
    Path root;

    private IndexFixture fixture;

    @AfterEach
    void tearDown() {
        if (fixture != null) {
            fixture.close();
        }
    }

    /**
     * 模拟一个位于 repo 目录的仓库。
     */
    private GitCommandRunner fakeGit(Path repository, AtomicInteger calls) {
        return (dir, args) -> {
            calls.incrementAndGet();
            String command = String.join(" ", args);
            switch (command) {
                case "rev-parse --show-toplevel":
                    return repository.toString() + "\n";
                case "symbolic-ref --quiet --short HEAD":
                    return "main\n";
                case "rev-list --all --count":
                    return "42\n";
                case "branch --format=%(refname:short)":
                    return "main\ndev\n";
                case "remote -v":
                    return "origin\tgit@example.com:team/repo.git (fetch)\norigin\tgit@example.com:team/repo.git (push)\n";
                default:
                    throw new GitCommandException("unexpected: " + command, 1, false, "");
            }
        };
    }

    @Test
    void parseRemotes_groupsByNameAndDirection() {
        List<GitRemote> remotes = GitMetadataCollector.parseRemotes(
                "origin\thttps://a/x.git (fetch)\n"
                        + "origin\thttps://b/x.git (push)\n"
                        + "mirror\thttps://m/x.git (fetch)\n"
                        + "\n");

        assertThat(remotes).containsExactly(
                new GitRemote("origin", "https://a/x.git", "https://b/x.git"),
                new GitRemote("mirror", "https://m/x.git", "https://m/x.git"));
        assertThat(GitMetadataCollector.parseRemotes("")).isEmpty();
    }

    @Test
    void refresh_recordsMetadataOnRepositoryRoot() throws IOException {
        Path repo = Files.createDirectories(root.resolve("repo"));
        Files.createDirectories(repo.resolve(".git"));
        fixture = new IndexFixture(root, fakeGit(repo, new AtomicInteger()), true);
        fixture.scanner().scan();

        GitMetadata metadata = fixture.store().findGitMetadata("/repo");

        assertThat(metadata).isNotNull();
        assertThat(metadata.currentBranch()).isEqualTo("main");
        assertThat(metadata.commitCount()).isEqualTo(42);
        assertThat(metadata.branchCount()).isEqualTo(2);
        assertThat(metadata.remotes()).extracting(GitRemote::name).containsExactly("origin");
        assertThat(fixture.store().findGitMetadata("/")).isNull();
    }

    @Test
    void refresh_reportsChangeOnlyWhenFactsDiffer() throws IOException {
        Path repo = Files.createDirectories(root.resolve("repo"));
        Files.createDirectories(repo.resolve(".git"));
        fixture = new IndexFixture(root, fakeGit(repo, new AtomicInteger()), true);
        fixture.indexer().index(root);
        fixture.indexer().index(repo);

        GitMetadataCollector.GitRefresh first = fixture.git().refresh("/repo").join();
        GitMetadataCollector.GitRefresh second = fixture.git().refresh("/repo").join();

        assertThat(first.changed()).isTrue();
        assertThat(first.metadata()).isNotNull();
        assertThat(second.changed()).isFalse();
    }

    @Test
    void refresh_ignoresSubdirectoryOfRepository() throws IOException {
        Path repo = Files.createDirectories(root.resolve("repo"));
        Path nested = Files.createDirectories(repo.resolve("nested"));
        // 子模块风格：.git 是文件，但 git 报告的仓库根目录是上层
        Files.writeString(nested.resolve(".git"), "gitdir: ../.git/modules/nested\n");
        fixture = new IndexFixture(root, fakeGit(repo, new AtomicInteger()), true);
        fixture.indexer().index(root);
        fixture.indexer().index(repo);
        fixture.indexer().index(nested);

        GitMetadataCollector.GitRefresh result = fixture.git().refresh("/repo/nested").join();

        assertThat(result.metadata()).isNull();
        assertThat(fixture.store().findGitMetadata("/repo/nested")).isNull();
    }

    @Test
    void refresh_skipsDirectoriesWithoutGitFolder() throws IOException {
        Files.createDirectories(root.resolve("plain"));
        AtomicInteger calls = new AtomicInteger();
        fixture = new IndexFixture(root, fakeGit(root.resolve("plain"), calls), true);
        fixture.scanner().scan();

        assertThat(fixture.store().findAllGitMetadata()).isEmpty();
        assertThat(calls.get()).isZero();
    }

    @Test
    void refresh_disablesItselfOnceGitIsUnavailable() throws IOException {
        Path repo = Files.createDirectories(root.resolve("repo"));
        Files.createDirectories(repo.resolve(".git"));
        AtomicInteger calls = new AtomicInteger();
        GitCommandRunner missing = (dir, args) -> {
            calls.incrementAndGet();
            throw new GitUnavailableException("git: command not found", null);
        };
        fixture = new IndexFixture(root, missing, true);
        fixture.indexer().index(root);
        fixture.indexer().index(repo);

        GitMetadataCollector.GitRefresh first = fixture.git().refresh("/repo").join();
        GitMetadataCollector.GitRefresh second = fixture.git().refresh("/repo").join();

        assertThat(first.changed()).isFalse();
        assertThat(second.changed()).isFalse();
        assertThat(fixture.git().isAvailable()).isFalse();
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void refresh_keepsCollectingWhenDirectoryVanishesMidRefresh() throws IOException {
        Path repo = Files.createDirectories(root.resolve("repo"));
        Files.createDirectories(repo.resolve(".git"));
        Path vanishing = Files.createDirectories(root.resolve("vanish"));
        Files.createDirectories(vanishing.resolve(".git"));
        GitCommandRunner healthy = fakeGit(repo, new AtomicInteger());
        ProcessGitCommandRunner real = new ProcessGitCommandRunner("git", Duration.ofSeconds(5), 64 * 1024);
        // vanish 在 stat 之后、调用 git 之前被删除
        GitCommandRunner runner = (dir, args) -> dir.equals(vanishing)
                ? real.run(root.resolve("vanish-deleted"), args)
                : healthy.run(dir, args);
        fixture = new IndexFixture(root, runner, true);
        fixture.indexer().index(root);
        fixture.indexer().index(repo);
        fixture.indexer().index(vanishing);

        GitMetadataCollector.GitRefresh vanished = fixture.git().refresh("/vanish").join();
        GitMetadataCollector.GitRefresh healthyRepo = fixture.git().refresh("/repo").join();

        assertThat(vanished.metadata()).isNull();
        assertThat(fixture.git().isAvailable()).isTrue();
        assertThat(healthyRepo.metadata()).isNotNull();
        assertThat(fixture.store().findGitMetadata("/repo").currentBranch()).isEqualTo("main");
    }

    @Test
    void refresh_coalescesConcurrentRequestsForSameDirectory() throws Exception {
        Path repo = Files.createDirectories(root.resolve("repo"));
        Files.createDirectories(repo.resolve(".git"));
        GitCommandRunner delegate = fakeGit(repo, new AtomicInteger());
        Map<String, AtomicInteger> callsByCommand = new ConcurrentHashMap<>();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        GitCommandRunner blocking = (dir, args) -> {
            String command = String.join(" ", args);
            callsByCommand.computeIfAbsent(command, k -> new AtomicInteger()).incrementAndGet();
            if (command.equals("rev-parse --show-toplevel")) {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return delegate.run(dir, args);
        };
        fixture = new IndexFixture(root, blocking, true);
        fixture.indexer().index(root);
        fixture.indexer().index(repo);

        CompletableFuture<GitMetadataCollector.GitRefresh> first = fixture.git().refresh("/repo");
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        CompletableFuture<GitMetadataCollector.GitRefresh> second = fixture.git().refresh("/repo");

        assertThat(second).isSameAs(first);
        release.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS).metadata()).isNotNull();
        assertThat(callsByCommand).isNotEmpty();
        assertThat(callsByCommand.values()).allSatisfy(count -> assertThat(count.get()).isEqualTo(1));
    }

    @Test
    void refresh_completesWhenStoreFails() throws Exception {
        Path repo = Files.createDirectories(root.resolve("repo"));
        Files.createDirectories(repo.resolve(".git"));
        EmbeddedDatabase database = IndexDatabase.create();
        EntryStore failing = new EntryStore(database, new ObjectMapper()) {
            @Override
            public GitMetadata findGitMetadata(String path) {
                throw new DataAccessResourceFailureException("database closed");
            }
        };
        GitMetadataCollector collector = new GitMetadataCollector(
                new CanonicalPaths(root), failing, fakeGit(repo, new AtomicInteger()), Executors.newSingleThreadExecutor(), true);
        try {
            GitMetadataCollector.GitRefresh first = collector.refresh("/repo").get(5, TimeUnit.SECONDS);
            GitMetadataCollector.GitRefresh second = collector.refresh("/repo").get(5, TimeUnit.SECONDS);

            assertThat(first.changed()).isFalse();
            assertThat(first.metadata()).isNull();
            assertThat(second.changed()).isFalse();
            assertThat(collector.isAvailable()).isTrue();
        } finally {
            collector.close();
            database.shutdown();
        }
    }

    @Test
    void refresh_isNoOpWhenDisabledByConfiguration() {
        fixture = new IndexFixture(root);

        assertThat(fixture.git().isAvailable()).isFalse();
        assertThat(fixture.git().refresh("/").join().changed()).isFalse();
    }
}
