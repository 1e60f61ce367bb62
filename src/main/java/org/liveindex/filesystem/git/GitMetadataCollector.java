package org.liveindex.filesystem.git;

import org.liveindex.filesystem.CanonicalPaths;
import org.liveindex.filesystem.IgnoredPaths;
import org.liveindex.filesystem.dto.GitMetadata;
import org.liveindex.filesystem.dto.GitRemote;
import org.liveindex.filesystem.store.EntryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Git 元数据采集器：对“仓库根目录”调用 git，解析输出并写入索引库。
 * <p>
 * 规则：
 * <ul>
 *   <li>只有当 {@code git rev-parse --show-toplevel} 报告的根目录正好等于候选目录时才记录；仓库子目录上的旧记录会被清除。</li>
 *   <li>分支、提交数、分支数、远程列表分别采集，单项失败不影响其他项。</li>
 *   <li>同一目录的并发刷新合并为一次执行；不同目录之间互不阻塞。</li>
 *   <li>git 不可用时本功能在进程生命周期内停用，之后的调用直接返回“无元数据”，只记录一次日志。</li>
 * </ul>
 */
public class GitMetadataCollector implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GitMetadataCollector.class);

    private final CanonicalPaths paths;
    private final EntryStore store;
    private final GitCommandRunner runner;
    private final ExecutorService executor;
    private final ConcurrentHashMap<String, CompletableFuture<GitRefresh>> inFlight = new ConcurrentHashMap<>();
    private final AtomicBoolean disabled = new AtomicBoolean(false);
    private final AtomicBoolean unavailableLogged = new AtomicBoolean(false);

    public GitMetadataCollector(CanonicalPaths paths, EntryStore store, GitCommandRunner runner, ExecutorService executor, boolean enabled) {
        this.paths = paths;
        this.store = store;
        this.runner = runner;
        this.executor = executor;
        if (!enabled) {
            disabled.set(true);
            log.info("Git 元数据采集已通过配置关闭（app.index.git-enabled=false）");
        }
    }

    public boolean isAvailable() {
        return !disabled.get();
    }

    /**
     * 一次刷新的结果。
     *
     * @param path     目录规范路径
     * @param metadata 刷新后的元数据（不是仓库根目录或采集失败时为 null）
     * @param changed  与刷新前相比是否有变化（新增、删除或内容变化）
     */
    public record GitRefresh(String path, GitMetadata metadata, boolean changed) {
        static GitRefresh unchanged(String path) {
            return new GitRefresh(path, null, false);
        }
    }

    /**
     * 异步刷新某个目录的 Git 元数据；同一目录已有进行中的刷新时直接返回那一次的 future。
     */
    public CompletableFuture<GitRefresh> refresh(String canonicalDir) {
        if (canonicalDir == null || disabled.get()) {
            return CompletableFuture.completedFuture(GitRefresh.unchanged(canonicalDir));
        }
        CompletableFuture<GitRefresh> created = new CompletableFuture<>();
        CompletableFuture<GitRefresh> existing = inFlight.putIfAbsent(canonicalDir, created);
        if (existing != null) {
            return existing;
        }
        try {
            executor.execute(() -> {
                GitRefresh result = GitRefresh.unchanged(canonicalDir);
                try {
                    result = refreshSafely(canonicalDir);
                } finally {
                    inFlight.remove(canonicalDir, created);
                    created.complete(result);
                }
            });
        } catch (RejectedExecutionException e) {
            // 正在关闭
            inFlight.remove(canonicalDir, created);
            created.complete(GitRefresh.unchanged(canonicalDir));
        }
        return created;
    }

    /**
     * 路径位于某个 {@code .git} 目录内部时，刷新其所属仓库根目录；否则什么也不做。
     */
    public CompletableFuture<GitRefresh> refreshOwningRepository(String canonicalPath) {
        String repository = CanonicalPaths.repositoryRootOfGitInternal(canonicalPath);
        if (repository == null) {
            return CompletableFuture.completedFuture(GitRefresh.unchanged(canonicalPath));
        }
        return refresh(repository);
    }

    private GitRefresh refreshSafely(String canonicalDir) {
        try {
            GitMetadata before = store.findGitMetadata(canonicalDir);
            GitMetadata after = collect(canonicalDir);
            GitMetadata current = after != null ? after : store.findGitMetadata(canonicalDir);
            boolean changed = (before == null) != (current == null) || (before != null && !before.sameFactsAs(current));
            return new GitRefresh(canonicalDir, current, changed);
        } catch (GitUnavailableException e) {
            disable(e);
            return GitRefresh.unchanged(canonicalDir);
        } catch (RuntimeException e) {
            log.warn("更新 Git 元数据失败：{}（{}）", canonicalDir, e.getMessage());
            return GitRefresh.unchanged(canonicalDir);
        }
    }

    private void disable(GitUnavailableException e) {
        disabled.set(true);
        if (unavailableLogged.compareAndSet(false, true)) {
            log.warn("git 不在 PATH 中或无法执行，跳过仓库元数据采集：{}", e.getMessage());
        }
    }

    /**
     * 同步采集并写入（或清除）某个目录的元数据。
     *
     * @return 已写入的元数据；目录不是仓库根目录或采集失败时返回 null
     */
    GitMetadata collect(String canonicalDir) throws GitUnavailableException {
        if (CanonicalPaths.isGitDirectory(canonicalDir)) {
            return null;
        }
        Path absolute = paths.toAbsolute(canonicalDir);

        BasicFileAttributes dirAttrs;
        try {
            dirAttrs = Files.readAttributes(absolute, BasicFileAttributes.class);
        } catch (NoSuchFileException e) {
            store.deleteGitMetadata(canonicalDir);
            return null;
        } catch (IOException e) {
            log.debug("无法读取目录属性，跳过 Git 元数据：{}（{}）", canonicalDir, e.getMessage());
            return null;
        }
        if (!dirAttrs.isDirectory()) {
            store.deleteGitMetadata(canonicalDir);
            return null;
        }

        try {
            Files.readAttributes(absolute.resolve(".git"), BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        } catch (NoSuchFileException | NotDirectoryException e) {
            store.deleteGitMetadata(canonicalDir);
            return null;
        } catch (IOException e) {
            if (!IgnoredPaths.isUnsupported(e)) {
                log.warn("检查 .git 失败：{}（{}）", canonicalDir, e.getMessage());
            }
            return null;
        }

        String topLevel;
        try {
            topLevel = runner.run(absolute, "rev-parse", "--show-toplevel").trim();
        } catch (GitCommandException e) {
            if (e.isNotRepository()) {
                store.deleteGitMetadata(canonicalDir);
                return null;
            }
            log.warn("解析 git 仓库根目录失败：{}（{}）", absolute, e.getMessage());
            return null;
        }

        String repositoryRoot = canonicalOfRepositoryRoot(topLevel);
        if (repositoryRoot == null || !repositoryRoot.equals(canonicalDir)) {
            // 只在索引范围内真正的仓库根目录上记录
            store.deleteGitMetadata(canonicalDir);
            return null;
        }

        String currentBranch = currentBranch(absolute);
        Integer commitCount = commitCount(absolute);
        Integer branchCount = branchCount(absolute);
        List<GitRemote> remotes = remotes(absolute);

        GitMetadata metadata = new GitMetadata(
                canonicalDir,
                System.currentTimeMillis(),
                currentBranch,
                commitCount,
                branchCount,
                remotes
        );
        store.upsertGitMetadata(metadata);
        return metadata;
    }

    private String canonicalOfRepositoryRoot(String topLevel) {
        if (topLevel == null || topLevel.isEmpty()) {
            return null;
        }
        Path reported = Path.of(topLevel);
        String canonical = paths.toCanonical(reported);
        if (canonical != null) {
            return canonical;
        }
        // git 报告的是真实路径；根目录本身可能经过符号链接
        try {
            Path rootReal = paths.root().toRealPath();
            Path reportedReal = reported.toRealPath();
            if (reportedReal.startsWith(rootReal)) {
                return new CanonicalPaths(rootReal).toCanonical(reportedReal);
            }
        } catch (IOException e) {
            log.debug("无法解析仓库根目录真实路径：{}（{}）", topLevel, e.getMessage());
        }
        return null;
    }

    private String currentBranch(Path dir) throws GitUnavailableException {
        try {
            String branch = runner.run(dir, "symbolic-ref", "--quiet", "--short", "HEAD").trim();
            return branch.isEmpty() ? null : branch;
        } catch (GitCommandException e) {
            if (e.isNotRepository()) {
                return null;
            }
        }
        // HEAD 游离：退回短 commit id
        try {
            String detached = runner.run(dir, "rev-parse", "--short", "HEAD").trim();
            return detached.isEmpty() ? null : detached;
        } catch (GitCommandException e) {
            return null;
        }
    }

    private Integer commitCount(Path dir) throws GitUnavailableException {
        try {
            return Integer.valueOf(runner.run(dir, "rev-list", "--all", "--count").trim());
        } catch (GitCommandException | NumberFormatException e) {
            return null;
        }
    }

    private Integer branchCount(Path dir) throws GitUnavailableException {
        try {
            String output = runner.run(dir, "branch", "--format=%(refname:short)");
            int count = 0;
            for (String line : output.split("\n")) {
                if (!line.isBlank()) {
                    count++;
                }
            }
            return count;
        } catch (GitCommandException e) {
            return null;
        }
    }

    private List<GitRemote> remotes(Path dir) throws GitUnavailableException {
        try {
            return parseRemotes(runner.run(dir, "remote", "-v"));
        } catch (GitCommandException e) {
            return List.of();
        }
    }

    /**
     * 解析 {@code git remote -v} 输出：按名称去重，区分 fetch/push；只出现一个方向时 push 默认等于 fetch。
     */
    static List<GitRemote> parseRemotes(String output) {
        if (output == null || output.isBlank()) {
            return List.of();
        }
        Map<String, String[]> byName = new LinkedHashMap<>();
        for (String rawLine : output.split("\n")) {
            String line = rawLine.trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] parts = line.split("\\s+");
            if (parts.length < 2) {
                continue;
            }
            String name = parts[0];
            String url = parts[1];
            String direction = parts.length > 2 ? parts[2] : "";
            String[] urls = byName.computeIfAbsent(name, k -> new String[2]);
            if ("(fetch)".equals(direction)) {
                urls[0] = url;
            } else if ("(push)".equals(direction)) {
                urls[1] = url;
            } else {
                if (urls[0] == null) {
                    urls[0] = url;
                }
                if (urls[1] == null) {
                    urls[1] = url;
                }
            }
        }
        List<GitRemote> remotes = new ArrayList<>(byName.size());
        for (Map.Entry<String, String[]> e : byName.entrySet()) {
            String fetch = e.getValue()[0];
            String push = e.getValue()[1] != null ? e.getValue()[1] : fetch;
            remotes.add(new GitRemote(e.getKey(), fetch, push));
        }
        return remotes;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
