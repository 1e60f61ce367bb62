package org.liveindex.filesystem.scan;

import org.liveindex.filesystem.CanonicalPaths;
import org.liveindex.filesystem.dto.IndexEntry;
import org.liveindex.filesystem.git.GitMetadataCollector;
import org.liveindex.filesystem.store.EntryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletionException;

/**
 * 初始扫描：从根目录开始深度优先（先序）遍历，把每个节点写入索引。
 * <p>
 * 说明：
 * <ul>
 *   <li>先序遍历保证父目录总是先于子节点写入；同一目录的子节点按名称顺序处理。</li>
 *   <li>目录写入后同步等待其 Git 元数据采集完成（git 调用本身有超时），采集失败不影响扫描。</li>
 *   <li>{@code .git} 内部文件无需再触发仓库刷新：仓库根目录已经先于它们被采集。</li>
 *   <li>符号链接目录只在 {@code follow-symlinks=true} 时进入，并按真实路径防止循环。</li>
 *   <li>扫描本身不重建搜索缓存，由调用方在扫描结束后统一重建。</li>
 * </ul>
 */
public class InitialScanner {

    private static final Logger log = LoggerFactory.getLogger(InitialScanner.class);

    private final PathIndexer indexer;
    private final EntryStore store;
    private final GitMetadataCollector git;
    private final boolean followSymlinks;

    public InitialScanner(PathIndexer indexer, EntryStore store, GitMetadataCollector git, boolean followSymlinks) {
        this.indexer = indexer;
        this.store = store;
        this.git = git;
        this.followSymlinks = followSymlinks;
    }

    /**
     * 一次扫描的统计。
     *
     * @param indexed       写入的条目数
     * @param removed       清理掉的陈旧条目数（仅 {@link #rescan()}）
     * @param elapsedMillis 耗时
     */
    public record ScanResult(int indexed, int removed, long elapsedMillis) {
    }

    public ScanResult scan() {
        long start = System.currentTimeMillis();
        Set<String> seen = walk();
        long elapsed = System.currentTimeMillis() - start;
        log.info("初始扫描完成：{} 个条目，用时 {} ms", seen.size(), elapsed);
        return new ScanResult(seen.size(), 0, elapsed);
    }

    /**
     * 重新扫描并删除磁盘上已经不存在（或已不可访问）的条目。用于事件丢失后的全量对账。
     */
    public ScanResult rescan() {
        long start = System.currentTimeMillis();
        Set<String> seen = walk();
        int removed = 0;
        for (IndexEntry existing : store.findAllEntries()) {
            String path = existing.path();
            if (seen.contains(path) || !store.exists(path)) {
                continue;
            }
            // 祖先已删除时其子树已一并删除，上面的 exists 检查会跳过它们
            removed += store.deleteSubtree(path);
        }
        long elapsed = System.currentTimeMillis() - start;
        log.info("全量对账完成：{} 个条目，清理 {} 个陈旧条目，用时 {} ms", seen.size(), removed, elapsed);
        return new ScanResult(seen.size(), removed, elapsed);
    }

    private Set<String> walk() {
        Set<String> seen = new HashSet<>();
        Set<Path> visitedRealDirs = new HashSet<>();
        Deque<Path> stack = new ArrayDeque<>();
        stack.push(indexer.paths().root());
        while (!stack.isEmpty()) {
            Path current = stack.pop();
            IndexEntry entry = indexer.index(current);
            if (entry == null || !seen.add(entry.path())) {
                continue;
            }
            if (!entry.isDirectory()) {
                continue;
            }
            awaitGit(entry.path());
            if (!shouldDescend(current, visitedRealDirs)) {
                continue;
            }
            List<Path> children = indexer.listChildren(current);
            // 逆序入栈，出栈顺序即名称顺序
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return seen;
    }

    private boolean shouldDescend(Path directory, Set<Path> visitedRealDirs) {
        boolean isRoot = directory.equals(indexer.paths().root());
        if (!isRoot && Files.isSymbolicLink(directory) && !followSymlinks) {
            return false;
        }
        try {
            return visitedRealDirs.add(directory.toRealPath());
        } catch (IOException e) {
            log.debug("无法解析真实路径，跳过子节点：{}（{}）", directory, e.getMessage());
            return false;
        }
    }

    private void awaitGit(String canonicalDir) {
        if (CanonicalPaths.isGitDirectory(canonicalDir)) {
            return;
        }
        try {
            git.refresh(canonicalDir).join();
        } catch (CompletionException e) {
            log.warn("采集 Git 元数据失败：{}（{}）", canonicalDir, e.getMessage());
        }
    }
}
