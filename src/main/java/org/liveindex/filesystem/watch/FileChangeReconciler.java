package org.liveindex.filesystem.watch;

import org.liveindex.filesystem.CanonicalPaths;
import org.liveindex.filesystem.IgnoredPaths;
import org.liveindex.filesystem.dto.IndexEntry;
import org.liveindex.filesystem.git.GitMetadataCollector;
import org.liveindex.filesystem.index.ChangeEvent;
import org.liveindex.filesystem.index.IndexMutationPipeline;
import org.liveindex.filesystem.scan.InitialScanner;
import org.liveindex.filesystem.scan.PathIndexer;
import org.liveindex.filesystem.store.EntryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 把变更事件落到索引上：增量 upsert / 删除，然后经由 {@link IndexMutationPipeline} 重建快照并广播。
 * <p>
 * 只能由单个消费线程调用 {@link #apply(FileChangeEvent)}，事件按到达顺序生效。
 */
public class FileChangeReconciler {

    private static final Logger log = LoggerFactory.getLogger(FileChangeReconciler.class);

    private final PathIndexer indexer;
    private final EntryStore store;
    private final IgnoredPaths ignored;
    private final GitMetadataCollector git;
    private final IndexMutationPipeline pipeline;
    private final InitialScanner scanner;
    private final AtomicLong processed = new AtomicLong();

    public FileChangeReconciler(PathIndexer indexer,
                                EntryStore store,
                                IgnoredPaths ignored,
                                GitMetadataCollector git,
                                IndexMutationPipeline pipeline,
                                InitialScanner scanner) {
        this.indexer = indexer;
        this.store = store;
        this.ignored = ignored;
        this.git = git;
        this.pipeline = pipeline;
        this.scanner = scanner;
    }

    public long processedCount() {
        return processed.get();
    }

    public void apply(FileChangeEvent event) {
        processed.incrementAndGet();
        switch (event.kind()) {
            case ADD_FILE, ADD_DIRECTORY, CHANGE_FILE -> upsert(event.path());
            case REMOVE_FILE, REMOVE_DIRECTORY -> remove(event.path());
            case OVERFLOW -> resync();
            case ERROR -> handleError(event);
        }
    }

    private void upsert(Path absolute) {
        String canonical = indexer.paths().toCanonical(absolute);
        if (canonical == null || ignored.isIgnored(absolute) || ignored.isIgnored(canonical)) {
            return;
        }
        List<IndexEntry> ancestors = indexer.backfillAncestors(canonical);
        boolean existed = store.exists(canonical);
        IndexEntry entry = indexer.index(absolute);

        List<ChangeEvent> changes = new ArrayList<>();
        for (IndexEntry ancestor : ancestors) {
            changes.add(ChangeEvent.entryAdded(ancestor.path()));
        }
        if (entry != null) {
            changes.add(existed ? ChangeEvent.entryUpdated(canonical) : ChangeEvent.entryAdded(canonical));
        }
        pipeline.commitAll(changes);

        for (IndexEntry ancestor : ancestors) {
            refreshGit(ancestor.path());
        }
        if (entry != null && entry.isDirectory()) {
            refreshGit(canonical);
        }
        refreshOwningRepository(canonical);
    }

    private void remove(Path absolute) {
        String canonical = indexer.paths().toCanonical(absolute);
        if (canonical == null) {
            return;
        }
        IndexEntry existing = store.findEntry(canonical);
        if (existing != null) {
            // 原生删除事件不区分类型，以索引里记录的类型为准
            int deleted = store.deleteSubtree(canonical);
            log.debug("删除{}：{}（{} 个条目）", existing.isDirectory() ? "目录" : "文件", canonical, deleted);
            pipeline.commit(ChangeEvent.entryRemoved(canonical));
        }
        refreshOwningRepository(canonical);
    }

    /**
     * 事件可能丢失：重新扫描整棵树并清理陈旧条目。
     */
    public void resync() {
        InitialScanner.ScanResult result = scanner.rescan();
        pipeline.commit(ChangeEvent.entryUpdated(CanonicalPaths.ROOT));
        log.info("索引已与磁盘重新对齐：{} 个条目，清理 {} 个", result.indexed(), result.removed());
    }

    private void handleError(FileChangeEvent event) {
        Throwable error = event.error();
        if (event.path() != null && error instanceof IOException io && IgnoredPaths.isUnsupported(io)) {
            ignored.mark(event.path());
            log.debug("无权限访问，加入忽略列表：{}", event.path());
            return;
        }
        log.warn("监听错误（已忽略）：{}（{}）", event.path(), error == null ? "unknown" : error.getMessage());
    }

    private void refreshOwningRepository(String canonical) {
        String repository = CanonicalPaths.repositoryRootOfGitInternal(canonical);
        if (repository != null) {
            refreshGit(repository);
        }
    }

    private void refreshGit(String canonicalDir) {
        git.refresh(canonicalDir).whenComplete((result, error) -> {
            if (error != null) {
                log.warn("刷新 Git 元数据失败：{}（{}）", canonicalDir, error.getMessage());
                return;
            }
            if (result.changed() && store.exists(result.path())) {
                pipeline.commit(ChangeEvent.entryUpdated(result.path()));
            }
        });
    }
}
