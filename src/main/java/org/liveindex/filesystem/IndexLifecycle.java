package org.liveindex.filesystem;

import org.liveindex.filesystem.dto.IndexStatus;
import org.liveindex.filesystem.git.GitMetadataCollector;
import org.liveindex.filesystem.index.IndexMutationPipeline;
import org.liveindex.filesystem.index.IndexSnapshot;
import org.liveindex.filesystem.scan.InitialScanner;
import org.liveindex.filesystem.watch.IndexWatcher;
import org.liveindex.filesystem.watch.WatchMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * 索引的启动与停止：先完整扫描、重建快照，再开始监听；关闭时先停监听再清空快照。
 * <p>
 * 启动阶段排在 Web 服务器之前，因此首个请求到达时初始扫描已经完成。
 */
public class IndexLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(IndexLifecycle.class);

    /**
     * 早于 Web 服务器启动，晚于其停止。
     */
    static final int PHASE = SmartLifecycle.DEFAULT_PHASE - 4096;

    private final InitialScanner scanner;
    private final IndexMutationPipeline pipeline;
    private final IndexWatcher watcher;
    private final CanonicalPaths paths;
    private final IgnoredPaths ignored;
    private final GitMetadataCollector git;
    private final boolean watchEnabled;
    private final WatchMode initialMode;

    private volatile boolean running;

    public IndexLifecycle(InitialScanner scanner,
                          IndexMutationPipeline pipeline,
                          IndexWatcher watcher,
                          CanonicalPaths paths,
                          IgnoredPaths ignored,
                          GitMetadataCollector git,
                          IndexProperties properties) {
        this.scanner = scanner;
        this.pipeline = pipeline;
        this.watcher = watcher;
        this.paths = paths;
        this.ignored = ignored;
        this.git = git;
        this.watchEnabled = properties.isWatchEnabled();
        this.initialMode = properties.getInitialWatchMode();
    }

    @Override
    public void start() {
        log.info("开始索引：{}", paths.root());
        scanner.scan();
        IndexSnapshot snapshot = pipeline.rebuild();
        log.info("搜索快照已就绪：{} 个条目，{} 个标签", snapshot.entries().size(), snapshot.tags().size());
        if (watchEnabled) {
            watcher.start(initialMode);
        } else {
            log.info("文件监听已关闭（app.index.watch-enabled=false），索引只反映启动时的状态");
        }
        running = true;
    }

    @Override
    public void stop() {
        running = false;
        watcher.close();
        pipeline.shutdown();
        log.info("索引已停止");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return PHASE;
    }

    public IndexStatus status() {
        IndexSnapshot snapshot = pipeline.snapshot();
        WatchMode mode = watcher.mode();
        return new IndexStatus(
                paths.root().toString(),
                mode == null ? "stopped" : mode.value(),
                watcher.isSwitching(),
                git.isAvailable(),
                snapshot.entries().size(),
                snapshot.tags().size(),
                ignored.size(),
                watcher.processedCount()
        );
    }
}
