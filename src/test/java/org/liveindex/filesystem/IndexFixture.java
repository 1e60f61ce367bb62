package org.liveindex.filesystem;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.liveindex.filesystem.git.GitCommandRunner;
import org.liveindex.filesystem.git.GitMetadataCollector;
import org.liveindex.filesystem.git.GitUnavailableException;
import org.liveindex.filesystem.index.ChangeBroadcaster;
import org.liveindex.filesystem.index.ChangeEvent;
import org.liveindex.filesystem.index.IndexMutationPipeline;
import org.liveindex.filesystem.index.IndexQueryService;
import org.liveindex.filesystem.index.SearchCache;
import org.liveindex.filesystem.index.TagService;
import org.liveindex.filesystem.scan.InitialScanner;
import org.liveindex.filesystem.scan.PathIndexer;
import org.liveindex.filesystem.store.EntryStore;
import org.liveindex.filesystem.store.IndexDatabase;
import org.liveindex.filesystem.watch.FileChangeReconciler;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;

/**
 * 测试用的完整索引组件（内存 H2 + 关闭的 Git 采集），对应生产环境 IndexConfiguration 的装配方式。
 */
public final class IndexFixture implements AutoCloseable {

    public static final GitCommandRunner NO_GIT = (dir, args) -> {
        throw new GitUnavailableException("git not installed", null);
    };

    private final EmbeddedDatabase database;
    private final CanonicalPaths paths;
    private final IgnoredPaths ignored;
    private final EntryStore store;
    private final GitMetadataCollector git;
    private final SearchCache cache;
    private final RecordingBroadcaster broadcaster = new RecordingBroadcaster();
    private final IndexMutationPipeline pipeline;
    private final PathIndexer indexer;
    private final InitialScanner scanner;
    private final FileChangeReconciler reconciler;
    private final IndexQueryService queries;
    private final TagService tags;

    public IndexFixture(Path root) {
        this(root, NO_GIT, false);
    }

    public IndexFixture(Path root, GitCommandRunner gitRunner, boolean gitEnabled) {
        this.database = IndexDatabase.create();
        this.paths = new CanonicalPaths(root);
        this.ignored = new IgnoredPaths(paths, List.of(".sock"));
        this.store = new EntryStore(database, new ObjectMapper());
        this.git = new GitMetadataCollector(paths, store, gitRunner, Executors.newFixedThreadPool(2), gitEnabled);
        this.cache = new SearchCache(store);
        this.pipeline = new IndexMutationPipeline(store, cache, broadcaster);
        this.indexer = new PathIndexer(paths, ignored, store);
        this.scanner = new InitialScanner(indexer, store, git, false);
        this.reconciler = new FileChangeReconciler(indexer, store, ignored, git, pipeline, scanner);
        this.queries = new IndexQueryService(paths, store, cache, 50, 10);
        this.tags = new TagService(pipeline);
    }

    /**
     * 初始扫描并建立快照。
     */
    public IndexFixture scan() {
        scanner.scan();
        pipeline.rebuild();
        return this;
    }

    public CanonicalPaths paths() {
        return paths;
    }

    public IgnoredPaths ignored() {
        return ignored;
    }

    public EntryStore store() {
        return store;
    }

    public GitMetadataCollector git() {
        return git;
    }

    public IndexMutationPipeline pipeline() {
        return pipeline;
    }

    public PathIndexer indexer() {
        return indexer;
    }

    public InitialScanner scanner() {
        return scanner;
    }

    public FileChangeReconciler reconciler() {
        return reconciler;
    }

    public IndexQueryService queries() {
        return queries;
    }

    public TagService tags() {
        return tags;
    }

    public RecordingBroadcaster broadcaster() {
        return broadcaster;
    }

    @Override
    public void close() {
        git.close();
        database.shutdown();
    }

    public static final class RecordingBroadcaster implements ChangeBroadcaster {

        private final List<ChangeEvent> events = new CopyOnWriteArrayList<>();

        @Override
        public void publish(ChangeEvent event) {
            events.add(event);
        }

        public List<ChangeEvent> events() {
            return events;
        }

        public List<String> types() {
            return events.stream().map(ChangeEvent::type).toList();
        }
    }
}
