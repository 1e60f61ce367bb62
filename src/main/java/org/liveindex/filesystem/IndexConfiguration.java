package org.liveindex.filesystem;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.liveindex.filesystem.content.ClientRequestTracker;
import org.liveindex.filesystem.content.FileContentService;
import org.liveindex.filesystem.git.GitMetadataCollector;
import org.liveindex.filesystem.git.ProcessGitCommandRunner;
import org.liveindex.filesystem.index.ChangeBroadcaster;
import org.liveindex.filesystem.index.IndexMutationPipeline;
import org.liveindex.filesystem.index.IndexQueryService;
import org.liveindex.filesystem.index.SearchCache;
import org.liveindex.filesystem.index.TagService;
import org.liveindex.filesystem.scan.InitialScanner;
import org.liveindex.filesystem.scan.PathIndexer;
import org.liveindex.filesystem.store.EntryStore;
import org.liveindex.filesystem.store.IndexDatabase;
import org.liveindex.filesystem.watch.FileChangeReconciler;
import org.liveindex.filesystem.watch.IndexWatcher;
import org.liveindex.filesystem.watch.NativeChangeSource;
import org.liveindex.filesystem.watch.PollingChangeSource;
import org.liveindex.filesystem.watch.WatchMode;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;

import java.nio.file.Path;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 实时索引服务的 Bean 装配。
 * <p>
 * 说明：
 * <ul>
 *   <li>索引库是进程内 H2，随应用关闭而销毁；每次启动都从磁盘重新扫描。</li>
 *   <li>扫描、监听的启动与停止由 {@link IndexLifecycle} 负责。</li>
 * </ul>
 */
@Configuration(proxyBeanMethods = false)
public class IndexConfiguration {

    @Bean
    public CanonicalPaths canonicalPaths(IndexProperties properties) {
        return new CanonicalPaths(Path.of(properties.getRoot()));
    }

    @Bean
    public IgnoredPaths ignoredPaths(CanonicalPaths paths, IndexProperties properties) {
        return new IgnoredPaths(paths, properties.getIgnoredSuffixes());
    }

    @Bean(destroyMethod = "shutdown")
    public EmbeddedDatabase indexDataSource() {
        return IndexDatabase.create();
    }

    @Bean
    public EntryStore entryStore(EmbeddedDatabase indexDataSource, ObjectMapper objectMapper) {
        return new EntryStore(indexDataSource, objectMapper);
    }

    @Bean(destroyMethod = "close")
    public GitMetadataCollector gitMetadataCollector(CanonicalPaths paths, EntryStore store, IndexProperties properties) {
        ProcessGitCommandRunner runner = new ProcessGitCommandRunner(
                properties.getGitBinary(),
                properties.getGitTimeout(),
                properties.getGitMaxOutput().toBytes()
        );
        AtomicInteger counter = new AtomicInteger();
        int threads = properties.getGitThreads();
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                threads, threads, 30, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(10_000),
                r -> {
                    Thread t = new Thread(r, "index-git-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy()
        );
        executor.allowCoreThreadTimeOut(true);
        return new GitMetadataCollector(paths, store, runner, executor, properties.isGitEnabled());
    }

    @Bean
    public SearchCache searchCache(EntryStore store) {
        return new SearchCache(store);
    }

    @Bean
    public IndexMutationPipeline indexMutationPipeline(EntryStore store, SearchCache cache, ChangeBroadcaster broadcaster) {
        return new IndexMutationPipeline(store, cache, broadcaster);
    }

    @Bean
    public IndexQueryService indexQueryService(CanonicalPaths paths, EntryStore store, SearchCache cache, IndexProperties properties) {
        return new IndexQueryService(paths, store, cache, properties.getSearchLimit(), properties.getSuggestionLimit());
    }

    @Bean
    public TagService tagService(IndexMutationPipeline pipeline) {
        return new TagService(pipeline);
    }

    @Bean
    public PathIndexer pathIndexer(CanonicalPaths paths, IgnoredPaths ignored, EntryStore store) {
        return new PathIndexer(paths, ignored, store);
    }

    @Bean
    public InitialScanner initialScanner(PathIndexer indexer, EntryStore store, GitMetadataCollector git, IndexProperties properties) {
        return new InitialScanner(indexer, store, git, properties.isFollowSymlinks());
    }

    @Bean
    public FileChangeReconciler fileChangeReconciler(PathIndexer indexer,
                                                     EntryStore store,
                                                     IgnoredPaths ignored,
                                                     GitMetadataCollector git,
                                                     IndexMutationPipeline pipeline,
                                                     InitialScanner scanner) {
        return new FileChangeReconciler(indexer, store, ignored, git, pipeline, scanner);
    }

    @Bean(destroyMethod = "close")
    public IndexWatcher indexWatcher(FileChangeReconciler reconciler,
                                     CanonicalPaths paths,
                                     IgnoredPaths ignored,
                                     IndexProperties properties) {
        return new IndexWatcher(reconciler, mode -> mode == WatchMode.POLLING
                ? new PollingChangeSource(paths, ignored, properties.isFollowSymlinks(), properties.getPollInterval())
                : new NativeChangeSource(paths, ignored, properties.isFollowSymlinks()));
    }

    @Bean
    public ClientRequestTracker clientRequestTracker() {
        return new ClientRequestTracker();
    }

    @Bean
    public FileContentService fileContentService(CanonicalPaths paths,
                                                 EntryStore store,
                                                 ClientRequestTracker tracker,
                                                 IndexProperties properties) {
        return new FileContentService(paths, store, tracker, properties.getFileSearchLimit(), properties.getSnippetMaxLength());
    }

    @Bean
    public IndexLifecycle indexLifecycle(InitialScanner scanner,
                                         IndexMutationPipeline pipeline,
                                         IndexWatcher watcher,
                                         CanonicalPaths paths,
                                         IgnoredPaths ignored,
                                         GitMetadataCollector git,
                                         IndexProperties properties) {
        return new IndexLifecycle(scanner, pipeline, watcher, paths, ignored, git, properties);
    }
}
