package org.liveindex.filesystem.watch;

import org.liveindex.filesystem.CanonicalPaths;
import org.liveindex.filesystem.IgnoredPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * 轮询监听：定期遍历整棵树，与上一次的快照比较后产生事件。
 * <p>
 * 比较规则：
 * <ul>
 *   <li>新增按先序输出，目录总在其子节点之前。</li>
 *   <li>删除只输出最上层的节点，子树由目录删除统一处理。</li>
 *   <li>文件的大小或修改时间变化视为修改；目录自身的时间变化不产生事件。</li>
 *   <li>同一路径的类型发生变化（文件变目录等）时先删除再新增。</li>
 * </ul>
 */
public class PollingChangeSource implements ChangeSource {

    private static final Logger log = LoggerFactory.getLogger(PollingChangeSource.class);

    private final CanonicalPaths paths;
    private final IgnoredPaths ignored;
    private final boolean followSymlinks;
    private final Duration interval;

    private ScheduledExecutorService scheduler;
    private Map<Path, NodeState> previous = Map.of();

    public PollingChangeSource(CanonicalPaths paths, IgnoredPaths ignored, boolean followSymlinks, Duration interval) {
        this.paths = paths;
        this.ignored = ignored;
        this.followSymlinks = followSymlinks;
        this.interval = interval;
    }

    /**
     * 单个节点在快照中的状态。
     */
    record NodeState(boolean directory, long size, long modifiedAt) {
    }

    @Override
    public WatchMode mode() {
        return WatchMode.POLLING;
    }

    @Override
    public void start(Consumer<FileChangeEvent> sink) {
        previous = snapshot();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "index-polling-watch");
            t.setDaemon(true);
            return t;
        });
        long millis = Math.max(100, interval.toMillis());
        scheduler.scheduleWithFixedDelay(() -> tick(sink), millis, millis, TimeUnit.MILLISECONDS);
        log.info("轮询监听已启动：{}（间隔 {} ms）", paths.root(), millis);
    }

    private void tick(Consumer<FileChangeEvent> sink) {
        try {
            poll(sink);
        } catch (RuntimeException e) {
            sink.accept(FileChangeEvent.error(null, e));
        }
    }

    /**
     * 立即执行一次比较（定时任务与测试共用）。
     */
    synchronized void poll(Consumer<FileChangeEvent> sink) {
        Map<Path, NodeState> current = snapshot();
        for (FileChangeEvent event : diff(previous, current)) {
            sink.accept(event);
        }
        previous = current;
    }

    static List<FileChangeEvent> diff(Map<Path, NodeState> before, Map<Path, NodeState> after) {
        List<FileChangeEvent> events = new ArrayList<>();
        Set<Path> removed = new HashSet<>();
        for (Map.Entry<Path, NodeState> e : before.entrySet()) {
            NodeState now = after.get(e.getKey());
            if (now == null || now.directory() != e.getValue().directory()) {
                removed.add(e.getKey());
            }
        }
        for (Map.Entry<Path, NodeState> e : before.entrySet()) {
            Path path = e.getKey();
            if (!removed.contains(path)) {
                continue;
            }
            Path parent = path.getParent();
            if (parent != null && removed.contains(parent)) {
                continue;
            }
            events.add(FileChangeEvent.of(
                    e.getValue().directory() ? FileChangeEvent.Kind.REMOVE_DIRECTORY : FileChangeEvent.Kind.REMOVE_FILE,
                    path));
        }
        for (Map.Entry<Path, NodeState> e : after.entrySet()) {
            Path path = e.getKey();
            NodeState now = e.getValue();
            NodeState then = before.get(path);
            if (then == null || removed.contains(path)) {
                events.add(FileChangeEvent.of(
                        now.directory() ? FileChangeEvent.Kind.ADD_DIRECTORY : FileChangeEvent.Kind.ADD_FILE, path));
            } else if (!now.directory() && (now.size() != then.size() || now.modifiedAt() != then.modifiedAt())) {
                events.add(FileChangeEvent.of(FileChangeEvent.Kind.CHANGE_FILE, path));
            }
        }
        return events;
    }

    /**
     * 先序遍历整棵树（子节点按名称排序），返回有序快照。
     */
    Map<Path, NodeState> snapshot() {
        Map<Path, NodeState> nodes = new LinkedHashMap<>();
        Set<Path> visitedReal = new HashSet<>();
        Deque<Path> stack = new ArrayDeque<>();
        stack.push(paths.root());
        while (!stack.isEmpty()) {
            Path current = stack.pop();
            if (ignored.isIgnored(current)) {
                continue;
            }
            BasicFileAttributes attrs;
            try {
                attrs = Files.readAttributes(current, BasicFileAttributes.class);
            } catch (NoSuchFileException e) {
                continue;
            } catch (IOException e) {
                if (IgnoredPaths.isUnsupported(e)) {
                    ignored.mark(current);
                }
                continue;
            }
            if (!attrs.isDirectory() && !attrs.isRegularFile()) {
                continue;
            }
            nodes.put(current, new NodeState(
                    attrs.isDirectory(),
                    attrs.isDirectory() ? 0L : attrs.size(),
                    attrs.lastModifiedTime().toMillis()));
            if (!attrs.isDirectory()) {
                continue;
            }
            boolean isRoot = current.equals(paths.root());
            if (!isRoot && !followSymlinks && Files.isSymbolicLink(current)) {
                continue;
            }
            try {
                if (!visitedReal.add(current.toRealPath())) {
                    continue;
                }
            } catch (IOException e) {
                continue;
            }
            List<Path> children = new ArrayList<>();
            try (var stream = Files.newDirectoryStream(current)) {
                for (Path child : stream) {
                    children.add(child);
                }
            } catch (IOException e) {
                if (IgnoredPaths.isUnsupported(e)) {
                    ignored.mark(current);
                }
                continue;
            }
            children.sort((a, b) -> b.getFileName().toString().compareTo(a.getFileName().toString()));
            for (Path child : children) {
                stack.push(child);
            }
        }
        return nodes;
    }

    @Override
    public void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }
}
