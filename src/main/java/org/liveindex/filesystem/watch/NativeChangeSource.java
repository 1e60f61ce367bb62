package org.liveindex.filesystem.watch;

import org.liveindex.filesystem.CanonicalPaths;
import org.liveindex.filesystem.IgnoredPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * 基于 {@link WatchService} 的原生监听。
 * <p>
 * 说明：
 * <ul>
 *   <li>WatchService 只监听单层目录，因此启动时递归注册整棵树；新建目录在收到事件后再注册。</li>
 *   <li>新建目录在注册之前可能已经有了内容，注册时会把这些内容补发为新增事件。</li>
 *   <li>删除事件一律上报为 {@link FileChangeEvent.Kind#REMOVE_FILE}，由协调器根据索引中的类型判断是否为目录。</li>
 *   <li>注册失败且属于资源耗尽时停止继续注册，并以错误事件上报（由上层切换到轮询）。</li>
 * </ul>
 */
public class NativeChangeSource implements ChangeSource {

    private static final Logger log = LoggerFactory.getLogger(NativeChangeSource.class);

    private final CanonicalPaths paths;
    private final IgnoredPaths ignored;
    private final boolean followSymlinks;

    private volatile WatchService watchService;
    private volatile boolean running;
    private Thread thread;

    public NativeChangeSource(CanonicalPaths paths, IgnoredPaths ignored, boolean followSymlinks) {
        this.paths = paths;
        this.ignored = ignored;
        this.followSymlinks = followSymlinks;
    }

    @Override
    public WatchMode mode() {
        return WatchMode.NATIVE;
    }

    @Override
    public void start(Consumer<FileChangeEvent> sink) {
        try {
            watchService = FileSystems.getDefault().newWatchService();
        } catch (IOException e) {
            sink.accept(FileChangeEvent.error(null, e));
            return;
        }
        running = true;
        if (!registerTree(paths.root(), sink, false)) {
            return;
        }
        thread = new Thread(() -> loop(sink), "index-native-watch");
        thread.setDaemon(true);
        thread.start();
        log.info("原生文件监听已启动：{}", paths.root());
    }

    private void loop(Consumer<FileChangeEvent> sink) {
        while (running) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (ClosedWatchServiceException e) {
                break;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            Path directory = (Path) key.watchable();
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                    sink.accept(FileChangeEvent.overflow());
                    continue;
                }
                if (!(event.context() instanceof Path name)) {
                    continue;
                }
                Path child = directory.resolve(name);
                if (ignored.isIgnored(child)) {
                    continue;
                }
                try {
                    dispatch(event.kind(), child, sink);
                } catch (RuntimeException e) {
                    sink.accept(FileChangeEvent.error(child, e));
                }
            }
            if (!key.reset()) {
                log.debug("监听失效（目录已删除或不可访问）：{}", directory);
            }
        }
    }

    private void dispatch(WatchEvent.Kind<?> kind, Path child, Consumer<FileChangeEvent> sink) {
        if (kind == StandardWatchEventKinds.ENTRY_DELETE) {
            sink.accept(FileChangeEvent.of(FileChangeEvent.Kind.REMOVE_FILE, child));
        } else if (kind == StandardWatchEventKinds.ENTRY_CREATE) {
            if (Files.isDirectory(child)) {
                sink.accept(FileChangeEvent.of(FileChangeEvent.Kind.ADD_DIRECTORY, child));
                if (followSymlinks || !Files.isSymbolicLink(child)) {
                    registerTree(child, sink, true);
                }
            } else {
                sink.accept(FileChangeEvent.of(FileChangeEvent.Kind.ADD_FILE, child));
            }
        } else if (kind == StandardWatchEventKinds.ENTRY_MODIFY) {
            // 目录的修改事件只表示其内容变化，内容本身另有事件
            if (Files.isRegularFile(child)) {
                sink.accept(FileChangeEvent.of(FileChangeEvent.Kind.CHANGE_FILE, child));
            }
        }
    }

    /**
     * 递归注册目录。
     *
     * @param emitContents 是否把已存在的内容补发为新增事件
     * @return false 表示因资源耗尽而中止
     */
    private boolean registerTree(Path start, Consumer<FileChangeEvent> sink, boolean emitContents) {
        Set<Path> visitedReal = new HashSet<>();
        Deque<Path> stack = new ArrayDeque<>();
        stack.push(start);
        while (!stack.isEmpty() && running) {
            Path dir = stack.pop();
            if (ignored.isIgnored(dir) || !markVisited(dir, visitedReal)) {
                continue;
            }
            try {
                dir.register(watchService,
                        StandardWatchEventKinds.ENTRY_CREATE,
                        StandardWatchEventKinds.ENTRY_DELETE,
                        StandardWatchEventKinds.ENTRY_MODIFY);
            } catch (ClosedWatchServiceException e) {
                return false;
            } catch (IOException e) {
                if (WatchErrors.isResourceExhaustion(e)) {
                    sink.accept(FileChangeEvent.error(dir, e));
                    return false;
                }
                if (IgnoredPaths.isUnsupported(e)) {
                    ignored.mark(dir);
                } else {
                    log.warn("注册目录监听失败：{}（{}）", dir, e.getMessage());
                }
                continue;
            }
            List<Path> children = children(dir);
            for (int i = children.size() - 1; i >= 0; i--) {
                Path child = children.get(i);
                if (ignored.isIgnored(child)) {
                    continue;
                }
                boolean directory = Files.isDirectory(child);
                if (emitContents) {
                    sink.accept(FileChangeEvent.of(
                            directory ? FileChangeEvent.Kind.ADD_DIRECTORY : FileChangeEvent.Kind.ADD_FILE, child));
                }
                if (directory && (followSymlinks || !Files.isSymbolicLink(child))) {
                    stack.push(child);
                }
            }
        }
        return true;
    }

    private static boolean markVisited(Path dir, Set<Path> visitedReal) {
        try {
            return visitedReal.add(dir.toRealPath());
        } catch (IOException e) {
            return false;
        }
    }

    private List<Path> children(Path dir) {
        List<Path> children = new ArrayList<>();
        try (var stream = Files.newDirectoryStream(dir)) {
            for (Path child : stream) {
                children.add(child);
            }
        } catch (IOException e) {
            if (IgnoredPaths.isUnsupported(e)) {
                ignored.mark(dir);
            }
            log.debug("无法列举目录：{}（{}）", dir, e.getMessage());
        }
        children.sort((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()));
        return children;
    }

    @Override
    public void close() {
        running = false;
        WatchService ws = watchService;
        if (ws != null) {
            try {
                ws.close();
            } catch (IOException e) {
                log.debug("关闭 WatchService 失败：{}", e.getMessage());
            }
        }
        if (thread != null) {
            thread.interrupt();
        }
    }
}
