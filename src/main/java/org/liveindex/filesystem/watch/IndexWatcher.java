package org.liveindex.filesystem.watch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * 监听状态机：管理当前变更源，并在单个消费线程上把事件交给 {@link FileChangeReconciler}。
 * <p>
 * 状态与约束：
 * <ul>
 *   <li>模式只有 native 与 polling；监听资源耗尽时 native 切换到 polling，整个进程生命周期内最多切换一次。</li>
 *   <li>切换串行执行：切换进行中再次请求时返回同一个 future；请求当前模式是空操作。</li>
 *   <li>每个变更源启动时分配一个代号，旧代号的事件一律丢弃，切换前后的事件不会交叉生效。</li>
 *   <li>切换到新变更源后补一次全量对账，覆盖切换窗口内可能漏掉的变化。</li>
 * </ul>
 */
public class IndexWatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(IndexWatcher.class);

    private final FileChangeReconciler reconciler;
    private final Function<WatchMode, ChangeSource> sourceFactory;
    private final BlockingQueue<QueuedEvent> queue = new LinkedBlockingQueue<>();
    private final ExecutorService switchExecutor;
    private final AtomicBoolean fellBackToPolling = new AtomicBoolean(false);
    private final AtomicLong generation = new AtomicLong();
    private final AtomicLong discarded = new AtomicLong();
    private final Object lock = new Object();

    private volatile boolean running;
    private volatile WatchMode mode;
    private ChangeSource source;
    private CompletableFuture<WatchMode> switchInFlight;
    private Thread consumer;

    public IndexWatcher(FileChangeReconciler reconciler, Function<WatchMode, ChangeSource> sourceFactory) {
        this.reconciler = reconciler;
        this.sourceFactory = sourceFactory;
        this.switchExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "index-watch-switch");
            t.setDaemon(true);
            return t;
        });
    }

    private record QueuedEvent(long generation, FileChangeEvent event) {
    }

    /**
     * 启动消费线程并以指定模式开始监听；返回时变更源已完成初始注册。
     */
    public void start(WatchMode initialMode) {
        running = true;
        consumer = new Thread(this::consume, "index-watch-consumer");
        consumer.setDaemon(true);
        consumer.start();
        switchTo(initialMode).join();
    }

    /**
     * 当前模式；尚未启动或已停止时为 null。
     */
    public WatchMode mode() {
        return mode;
    }

    public boolean isSwitching() {
        synchronized (lock) {
            return switchInFlight != null && !switchInFlight.isDone();
        }
    }

    public long processedCount() {
        return reconciler.processedCount();
    }

    public long discardedCount() {
        return discarded.get();
    }

    /**
     * 请求切换监听模式。
     */
    public CompletableFuture<WatchMode> switchTo(WatchMode target) {
        synchronized (lock) {
            if (switchInFlight != null && !switchInFlight.isDone()) {
                return switchInFlight;
            }
            if (target == mode && source != null) {
                return CompletableFuture.completedFuture(mode);
            }
            CompletableFuture<WatchMode> future = CompletableFuture.supplyAsync(() -> doSwitch(target), switchExecutor);
            switchInFlight = future;
            future.whenComplete((m, e) -> {
                synchronized (lock) {
                    if (switchInFlight == future) {
                        switchInFlight = null;
                    }
                }
                if (e != null) {
                    log.error("切换监听模式失败：{}", target, e);
                }
            });
            return future;
        }
    }

    private WatchMode doSwitch(WatchMode target) {
        ChangeSource previous;
        long gen;
        synchronized (lock) {
            previous = source;
            source = null;
            gen = generation.incrementAndGet();
        }
        if (previous != null) {
            previous.close();
        }
        if (!running) {
            return mode;
        }
        ChangeSource next = sourceFactory.apply(target);
        synchronized (lock) {
            source = next;
            mode = target;
        }
        next.start(event -> enqueue(gen, event));
        if (previous != null) {
            enqueue(gen, FileChangeEvent.overflow());
        }
        log.info("监听模式：{}", target.value());
        return target;
    }

    private void enqueue(long gen, FileChangeEvent event) {
        if (running) {
            queue.offer(new QueuedEvent(gen, event));
        }
    }

    private void consume() {
        while (running) {
            QueuedEvent queued;
            try {
                queued = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (queued.generation() != generation.get()) {
                discarded.incrementAndGet();
                continue;
            }
            FileChangeEvent event = queued.event();
            try {
                if (event.kind() == FileChangeEvent.Kind.ERROR && WatchErrors.isResourceExhaustion(event.error())) {
                    onResourceExhausted(event);
                } else {
                    reconciler.apply(event);
                }
            } catch (RuntimeException e) {
                log.warn("处理文件事件失败：{} {}（{}）", event.kind(), event.path(), e.getMessage());
            }
        }
    }

    private void onResourceExhausted(FileChangeEvent event) {
        String reason = event.error() == null ? "" : event.error().getMessage();
        if (mode == WatchMode.NATIVE && fellBackToPolling.compareAndSet(false, true)) {
            log.warn("原生监听资源耗尽，切换为轮询模式：{}", reason);
            fallBackToPolling();
            return;
        }
        log.warn("监听资源耗尽（当前模式 {}）：{}", mode == null ? "stopped" : mode.value(), reason);
    }

    private void fallBackToPolling() {
        CompletableFuture<WatchMode> pending;
        synchronized (lock) {
            pending = switchInFlight;
        }
        if (pending == null || pending.isDone()) {
            switchTo(WatchMode.POLLING);
            return;
        }
        // 耗尽发生在 native 启动过程中：等这次切换结束后再切
        pending.whenCompleteAsync((m, e) -> switchTo(WatchMode.POLLING), switchExecutor);
    }

    @Override
    public void close() {
        running = false;
        ChangeSource current;
        synchronized (lock) {
            current = source;
            source = null;
            generation.incrementAndGet();
        }
        if (current != null) {
            current.close();
        }
        mode = null;
        switchExecutor.shutdownNow();
        if (consumer != null) {
            consumer.interrupt();
        }
        queue.clear();
    }
}
