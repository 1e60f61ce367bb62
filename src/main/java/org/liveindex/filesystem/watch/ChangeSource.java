package org.liveindex.filesystem.watch;

import java.util.function.Consumer;

/**
 * 文件系统变更来源（原生监听或轮询）。
 * <p>
 * 实现负责把观察到的变化转换为 {@link FileChangeEvent} 交给 sink；自身的故障也以
 * {@link FileChangeEvent.Kind#ERROR} 事件上报，而不是抛给调用方。
 */
public interface ChangeSource extends AutoCloseable {

    WatchMode mode();

    /**
     * 开始监听。方法返回时初始注册（或基线快照）已经完成。
     */
    void start(Consumer<FileChangeEvent> sink);

    @Override
    void close();
}
