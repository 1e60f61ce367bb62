package org.liveindex.filesystem.index;

/**
 * 变更通知的发布端。实现必须是“发出即忘”：不能因为某个观察者未就绪而阻塞调用方。
 */
public interface ChangeBroadcaster {

    void publish(ChangeEvent event);
}
