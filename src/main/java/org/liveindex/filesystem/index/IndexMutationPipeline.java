package org.liveindex.filesystem.index;

import org.liveindex.filesystem.dto.Tag;
import org.liveindex.filesystem.store.EntryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 索引变更的统一出口：每次变更之后“重建快照 + 广播通知”，两步总是一起发生。
 * <p>
 * commit 串行执行，保证快照与通知按变更顺序发布。
 */
public class IndexMutationPipeline {

    private static final Logger log = LoggerFactory.getLogger(IndexMutationPipeline.class);

    private final EntryStore store;
    private final SearchCache cache;
    private final ChangeBroadcaster broadcaster;
    private final Object lock = new Object();

    public IndexMutationPipeline(EntryStore store, SearchCache cache, ChangeBroadcaster broadcaster) {
        this.store = store;
        this.cache = cache;
        this.broadcaster = broadcaster;
    }

    /**
     * 已写入索引库的变更：重建快照并广播。
     */
    public void commit(ChangeEvent event) {
        commitAll(List.of(event));
    }

    /**
     * 一批变更只重建一次快照，再按顺序逐条广播。
     */
    public void commitAll(List<ChangeEvent> events) {
        if (events.isEmpty()) {
            return;
        }
        synchronized (lock) {
            cache.rebuild();
            for (ChangeEvent event : events) {
                try {
                    broadcaster.publish(event);
                } catch (RuntimeException e) {
                    log.warn("广播变更通知失败：{} {}（{}）", event.type(), event.path(), e.getMessage());
                }
            }
        }
    }

    /**
     * 不伴随通知的全量重建（初始扫描结束时使用）。
     */
    public IndexSnapshot rebuild() {
        synchronized (lock) {
            return cache.rebuild();
        }
    }

    /**
     * 添加标签（幂等）。无论是否真正插入都会重建并广播，客户端据此刷新。
     *
     * @return 是否新增
     */
    public boolean addTag(Tag tag) {
        boolean inserted = store.addTag(tag);
        commit(ChangeEvent.tagAdded(tag.path(), tag.key(), tag.value()));
        return inserted;
    }

    /**
     * 删除标签；不存在时不改动索引，但同样广播。
     *
     * @return 是否删除
     */
    public boolean removeTag(Tag tag) {
        boolean removed = store.removeTag(tag);
        commit(ChangeEvent.tagRemoved(tag.path(), tag.key(), tag.value()));
        return removed;
    }

    public IndexSnapshot snapshot() {
        return cache.snapshot();
    }

    public void shutdown() {
        synchronized (lock) {
            cache.clear();
        }
    }
}
