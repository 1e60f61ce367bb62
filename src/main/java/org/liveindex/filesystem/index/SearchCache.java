package org.liveindex.filesystem.index;

import org.liveindex.filesystem.store.EntryStore;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 搜索缓存：持有当前的 {@link IndexSnapshot}。
 * <p>
 * 设计要点：
 * <ul>
 *   <li>每次索引变更后从 {@link EntryStore} 全量重建，不做增量修补。</li>
 *   <li>新快照在构建完成后一次性替换旧快照，并发读者不会看到“构建了一半”的状态。</li>
 *   <li>不对外暴露可变结构；所有变更都必须经过 {@link IndexMutationPipeline}。</li>
 * </ul>
 */
public class SearchCache {

    private final EntryStore store;
    private final AtomicReference<IndexSnapshot> current = new AtomicReference<>(IndexSnapshot.empty());

    public SearchCache(EntryStore store) {
        this.store = store;
    }

    public IndexSnapshot snapshot() {
        return current.get();
    }

    /**
     * 从索引库全量重建并替换当前快照。
     */
    IndexSnapshot rebuild() {
        IndexSnapshot next = IndexSnapshot.of(
                store.findAllEntries(),
                store.findAllTags(),
                store.findAllGitMetadata()
        );
        current.set(next);
        return next;
    }

    /**
     * 关闭时清空快照。
     */
    void clear() {
        current.set(IndexSnapshot.empty());
    }
}
