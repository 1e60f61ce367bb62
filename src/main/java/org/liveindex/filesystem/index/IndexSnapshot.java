package org.liveindex.filesystem.index;

import org.liveindex.filesystem.dto.GitInfo;
import org.liveindex.filesystem.dto.GitMetadata;
import org.liveindex.filesystem.dto.IndexEntry;
import org.liveindex.filesystem.dto.Tag;
import org.liveindex.filesystem.dto.TagValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 某一时刻索引的只读快照：条目、标签、Git 元数据以及两套模糊索引。
 * <p>
 * 快照构建完成后不再修改；{@link SearchCache} 通过整体替换来发布新快照，读者要么看到旧快照、要么看到新快照。
 */
public final class IndexSnapshot {

    static final double ENTRY_THRESHOLD = 0.3;
    static final double TAG_THRESHOLD = 0.2;

    private final List<IndexEntry> entries;
    private final Map<String, IndexEntry> entriesByPath;
    private final FuzzyIndex<IndexEntry> entryIndex;
    private final List<Tag> tags;
    private final Map<String, List<TagValue>> tagsByPath;
    private final FuzzyIndex<Tag> tagIndex;
    private final Map<String, Set<String>> tagValuesByKey;
    private final Map<String, GitMetadata> gitByPath;
    private final long builtAt;

    private IndexSnapshot(List<IndexEntry> entries, List<Tag> tags, List<GitMetadata> gitMetadata, long builtAt) {
        this.entries = List.copyOf(entries);
        Map<String, IndexEntry> byPath = new HashMap<>(entries.size() * 2);
        for (IndexEntry e : this.entries) {
            byPath.put(e.path(), e);
        }
        this.entriesByPath = Collections.unmodifiableMap(byPath);
        this.entryIndex = FuzzyIndex.of(this.entries, ENTRY_THRESHOLD, IndexEntry::path, IndexEntry::name);

        this.tags = List.copyOf(tags);
        Map<String, List<TagValue>> grouped = new HashMap<>();
        Map<String, Set<String>> valuesByKey = new LinkedHashMap<>();
        for (Tag t : this.tags) {
            grouped.computeIfAbsent(t.path(), k -> new ArrayList<>()).add(new TagValue(t.key(), t.value()));
            valuesByKey.computeIfAbsent(t.key(), k -> new LinkedHashSet<>()).add(t.value());
        }
        Comparator<TagValue> order = Comparator.comparing(TagValue::key).thenComparing(TagValue::value);
        Map<String, List<TagValue>> sorted = new HashMap<>(grouped.size() * 2);
        for (Map.Entry<String, List<TagValue>> e : grouped.entrySet()) {
            List<TagValue> list = new ArrayList<>(e.getValue());
            list.sort(order);
            sorted.put(e.getKey(), List.copyOf(list));
        }
        this.tagsByPath = Collections.unmodifiableMap(sorted);
        Map<String, Set<String>> frozenValues = new LinkedHashMap<>();
        valuesByKey.forEach((k, v) -> frozenValues.put(k, Collections.unmodifiableSet(v)));
        this.tagValuesByKey = Collections.unmodifiableMap(frozenValues);
        this.tagIndex = FuzzyIndex.of(this.tags, TAG_THRESHOLD, Tag::pair, Tag::key, Tag::value);

        Map<String, GitMetadata> git = new HashMap<>();
        for (GitMetadata g : gitMetadata) {
            git.put(g.path(), g);
        }
        this.gitByPath = Collections.unmodifiableMap(git);
        this.builtAt = builtAt;
    }

    /**
     * @param entries 条目（按深度、名称排序，即“索引顺序”）
     */
    public static IndexSnapshot of(List<IndexEntry> entries, List<Tag> tags, List<GitMetadata> gitMetadata) {
        return new IndexSnapshot(entries, tags, gitMetadata, System.currentTimeMillis());
    }

    public static IndexSnapshot empty() {
        return of(List.of(), List.of(), List.of());
    }

    public List<IndexEntry> entries() {
        return entries;
    }

    public IndexEntry entry(String path) {
        return entriesByPath.get(path);
    }

    public FuzzyIndex<IndexEntry> entryIndex() {
        return entryIndex;
    }

    public List<Tag> tags() {
        return tags;
    }

    public List<TagValue> tagsFor(String path) {
        return tagsByPath.getOrDefault(path, List.of());
    }

    public FuzzyIndex<Tag> tagIndex() {
        return tagIndex;
    }

    public Map<String, Set<String>> tagValuesByKey() {
        return tagValuesByKey;
    }

    /**
     * 目录返回仓库信息（非仓库为 {@code isRepo=false}）；文件返回 null。
     */
    public GitInfo gitInfoFor(IndexEntry entry) {
        if (entry == null || !entry.isDirectory()) {
            return null;
        }
        return GitInfo.of(gitByPath.get(entry.path()));
    }

    public long builtAt() {
        return builtAt;
    }
}
