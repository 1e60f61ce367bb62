package org.liveindex.filesystem.index;

import org.liveindex.filesystem.CanonicalPaths;
import org.liveindex.filesystem.EntryNotFoundException;
import org.liveindex.filesystem.dto.EntryDetail;
import org.liveindex.filesystem.dto.EntryKind;
import org.liveindex.filesystem.dto.IndexEntry;
import org.liveindex.filesystem.dto.Suggestion;
import org.liveindex.filesystem.dto.Tag;
import org.liveindex.filesystem.dto.TagSearchHit;
import org.liveindex.filesystem.dto.TreeNode;
import org.liveindex.filesystem.dto.TreeResult;
import org.liveindex.filesystem.store.EntryStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 查询引擎：目录树重建、标签过滤 + 模糊搜索、搜索框联想、标签查询。
 * <p>
 * 除单条目查询外，所有查询都只读取同一个 {@link IndexSnapshot}，因此一次查询内部看到的数据总是一致的。
 */
public class IndexQueryService {

    static final int DEFAULT_TAG_SEARCH_LIMIT = 20;
    static final int MAX_TAG_SEARCH_LIMIT = 100;

    private static final int SUGGESTION_PART_LIMIT = 5;

    private static final Comparator<TreeNode> CHILD_ORDER = Comparator
            .comparing((TreeNode n) -> n.kind() == EntryKind.DIRECTORY ? 0 : 1)
            .thenComparing(TreeNode::name, String.CASE_INSENSITIVE_ORDER)
            .thenComparing(TreeNode::name);

    private final CanonicalPaths paths;
    private final EntryStore store;
    private final SearchCache cache;
    private final int searchLimit;
    private final int suggestionLimit;

    public IndexQueryService(CanonicalPaths paths, EntryStore store, SearchCache cache, int searchLimit, int suggestionLimit) {
        this.paths = paths;
        this.store = store;
        this.cache = cache;
        this.searchLimit = Math.max(1, searchLimit);
        this.suggestionLimit = Math.max(1, suggestionLimit);
    }

    /**
     * 一个 {@code key:value} 标签过滤条件。
     */
    public record TagFilter(String key, String value) {
    }

    // ---------------------------------------------------------------- tree

    /**
     * 根据 parentPath 组装父子关系并排序：目录在前，文件在后，同组内按名称忽略大小写排序。
     */
    public TreeResult tree() {
        IndexSnapshot snapshot = cache.snapshot();
        Map<String, List<IndexEntry>> childrenByParent = new HashMap<>();
        IndexEntry rootEntry = null;
        for (IndexEntry e : snapshot.entries()) {
            if (e.parentPath() == null) {
                if (CanonicalPaths.ROOT.equals(e.path())) {
                    rootEntry = e;
                }
                continue;
            }
            childrenByParent.computeIfAbsent(e.parentPath(), k -> new ArrayList<>()).add(e);
        }
        TreeNode root = rootEntry == null ? null : buildNode(rootEntry, snapshot, childrenByParent);
        return new TreeResult(paths.rootName(), root, System.currentTimeMillis());
    }

    private TreeNode buildNode(IndexEntry entry, IndexSnapshot snapshot, Map<String, List<IndexEntry>> childrenByParent) {
        List<TreeNode> children = new ArrayList<>();
        for (IndexEntry child : childrenByParent.getOrDefault(entry.path(), List.of())) {
            children.add(buildNode(child, snapshot, childrenByParent));
        }
        children.sort(CHILD_ORDER);
        String name = CanonicalPaths.ROOT.equals(entry.path()) ? paths.rootName() : entry.name();
        return new TreeNode(
                entry.path(),
                name,
                entry.kind(),
                entry.size(),
                entry.modifiedAt(),
                entry.extension(),
                entry.depth(),
                snapshot.tagsFor(entry.path()),
                snapshot.gitInfoFor(entry),
                List.copyOf(children)
        );
    }

    // ---------------------------------------------------------------- entry

    public EntryDetail entry(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("参数错误：path 不能为空");
        }
        IndexEntry entry = store.findEntry(path);
        if (entry == null) {
            throw new EntryNotFoundException(path);
        }
        return EntryDetail.of(entry, store.tagsFor(path), cache.snapshot().gitInfoFor(entry));
    }

    // ---------------------------------------------------------------- search

    /**
     * 解析逗号分隔的 {@code key:value} 过滤条件；空白或格式不对的片段直接忽略。
     */
    public static List<TagFilter> parseTagFilters(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        List<TagFilter> filters = new ArrayList<>();
        for (String piece : raw.split(",")) {
            String trimmed = piece.trim();
            int idx = trimmed.indexOf(':');
            if (idx < 0) {
                continue;
            }
            String key = trimmed.substring(0, idx).trim();
            String value = trimmed.substring(idx + 1).trim();
            if (!key.isEmpty() && !value.isEmpty()) {
                filters.add(new TagFilter(key, value));
            }
        }
        return filters;
    }

    /**
     * 搜索条目。
     * <ul>
     *   <li>每个过滤条件单独求出满足的路径集合，再求交集；没有过滤条件则不限制。</li>
     *   <li>有关键字：模糊匹配（限量），限制在交集内，保持匹配顺序并按路径去重。</li>
     *   <li>无关键字：按索引顺序返回（过滤后的）条目，同样限量。</li>
     * </ul>
     */
    public List<EntryDetail> search(String query, List<TagFilter> filters) {
        IndexSnapshot snapshot = cache.snapshot();
        Set<String> allowed = pathsMatchingAll(snapshot, filters);
        String q = query == null ? "" : query.trim();

        List<IndexEntry> selected = new ArrayList<>();
        if (!q.isEmpty()) {
            Set<String> seen = new HashSet<>();
            for (FuzzyIndex.Hit<IndexEntry> hit : snapshot.entryIndex().search(q, searchLimit)) {
                IndexEntry e = hit.item();
                if (allowed != null && !allowed.contains(e.path())) {
                    continue;
                }
                if (seen.add(e.path())) {
                    selected.add(e);
                }
            }
        } else {
            for (IndexEntry e : snapshot.entries()) {
                if (selected.size() >= searchLimit) {
                    break;
                }
                if (allowed == null || allowed.contains(e.path())) {
                    selected.add(e);
                }
            }
        }
        List<EntryDetail> results = new ArrayList<>(selected.size());
        for (IndexEntry e : selected) {
            results.add(EntryDetail.of(e, snapshot.tagsFor(e.path()), snapshot.gitInfoFor(e)));
        }
        return results;
    }

    /**
     * @return 满足全部条件的路径；条件为空时返回 null（表示不限制）
     */
    private static Set<String> pathsMatchingAll(IndexSnapshot snapshot, List<TagFilter> filters) {
        if (filters == null || filters.isEmpty()) {
            return null;
        }
        Set<String> result = null;
        for (TagFilter filter : filters) {
            Set<String> matching = new HashSet<>();
            for (Tag t : snapshot.tags()) {
                if (t.key().equals(filter.key()) && t.value().equals(filter.value())) {
                    matching.add(t.path());
                }
            }
            if (result == null) {
                result = matching;
            } else {
                result.retainAll(matching);
            }
        }
        return result;
    }

    // ---------------------------------------------------------------- suggestions

    /**
     * 搜索框联想。
     * <ul>
     *   <li>空输入：返回若干个目录（不含根目录）。</li>
     *   <li>最后一个词形如 {@code key:部分值}：返回该 key 下以此开头的已知值。</li>
     *   <li>否则合并路径模糊匹配、标签模糊匹配、标签名前缀匹配，按 (type, value) 去重。</li>
     * </ul>
     */
    public List<Suggestion> suggest(String rawQuery) {
        IndexSnapshot snapshot = cache.snapshot();
        String query = rawQuery == null ? "" : rawQuery.trim();
        if (query.isEmpty()) {
            List<Suggestion> dirs = new ArrayList<>();
            for (IndexEntry e : snapshot.entries()) {
                if (dirs.size() >= suggestionLimit) {
                    break;
                }
                if (e.isDirectory() && !CanonicalPaths.ROOT.equals(e.path())) {
                    dirs.add(new Suggestion(Suggestion.PATH, e.path()));
                }
            }
            return dirs;
        }

        String[] tokens = query.split("\\s+");
        String current = tokens[tokens.length - 1];
        int colon = current.indexOf(':');
        if (colon > -1) {
            String key = current.substring(0, colon);
            String partial = current.substring(colon + 1).toLowerCase(Locale.ROOT);
            List<Suggestion> values = new ArrayList<>();
            for (String value : snapshot.tagValuesByKey().getOrDefault(key, Set.of())) {
                if (values.size() >= suggestionLimit) {
                    break;
                }
                if (value.toLowerCase(Locale.ROOT).startsWith(partial)) {
                    values.add(new Suggestion(Suggestion.TAG, key + ":" + value));
                }
            }
            return values;
        }

        List<Suggestion> merged = new ArrayList<>();
        for (FuzzyIndex.Hit<IndexEntry> hit : snapshot.entryIndex().search(current, SUGGESTION_PART_LIMIT)) {
            merged.add(new Suggestion(Suggestion.PATH, hit.item().path()));
        }
        for (FuzzyIndex.Hit<Tag> hit : snapshot.tagIndex().search(current, SUGGESTION_PART_LIMIT)) {
            merged.add(new Suggestion(Suggestion.TAG, hit.item().pair()));
        }
        String lowerCurrent = current.toLowerCase(Locale.ROOT);
        int keyCount = 0;
        for (String key : snapshot.tagValuesByKey().keySet()) {
            if (keyCount >= SUGGESTION_PART_LIMIT) {
                break;
            }
            if (key.toLowerCase(Locale.ROOT).startsWith(lowerCurrent)) {
                merged.add(new Suggestion(Suggestion.TAG_KEY, key + ":"));
                keyCount++;
            }
        }

        Set<Suggestion> unique = new LinkedHashSet<>(merged);
        List<Suggestion> result = new ArrayList<>(Math.min(unique.size(), suggestionLimit));
        for (Suggestion s : unique) {
            if (result.size() >= suggestionLimit) {
                break;
            }
            result.add(s);
        }
        return result;
    }

    // ---------------------------------------------------------------- tags

    /**
     * 列出标签：指定路径时只列该条目的标签（条目不存在抛 404），否则列出全部。
     */
    public List<Tag> tags(String path) {
        if (path == null || path.isBlank()) {
            return cache.snapshot().tags();
        }
        if (!store.exists(path)) {
            throw new EntryNotFoundException(path);
        }
        return store.tagsFor(path).stream().map(t -> new Tag(path, t.key(), t.value())).toList();
    }

    /**
     * 标签模糊搜索；limit 限制在 [1, 100]，默认 20。
     */
    public List<TagSearchHit> searchTags(String query, Integer limit) {
        String q = query == null ? "" : query.trim();
        if (q.isEmpty()) {
            throw new IllegalArgumentException("参数错误：q 不能为空");
        }
        int resolvedLimit = limit == null ? DEFAULT_TAG_SEARCH_LIMIT : Math.min(Math.max(limit, 1), MAX_TAG_SEARCH_LIMIT);
        List<TagSearchHit> hits = new ArrayList<>();
        for (FuzzyIndex.Hit<Tag> hit : cache.snapshot().tagIndex().search(q, resolvedLimit)) {
            Tag t = hit.item();
            hits.add(new TagSearchHit(t.path(), t.key(), t.value(), t.pair(), hit.score()));
        }
        return hits;
    }

    public IndexSnapshot snapshot() {
        return cache.snapshot();
    }
}
