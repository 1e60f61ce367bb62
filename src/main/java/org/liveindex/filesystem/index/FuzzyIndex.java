package org.liveindex.filesystem.index;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * 模糊匹配索引（不可变）。
 * <p>
 * 匹配方式：把查询串当作“近似子串”在每个 key 中查找，允许插入/删除/替换以及相邻字符互换，每种记 1 个错误；
 * 分数 = 最少错误数 / 查询串长度（0 表示包含完全一致的子串）。分数不超过阈值即视为命中，多个 key 取最好的一个。
 * 大小写不敏感，不考虑命中位置。
 * <p>
 * 结果按分数升序，分数相同时保持建索引时的顺序。
 *
 * @param <T> 被索引的元素类型
 */
public final class FuzzyIndex<T> {

    private final List<T> items;
    private final List<String[]> keys;
    private final double threshold;

    private FuzzyIndex(List<T> items, List<String[]> keys, double threshold) {
        this.items = items;
        this.keys = keys;
        this.threshold = threshold;
    }

    /**
     * @param items     元素（顺序即“索引顺序”）
     * @param threshold 命中阈值，取值 [0, 1]
     * @param keyFns    取 key 的函数；返回 null 的 key 会被忽略
     */
    @SafeVarargs
    public static <T> FuzzyIndex<T> of(List<T> items, double threshold, Function<T, String>... keyFns) {
        List<T> copy = List.copyOf(items);
        List<String[]> keys = new ArrayList<>(copy.size());
        for (T item : copy) {
            String[] k = new String[keyFns.length];
            for (int i = 0; i < keyFns.length; i++) {
                String v = keyFns[i].apply(item);
                k[i] = v == null ? null : v.toLowerCase(Locale.ROOT);
            }
            keys.add(k);
        }
        return new FuzzyIndex<>(copy, keys, threshold);
    }

    public int size() {
        return items.size();
    }

    public List<T> items() {
        return items;
    }

    /**
     * 单条命中。
     *
     * @param item     元素
     * @param score    分数（0 为完全包含）
     * @param refIndex 元素在索引中的位置
     */
    public record Hit<T>(T item, double score, int refIndex) {
    }

    public List<Hit<T>> search(String query, int limit) {
        if (query == null || limit <= 0) {
            return List.of();
        }
        String pattern = query.toLowerCase(Locale.ROOT);
        if (pattern.isEmpty()) {
            return List.of();
        }
        int maxErrors = (int) Math.floor(threshold * pattern.length() + 1e-9);
        List<Hit<T>> hits = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            int best = Integer.MAX_VALUE;
            for (String key : keys.get(i)) {
                if (key == null) {
                    continue;
                }
                int errors = substringDistance(pattern, key, maxErrors);
                if (errors < best) {
                    best = errors;
                    if (best == 0) {
                        break;
                    }
                }
            }
            if (best <= maxErrors) {
                hits.add(new Hit<>(items.get(i), (double) best / pattern.length(), i));
            }
        }
        hits.sort(Comparator.comparingDouble((Hit<T> h) -> h.score()).thenComparingInt(Hit::refIndex));
        return hits.size() > limit ? List.copyOf(hits.subList(0, limit)) : hits;
    }

    /**
     * 计算 {@code pattern} 与 {@code text} 中任意子串之间的最小编辑距离（含相邻互换）。
     * 结果超过 {@code maxErrors} 时可能提前返回 {@code maxErrors + 1}。
     */
    static int substringDistance(String pattern, String text, int maxErrors) {
        if (text.contains(pattern)) {
            return 0;
        }
        int m = pattern.length();
        int n = text.length();
        if (maxErrors <= 0 || m == 0) {
            return m == 0 ? 0 : maxErrors + 1;
        }
        // 三行滚动：prev2 = 第 i-2 行，prev = 第 i-1 行，cur = 第 i 行；第 0 行全 0（子串可以从任意位置开始）
        int[] prev2 = new int[n + 1];
        int[] prev = new int[n + 1];
        int[] cur = new int[n + 1];
        for (int i = 1; i <= m; i++) {
            char pc = pattern.charAt(i - 1);
            cur[0] = i;
            int rowMin = cur[0];
            for (int j = 1; j <= n; j++) {
                char tc = text.charAt(j - 1);
                int cost = pc == tc ? 0 : 1;
                int v = Math.min(Math.min(prev[j] + 1, cur[j - 1] + 1), prev[j - 1] + cost);
                if (i > 1 && j > 1 && pc == text.charAt(j - 2) && pattern.charAt(i - 2) == tc) {
                    v = Math.min(v, prev2[j - 2] + 1);
                }
                cur[j] = v;
                if (v < rowMin) {
                    rowMin = v;
                }
            }
            if (rowMin > maxErrors) {
                return maxErrors + 1;
            }
            int[] tmp = prev2;
            prev2 = prev;
            prev = cur;
            cur = tmp;
        }
        int best = Integer.MAX_VALUE;
        for (int j = 0; j <= n; j++) {
            if (prev[j] < best) {
                best = prev[j];
            }
        }
        return best;
    }
}
