package org.liveindex.filesystem.content;

import java.util.Locale;

/**
 * 文件内搜索结果的片段截取。
 */
public final class SnippetBuilder {

    static final int PRE_CONTEXT = 60;
    static final int POST_CONTEXT = 120;
    static final String ELLIPSIS = "…";

    private SnippetBuilder() {
    }

    /**
     * 截取片段：制表符展开为 4 个空格；若行内（忽略大小写）出现查询串，取其前 60、后 120 个字符并在截断处加省略号；
     * 否则返回整行，超过 maxLength 时截断为 maxLength - 1 个字符加省略号。
     */
    public static String build(String line, String query, int maxLength) {
        if (line == null || line.isEmpty()) {
            return "";
        }
        String text = line.replace("\t", "    ");
        String q = query == null ? "" : query.trim();
        int index = q.isEmpty() ? -1 : text.toLowerCase(Locale.ROOT).indexOf(q.toLowerCase(Locale.ROOT));
        if (index < 0) {
            if (text.length() <= maxLength) {
                return text;
            }
            return text.substring(0, Math.max(0, maxLength - 1)) + ELLIPSIS;
        }
        int start = Math.max(0, index - PRE_CONTEXT);
        int end = Math.min(text.length(), index + q.length() + POST_CONTEXT);
        StringBuilder sb = new StringBuilder(end - start + 2);
        if (start > 0) {
            sb.append(ELLIPSIS);
        }
        sb.append(text, start, end);
        if (end < text.length()) {
            sb.append(ELLIPSIS);
        }
        return sb.toString();
    }
}
