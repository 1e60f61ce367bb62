package org.liveindex.filesystem.dto;

/**
 * 搜索框联想项。
 *
 * @param type  path / tag / tagKey
 * @param value 联想值（路径、{@code key:value} 或 {@code key:}）
 */
public record Suggestion(String type, String value) {

    public static final String PATH = "path";
    public static final String TAG = "tag";
    public static final String TAG_KEY = "tagKey";
}
