package org.liveindex.filesystem.index;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.liveindex.filesystem.dto.TagValue;

/**
 * 推送给观察者的索引变更通知。
 *
 * @param type 事件类型：entry-added / entry-updated / entry-removed / tag-added / tag-removed
 * @param path 条目规范路径
 * @param tag  标签（仅标签事件）
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChangeEvent(String type, String path, TagValue tag) {

    public static final String ENTRY_ADDED = "entry-added";
    public static final String ENTRY_UPDATED = "entry-updated";
    public static final String ENTRY_REMOVED = "entry-removed";
    public static final String TAG_ADDED = "tag-added";
    public static final String TAG_REMOVED = "tag-removed";

    public static ChangeEvent entryAdded(String path) {
        return new ChangeEvent(ENTRY_ADDED, path, null);
    }

    public static ChangeEvent entryUpdated(String path) {
        return new ChangeEvent(ENTRY_UPDATED, path, null);
    }

    public static ChangeEvent entryRemoved(String path) {
        return new ChangeEvent(ENTRY_REMOVED, path, null);
    }

    public static ChangeEvent tagAdded(String path, String key, String value) {
        return new ChangeEvent(TAG_ADDED, path, new TagValue(key, value));
    }

    public static ChangeEvent tagRemoved(String path, String key, String value) {
        return new ChangeEvent(TAG_REMOVED, path, new TagValue(key, value));
    }
}
