package org.liveindex.filesystem.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 索引条目类型。
 */
public enum EntryKind {
    FILE("file"),
    DIRECTORY("directory");

    private final String value;

    EntryKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static EntryKind fromValue(String value) {
        for (EntryKind kind : values()) {
            if (kind.value.equals(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("未知的条目类型：" + value);
    }
}
