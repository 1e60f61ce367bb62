package org.liveindex.filesystem.watch;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum WatchMode {

    NATIVE("native"),
    POLLING("polling");

    private final String value;

    WatchMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * 配置值解析（大小写不敏感）。
     */
    public static WatchMode fromValue(String raw) {
        if (raw != null) {
            String normalized = raw.trim().toLowerCase(Locale.ROOT);
            for (WatchMode mode : values()) {
                if (mode.value.equals(normalized)) {
                    return mode;
                }
            }
        }
        throw new IllegalArgumentException("未知的监听模式：" + raw + "（可选 native / polling）");
    }
}
