package org.liveindex.filesystem.dto;

/**
 * 挂在条目上的标签（不含路径）。
 */
public record TagValue(String key, String value) {
}
