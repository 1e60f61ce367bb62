package org.liveindex.filesystem.dto;

/**
 * 标签增删结果。
 *
 * @param changed 是否真正改变了索引（重复添加、删除不存在的标签时为 false）
 */
public record TagMutationResult(String path, String key, String value, boolean changed) {
}
