package org.liveindex.filesystem.dto;

/**
 * 标签模糊搜索的单条结果。
 *
 * @param score 匹配分数（0 为完全匹配，越大越不相似）
 */
public record TagSearchHit(String path, String key, String value, String pair, Double score) {
}
