package org.liveindex.filesystem.dto;

/**
 * 文件内搜索的单条匹配。
 *
 * @param line    行号（1-based）
 * @param score   匹配分数（0 为完全匹配）
 * @param snippet 片段（围绕第一次出现的位置截取，或截断后的行首）
 */
public record FileLineMatch(int line, Double score, String snippet) {
}
