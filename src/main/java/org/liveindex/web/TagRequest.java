package org.liveindex.web;

/**
 * 标签增删请求体。
 */
public record TagRequest(String path, String key, String value) {
}
