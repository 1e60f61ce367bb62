package org.liveindex.web;

/**
 * 统一错误响应体：{@code {"error": "..."}}。
 */
public record ErrorResponse(String error) {
}
