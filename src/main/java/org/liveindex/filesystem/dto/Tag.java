package org.liveindex.filesystem.dto;

/**
 * 用户附加在某个条目上的标签（key:value）。同一 key 允许多个 value，(path, key, value) 唯一。
 *
 * @param path  条目规范路径
 * @param key   标签名
 * @param value 标签值
 */
public record Tag(String path, String key, String value) {

    /**
     * {@code key:value} 形式，用于模糊搜索与联想。
     */
    public String pair() {
        return key + ":" + value;
    }
}
