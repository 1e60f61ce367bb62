package org.liveindex.filesystem.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 条目详情（搜索结果、单条目查询）：条目本身 + 标签 + 仓库信息。
 *
 * @param git 目录返回仓库信息；文件为 null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EntryDetail(
        String path,
        String name,
        String parentPath,
        EntryKind kind,
        Long size,
        long modifiedAt,
        String extension,
        int depth,
        List<TagValue> tags,
        GitInfo git
) {
    public static EntryDetail of(IndexEntry entry, List<TagValue> tags, GitInfo git) {
        return new EntryDetail(
                entry.path(),
                entry.name(),
                entry.parentPath(),
                entry.kind(),
                entry.size(),
                entry.modifiedAt(),
                entry.extension(),
                entry.depth(),
                tags == null ? List.of() : tags,
                entry.isDirectory() ? git : null
        );
    }
}
