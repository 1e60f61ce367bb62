package org.liveindex.filesystem.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 目录树节点（递归）。
 * <p>
 * children 已排序：目录在前、文件在后；同组内按名称忽略大小写排序。
 *
 * @param path       规范路径
 * @param name       名称
 * @param kind       类型
 * @param size       文件大小（目录为 null）
 * @param modifiedAt 最后修改时间（毫秒）
 * @param extension  扩展名
 * @param depth      深度
 * @param tags       标签
 * @param git        仓库信息（仅目录）
 * @param children   子节点（文件为空列表）
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TreeNode(
        String path,
        String name,
        EntryKind kind,
        Long size,
        long modifiedAt,
        String extension,
        int depth,
        List<TagValue> tags,
        GitInfo git,
        List<TreeNode> children
) {
}
