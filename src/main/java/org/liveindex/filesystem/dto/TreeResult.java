package org.liveindex.filesystem.dto;

/**
 * 整棵目录树的查询结果。
 *
 * @param rootName    根目录名称
 * @param root        根节点（索引尚为空时为 null）
 * @param generatedAt 生成时间（毫秒）
 */
public record TreeResult(String rootName, TreeNode root, long generatedAt) {
}
