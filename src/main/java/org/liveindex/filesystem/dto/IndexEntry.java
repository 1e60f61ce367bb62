package org.liveindex.filesystem.dto;

/**
 * 一个被索引的文件系统节点。
 *
 * @param path       规范路径（相对索引根目录，/ 表示根目录本身），唯一键
 * @param name       名称（文件名/目录名；根目录为根目录名）
 * @param parentPath 父目录规范路径（根目录为 null）
 * @param kind       类型：file / directory
 * @param size       文件大小（字节；目录为 null）
 * @param modifiedAt 最后修改时间（毫秒时间戳）
 * @param extension  扩展名（小写、无前导点；目录与无扩展名文件为空串）
 * @param depth      深度（根目录为 0）
 */
public record IndexEntry(
        String path,
        String name,
        String parentPath,
        EntryKind kind,
        Long size,
        long modifiedAt,
        String extension,
        int depth
) {
    public boolean isDirectory() {
        return kind == EntryKind.DIRECTORY;
    }
}
