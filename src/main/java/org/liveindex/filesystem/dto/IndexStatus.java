package org.liveindex.filesystem.dto;

/**
 * 索引运行状态。
 *
 * @param root             索引根目录（绝对路径）
 * @param watchMode        当前监听模式：native / polling / stopped
 * @param switching        是否正在切换监听模式
 * @param gitAvailable     git 元数据采集是否可用
 * @param entryCount       当前快照中的条目数
 * @param tagCount         当前快照中的标签数
 * @param ignoredPathCount 会话内被忽略的路径数
 * @param eventsProcessed  已处理的文件系统事件数
 */
public record IndexStatus(
        String root,
        String watchMode,
        boolean switching,
        boolean gitAvailable,
        int entryCount,
        int tagCount,
        int ignoredPathCount,
        long eventsProcessed
) {
}
