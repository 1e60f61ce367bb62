package org.liveindex.filesystem.dto;

import java.util.List;
import java.util.Objects;

/**
 * 仓库根目录的 Git 元数据（只会记录在“git 报告的仓库根目录”上，不会记录在仓库子目录上）。
 *
 * @param path          仓库根目录的规范路径
 * @param detectedAt    采集时间（毫秒时间戳）
 * @param currentBranch 当前分支；HEAD 游离时为短 commit id；获取失败为 null
 * @param commitCount   提交总数（rev-list --all --count；获取失败为 null）
 * @param branchCount   本地分支数（获取失败为 null）
 * @param remotes       远程列表（按名称去重）
 */
public record GitMetadata(
        String path,
        long detectedAt,
        String currentBranch,
        Integer commitCount,
        Integer branchCount,
        List<GitRemote> remotes
) {
    public GitMetadata {
        remotes = remotes == null ? List.of() : List.copyOf(remotes);
    }

    /**
     * 除采集时间外的内容是否一致（用于判断刷新后是否需要通知观察者）。
     */
    public boolean sameFactsAs(GitMetadata other) {
        return other != null
                && Objects.equals(path, other.path)
                && Objects.equals(currentBranch, other.currentBranch)
                && Objects.equals(commitCount, other.commitCount)
                && Objects.equals(branchCount, other.branchCount)
                && Objects.equals(remotes, other.remotes);
    }
}
