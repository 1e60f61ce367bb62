package org.liveindex.filesystem.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 目录节点上展示的仓库信息视图。非仓库目录只返回 {@code isRepo=false}。
 *
 * @param isRepo        是否为仓库根目录
 * @param detectedAt    采集时间
 * @param currentBranch 当前分支 / 短 commit id
 * @param commitCount   提交总数
 * @param branchCount   分支数
 * @param remoteCount   远程数量
 * @param isLocalOnly   是否没有任何远程
 * @param remotes       远程列表
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GitInfo(
        @JsonProperty("isRepo") boolean isRepo,
        Long detectedAt,
        String currentBranch,
        Integer commitCount,
        Integer branchCount,
        Integer remoteCount,
        @JsonProperty("isLocalOnly") Boolean isLocalOnly,
        List<GitRemote> remotes
) {
    private static final GitInfo NOT_A_REPOSITORY = new GitInfo(false, null, null, null, null, null, null, null);

    public static GitInfo notARepository() {
        return NOT_A_REPOSITORY;
    }

    public static GitInfo of(GitMetadata metadata) {
        if (metadata == null) {
            return NOT_A_REPOSITORY;
        }
        int remoteCount = metadata.remotes().size();
        return new GitInfo(
                true,
                metadata.detectedAt(),
                metadata.currentBranch(),
                metadata.commitCount(),
                metadata.branchCount(),
                remoteCount,
                remoteCount == 0,
                metadata.remotes()
        );
    }
}
