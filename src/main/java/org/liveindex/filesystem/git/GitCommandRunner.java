package org.liveindex.filesystem.git;

import java.nio.file.Path;

/**
 * 在指定目录下执行一条 git 命令并返回标准输出。
 * <p>
 * 实现需要保证：有超时、有输出大小上限；git 可执行文件不存在时抛 {@link GitUnavailableException}。
 */
public interface GitCommandRunner {

    String run(Path workingDirectory, String... args) throws GitUnavailableException, GitCommandException;
}
