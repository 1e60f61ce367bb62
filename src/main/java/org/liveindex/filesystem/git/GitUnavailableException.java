package org.liveindex.filesystem.git;

/**
 * git 可执行文件不可用（不在 PATH 中或无法启动）。收到后整个采集功能在进程生命周期内停用。
 */
public class GitUnavailableException extends Exception {

    public GitUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
