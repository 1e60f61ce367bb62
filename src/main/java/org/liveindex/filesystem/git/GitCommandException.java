package org.liveindex.filesystem.git;

import java.util.Locale;

/**
 * 单次 git 命令失败（非 0 退出码、超时、输出超限等）。属于“单次调用”级别的失败，按“无元数据”处理，不会立即重试。
 */
public class GitCommandException extends Exception {

    private final int exitCode;
    private final boolean timedOut;
    private final String stderr;

    public GitCommandException(String message, int exitCode, boolean timedOut, String stderr) {
        super(message);
        this.exitCode = exitCode;
        this.timedOut = timedOut;
        this.stderr = stderr == null ? "" : stderr;
    }

    public int getExitCode() {
        return exitCode;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    public String getStderr() {
        return stderr;
    }

    /**
     * 是否为“不是 git 仓库”一类的错误。
     */
    public boolean isNotRepository() {
        String text = (stderr + " " + getMessage()).toLowerCase(Locale.ROOT);
        return text.contains("not a git repository") || text.contains("invalid gitfile format");
    }
}
