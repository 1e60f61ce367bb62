package org.liveindex.filesystem.git;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * 通过 {@link ProcessBuilder} 调用本机 git。
 * <p>
 * 说明：
 * <ul>
 *   <li>stdout/stderr 各由一个线程读取，避免缓冲区写满导致子进程阻塞。</li>
 *   <li>输出超过上限后继续读取但丢弃（同样是为了不阻塞子进程），并以失败返回。</li>
 *   <li>超时后强制结束子进程。</li>
 * </ul>
 */
public class ProcessGitCommandRunner implements GitCommandRunner {

    private final String binary;
    private final Duration timeout;
    private final long maxOutputBytes;

    public ProcessGitCommandRunner(String binary, Duration timeout, long maxOutputBytes) {
        this.binary = (binary == null || binary.isBlank()) ? "git" : binary;
        this.timeout = timeout == null ? Duration.ofSeconds(5) : timeout;
        this.maxOutputBytes = Math.max(1024, maxOutputBytes);
    }

    @Override
    public String run(Path workingDirectory, String... args) throws GitUnavailableException, GitCommandException {
        List<String> command = new ArrayList<>(args.length + 1);
        command.add(binary);
        command.addAll(Arrays.asList(args));
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workingDirectory != null) {
            if (!Files.isDirectory(workingDirectory)) {
                throw missingDirectory(workingDirectory);
            }
            pb.directory(workingDirectory.toFile());
        }
        // 避免 git 等待交互输入（例如凭据提示）
        pb.environment().put("GIT_TERMINAL_PROMPT", "0");

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            // 目录在检查之后才被删除时，错误信息与“找不到 git”相同
            if (workingDirectory != null && !Files.isDirectory(workingDirectory)) {
                throw missingDirectory(workingDirectory);
            }
            if (isExecutableMissing(e)) {
                throw new GitUnavailableException("git 可执行文件不可用：" + binary, e);
            }
            throw new GitCommandException("启动 git 失败：" + e.getMessage(), -1, false, "");
        }

        BoundedSink out = new BoundedSink(maxOutputBytes);
        BoundedSink err = new BoundedSink(64 * 1024);
        Thread outReader = drainAsync(process.getInputStream(), out, "git-stdout");
        Thread errReader = drainAsync(process.getErrorStream(), err, "git-stderr");

        boolean finished;
        try {
            finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new GitCommandException("等待 git 命令时被中断：" + String.join(" ", args), -1, false, "");
        }
        if (!finished) {
            process.destroyForcibly();
        }
        joinQuietly(outReader);
        joinQuietly(errReader);

        String stderr = err.asString();
        if (!finished) {
            throw new GitCommandException("git 命令超时（" + timeout.toMillis() + "ms）：" + String.join(" ", args), -1, true, stderr);
        }
        if (out.closedEarly()) {
            throw new GitCommandException("读取 git 输出失败：" + String.join(" ", args), -1, false, stderr);
        }
        if (out.overflowed()) {
            throw new GitCommandException("git 输出超过上限（" + maxOutputBytes + " 字节）：" + String.join(" ", args), -1, false, stderr);
        }
        int exit = process.exitValue();
        if (exit != 0) {
            throw new GitCommandException("git 命令失败（exit=" + exit + "）：" + String.join(" ", args), exit, false, stderr);
        }
        return out.asString();
    }

    private static GitCommandException missingDirectory(Path workingDirectory) {
        return new GitCommandException("git 工作目录不存在：" + workingDirectory, -1, false, "");
    }

    private static boolean isExecutableMissing(IOException e) {
        String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        return message.contains("error=2") || message.contains("no such file") || message.contains("cannot find the file");
    }

    private static Thread drainAsync(InputStream in, BoundedSink sink, String name) {
        Thread t = new Thread(() -> sink.drain(in), name);
        t.setDaemon(true);
        t.start();
        return t;
    }

    private static void joinQuietly(Thread t) {
        try {
            t.join(3000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class BoundedSink {
        private final long limit;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private volatile boolean overflowed;
        private volatile boolean closedEarly;

        private BoundedSink(long limit) {
            this.limit = limit;
        }

        void drain(InputStream in) {
            byte[] buf = new byte[8192];
            try (InputStream input = in) {
                int read;
                while ((read = input.read(buf)) >= 0) {
                    synchronized (buffer) {
                        long room = limit - buffer.size();
                        if (room <= 0) {
                            overflowed = true;
                            continue;
                        }
                        int take = (int) Math.min(room, read);
                        buffer.write(buf, 0, take);
                        if (take < read) {
                            overflowed = true;
                        }
                    }
                }
            } catch (IOException e) {
                // 子进程被强制结束时管道会被关闭，已读到的部分仍然保留
                closedEarly = true;
            }
        }

        boolean overflowed() {
            return overflowed;
        }

        boolean closedEarly() {
            return closedEarly;
        }

        String asString() {
            synchronized (buffer) {
                return buffer.toString(StandardCharsets.UTF_8);
            }
        }
    }
}
