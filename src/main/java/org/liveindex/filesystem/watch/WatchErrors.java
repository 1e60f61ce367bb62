package org.liveindex.filesystem.watch;

import java.util.List;
import java.util.Locale;

/**
 * 监听错误分类。
 */
public final class WatchErrors {

    private static final List<String> EXHAUSTION_MARKERS = List.of(
            "enospc",
            "emfile",
            "inotify watches",
            "too many open files"
    );

    private WatchErrors() {
    }

    /**
     * 是否为“监听资源耗尽”（inotify 监听数或文件句柄用尽），沿 cause 链逐层检查。
     */
    public static boolean isResourceExhaustion(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 10) {
            String message = current.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                for (String marker : EXHAUSTION_MARKERS) {
                    if (lower.contains(marker)) {
                        return true;
                    }
                }
            }
            current = current.getCause();
        }
        return false;
    }
}
