package org.liveindex.filesystem.watch;

import java.nio.file.Path;

/**
 * 变更源产生的文件系统事件。
 *
 * @param kind  事件类型
 * @param path  绝对路径（{@link Kind#OVERFLOW} 以及部分错误事件为 null）
 * @param error 错误原因（仅 {@link Kind#ERROR}）
 */
public record FileChangeEvent(Kind kind, Path path, Throwable error) {

    public enum Kind {
        ADD_FILE,
        CHANGE_FILE,
        REMOVE_FILE,
        ADD_DIRECTORY,
        REMOVE_DIRECTORY,
        ERROR,
        /**
         * 事件丢失（例如内核队列溢出），需要全量对账。
         */
        OVERFLOW
    }

    public static FileChangeEvent of(Kind kind, Path path) {
        return new FileChangeEvent(kind, path, null);
    }

    public static FileChangeEvent error(Path path, Throwable error) {
        return new FileChangeEvent(Kind.ERROR, path, error);
    }

    public static FileChangeEvent overflow() {
        return new FileChangeEvent(Kind.OVERFLOW, null, null);
    }
}
