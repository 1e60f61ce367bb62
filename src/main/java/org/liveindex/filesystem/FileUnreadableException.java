package org.liveindex.filesystem;

/**
 * 文件存在但因权限不足或文件系统不支持而无法读取，对应 HTTP 403。
 */
public class FileUnreadableException extends RuntimeException {

    public FileUnreadableException(String path, Throwable cause) {
        super("当前文件系统上无法读取该文件：" + path, cause);
    }
}
