package org.liveindex.filesystem;

/**
 * 请求的条目不在索引中（或已从磁盘消失）。与参数错误区分，对应 HTTP 404。
 */
public class EntryNotFoundException extends RuntimeException {

    private final String path;

    public EntryNotFoundException(String path) {
        super("条目不存在：" + path);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
