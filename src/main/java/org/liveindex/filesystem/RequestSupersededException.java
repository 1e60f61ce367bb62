package org.liveindex.filesystem;

/**
 * 同一客户端针对同一资源发起了更新的请求，当前（较旧的）请求结果被丢弃，对应 HTTP 409。
 */
public class RequestSupersededException extends RuntimeException {

    public RequestSupersededException(String operation, String clientId) {
        super("请求已被同一客户端的新请求取代：" + operation + "（clientId=" + clientId + "）");
    }
}
