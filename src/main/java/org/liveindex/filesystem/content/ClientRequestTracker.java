package org.liveindex.filesystem.content;

import org.liveindex.filesystem.RequestSupersededException;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 按 (客户端, 操作) 记录请求代号：同一客户端发起新请求后，旧请求即被“取代”。
 * <p>
 * 未携带客户端标识的请求不参与跟踪，永远视为最新。
 */
public class ClientRequestTracker {

    static final long UNTRACKED = 0L;

    private final ConcurrentHashMap<String, AtomicLong> generations = new ConcurrentHashMap<>();

    /**
     * 登记一个新请求。
     *
     * @return 本次请求的代号
     */
    public long begin(String clientId, String operation) {
        if (clientId == null || clientId.isBlank()) {
            return UNTRACKED;
        }
        return generations.computeIfAbsent(key(clientId, operation), k -> new AtomicLong()).incrementAndGet();
    }

    public boolean isCurrent(String clientId, String operation, long generation) {
        if (generation == UNTRACKED || clientId == null || clientId.isBlank()) {
            return true;
        }
        AtomicLong current = generations.get(key(clientId, operation));
        return current == null || current.get() == generation;
    }

    /**
     * @throws RequestSupersededException 已有更新的请求
     */
    public void ensureCurrent(String clientId, String operation, long generation) {
        if (!isCurrent(clientId, operation, generation)) {
            throw new RequestSupersededException(operation, clientId);
        }
    }

    private static String key(String clientId, String operation) {
        return clientId + "|" + operation;
    }
}
