package org.liveindex.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.liveindex.filesystem.index.ChangeBroadcaster;
import org.liveindex.filesystem.index.ChangeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 通过 WebSocket 向所有已连接客户端推送索引变更（JSON）。
 * <p>
 * 推送是“尽力而为”：发送缓冲区满时丢弃消息，已关闭或出错的会话直接移除，发布方永远不会被某个慢客户端阻塞。
 */
@Component
public class WebSocketChangeBroadcaster extends TextWebSocketHandler implements ChangeBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(WebSocketChangeBroadcaster.class);

    static final int SEND_TIME_LIMIT_MS = 5_000;
    static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final ObjectMapper objectMapper;
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    public WebSocketChangeBroadcaster(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        sessions.put(session.getId(), new ConcurrentWebSocketSessionDecorator(
                session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT, ConcurrentWebSocketSessionDecorator.OverflowStrategy.DROP));
        log.debug("WebSocket 已连接：{}（当前 {} 个）", session.getId(), sessions.size());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session.getId());
        log.debug("WebSocket 已断开：{}（{}）", session.getId(), status);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        sessions.remove(session.getId());
        log.debug("WebSocket 传输错误：{}（{}）", session.getId(), exception.getMessage());
    }

    @Override
    public void publish(ChangeEvent event) {
        if (sessions.isEmpty()) {
            return;
        }
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.warn("序列化变更通知失败：{}", e.getOriginalMessage());
            return;
        }
        TextMessage message = new TextMessage(payload);
        for (Map.Entry<String, WebSocketSession> e : sessions.entrySet()) {
            WebSocketSession session = e.getValue();
            if (!session.isOpen()) {
                sessions.remove(e.getKey());
                continue;
            }
            try {
                session.sendMessage(message);
            } catch (IOException | RuntimeException ex) {
                sessions.remove(e.getKey());
                log.debug("推送失败，移除会话：{}（{}）", e.getKey(), ex.getMessage());
            }
        }
    }

    public int sessionCount() {
        return sessions.size();
    }
}
