package org.liveindex.web;

import org.liveindex.filesystem.IndexProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * 注册变更推送通道 {@code /ws}。
 */
@Configuration(proxyBeanMethods = false)
@EnableWebSocket
public class WebSocketConfiguration implements WebSocketConfigurer {

    private final WebSocketChangeBroadcaster broadcaster;
    private final IndexProperties properties;

    public WebSocketConfiguration(WebSocketChangeBroadcaster broadcaster, IndexProperties properties) {
        this.broadcaster = broadcaster;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(broadcaster, "/ws")
                .setAllowedOriginPatterns(properties.getWebsocketAllowedOrigins().toArray(String[]::new));
    }
}
