package com.rebenew.pongParty.gameserver.config;

import com.rebenew.pongParty.gameserver.websocket.GameWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final GameWebSocketHandler gameWebSocketHandler;
    private final GameProperties properties;

    public WebSocketConfig(GameWebSocketHandler gameWebSocketHandler, GameProperties properties) {
        this.gameWebSocketHandler = gameWebSocketHandler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(gameWebSocketHandler, properties.getWebsocket().getPath())
                .setAllowedOriginPatterns(properties.getWebsocket().getAllowedOrigins());
    }
}
