package com.keyaccess.presentation.config;

import com.keyaccess.presentation.websocket.AccessWebSocketHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import java.util.Arrays;

/**
 * Canal /ws/keybox del panel del personal. Los orígenes admitidos se leen de
 * keybox.websocket.allowed-origins (lista separada por comas).
 */
@Configuration
@EnableWebSocket
@Slf4j
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String ENDPOINT = "/ws/keybox";

    private final AccessWebSocketHandler accessWebSocketHandler;
    private final String[] allowedOrigins;

    public WebSocketConfig(
            AccessWebSocketHandler accessWebSocketHandler,
            @Value("${keybox.websocket.allowed-origins:*}") String[] allowedOrigins) {
        this.accessWebSocketHandler = accessWebSocketHandler;
        this.allowedOrigins = Arrays.stream(allowedOrigins)
                .map(String::trim)
                .filter(origin -> !origin.isEmpty())
                .toArray(String[]::new);
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        log.info("Panel en vivo en {} (orígenes: {})", ENDPOINT, String.join(", ", allowedOrigins));
        registry.addHandler(accessWebSocketHandler, ENDPOINT)
                .setAllowedOrigins(allowedOrigins);
    }
}
