package se.escrow_be.configuration;

import lombok.AllArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@AllArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final RoomWebSocketHandler roomWebSocketHandler;
    private final CorsConfig corsConfig;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        // /api/ws/{room_phrase}/{user_id}
        registry.addHandler(roomWebSocketHandler, "/api/ws/*/*")
                .setAllowedOrigins(corsConfig.allowedOriginList().toArray(String[]::new));
    }
}
