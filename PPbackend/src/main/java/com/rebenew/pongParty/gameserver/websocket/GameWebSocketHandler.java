package com.rebenew.pongParty.gameserver.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebenew.pongParty.gameserver.model.Direction;
import com.rebenew.pongParty.gameserver.model.GameMsg;
import com.rebenew.pongParty.gameserver.model.MessageType;
import com.rebenew.pongParty.gameserver.service.GameSessionCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Adaptador de transporte: cada WebSocketSession es una conexión, identificada por su id.
 * Traduce frames JSON a operaciones del {@link GameSessionCoordinator}.
 */
@Component
public class GameWebSocketHandler extends TextWebSocketHandler {
    private static final Logger logger = LoggerFactory.getLogger(GameWebSocketHandler.class);

    private final GameSessionCoordinator coordinator;
    private final WebSocketBroadcastGateway gateway;
    private final ObjectMapper objectMapper;

    public GameWebSocketHandler(GameSessionCoordinator coordinator, WebSocketBroadcastGateway gateway,
                                ObjectMapper objectMapper) {
        this.coordinator = coordinator;
        this.gateway = gateway;
        this.objectMapper = objectMapper;
        logger.info("✅ GameWebSocketHandler inicializado");
    }

    // ==================== CICLO DE VIDA WEBSOCKET ====================

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) {
        gateway.register(session);
        logger.info("🔄 Nueva conexión WebSocket: {}", session.getId());
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        GameMsg msg;
        try {
            msg = objectMapper.readValue(message.getPayload(), GameMsg.class);
        } catch (Exception e) {
            logger.warn("❌ Error parseando mensaje de {}: {}", session.getId(), e.getMessage());
            gateway.send(session.getId(), GameMsg.error("invalid_message", "Mensaje no es JSON válido", null));
            return;
        }

        if (msg.getType() == null) {
            gateway.send(session.getId(), GameMsg.error("missing_type", "Falta el campo type", msg.getCorrelationId()));
            return;
        }
        processMessage(session, msg);
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        coordinator.disconnect(session.getId());
        gateway.unregister(session.getId());
        logger.info("🔌 Conexión cerrada: {} ({})", session.getId(), status);
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        logger.error("🚨 Error de transporte WebSocket: {} - {}", session.getId(), exception.getMessage());
    }

    // ==================== PROCESAMIENTO PRINCIPAL ====================

    private void processMessage(WebSocketSession session, GameMsg msg) {
        String connectionId = session.getId();
        try {
            switch (msg.getType()) {
                case MessageType.JOIN_GAME:
                    handleJoin(connectionId, msg);
                    break;
                case MessageType.PADDLE_MOVE:
                    handlePaddleMove(connectionId, msg);
                    break;
                case MessageType.HEARTBEAT:
                    gateway.send(connectionId, GameMsg.ack(true, "heartbeat_received", msg.getCorrelationId()));
                    break;
                default:
                    logger.warn("❓ Tipo de mensaje desconocido de {}: {}", connectionId, msg.getType());
                    gateway.send(connectionId, GameMsg.error("unknown_message_type",
                            "Tipo desconocido: " + msg.getType(), msg.getCorrelationId()));
            }
        } catch (IllegalArgumentException e) {
            logger.warn("❌ Mensaje {} inválido de {}: {}", msg.getType(), connectionId, e.getMessage());
            gateway.send(connectionId, GameMsg.error("invalid_request", e.getMessage(), msg.getCorrelationId()));
        }
    }

    private void handleJoin(String connectionId, GameMsg msg) {
        String roomId = msg.getRoomId();
        if (roomId == null && msg.getDataAsMap() != null) {
            roomId = msg.getStringData("roomId");
        }
        coordinator.join(connectionId, roomId);
    }

    private void handlePaddleMove(String connectionId, GameMsg msg) {
        Direction direction = Direction.fromWire(msg.getStringData("direction"));
        if (direction == null) {
            gateway.send(connectionId, GameMsg.error("invalid_direction",
                    "direction debe ser 'up' o 'down'", msg.getCorrelationId()));
            return;
        }
        coordinator.movePaddle(connectionId, direction);
    }
}
