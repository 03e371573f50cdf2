package com.rebenew.pongParty.gameserver.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;
import lombok.Setter;

import java.util.Map;

/**
 * Mensaje WebSocket unificado. El payload va siempre en 'data'.
 */
@Getter
@Setter
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class GameMsg {
    private String type;
    private String roomId;
    private String correlationId;
    private Long timestamp;
    private Object data;

    // ==================== CONSTRUCTORES ESTÁTICOS ====================

    public static GameMsg paddleAssignment(String roomId, PaddleSide side) {
        return new GameMsg(MessageType.PADDLE_ASSIGNMENT, roomId, Map.of("side", side));
    }

    public static GameMsg gameState(String roomId, GameState snapshot) {
        return new GameMsg(MessageType.GAME_STATE, roomId, snapshot);
    }

    public static GameMsg paddleUpdate(String roomId, PaddleSide side, double y) {
        return new GameMsg(MessageType.PADDLE_UPDATE, roomId, Map.of("side", side, "y", y));
    }

    public static GameMsg gameStart(String roomId) {
        return new GameMsg(MessageType.GAME_START, roomId, null);
    }

    public static GameMsg playerDisconnected(String roomId) {
        return new GameMsg(MessageType.PLAYER_DISCONNECTED, roomId, null);
    }

    public static GameMsg ack(boolean success, String reason, String correlationId) {
        GameMsg msg = new GameMsg(MessageType.ACK, null, Map.of("success", success, "reason", reason));
        msg.setCorrelationId(correlationId);
        return msg;
    }

    public static GameMsg error(String errorCode, String message, String correlationId) {
        GameMsg msg = new GameMsg(MessageType.ERROR, null, Map.of("code", errorCode, "message", message));
        msg.setCorrelationId(correlationId);
        return msg;
    }

    private GameMsg(String type, String roomId, Object data) {
        this.type = type;
        this.roomId = roomId;
        this.data = data;
        this.timestamp = System.currentTimeMillis();
    }

    // Constructor público vacío para Jackson
    public GameMsg() {
        this.timestamp = System.currentTimeMillis();
    }

    // ==================== EXTRACCIÓN DE DATOS ====================

    @JsonIgnore
    @SuppressWarnings("unchecked")
    public Map<String, Object> getDataAsMap() {
        return data instanceof Map ? (Map<String, Object>) data : null;
    }

    /**
     * Lee una clave de 'data'. Acepta también 'data' como string plano
     * (p.ej. {"type":"paddleMove","data":"up"}), que es como emite el cliente original.
     */
    public String getStringData(String key) {
        if (data instanceof String)
            return (String) data;
        Map<String, Object> dataMap = getDataAsMap();
        Object value = dataMap != null ? dataMap.get(key) : null;
        return value != null ? value.toString() : null;
    }

    public boolean is(String messageType) {
        return messageType.equals(type);
    }

    @Override
    public String toString() {
        return String.format("GameMsg{type='%s', roomId='%s', correlationId='%s', timestamp=%d}",
                type, roomId, correlationId, timestamp);
    }
}
