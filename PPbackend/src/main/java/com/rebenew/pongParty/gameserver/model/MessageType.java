package com.rebenew.pongParty.gameserver.model;

/**
 * Tipos de mensaje del protocolo WebSocket.
 */
public final class MessageType {
    // Entrantes
    public static final String JOIN_GAME = "joinGame";
    public static final String PADDLE_MOVE = "paddleMove";
    public static final String HEARTBEAT = "heartbeat";

    // Salientes
    public static final String PADDLE_ASSIGNMENT = "paddleAssignment";
    public static final String GAME_STATE = "gameState";
    public static final String PADDLE_UPDATE = "paddleUpdate";
    public static final String GAME_START = "gameStart";
    public static final String PLAYER_DISCONNECTED = "playerDisconnected";
    public static final String ACK = "ack";
    public static final String ERROR = "error";

    private MessageType() {
    }
}
