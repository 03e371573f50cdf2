package com.rebenew.pongParty.gameserver.model;

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.List;

/**
 * DTO para respuestas API - solo lo que necesita un panel de administración
 */

@Getter
@Setter
public class RoomResponse {
    private String roomId;
    private RoomState state;
    private List<String> players;
    private String leftPlayerId;
    private String rightPlayerId;
    private int scoreLeft;
    private int scoreRight;
    private long ticks;
    private Instant createdAt;
    private Instant lastActivityAt;

    public RoomResponse(String roomId, RoomState state, GameState snapshot, long ticks,
                        Instant createdAt, Instant lastActivityAt) {
        this.roomId = roomId;
        this.state = state;
        this.players = snapshot.getPlayers();
        this.leftPlayerId = snapshot.getPaddles().getLeft().getPlayerId();
        this.rightPlayerId = snapshot.getPaddles().getRight().getPlayerId();
        this.scoreLeft = snapshot.getScore().getLeft();
        this.scoreRight = snapshot.getScore().getRight();
        this.ticks = ticks;
        this.createdAt = createdAt;
        this.lastActivityAt = lastActivityAt;
    }
}
