package com.rebenew.pongParty.gameserver.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Estado autoritativo de una sala: pelota, palas, marcador y jugadores.
 * Solo lo muta la GameRoom que lo posee; hacia afuera siempre se envía un
 * {@link #snapshot()}.
 */
@Getter
@Setter
public class GameState {
    private Ball ball = new Ball();
    private Paddles paddles = new Paddles();
    private Score score = new Score();
    private boolean gameActive;
    private List<String> players = new ArrayList<>();

    @Getter
    @Setter
    public static class Ball {
        private double x;
        private double y;
        private double dx;
        private double dy;

        public Ball() {
        }

        public Ball(double x, double y, double dx, double dy) {
            this.x = x;
            this.y = y;
            this.dx = dx;
            this.dy = dy;
        }
    }

    @Getter
    @Setter
    public static class Paddle {
        private double y;
        private String playerId; // null = slot libre

        public Paddle() {
        }

        public Paddle(double y, String playerId) {
            this.y = y;
            this.playerId = playerId;
        }

        @JsonIgnore
        public boolean isOwned() {
            return playerId != null;
        }

        public boolean isOwnedBy(String connectionId) {
            return playerId != null && playerId.equals(connectionId);
        }
    }

    @Getter
    @Setter
    public static class Paddles {
        private Paddle left = new Paddle();
        private Paddle right = new Paddle();

        public Paddle get(PaddleSide side) {
            return side == PaddleSide.LEFT ? left : right;
        }
    }

    @Getter
    @Setter
    public static class Score {
        private int left;
        private int right;
    }

    // ========== CONSULTAS ==========

    public PaddleSide sideOwnedBy(String connectionId) {
        if (paddles.left.isOwnedBy(connectionId))
            return PaddleSide.LEFT;
        if (paddles.right.isOwnedBy(connectionId))
            return PaddleSide.RIGHT;
        return null;
    }

    public boolean bothSlotsOwned() {
        return paddles.left.isOwned() && paddles.right.isOwned();
    }

    // Copia profunda para serializar fuera del estado mutable
    public GameState snapshot() {
        GameState copy = new GameState();
        copy.ball = new Ball(ball.x, ball.y, ball.dx, ball.dy);
        copy.paddles.left = new Paddle(paddles.left.y, paddles.left.playerId);
        copy.paddles.right = new Paddle(paddles.right.y, paddles.right.playerId);
        copy.score.left = score.left;
        copy.score.right = score.right;
        copy.gameActive = gameActive;
        copy.players = new ArrayList<>(players);
        return copy;
    }
}
