package com.rebenew.pongParty.gameserver.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Constantes del tablero, de la simulación y del transporte (prefijo "pong").
 * Los valores por defecto coinciden con la geometría que usa el cliente.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "pong")
public class GameProperties {

    private Game game = new Game();
    private Rooms rooms = new Rooms();
    private Websocket websocket = new Websocket();

    @Getter
    @Setter
    public static class Game {
        private double boardWidth = 800;
        private double boardHeight = 400;
        private double paddleWidth = 10;
        private double paddleHeight = 80;
        private double ballSize = 10;
        private double paddleStep = 5;
        private double ballSpeed = 4;
        private int tickRateHz = 60;

        // Máxima coordenada y que puede tomar una pala
        public double maxPaddleY() {
            return boardHeight - paddleHeight;
        }

        public long tickPeriodMicros() {
            return 1_000_000L / tickRateHz;
        }
    }

    @Getter
    @Setter
    public static class Rooms {
        // Sala a la que entra un joinGame sin roomId
        private String defaultRoomId = "room1";
    }

    @Getter
    @Setter
    public static class Websocket {
        private String path = "/ws/pong";
        private String[] allowedOrigins = {"*"};
        // Mensajes pendientes por conexión antes de descartar los más viejos
        private int sendQueueLimit = 256;
    }

    @PostConstruct
    public void validate() {
        if (game.boardWidth <= 0 || game.boardHeight <= 0) {
            throw new IllegalStateException("El tablero debe tener dimensiones positivas");
        }
        if (game.paddleWidth <= 0 || game.paddleHeight <= 0 || game.ballSize <= 0) {
            throw new IllegalStateException("Palas y pelota deben tener tamaño positivo");
        }
        if (game.paddleHeight > game.boardHeight) {
            throw new IllegalStateException("La pala no puede ser más alta que el tablero");
        }
        if (game.ballSpeed <= 0 || game.paddleStep <= 0) {
            throw new IllegalStateException("ballSpeed y paddleStep deben ser positivos");
        }
        if (game.tickRateHz <= 0 || game.tickRateHz > 1000) {
            throw new IllegalStateException("tickRateHz fuera de rango: " + game.tickRateHz);
        }
        if (websocket.sendQueueLimit <= 0) {
            throw new IllegalStateException("sendQueueLimit debe ser positivo");
        }
        if (rooms.defaultRoomId == null || rooms.defaultRoomId.trim().isEmpty()) {
            throw new IllegalStateException("defaultRoomId no puede ser nulo o vacío");
        }
    }
}
