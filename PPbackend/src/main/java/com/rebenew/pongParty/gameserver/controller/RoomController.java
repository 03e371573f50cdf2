package com.rebenew.pongParty.gameserver.controller;

import com.rebenew.pongParty.gameserver.model.GameState;
import com.rebenew.pongParty.gameserver.model.RoomResponse;
import com.rebenew.pongParty.gameserver.service.GameSessionCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Consultas de solo lectura sobre las salas de juego.
 * Las partidas se juegan exclusivamente por WebSocket; este controlador sirve
 * para monitoreo y depuración.
 */
@RestController
@RequestMapping("/rooms")
public class RoomController {
    private static final Logger logger = LoggerFactory.getLogger(RoomController.class);

    private final GameSessionCoordinator coordinator;

    public RoomController(GameSessionCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    /**
     * Listar todas las salas vivas
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> getAllRooms() {
        logger.debug("📋 Listando todas las salas");

        List<RoomResponse> rooms = coordinator.listRooms();
        Map<String, Object> response = new HashMap<>();
        response.put("totalRooms", rooms.size());
        response.put("rooms", rooms);
        response.put("timestamp", System.currentTimeMillis());
        return ResponseEntity.ok(response);
    }

    /**
     * Obtiene metadata de una sala específica
     *
     * @param roomId ID de la sala
     * @return estado, jugadores, dueños de cada pala y marcador; 404 si no existe
     */
    @GetMapping("/{roomId}")
    public ResponseEntity<RoomResponse> getRoom(@PathVariable String roomId) {
        logger.debug("🔍 Consultando información de sala: {}", roomId);

        return coordinator.getRoom(roomId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> {
                    logger.debug("Sala inexistente: {}", roomId);
                    return ResponseEntity.notFound().build();
                });
    }

    @GetMapping("/{roomId}/state")
    public ResponseEntity<GameState> getRoomState(@PathVariable String roomId) {
        return coordinator.getRoomSnapshot(roomId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getServiceStats() {
        logger.debug("📊 Solicitando estadísticas del servicio");
        return ResponseEntity.ok(coordinator.getServiceStats());
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> healthInfo = new HashMap<>();
        healthInfo.put("status", "healthy");
        healthInfo.put("timestamp", System.currentTimeMillis());
        healthInfo.put("service", "pong-game-server");
        healthInfo.put("activeRooms", coordinator.listRooms().size());
        return ResponseEntity.ok(healthInfo);
    }
}
