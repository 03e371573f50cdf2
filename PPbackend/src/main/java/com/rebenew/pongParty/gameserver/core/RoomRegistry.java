package com.rebenew.pongParty.gameserver.core;

import com.rebenew.pongParty.gameserver.config.GameProperties;
import com.rebenew.pongParty.gameserver.engine.PhysicsEngine;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

// Mapa roomId -> sala y el índice inverso conexión -> roomId.

@Component
public class RoomRegistry {
    private static final Logger logger = LoggerFactory.getLogger(RoomRegistry.class);

    // ============================
    // ESTADO PRINCIPAL
    // ============================
    private final ConcurrentHashMap<String, GameRoom> rooms = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> connectionRooms = new ConcurrentHashMap<>();

    // Serializa altas/bajas en ambos mapas. Orden de locks: registryLock -> sala.
    private final Object registryLock = new Object();
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    private final GameProperties.Game game;
    private final PhysicsEngine physics;
    private final BroadcastGateway gateway;
    private final Supplier<Random> randomSupplier;

    @Autowired
    public RoomRegistry(GameProperties properties, PhysicsEngine physics, BroadcastGateway gateway) {
        this(properties, physics, gateway, Random::new);
    }

    RoomRegistry(GameProperties properties, PhysicsEngine physics, BroadcastGateway gateway,
                 Supplier<Random> randomSupplier) {
        this.game = properties.getGame();
        this.physics = physics;
        this.gateway = gateway;
        this.randomSupplier = randomSupplier;
        logger.info("RoomRegistry inicializado");
    }

    // ====================
    // ALTAS / BAJAS
    // ====================

    /**
     * Crea la sala si no existe y une la conexión. La lista de jugadores de la sala y
     * el índice inverso se actualizan dentro del mismo lock de sala.
     */
    public JoinResult join(String connectionId, String roomId) {
        validateId(connectionId, "connectionId");
        validateId(roomId, "roomId");

        synchronized (registryLock) {
            if (shuttingDown.get()) {
                throw new IllegalStateException("RoomRegistry detenido, join rechazado: " + connectionId);
            }
            String current = connectionRooms.get(connectionId);
            if (current != null) {
                logger.debug("Join duplicado ignorado: {} ya está en {}", connectionId, current);
                return JoinResult.alreadyJoined(current);
            }

            GameRoom room = rooms.get(roomId);
            if (room == null) {
                room = new GameRoom(roomId, game, physics, gateway, randomSupplier.get());
                rooms.put(roomId, room);
                logger.info("🏟️ Sala creada: {}", roomId);
            }

            synchronized (room) {
                JoinResult result = room.join(connectionId);
                connectionRooms.put(connectionId, roomId);
                return result;
            }
        }
    }

    /**
     * Saca la conexión de su sala. Si la sala queda vacía se elimina del registro en
     * la misma sección crítica. Idempotente.
     */
    public Optional<LeaveResult> leave(String connectionId) {
        if (connectionId == null)
            return Optional.empty();

        synchronized (registryLock) {
            String roomId = connectionRooms.get(connectionId);
            if (roomId == null)
                return Optional.empty();

            GameRoom room = rooms.get(roomId);
            if (room == null) {
                // índice huérfano, no debería ocurrir
                connectionRooms.remove(connectionId);
                logger.warn("Índice inverso apuntaba a sala inexistente: {} -> {}", connectionId, roomId);
                return Optional.empty();
            }

            LeaveResult result;
            synchronized (room) {
                result = room.leave(connectionId);
                connectionRooms.remove(connectionId);
            }

            if (result.roomEmpty()) {
                rooms.remove(roomId);
                room.destroy();
                logger.info("🗑️ Sala eliminada (sin jugadores): {}", roomId);
            }
            return Optional.of(result);
        }
    }

    // ====================
    // CONSULTAS
    // ====================

    public Optional<GameRoom> findRoomOf(String connectionId) {
        if (connectionId == null)
            return Optional.empty();
        String roomId = connectionRooms.get(connectionId);
        return roomId == null ? Optional.empty() : getRoom(roomId);
    }

    public Optional<GameRoom> getRoom(String roomId) {
        if (roomId == null)
            return Optional.empty();
        return Optional.ofNullable(rooms.get(roomId));
    }

    public boolean roomExists(String roomId) {
        return roomId != null && rooms.containsKey(roomId);
    }

    // Copia defensiva
    public List<GameRoom> getAllRooms() {
        return new ArrayList<>(rooms.values());
    }

    public int getRoomCount() {
        return rooms.size();
    }

    public int getConnectionCount() {
        return connectionRooms.size();
    }

    // ==================== VALIDACIONES ====================

    private void validateId(String value, String name) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(name + " no puede ser nulo o vacío");
        }
    }

    // ==================== CIERRE ====================

    @PreDestroy
    public void shutdown() {
        if (shuttingDown.compareAndSet(false, true)) {
            logger.info("Shutting down RoomRegistry...");
            synchronized (registryLock) {
                rooms.values().forEach(GameRoom::destroy);
                rooms.clear();
                connectionRooms.clear();
            }
        }
    }
}
