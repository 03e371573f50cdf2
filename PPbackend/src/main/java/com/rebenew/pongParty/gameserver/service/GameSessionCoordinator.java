package com.rebenew.pongParty.gameserver.service;

import com.rebenew.pongParty.gameserver.config.GameProperties;
import com.rebenew.pongParty.gameserver.core.GameRoom;
import com.rebenew.pongParty.gameserver.core.JoinResult;
import com.rebenew.pongParty.gameserver.core.LeaveResult;
import com.rebenew.pongParty.gameserver.core.RoomRegistry;
import com.rebenew.pongParty.gameserver.model.Direction;
import com.rebenew.pongParty.gameserver.model.GameState;
import com.rebenew.pongParty.gameserver.model.PaddleSide;
import com.rebenew.pongParty.gameserver.model.RoomResponse;
import com.rebenew.pongParty.gameserver.model.RoomState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Lógica por conexión: join → sala → pala, relay de movimientos y limpieza al desconectar.
 * <p>
 * Nunca guarda referencias a una sala entre mensajes: cada operación vuelve a
 * resolverla en el {@link RoomRegistry}, porque la sala puede haber sido destruida
 * mientras tanto.
 */
@Service
public class GameSessionCoordinator {
    private static final Logger logger = LoggerFactory.getLogger(GameSessionCoordinator.class);

    private static final Pattern ROOM_ID_PATTERN = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private final RoomRegistry registry;
    private final GameProperties properties;

    public GameSessionCoordinator(RoomRegistry registry, GameProperties properties) {
        this.registry = registry;
        this.properties = properties;
    }

    // ==================== OPERACIONES DE JUGADOR ====================

    /**
     * Une la conexión a la sala pedida o, si no pide ninguna, a la sala por defecto.
     *
     * @throws IllegalArgumentException si el roomId pedido no es válido
     */
    public JoinResult join(String connectionId, String requestedRoomId) {
        String roomId = resolveRoomId(requestedRoomId);
        JoinResult result = registry.join(connectionId, roomId);

        if (result.alreadyJoined()) {
            logger.debug("Join repetido de {} ignorado (sala {})", connectionId, result.roomId());
        } else if (result.isSpectator()) {
            logger.info("👀 {} unido a sala {} sin pala (sala completa)", connectionId, roomId);
        } else {
            logger.info("👤 {} unido a sala {} con pala {}", connectionId, roomId, result.side());
        }
        return result;
    }

    public Optional<PaddleSide> movePaddle(String connectionId, Direction direction) {
        Optional<GameRoom> room = registry.findRoomOf(connectionId);
        if (room.isEmpty()) {
            logger.debug("paddleMove de {} sin sala, ignorado", connectionId);
            return Optional.empty();
        }
        PaddleSide side = room.get().movePaddle(connectionId, direction);
        if (side == null) {
            logger.debug("paddleMove de {} sin pala en sala {}, ignorado", connectionId, room.get().getRoomId());
        }
        return Optional.ofNullable(side);
    }

    // Idempotente: una conexión desconocida no es un error
    public Optional<LeaveResult> disconnect(String connectionId) {
        Optional<LeaveResult> result = registry.leave(connectionId);
        result.ifPresent(r -> logger.info("🔌 {} salió de sala {} (pala: {}, partida detenida: {}, sala vacía: {})",
                connectionId, r.roomId(), r.vacatedSide(), r.matchStopped(), r.roomEmpty()));
        return result;
    }

    // ==================== CONSULTAS ====================

    public List<RoomResponse> listRooms() {
        return registry.getAllRooms().stream()
                .map(GameRoom::toRoomResponse)
                .sorted(Comparator.comparing(RoomResponse::getRoomId))
                .collect(Collectors.toList());
    }

    public Optional<RoomResponse> getRoom(String roomId) {
        return registry.getRoom(roomId).map(GameRoom::toRoomResponse);
    }

    public Optional<GameState> getRoomSnapshot(String roomId) {
        return registry.getRoom(roomId).map(GameRoom::snapshot);
    }

    public Map<String, Object> getServiceStats() {
        List<GameRoom> rooms = registry.getAllRooms();
        Map<String, Object> stats = new HashMap<>();
        stats.put("totalRooms", rooms.size());
        stats.put("activeRooms", rooms.stream().filter(r -> r.getRoomState() == RoomState.ACTIVE).count());
        stats.put("waitingRooms", rooms.stream().filter(r -> r.getRoomState() == RoomState.WAITING).count());
        stats.put("totalConnections", registry.getConnectionCount());
        stats.put("totalTicks", rooms.stream().mapToLong(GameRoom::getTicks).sum());
        stats.put("tickRateHz", properties.getGame().getTickRateHz());
        stats.put("timestamp", System.currentTimeMillis());
        return stats;
    }

    // ==================== VALIDACIONES ====================

    String resolveRoomId(String requestedRoomId) {
        if (requestedRoomId == null || requestedRoomId.trim().isEmpty()) {
            return properties.getRooms().getDefaultRoomId();
        }
        String trimmed = requestedRoomId.trim();
        if (!ROOM_ID_PATTERN.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("roomId inválido: " + requestedRoomId);
        }
        return trimmed;
    }
}
