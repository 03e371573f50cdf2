package com.rebenew.pongParty.gameserver.service;

import com.rebenew.pongParty.gameserver.config.GameProperties;
import com.rebenew.pongParty.gameserver.core.JoinResult;
import com.rebenew.pongParty.gameserver.core.LeaveResult;
import com.rebenew.pongParty.gameserver.core.RecordingBroadcastGateway;
import com.rebenew.pongParty.gameserver.core.RoomRegistry;
import com.rebenew.pongParty.gameserver.engine.PhysicsEngine;
import com.rebenew.pongParty.gameserver.model.Direction;
import com.rebenew.pongParty.gameserver.model.GameState;
import com.rebenew.pongParty.gameserver.model.PaddleSide;
import com.rebenew.pongParty.gameserver.model.RoomResponse;
import com.rebenew.pongParty.gameserver.model.RoomState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GameSessionCoordinatorTest {

    private RecordingBroadcastGateway gateway;
    private RoomRegistry registry;
    private GameSessionCoordinator coordinator;

    @BeforeEach
    void setUp() {
        GameProperties properties = new GameProperties();
        properties.getGame().setTickRateHz(1);
        gateway = new RecordingBroadcastGateway();
        registry = new RoomRegistry(properties, new PhysicsEngine(properties), gateway);
        coordinator = new GameSessionCoordinator(registry, properties);
    }

    @AfterEach
    void tearDown() {
        registry.shutdown();
    }

    @Test
    void twoPlayersJoinDefaultRoomAndStartMatch() {
        JoinResult first = coordinator.join("A", null);
        JoinResult second = coordinator.join("B", "");

        assertThat(first.roomId()).isEqualTo("room1");
        assertThat(first.side()).isEqualTo(PaddleSide.LEFT);
        assertThat(second.roomId()).isEqualTo("room1");
        assertThat(second.side()).isEqualTo(PaddleSide.RIGHT);
        assertThat(second.matchStarted()).isTrue();

        RoomResponse room = coordinator.getRoom("room1").orElseThrow();
        assertThat(room.getState()).isEqualTo(RoomState.ACTIVE);
        assertThat(room.getLeftPlayerId()).isEqualTo("A");
        assertThat(room.getRightPlayerId()).isEqualTo("B");

        assertThat(gateway.typesFor("A")).contains("paddleAssignment", "gameStart", "gameState");
        assertThat(gateway.typesFor("B")).contains("paddleAssignment", "gameStart", "gameState");
    }

    @Test
    void explicitRoomIdIsTrimmedAndUsed() {
        JoinResult result = coordinator.join("A", "  arena_2 ");

        assertThat(result.roomId()).isEqualTo("arena_2");
        assertThat(coordinator.getRoom("arena_2")).isPresent();
        assertThat(coordinator.getRoom("room1")).isEmpty();
    }

    @Test
    void invalidRoomIdIsRejected() {
        assertThatThrownBy(() -> coordinator.join("A", "sala con espacios"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> coordinator.join("A", "x".repeat(65)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(coordinator.listRooms()).isEmpty();
    }

    @Test
    void resolveRoomIdFallsBackToDefault() {
        assertThat(coordinator.resolveRoomId(null)).isEqualTo("room1");
        assertThat(coordinator.resolveRoomId("   ")).isEqualTo("room1");
        assertThat(coordinator.resolveRoomId("r-9")).isEqualTo("r-9");
    }

    @Test
    void moveIsRelayedForPaddleOwner() {
        coordinator.join("A", null);
        coordinator.join("B", null);
        gateway.clear();

        Optional<PaddleSide> side = coordinator.movePaddle("B", Direction.DOWN);

        assertThat(side).contains(PaddleSide.RIGHT);
        GameState state = coordinator.getRoomSnapshot("room1").orElseThrow();
        assertThat(state.getPaddles().getRight().getY()).isEqualTo(165.0);
        assertThat(gateway.typesFor("A")).containsExactly("paddleUpdate");
        assertThat(gateway.typesFor("B")).containsExactly("paddleUpdate");
    }

    @Test
    void moveFromUnknownConnectionIsIgnored() {
        coordinator.join("A", null);
        gateway.clear();

        assertThat(coordinator.movePaddle("ghost", Direction.UP)).isEmpty();
        assertThat(gateway.getDeliveries()).isEmpty();
    }

    @Test
    void moveFromSpectatorIsIgnored() {
        coordinator.join("A", null);
        coordinator.join("B", null);
        coordinator.join("C", null);
        gateway.clear();

        assertThat(coordinator.movePaddle("C", Direction.UP)).isEmpty();
        assertThat(gateway.getDeliveries()).isEmpty();
    }

    @Test
    void disconnectDuringMatchNotifiesRemainingPlayer() {
        coordinator.join("A", null);
        coordinator.join("B", null);
        gateway.clear();

        Optional<LeaveResult> result = coordinator.disconnect("A");

        assertThat(result).isPresent();
        assertThat(result.get().vacatedSide()).isEqualTo(PaddleSide.LEFT);
        assertThat(result.get().matchStopped()).isTrue();
        assertThat(gateway.typesFor("B")).containsExactly("playerDisconnected");
        assertThat(coordinator.getRoom("room1").orElseThrow().getState()).isEqualTo(RoomState.WAITING);
    }

    @Test
    void lastDisconnectRemovesRoom() {
        coordinator.join("A", null);

        assertThat(coordinator.disconnect("A")).isPresent();
        assertThat(coordinator.disconnect("A")).isEmpty();
        assertThat(coordinator.listRooms()).isEmpty();
        assertThat(coordinator.getRoomSnapshot("room1")).isEmpty();
    }

    @Test
    void listRoomsIsSortedById() {
        coordinator.join("A", "zeta");
        coordinator.join("B", "alpha");
        coordinator.join("C", "mid");

        List<RoomResponse> rooms = coordinator.listRooms();

        assertThat(rooms).extracting(RoomResponse::getRoomId).containsExactly("alpha", "mid", "zeta");
    }

    @Test
    void serviceStatsCountRoomsByState() {
        coordinator.join("A", "r1");
        coordinator.join("B", "r1");
        coordinator.join("C", "r2");

        Map<String, Object> stats = coordinator.getServiceStats();

        assertThat(stats.get("totalRooms")).isEqualTo(2);
        assertThat(stats.get("activeRooms")).isEqualTo(1L);
        assertThat(stats.get("waitingRooms")).isEqualTo(1L);
        assertThat(stats.get("totalConnections")).isEqualTo(3);
        assertThat(stats.get("tickRateHz")).isEqualTo(1);
        assertThat(stats).containsKeys("totalTicks", "timestamp");
    }
}
