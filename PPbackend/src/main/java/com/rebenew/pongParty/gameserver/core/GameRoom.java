package com.rebenew.pongParty.gameserver.core;

import com.rebenew.pongParty.gameserver.config.GameProperties;
import com.rebenew.pongParty.gameserver.engine.PhysicsEngine;
import com.rebenew.pongParty.gameserver.engine.TickOutcome;
import com.rebenew.pongParty.gameserver.model.Direction;
import com.rebenew.pongParty.gameserver.model.GameMsg;
import com.rebenew.pongParty.gameserver.model.GameState;
import com.rebenew.pongParty.gameserver.model.PaddleSide;
import com.rebenew.pongParty.gameserver.model.RoomResponse;
import com.rebenew.pongParty.gameserver.model.RoomState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Una partida aislada: dueña exclusiva de su {@link GameState} y de su loop de ticks.
 * <p>
 * Todas las lecturas y escrituras del estado (join, move, leave y el propio tick)
 * pasan por el monitor de la sala. Cada sala tiene su propio hilo de ticks, así
 * que salas distintas simulan en paralelo sin compartir locks.
 * <p>
 * Ciclo de vida: WAITING (falta una pala) → ACTIVE (ambas palas, ticks) →
 * WAITING (se fue un jugador) → TERMINATED (sin jugadores).
 */
public class GameRoom {
    private static final Logger logger = LoggerFactory.getLogger(GameRoom.class);

    // IDENTIFICACIÓN
    private final String roomId;
    private final Instant createdAt;
    private volatile Instant lastActivityAt;

    // SIMULACIÓN
    private final GameProperties.Game game;
    private final PhysicsEngine physics;
    private final Random random;
    private final GameState state;
    private volatile RoomState roomState = RoomState.WAITING;
    private volatile long ticks = 0L;

    // LOOP
    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;
    private long loopGeneration = 0L;

    // SALIDA
    private final BroadcastGateway gateway;

    public GameRoom(String roomId, GameProperties.Game game, PhysicsEngine physics,
                    BroadcastGateway gateway, Random random) {
        this.roomId = roomId;
        this.game = game;
        this.physics = physics;
        this.gateway = gateway;
        this.random = random;
        this.state = physics.newGameState(random);
        this.createdAt = Instant.now();
        this.lastActivityAt = this.createdAt;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            t.setName("room-" + roomId + "-tick");
            return t;
        });
    }

    // ========== JUGADORES ==========

    /**
     * Registra la conexión y le asigna la primera pala libre (izquierda antes que derecha).
     * El joiner recibe paddleAssignment y luego el gameState completo; si con él se llenan
     * ambas palas, arranca el loop y se emite gameStart a toda la sala.
     */
    public synchronized JoinResult join(String connectionId) {
        if (roomState == RoomState.TERMINATED) {
            throw new IllegalStateException("Join sobre sala destruida: " + roomId);
        }
        if (state.getPlayers().contains(connectionId)) {
            return JoinResult.alreadyJoined(roomId);
        }

        state.getPlayers().add(connectionId);
        touch();

        PaddleSide side = null;
        if (!state.getPaddles().getLeft().isOwned()) {
            side = PaddleSide.LEFT;
        } else if (!state.getPaddles().getRight().isOwned()) {
            side = PaddleSide.RIGHT;
        }

        if (side != null) {
            state.getPaddles().get(side).setPlayerId(connectionId);
            gateway.send(connectionId, GameMsg.paddleAssignment(roomId, side));
        } else {
            logger.debug("Sala {} llena, {} entra como espectador", roomId, connectionId);
        }

        boolean started = false;
        if (roomState == RoomState.WAITING && state.bothSlotsOwned()) {
            state.setGameActive(true);
            roomState = RoomState.ACTIVE;
            startLoop();
            gateway.broadcast(playersCopy(), GameMsg.gameStart(roomId));
            started = true;
            logger.info("🏓 Partida iniciada en sala {} ({} vs {})", roomId,
                    state.getPaddles().getLeft().getPlayerId(), state.getPaddles().getRight().getPlayerId());
        }

        gateway.send(connectionId, GameMsg.gameState(roomId, state.snapshot()));
        return new JoinResult(roomId, side, false, started);
    }

    /**
     * Mueve la pala de la conexión un paso y emite paddleUpdate fuera del ciclo de ticks.
     *
     * @return lado movido, o null si la conexión no tiene pala en esta sala
     */
    public synchronized PaddleSide movePaddle(String connectionId, Direction direction) {
        if (roomState == RoomState.TERMINATED || direction == null)
            return null;
        PaddleSide side = state.sideOwnedBy(connectionId);
        if (side == null)
            return null;

        GameState.Paddle paddle = state.getPaddles().get(side);
        double step = direction == Direction.UP ? -game.getPaddleStep() : game.getPaddleStep();
        paddle.setY(physics.clampPaddle(paddle.getY() + step));
        touch();

        gateway.broadcast(playersCopy(), GameMsg.paddleUpdate(roomId, side, paddle.getY()));
        return side;
    }

    /**
     * Quita la conexión de la sala y libera su pala. Si era dueña de una pala en una
     * partida activa, el loop se detiene antes de salir de este método y se avisa con
     * playerDisconnected. Si la sala queda vacía pasa a TERMINATED.
     */
    public synchronized LeaveResult leave(String connectionId) {
        if (!state.getPlayers().remove(connectionId)) {
            return LeaveResult.notMember(roomId);
        }
        touch();

        PaddleSide vacated = state.sideOwnedBy(connectionId);
        if (vacated != null) {
            state.getPaddles().get(vacated).setPlayerId(null);
        }

        if (state.getPlayers().isEmpty()) {
            stopLoop();
            state.setGameActive(false);
            roomState = RoomState.TERMINATED;
            return new LeaveResult(roomId, vacated, false, true);
        }

        boolean stopped = false;
        if (roomState == RoomState.ACTIVE && !state.bothSlotsOwned()) {
            stopLoop();
            state.setGameActive(false);
            roomState = RoomState.WAITING;
            gateway.broadcast(playersCopy(), GameMsg.playerDisconnected(roomId));
            stopped = true;
            logger.info("⏹️ Partida detenida en sala {}: {} abandonó la pala {}", roomId, connectionId, vacated);
        }
        return new LeaveResult(roomId, vacated, stopped, false);
    }

    // ========== LOOP DE TICKS ==========

    private void startLoop() {
        stopLoop();
        final long generation = ++loopGeneration;
        long period = game.tickPeriodMicros();
        tickTask = scheduler.scheduleAtFixedRate(() -> runScheduledTick(generation),
                period, period, TimeUnit.MICROSECONDS);
    }

    // Invalida la generación actual: un tick ya encolado no emitirá nada
    private void stopLoop() {
        loopGeneration++;
        if (tickTask != null && !tickTask.isDone()) {
            tickTask.cancel(false);
        }
        tickTask = null;
    }

    void runScheduledTick(long generation) {
        try {
            synchronized (this) {
                if (generation != loopGeneration || roomState != RoomState.ACTIVE)
                    return;
                tick();
            }
        } catch (Exception e) {
            // Una excepción aquí cancelaría el scheduleAtFixedRate sin aviso
            logger.error("💥 Error en tick de sala {}: {}", roomId, e.getMessage(), e);
        }
    }

    // Un paso de física + gameState completo a toda la sala
    synchronized void tick() {
        TickOutcome outcome = physics.advance(state, random);
        ticks++;
        if (outcome.isScore()) {
            logger.debug("Punto en sala {}: {} (marcador {}-{})", roomId, outcome,
                    state.getScore().getLeft(), state.getScore().getRight());
        }
        gateway.broadcast(playersCopy(), GameMsg.gameState(roomId, state.snapshot()));
    }

    synchronized long currentLoopGeneration() {
        return loopGeneration;
    }

    public synchronized boolean isLoopRunning() {
        return tickTask != null && !tickTask.isDone();
    }

    /**
     * Detiene el loop y libera el hilo de la sala. Lo invoca el registro al eliminarla.
     */
    public synchronized void destroy() {
        stopLoop();
        roomState = RoomState.TERMINATED;
        state.setGameActive(false);
        scheduler.shutdownNow();
    }

    // ========== CONSULTAS ==========

    public synchronized GameState snapshot() {
        return state.snapshot();
    }

    public synchronized RoomResponse toRoomResponse() {
        return new RoomResponse(roomId, roomState, state.snapshot(), ticks, createdAt, lastActivityAt);
    }

    public synchronized boolean hasPlayer(String connectionId) {
        return state.getPlayers().contains(connectionId);
    }

    public synchronized int getPlayerCount() {
        return state.getPlayers().size();
    }

    public String getRoomId() {
        return roomId;
    }

    public RoomState getRoomState() {
        return roomState;
    }

    public long getTicks() {
        return ticks;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastActivityAt() {
        return lastActivityAt;
    }

    private List<String> playersCopy() {
        return new ArrayList<>(state.getPlayers());
    }

    private void touch() {
        this.lastActivityAt = Instant.now();
    }

    @Override
    public String toString() {
        return "GameRoom{" +
                "roomId='" + roomId + '\'' +
                ", state=" + roomState +
                ", players=" + state.getPlayers() +
                ", score=" + state.getScore().getLeft() + "-" + state.getScore().getRight() +
                ", ticks=" + ticks +
                '}';
    }
}
