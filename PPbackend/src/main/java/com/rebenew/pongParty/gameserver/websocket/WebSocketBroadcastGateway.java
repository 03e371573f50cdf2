package com.rebenew.pongParty.gameserver.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebenew.pongParty.gameserver.config.GameProperties;
import com.rebenew.pongParty.gameserver.core.BroadcastGateway;
import com.rebenew.pongParty.gameserver.model.GameMsg;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Collection;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entrega de mensajes sobre WebSocket.
 * <p>
 * El mensaje se serializa en el hilo que llama (normalmente el tick de la sala, con
 * el lock tomado) y se encola en la cola de salida de cada conexión. Un hilo del
 * broadcastExecutor drena cada cola en orden, de a una conexión por vez, así que
 * un cliente lento nunca frena el tick. Si la cola se llena se descartan los
 * mensajes más viejos.
 */
@Component
public class WebSocketBroadcastGateway implements BroadcastGateway {
    private static final Logger logger = LoggerFactory.getLogger(WebSocketBroadcastGateway.class);

    private final ConcurrentHashMap<String, Outbox> outboxes = new ConcurrentHashMap<>();
    private final AtomicLong droppedMessages = new AtomicLong();

    private final ObjectMapper objectMapper;
    private final Executor executor;
    private final int queueLimit;

    public WebSocketBroadcastGateway(ObjectMapper objectMapper, GameProperties properties,
                                     @Qualifier("broadcastExecutor") Executor executor) {
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.queueLimit = properties.getWebsocket().getSendQueueLimit();
    }

    // ==================== CONEXIONES ====================

    public void register(WebSocketSession session) {
        outboxes.put(session.getId(), new Outbox(session));
    }

    public void unregister(String connectionId) {
        Outbox outbox = outboxes.remove(connectionId);
        if (outbox != null) {
            outbox.queue.clear();
        }
    }

    public boolean isRegistered(String connectionId) {
        return outboxes.containsKey(connectionId);
    }

    public int getConnectionCount() {
        return outboxes.size();
    }

    public long getDroppedMessages() {
        return droppedMessages.get();
    }

    // ==================== ENVÍO ====================

    @Override
    public void send(String connectionId, GameMsg message) {
        String json = serialize(message);
        if (json == null)
            return;
        enqueue(connectionId, new TextMessage(json));
    }

    @Override
    public void broadcast(Collection<String> connectionIds, GameMsg message) {
        if (connectionIds == null || connectionIds.isEmpty())
            return;
        String json = serialize(message);
        if (json == null)
            return;
        TextMessage frame = new TextMessage(json);
        for (String connectionId : connectionIds) {
            enqueue(connectionId, frame);
        }
    }

    private String serialize(GameMsg message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            logger.error("❌ Error serializando mensaje {}: {}", message, e.getMessage(), e);
            return null;
        }
    }

    private void enqueue(String connectionId, TextMessage frame) {
        Outbox outbox = outboxes.get(connectionId);
        if (outbox == null) {
            logger.debug("Mensaje para conexión no registrada: {}", connectionId);
            return;
        }

        outbox.queue.add(frame);
        if (outbox.size.incrementAndGet() > queueLimit && outbox.queue.poll() != null) {
            outbox.size.decrementAndGet();
            long dropped = droppedMessages.incrementAndGet();
            logger.debug("Cola llena para {}, mensaje descartado (total descartados: {})", connectionId, dropped);
        }
        scheduleDrain(outbox);
    }

    private void scheduleDrain(Outbox outbox) {
        if (!outbox.draining.compareAndSet(false, true))
            return;
        try {
            executor.execute(() -> drain(outbox));
        } catch (RejectedExecutionException e) {
            outbox.draining.set(false);
            logger.debug("Executor de salida detenido, mensaje no enviado a {}", outbox.session.getId());
        }
    }

    private void drain(Outbox outbox) {
        while (true) {
            TextMessage frame;
            while ((frame = outbox.queue.poll()) != null) {
                outbox.size.decrementAndGet();
                safeSend(outbox, frame);
            }
            outbox.draining.set(false);
            // alguien encoló entre el último poll y el set(false)
            if (outbox.queue.isEmpty() || !outbox.draining.compareAndSet(false, true))
                return;
        }
    }

    // Un fallo queda aislado en esta conexión; no se reintenta
    private void safeSend(Outbox outbox, TextMessage frame) {
        WebSocketSession session = outbox.session;
        if (!session.isOpen()) {
            outbox.queue.clear();
            outbox.size.set(0);
            return;
        }
        try {
            session.sendMessage(frame);
        } catch (IOException | RuntimeException e) {
            logger.warn("⚠️ Error enviando mensaje WebSocket a sesión {}: {}", session.getId(), e.getMessage());
        }
    }

    private static final class Outbox {
        private final WebSocketSession session;
        private final ConcurrentLinkedQueue<TextMessage> queue = new ConcurrentLinkedQueue<>();
        private final AtomicInteger size = new AtomicInteger();
        private final AtomicBoolean draining = new AtomicBoolean(false);

        private Outbox(WebSocketSession session) {
            this.session = session;
        }
    }
}
