package com.rebenew.pongParty.gameserver.core;

import com.rebenew.pongParty.gameserver.model.GameMsg;

import java.util.Collection;

/**
 * Salida de mensajes hacia las conexiones. La implementación decide cómo se
 * entrega; para la simulación es fire-and-forget: no bloquea ni lanza por un
 * cliente lento o caído.
 */
public interface BroadcastGateway {

    void send(String connectionId, GameMsg message);

    void broadcast(Collection<String> connectionIds, GameMsg message);
}
