package com.rebenew.pongParty.gameserver.core;

import com.rebenew.pongParty.gameserver.model.PaddleSide;

/**
 * Resultado de un join. side == null: espectador (o conexión ya registrada).
 */
public record JoinResult(
        String roomId,
        PaddleSide side,
        boolean alreadyJoined,
        boolean matchStarted
) {
    public static JoinResult alreadyJoined(String roomId) {
        return new JoinResult(roomId, null, true, false);
    }

    public boolean isSpectator() {
        return side == null && !alreadyJoined;
    }
}
