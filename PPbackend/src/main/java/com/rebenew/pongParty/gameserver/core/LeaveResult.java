package com.rebenew.pongParty.gameserver.core;

import com.rebenew.pongParty.gameserver.model.PaddleSide;

public record LeaveResult(
        String roomId,
        PaddleSide vacatedSide,   // null si era espectador
        boolean matchStopped,     // ACTIVE -> WAITING
        boolean roomEmpty         // sala destruida
) {
    public static LeaveResult notMember(String roomId) {
        return new LeaveResult(roomId, null, false, false);
    }
}
