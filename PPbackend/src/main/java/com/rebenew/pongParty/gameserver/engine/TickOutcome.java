package com.rebenew.pongParty.gameserver.engine;

// Resultado de avanzar un tick de física.
public enum TickOutcome {
    NONE,
    LEFT_SCORED,
    RIGHT_SCORED;

    public boolean isScore() {
        return this != NONE;
    }
}
