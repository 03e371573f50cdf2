package com.rebenew.pongParty.gameserver.model;

// Dirección de un paddleMove. "up" reduce la coordenada y.
public enum Direction {
    UP,
    DOWN;

    public static Direction fromWire(String value) {
        if (value == null)
            return null;
        switch (value.trim().toLowerCase()) {
            case "up":
                return UP;
            case "down":
                return DOWN;
            default:
                return null;
        }
    }
}
