package com.rebenew.pongParty.gameserver.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PaddleSide {
    LEFT("left"),
    RIGHT("right");

    private final String wireName;

    PaddleSide(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
