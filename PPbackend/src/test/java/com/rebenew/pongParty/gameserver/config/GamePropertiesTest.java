package com.rebenew.pongParty.gameserver.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GamePropertiesTest {

    @Test
    void defaultsMatchClassicBoard() {
        GameProperties properties = new GameProperties();

        assertThatCode(properties::validate).doesNotThrowAnyException();
        assertThat(properties.getGame().maxPaddleY()).isEqualTo(320.0);
        assertThat(properties.getGame().tickPeriodMicros()).isEqualTo(16_666L);
        assertThat(properties.getRooms().getDefaultRoomId()).isEqualTo("room1");
    }

    @Test
    void paddleTallerThanBoardIsRejected() {
        GameProperties properties = new GameProperties();
        properties.getGame().setPaddleHeight(500);

        assertThatThrownBy(properties::validate).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void tickRateOutOfRangeIsRejected() {
        GameProperties properties = new GameProperties();
        properties.getGame().setTickRateHz(0);

        assertThatThrownBy(properties::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("tickRateHz");
    }

    @Test
    void blankDefaultRoomIsRejected() {
        GameProperties properties = new GameProperties();
        properties.getRooms().setDefaultRoomId(" ");

        assertThatThrownBy(properties::validate).isInstanceOf(IllegalStateException.class);
    }
}
