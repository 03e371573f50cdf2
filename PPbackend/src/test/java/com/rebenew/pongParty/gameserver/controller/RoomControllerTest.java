package com.rebenew.pongParty.gameserver.controller;

import com.rebenew.pongParty.gameserver.config.AppConfig;
import com.rebenew.pongParty.gameserver.config.GameProperties;
import com.rebenew.pongParty.gameserver.core.RecordingBroadcastGateway;
import com.rebenew.pongParty.gameserver.core.RoomRegistry;
import com.rebenew.pongParty.gameserver.engine.PhysicsEngine;
import com.rebenew.pongParty.gameserver.service.GameSessionCoordinator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.hamcrest.Matchers.contains;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class RoomControllerTest {

    private RoomRegistry registry;
    private GameSessionCoordinator coordinator;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        GameProperties properties = new GameProperties();
        properties.getGame().setTickRateHz(1);
        registry = new RoomRegistry(properties, new PhysicsEngine(properties), new RecordingBroadcastGateway());
        coordinator = new GameSessionCoordinator(registry, properties);
        mockMvc = MockMvcBuilders.standaloneSetup(new RoomController(coordinator))
                .setMessageConverters(new MappingJackson2HttpMessageConverter(new AppConfig().objectMapper()))
                .build();
    }

    @AfterEach
    void tearDown() {
        registry.shutdown();
    }

    @Test
    void unknownRoomReturns404() throws Exception {
        mockMvc.perform(get("/rooms/nope"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/rooms/nope/state"))
                .andExpect(status().isNotFound());
    }

    @Test
    void roomMetadataShowsOwnersAndState() throws Exception {
        coordinator.join("A", "arena");
        coordinator.join("B", "arena");

        mockMvc.perform(get("/rooms/arena"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.roomId").value("arena"))
                .andExpect(jsonPath("$.state").value("ACTIVE"))
                .andExpect(jsonPath("$.leftPlayerId").value("A"))
                .andExpect(jsonPath("$.rightPlayerId").value("B"))
                .andExpect(jsonPath("$.players", contains("A", "B")))
                .andExpect(jsonPath("$.scoreLeft").value(0));
    }

    @Test
    void roomStateExposesWireSnapshot() throws Exception {
        coordinator.join("A", "arena");

        mockMvc.perform(get("/rooms/arena/state"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ball.x").value(400.0))
                .andExpect(jsonPath("$.ball.y").value(200.0))
                .andExpect(jsonPath("$.paddles.left.y").value(160.0))
                .andExpect(jsonPath("$.paddles.left.playerId").value("A"))
                .andExpect(jsonPath("$.score.left").value(0))
                .andExpect(jsonPath("$.gameActive").value(false))
                .andExpect(jsonPath("$.paddles.left.owned").doesNotExist());
    }

    @Test
    void listIncludesEveryLiveRoom() throws Exception {
        coordinator.join("A", "r2");
        coordinator.join("B", "r1");

        mockMvc.perform(get("/rooms"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalRooms").value(2))
                .andExpect(jsonPath("$.rooms[0].roomId").value("r1"))
                .andExpect(jsonPath("$.rooms[1].roomId").value("r2"));
    }

    @Test
    void statsAndHealthRespond() throws Exception {
        coordinator.join("A", "r1");

        mockMvc.perform(get("/rooms/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalRooms").value(1))
                .andExpect(jsonPath("$.waitingRooms").value(1))
                .andExpect(jsonPath("$.totalConnections").value(1));

        mockMvc.perform(get("/rooms/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.service").value("pong-game-server"))
                .andExpect(jsonPath("$.activeRooms").value(1));
    }
}
