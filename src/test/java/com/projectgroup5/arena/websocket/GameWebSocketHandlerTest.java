package com.projectgroup5.arena.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.projectgroup5.arena.config.ArenaProperties;
import com.projectgroup5.arena.dto.PlayerTicketDto;
import com.projectgroup5.arena.game.CollisionResolver;
import com.projectgroup5.arena.game.GameRoomManager;
import com.projectgroup5.arena.game.GameWorld;
import com.projectgroup5.arena.game.Position;
import com.projectgroup5.arena.service.GameService;
import com.projectgroup5.arena.service.GameStateMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link GameWebSocketHandler}.
 */
class GameWebSocketHandlerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private GameRoomManager roomManager;
    private GameService gameService;
    private GameWebSocketHandler handler;
    private WebSocketSession session;

    @BeforeEach
    void setUp() throws Exception {
        ArenaProperties settings = new ArenaProperties();
        settings.setSeed(7L);
        settings.setInitialRocks(0);
        settings.setInitialGuns(0);
        settings.setInitialAmmo(0);
        roomManager = new GameRoomManager(settings);
        gameService = new GameService(roomManager, new CollisionResolver(), new GameStateMapper());
        handler = new GameWebSocketHandler(gameService, objectMapper);

        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("s1");
        when(session.isOpen()).thenReturn(true);
        handler.afterConnectionEstablished(session);
    }

    private void send(String json) throws Exception {
        handler.handleMessage(session, new TextMessage(json));
    }

    private List<JsonNode> sentFrames() throws Exception {
        @SuppressWarnings("unchecked")
        ArgumentCaptor<WebSocketMessage<?>> captor = ArgumentCaptor.forClass(WebSocketMessage.class);
        verify(session, atLeastOnce()).sendMessage(captor.capture());
        List<JsonNode> frames = new ArrayList<>();
        for (WebSocketMessage<?> m : captor.getAllValues()) {
            frames.add(objectMapper.readTree((String) m.getPayload()));
        }
        return frames;
    }

    private JsonNode lastFrame() throws Exception {
        List<JsonNode> frames = sentFrames();
        return frames.get(frames.size() - 1);
    }

    private String subscribe(PlayerTicketDto ticket) {
        return "{\"type\":\"SUBSCRIBE\",\"gameId\":" + ticket.getGameId()
                + ",\"playerId\":" + ticket.getPlayerId() + "}";
    }

    @Test
    void connect_sendsConnected() throws Exception {
        assertEquals("CONNECTED", sentFrames().get(0).get("type").asText());
    }

    @Test
    void subscribe_repliesWithSubscribedAndState() throws Exception {
        PlayerTicketDto ticket = gameService.create("arena", "alice");

        send(subscribe(ticket));

        List<JsonNode> frames = sentFrames();
        assertEquals("SUBSCRIBED", frames.get(1).get("type").asText());
        assertEquals("GAME_STATE", frames.get(2).get("type").asText());
        assertEquals("alice", frames.get(2).get("state").get("players").get(0).get("name").asText());
    }

    @Test
    void subscribe_unknownGame_sendsError() throws Exception {
        send("{\"type\":\"SUBSCRIBE\",\"gameId\":5,\"playerId\":1}");

        JsonNode frame = lastFrame();
        assertEquals("ERROR", frame.get("type").asText());
        assertEquals("Game not found: 5", frame.get("message").asText());
    }

    @Test
    void move_beforeSubscribe_sendsError() throws Exception {
        send("{\"type\":\"MOVE\",\"x\":10,\"y\":10}");

        assertEquals("ERROR", lastFrame().get("type").asText());
    }

    @Test
    void move_afterSubscribe_repliesMoved() throws Exception {
        PlayerTicketDto ticket = gameService.create("arena", "alice");
        Position at = roomManager.requireGameRoom(ticket.getGameId())
                .getPlayer(ticket.getPlayerId()).getPosition();
        send(subscribe(ticket));

        send("{\"type\":\"MOVE\",\"x\":" + at.getX() + ",\"y\":" + at.getY() + "}");

        JsonNode frame = lastFrame();
        assertEquals("MOVED", frame.get("type").asText());
        assertTrue(frame.get("moved").asBoolean());
    }

    @Test
    void broadcast_sendsStateToSubscribers() throws Exception {
        PlayerTicketDto ticket = gameService.create("arena", "alice");
        send(subscribe(ticket));
        int before = sentFrames().size();

        handler.broadcastState(ticket.getGameId());

        List<JsonNode> frames = sentFrames();
        assertEquals(before + 1, frames.size());
        assertEquals("GAME_STATE", frames.get(frames.size() - 1).get("type").asText());
    }

    @Test
    void broadcast_removedPlayer_sendsEliminatedOnce() throws Exception {
        PlayerTicketDto ticket = gameService.create("arena", "alice");
        send(subscribe(ticket));
        GameWorld world = roomManager.requireGameRoom(ticket.getGameId());
        world.runLocked(() -> world.destroyPlayer(ticket.getPlayerId()));

        handler.broadcastState(ticket.getGameId());
        int after = sentFrames().size();
        handler.broadcastState(ticket.getGameId());

        assertEquals("ELIMINATED", lastFrame().get("type").asText());
        assertEquals(after, sentFrames().size());
    }

    @Test
    void broadcast_removedGame_sendsGameOverOnceAndForgetsGame() throws Exception {
        PlayerTicketDto ticket = gameService.create("arena", "alice");
        send(subscribe(ticket));
        roomManager.removeGameRoom(ticket.getGameId());

        handler.broadcastState(ticket.getGameId());
        int after = sentFrames().size();
        handler.broadcastState(ticket.getGameId());

        JsonNode frame = lastFrame();
        assertEquals("GAME_OVER", frame.get("type").asText());
        assertEquals(ticket.getGameId(), frame.get("gameId").asLong());
        assertEquals(after, sentFrames().size());
    }

    @Test
    void unknownType_sendsError() throws Exception {
        send("{\"type\":\"DANCE\"}");

        JsonNode frame = lastFrame();
        assertEquals("ERROR", frame.get("type").asText());
        assertEquals("Unknown message type: DANCE", frame.get("message").asText());
    }
}
