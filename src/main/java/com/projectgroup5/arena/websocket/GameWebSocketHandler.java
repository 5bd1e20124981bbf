package com.projectgroup5.arena.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.projectgroup5.arena.dto.GameStateDto;
import com.projectgroup5.arena.exception.EntityNotFoundException;
import com.projectgroup5.arena.exception.GameNotFoundException;
import com.projectgroup5.arena.game.Position;
import com.projectgroup5.arena.service.GameService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 游戏 WebSocket 处理器 - 实时通信层
 *
 * 客户端订阅某个游戏中的某个玩家，每帧收到一次 GAME_STATE，
 * 也可以直接发送 MOVE / FIRE 代替 REST 调用。
 *
 * 快照通过 {@link GameService} 在游戏锁内生成；序列化和发送在释放锁之后进行。
 */
@Component
public class GameWebSocketHandler extends TextWebSocketHandler {

    private static final Logger logger = LoggerFactory.getLogger(GameWebSocketHandler.class);

    private final GameService gameService;
    private final ObjectMapper objectMapper;

    // sessionId -> WebSocketSession
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    // sessionId -> PlayerConnection
    private final Map<String, PlayerConnection> connections = new ConcurrentHashMap<>();

    // gameId -> Set<sessionId>
    private final Map<Long, Set<String>> gameSessions = new ConcurrentHashMap<>();

    public GameWebSocketHandler(GameService gameService, ObjectMapper objectMapper) {
        this.gameService = gameService;
        this.objectMapper = objectMapper;
    }

    // ==================== 连接建立 / 关闭 ====================

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        String sessionId = session.getId();
        sessions.put(sessionId, session);
        logger.info("WebSocket connected: {}", sessionId);

        sendMessage(session, Map.of("type", "CONNECTED", "sessionId", sessionId));
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) throws Exception {
        cleanupConnection(session.getId());
        sessions.remove(session.getId());
        logger.info("WebSocket disconnected: {}, status: {}", session.getId(), status);
    }

    private void cleanupConnection(String sessionId) {
        PlayerConnection conn = connections.remove(sessionId);
        if (conn != null) {
            Set<String> set = gameSessions.get(conn.gameId);
            if (set != null) {
                set.remove(sessionId);
            }
            logger.info("Player {} unsubscribed from game {}", conn.playerId, conn.gameId);
        }
    }

    // ==================== 消息分发 ====================

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        String sessionId = session.getId();
        try {
            @SuppressWarnings("unchecked")
            Map<String, Object> msg = objectMapper.readValue(message.getPayload(), Map.class);
            String type = String.valueOf(msg.get("type"));

            switch (type) {
                case "SUBSCRIBE" -> handleSubscribe(session, msg);
                case "MOVE" -> handleMove(session, msg);
                case "FIRE" -> handleFire(session, msg);
                case "LEAVE" -> cleanupConnection(sessionId);
                default -> {
                    logger.warn("Unknown message type from {}: {}", sessionId, type);
                    sendMessage(session, Map.of("type", "ERROR", "message", "Unknown message type: " + type));
                }
            }
        } catch (GameNotFoundException | EntityNotFoundException | IllegalArgumentException e) {
            sendMessage(session, Map.of("type", "ERROR", "message", e.getMessage()));
        } catch (Exception e) {
            logger.error("Error handling message from {}", sessionId, e);
            sendMessage(session, Map.of("type", "ERROR", "message", String.valueOf(e.getMessage())));
        }
    }

    private void handleSubscribe(WebSocketSession session, Map<String, Object> msg) throws IOException {
        long gameId = number(msg, "gameId").longValue();
        int playerId = number(msg, "playerId").intValue();

        // 任一 id 不存在都会抛出 not-found
        GameStateDto state = gameService.getState(gameId, playerId);

        String sessionId = session.getId();
        cleanupConnection(sessionId);
        connections.put(sessionId, new PlayerConnection(gameId, playerId));
        gameSessions.computeIfAbsent(gameId, k -> ConcurrentHashMap.newKeySet()).add(sessionId);
        logger.info("Player {} subscribed to game {} (session {})", playerId, gameId, sessionId);

        sendMessage(session, Map.of("type", "SUBSCRIBED", "gameId", gameId, "playerId", playerId));
        sendState(session, state);
    }

    private void handleMove(WebSocketSession session, Map<String, Object> msg) throws IOException {
        PlayerConnection conn = requireConnection(session);
        Position target = new Position(number(msg, "x").doubleValue(), number(msg, "y").doubleValue());
        boolean moved = gameService.move(conn.gameId, conn.playerId, target);
        sendMessage(session, Map.of("type", "MOVED", "moved", moved));
    }

    private void handleFire(WebSocketSession session, Map<String, Object> msg) throws IOException {
        PlayerConnection conn = requireConnection(session);
        int gunId = number(msg, "gunId").intValue();
        Position aim = null;
        if (msg.get("targetX") instanceof Number && msg.get("targetY") instanceof Number) {
            aim = new Position(number(msg, "targetX").doubleValue(), number(msg, "targetY").doubleValue());
        }
        List<Integer> bullets = gameService.fire(conn.gameId, conn.playerId, gunId, aim);
        sendMessage(session, Map.of("type", "FIRED", "bullets", bullets));
    }

    // ==================== 状态推送 ====================

    /**
     * 向 {@code gameId} 的每个订阅者推送各自视角的状态；
     * 游戏已被移除时推送 GAME_OVER 并丢弃该游戏的订阅表。
     */
    public void broadcastState(long gameId) {
        Set<String> set = gameSessions.get(gameId);
        if (set == null) return;

        for (String sid : set) {
            WebSocketSession session = sessions.get(sid);
            PlayerConnection conn = connections.get(sid);
            if (session == null || conn == null || !session.isOpen()) continue;
            try {
                sendState(session, gameService.getState(gameId, conn.playerId));
            } catch (EntityNotFoundException e) {
                cleanupConnection(sid);
                trySend(session, Map.of("type", "ELIMINATED", "gameId", gameId, "playerId", conn.playerId));
            } catch (GameNotFoundException e) {
                cleanupConnection(sid);
                trySend(session, Map.of("type", "GAME_OVER", "gameId", gameId));
            } catch (Exception e) {
                logger.error("Send fail session {}", sid, e);
            }
        }

        if (!gameService.isActive(gameId)) {
            gameSessions.remove(gameId);
        }
    }

    // ==================== 工具方法 ====================

    private void sendState(WebSocketSession session, GameStateDto state) throws IOException {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", "GAME_STATE");
        frame.put("state", state);
        sendMessage(session, frame);
    }

    private void trySend(WebSocketSession session, Map<String, Object> data) {
        try {
            sendMessage(session, data);
        } catch (IOException e) {
            logger.error("Send fail session {}", session.getId(), e);
        }
    }

    /** 帧推送和请求回复可能同时写同一个 session */
    private void sendMessage(WebSocketSession session, Map<String, Object> data) throws IOException {
        String json = objectMapper.writeValueAsString(data);
        synchronized (session) {
            session.sendMessage(new TextMessage(json));
        }
    }

    private PlayerConnection requireConnection(WebSocketSession session) {
        PlayerConnection conn = connections.get(session.getId());
        if (conn == null) {
            throw new IllegalArgumentException("Not subscribed to a game");
        }
        return conn;
    }

    private static Number number(Map<String, Object> msg, String key) {
        Object value = msg.get(key);
        if (!(value instanceof Number)) {
            throw new IllegalArgumentException("Missing or non-numeric field: " + key);
        }
        return (Number) value;
    }

    /** 玩家连接信息 */
    private static class PlayerConnection {
        final long gameId;
        final int playerId;

        PlayerConnection(long gameId, int playerId) {
            this.gameId = gameId;
            this.playerId = playerId;
        }
    }
}
