package com.projectgroup5.arena.game;

import com.projectgroup5.arena.exception.CollisionConsistencyException;
import com.projectgroup5.arena.websocket.GameWebSocketHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 游戏主循环调度器
 * 在单个调度线程上按固定频率运行，依次推进每个活跃游戏（各自持有自己的锁）
 *
 * 数据流:
 * 加锁 → PhysicsEngine.step → 解锁 → 按玩家生成快照 → WebSocket
 *
 * 没有玩家的游戏、以及出现一致性错误的游戏，在两帧之间被清理，
 * 订阅者收到 GAME_OVER。
 */
@Component
public class GameTickScheduler {

    private static final Logger logger = LoggerFactory.getLogger(GameTickScheduler.class);

    private final GameRoomManager roomManager;
    private final PhysicsEngine physicsEngine;
    private final GameWebSocketHandler webSocketHandler;

    public GameTickScheduler(GameRoomManager roomManager,
                             PhysicsEngine physicsEngine,
                             GameWebSocketHandler webSocketHandler) {
        this.roomManager = roomManager;
        this.physicsEngine = physicsEngine;
        this.webSocketHandler = webSocketHandler;
    }

    @Scheduled(fixedRateString = "${arena.tick-millis:33}")
    public void tick() {
        for (GameWorld world : roomManager.getActiveWorlds()) {
            long gameId = world.getGameId();
            boolean empty;
            try {
                empty = world.locked(() -> {
                    physicsEngine.step(world);
                    return world.getPlayers().isEmpty();
                });
            } catch (CollisionConsistencyException e) {
                // 放置或索引已损坏：该游戏不能再继续
                logger.error("Game {} aborted at tick {}: {}", gameId, world.getTick(), e.getPair(), e);
                finishGame(gameId);
                continue;
            } catch (Exception e) {
                logger.error("Error processing game world {}", gameId, e);
                webSocketHandler.broadcastState(gameId);
                continue;
            }

            if (empty) {
                logger.info("Game {} ends at tick {}: no players left", gameId, world.getTick());
                finishGame(gameId);
            } else {
                webSocketHandler.broadcastState(gameId);
            }
        }
    }

    /** 从调度中移除，然后通知订阅者 */
    private void finishGame(long gameId) {
        roomManager.removeGameRoom(gameId);
        webSocketHandler.broadcastState(gameId);
    }
}
