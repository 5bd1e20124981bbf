package com.projectgroup5.arena.game;

import com.projectgroup5.arena.config.ArenaProperties;
import com.projectgroup5.arena.exception.GameNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 游戏房间管理器 - 管理所有活跃的 {@link GameWorld}
 * 每个游戏有独立的状态和锁
 */
@Component
public class GameRoomManager {
    private static final Logger logger = LoggerFactory.getLogger(GameRoomManager.class);

    // gameId -> GameWorld
    private final Map<Long, GameWorld> activeGames = new ConcurrentHashMap<>();
    private final AtomicLong gameIdSeq = new AtomicLong(0);

    private final ArenaProperties settings;

    public GameRoomManager(ArenaProperties settings) {
        this.settings = settings;
    }

    /**
     * 用新 id 创建空世界；{@link #register(GameWorld)} 之后才会被调度
     */
    public GameWorld newGameWorld(String name) {
        long gameId = gameIdSeq.getAndIncrement();
        Random base = settings.getSeed() == null ? new Random() : new Random(settings.getSeed() + gameId);
        EntityGenerator generator = new RandomEntityGenerator(settings, new Random(base.nextLong()));
        return new GameWorld(gameId, name, settings, generator, new Random(base.nextLong()));
    }

    public void register(GameWorld world) {
        GameWorld previous = activeGames.putIfAbsent(world.getGameId(), world);
        if (previous != null) {
            logger.warn("GameWorld already exists for gameId={}", world.getGameId());
            return;
        }
        logger.info("Created GameWorld gameId={} name={}", world.getGameId(), world.getName());
    }

    public Optional<GameWorld> getGameRoom(long gameId) {
        return Optional.ofNullable(activeGames.get(gameId));
    }

    public GameWorld requireGameRoom(long gameId) {
        return getGameRoom(gameId).orElseThrow(() -> new GameNotFoundException(gameId));
    }

    /** 只在两帧之间调用 */
    public void removeGameRoom(long gameId) {
        GameWorld world = activeGames.remove(gameId);
        if (world != null) {
            logger.info("Removed GameWorld for gameId={}", gameId);
        }
    }

    public Collection<GameWorld> getActiveWorlds() {
        return activeGames.values();
    }
}
