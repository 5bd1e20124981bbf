package com.projectgroup5.arena.service;

import com.projectgroup5.arena.dto.GameDescriptionDto;
import com.projectgroup5.arena.dto.GameStateDto;
import com.projectgroup5.arena.dto.PlayerTicketDto;
import com.projectgroup5.arena.exception.EntityNotFoundException;
import com.projectgroup5.arena.game.BulletEntity;
import com.projectgroup5.arena.game.CollisionResolver;
import com.projectgroup5.arena.game.EntityKind;
import com.projectgroup5.arena.game.GameRoomManager;
import com.projectgroup5.arena.game.GameWorld;
import com.projectgroup5.arena.game.GunEntity;
import com.projectgroup5.arena.game.PlayerEntity;
import com.projectgroup5.arena.game.Position;
import com.projectgroup5.arena.game.Shape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 游戏服务 - 创建、加入、开火、移动以及各种查询
 * 每个调用都在目标游戏的锁内完成
 */
@Service
public class GameService {
    private static final Logger logger = LoggerFactory.getLogger(GameService.class);

    private final GameRoomManager roomManager;
    private final CollisionResolver collisionResolver;
    private final GameStateMapper stateMapper;

    public GameService(GameRoomManager roomManager,
                       CollisionResolver collisionResolver,
                       GameStateMapper stateMapper) {
        this.roomManager = roomManager;
        this.collisionResolver = collisionResolver;
        this.stateMapper = stateMapper;
    }

    /** 生成新地图、放置创建者，然后才交给主循环调度 */
    public PlayerTicketDto create(String gameName, String playerName) {
        GameWorld world = roomManager.newGameWorld(gameName);
        PlayerEntity player = world.locked(() -> {
            world.seedInitialEntities();
            return world.spawnPlayer(playerName);
        });
        roomManager.register(world);
        logger.info("Player {} ({}) created game {} ({})",
                player.getId(), playerName, world.getGameId(), gameName);
        return new PlayerTicketDto(world.getGameId(), player.getId());
    }

    public PlayerTicketDto join(long gameId, String playerName) {
        GameWorld world = roomManager.requireGameRoom(gameId);
        PlayerEntity player = world.locked(() -> world.spawnPlayer(playerName));
        logger.info("Player {} ({}) joined game {}", player.getId(), playerName, gameId);
        return new PlayerTicketDto(gameId, player.getId());
    }

    /**
     * Fires {@code gunId}. A dead shooter is removed instead; a gun that is not this player's,
     * or is still cooling down, does nothing.
     *
     * @param aim point to shoot at, or null to shoot along the player's heading
     * @return ids of the bullets created, empty if nothing was fired
     */
    public List<Integer> fire(long gameId, int playerId, int gunId, Position aim) {
        GameWorld world = roomManager.requireGameRoom(gameId);
        return world.locked(() -> {
            PlayerEntity player = requirePlayer(world, playerId);
            GunEntity gun = world.getGun(gunId);
            if (gun == null) {
                throw new EntityNotFoundException(EntityKind.GUN, gunId);
            }
            if (player.isDead()) {
                world.destroyPlayer(playerId);
                return Collections.<Integer>emptyList();
            }
            if (!player.getInventory().contains(gunId)
                    || gun.getOwnerId() != playerId
                    || gun.getCooldown() != 0) {
                return Collections.<Integer>emptyList();
            }

            double heading = player.getHeading();
            if (aim != null && !aim.equals(player.getPosition())) {
                heading = headingTowards(player.getPosition(), aim);
            }
            world.replaceGun(gun.withCooldown(gun.getCooldownRate()));
            PlayerEntity shooter = player.withLastFired(gun.getWeaponType()).withHeading(heading);
            world.replacePlayer(shooter);

            List<Integer> ids = new ArrayList<>();
            for (BulletEntity b : world.getGenerator().bullets(shooter, gun, heading)) {
                world.addBullet(b);
                ids.add(b.getId());
            }
            logger.debug("Game {}: player {} fired {} -> {} bullets",
                    gameId, playerId, gun.getWeaponType(), ids.size());
            return ids;
        });
    }

    /**
     * Moves a player to {@code target} unless a blocking collision is in the way. Every collision
     * at the target is resolved either way (pickups, bullet hits).
     *
     * @return true if the move was committed
     */
    public boolean move(long gameId, int playerId, Position target) {
        GameWorld world = roomManager.requireGameRoom(gameId);
        return world.locked(() -> {
            if (Double.isNaN(target.getX()) || Double.isNaN(target.getY()) || !world.isInsideMap(target)) {
                return false;
            }
            PlayerEntity player = requirePlayer(world, playerId);
            if (player.isDead()) {
                world.destroyPlayer(playerId);
                return false;
            }

            Shape original = world.shapeOf(player);
            world.getGrid().remove(original);
            Shape candidate = original.movedTo(target);

            boolean blocked = false;
            for (Shape other : world.getGrid().test(candidate)) {
                blocked |= collisionResolver.resolve(world, candidate, other);
            }

            // 重新读取：碰撞结算可能改变了血量或背包
            PlayerEntity current = world.getPlayer(playerId);
            if (current == null || current.isDead()) {
                return false;
            }
            if (blocked) {
                world.getGrid().update(original);
                return false;
            }

            PlayerEntity moved = current.withPosition(target);
            if (!target.equals(current.getPosition())) {
                moved = moved.withHeading(headingTowards(current.getPosition(), target));
            }
            world.replacePlayer(moved);
            world.getGrid().update(world.shapeOf(moved));
            return true;
        });
    }

    /** {@code playerId} 视野内的快照 */
    public GameStateDto getState(long gameId, int playerId) {
        GameWorld world = roomManager.requireGameRoom(gameId);
        return world.locked(() -> stateMapper.toState(world, requirePlayer(world, playerId)));
    }

    public GameDescriptionDto describe(long gameId) {
        GameWorld world = roomManager.requireGameRoom(gameId);
        return world.locked(() -> stateMapper.toDescription(world));
    }

    public List<GameDescriptionDto> listGames() {
        return roomManager.getActiveWorlds().stream()
                .map(world -> world.locked(() -> stateMapper.toDescription(world)))
                .collect(Collectors.toList());
    }

    /** 游戏是否仍在调度中 */
    public boolean isActive(long gameId) {
        return roomManager.getGameRoom(gameId).isPresent();
    }

    /** Flattened entity listing of one game. */
    public List<Shape> shapes(long gameId) {
        GameWorld world = roomManager.requireGameRoom(gameId);
        return world.locked(world::toShapes);
    }

    private static PlayerEntity requirePlayer(GameWorld world, int playerId) {
        PlayerEntity player = world.getPlayer(playerId);
        if (player == null) {
            throw new EntityNotFoundException(EntityKind.PLAYER, playerId);
        }
        return player;
    }

    private static double headingTowards(Position from, Position to) {
        return Math.atan2(to.getY() - from.getY(), to.getX() - from.getX());
    }
}
