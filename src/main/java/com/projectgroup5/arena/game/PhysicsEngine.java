package com.projectgroup5.arena.game;

import com.projectgroup5.arena.config.ArenaProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 物理引擎 - 每帧推进一个游戏（服务器权威）
 *
 * 阶段顺序固定:
 * 子弹超时 → 清理死亡/出圈玩家 → 子弹飞行 → 碰撞结算 →
 * 枪械冷却 → 时钟与缩圈 → 刷新弹药 → 刷新枪械
 *
 * 调用方持有该世界的锁
 */
@Component
public class PhysicsEngine {
    private static final Logger logger = LoggerFactory.getLogger(PhysicsEngine.class);

    private final CollisionResolver collisionResolver;

    public PhysicsEngine(CollisionResolver collisionResolver) {
        this.collisionResolver = collisionResolver;
    }

    public void step(GameWorld world) {
        removeExpiredBullets(world);
        removeDeadPlayers(world);
        updateBullets(world);
        handleCollisions(world);
        updateGuns(world);
        world.advanceClock();
        spawnAmmo(world);
        spawnGuns(world);
    }

    /** 1) 移除超时子弹 */
    void removeExpiredBullets(GameWorld world) {
        int timeout = world.getSettings().getBulletTimeout();
        for (BulletEntity b : new ArrayList<>(world.getBullets())) {
            if (b.getAge() > timeout) {
                world.destroyBullet(b.getId());
            }
        }
    }

    /** 2) 移除死亡玩家和严格位于安全区外的玩家（连同其枪械） */
    void removeDeadPlayers(GameWorld world) {
        for (PlayerEntity p : new ArrayList<>(world.getPlayers())) {
            boolean outside = world.isOutsideSafeZone(p.getPosition());
            if (p.isDead() || outside) {
                world.destroyPlayer(p.getId());
                logger.info("Game {}: player {} ({}) removed, {}", world.getGameId(), p.getId(), p.getName(),
                        p.isDead() ? "health " + p.getHealth() : "outside zone r=" + world.getSafeZoneRadius());
            }
        }
    }

    /** 3) 更新子弹位置 */
    void updateBullets(GameWorld world) {
        for (BulletEntity b : new ArrayList<>(world.getBullets())) {
            BulletEntity moved = b.step();
            world.replaceBullet(moved);
            world.getGrid().update(world.shapeOf(moved));
        }
    }

    /** 4) 每个重叠对处理一次；成员已被删除的对直接跳过 */
    void handleCollisions(GameWorld world) {
        List<CollisionPair> pairs = world.getGrid().all();
        for (CollisionPair pair : pairs) {
            collisionResolver.resolve(world, pair);
        }
    }

    /** 5) 冷却递减到 0 */
    void updateGuns(GameWorld world) {
        int decay = world.getSettings().getGunCooldownDecay();
        for (GunEntity g : new ArrayList<>(world.getGuns())) {
            if (g.getCooldown() > 0) {
                world.replaceGun(g.withCooldown(Math.max(0, g.getCooldown() - decay)));
            }
        }
    }

    /** 7) 刷新弹药 */
    void spawnAmmo(GameWorld world) {
        ArenaProperties settings = world.getSettings();
        if (world.getTick() % settings.getAmmoSpawnInterval() != 0) return;
        for (int i = 0; i < settings.getAmmoSpawnCount(); i++) {
            world.spawnAmmo();
        }
        logger.debug("Game {}: spawned {} ammo at tick {}", world.getGameId(),
                settings.getAmmoSpawnCount(), world.getTick());
    }

    /** 8) 刷新枪械 */
    void spawnGuns(GameWorld world) {
        ArenaProperties settings = world.getSettings();
        if (world.getTick() % settings.getGunSpawnInterval() != 0) return;
        for (int i = 0; i < settings.getGunSpawnCount(); i++) {
            world.spawnGun();
        }
        logger.debug("Game {}: spawned {} guns at tick {}", world.getGameId(),
                settings.getGunSpawnCount(), world.getTick());
    }
}
