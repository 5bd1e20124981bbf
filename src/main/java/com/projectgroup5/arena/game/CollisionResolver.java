package com.projectgroup5.arena.game;

import com.projectgroup5.arena.exception.CollisionConsistencyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Applies the effect of one collision and reports whether it blocks movement.
 *
 * Pairs are put into {@link EntityKind} order first, so only the Player-first and Bullet-first
 * rows need handling. If either member has already been deleted (earlier in the same tick, or by
 * an earlier collision of the same move) the pair is a no-op that does not block.
 *
 * Caller holds the world's lock.
 */
@Component
public class CollisionResolver {
    private static final Logger logger = LoggerFactory.getLogger(CollisionResolver.class);

    /**
     * @return true if the collision blocks the movement that produced it
     * @throws CollisionConsistencyException for two stationary kinds
     */
    public boolean resolve(GameWorld world, Shape a, Shape b) {
        return resolve(world, new CollisionPair(a, b));
    }

    public boolean resolve(GameWorld world, CollisionPair pair) {
        CollisionPair ordered = pair.canonical();
        Shape first = ordered.getFirst();
        Shape second = ordered.getSecond();

        switch (first.getKind()) {
            case PLAYER:
                return switch (second.getKind()) {
                    case PLAYER -> playerPlayer(world, first.getId(), second.getId());
                    case BULLET -> playerBullet(world, first.getId(), second.getId());
                    case AMMO -> playerAmmo(world, first.getId(), second.getId());
                    case GUN -> playerGun(world, first.getId(), second.getId());
                    case ROCK -> playerRock(world, first.getId(), second.getId());
                };
            case BULLET:
                switch (second.getKind()) {
                    case BULLET:
                        bulletBullet(world, first.getId(), second.getId());
                        return false;
                    case AMMO:
                        bulletAmmo(world, first.getId(), second.getId());
                        return false;
                    case GUN:
                        bulletGun(world, first.getId(), second.getId());
                        return false;
                    case ROCK:
                        bulletRock(world, first.getId(), second.getId());
                        return false;
                    default:
                        break;
                }
                break;
            default:
                break;
        }
        throw new CollisionConsistencyException(ordered);
    }

    // ==================== 玩家 ====================

    /** Picks up the ammo if the player holds a gun of its type; otherwise the drop is in the way. */
    private boolean playerAmmo(GameWorld world, int playerId, int ammoId) {
        PlayerEntity player = world.getPlayer(playerId);
        AmmoEntity ammo = world.getAmmo(ammoId);
        if (player == null || ammo == null) return false;

        GunEntity gun = world.findOwnedGun(player, ammo.getAmmoType());
        if (gun == null) {
            return true;
        }
        world.replaceGun(gun.withAmmo(gun.getAmmo() + ammo.getAmount()));
        world.destroyAmmo(ammoId);
        logger.debug("Player {} picked up {} {} ammo", playerId, ammo.getAmount(), ammo.getAmmoType());
        return false;
    }

    /** 友军伤害生效；被击杀的玩家立即离开索引，下一次清理时才从存储中删除 */
    private boolean playerBullet(GameWorld world, int playerId, int bulletId) {
        PlayerEntity player = world.getPlayer(playerId);
        BulletEntity bullet = world.getBullet(bulletId);
        if (player == null || bullet == null) return false;

        PlayerEntity hurt = player.withHealth(player.getHealth() - bullet.getDamage());
        world.replacePlayer(hurt);
        world.destroyBullet(bulletId);
        if (hurt.isDead()) {
            world.getGrid().remove(hurt.ref());
            logger.info("Player {} ({}) killed by bullet of player {}",
                    playerId, hurt.getName(), bullet.getOwnerId());
        }
        return false;
    }

    /** 拾取枪械，除非已拥有同类型的枪 */
    private boolean playerGun(GameWorld world, int playerId, int gunId) {
        PlayerEntity player = world.getPlayer(playerId);
        GunEntity gun = world.getGun(gunId);
        if (player == null || gun == null || gun.isOwned()) return false;

        if (world.findOwnedGun(player, gun.getWeaponType()) != null) {
            return true;
        }
        world.replacePlayer(player.withGun(gunId));
        world.replaceGun(gun.withOwner(playerId));
        world.getGrid().remove(gun.ref());
        logger.debug("Player {} picked up {} gun {}", playerId, gun.getWeaponType(), gunId);
        return false;
    }

    private boolean playerRock(GameWorld world, int playerId, int rockId) {
        return world.getPlayer(playerId) != null && world.getRock(rockId) != null;
    }

    private boolean playerPlayer(GameWorld world, int playerId, int otherId) {
        return world.getPlayer(playerId) != null && world.getPlayer(otherId) != null;
    }

    // ==================== 子弹 ====================

    private void bulletAmmo(GameWorld world, int bulletId, int ammoId) {
        if (world.getBullet(bulletId) == null || world.getAmmo(ammoId) == null) return;
        world.destroyBullet(bulletId);
        world.destroyAmmo(ammoId);
    }

    private void bulletBullet(GameWorld world, int bulletId, int otherId) {
        if (world.getBullet(bulletId) == null || world.getBullet(otherId) == null) return;
        world.destroyBullet(bulletId);
        world.destroyBullet(otherId);
    }

    private void bulletGun(GameWorld world, int bulletId, int gunId) {
        if (world.getBullet(bulletId) == null || world.getGun(gunId) == null) return;
        world.destroyBullet(bulletId);
        world.destroyGun(gunId);
    }

    private void bulletRock(GameWorld world, int bulletId, int rockId) {
        if (world.getBullet(bulletId) == null || world.getRock(rockId) == null) return;
        world.destroyBullet(bulletId);
    }
}
