package com.projectgroup5.arena.game;

import com.projectgroup5.arena.config.ArenaProperties;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Default generator: random weapon types, stats taken from {@link WeaponType}.
 */
public class RandomEntityGenerator implements EntityGenerator {

    // gap between the shooter's edge and a fresh bullet's edge
    private static final double MUZZLE_GAP = 1.0;

    private final ArenaProperties settings;
    private final Random random;
    private int nextId = 1;

    public RandomEntityGenerator(ArenaProperties settings, Random random) {
        this.settings = settings;
        this.random = random;
    }

    @Override
    public AmmoEntity ammo(Position at, Collection<WeaponType> gunTypes) {
        WeaponType type;
        if (gunTypes.isEmpty()) {
            type = randomType();
        } else {
            List<WeaponType> candidates = new ArrayList<>(gunTypes);
            type = candidates.get(random.nextInt(candidates.size()));
        }
        return new AmmoEntity(nextId(), at, type, type.getAmmoPerDrop());
    }

    @Override
    public GunEntity gun(Position at) {
        WeaponType type = randomType();
        return new GunEntity(nextId(), at, type, Entity.NO_OWNER,
                type.getAmmoPerDrop(), 0, type.getCooldownRate());
    }

    @Override
    public RockEntity rock(Position at) {
        return new RockEntity(nextId(), at);
    }

    @Override
    public PlayerEntity player(Position at, String name) {
        double heading = random.nextDouble() * 2 * Math.PI;
        return new PlayerEntity(nextId(), name, at, settings.getPlayerHealth(),
                Collections.emptySet(), null, heading);
    }

    @Override
    public List<BulletEntity> bullets(PlayerEntity shooter, GunEntity gun, double heading) {
        WeaponType type = gun.getWeaponType();
        int pellets = type.getPellets();
        double bulletRadius = settings.radiusOf(EntityKind.BULLET);
        double distance = settings.radiusOf(EntityKind.PLAYER) + bulletRadius + MUZZLE_GAP;
        if (pellets > 1 && type.getSpread() > 0) {
            // 相邻弹丸的初始位置不能重叠
            double apart = (bulletRadius + MUZZLE_GAP / 2) / Math.sin(type.getSpread() / 2);
            distance = Math.max(distance, apart);
        }

        List<BulletEntity> bullets = new ArrayList<>(pellets);
        Position origin = shooter.getPosition();
        for (int i = 0; i < pellets; i++) {
            double angle = heading + (i - (pellets - 1) / 2.0) * type.getSpread();
            double cos = Math.cos(angle);
            double sin = Math.sin(angle);
            bullets.add(new BulletEntity(
                    nextId(),
                    origin.move(cos * distance, sin * distance),
                    cos * type.getSpeed(),
                    sin * type.getSpeed(),
                    type.getDamage(),
                    shooter.getId(),
                    0,
                    type.getMotion()));
        }
        return bullets;
    }

    private WeaponType randomType() {
        WeaponType[] types = WeaponType.values();
        return types[random.nextInt(types.length)];
    }

    private int nextId() {
        return nextId++;
    }
}
