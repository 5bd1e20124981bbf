package com.projectgroup5.arena.game;

import com.projectgroup5.arena.config.ArenaProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link RandomEntityGenerator}.
 */
class RandomEntityGeneratorTest {

    private ArenaProperties settings;
    private RandomEntityGenerator generator;

    @BeforeEach
    void setUp() {
        settings = new ArenaProperties();
        generator = new RandomEntityGenerator(settings, new Random(5));
    }

    private PlayerEntity shooter() {
        return generator.player(new Position(500, 500), "shooter");
    }

    private GunEntity gun(PlayerEntity owner, WeaponType type) {
        return new GunEntity(999, owner.getPosition(), type, owner.getId(), 10, 0, type.getCooldownRate());
    }

    @Test
    void player_startsWithConfiguredHealthAndEmptyInventory() {
        PlayerEntity p = shooter();

        assertEquals(100, p.getHealth());
        assertTrue(p.getInventory().isEmpty());
        assertNull(p.getLastFired());
        assertEquals("shooter", p.getName());
    }

    @Test
    void ids_areUniqueAcrossKinds() {
        Set<Integer> ids = new HashSet<>();
        ids.add(generator.rock(new Position(0, 0)).getId());
        ids.add(generator.gun(new Position(0, 0)).getId());
        ids.add(generator.ammo(new Position(0, 0), List.of()).getId());
        ids.add(shooter().getId());

        assertEquals(4, ids.size());
    }

    @Test
    void gun_isUnownedAndReady() {
        GunEntity g = generator.gun(new Position(10, 10));

        assertFalse(g.isOwned());
        assertEquals(0, g.getCooldown());
        assertEquals(g.getWeaponType().getCooldownRate(), g.getCooldownRate());
    }

    @Test
    void ammo_matchesExistingGunTypes() {
        for (int i = 0; i < 20; i++) {
            AmmoEntity a = generator.ammo(new Position(0, 0), List.of(WeaponType.RIFLE));
            assertEquals(WeaponType.RIFLE, a.getAmmoType());
            assertEquals(WeaponType.RIFLE.getAmmoPerDrop(), a.getAmount());
        }
    }

    @Test
    void bullets_pelletCountFollowsWeapon() {
        PlayerEntity p = shooter();
        for (WeaponType type : WeaponType.values()) {
            List<BulletEntity> bullets = generator.bullets(p, gun(p, type), 0);
            assertEquals(type.getPellets(), bullets.size(), type.name());
            for (BulletEntity b : bullets) {
                assertEquals(p.getId(), b.getOwnerId());
                assertEquals(type.getDamage(), b.getDamage());
                assertEquals(0, b.getAge());
                assertEquals(type.getMotion(), b.getMotion());
            }
        }
    }

    @Test
    void bullets_startClearOfShooterAndEachOther() {
        PlayerEntity p = shooter();
        Shape body = new Shape(p.ref(), p.getPosition(), settings.radiusOf(EntityKind.PLAYER));
        for (WeaponType type : WeaponType.values()) {
            List<BulletEntity> bullets = generator.bullets(p, gun(p, type), 1.2);
            for (int i = 0; i < bullets.size(); i++) {
                Shape a = shapeOf(bullets.get(i));
                assertFalse(a.overlaps(body), type + " pellet overlaps shooter");
                for (int j = i + 1; j < bullets.size(); j++) {
                    assertFalse(a.overlaps(shapeOf(bullets.get(j))), type + " pellets overlap");
                }
            }
        }
    }

    @Test
    void bullets_travelAlongHeading() {
        PlayerEntity p = shooter();
        BulletEntity b = generator.bullets(p, gun(p, WeaponType.PISTOL), Math.PI / 2).get(0);

        assertEquals(500, b.getPosition().getX(), 1e-9);
        assertTrue(b.getPosition().getY() > 500);
        assertEquals(0, b.getVx(), 1e-9);
        assertEquals(WeaponType.PISTOL.getSpeed(), b.getVy(), 1e-9);
    }

    private Shape shapeOf(BulletEntity b) {
        return new Shape(b.ref(), b.getPosition(), settings.radiusOf(EntityKind.BULLET));
    }
}
