package com.projectgroup5.arena.game;

import java.util.Collection;
import java.util.List;

/**
 * Supplies new entity records with ids unique inside one game.
 * Placement is the caller's job: every method receives an already free position.
 */
public interface EntityGenerator {

    /** Ammo whose type matches one of {@code gunTypes} when any are given. */
    AmmoEntity ammo(Position at, Collection<WeaponType> gunTypes);

    GunEntity gun(Position at);

    RockEntity rock(Position at);

    PlayerEntity player(Position at, String name);

    /** Bullets for one trigger pull of {@code gun} by {@code shooter}, aimed along {@code heading}. */
    List<BulletEntity> bullets(PlayerEntity shooter, GunEntity gun, double heading);
}
