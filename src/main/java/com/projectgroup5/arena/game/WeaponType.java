package com.projectgroup5.arena.game;

/**
 * Weapon catalogue. Bullet generation reads everything it needs from here.
 */
public enum WeaponType {
    //       damage pellets spread speed cooldown ammoDrop motion
    PISTOL(  10,    1,      0.0,   8.0,  10,      12,      BulletMotion.STRAIGHT),
    SHOTGUN( 8,     5,      0.18,  7.0,  30,      6,       BulletMotion.SPREAD),
    RIFLE(   25,    1,      0.0,   14.0, 45,      5,       BulletMotion.STRAIGHT),
    CURVE(   15,    1,      0.0,   6.0,  20,      8,       BulletMotion.ARCING);

    private final int damage;
    private final int pellets;
    private final double spread;
    private final double speed;
    private final int cooldownRate;
    private final int ammoPerDrop;
    private final BulletMotion motion;

    WeaponType(int damage, int pellets, double spread, double speed,
               int cooldownRate, int ammoPerDrop, BulletMotion motion) {
        this.damage = damage;
        this.pellets = pellets;
        this.spread = spread;
        this.speed = speed;
        this.cooldownRate = cooldownRate;
        this.ammoPerDrop = ammoPerDrop;
        this.motion = motion;
    }

    public int getDamage() {
        return damage;
    }

    public int getPellets() {
        return pellets;
    }

    /** Angle between neighbouring pellets, radians. */
    public double getSpread() {
        return spread;
    }

    public double getSpeed() {
        return speed;
    }

    public int getCooldownRate() {
        return cooldownRate;
    }

    public int getAmmoPerDrop() {
        return ammoPerDrop;
    }

    public BulletMotion getMotion() {
        return motion;
    }
}
