package com.projectgroup5.arena.game;

/**
 * A projectile in flight. {@link BulletMotion} decides how it advances each tick.
 */
public final class BulletEntity implements Entity {
    private final int id;
    private final Position position;
    private final double vx;
    private final double vy;
    private final int damage;
    private final int ownerId;
    private final int age;
    private final BulletMotion motion;

    public BulletEntity(int id, Position position, double vx, double vy,
                        int damage, int ownerId, int age, BulletMotion motion) {
        this.id = id;
        this.position = position;
        this.vx = vx;
        this.vy = vy;
        this.damage = damage;
        this.ownerId = ownerId;
        this.age = age;
        this.motion = motion;
    }

    /** One tick of flight: new position, new velocity, age + 1. */
    public BulletEntity step() {
        return motion.advance(this);
    }

    BulletEntity next(Position newPosition, double newVx, double newVy) {
        return new BulletEntity(id, newPosition, newVx, newVy, damage, ownerId, age + 1, motion);
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.BULLET;
    }

    @Override
    public int getId() {
        return id;
    }

    @Override
    public Position getPosition() {
        return position;
    }

    public double getVx() {
        return vx;
    }

    public double getVy() {
        return vy;
    }

    public int getDamage() {
        return damage;
    }

    public int getOwnerId() {
        return ownerId;
    }

    public int getAge() {
        return age;
    }

    public BulletMotion getMotion() {
        return motion;
    }
}
