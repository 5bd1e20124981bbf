package com.projectgroup5.arena.game;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 玩家状态（服务器权威）。不可变，世界里替换为更新后的副本
 */
public final class PlayerEntity implements Entity {
    private final int id;
    private final String name;
    private final Position position;
    private final int health;
    private final Set<Integer> inventory;
    private final WeaponType lastFired;
    private final double heading;

    public PlayerEntity(int id, String name, Position position, int health,
                        Set<Integer> inventory, WeaponType lastFired, double heading) {
        this.id = id;
        this.name = name;
        this.position = position;
        this.health = health;
        this.inventory = Collections.unmodifiableSet(new LinkedHashSet<>(inventory));
        this.lastFired = lastFired;
        this.heading = heading;
    }

    public PlayerEntity withPosition(Position newPosition) {
        return new PlayerEntity(id, name, newPosition, health, inventory, lastFired, heading);
    }

    public PlayerEntity withHealth(int newHealth) {
        return new PlayerEntity(id, name, position, newHealth, inventory, lastFired, heading);
    }

    public PlayerEntity withGun(int gunId) {
        Set<Integer> inv = new LinkedHashSet<>(inventory);
        inv.add(gunId);
        return new PlayerEntity(id, name, position, health, inv, lastFired, heading);
    }

    public PlayerEntity withoutGun(int gunId) {
        Set<Integer> inv = new LinkedHashSet<>(inventory);
        inv.remove(gunId);
        return new PlayerEntity(id, name, position, health, inv, lastFired, heading);
    }

    public PlayerEntity withLastFired(WeaponType type) {
        return new PlayerEntity(id, name, position, health, inventory, type, heading);
    }

    public PlayerEntity withHeading(double newHeading) {
        return new PlayerEntity(id, name, position, health, inventory, lastFired, newHeading);
    }

    public boolean isDead() {
        return health <= 0;
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.PLAYER;
    }

    @Override
    public int getId() {
        return id;
    }

    @Override
    public Position getPosition() {
        return position;
    }

    public String getName() {
        return name;
    }

    public int getHealth() {
        return health;
    }

    public Set<Integer> getInventory() {
        return inventory;
    }

    /** 还未开火时为 null */
    public WeaponType getLastFired() {
        return lastFired;
    }

    public double getHeading() {
        return heading;
    }
}
