package com.projectgroup5.arena.game;

/**
 * 枪械。无主的枪作为拾取物留在地图上；被拥有的枪只存在于持有者的背包中，没有碰撞形状
 */
public final class GunEntity implements Entity {
    private final int id;
    private final Position position;
    private final WeaponType weaponType;
    private final int ownerId;
    private final int ammo;
    private final int cooldown;
    private final int cooldownRate;

    public GunEntity(int id, Position position, WeaponType weaponType, int ownerId,
                     int ammo, int cooldown, int cooldownRate) {
        this.id = id;
        this.position = position;
        this.weaponType = weaponType;
        this.ownerId = ownerId;
        this.ammo = ammo;
        this.cooldown = cooldown;
        this.cooldownRate = cooldownRate;
    }

    public GunEntity withOwner(int newOwnerId) {
        return new GunEntity(id, position, weaponType, newOwnerId, ammo, cooldown, cooldownRate);
    }

    public GunEntity withAmmo(int newAmmo) {
        return new GunEntity(id, position, weaponType, ownerId, newAmmo, cooldown, cooldownRate);
    }

    public GunEntity withCooldown(int newCooldown) {
        return new GunEntity(id, position, weaponType, ownerId, ammo, newCooldown, cooldownRate);
    }

    public boolean isOwned() {
        return ownerId != NO_OWNER;
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.GUN;
    }

    @Override
    public int getId() {
        return id;
    }

    @Override
    public Position getPosition() {
        return position;
    }

    public WeaponType getWeaponType() {
        return weaponType;
    }

    public int getOwnerId() {
        return ownerId;
    }

    public int getAmmo() {
        return ammo;
    }

    public int getCooldown() {
        return cooldown;
    }

    public int getCooldownRate() {
        return cooldownRate;
    }
}
