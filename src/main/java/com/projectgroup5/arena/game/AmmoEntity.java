package com.projectgroup5.arena.game;

/**
 * 弹药。持有同类型枪的玩家才能拾取
 */
public final class AmmoEntity implements Entity {
    private final int id;
    private final Position position;
    private final WeaponType ammoType;
    private final int amount;

    public AmmoEntity(int id, Position position, WeaponType ammoType, int amount) {
        this.id = id;
        this.position = position;
        this.ammoType = ammoType;
        this.amount = amount;
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.AMMO;
    }

    @Override
    public int getId() {
        return id;
    }

    @Override
    public Position getPosition() {
        return position;
    }

    public WeaponType getAmmoType() {
        return ammoType;
    }

    public int getAmount() {
        return amount;
    }
}
