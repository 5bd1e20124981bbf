package com.projectgroup5.arena.game;

/**
 * 岩石障碍物，开局放置，不会移动
 */
public final class RockEntity implements Entity {
    private final int id;
    private final Position position;

    public RockEntity(int id, Position position) {
        this.id = id;
        this.position = position;
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.ROCK;
    }

    @Override
    public int getId() {
        return id;
    }

    @Override
    public Position getPosition() {
        return position;
    }
}
