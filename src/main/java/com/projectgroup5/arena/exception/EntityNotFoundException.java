package com.projectgroup5.arena.exception;

import com.projectgroup5.arena.game.EntityKind;

/**
 * A player or gun id that does not exist in the game.
 */
public class EntityNotFoundException extends RuntimeException {
    private final EntityKind kind;
    private final int id;

    public EntityNotFoundException(EntityKind kind, int id) {
        super(kind.name().toLowerCase() + " not found: " + id);
        this.kind = kind;
        this.id = id;
    }

    public EntityKind getKind() {
        return kind;
    }

    public int getId() {
        return id;
    }
}
