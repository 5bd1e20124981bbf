package com.projectgroup5.arena.game;

import java.util.Objects;

/**
 * Identity of an entity inside one game: its kind plus its id.
 */
public final class EntityRef {
    private final EntityKind kind;
    private final int id;

    public EntityRef(EntityKind kind, int id) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.id = id;
    }

    public EntityKind getKind() {
        return kind;
    }

    public int getId() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EntityRef)) return false;
        EntityRef that = (EntityRef) o;
        return id == that.id && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, id);
    }

    @Override
    public String toString() {
        return kind + "#" + id;
    }
}
