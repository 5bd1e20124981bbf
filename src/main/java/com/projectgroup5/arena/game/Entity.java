package com.projectgroup5.arena.game;

/**
 * Common view of every game object stored in a {@link GameWorld}.
 */
public interface Entity {

    /** Owner id of unowned guns and unattributed bullets. */
    int NO_OWNER = -1;

    EntityKind getKind();

    int getId();

    Position getPosition();

    default EntityRef ref() {
        return new EntityRef(getKind(), getId());
    }
}
