package com.projectgroup5.arena.game;

/**
 * Entity kinds, declared in collision priority order.
 * Players come first, then bullets, then the stationary kinds.
 */
public enum EntityKind {
    PLAYER,
    BULLET,
    AMMO,
    GUN,
    ROCK
}
