package com.projectgroup5.arena.game;

import java.util.Objects;

/**
 * Two overlapping shapes. Order is whatever the producer chose;
 * use {@link #canonical()} before dispatching on kinds.
 */
public final class CollisionPair {
    private final Shape first;
    private final Shape second;

    public CollisionPair(Shape first, Shape second) {
        this.first = Objects.requireNonNull(first, "first");
        this.second = Objects.requireNonNull(second, "second");
    }

    public Shape getFirst() {
        return first;
    }

    public Shape getSecond() {
        return second;
    }

    /**
     * Orders the pair by {@link EntityKind} declaration order, so the
     * higher-priority kind is always first.
     */
    public CollisionPair canonical() {
        if (second.getKind().ordinal() < first.getKind().ordinal()) {
            return new CollisionPair(second, first);
        }
        return this;
    }

    /** True if both pairs name the same two entities, in either order. */
    public boolean sameEntities(CollisionPair other) {
        EntityRef a = first.getRef();
        EntityRef b = second.getRef();
        return (a.equals(other.first.getRef()) && b.equals(other.second.getRef()))
                || (a.equals(other.second.getRef()) && b.equals(other.first.getRef()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CollisionPair)) return false;
        CollisionPair that = (CollisionPair) o;
        return first.equals(that.first) && second.equals(that.second);
    }

    @Override
    public int hashCode() {
        return Objects.hash(first, second);
    }

    @Override
    public String toString() {
        return "[" + first + " x " + second + "]";
    }
}
