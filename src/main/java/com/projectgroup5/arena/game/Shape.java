package com.projectgroup5.arena.game;

import java.util.Objects;

/**
 * Collision geometry of one entity: identity, centre and radius.
 * Carries no game semantics; the grid only ever looks at this.
 */
public final class Shape {
    private final EntityRef ref;
    private final Position center;
    private final double radius;

    public Shape(EntityRef ref, Position center, double radius) {
        this.ref = Objects.requireNonNull(ref, "ref");
        this.center = Objects.requireNonNull(center, "center");
        this.radius = radius;
    }

    public Shape(EntityKind kind, int id, double x, double y, double radius) {
        this(new EntityRef(kind, id), new Position(x, y), radius);
    }

    public EntityRef getRef() {
        return ref;
    }

    public EntityKind getKind() {
        return ref.getKind();
    }

    public int getId() {
        return ref.getId();
    }

    public Position getCenter() {
        return center;
    }

    public double getRadius() {
        return radius;
    }

    public Shape movedTo(Position position) {
        return new Shape(ref, position, radius);
    }

    /** Tangent circles do not overlap. */
    public boolean overlaps(Shape other) {
        double reach = radius + other.radius;
        return center.squaredDistanceTo(other.center) < reach * reach;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Shape)) return false;
        Shape that = (Shape) o;
        return Double.compare(that.radius, radius) == 0
                && ref.equals(that.ref)
                && center.equals(that.center);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ref, center, radius);
    }

    @Override
    public String toString() {
        return ref + "@" + center + "r" + radius;
    }
}
