package com.projectgroup5.arena.game;

import java.util.Objects;

/**
 * Immutable 2D point in world coordinates.
 */
public final class Position {
    private final double x;
    private final double y;

    public Position(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public Position move(double dx, double dy) {
        return new Position(x + dx, y + dy);
    }

    public double squaredDistanceTo(Position other) {
        double dx = other.x - x;
        double dy = other.y - y;
        return dx * dx + dy * dy;
    }

    /** Strictly inside the circle of radius {@code radius} around this point. */
    public boolean isWithin(Position other, double radius) {
        return radius * radius > squaredDistanceTo(other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Position)) return false;
        Position that = (Position) o;
        return Double.compare(that.x, x) == 0 && Double.compare(that.y, y) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
