package com.projectgroup5.arena.game;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Uniform-grid spatial index over circular {@link Shape}s.
 *
 * Each shape lives in the single cell that contains its centre. The cell size is twice the
 * largest radius the grid was configured for, so two overlapping shapes of configured size are
 * always in the same or adjacent cells; larger shapes widen the searched neighbourhood.
 *
 * Not thread-safe. Callers hold the owning game's lock.
 */
public class SpatialGrid {

    private final double cellSize;
    private final Random random;
    private final int maxFreeAttempts;

    // ref -> stored geometry
    private final Map<EntityRef, Shape> shapes = new LinkedHashMap<>();
    // packed cell key -> shapes whose centre falls in that cell
    private final Map<Long, Map<EntityRef, Shape>> cells = new LinkedHashMap<>();

    // largest radius ever stored; only grows
    private double largestRadius;

    public SpatialGrid(double maxRadius, Random random, int maxFreeAttempts) {
        if (maxRadius <= 0) {
            throw new IllegalArgumentException("maxRadius must be positive: " + maxRadius);
        }
        this.cellSize = maxRadius * 2;
        this.random = random;
        this.maxFreeAttempts = maxFreeAttempts;
        this.largestRadius = maxRadius;
    }

    /** Inserts the shape, or replaces the stored geometry for its identity. */
    public void update(Shape shape) {
        Shape previous = shapes.put(shape.getRef(), shape);
        if (previous != null) {
            detach(previous);
        }
        cells.computeIfAbsent(cellKeyOf(shape.getCenter()), k -> new LinkedHashMap<>())
                .put(shape.getRef(), shape);
        largestRadius = Math.max(largestRadius, shape.getRadius());
    }

    /** Removes the geometry stored for this shape's identity; no-op if absent. */
    public void remove(Shape shape) {
        remove(shape.getRef());
    }

    public void remove(EntityRef ref) {
        Shape previous = shapes.remove(ref);
        if (previous != null) {
            detach(previous);
        }
    }

    /**
     * Stored shapes that overlap {@code probe}. A stored shape with the probe's own identity is
     * never reported. Does not modify the grid.
     */
    public List<Shape> test(Shape probe) {
        List<Shape> hits = new ArrayList<>();
        int reach = reachFor(probe.getRadius());
        int cx = cellCoord(probe.getCenter().getX());
        int cy = cellCoord(probe.getCenter().getY());
        for (int dx = -reach; dx <= reach; dx++) {
            for (int dy = -reach; dy <= reach; dy++) {
                Map<EntityRef, Shape> cell = cells.get(packKey(cx + dx, cy + dy));
                if (cell == null) continue;
                for (Shape stored : cell.values()) {
                    if (stored.getRef().equals(probe.getRef())) continue;
                    if (stored.overlaps(probe)) {
                        hits.add(stored);
                    }
                }
            }
        }
        return hits;
    }

    /**
     * Every unordered pair of overlapping stored shapes, each exactly once.
     * A cell is compared with itself and with the forward half of its neighbourhood.
     */
    public List<CollisionPair> all() {
        List<CollisionPair> pairs = new ArrayList<>();
        int reach = reachFor(largestRadius);
        for (Map.Entry<Long, Map<EntityRef, Shape>> entry : cells.entrySet()) {
            int cx = unpackX(entry.getKey());
            int cy = unpackY(entry.getKey());
            List<Shape> here = new ArrayList<>(entry.getValue().values());

            for (int i = 0; i < here.size(); i++) {
                for (int j = i + 1; j < here.size(); j++) {
                    if (here.get(i).overlaps(here.get(j))) {
                        pairs.add(new CollisionPair(here.get(i), here.get(j)));
                    }
                }
            }

            for (int dx = 0; dx <= reach; dx++) {
                for (int dy = -reach; dy <= reach; dy++) {
                    if (dx == 0 && dy <= 0) continue;
                    Map<EntityRef, Shape> neighbour = cells.get(packKey(cx + dx, cy + dy));
                    if (neighbour == null) continue;
                    for (Shape a : here) {
                        for (Shape b : neighbour.values()) {
                            if (a.overlaps(b)) {
                                pairs.add(new CollisionPair(a, b));
                            }
                        }
                    }
                }
            }
        }
        return pairs;
    }

    /**
     * A centre inside {@code [clearance, size - clearance]} on both axes where a circle of radius
     * {@code clearance} overlaps nothing stored. Inserts nothing.
     *
     * @throws IllegalStateException if no slot is found within the attempt budget
     */
    public Position free(double width, double height, double clearance) {
        EntityRef probeRef = new EntityRef(EntityKind.ROCK, Integer.MIN_VALUE);
        for (int attempt = 0; attempt < maxFreeAttempts; attempt++) {
            double x = sample(clearance, width - clearance);
            double y = sample(clearance, height - clearance);
            Shape probe = new Shape(probeRef, new Position(x, y), clearance);
            if (test(probe).isEmpty()) {
                return probe.getCenter();
            }
        }
        throw new IllegalStateException("No free position after " + maxFreeAttempts + " attempts");
    }

    public Shape get(EntityRef ref) {
        return shapes.get(ref);
    }

    public boolean contains(EntityRef ref) {
        return shapes.containsKey(ref);
    }

    public int size() {
        return shapes.size();
    }

    // ==================== internals ====================

    private double sample(double min, double max) {
        if (max <= min) {
            return (min + max) / 2;
        }
        return min + random.nextDouble() * (max - min);
    }

    private void detach(Shape shape) {
        long key = cellKeyOf(shape.getCenter());
        Map<EntityRef, Shape> cell = cells.get(key);
        if (cell != null) {
            cell.remove(shape.getRef());
            if (cell.isEmpty()) {
                cells.remove(key);
            }
        }
    }

    private int reachFor(double probeRadius) {
        return Math.max(1, (int) Math.ceil((probeRadius + largestRadius) / cellSize));
    }

    private int cellCoord(double v) {
        return (int) Math.floor(v / cellSize);
    }

    private long cellKeyOf(Position p) {
        return packKey(cellCoord(p.getX()), cellCoord(p.getY()));
    }

    private static long packKey(int cx, int cy) {
        return ((long) cx << 32) | (cy & 0xffffffffL);
    }

    private static int unpackX(long key) {
        return (int) (key >> 32);
    }

    private static int unpackY(long key) {
        return (int) key;
    }
}
