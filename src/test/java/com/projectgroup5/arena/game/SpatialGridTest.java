package com.projectgroup5.arena.game;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link SpatialGrid}.
 */
class SpatialGridTest {

    private SpatialGrid grid;

    @BeforeEach
    void setUp() {
        grid = new SpatialGrid(20, new Random(7), 1000);
    }

    private static Shape rock(int id, double x, double y) {
        return new Shape(EntityKind.ROCK, id, x, y, 20);
    }

    private static Shape player(int id, double x, double y) {
        return new Shape(EntityKind.PLAYER, id, x, y, 10);
    }

    @Test
    void test_doesNotModifyGrid() {
        grid.update(rock(1, 100, 100));
        Shape probe = player(2, 110, 100);

        List<Shape> first = grid.test(probe);
        List<Shape> second = grid.test(probe);

        assertEquals(first, second);
        assertEquals(1, first.size());
        assertEquals(1, grid.size());
        assertFalse(grid.contains(probe.getRef()));
    }

    @Test
    void test_disjointProbe_returnsEmpty() {
        grid.update(rock(1, 100, 100));
        grid.update(rock(2, 400, 400));

        assertTrue(grid.test(player(3, 250, 250)).isEmpty());
    }

    @Test
    void test_skipsShapeWithSameIdentity() {
        Shape p = player(1, 50, 50);
        grid.update(p);

        assertTrue(grid.test(p.movedTo(new Position(52, 50))).isEmpty());
    }

    @Test
    void test_tangentCircles_doNotOverlap() {
        grid.update(rock(1, 100, 100));

        // 20 + 10 = 30 exactly
        assertTrue(grid.test(player(2, 130, 100)).isEmpty());
        assertEquals(1, grid.test(player(2, 129.999, 100)).size());
    }

    @Test
    void all_reportsEachPairOnce() {
        Shape a = player(1, 100, 100);
        Shape b = player(2, 115, 100);
        grid.update(a);
        grid.update(b);

        List<CollisionPair> pairs = grid.all();

        assertEquals(1, pairs.size());
        assertTrue(pairs.get(0).sameEntities(new CollisionPair(a, b)));
    }

    @Test
    void all_findsPairsAcrossCellBoundaries() {
        // cell size is 40; these sit either side of x = 40 and y = 40
        Shape a = player(1, 39, 39);
        Shape b = player(2, 41, 41);
        grid.update(a);
        grid.update(b);

        assertEquals(1, grid.all().size());
        assertEquals(List.of(b), grid.test(a));
    }

    @Test
    void all_afterRemove_dropsPair() {
        Shape a = player(1, 100, 100);
        Shape b = player(2, 115, 100);
        grid.update(a);
        grid.update(b);

        grid.remove(b);

        assertTrue(grid.all().isEmpty());
        assertEquals(1, grid.size());
    }

    @Test
    void update_replacesGeometryForSameIdentity() {
        grid.update(player(1, 100, 100));
        grid.update(player(1, 500, 500));

        assertEquals(1, grid.size());
        assertEquals(new Position(500, 500), grid.get(new EntityRef(EntityKind.PLAYER, 1)).getCenter());
        assertTrue(grid.test(player(9, 100, 100)).isEmpty());
        assertEquals(1, grid.test(player(9, 505, 500)).size());
    }

    @Test
    void updateThenRemove_leavesGridAsBefore() {
        grid.update(rock(1, 100, 100));
        List<CollisionPair> before = grid.all();

        Shape p = player(2, 110, 100);
        grid.update(p);
        grid.remove(p.getRef());

        assertEquals(before, grid.all());
        assertEquals(1, grid.size());
        assertNull(grid.get(p.getRef()));
    }

    @Test
    void remove_absent_isNoOp() {
        grid.update(rock(1, 100, 100));
        grid.remove(new EntityRef(EntityKind.BULLET, 99));
        assertEquals(1, grid.size());
    }

    @Test
    void test_largeShape_reachesBeyondAdjacentCells() {
        Shape big = new Shape(EntityKind.ROCK, 1, 200, 200, 120);
        grid.update(big);

        assertEquals(1, grid.test(player(2, 320, 200)).size());
        assertEquals(1, grid.test(player(3, 90, 200)).size());

        grid.update(player(2, 320, 200));
        assertEquals(1, grid.all().size());
    }

    @Test
    void free_returnsPositionClearOfEverything() {
        for (int i = 0; i < 20; i++) {
            grid.update(rock(i, 50 + i * 45, 200));
        }

        for (int i = 0; i < 50; i++) {
            Position p = grid.free(1000, 1000, 10);
            assertTrue(p.getX() >= 10 && p.getX() <= 990);
            assertTrue(p.getY() >= 10 && p.getY() <= 990);
            assertTrue(grid.test(new Shape(EntityKind.PLAYER, 999, p.getX(), p.getY(), 10)).isEmpty());
        }
        assertEquals(20, grid.size());
    }

    @Test
    void free_fullMap_throws() {
        SpatialGrid small = new SpatialGrid(20, new Random(1), 50);
        small.update(new Shape(EntityKind.ROCK, 1, 50, 50, 20));
        small.update(new Shape(EntityKind.ROCK, 2, 50, 50, 100));

        assertThrows(IllegalStateException.class, () -> small.free(100, 100, 10));
    }

    @Test
    void all_matchesBruteForce() {
        Random random = new Random(42);
        List<Shape> placed = new ArrayList<>();
        for (int i = 0; i < 300; i++) {
            double r = 2 + random.nextDouble() * 18;
            Shape s = new Shape(EntityKind.BULLET, i, random.nextDouble() * 600, random.nextDouble() * 600, r);
            placed.add(s);
            grid.update(s);
        }

        Set<String> expected = new HashSet<>();
        for (int i = 0; i < placed.size(); i++) {
            for (int j = i + 1; j < placed.size(); j++) {
                if (placed.get(i).overlaps(placed.get(j))) {
                    expected.add(key(placed.get(i), placed.get(j)));
                }
            }
        }

        List<CollisionPair> pairs = grid.all();
        Set<String> actual = new HashSet<>();
        for (CollisionPair pair : pairs) {
            actual.add(key(pair.getFirst(), pair.getSecond()));
        }

        assertEquals(expected.size(), pairs.size());
        assertEquals(expected, actual);

        Shape probe = new Shape(EntityKind.PLAYER, 1000, 300, 300, 40);
        long bruteHits = placed.stream().filter(probe::overlaps).count();
        assertEquals(bruteHits, grid.test(probe).size());
    }

    private static String key(Shape a, Shape b) {
        int lo = Math.min(a.getId(), b.getId());
        int hi = Math.max(a.getId(), b.getId());
        return lo + ":" + hi;
    }
}
