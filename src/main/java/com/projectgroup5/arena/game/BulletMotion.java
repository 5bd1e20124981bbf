package com.projectgroup5.arena.game;

/**
 * Per-tick flight rules for bullets.
 */
public enum BulletMotion {
    /** Constant velocity. */
    STRAIGHT {
        @Override
        public BulletEntity advance(BulletEntity b) {
            return b.next(b.getPosition().move(b.getVx(), b.getVy()), b.getVx(), b.getVy());
        }
    },
    /** Constant heading, speed decays each tick. */
    SPREAD {
        @Override
        public BulletEntity advance(BulletEntity b) {
            return b.next(b.getPosition().move(b.getVx(), b.getVy()),
                    b.getVx() * SPREAD_DRAG, b.getVy() * SPREAD_DRAG);
        }
    },
    /** Velocity vector turns by a fixed angle each tick. */
    ARCING {
        @Override
        public BulletEntity advance(BulletEntity b) {
            double cos = Math.cos(ARC_TURN);
            double sin = Math.sin(ARC_TURN);
            double vx = b.getVx() * cos - b.getVy() * sin;
            double vy = b.getVx() * sin + b.getVy() * cos;
            return b.next(b.getPosition().move(b.getVx(), b.getVy()), vx, vy);
        }
    };

    static final double SPREAD_DRAG = 0.96;
    static final double ARC_TURN = 0.04; // radians per tick

    public abstract BulletEntity advance(BulletEntity bullet);
}
