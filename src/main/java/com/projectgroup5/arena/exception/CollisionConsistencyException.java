package com.projectgroup5.arena.exception;

import com.projectgroup5.arena.game.CollisionPair;

/**
 * 两个静止实体重叠：放置或空间索引出错，本帧无法继续
 */
public class CollisionConsistencyException extends IllegalStateException {
    private final transient CollisionPair pair;

    public CollisionConsistencyException(CollisionPair pair) {
        super("Unresolvable collision " + pair);
        this.pair = pair;
    }

    public CollisionPair getPair() {
        return pair;
    }
}
