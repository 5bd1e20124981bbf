package com.projectgroup5.arena.exception;

/**
 * 游戏不存在（或已结束）
 */
public class GameNotFoundException extends RuntimeException {
    private final long gameId;

    public GameNotFoundException(long gameId) {
        super("Game not found: " + gameId);
        this.gameId = gameId;
    }

    public long getGameId() {
        return gameId;
    }
}
