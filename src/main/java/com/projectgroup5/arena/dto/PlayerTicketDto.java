package com.projectgroup5.arena.dto;

/**
 * 创建 / 加入游戏的返回值：所在游戏，以及调用方控制的玩家
 */
public class PlayerTicketDto {
    private long gameId;
    private int playerId;

    public PlayerTicketDto() {
    }

    public PlayerTicketDto(long gameId, int playerId) {
        this.gameId = gameId;
        this.playerId = playerId;
    }

    public long getGameId() { return gameId; }
    public void setGameId(long gameId) { this.gameId = gameId; }

    public int getPlayerId() { return playerId; }
    public void setPlayerId(int playerId) { this.playerId = playerId; }
}
