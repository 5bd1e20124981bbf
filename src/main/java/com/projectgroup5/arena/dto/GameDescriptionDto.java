package com.projectgroup5.arena.dto;

import java.util.List;

public class GameDescriptionDto {
    private long gameId;
    private String gameName;
    private List<String> players;   // player names, in join order

    public long getGameId() { return gameId; }
    public void setGameId(long gameId) { this.gameId = gameId; }

    public String getGameName() { return gameName; }
    public void setGameName(String gameName) { this.gameName = gameName; }

    public List<String> getPlayers() { return players; }
    public void setPlayers(List<String> players) { this.players = players; }
}
