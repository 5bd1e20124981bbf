package com.projectgroup5.arena.dto;

public class CreateGameRequest {
    private String gameName;
    private String playerName;

    public String getGameName() { return gameName; }
    public void setGameName(String gameName) { this.gameName = gameName; }

    public String getPlayerName() { return playerName; }
    public void setPlayerName(String playerName) { this.playerName = playerName; }
}
