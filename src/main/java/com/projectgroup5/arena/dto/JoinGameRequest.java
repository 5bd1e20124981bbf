package com.projectgroup5.arena.dto;

public class JoinGameRequest {
    private String playerName;

    public String getPlayerName() { return playerName; }
    public void setPlayerName(String playerName) { this.playerName = playerName; }
}
