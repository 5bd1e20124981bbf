package com.projectgroup5.arena.dto;

public class FireRequest {
    private Integer playerId;
    private Integer gunId;
    // 可选瞄准点；不填则沿玩家朝向射击
    private Double targetX;
    private Double targetY;

    public Integer getPlayerId() { return playerId; }
    public void setPlayerId(Integer playerId) { this.playerId = playerId; }

    public Integer getGunId() { return gunId; }
    public void setGunId(Integer gunId) { this.gunId = gunId; }

    public Double getTargetX() { return targetX; }
    public void setTargetX(Double targetX) { this.targetX = targetX; }

    public Double getTargetY() { return targetY; }
    public void setTargetY(Double targetY) { this.targetY = targetY; }
}
