package com.projectgroup5.arena.config;

import com.projectgroup5.arena.game.EntityKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 游戏参数，从 application.properties 的 {@code arena.*} 绑定。
 * 下面的默认值就是服务器的出厂配置；非法值在启动时即被拒绝。
 */
@Validated
@ConfigurationProperties(prefix = "arena")
public class ArenaProperties {

    @Positive
    private long tickMillis = 33;

    @Positive
    private double mapWidth = 1000;
    @Positive
    private double mapHeight = 1000;

    // 安全区
    @Positive
    private double safeZoneRadius = 710;
    @PositiveOrZero
    private double constrictRate = 0.05;

    @PositiveOrZero
    private double visionRadius = 300;

    @PositiveOrZero
    private int bulletTimeout = 60;
    @Positive
    private int gunCooldownDecay = 1;

    // 刷新间隔按帧计，取模用，必须为正
    @Positive
    private int ammoSpawnInterval = 300;
    @PositiveOrZero
    private int ammoSpawnCount = 5;
    @Positive
    private int gunSpawnInterval = 900;
    @PositiveOrZero
    private int gunSpawnCount = 2;

    @PositiveOrZero
    private int initialRocks = 40;
    @PositiveOrZero
    private int initialGuns = 10;
    @PositiveOrZero
    private int initialAmmo = 30;

    @Positive
    private int playerHealth = 100;

    @Positive
    private int freeAttempts = 1000;

    /** null = 用系统时间作为随机种子 */
    private Long seed;

    @Valid
    @NotNull
    private final Radius radius = new Radius();

    /** 各类实体的碰撞半径 */
    public static class Radius {
        @Positive
        private double player = 10;
        @Positive
        private double bullet = 2;
        @Positive
        private double ammo = 5;
        @Positive
        private double gun = 6;
        @Positive
        private double rock = 20;

        public double getPlayer() { return player; }
        public void setPlayer(double player) { this.player = player; }

        public double getBullet() { return bullet; }
        public void setBullet(double bullet) { this.bullet = bullet; }

        public double getAmmo() { return ammo; }
        public void setAmmo(double ammo) { this.ammo = ammo; }

        public double getGun() { return gun; }
        public void setGun(double gun) { this.gun = gun; }

        public double getRock() { return rock; }
        public void setRock(double rock) { this.rock = rock; }
    }

    public double radiusOf(EntityKind kind) {
        return switch (kind) {
            case PLAYER -> radius.player;
            case BULLET -> radius.bullet;
            case AMMO -> radius.ammo;
            case GUN -> radius.gun;
            case ROCK -> radius.rock;
        };
    }

    public double maxRadius() {
        double max = 0;
        for (EntityKind kind : EntityKind.values()) {
            max = Math.max(max, radiusOf(kind));
        }
        return max;
    }

    // Getters & Setters
    public long getTickMillis() { return tickMillis; }
    public void setTickMillis(long tickMillis) { this.tickMillis = tickMillis; }

    public double getMapWidth() { return mapWidth; }
    public void setMapWidth(double mapWidth) { this.mapWidth = mapWidth; }

    public double getMapHeight() { return mapHeight; }
    public void setMapHeight(double mapHeight) { this.mapHeight = mapHeight; }

    public double getSafeZoneRadius() { return safeZoneRadius; }
    public void setSafeZoneRadius(double safeZoneRadius) { this.safeZoneRadius = safeZoneRadius; }

    public double getConstrictRate() { return constrictRate; }
    public void setConstrictRate(double constrictRate) { this.constrictRate = constrictRate; }

    public double getVisionRadius() { return visionRadius; }
    public void setVisionRadius(double visionRadius) { this.visionRadius = visionRadius; }

    public int getBulletTimeout() { return bulletTimeout; }
    public void setBulletTimeout(int bulletTimeout) { this.bulletTimeout = bulletTimeout; }

    public int getGunCooldownDecay() { return gunCooldownDecay; }
    public void setGunCooldownDecay(int gunCooldownDecay) { this.gunCooldownDecay = gunCooldownDecay; }

    public int getAmmoSpawnInterval() { return ammoSpawnInterval; }
    public void setAmmoSpawnInterval(int ammoSpawnInterval) { this.ammoSpawnInterval = ammoSpawnInterval; }

    public int getAmmoSpawnCount() { return ammoSpawnCount; }
    public void setAmmoSpawnCount(int ammoSpawnCount) { this.ammoSpawnCount = ammoSpawnCount; }

    public int getGunSpawnInterval() { return gunSpawnInterval; }
    public void setGunSpawnInterval(int gunSpawnInterval) { this.gunSpawnInterval = gunSpawnInterval; }

    public int getGunSpawnCount() { return gunSpawnCount; }
    public void setGunSpawnCount(int gunSpawnCount) { this.gunSpawnCount = gunSpawnCount; }

    public int getInitialRocks() { return initialRocks; }
    public void setInitialRocks(int initialRocks) { this.initialRocks = initialRocks; }

    public int getInitialGuns() { return initialGuns; }
    public void setInitialGuns(int initialGuns) { this.initialGuns = initialGuns; }

    public int getInitialAmmo() { return initialAmmo; }
    public void setInitialAmmo(int initialAmmo) { this.initialAmmo = initialAmmo; }

    public int getPlayerHealth() { return playerHealth; }
    public void setPlayerHealth(int playerHealth) { this.playerHealth = playerHealth; }

    public int getFreeAttempts() { return freeAttempts; }
    public void setFreeAttempts(int freeAttempts) { this.freeAttempts = freeAttempts; }

    public Long getSeed() { return seed; }
    public void setSeed(Long seed) { this.seed = seed; }

    public Radius getRadius() { return radius; }
}
