package com.projectgroup5.arena.dto;

import java.util.List;

/**
 * 单个玩家视角的游戏状态：视野内的弹药、子弹、岩石，视野内或已拥有的枪，全部玩家，
 * 以及地图尺寸和当前安全区半径
 */
public class GameStateDto {
    private long id;
    private String name;
    private double[] size;
    private double radius;
    private long tick;
    private List<AmmoView> ammo;
    private List<BulletView> bullets;
    private List<GunView> guns;
    private List<PlayerView> players;
    private List<RockView> rocks;

    public long getId() { return id; }
    public void setId(long id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public double[] getSize() { return size; }
    public void setSize(double[] size) { this.size = size; }

    public double getRadius() { return radius; }
    public void setRadius(double radius) { this.radius = radius; }

    public long getTick() { return tick; }
    public void setTick(long tick) { this.tick = tick; }

    public List<AmmoView> getAmmo() { return ammo; }
    public void setAmmo(List<AmmoView> ammo) { this.ammo = ammo; }

    public List<BulletView> getBullets() { return bullets; }
    public void setBullets(List<BulletView> bullets) { this.bullets = bullets; }

    public List<GunView> getGuns() { return guns; }
    public void setGuns(List<GunView> guns) { this.guns = guns; }

    public List<PlayerView> getPlayers() { return players; }
    public void setPlayers(List<PlayerView> players) { this.players = players; }

    public List<RockView> getRocks() { return rocks; }
    public void setRocks(List<RockView> rocks) { this.rocks = rocks; }

    public static class AmmoView {
        private int id;
        private double[] pos;
        private String type;
        private int amount;

        public int getId() { return id; }
        public void setId(int id) { this.id = id; }

        public double[] getPos() { return pos; }
        public void setPos(double[] pos) { this.pos = pos; }

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public int getAmount() { return amount; }
        public void setAmount(int amount) { this.amount = amount; }
    }

    public static class BulletView {
        private int id;
        private double[] pos;
        private int owner;
        private int damage;

        public int getId() { return id; }
        public void setId(int id) { this.id = id; }

        public double[] getPos() { return pos; }
        public void setPos(double[] pos) { this.pos = pos; }

        public int getOwner() { return owner; }
        public void setOwner(int owner) { this.owner = owner; }

        public int getDamage() { return damage; }
        public void setDamage(int damage) { this.damage = damage; }
    }

    public static class GunView {
        private int id;
        private double[] pos;
        private String type;
        private int owner;
        private int ammo;
        private int cooldown;
        private int rate;

        public int getId() { return id; }
        public void setId(int id) { this.id = id; }

        public double[] getPos() { return pos; }
        public void setPos(double[] pos) { this.pos = pos; }

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public int getOwner() { return owner; }
        public void setOwner(int owner) { this.owner = owner; }

        public int getAmmo() { return ammo; }
        public void setAmmo(int ammo) { this.ammo = ammo; }

        public int getCooldown() { return cooldown; }
        public void setCooldown(int cooldown) { this.cooldown = cooldown; }

        public int getRate() { return rate; }
        public void setRate(int rate) { this.rate = rate; }
    }

    public static class PlayerView {
        private int id;
        private String name;
        private double[] pos;
        private int hp;
        private List<Integer> inventory;
        private String lastFired;

        public int getId() { return id; }
        public void setId(int id) { this.id = id; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public double[] getPos() { return pos; }
        public void setPos(double[] pos) { this.pos = pos; }

        public int getHp() { return hp; }
        public void setHp(int hp) { this.hp = hp; }

        public List<Integer> getInventory() { return inventory; }
        public void setInventory(List<Integer> inventory) { this.inventory = inventory; }

        public String getLastFired() { return lastFired; }
        public void setLastFired(String lastFired) { this.lastFired = lastFired; }
    }

    public static class RockView {
        private int id;
        private double[] pos;

        public int getId() { return id; }
        public void setId(int id) { this.id = id; }

        public double[] getPos() { return pos; }
        public void setPos(double[] pos) { this.pos = pos; }
    }
}
