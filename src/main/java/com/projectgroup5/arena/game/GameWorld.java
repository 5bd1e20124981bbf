package com.projectgroup5.arena.game;

import com.projectgroup5.arena.config.ArenaProperties;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 游戏世界状态（服务器权威）：按类型存放的实体、实体的空间索引、安全区和帧计数
 *
 * 所有读写都必须经过 {@link #locked(Supplier)} 或 {@link #runLocked(Runnable)}，
 * 内部的 Map 本身不做同步
 */
public class GameWorld {
    private final long gameId;
    private final String name;
    private final double width;
    private final double height;
    private final ArenaProperties settings;
    private final EntityGenerator generator;
    private final SpatialGrid grid;
    private final ReentrantLock lock = new ReentrantLock();

    private double safeZoneRadius;
    private long tick = 0;

    private final Map<Integer, AmmoEntity> ammo = new LinkedHashMap<>();
    private final Map<Integer, BulletEntity> bullets = new LinkedHashMap<>();
    private final Map<Integer, RockEntity> rocks = new LinkedHashMap<>();
    private final Map<Integer, GunEntity> guns = new LinkedHashMap<>();
    private final Map<Integer, PlayerEntity> players = new LinkedHashMap<>();

    public GameWorld(long gameId, String name, ArenaProperties settings,
                     EntityGenerator generator, Random random) {
        this.gameId = gameId;
        this.name = name;
        this.settings = settings;
        this.generator = generator;
        this.width = settings.getMapWidth();
        this.height = settings.getMapHeight();
        this.safeZoneRadius = settings.getSafeZoneRadius();
        this.grid = new SpatialGrid(settings.maxRadius(), random, settings.getFreeAttempts());
    }

    // ==================== 加锁 ====================

    public <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runLocked(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    // ==================== 几何 ====================

    public Shape shapeOf(Entity entity) {
        return new Shape(entity.ref(), entity.getPosition(), settings.radiusOf(entity.getKind()));
    }

    public Position freePosition(EntityKind kind) {
        return grid.free(width, height, settings.radiusOf(kind));
    }

    public boolean isInsideMap(Position p) {
        return p.getX() >= 0 && p.getY() >= 0 && p.getX() <= width && p.getY() <= height;
    }

    public Position center() {
        return new Position(width / 2, height / 2);
    }

    /** 到中心的距离严格大于安全区半径；半径为负时所有人都在圈外 */
    public boolean isOutsideSafeZone(Position p) {
        if (safeZoneRadius < 0) {
            return true;
        }
        return center().squaredDistanceTo(p) > safeZoneRadius * safeZoneRadius;
    }

    // ==================== 创建 ====================

    /** 初始地图：先岩石，再枪，最后弹药（弹药类型要匹配已有的枪） */
    public void seedInitialEntities() {
        for (int i = 0; i < settings.getInitialRocks(); i++) spawnRock();
        for (int i = 0; i < settings.getInitialGuns(); i++) spawnGun();
        for (int i = 0; i < settings.getInitialAmmo(); i++) spawnAmmo();
    }

    public AmmoEntity spawnAmmo() {
        AmmoEntity a = generator.ammo(freePosition(EntityKind.AMMO), gunTypes());
        addAmmo(a);
        return a;
    }

    public GunEntity spawnGun() {
        GunEntity g = generator.gun(freePosition(EntityKind.GUN));
        addGun(g);
        return g;
    }

    public RockEntity spawnRock() {
        RockEntity r = generator.rock(freePosition(EntityKind.ROCK));
        addRock(r);
        return r;
    }

    public PlayerEntity spawnPlayer(String playerName) {
        PlayerEntity p = generator.player(freePosition(EntityKind.PLAYER), playerName);
        addPlayer(p);
        return p;
    }

    public void addAmmo(AmmoEntity a) {
        ammo.put(a.getId(), a);
        grid.update(shapeOf(a));
    }

    public void addBullet(BulletEntity b) {
        bullets.put(b.getId(), b);
        grid.update(shapeOf(b));
    }

    public void addRock(RockEntity r) {
        rocks.put(r.getId(), r);
        grid.update(shapeOf(r));
    }

    /** 已被拥有的枪不进入索引 */
    public void addGun(GunEntity g) {
        guns.put(g.getId(), g);
        if (!g.isOwned()) {
            grid.update(shapeOf(g));
        }
    }

    public void addPlayer(PlayerEntity p) {
        players.put(p.getId(), p);
        grid.update(shapeOf(p));
    }

    // ==================== 替换（只改存储，不动索引） ====================

    public void replaceBullet(BulletEntity b) {
        bullets.put(b.getId(), b);
    }

    public void replaceGun(GunEntity g) {
        guns.put(g.getId(), g);
    }

    public void replacePlayer(PlayerEntity p) {
        players.put(p.getId(), p);
    }

    // ==================== 删除（已不存在时为空操作） ====================

    public boolean destroyAmmo(int id) {
        AmmoEntity a = ammo.remove(id);
        if (a == null) return false;
        grid.remove(a.ref());
        return true;
    }

    public boolean destroyBullet(int id) {
        BulletEntity b = bullets.remove(id);
        if (b == null) return false;
        grid.remove(b.ref());
        return true;
    }

    /** 同时从持有者的背包中移除 */
    public boolean destroyGun(int id) {
        GunEntity g = guns.remove(id);
        if (g == null) return false;
        grid.remove(g.ref());
        if (g.isOwned()) {
            PlayerEntity owner = players.get(g.getOwnerId());
            if (owner != null) {
                players.put(owner.getId(), owner.withoutGun(id));
            }
        }
        return true;
    }

    /** 持有的枪直接删除，不掉落 */
    public boolean destroyPlayer(int id) {
        PlayerEntity p = players.remove(id);
        if (p == null) return false;
        grid.remove(p.ref());
        for (Integer gunId : p.getInventory()) {
            GunEntity g = guns.remove(gunId);
            if (g != null) {
                grid.remove(g.ref());
            }
        }
        return true;
    }

    // ==================== 查询 ====================

    /** Owned gun of this weapon type in the player's inventory, or null. */
    public GunEntity findOwnedGun(PlayerEntity player, WeaponType type) {
        for (Integer gunId : player.getInventory()) {
            GunEntity g = guns.get(gunId);
            if (g != null && g.getWeaponType() == type) {
                return g;
            }
        }
        return null;
    }

    /** Weapon types of every gun in the game, owned or not. */
    public Set<WeaponType> gunTypes() {
        Set<WeaponType> types = new LinkedHashSet<>();
        for (GunEntity g : guns.values()) {
            types.add(g.getWeaponType());
        }
        return types;
    }

    /**
     * Flattened listing: all ammo, unattributed bullets, all rocks, all guns and all players as
     * plain shapes.
     */
    public List<Shape> toShapes() {
        List<Shape> list = new ArrayList<>();
        ammo.values().forEach(a -> list.add(shapeOf(a)));
        bullets.values().stream()
                .filter(b -> b.getOwnerId() == Entity.NO_OWNER)
                .forEach(b -> list.add(shapeOf(b)));
        rocks.values().forEach(r -> list.add(shapeOf(r)));
        guns.values().forEach(g -> list.add(shapeOf(g)));
        players.values().forEach(p -> list.add(shapeOf(p)));
        return list;
    }

    public AmmoEntity getAmmo(int id) {
        return ammo.get(id);
    }

    public BulletEntity getBullet(int id) {
        return bullets.get(id);
    }

    public RockEntity getRock(int id) {
        return rocks.get(id);
    }

    public GunEntity getGun(int id) {
        return guns.get(id);
    }

    public PlayerEntity getPlayer(int id) {
        return players.get(id);
    }

    public Collection<AmmoEntity> getAmmo() {
        return Collections.unmodifiableCollection(ammo.values());
    }

    public Collection<BulletEntity> getBullets() {
        return Collections.unmodifiableCollection(bullets.values());
    }

    public Collection<RockEntity> getRocks() {
        return Collections.unmodifiableCollection(rocks.values());
    }

    public Collection<GunEntity> getGuns() {
        return Collections.unmodifiableCollection(guns.values());
    }

    public Collection<PlayerEntity> getPlayers() {
        return Collections.unmodifiableCollection(players.values());
    }

    // ==================== 时钟与安全区 ====================

    /** 帧数 + 1，安全区按收缩速率缩小，半径不设下限 */
    public void advanceClock() {
        tick++;
        safeZoneRadius -= settings.getConstrictRate();
    }

    public long getTick() {
        return tick;
    }

    public double getSafeZoneRadius() {
        return safeZoneRadius;
    }

    public void setSafeZoneRadius(double safeZoneRadius) {
        this.safeZoneRadius = safeZoneRadius;
    }

    // Getters
    public long getGameId() {
        return gameId;
    }

    public String getName() {
        return name;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public SpatialGrid getGrid() {
        return grid;
    }

    public ArenaProperties getSettings() {
        return settings;
    }

    public EntityGenerator getGenerator() {
        return generator;
    }
}
