package com.projectgroup5.arena.service;

import com.projectgroup5.arena.dto.GameDescriptionDto;
import com.projectgroup5.arena.dto.GameStateDto;
import com.projectgroup5.arena.game.AmmoEntity;
import com.projectgroup5.arena.game.BulletEntity;
import com.projectgroup5.arena.game.GameWorld;
import com.projectgroup5.arena.game.GunEntity;
import com.projectgroup5.arena.game.PlayerEntity;
import com.projectgroup5.arena.game.Position;
import com.projectgroup5.arena.game.RockEntity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.stream.Collectors;

/**
 * Read-only projection of a world into wire DTOs. Caller holds the world's lock.
 */
@Component
public class GameStateMapper {

    public GameStateDto toState(GameWorld world, PlayerEntity viewer) {
        Position eye = viewer.getPosition();
        double vision = world.getSettings().getVisionRadius();

        GameStateDto state = new GameStateDto();
        state.setId(world.getGameId());
        state.setName(world.getName());
        state.setSize(new double[]{world.getWidth(), world.getHeight()});
        state.setRadius(world.getSafeZoneRadius());
        state.setTick(world.getTick());

        state.setAmmo(world.getAmmo().stream()
                .filter(a -> eye.isWithin(a.getPosition(), vision))
                .map(this::toView)
                .collect(Collectors.toList()));
        state.setBullets(world.getBullets().stream()
                .filter(b -> eye.isWithin(b.getPosition(), vision))
                .map(this::toView)
                .collect(Collectors.toList()));
        state.setRocks(world.getRocks().stream()
                .filter(r -> eye.isWithin(r.getPosition(), vision))
                .map(this::toView)
                .collect(Collectors.toList()));
        // 已拥有的枪总是可见，客户端才能显示每个人的背包
        state.setGuns(world.getGuns().stream()
                .filter(g -> g.isOwned() || eye.isWithin(g.getPosition(), vision))
                .map(this::toView)
                .collect(Collectors.toList()));
        state.setPlayers(world.getPlayers().stream()
                .map(this::toView)
                .collect(Collectors.toList()));
        return state;
    }

    public GameDescriptionDto toDescription(GameWorld world) {
        GameDescriptionDto dto = new GameDescriptionDto();
        dto.setGameId(world.getGameId());
        dto.setGameName(world.getName());
        dto.setPlayers(world.getPlayers().stream()
                .map(PlayerEntity::getName)
                .collect(Collectors.toList()));
        return dto;
    }

    private GameStateDto.AmmoView toView(AmmoEntity a) {
        GameStateDto.AmmoView v = new GameStateDto.AmmoView();
        v.setId(a.getId());
        v.setPos(pos(a.getPosition()));
        v.setType(a.getAmmoType().name());
        v.setAmount(a.getAmount());
        return v;
    }

    private GameStateDto.BulletView toView(BulletEntity b) {
        GameStateDto.BulletView v = new GameStateDto.BulletView();
        v.setId(b.getId());
        v.setPos(pos(b.getPosition()));
        v.setOwner(b.getOwnerId());
        v.setDamage(b.getDamage());
        return v;
    }

    private GameStateDto.RockView toView(RockEntity r) {
        GameStateDto.RockView v = new GameStateDto.RockView();
        v.setId(r.getId());
        v.setPos(pos(r.getPosition()));
        return v;
    }

    private GameStateDto.GunView toView(GunEntity g) {
        GameStateDto.GunView v = new GameStateDto.GunView();
        v.setId(g.getId());
        v.setPos(pos(g.getPosition()));
        v.setType(g.getWeaponType().name());
        v.setOwner(g.getOwnerId());
        v.setAmmo(g.getAmmo());
        v.setCooldown(g.getCooldown());
        v.setRate(g.getCooldownRate());
        return v;
    }

    private GameStateDto.PlayerView toView(PlayerEntity p) {
        GameStateDto.PlayerView v = new GameStateDto.PlayerView();
        v.setId(p.getId());
        v.setName(p.getName());
        v.setPos(pos(p.getPosition()));
        v.setHp(p.getHealth());
        v.setInventory(new ArrayList<>(p.getInventory()));
        v.setLastFired(p.getLastFired() == null ? null : p.getLastFired().name());
        return v;
    }

    private static double[] pos(Position p) {
        return new double[]{p.getX(), p.getY()};
    }
}
