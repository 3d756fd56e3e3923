package com.arenahub.gameservice.games.artillery.domain.physics;

import com.arenahub.gameservice.engine.state.ArtilleryState;
import com.arenahub.gameservice.games.artillery.domain.model.Projectile;
import com.arenahub.gameservice.games.artillery.domain.model.Worm;
import com.arenahub.gameservice.games.artillery.domain.weapon.WeaponDef;
import com.arenahub.gameservice.games.artillery.domain.weapon.WeaponRegistry;
import lombok.RequiredArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.arenahub.gameservice.games.artillery.domain.constants.ArtilleryRules.*;

/**
 * 引爆结算：挖坑、范围伤害与击退、集束分裂。
 * 所有伤害都经 {@link #applyDamage}，生命只减不增。
 */
@RequiredArgsConstructor
public class Explosions {

    private final PhysicsSettings physics;
    private final WeaponRegistry weapons;
    private final EventSink sink;

    /**
     * 引爆一枚弹体，分裂出的子弹头追加到 spawned。
     */
    public void detonate(ArtilleryState s, Projectile p, List<Projectile> spawned) {
        p.setActive(false);
        WeaponDef weapon = weapons.find(p.getWeaponSlug()).orElse(null);
        if (weapon == null) {
            return;
        }
        double cx = p.getX();
        double cy = p.getY();

        // 1) 弹坑
        if (weapon.radius() > 0) {
            Terrain.carveCrater(s, cx, cy, weapon.radius());
        }

        // 2) 伤害与击退，零半径武器也有最小作用范围
        double effective = Math.max(weapon.radius(), MIN_EFFECT_RADIUS);
        for (Worm w : s.getWorms().values()) {
            if (!w.isAlive()) continue;
            double dist = Math.hypot(w.getX() - cx, w.getY() - cy);
            if (dist >= effective) continue;
            double falloff = 1 - dist / effective;
            int damage = (int) Math.round(weapon.damage() * falloff);
            double angle = Math.atan2(w.getY() - cy, w.getX() - cx);
            double knockback = falloff * damage * physics.knockbackForce();
            w.setVx(w.getVx() + Math.cos(angle) * knockback);
            w.setVy(w.getVy() + Math.sin(angle) * knockback - KNOCKBACK_LIFT);
            applyDamage(w, damage, p.getOwnerId(), "explosion");
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("x", cx);
        data.put("y", cy);
        data.put("radius", weapon.radius());
        data.put("weapon", p.getWeaponSlug());
        sink.emit("explosion", null, data);

        // 3) 集束：均匀散开加随机扰动，子弹头不再分裂
        if (weapon.clusters() > 0 && !p.isClusterChild()) {
            String fragment = "banana-bomb".equals(p.getWeaponSlug())
                    ? WeaponRegistry.BANANA_FRAGMENT
                    : WeaponRegistry.GRENADE_FRAGMENT;
            for (int i = 0; i < weapon.clusters(); i++) {
                double spread = Math.PI * 2 * i / weapon.clusters()
                        + (s.getRandom().nextDouble() - 0.5) * CLUSTER_JITTER;
                s.setNextProjectileId(s.getNextProjectileId() + 1);
                Projectile child = new Projectile();
                child.setId("cluster_" + p.getId() + "_" + s.getNextProjectileId());
                child.setWeaponSlug(fragment);
                child.setX(cx);
                child.setY(cy);
                child.setVx(Math.cos(spread) * CLUSTER_SPEED);
                child.setVy(Math.sin(spread) * CLUSTER_SPEED - CLUSTER_LIFT);
                child.setFuse(CLUSTER_FUSE + s.getRandom().nextDouble());
                child.setBounciness(CLUSTER_BOUNCINESS);
                child.setOwnerId(p.getOwnerId());
                child.setClusterChild(true);
                spawned.add(child);
            }
        }
    }

    /**
     * 扣血并发事件：归零即阵亡（worm_died），否则 damage。
     */
    public void applyDamage(Worm w, int damage, String killedBy, String cause) {
        if (!w.isAlive() || damage <= 0) {
            return;
        }
        w.setHp(Math.max(0, w.getHp() - damage));
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("wormId", w.getId());
        data.put("wormName", w.getName());
        if (w.getHp() <= 0) {
            w.setAlive(false);
            data.put("killedBy", killedBy);
            data.put("cause", cause);
            sink.emit("worm_died", w.getPlayerId(), data);
        } else {
            data.put("damage", damage);
            sink.emit("damage", w.getPlayerId(), data);
        }
    }
}
