package com.arenahub.gameservice.games.artillery.domain.physics;

import com.arenahub.gameservice.engine.state.ArtilleryState;
import com.arenahub.gameservice.games.artillery.domain.model.Projectile;
import com.arenahub.gameservice.games.artillery.domain.model.TrailPoint;
import com.arenahub.gameservice.games.artillery.domain.model.Worm;
import com.arenahub.gameservice.games.artillery.domain.weapon.WeaponDef;
import com.arenahub.gameservice.games.artillery.domain.weapon.WeaponRegistry;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.arenahub.gameservice.games.artillery.domain.constants.ArtilleryRules.*;

/**
 * 弹体逐 tick 积分：重力、风、追踪修正、位移、出界/落水、地形碰撞（反弹或引爆）、近炸、引信。
 */
@RequiredArgsConstructor
public class ProjectileSimulator {

    private final PhysicsSettings physics;
    private final WeaponRegistry weapons;
    private final Explosions explosions;
    private final EventSink sink;

    /** 推进所有活动弹体一个 tick，新分裂出的子弹头下一 tick 才开始运动 */
    public void step(ArtilleryState s) {
        List<Projectile> spawned = new ArrayList<>();
        for (Projectile p : s.getProjectiles()) {
            if (p.isActive()) {
                advance(s, p, spawned);
            }
        }
        s.getProjectiles().removeIf(p -> !p.isActive());
        s.getProjectiles().addAll(spawned);
    }

    public boolean anyActive(ArtilleryState s) {
        return s.getProjectiles().stream().anyMatch(Projectile::isActive);
    }

    private void advance(ArtilleryState s, Projectile p, List<Projectile> spawned) {
        WeaponDef weapon = weapons.find(p.getWeaponSlug()).orElse(null);
        if (weapon == null) {
            p.setActive(false);
            return;
        }

        // 1) 受力
        if (weapon.gravity()) {
            p.setVy(p.getVy() + physics.gravity());
        }
        if (weapon.windAffected() && physics.windEnabled()) {
            p.setVx(p.getVx() + s.getWind() * WIND_FACTOR);
        }
        steerTowardTarget(s, p);

        // 2) 位移与轨迹
        p.setX(p.getX() + p.getVx());
        p.setY(p.getY() + p.getVy());
        p.getTrail().add(new TrailPoint(p.getX(), p.getY()));
        if (p.getTrail().size() > TRAIL_LIMIT) {
            p.getTrail().remove(0);
        }

        // 3) 出界、落水
        if (p.getX() < -OUT_OF_BOUNDS_MARGIN || p.getX() > s.getWidth() + OUT_OF_BOUNDS_MARGIN
                || p.getY() > s.getHeight() + OUT_OF_BOUNDS_MARGIN) {
            p.setActive(false);
            return;
        }
        if (p.getY() >= s.getWaterLevel()) {
            p.setActive(false);
            sink.emit("splash", null, Map.of("x", p.getX(), "y", s.getWaterLevel()));
            return;
        }

        // 4) 地形碰撞
        int px = (int) Math.floor(p.getX());
        int py = (int) Math.floor(p.getY());
        if (px >= 0 && px < s.getWidth() && py >= 0 && py < s.getHeight()) {
            int groundY = s.getGround()[px];
            if (py >= groundY) {
                if (weapon.bounces() && p.getFuse() > 0) {
                    p.setVy(-Math.abs(p.getVy()) * p.getBounciness());
                    p.setVx(p.getVx() * BOUNCE_FRICTION);
                    p.setY(groundY - 1);
                    if (Math.abs(p.getVy()) < SETTLE_SPEED && Math.abs(p.getVx()) < SETTLE_SPEED) {
                        // 停稳，等引信
                        p.setVx(0);
                        p.setVy(0);
                    }
                } else if (p.getFuse() <= 0) {
                    explosions.detonate(s, p, spawned);
                    return;
                }
            }
        }

        // 5) 近炸：碰撞类弹体靠近任一非发射者的虫子即引爆
        if (!weapon.bounces() || p.getFuse() < 0) {
            for (Worm w : s.getWorms().values()) {
                if (!w.isAlive() || w.getId().equals(p.getOwnerId())) continue;
                if (Math.hypot(w.getX() - p.getX(), w.getY() - p.getY()) < PROXIMITY_RADIUS) {
                    explosions.detonate(s, p, spawned);
                    return;
                }
            }
        }

        // 6) 引信
        if (p.getFuse() > 0) {
            p.setFuse(p.getFuse() - SECONDS_PER_TICK);
            if (p.getFuse() <= 0) {
                explosions.detonate(s, p, spawned);
            }
        }
    }

    /** 追踪弹：保持速率，按比例把速度方向拉向目标 */
    private void steerTowardTarget(ArtilleryState s, Projectile p) {
        if (p.getHomingTargetId() == null) return;
        Worm target = s.getWorms().get(p.getHomingTargetId());
        if (target == null || !target.isAlive()) return;
        double speed = Math.hypot(p.getVx(), p.getVy());
        double desired = Math.atan2(target.getY() - p.getY(), target.getX() - p.getX());
        p.setVx(p.getVx() + (Math.cos(desired) * speed - p.getVx()) * HOMING_STEER);
        p.setVy(p.getVy() + (Math.sin(desired) * speed - p.getVy()) * HOMING_STEER);
    }
}
