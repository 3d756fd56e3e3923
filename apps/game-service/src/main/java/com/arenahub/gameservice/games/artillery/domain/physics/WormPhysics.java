package com.arenahub.gameservice.games.artillery.domain.physics;

import com.arenahub.gameservice.engine.state.ArtilleryState;
import com.arenahub.gameservice.games.artillery.domain.model.Worm;
import lombok.RequiredArgsConstructor;

import java.util.Map;

import static com.arenahub.gameservice.games.artillery.domain.constants.ArtilleryRules.*;

/**
 * 虫子的自由落体：重力、摩擦、着地吸附与坠落伤害、落水淹死。
 * 与弹体相互独立，每 tick 各算一遍。
 */
@RequiredArgsConstructor
public class WormPhysics {

    private final PhysicsSettings physics;
    private final Explosions explosions;
    private final EventSink sink;

    /**
     * 推进一个 tick，返回本 tick 开始时是否有虫子在运动。
     */
    public boolean step(ArtilleryState s) {
        boolean anyMoving = false;
        for (Worm w : s.getWorms().values()) {
            if (!w.isAlive()) continue;
            // 脚下的地被挖空了就开始下落
            if (!w.moving() && w.getY() < s.groundAt((int) Math.floor(w.getX())) - 2) {
                w.setVy(physics.gravity());
            }
            if (w.moving()) {
                anyMoving = true;
                advance(s, w);
            }
        }
        return anyMoving;
    }

    public boolean anyMoving(ArtilleryState s) {
        return s.getWorms().values().stream().anyMatch(w -> w.isAlive() && w.moving());
    }

    private void advance(ArtilleryState s, Worm w) {
        if (w.getFallStartY() == null) {
            w.setFallStartY(w.getY());
        }
        w.setVy(w.getVy() + physics.gravity());
        w.setX(Math.max(0, Math.min(s.getWidth() - 1, w.getX() + w.getVx())));
        w.setY(w.getY() + w.getVy());
        w.setVx(w.getVx() * WORM_FRICTION);
        // 记录腾空最高点（y 越小越高）
        w.setFallStartY(Math.min(w.getFallStartY(), w.getY()));

        int groundY = s.groundAt((int) Math.floor(w.getX()));
        if (w.getY() >= groundY - 1) {
            double fallDistance = (groundY - 1) - w.getFallStartY();
            if (physics.fallDamage() && w.getVy() > FALL_DAMAGE_MIN_SPEED) {
                int damage = (int) Math.floor(Math.max(0, fallDistance - physics.safeHeight())
                        * physics.fallDamageMultiplier());
                if (damage > 0) {
                    sink.emit("fall_damage", w.getPlayerId(), Map.of("wormId", w.getId(), "damage", damage));
                    explosions.applyDamage(w, damage, null, "fall");
                }
            }
            w.setY(groundY - 1);
            w.setVx(0);
            w.setVy(0);
        }

        if (w.getY() >= s.getWaterLevel()) {
            drown(w);
            return;
        }

        if (Math.abs(w.getVx()) < SNAP_SPEED) w.setVx(0);
        if (Math.abs(w.getVy()) < SNAP_SPEED && w.getY() >= groundY - 2) w.setVy(0);
        if (!w.moving()) {
            w.setFallStartY(null);
        }
    }

    /** 落水即阵亡 */
    public void drown(Worm w) {
        w.setAlive(false);
        w.setHp(0);
        w.setVx(0);
        w.setVy(0);
        w.setFallStartY(null);
        sink.emit("worm_drowned", w.getPlayerId(), Map.of("wormId", w.getId(), "wormName", w.getName()));
    }
}
