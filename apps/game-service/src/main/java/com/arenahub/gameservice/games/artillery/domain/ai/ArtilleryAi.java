package com.arenahub.gameservice.games.artillery.domain.ai;

import com.arenahub.gameservice.engine.core.AiAdvisor;
import com.arenahub.gameservice.engine.core.GameAction;
import com.arenahub.gameservice.engine.core.SeededRandom;
import com.arenahub.gameservice.engine.state.ArtilleryState;
import com.arenahub.gameservice.games.artillery.domain.model.ArtilleryPlayer;
import com.arenahub.gameservice.games.artillery.domain.model.Worm;
import com.arenahub.gameservice.games.artillery.domain.weapon.WeaponRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * NPC 炮手：打最近的敌方虫子，按距离挑武器，瞄准时带有限的随机偏差。
 */
@Slf4j
@RequiredArgsConstructor
public class ArtilleryAi implements AiAdvisor<ArtilleryState> {

    /** 射程门槛与对应武器，从近到远依次尝试 */
    private static final List<Map.Entry<Double, String>> RANGE_PRIORITY = List.of(
            Map.entry(30.0, "fire-punch"),
            Map.entry(40.0, "baseball-bat"),
            Map.entry(100.0, "shotgun"),
            Map.entry(200.0, "grenade"));

    /** 约 ±10 度 */
    private static final double AIM_JITTER = 0.35;

    private final WeaponRegistry weapons;

    @Override
    public GameAction suggest(ArtilleryState s, String actorId) {
        ArtilleryPlayer me = s.getPlayers().get(actorId);
        Worm worm = s.getActiveWormId() == null ? null : s.getWorms().get(s.getActiveWormId());
        if (me == null || worm == null || !worm.isAlive()) {
            return null;
        }
        Worm target = s.getWorms().values().stream()
                .filter(w -> w.isAlive() && w.getTeamId() != me.getTeamId())
                .min(Comparator.comparingDouble(w -> distance(worm, w)))
                .orElse(null);
        if (target == null) {
            return null;
        }
        double dist = distance(worm, target);
        String weapon = pickWeapon(me, dist);

        SeededRandom rng = s.getRandom();
        double dx = target.getX() - worm.getX();
        double dy = target.getY() - worm.getY();
        double angle = Math.atan2(dy, dx) + (rng.nextDouble() - 0.5) * AIM_JITTER;
        double power = Math.min(100, Math.max(30, dist * 0.4 + rng.nextDouble() * 20));

        log.debug("[artillery] NPC {} 瞄准 {} dist={} weapon={}", actorId, target.getId(), Math.round(dist), weapon);
        return GameAction.of("fire", Map.of("weapon", weapon, "angle", angle, "power", power));
    }

    private String pickWeapon(ArtilleryPlayer me, double dist) {
        for (Map.Entry<Double, String> e : RANGE_PRIORITY) {
            if (dist < e.getKey() && usable(me, e.getValue())) {
                return e.getValue();
            }
        }
        if (usable(me, WeaponRegistry.DEFAULT_WEAPON)) {
            return WeaponRegistry.DEFAULT_WEAPON;
        }
        // 实在没有弹药就跳过回合
        return "skip";
    }

    private boolean usable(ArtilleryPlayer me, String slug) {
        return me.ammoOf(slug) != 0 && weapons.find(slug).isPresent();
    }

    private static double distance(Worm a, Worm b) {
        return Math.hypot(a.getX() - b.getX(), a.getY() - b.getY());
    }
}
