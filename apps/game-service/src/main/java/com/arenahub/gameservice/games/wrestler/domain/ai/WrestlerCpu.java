package com.arenahub.gameservice.games.wrestler.domain.ai;

import com.arenahub.gameservice.engine.core.AiAdvisor;
import com.arenahub.gameservice.engine.core.GameAction;
import com.arenahub.gameservice.engine.core.SeededRandom;
import com.arenahub.gameservice.engine.state.WrestlerState;
import com.arenahub.gameservice.games.wrestler.WrestlerConfig;
import com.arenahub.gameservice.games.wrestler.domain.constants.WrestlerTables;
import com.arenahub.gameservice.games.wrestler.domain.model.Wrestler;
import lombok.RequiredArgsConstructor;

import java.util.Map;

/**
 * 单人模式的 CPU 摔角手：加权随机出招。
 * 优先级：气势够就放终结技 → 对手残血时大概率压制 → 打击 / 抱摔 / 甩绳 → 体力不支时休息。
 */
@RequiredArgsConstructor
public class WrestlerCpu implements AiAdvisor<WrestlerState> {

    private final WrestlerConfig config;

    @Override
    public GameAction suggest(WrestlerState s, String actorId) {
        Wrestler me = s.getWrestlers().get(actorId);
        String targetId = opponentOf(s, actorId);
        if (me == null || targetId == null) {
            return null;
        }
        Wrestler opp = s.getWrestlers().get(targetId);
        SeededRandom rng = s.getRandom();
        double roll = rng.nextDouble();
        int stamina = me.getStamina();

        if (me.getMomentum() >= s.getFinisherThreshold() && stamina >= config.staminaCostOf("finisher")) {
            return act("finisher", targetId);
        }
        if (opp.getHp() <= 20 && stamina >= config.staminaCostOf("pin") && roll < 0.6) {
            return act("pin", targetId);
        }
        if (roll < 0.4 && stamina >= config.staminaCostOf("strike")) {
            String type = rng.pick(WrestlerTables.STRIKE_TYPES);
            return GameAction.of("strike", Map.of("type", type, "targetId", targetId));
        }
        if (roll < 0.7 && stamina >= config.staminaCostOf("grapple")) {
            return act("grapple", targetId);
        }
        if (stamina >= config.staminaCostOf("irish_whip")) {
            return GameAction.of("irish_whip", Map.of("direction", rng.chance(0.5) ? "ropes" : "corner", "targetId", targetId));
        }
        return GameAction.of("rest");
    }

    /**
     * 压制防守：按体力比例决定挣脱概率（>50% 0.8，>25% 0.5，其余 0.2）。
     */
    public boolean escapesPin(WrestlerState s, String actorId) {
        Wrestler me = s.getWrestlers().get(actorId);
        double ratio = me.getMaxStamina() == 0 ? 0 : (double) me.getStamina() / me.getMaxStamina();
        double chance = ratio > 0.5 ? 0.8 : (ratio > 0.25 ? 0.5 : 0.2);
        return s.getRandom().chance(chance);
    }

    /** 第一个未出局、且（双打时）在场上的非队友 */
    public static String opponentOf(WrestlerState s, String actorId) {
        Wrestler me = s.getWrestlers().get(actorId);
        for (Map.Entry<String, Wrestler> e : s.getWrestlers().entrySet()) {
            Wrestler w = e.getValue();
            if (e.getKey().equals(actorId) || w.isEliminated() || !w.isActive()) continue;
            if (me != null && me.getTeamId() != null && me.getTeamId().equals(w.getTeamId())) continue;
            return e.getKey();
        }
        return null;
    }

    private static GameAction act(String type, String targetId) {
        return GameAction.of(type, Map.of("targetId", targetId));
    }
}
