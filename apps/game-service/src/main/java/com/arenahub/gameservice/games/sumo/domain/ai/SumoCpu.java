package com.arenahub.gameservice.games.sumo.domain.ai;

import com.arenahub.gameservice.engine.core.AiAdvisor;
import com.arenahub.gameservice.engine.core.GameAction;
import com.arenahub.gameservice.engine.core.SeededRandom;
import com.arenahub.gameservice.engine.state.SumoState;
import com.arenahub.gameservice.games.sumo.domain.constants.SumoTables;
import com.arenahub.gameservice.games.sumo.domain.model.Rikishi;

import java.util.Map;

/**
 * 单人模式的 CPU 力士。
 * 立合先冲撞；体力耗尽只推；有抓握时摔或推；对手刚冲撞过就闪身；否则抓腰带。
 */
public class SumoCpu implements AiAdvisor<SumoState> {

    @Override
    public GameAction suggest(SumoState s, String actorId) {
        Rikishi me = s.getWrestlers().get(actorId);
        Rikishi opp = opponentOf(s, actorId);
        if (me == null || opp == null) {
            return null;
        }
        SeededRandom rng = s.getRandom();
        if (me.getStamina() <= 0) {
            return GameAction.of(opp.getGrip() != null ? "slap" : "push");
        }
        if (me.isTachiai()) {
            return GameAction.of("charge");
        }
        if (opp.isPendingCharge()) {
            return GameAction.of("sidestep");
        }
        // 自己被逼到边缘时先拍掉对手的抓握
        if (opp.getGrip() != null && Math.abs(me.getPosition()) >= s.getRingSize() - 2) {
            return GameAction.of("slap");
        }
        if (me.getGrip() != null) {
            return GameAction.of(opp.getBalance() < SumoTables.VULNERABLE_BALANCE || rng.chance(0.4) ? "throw" : "push");
        }
        return rng.chance(0.5)
                ? GameAction.of("grip", Map.of("type", "mawashi"))
                : GameAction.of("push");
    }

    private static Rikishi opponentOf(SumoState s, String actorId) {
        for (Map.Entry<String, Rikishi> e : s.getWrestlers().entrySet()) {
            if (!e.getKey().equals(actorId)) {
                return e.getValue();
            }
        }
        return null;
    }
}
