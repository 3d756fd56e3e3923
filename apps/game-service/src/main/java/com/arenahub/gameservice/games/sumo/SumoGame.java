package com.arenahub.gameservice.games.sumo;

import com.arenahub.gameservice.engine.core.BaseGame;
import com.arenahub.gameservice.engine.core.EngineMode;
import com.arenahub.gameservice.engine.core.GameAction;
import com.arenahub.gameservice.engine.core.KernelMessages;
import com.arenahub.gameservice.engine.core.SeededRandom;
import com.arenahub.gameservice.engine.core.Verdict;
import com.arenahub.gameservice.engine.state.SumoState;
import com.arenahub.gameservice.games.sumo.domain.ai.SumoCpu;
import com.arenahub.gameservice.games.sumo.domain.constants.SumoMessages;
import com.arenahub.gameservice.games.sumo.domain.constants.SumoTables;
import com.arenahub.gameservice.games.sumo.domain.model.Rikishi;
import com.arenahub.gameservice.games.sumo.domain.model.WeightClass;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 相扑：一维土俵上的推出游戏。
 * 不强制轮流；单人时加入 CPU，每次真人出手成功后 CPU 立即回一手。
 * 每次出手结束：回合数+1，双方回复体力与平衡，然后判定出界。
 */
@Slf4j
public class SumoGame extends BaseGame<SumoState> {

    public static final String SLUG = "sumo";
    public static final String CPU_ID = "cpu";

    private final SumoConfig config;
    private final SumoCpu cpu = new SumoCpu();

    public SumoGame(SumoConfig config) {
        super(SumoState.class);
        this.config = config == null ? new SumoConfig() : config;
    }

    @Override
    public String slug() {
        return SLUG;
    }

    @Override
    public EngineMode mode() {
        return EngineMode.TURN_BASED;
    }

    @Override
    public int minPlayers() {
        return 1;
    }

    @Override
    public int maxPlayers() {
        return 2;
    }

    @Override
    protected SumoState initializeState(List<String> playerIds) {
        SumoState s = new SumoState();
        s.setRandom(new SeededRandom(config.getSeed() == null ? 0L : config.getSeed()));
        s.setRingSize(Math.max(1, config.getRingSize()));
        s.setTachiaiBonusWindow(config.getTachiaiBonusWindow());

        List<String> ids = new ArrayList<>(playerIds);
        if (ids.size() == 1) {
            ids.add(CPU_ID);
        }
        // 双方站在中心两侧
        int offset = Math.max(1, s.getRingSize() / 3);
        WeightClass weight = WeightClass.of(config.getWeightClass());
        for (int i = 0; i < ids.size(); i++) {
            Rikishi r = new Rikishi();
            r.setPosition(i == 0 ? -offset : offset);
            r.setWeightClass(weight);
            r.setCpu(CPU_ID.equals(ids.get(i)));
            s.getWrestlers().put(ids.get(i), r);
            s.getTotalScore().put(ids.get(i), 0);
        }
        return s;
    }

    @Override
    protected Verdict processAction(SumoState s, String pid, GameAction action) {
        Verdict v = perform(s, pid, action);
        if (!v.accepted()) {
            return v;
        }
        Rikishi cpuRikishi = s.getWrestlers().get(CPU_ID);
        if (!s.isMatchOver() && cpuRikishi != null && cpuRikishi.isCpu()) {
            GameAction reply = cpu.suggest(s, CPU_ID);
            if (reply != null) {
                Verdict cv = perform(s, CPU_ID, reply);
                if (!cv.accepted()) {
                    log.debug("[sumo] CPU 动作被拒绝 type={} reason={}，改为推", reply.type(), cv.reason());
                    perform(s, CPU_ID, GameAction.of("push"));
                }
            }
        }
        return v;
    }

    /** 真人与 CPU 共用：校验后执行，并完成回合收尾 */
    private Verdict perform(SumoState s, String pid, GameAction action) {
        Rikishi me = s.getWrestlers().get(pid);
        Rikishi opp = opponentOf(s, pid);
        String type = action.type();

        // 1) 校验
        if (!SumoTables.STAMINA_COSTS.containsKey(type)) {
            return Verdict.reject(KernelMessages.formatUnknownAction(type));
        }
        if (opp == null) {
            return Verdict.reject(SumoMessages.NO_OPPONENT);
        }
        if (me.getStamina() <= 0 && !SumoTables.EXHAUSTED_ACTIONS.contains(type)) {
            return Verdict.reject(SumoMessages.EXHAUSTED);
        }
        String gripType = null;
        if ("grip".equals(type)) {
            gripType = action.string("type").orElse("arm");
            if (!SumoTables.GRIP_TYPES.contains(gripType)) {
                return Verdict.reject(SumoMessages.INVALID_GRIP);
            }
        }
        if ("throw".equals(type) && me.getGrip() == null) {
            return Verdict.reject(SumoMessages.NEED_GRIP);
        }
        if ("charge".equals(type) && !me.isTachiai()) {
            return Verdict.reject(SumoMessages.TACHIAI_ONLY);
        }

        // 2) 执行
        me.setPendingCharge(false);
        me.setStamina(Math.max(0, me.getStamina() - SumoTables.STAMINA_COSTS.get(type)));
        switch (type) {
            case "push" -> push(s, pid, me, opp);
            case "pull" -> pull(pid, me, opp);
            case "grip" -> {
                me.setGrip(gripType);
                emit("grip", pid, Map.of("type", gripType));
            }
            case "throw" -> throwOpponent(s, pid, me, opp);
            case "sidestep" -> sidestep(s, pid, me, opp);
            case "slap" -> {
                opp.setGrip(null);
                opp.setBalance(Math.max(0, opp.getBalance() - 6));
                emit("slap", pid, Map.of("balance", opp.getBalance()));
            }
            case "charge" -> charge(s, pid, me, opp);
            default -> throw new IllegalStateException("unreachable: " + type);
        }
        me.setTachiai(false);
        me.setLastAction(type);

        // 3) 收尾
        finishTurn(s);
        return Verdict.accept();
    }

    private void push(SumoState s, String pid, Rikishi me, Rikishi opp) {
        int distance = me.getGrip() != null ? 2 : 1;
        if (vulnerable(opp)) distance++;
        opp.setPosition(opp.getPosition() + direction(me, opp) * distance);
        opp.setBalance(Math.max(0, opp.getBalance() - 6));
        emit("push", pid, Map.of("distance", distance, "targetPos", opp.getPosition()));
    }

    private void pull(String pid, Rikishi me, Rikishi opp) {
        int distance = me.getGrip() != null ? 2 : 1;
        opp.setPosition(opp.getPosition() - direction(me, opp) * distance);
        emit("pull", pid, Map.of("distance", distance, "targetPos", opp.getPosition()));
    }

    private void throwOpponent(SumoState s, String pid, Rikishi me, Rikishi opp) {
        double chance = Math.min(95, Math.max(10, 70 + (me.getWeightClass().strength() - opp.getBalance() * 0.1) * 2));
        if (s.getRandom().nextDouble() * 100 < chance) {
            int distance = vulnerable(opp) ? 3 : 2;
            opp.setPosition(opp.getPosition() + direction(me, opp) * distance);
            opp.setBalance(Math.max(0, opp.getBalance() - 18));
            emit("throw_success", pid, Map.of("distance", distance, "targetPos", opp.getPosition()));
        } else {
            emit("throw_fail", pid);
        }
    }

    private void sidestep(SumoState s, String pid, Rikishi me, Rikishi opp) {
        int dodgeChance = Math.min(95, 80 + me.getWeightClass().speed() * 2);
        boolean dodged = s.getRandom().nextDouble() * 100 < dodgeChance;
        if (dodged && opp.isPendingCharge()) {
            // 冲撞落空，对手冲过头
            opp.setPosition(opp.getPosition() + direction(opp, me) * 2);
            emit("sidestep_success", pid, Map.of("opponentPos", opp.getPosition()));
        } else {
            emit("sidestep", pid, Map.of("dodged", dodged));
        }
        opp.setPendingCharge(false);
    }

    private void charge(SumoState s, String pid, Rikishi me, Rikishi opp) {
        int distance = 2;
        if (s.getTurnCount() <= s.getTachiaiBonusWindow()) distance++;
        if (vulnerable(opp)) distance++;
        opp.setPosition(opp.getPosition() + direction(me, opp) * distance);
        opp.setBalance(Math.max(0, opp.getBalance() - 12));
        me.setPendingCharge(true);
        emit("charge", pid, Map.of("distance", distance, "targetPos", opp.getPosition()));
    }

    private void finishTurn(SumoState s) {
        s.setTurnCount(s.getTurnCount() + 1);
        for (Rikishi r : s.getWrestlers().values()) {
            r.setStamina(Math.min(r.getMaxStamina(), r.getStamina() + SumoTables.STAMINA_REGEN));
            r.setBalance(Math.min(SumoTables.MAX_BALANCE, r.getBalance() + SumoTables.BALANCE_REGEN));
        }
        checkRingOut(s);
    }

    private void checkRingOut(SumoState s) {
        for (Map.Entry<String, Rikishi> e : s.getWrestlers().entrySet()) {
            if (Math.abs(e.getValue().getPosition()) < s.getRingSize()) continue;
            String loser = e.getKey();
            String winner = s.getWrestlers().keySet().stream()
                    .filter(id -> !id.equals(loser))
                    .findFirst()
                    .orElse(null);
            s.setMatchOver(true);
            s.setWinnerId(winner);
            if (winner != null) {
                // 越快推出得分越高
                int score = Math.max(SumoTables.RING_OUT_MIN_SCORE,
                        SumoTables.RING_OUT_BASE_SCORE - s.getTurnCount() * SumoTables.SCORE_PER_TURN);
                s.getTotalScore().merge(winner, score, Integer::sum);
                emit("ring_out", loser, Map.of("position", e.getValue().getPosition()));
                emit("match_won", winner, Map.of("turns", s.getTurnCount()));
            }
            return;
        }
    }

    private static boolean vulnerable(Rikishi r) {
        return r.getBalance() < SumoTables.VULNERABLE_BALANCE;
    }

    /** 对手在右侧为 +1，否则 -1 */
    private static int direction(Rikishi from, Rikishi to) {
        return to.getPosition() > from.getPosition() ? 1 : -1;
    }

    private static Rikishi opponentOf(SumoState s, String pid) {
        for (Map.Entry<String, Rikishi> e : s.getWrestlers().entrySet()) {
            if (!e.getKey().equals(pid)) return e.getValue();
        }
        return null;
    }

    @Override
    protected String phaseOf(SumoState s) {
        return s.getTurnCount() == 0 ? "tachiai" : "bout";
    }

    @Override
    protected boolean checkGameOver(SumoState s) {
        return s.isMatchOver();
    }

    @Override
    protected String determineWinner(SumoState s) {
        return s.getWinnerId();
    }

    @Override
    protected Map<String, Integer> calculateScores(SumoState s) {
        return s.getTotalScore();
    }
}
