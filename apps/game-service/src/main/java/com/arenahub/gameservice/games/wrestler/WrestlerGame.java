package com.arenahub.gameservice.games.wrestler;

import com.arenahub.gameservice.engine.core.BaseGame;
import com.arenahub.gameservice.engine.core.EngineMode;
import com.arenahub.gameservice.engine.core.GameAction;
import com.arenahub.gameservice.engine.core.KernelMessages;
import com.arenahub.gameservice.engine.core.SeededRandom;
import com.arenahub.gameservice.engine.core.Verdict;
import com.arenahub.gameservice.engine.state.WrestlerState;
import com.arenahub.gameservice.games.wrestler.domain.ai.WrestlerCpu;
import com.arenahub.gameservice.games.wrestler.domain.constants.WrestlerMessages;
import com.arenahub.gameservice.games.wrestler.domain.constants.WrestlerTables;
import com.arenahub.gameservice.games.wrestler.domain.model.Wrestler;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 职业摔角：气势/观众/体力系统，压制读秒，抓绳，终结技，四种赛制。
 * 真人之间不强制轮流（自由混战），但压制子状态下只有防守方能行动；
 * 单人模式自动加入 CPU，每次真人出手后轮转到 CPU 时由 {@link WrestlerCpu} 当场出招。
 */
@Slf4j
public class WrestlerGame extends BaseGame<WrestlerState> {

    public static final String SLUG = "wrestler";
    public static final String CPU_ID = "cpu";

    private static final Set<String> ACTIONS = Set.of(
            "strike", "grapple", "irish_whip", "pin", "kick_out", "rope_break",
            "tag_partner", "climb_turnbuckle", "finisher", "taunt", "rest");

    private final WrestlerConfig config;
    private final WrestlerCpu cpu;

    public WrestlerGame(WrestlerConfig config) {
        super(WrestlerState.class);
        this.config = config == null ? new WrestlerConfig() : config;
        this.cpu = new WrestlerCpu(this.config);
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
        return 4;
    }

    @Override
    protected WrestlerState initializeState(List<String> playerIds) {
        WrestlerState s = new WrestlerState();
        s.setRandom(new SeededRandom(config.getSeed() == null ? 0L : config.getSeed()));
        s.setMatchType(config.getMatchType());
        s.setFinisherThreshold(config.getFinisherThreshold());

        List<String> all = new ArrayList<>(playerIds);
        if (playerIds.size() == 1) {
            all.add(CPU_ID);
        }
        boolean cage = "cage".equals(config.getMatchType());
        for (String id : all) {
            Wrestler w = new Wrestler();
            w.setHp(config.getWrestlerHp());
            w.setMaxHp(config.getWrestlerHp());
            w.setStamina(config.getWrestlerStamina());
            w.setMaxStamina(config.getWrestlerStamina());
            w.setRopeBreaksLeft(cage ? 0 : config.getRopeBreaks());
            w.setTeamId(id);
            w.setCpu(CPU_ID.equals(id));
            s.getWrestlers().put(id, w);
        }
        if (isTag(s) && all.size() >= 2) {
            // 前一半对后一半，各队第一人先上场
            int half = (all.size() + 1) / 2;
            for (int i = 0; i < all.size(); i++) {
                Wrestler w = s.getWrestlers().get(all.get(i));
                boolean teamA = i < half;
                int partnerIdx = teamA ? i + half : i - half;
                w.setTagPartner(partnerIdx < all.size() ? all.get(partnerIdx) : null);
                w.setActive(teamA ? i == 0 : i == half);
                w.setTeamId(teamA ? "team_a" : "team_b");
            }
        }
        recomputeOrder(s);
        return s;
    }

    @Override
    protected Verdict processAction(WrestlerState s, String pid, GameAction action) {
        Wrestler w = s.getWrestlers().get(pid);
        String type = action.type();

        // 1) 压制子状态：只有防守方可以踢出或抓绳
        if (s.isPinAttemptActive()) {
            if (!pid.equals(s.getPinDefender())) {
                return Verdict.reject(WrestlerMessages.PIN_IN_PROGRESS);
            }
            if (!"kick_out".equals(type) && !"rope_break".equals(type)) {
                return Verdict.reject(WrestlerMessages.PIN_DEFENDER_ONLY);
            }
        }
        if (!ACTIONS.contains(type)) {
            return Verdict.reject(KernelMessages.formatUnknownAction(type));
        }
        // 2) 双打：场下选手只能换人
        if (isTag(s) && !w.isActive() && !"tag_partner".equals(type)) {
            return Verdict.reject(WrestlerMessages.NOT_ACTIVE);
        }
        // 3) 动作本身
        Verdict v = perform(s, pid, action);
        if (!v.accepted()) {
            return v;
        }
        // 4) 轮转并让 CPU 出手
        if (!s.isMatchOver() && !"tag_partner".equals(type)) {
            advanceTurn(s);
        }
        return v;
    }

    /** 真人与 CPU 共用的动作执行入口：先校验，再修改 */
    private Verdict perform(WrestlerState s, String actorId, GameAction action) {
        String type = action.type();
        Wrestler w = s.getWrestlers().get(actorId);
        int cost = config.staminaCostOf(type);
        if (!"kick_out".equals(type) && w.getStamina() < cost) {
            return Verdict.reject(WrestlerMessages.NOT_ENOUGH_STAMINA, cost, w.getStamina());
        }
        Verdict v = switch (type) {
            case "strike" -> strike(s, actorId, w, action);
            case "grapple" -> grapple(s, actorId, w, action);
            case "irish_whip" -> irishWhip(s, actorId, w, action);
            case "pin" -> pin(s, actorId, w, action);
            case "kick_out" -> kickOut(s, actorId, w);
            case "rope_break" -> ropeBreak(s, actorId, w);
            case "tag_partner" -> tagPartner(s, actorId, w);
            case "climb_turnbuckle" -> climb(s, actorId, w, action);
            case "finisher" -> finisher(s, actorId, w, action);
            case "taunt" -> taunt(s, actorId, w);
            case "rest" -> rest(s, actorId, w);
            default -> Verdict.reject(KernelMessages.formatUnknownAction(type));
        };
        if (v.accepted() && !"pin".equals(type) && !"tag_partner".equals(type)) {
            regenStamina(s);
            regenTagPartners(s);
        }
        return v;
    }

    // ------------------------------------------------------------------ 进攻

    private Verdict strike(WrestlerState s, String id, Wrestler w, GameAction action) {
        String kind = action.string("type").orElse("punch");
        if (!WrestlerTables.STRIKE_DAMAGE.containsKey(kind) && !config.getStrikeDamage().containsKey(kind)) {
            return Verdict.reject(WrestlerMessages.INVALID_STRIKE);
        }
        Optional<String> target = resolveTarget(s, id, action);
        if (target.isEmpty()) return targetError(action);

        Wrestler opp = s.getWrestlers().get(target.get());
        int damage = config.strikeDamageOf(kind);
        w.setStamina(w.getStamina() - config.staminaCostOf("strike"));
        opp.setHp(opp.getHp() - damage);
        gainMomentum(s, w, "strike");
        crowd(s, 2);
        emit("strike", id, Map.of("type", kind, "damage", damage, "target", target.get()));
        checkElimination(s, target.get());
        return Verdict.accept();
    }

    private Verdict grapple(WrestlerState s, String id, Wrestler w, GameAction action) {
        Optional<String> target = resolveTarget(s, id, action);
        if (target.isEmpty()) return targetError(action);

        Wrestler opp = s.getWrestlers().get(target.get());
        // 扣体力前比较，发起方占优
        int myPower = w.getStamina() + w.getMomentum();
        int oppPower = opp.getStamina() + opp.getMomentum();
        w.setStamina(w.getStamina() - config.staminaCostOf("grapple"));
        if (myPower >= oppPower) {
            int damage = config.getGrapplingDamage();
            opp.setHp(opp.getHp() - damage);
            gainMomentum(s, w, "grapple");
            crowd(s, 5);
            emit("grapple_success", id, Map.of("damage", damage, "target", target.get()));
            checkElimination(s, target.get());
        } else {
            w.setHp(w.getHp() - WrestlerTables.REVERSAL_DAMAGE);
            opp.setMomentum(Math.min(WrestlerTables.MAX_METER, opp.getMomentum() + 5));
            crowd(s, 3);
            emit("grapple_reversed", id, Map.of("damage", WrestlerTables.REVERSAL_DAMAGE, "by", target.get()));
            checkElimination(s, id);
        }
        return Verdict.accept();
    }

    private Verdict irishWhip(WrestlerState s, String id, Wrestler w, GameAction action) {
        String direction = action.string("direction").orElse("ropes");
        Optional<String> target = resolveTarget(s, id, action);
        if (target.isEmpty()) return targetError(action);

        Wrestler opp = s.getWrestlers().get(target.get());
        boolean corner = "corner".equals(direction);
        int damage = corner ? 10 : 8;
        w.setStamina(w.getStamina() - config.staminaCostOf("irish_whip"));
        opp.setHp(opp.getHp() - damage);
        opp.setPosition(corner ? "corner" : "ropes");
        crowd(s, 3);
        emit("irish_whip", id, Map.of("direction", corner ? "corner" : "ropes", "damage", damage, "target", target.get()));
        checkElimination(s, target.get());
        return Verdict.accept();
    }

    private Verdict pin(WrestlerState s, String id, Wrestler w, GameAction action) {
        Optional<String> target = resolveTarget(s, id, action);
        if (target.isEmpty()) return targetError(action);

        w.setStamina(w.getStamina() - config.staminaCostOf("pin"));
        startPin(s, id, target.get());
        emit("pin_attempt", id, Map.of("target", target.get()));
        return Verdict.accept();
    }

    private Verdict climb(WrestlerState s, String id, Wrestler w, GameAction action) {
        w.setStamina(w.getStamina() - config.staminaCostOf("climb_turnbuckle"));
        w.setPosition("turnbuckle");
        if ("cage".equals(s.getMatchType()) && w.getMomentum() >= WrestlerTables.CAGE_ESCAPE_MOMENTUM) {
            emit("cage_escape", id);
            s.getWrestlers().forEach((other, x) -> {
                if (!other.equals(id)) x.setEliminated(true);
            });
            recomputeOrder(s);
            s.setMatchOver(true);
            return Verdict.accept();
        }
        gainMomentum(s, w, "climb_turnbuckle");
        crowd(s, 8);
        // 从角柱飞身而下
        Optional<String> target = resolveTarget(s, id, action);
        if (target.isPresent()) {
            Wrestler opp = s.getWrestlers().get(target.get());
            opp.setHp(opp.getHp() - config.getAerialDamage());
            emit("aerial_attack", id, Map.of("damage", config.getAerialDamage(), "target", target.get()));
            checkElimination(s, target.get());
        }
        return Verdict.accept();
    }

    private Verdict finisher(WrestlerState s, String id, Wrestler w, GameAction action) {
        if (w.getMomentum() < s.getFinisherThreshold()) {
            return Verdict.reject(WrestlerMessages.FINISHER_MOMENTUM, s.getFinisherThreshold(), w.getMomentum());
        }
        Optional<String> target = resolveTarget(s, id, action);
        if (target.isEmpty()) return targetError(action);

        Wrestler opp = s.getWrestlers().get(target.get());
        int damage = config.getFinisherDamage();
        w.setStamina(w.getStamina() - config.staminaCostOf("finisher"));
        w.setMomentum(0);
        opp.setHp(opp.getHp() - damage);
        crowd(s, 20);
        emit("finisher", id, Map.of("damage", damage, "target", target.get()));
        if (opp.getHp() > 0) {
            startPin(s, id, target.get());
            emit("pin_after_finisher", id, Map.of("target", target.get()));
        } else {
            opp.setHp(0);
            opp.setEliminated(true);
            emit("knocked_out", target.get());
            recomputeOrder(s);
            checkMatchEnd(s);
        }
        return Verdict.accept();
    }

    private Verdict taunt(WrestlerState s, String id, Wrestler w) {
        w.setStamina(w.getStamina() - config.staminaCostOf("taunt"));
        gainMomentum(s, w, "taunt");
        crowd(s, 10);
        emit("taunt", id, Map.of("crowd", s.getCrowdMeter()));
        return Verdict.accept();
    }

    private Verdict rest(WrestlerState s, String id, Wrestler w) {
        w.setStamina(Math.min(w.getMaxStamina(), w.getStamina() + WrestlerTables.REST_RECOVERY));
        crowd(s, -5);
        emit("rest", id, Map.of("stamina", w.getStamina()));
        return Verdict.accept();
    }

    // ------------------------------------------------------------------ 压制

    private void startPin(WrestlerState s, String attacker, String defender) {
        s.setPinAttemptActive(true);
        s.setPinAttacker(attacker);
        s.setPinDefender(defender);
        s.getReferee().setCounting(true);
        s.getReferee().setCount(0);
        s.getReferee().setTargetId(defender);
        // CPU 无法等待下一条请求，当场结算
        if (s.getWrestlers().get(defender).isCpu()) {
            resolveCpuPinDefense(s, defender);
        }
    }

    private void clearPin(WrestlerState s) {
        s.setPinAttemptActive(false);
        s.setPinAttacker(null);
        s.setPinDefender(null);
        s.getReferee().reset();
    }

    private void resolveCpuPinDefense(WrestlerState s, String cpuId) {
        Wrestler c = s.getWrestlers().get(cpuId);
        if (cpu.escapesPin(s, cpuId)) {
            clearPin(s);
            c.setStamina(Math.max(0, c.getStamina() - config.staminaCostOf("kick_out")));
            c.setMomentum(Math.min(WrestlerTables.MAX_METER, c.getMomentum() + 5));
            crowd(s, 10);
            emit("kick_out", cpuId, Map.of("success", true));
        } else {
            String by = s.getPinAttacker();
            pinned(s, cpuId, by);
        }
    }

    private Verdict kickOut(WrestlerState s, String id, Wrestler w) {
        if (!s.isPinAttemptActive() || !id.equals(s.getPinDefender())) {
            return Verdict.reject(WrestlerMessages.NO_PIN);
        }
        if (w.getHp() > w.getMaxHp() * WrestlerTables.KICK_OUT_HP_RATIO) {
            clearPin(s);
            w.setStamina(Math.max(0, w.getStamina() - config.staminaCostOf("kick_out")));
            w.setMomentum(Math.min(WrestlerTables.MAX_METER, w.getMomentum() + 5));
            crowd(s, 10);
            emit("kick_out", id, Map.of("success", true));
        } else {
            pinned(s, id, s.getPinAttacker());
        }
        return Verdict.accept();
    }

    /** 三秒读完：防守方出局 */
    private void pinned(WrestlerState s, String defender, String by) {
        s.getReferee().setCount(3);
        clearPin(s);
        s.getWrestlers().get(defender).setEliminated(true);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("count", 3);
        data.put("by", by);
        emit("pinned", defender, data);
        recomputeOrder(s);
        checkMatchEnd(s);
    }

    private Verdict ropeBreak(WrestlerState s, String id, Wrestler w) {
        if ("cage".equals(s.getMatchType())) return Verdict.reject(WrestlerMessages.NO_ROPE_BREAK_IN_CAGE);
        if (w.getRopeBreaksLeft() <= 0) return Verdict.reject(WrestlerMessages.NO_ROPE_BREAKS);
        w.setRopeBreaksLeft(w.getRopeBreaksLeft() - 1);
        if (s.isPinAttemptActive() && id.equals(s.getPinDefender())) {
            clearPin(s);
        }
        emit("rope_break", id, Map.of("remaining", w.getRopeBreaksLeft()));
        return Verdict.accept();
    }

    // ------------------------------------------------------------------ 双打

    private Verdict tagPartner(WrestlerState s, String id, Wrestler w) {
        if (!isTag(s)) return Verdict.reject(WrestlerMessages.TAG_ONLY_IN_TAG);
        String partnerId = w.getTagPartner();
        Wrestler partner = partnerId == null ? null : s.getWrestlers().get(partnerId);
        if (partner == null) return Verdict.reject(WrestlerMessages.NO_PARTNER);
        if (w.isActive()) {
            if (partner.isEliminated()) return Verdict.reject(WrestlerMessages.PARTNER_ELIMINATED);
            w.setActive(false);
            partner.setActive(true);
        } else {
            // 场下选手主动换上
            partner.setActive(false);
            w.setActive(true);
        }
        recomputeOrder(s);
        emit("tag", id, Map.of("partner", partnerId));
        return Verdict.accept();
    }

    // ------------------------------------------------------------------ 轮转 / CPU

    /**
     * 轮到下一位；若轮到 CPU 则当场出招，至多绕一圈。
     */
    private void advanceTurn(WrestlerState s) {
        int guard = s.getTurnOrder().size();
        next(s);
        while (guard-- > 0 && !s.isMatchOver() && !s.isPinAttemptActive() && currentIsCpu(s)) {
            runCpuTurn(s, currentActor(s));
            if (s.isMatchOver() || s.isPinAttemptActive()) break;
            next(s);
        }
    }

    private void runCpuTurn(WrestlerState s, String cpuId) {
        GameAction suggestion = cpu.suggest(s, cpuId);
        if (suggestion == null) return;
        Verdict v = perform(s, cpuId, suggestion);
        if (!v.accepted()) {
            log.debug("[wrestler] CPU 动作被拒绝 type={} reason={}，改为休息", suggestion.type(), v.reason());
            perform(s, cpuId, GameAction.of("rest"));
        }
    }

    private void next(WrestlerState s) {
        if (!s.getTurnOrder().isEmpty()) {
            s.setCurrentTurnIndex((s.getCurrentTurnIndex() + 1) % s.getTurnOrder().size());
        }
    }

    private String currentActor(WrestlerState s) {
        List<String> order = s.getTurnOrder();
        return order.isEmpty() ? null : order.get(Math.min(s.getCurrentTurnIndex(), order.size() - 1));
    }

    private boolean currentIsCpu(WrestlerState s) {
        String id = currentActor(s);
        return id != null && s.getWrestlers().get(id).isCpu();
    }

    /** 重建轮转（未出局且在场上的选手），当前行动者仍在则保持，否则把下标夹回新范围 */
    private void recomputeOrder(WrestlerState s) {
        String current = currentActor(s);
        List<String> order = new ArrayList<>();
        s.getWrestlers().forEach((id, w) -> {
            if (!w.isEliminated() && (!isTag(s) || w.isActive())) order.add(id);
        });
        int idx = current == null ? -1 : order.indexOf(current);
        if (idx < 0) {
            idx = order.isEmpty() ? 0 : Math.min(s.getCurrentTurnIndex(), order.size() - 1);
        }
        s.setTurnOrder(order);
        s.setCurrentTurnIndex(idx);
    }

    // ------------------------------------------------------------------ 工具

    /** payload.targetId 优先，否则取第一个合法对手 */
    private Optional<String> resolveTarget(WrestlerState s, String id, GameAction action) {
        Optional<String> requested = action.string("targetId");
        if (requested.isEmpty()) {
            return Optional.ofNullable(WrestlerCpu.opponentOf(s, id));
        }
        String t = requested.get();
        Wrestler me = s.getWrestlers().get(id);
        Wrestler opp = s.getWrestlers().get(t);
        if (opp == null || t.equals(id) || opp.isEliminated() || !opp.isActive()
                || (me.getTeamId() != null && me.getTeamId().equals(opp.getTeamId()))) {
            return Optional.empty();
        }
        return requested;
    }

    private Verdict targetError(GameAction action) {
        return action.string("targetId")
                .map(t -> Verdict.reject(WrestlerMessages.INVALID_TARGET, t))
                .orElse(Verdict.reject(WrestlerMessages.NO_OPPONENT));
    }

    private double momentumMultiplier(WrestlerState s) {
        if (s.getCrowdMeter() > 50) return 1.5;
        if (s.getCrowdMeter() < -50) return 0.75;
        return 1.0;
    }

    private void gainMomentum(WrestlerState s, Wrestler w, String action) {
        int gain = (int) Math.floor(config.momentumGainOf(action) * momentumMultiplier(s));
        w.setMomentum(Math.min(WrestlerTables.MAX_METER, w.getMomentum() + gain));
    }

    private void crowd(WrestlerState s, int delta) {
        s.setCrowdMeter(Math.max(-WrestlerTables.MAX_METER, Math.min(WrestlerTables.MAX_METER, s.getCrowdMeter() + delta)));
    }

    private void regenStamina(WrestlerState s) {
        for (Wrestler w : s.getWrestlers().values()) {
            if (!w.isEliminated()) {
                w.setStamina(Math.min(w.getMaxStamina(), Math.max(0, w.getStamina()) + config.getStaminaRegen()));
            }
        }
    }

    private void regenTagPartners(WrestlerState s) {
        if (!isTag(s)) return;
        for (Wrestler w : s.getWrestlers().values()) {
            if (!w.isEliminated() && !w.isActive()) {
                w.setHp(Math.min(w.getMaxHp(), w.getHp() + config.getTagPartnerHealRate()));
            }
        }
    }

    /** 大乱斗 hp 归零即出局；其他赛制只夹到 0，必须压制取胜 */
    private void checkElimination(WrestlerState s, String id) {
        Wrestler w = s.getWrestlers().get(id);
        if (w == null || w.getHp() > 0) return;
        w.setHp(0);
        if ("royal-rumble".equals(s.getMatchType())) {
            w.setEliminated(true);
            emit("eliminated", id, Map.of("matchType", "royal-rumble"));
            recomputeOrder(s);
            checkMatchEnd(s);
        }
    }

    private void checkMatchEnd(WrestlerState s) {
        Set<String> teamsAlive = new HashSet<>();
        s.getWrestlers().values().stream()
                .filter(w -> !w.isEliminated())
                .forEach(w -> teamsAlive.add(w.getTeamId()));
        if (teamsAlive.size() <= 1) {
            s.setMatchOver(true);
        }
    }

    private static boolean isTag(WrestlerState s) {
        return "tag".equals(s.getMatchType());
    }

    // ------------------------------------------------------------------ 内核钩子

    @Override
    protected boolean isEliminated(WrestlerState s, String playerId) {
        Wrestler w = s.getWrestlers().get(playerId);
        return w == null || w.isEliminated();
    }

    @Override
    protected String phaseOf(WrestlerState s) {
        return s.isPinAttemptActive() ? "pin" : s.getMatchType();
    }

    @Override
    protected boolean checkGameOver(WrestlerState s) {
        return s.isMatchOver();
    }

    /** 仅剩一人时为其；否则未出局者中生命最高者 */
    @Override
    protected String determineWinner(WrestlerState s) {
        String best = null;
        int bestHp = -1;
        for (Map.Entry<String, Wrestler> e : s.getWrestlers().entrySet()) {
            Wrestler w = e.getValue();
            if (w.isEliminated()) continue;
            if (w.getHp() > bestHp) {
                bestHp = w.getHp();
                best = e.getKey();
            }
        }
        return best;
    }

    @Override
    protected Map<String, Integer> calculateScores(WrestlerState s) {
        Map<String, Integer> scores = new LinkedHashMap<>();
        s.getWrestlers().forEach((id, w) ->
                scores.put(id, w.getMomentum() + (w.isEliminated() ? 0 : 100) + Math.max(0, w.getHp())));
        return scores;
    }
}
