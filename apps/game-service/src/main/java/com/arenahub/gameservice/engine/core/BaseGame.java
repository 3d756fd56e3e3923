package com.arenahub.gameservice.engine.core;

import com.arenahub.gameservice.engine.state.GameData;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.LongSupplier;

/**
 * 所有游戏模块的内核基类。
 * 子类只实现若干钩子（initializeState / processAction / checkGameOver / determineWinner / calculateScores），
 * 生命周期、校验顺序、提交与事件收集由这里统一完成：
 * 1) 钩子在数据的工作副本上执行，被拒绝时副本与暂存事件一起丢弃，已提交状态不变；
 * 2) 被接受时整体替换已提交数据，turn+1，再重新判定终局；
 * 3) 终局后数据冻结，此后所有动作以同一原因失败。
 *
 * @param <D> 模块私有数据类型
 */
@Slf4j
public abstract class BaseGame<D extends GameData> implements UnifiedGame {

    public static final String PHASE_PLAYING = "playing";
    public static final String PHASE_ENDED = "ended";

    private final Class<D> dataType;
    private final LongSupplier clock;

    private List<String> playerIds = List.of();
    private D data;
    private int turn;
    private String phase = "init";

    /** 已提交但尚未返回给宿主的事件 */
    private final List<GameEvent> pending = new ArrayList<>();
    /** 当前动作暂存的事件，失败时丢弃 */
    private List<GameEvent> staged = pending;

    protected BaseGame(Class<D> dataType) {
        this(dataType, System::currentTimeMillis);
    }

    protected BaseGame(Class<D> dataType, LongSupplier clock) {
        this.dataType = dataType;
        this.clock = clock;
    }

    // =================== 钩子 ===================

    protected abstract D initializeState(List<String> playerIds);

    /**
     * 处理一条动作。参数 data 是工作副本：先完整校验，再修改；返回拒绝时副本会被丢弃。
     */
    protected abstract Verdict processAction(D data, String playerId, GameAction action);

    protected abstract boolean checkGameOver(D data);

    protected abstract String determineWinner(D data);

    protected abstract Map<String, Integer> calculateScores(D data);

    /** 战争迷雾投影，默认返回完整副本 */
    protected D projectForPlayer(D copy, String playerId) {
        return copy;
    }

    /** 模块自己的阶段标签，写入 GameState.phase */
    protected String phaseOf(D data) {
        return PHASE_PLAYING;
    }

    /** 已出局的玩家不能再行动 */
    protected boolean isEliminated(D data, String playerId) {
        return false;
    }

    /** 出局玩家仍可发送的动作（例如推进时间的 tick） */
    protected Set<String> spectatorActions() {
        return Set.of();
    }

    /**
     * 眩晕/跳过：若该玩家带有“跳过下回合”标记则在此消费并返回 true，
     * 内核随后发出 turn_skipped 并直接判定成功。
     * 只有本该由该玩家行动、且动作类型合法时才能消费；否则返回 false 交给 processAction 拒绝。
     */
    protected boolean consumeSkip(D data, String playerId, GameAction action) {
        return false;
    }

    // =================== 生命周期 ===================

    @Override
    public void initialize(List<String> ids) {
        checkPlayers(ids);
        this.playerIds = List.copyOf(ids);
        this.pending.clear();
        this.staged = pending;
        this.turn = 0;
        this.phase = PHASE_PLAYING;
        emit("game_started", null, Map.of("playerIds", playerIds));
        this.data = initializeState(playerIds);
        this.phase = derivePhase(data);
        log.info("[{}] 对局初始化完成 players={}", slug(), playerIds);
    }

    @Override
    public void restoreState(List<String> ids, GameState state) {
        checkPlayers(ids);
        if (state == null || !dataType.isInstance(state.data())) {
            throw new IllegalArgumentException("快照数据与游戏类型不匹配: " + slug());
        }
        this.playerIds = List.copyOf(ids);
        this.pending.clear();
        this.staged = pending;
        this.turn = state.turn();
        this.phase = state.phase();
        this.data = dataType.cast(state.data().copy());
    }

    private void checkPlayers(List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            throw new IllegalArgumentException("至少需要一名玩家");
        }
        if (ids.size() < minPlayers() || ids.size() > maxPlayers()) {
            throw new IllegalArgumentException(
                    String.format("%s 需要 %d~%d 名玩家，实际 %d", slug(), minPlayers(), maxPlayers(), ids.size()));
        }
        Set<String> seen = new HashSet<>();
        for (String id : ids) {
            if (id == null || id.isBlank() || !seen.add(id)) {
                throw new IllegalArgumentException("玩家 id 为空或重复: " + id);
            }
        }
    }

    @Override
    public GameState getState() {
        requireInitialized();
        return new GameState(turn, phase, data.copy());
    }

    @Override
    public GameState getStateForPlayer(String playerId) {
        requireInitialized();
        @SuppressWarnings("unchecked")
        D copy = (D) data.copy();
        return new GameState(turn, phase, projectForPlayer(copy, playerId));
    }

    @Override
    public ActionResult handleAction(String playerId, GameAction action) {
        if (data == null) {
            return ActionResult.fail(KernelMessages.NOT_INITIALIZED);
        }
        // 1) 结构性校验：玩家、终局、动作本身
        if (playerId == null || !playerIds.contains(playerId)) {
            return ActionResult.fail(KernelMessages.formatUnknownPlayer(playerId));
        }
        if (isGameOver()) {
            return ActionResult.fail(KernelMessages.GAME_OVER);
        }
        if (action == null || action.type() == null || action.type().isBlank()) {
            return ActionResult.fail(KernelMessages.MISSING_ACTION_TYPE);
        }
        if (isEliminated(data, playerId) && !spectatorActions().contains(action.type())) {
            return ActionResult.fail(KernelMessages.ELIMINATED);
        }

        // 2) 在工作副本上执行钩子
        @SuppressWarnings("unchecked")
        D working = (D) data.copy();
        List<GameEvent> buffer = new ArrayList<>();
        staged = buffer;
        Verdict verdict;
        try {
            if (consumeSkip(working, playerId, action)) {
                emit("turn_skipped", playerId, Map.of("reason", "recovering"));
                verdict = Verdict.accept();
            } else {
                verdict = processAction(working, playerId, action);
            }
        } catch (RuntimeException e) {
            log.error("[{}] 处理动作异常 player={} type={}", slug(), playerId, action.type(), e);
            verdict = Verdict.reject(KernelMessages.INTERNAL_ERROR);
        } finally {
            staged = pending;
        }
        if (verdict == null || !verdict.accepted()) {
            String reason = verdict == null ? KernelMessages.INTERNAL_ERROR : verdict.reason();
            log.debug("[{}] 拒绝动作 player={} type={} reason={}", slug(), playerId, action.type(), reason);
            return ActionResult.fail(reason);
        }

        // 3) 提交
        this.data = working;
        this.turn++;
        pending.addAll(buffer);
        if (checkGameOver(data)) {
            this.phase = PHASE_ENDED;
            Map<String, Object> ended = new LinkedHashMap<>();
            ended.put("winner", determineWinner(data));
            ended.put("scores", calculateScores(data));
            emit("game_ended", null, ended);
            log.info("[{}] 对局结束 winner={} turn={}", slug(), ended.get("winner"), turn);
        } else {
            this.phase = derivePhase(data);
        }
        return ActionResult.ok(getState(), drainPendingEvents());
    }

    @Override
    public boolean isGameOver() {
        return data != null && (PHASE_ENDED.equals(phase) || data.over() || checkGameOver(data));
    }

    @Override
    public String getWinner() {
        return data == null ? null : determineWinner(data);
    }

    @Override
    public Map<String, Integer> getScores() {
        return data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(calculateScores(data)));
    }

    @Override
    public List<GameEvent> drainPendingEvents() {
        List<GameEvent> out = List.copyOf(pending);
        pending.clear();
        return out;
    }

    @Override
    public List<String> getPlayerIds() {
        return playerIds;
    }

    // =================== 子类辅助 ===================

    /** 发出事件；处理动作期间进入暂存区，失败时随副本一并丢弃 */
    protected void emit(String type, String playerId, Map<String, Object> payload) {
        staged.add(new GameEvent(type, playerId, payload, clock.getAsLong()));
    }

    protected void emit(String type, String playerId) {
        emit(type, playerId, Map.of());
    }

    protected int getTurn() {
        return turn;
    }

    private String derivePhase(D d) {
        if (checkGameOver(d)) {
            return PHASE_ENDED;
        }
        String p = phaseOf(d);
        return p == null ? PHASE_PLAYING : p;
    }

    private void requireInitialized() {
        if (data == null) {
            throw new IllegalStateException(KernelMessages.NOT_INITIALIZED);
        }
    }
}
