package com.arenahub.gameservice.games.brawler;

import com.arenahub.gameservice.engine.core.BaseGame;
import com.arenahub.gameservice.engine.core.EngineMode;
import com.arenahub.gameservice.engine.core.GameAction;
import com.arenahub.gameservice.engine.core.KernelMessages;
import com.arenahub.gameservice.engine.core.SeededRandom;
import com.arenahub.gameservice.engine.core.Verdict;
import com.arenahub.gameservice.engine.state.BrawlerState;
import com.arenahub.gameservice.games.brawler.domain.constants.BrawlerCatalog;
import com.arenahub.gameservice.games.brawler.domain.constants.BrawlerMessages;
import com.arenahub.gameservice.games.brawler.domain.model.Fighter;
import com.arenahub.gameservice.games.brawler.domain.model.Thug;
import com.arenahub.gameservice.games.brawler.domain.model.Weapon;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 横版乱斗：若干关卡，每关若干波敌人，最后一关最后一波为首领。
 * 玩家按 order 轮流出手（拾取武器不占回合），每次出手后场上存活敌人依次反击。
 */
public class BrawlerGame extends BaseGame<BrawlerState> {

    public static final String SLUG = "brawler";

    private final BrawlerConfig config;

    public BrawlerGame(BrawlerConfig config) {
        super(BrawlerState.class);
        this.config = config == null ? new BrawlerConfig() : config;
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
    protected BrawlerState initializeState(List<String> playerIds) {
        BrawlerState s = new BrawlerState();
        s.setRandom(new SeededRandom(config.getSeed() == null ? 0L : config.getSeed()));
        s.setTotalStages(Math.max(1, config.getStageCount()));
        s.setWavesPerStage(Math.max(1, config.getWavesPerStage()));
        for (String pid : playerIds) {
            s.getPlayers().put(pid, new Fighter());
            s.getOrder().add(pid);
        }
        spawnWave(s);
        maybeSpawnWeapon(s);
        return s;
    }

    @Override
    protected Verdict processAction(BrawlerState s, String pid, GameAction action) {
        Fighter f = s.getPlayers().get(pid);
        if ("pick_up".equals(action.type())) {
            return pickUp(s, pid, f, action);
        }
        String active = activePlayer(s);
        if (!pid.equals(active)) {
            return Verdict.reject(KernelMessages.formatNotYourTurn(active));
        }
        Verdict v = switch (action.type()) {
            case "move" -> move(f, action);
            case "attack" -> strike(s, pid, f, action, "attack", BrawlerCatalog.ATTACK_DAMAGE, false);
            case "jump_attack" -> strike(s, pid, f, action, "jump_attack", BrawlerCatalog.JUMP_ATTACK_DAMAGE, false);
            case "grab" -> strike(s, pid, f, action, "grab", BrawlerCatalog.GRAB_DAMAGE, true);
            case "throw" -> strike(s, pid, f, action, "throw", BrawlerCatalog.THROW_DAMAGE, true);
            case "use_weapon" -> useWeapon(s, pid, f, action);
            case "special" -> special(s, pid, f);
            default -> Verdict.reject(KernelMessages.formatUnknownAction(action.type()));
        };
        if (v.accepted()) {
            advanceTurn(s);
        }
        return v;
    }

    private Verdict move(Fighter f, GameAction action) {
        String dir = action.string("direction").orElse("");
        switch (dir) {
            case "left" -> f.setX(Math.max(0, f.getX() - 1));
            case "right" -> f.setX(f.getX() + 1);
            case "up", "down" -> {
                // 纵向移动只改变站位，不影响坐标
            }
            default -> {
                return Verdict.reject(BrawlerMessages.INVALID_DIRECTION);
            }
        }
        f.setComboCount(0);
        f.setLastAction("move");
        return Verdict.accept();
    }

    /**
     * 通用单体攻击。needsTarget 为真时必须给出 targetId（抓取/投掷），否则打第一个存活敌人。
     */
    private Verdict strike(BrawlerState s, String pid, Fighter f, GameAction action,
                           String kind, int base, boolean needsTarget) {
        Optional<Thug> target = findTarget(s, action, needsTarget);
        if (target.isEmpty()) {
            if (!needsTarget) return Verdict.reject(BrawlerMessages.NO_ENEMIES);
            return Verdict.reject(action.string("targetId").isEmpty()
                    ? BrawlerMessages.MISSING_TARGET
                    : BrawlerMessages.TARGET_NOT_FOUND);
        }
        int damage = applyCombo(f, kind, base);
        hit(s, pid, f, target.get(), damage);
        emit(kind, pid, Map.of("target", target.get().getId(), "damage", damage, "combo", f.getComboCount()));
        afterPlayerAction(s, pid, f);
        return Verdict.accept();
    }

    private Verdict useWeapon(BrawlerState s, String pid, Fighter f, GameAction action) {
        Weapon w = f.getWeapon();
        if (w == null) return Verdict.reject(BrawlerMessages.NO_WEAPON);
        Optional<Thug> target = findTarget(s, action, false);
        if (target.isEmpty()) return Verdict.reject(BrawlerMessages.NO_ENEMIES);

        int damage = applyCombo(f, "use_weapon", w.getDamage());
        hit(s, pid, f, target.get(), damage);
        w.setDurability(w.getDurability() - 1);
        emit("weapon_attack", pid, Map.of("target", target.get().getId(), "damage", damage, "weaponType", w.getType()));
        if (w.getDurability() <= 0) {
            f.setWeapon(null);
            emit("weapon_broke", pid, Map.of("type", w.getType()));
        }
        afterPlayerAction(s, pid, f);
        return Verdict.accept();
    }

    private Verdict special(BrawlerState s, String pid, Fighter f) {
        if (f.getHp() <= BrawlerCatalog.SPECIAL_HP_COST) return Verdict.reject(BrawlerMessages.SPECIAL_HP);
        f.setHp(f.getHp() - BrawlerCatalog.SPECIAL_HP_COST);
        for (Thug t : s.getEnemies()) {
            if (t.isAlive()) hit(s, pid, f, t, BrawlerCatalog.SPECIAL_DAMAGE);
        }
        f.setComboCount(0);
        f.setLastAction("special");
        emit("special", pid, Map.of("damage", BrawlerCatalog.SPECIAL_DAMAGE, "hpCost", BrawlerCatalog.SPECIAL_HP_COST));
        // 必杀无反击
        checkWaveClear(s);
        return Verdict.accept();
    }

    private Verdict pickUp(BrawlerState s, String pid, Fighter f, GameAction action) {
        Optional<String> id = action.string("weaponId");
        Optional<Weapon> w = s.getWeapons().stream()
                .filter(x -> id.isEmpty() || x.getId().equals(id.get()))
                .findFirst();
        if (w.isEmpty()) return Verdict.reject(BrawlerMessages.WEAPON_NOT_FOUND);
        s.getWeapons().remove(w.get());
        if (f.getWeapon() != null) {
            // 旧武器丢回地面
            Weapon old = f.getWeapon();
            old.setX(f.getX());
            s.getWeapons().add(old);
        }
        f.setWeapon(w.get());
        emit("weapon_pickup", pid, Map.of("weaponType", w.get().getType(), "damage", w.get().getDamage()));
        return Verdict.accept();
    }

    // ------------------------------------------------------------------ 结算

    private Optional<Thug> findTarget(BrawlerState s, GameAction action, boolean needsTarget) {
        Optional<String> id = action.string("targetId");
        if (id.isPresent()) {
            return s.getEnemies().stream().filter(t -> t.isAlive() && t.getId().equals(id.get())).findFirst();
        }
        if (needsTarget) return Optional.empty();
        return s.getEnemies().stream().filter(Thug::isAlive).findFirst();
    }

    private void hit(BrawlerState s, String pid, Fighter f, Thug t, int damage) {
        t.setHp(t.getHp() - damage);
        f.setScore(f.getScore() + damage);
        if (t.getHp() <= 0) {
            t.setHp(0);
            t.setAlive(false);
            f.setScore(f.getScore() + BrawlerCatalog.KILL_BONUS);
            emit("enemy_defeated", pid, Map.of("enemy", t.getId(), "name", t.getName()));
        }
    }

    /** 连招：与上一招不同且上一招不是移动时连段+1，伤害乘 1 + 连段*0.15 */
    private int applyCombo(Fighter f, String kind, int base) {
        String last = f.getLastAction();
        f.setLastAction(kind);
        if (last != null && !last.equals(kind) && !"move".equals(last)) {
            f.setComboCount(f.getComboCount() + 1);
            return (int) Math.floor(base * (1 + f.getComboCount() * BrawlerCatalog.COMBO_STEP));
        }
        f.setComboCount(0);
        return base;
    }

    private void afterPlayerAction(BrawlerState s, String pid, Fighter f) {
        enemyCounterattack(s, pid, f);
        checkWaveClear(s);
    }

    private void enemyCounterattack(BrawlerState s, String pid, Fighter f) {
        for (Thug t : s.getEnemies()) {
            if (!t.isAlive()) continue;
            f.setHp(f.getHp() - t.getAtk());
            if (f.getHp() <= 0) {
                f.setHp(0);
                f.setLives(f.getLives() - 1);
                if (f.getLives() > 0) {
                    f.setHp(f.getMaxHp());
                    emit("life_lost", pid, Map.of("livesRemaining", f.getLives()));
                } else {
                    f.setKnockedOut(true);
                    emit("player_ko", pid);
                    if (s.getPlayers().values().stream().allMatch(Fighter::isKnockedOut)) {
                        s.setGameOver(true);
                        emit("game_over", null, Map.of("result", "defeat"));
                    }
                }
                break;
            }
        }
    }

    private void checkWaveClear(BrawlerState s) {
        if (s.isGameOver() || s.getEnemies().stream().anyMatch(Thug::isAlive)) return;
        if (s.getCurrentWave() < s.getWavesPerStage()) {
            emit("wave_cleared", null, Map.of("stage", s.getCurrentStage(), "wave", s.getCurrentWave()));
            s.setCurrentWave(s.getCurrentWave() + 1);
            spawnWave(s);
            maybeSpawnWeapon(s);
            return;
        }
        s.setStageCleared(true);
        emit("stage_cleared", null, Map.of("stage", s.getCurrentStage()));
        if (s.getCurrentStage() >= s.getTotalStages()) {
            s.setGameOver(true);
            emit("victory", null);
        } else {
            s.setCurrentStage(s.getCurrentStage() + 1);
            s.setCurrentWave(1);
            s.setStageCleared(false);
            spawnWave(s);
            maybeSpawnWeapon(s);
        }
    }

    private void spawnWave(BrawlerState s) {
        int stage = s.getCurrentStage();
        boolean bossWave = stage >= s.getTotalStages() && s.getCurrentWave() >= s.getWavesPerStage();
        List<String> types = new ArrayList<>();
        if (bossWave) {
            types.add("Boss");
        } else {
            for (int i = 0; i < Math.max(1, config.getEnemyDensity()); i++) {
                if (stage == 1) types.add("Thug");
                else if (stage == 2) types.add(i == 0 ? "Bruiser" : "Thug");
                else types.add(i == 0 ? "Bruiser" : (i == 1 ? "Knife" : "Thug"));
            }
        }
        List<Thug> enemies = new ArrayList<>();
        for (int i = 0; i < types.size(); i++) {
            BrawlerCatalog.EnemyStats st = BrawlerCatalog.ENEMIES.get(types.get(i));
            enemies.add(new Thug("enemy_s" + stage + "_w" + s.getCurrentWave() + "_" + i,
                    types.get(i), st.hp(), st.hp(), st.atk(), 5 + i * 2, true));
        }
        s.setEnemies(enemies);
    }

    private void maybeSpawnWeapon(BrawlerState s) {
        SeededRandom rng = s.getRandom();
        if (!rng.chance(config.getWeaponSpawnRate())) return;
        String type = rng.pick(BrawlerCatalog.WEAPON_TYPES);
        BrawlerCatalog.WeaponStats st = BrawlerCatalog.WEAPONS.get(type);
        s.getWeapons().add(new Weapon("weapon_s" + s.getCurrentStage() + "_w" + s.getCurrentWave(),
                type, 3, st.damage(), st.durability()));
    }

    // ------------------------------------------------------------------ 轮转

    private String activePlayer(BrawlerState s) {
        return s.getOrder().get(Math.floorMod(s.getActiveIndex(), s.getOrder().size()));
    }

    private void advanceTurn(BrawlerState s) {
        List<String> order = s.getOrder();
        for (int step = 1; step <= order.size(); step++) {
            int next = Math.floorMod(s.getActiveIndex() + step, order.size());
            if (!s.getPlayers().get(order.get(next)).isKnockedOut()) {
                s.setActiveIndex(next);
                return;
            }
        }
    }

    // ------------------------------------------------------------------ 内核钩子

    @Override
    protected boolean isEliminated(BrawlerState s, String playerId) {
        Fighter f = s.getPlayers().get(playerId);
        return f == null || f.isKnockedOut();
    }

    @Override
    protected String phaseOf(BrawlerState s) {
        return "stage" + s.getCurrentStage() + "_wave" + s.getCurrentWave();
    }

    @Override
    protected boolean checkGameOver(BrawlerState s) {
        return s.isGameOver();
    }

    /** 通关时最高分者胜；全员 KO 无胜者 */
    @Override
    protected String determineWinner(BrawlerState s) {
        if (!(s.isGameOver() && s.isStageCleared() && s.getCurrentStage() >= s.getTotalStages())) {
            return null;
        }
        String best = null;
        int bestScore = -1;
        for (Map.Entry<String, Fighter> e : s.getPlayers().entrySet()) {
            if (e.getValue().getScore() > bestScore) {
                bestScore = e.getValue().getScore();
                best = e.getKey();
            }
        }
        return best;
    }

    @Override
    protected Map<String, Integer> calculateScores(BrawlerState s) {
        Map<String, Integer> scores = new LinkedHashMap<>();
        s.getPlayers().forEach((pid, f) -> scores.put(pid, f.getScore()));
        return scores;
    }
}
