package com.arenahub.gameservice.games.dungeon;

import com.arenahub.gameservice.engine.core.BaseGame;
import com.arenahub.gameservice.engine.core.EngineMode;
import com.arenahub.gameservice.engine.core.GameAction;
import com.arenahub.gameservice.engine.core.KernelMessages;
import com.arenahub.gameservice.engine.core.SeededRandom;
import com.arenahub.gameservice.engine.core.Verdict;
import com.arenahub.gameservice.engine.state.DungeonState;
import com.arenahub.gameservice.games.dungeon.domain.constants.DungeonCatalog;
import com.arenahub.gameservice.games.dungeon.domain.constants.DungeonCatalog.EnemyTemplate;
import com.arenahub.gameservice.games.dungeon.domain.constants.DungeonMessages;
import com.arenahub.gameservice.games.dungeon.domain.model.DungeonPhase;
import com.arenahub.gameservice.games.dungeon.domain.model.Enemy;
import com.arenahub.gameservice.games.dungeon.domain.model.EquipmentSlot;
import com.arenahub.gameservice.games.dungeon.domain.model.Hero;
import com.arenahub.gameservice.games.dungeon.domain.model.LootItem;
import com.arenahub.gameservice.games.dungeon.domain.model.Rarity;
import com.arenahub.gameservice.games.dungeon.domain.rule.DungeonRules;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 多层地牢：战斗 → 拾取 → 下楼 → 商店，循环直到最后一层或全员阵亡。
 * 战斗动作按 order 轮转，背包/装备/商店动作不受轮转限制。
 */
@Slf4j
public class DungeonGame extends BaseGame<DungeonState> {

    public static final String SLUG = "dungeon";

    private static final Set<String> ACTIONS = Set.of(
            "attack", "heavy_attack", "dodge", "block", "use_item", "equip",
            "loot_pickup", "descend", "shop_buy", "leave_shop");

    private final DungeonConfig config;

    public DungeonGame(DungeonConfig config) {
        super(DungeonState.class);
        this.config = config == null ? new DungeonConfig() : config;
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
    protected DungeonState initializeState(List<String> playerIds) {
        DungeonState s = new DungeonState();
        s.setRandom(new SeededRandom(config.getSeed() == null ? 0L : config.getSeed()));
        s.setTotalFloors(Math.max(1, config.getFloorCount()));
        s.setBossEveryNFloors(config.getBossEveryNFloors());
        s.setLootRarity(config.getLootRarity());
        int slots = Math.max(1, config.getEquipmentSlots());
        for (String pid : playerIds) {
            Hero h = new Hero();
            for (int i = 0; i < slots; i++) {
                String name = i < DungeonCatalog.SLOT_NAMES.size() ? DungeonCatalog.SLOT_NAMES.get(i) : "slot_" + i;
                h.getEquipment().add(new EquipmentSlot(name, null));
            }
            s.getPlayers().put(pid, h);
            s.getOrder().add(pid);
        }
        spawnEnemies(s);
        return s;
    }

    @Override
    protected Verdict processAction(DungeonState s, String playerId, GameAction action) {
        Hero hero = s.getPlayers().get(playerId);
        return switch (action.type()) {
            case "attack" -> attack(s, playerId, hero, action, false);
            case "heavy_attack" -> attack(s, playerId, hero, action, true);
            case "dodge" -> dodge(s, playerId, hero);
            case "block" -> block(s, playerId, hero);
            case "use_item" -> useItem(playerId, hero, action);
            case "equip" -> equip(playerId, hero, action);
            case "loot_pickup" -> lootPickup(s, playerId, hero, action);
            case "descend" -> descend(s, playerId);
            case "shop_buy" -> shopBuy(s, playerId, hero, action);
            case "leave_shop" -> leaveShop(s, playerId);
            default -> Verdict.reject(KernelMessages.formatUnknownAction(action.type()));
        };
    }

    // ------------------------------------------------------------------ 战斗

    private Verdict attack(DungeonState s, String pid, Hero hero, GameAction action, boolean heavy) {
        Verdict gate = combatGate(s, pid);
        if (gate != null) return gate;
        Optional<Enemy> target = resolveTarget(s, action);
        if (target.isEmpty()) {
            return Verdict.reject(DungeonMessages.TARGET_NOT_FOUND);
        }
        Enemy enemy = target.get();
        int damage = heavy
                ? DungeonRules.heavyDamage(hero.effectiveAtk(), hero.effectiveSpd(), enemy.getDef())
                : DungeonRules.playerDamage(hero.effectiveAtk(), hero.effectiveSpd(), enemy.getDef());
        enemy.setHp(enemy.getHp() - damage);
        if (heavy) {
            hero.setSkipNextTurn(true);
        }
        emit(heavy ? "heavy_attack" : "attack", pid, Map.of("target", enemy.getId(), "damage", damage));
        if (enemy.getHp() <= 0) {
            enemy.setHp(0);
            enemy.setAlive(false);
            onEnemyKilled(s, pid, hero, enemy);
        }
        enemyCounterattack(s, pid, hero);
        checkCombatEnd(s);
        advanceCombatTurn(s);
        return Verdict.accept();
    }

    private Verdict dodge(DungeonState s, String pid, Hero hero) {
        Verdict gate = combatGate(s, pid);
        if (gate != null) return gate;
        hero.setDodging(true);
        emit("dodge", pid, Map.of("chance", DungeonRules.dodgeChance(hero.effectiveSpd())));
        enemyCounterattack(s, pid, hero);
        hero.setDodging(false);
        advanceCombatTurn(s);
        return Verdict.accept();
    }

    private Verdict block(DungeonState s, String pid, Hero hero) {
        Verdict gate = combatGate(s, pid);
        if (gate != null) return gate;
        hero.setBlocking(true);
        emit("block", pid);
        enemyCounterattack(s, pid, hero);
        hero.setBlocking(false);
        checkCombatEnd(s);
        advanceCombatTurn(s);
        return Verdict.accept();
    }

    private Verdict combatGate(DungeonState s, String pid) {
        if (s.getPhase() != DungeonPhase.COMBAT) {
            return Verdict.reject(DungeonMessages.NOT_IN_COMBAT);
        }
        String active = activePlayer(s);
        if (!pid.equals(active)) {
            return Verdict.reject(KernelMessages.formatNotYourTurn(active));
        }
        return null;
    }

    /** targetId 优先，其次 targetIndex，都没给则取第一个存活的敌人 */
    private Optional<Enemy> resolveTarget(DungeonState s, GameAction action) {
        Optional<String> id = action.string("targetId");
        if (id.isPresent()) {
            return s.getEnemies().stream().filter(e -> e.isAlive() && e.getId().equals(id.get())).findFirst();
        }
        if (action.payload().containsKey("targetIndex")) {
            Optional<Integer> idx = action.integer("targetIndex");
            if (idx.isEmpty() || idx.get() < 0 || idx.get() >= s.getEnemies().size()) {
                return Optional.empty();
            }
            Enemy e = s.getEnemies().get(idx.get());
            return e.isAlive() ? Optional.of(e) : Optional.empty();
        }
        return s.getEnemies().stream().filter(Enemy::isAlive).findFirst();
    }

    private void onEnemyKilled(DungeonState s, String pid, Hero hero, Enemy enemy) {
        int xp = DungeonRules.killXp(s.getCurrentFloor());
        int gold = DungeonRules.killGold(s.getCurrentFloor());
        hero.setXp(hero.getXp() + xp);
        hero.setGold(hero.getGold() + gold);
        emit("enemy_killed", pid, Map.of("enemy", enemy.getName(), "xp", xp, "gold", gold));
        while (hero.getXp() >= DungeonCatalog.XP_PER_LEVEL) {
            hero.setXp(hero.getXp() - DungeonCatalog.XP_PER_LEVEL);
            hero.setLevel(hero.getLevel() + 1);
            hero.setMaxHp(hero.getMaxHp() + 5);
            hero.setHp(Math.min(hero.getHp() + 5, hero.getMaxHp()));
            hero.setStr(hero.getStr() + 2);
            hero.setDef(hero.getDef() + 1);
            hero.setSpd(hero.getSpd() + 1);
            emit("level_up", pid, Map.of("level", hero.getLevel()));
        }
        generateLoot(s, enemy);
    }

    private void generateLoot(DungeonState s, Enemy enemy) {
        SeededRandom rng = s.getRandom();
        double chance = enemy.isBoss() ? 1.0 : DungeonRules.dropChance(s.getLootRarity());
        int drops = 0;
        if (rng.chance(chance)) drops++;
        if (enemy.isBoss() || rng.chance(chance * 0.5)) drops++;
        Rarity tableKey = enemy.isBoss() ? Rarity.RARE : enemy.getLootTable();
        List<LootItem> table = DungeonCatalog.LOOT.getOrDefault(tableKey, DungeonCatalog.LOOT.get(Rarity.COMMON));
        for (int i = 0; i < drops; i++) {
            LootItem item = mint(s, rng.pick(table));
            // 掉落随楼层成长
            if (item.getAtk() > 0) item.setAtk(item.getAtk() + (int) Math.floor(s.getCurrentFloor() * 0.5));
            if (item.getDef() > 0) item.setDef(item.getDef() + (int) Math.floor(s.getCurrentFloor() * 0.3));
            s.getLootDrops().add(item);
        }
    }

    private void enemyCounterattack(DungeonState s, String pid, Hero hero) {
        for (Enemy enemy : s.getEnemies()) {
            if (!enemy.isAlive()) continue;
            if (hero.isDodging()) {
                int pct = DungeonRules.dodgeChance(hero.effectiveSpd());
                if (s.getRandom().nextDouble() * 100 < pct) {
                    emit("dodge_success", pid, Map.of("enemy", enemy.getId()));
                    continue;
                }
            }
            int damage = DungeonRules.counterDamage(enemy.getAtk(), hero.effectiveDef(), hero.isBlocking());
            if (hero.isBlocking()) {
                emit("block_absorbed", pid, Map.of("reduced", damage, "enemy", enemy.getId()));
            }
            hero.setHp(hero.getHp() - damage);
            if (hero.getHp() <= 0) {
                hero.setHp(0);
                emit("player_died", pid);
                if (s.getPlayers().values().stream().noneMatch(Hero::alive)) {
                    s.setGameOver(true);
                    emit("game_over", null, Map.of("result", "defeat"));
                }
                break;
            }
        }
    }

    private void checkCombatEnd(DungeonState s) {
        if (s.isGameOver() || s.getPhase() != DungeonPhase.COMBAT) return;
        if (s.getEnemies().stream().noneMatch(Enemy::isAlive)) {
            emit("floor_cleared", null, Map.of("floor", s.getCurrentFloor()));
            s.setPhase(s.getLootDrops().isEmpty() ? DungeonPhase.DESCEND : DungeonPhase.LOOT);
        }
    }

    // ------------------------------------------------------------------ 背包

    private Verdict useItem(String pid, Hero hero, GameAction action) {
        Optional<String> itemId = action.string("itemId");
        if (itemId.isEmpty()) return Verdict.reject(DungeonMessages.MISSING_ITEM_ID);
        int idx = indexOf(hero.getInventory(), itemId.get());
        if (idx < 0) return Verdict.reject(DungeonMessages.ITEM_NOT_IN_INVENTORY);
        LootItem item = hero.getInventory().get(idx);
        if (!item.consumable()) return Verdict.reject(DungeonMessages.NOT_CONSUMABLE);

        int before = hero.getHp();
        hero.setHp(Math.min(hero.getMaxHp(), hero.getHp() + item.getHp()));
        hero.getInventory().remove(idx);
        emit("use_item", pid, Map.of("item", item.getName(), "healed", hero.getHp() - before));
        return Verdict.accept();
    }

    private Verdict equip(String pid, Hero hero, GameAction action) {
        Optional<String> itemId = action.string("itemId");
        if (itemId.isEmpty()) return Verdict.reject(DungeonMessages.MISSING_ITEM_ID);
        int idx = indexOf(hero.getInventory(), itemId.get());
        if (idx < 0) return Verdict.reject(DungeonMessages.ITEM_NOT_IN_INVENTORY);
        LootItem item = hero.getInventory().get(idx);
        if (item.consumable()) return Verdict.reject(DungeonMessages.CANNOT_EQUIP_CONSUMABLE);
        Optional<Integer> slotIdx = resolveSlot(hero, action);
        if (slotIdx.isEmpty()) return Verdict.reject(DungeonMessages.INVALID_SLOT);

        EquipmentSlot slot = hero.getEquipment().get(slotIdx.get());
        hero.getInventory().remove(idx);
        LootItem previous = slot.getItem();
        if (previous != null) {
            hero.getInventory().add(previous);
            // 卸下时收回原装备的生命加成，当前生命至少保留 1
            if (previous.getHp() > 0) {
                hero.setMaxHp(hero.getMaxHp() - previous.getHp());
                hero.setHp(Math.max(1, Math.min(hero.getHp(), hero.getMaxHp())));
            }
        }
        slot.setItem(item);
        if (item.getHp() > 0) {
            hero.setMaxHp(hero.getMaxHp() + item.getHp());
            hero.setHp(hero.getHp() + item.getHp());
        }
        emit("equip", pid, Map.of("item", item.getName(), "slot", slot.getSlot()));
        return Verdict.accept();
    }

    /** slot 可以是下标，也可以是槽名 */
    private Optional<Integer> resolveSlot(Hero hero, GameAction action) {
        Optional<Integer> byIndex = action.integer("slot");
        if (byIndex.isPresent()) {
            int i = byIndex.get();
            return i >= 0 && i < hero.getEquipment().size() ? byIndex : Optional.empty();
        }
        Optional<String> byName = action.string("slot");
        if (byName.isPresent()) {
            for (int i = 0; i < hero.getEquipment().size(); i++) {
                if (hero.getEquipment().get(i).getSlot().equals(byName.get())) return Optional.of(i);
            }
        }
        return Optional.empty();
    }

    private Verdict lootPickup(DungeonState s, String pid, Hero hero, GameAction action) {
        if (s.getPhase() != DungeonPhase.LOOT) return Verdict.reject(DungeonMessages.NO_LOOT_PHASE);
        Optional<String> itemId = action.string("itemId");
        if (itemId.isEmpty()) return Verdict.reject(DungeonMessages.MISSING_ITEM_ID);
        int idx = indexOf(s.getLootDrops(), itemId.get());
        if (idx < 0) return Verdict.reject(DungeonMessages.LOOT_NOT_FOUND);

        LootItem item = s.getLootDrops().remove(idx);
        hero.getInventory().add(item);
        emit("loot_pickup", pid, Map.of("item", item.getName(), "rarity", item.getRarity().name().toLowerCase()));
        if (s.getLootDrops().isEmpty()) {
            s.setPhase(DungeonPhase.DESCEND);
        }
        return Verdict.accept();
    }

    // ------------------------------------------------------------------ 楼层与商店

    private Verdict descend(DungeonState s, String pid) {
        if (s.getPhase() != DungeonPhase.DESCEND) return Verdict.reject(DungeonMessages.CANNOT_DESCEND);
        if (s.getCurrentFloor() >= s.getTotalFloors()) {
            s.setGameOver(true);
            s.setVictory(true);
            emit("victory", pid, Map.of("floorsCleared", s.getTotalFloors()));
            return Verdict.accept();
        }
        s.setCurrentFloor(s.getCurrentFloor() + 1);
        s.getLootDrops().clear();
        s.setPhase(DungeonPhase.SHOP);
        generateShop(s);
        emit("descend", pid, Map.of("floor", s.getCurrentFloor()));
        return Verdict.accept();
    }

    private Verdict shopBuy(DungeonState s, String pid, Hero hero, GameAction action) {
        if (s.getPhase() != DungeonPhase.SHOP) return Verdict.reject(DungeonMessages.SHOP_CLOSED);
        Optional<String> itemId = action.string("itemId");
        if (itemId.isEmpty()) return Verdict.reject(DungeonMessages.MISSING_ITEM_ID);
        int idx = indexOf(s.getShop(), itemId.get());
        if (idx < 0) return Verdict.reject(DungeonMessages.ITEM_NOT_IN_SHOP);
        LootItem item = s.getShop().get(idx);
        if (hero.getGold() < item.getValue()) {
            return Verdict.reject(DungeonMessages.formatNotEnoughGold(item.getValue(), hero.getGold()));
        }
        hero.setGold(hero.getGold() - item.getValue());
        hero.getInventory().add(s.getShop().remove(idx));
        emit("shop_buy", pid, Map.of("item", item.getName(), "cost", item.getValue()));
        return Verdict.accept();
    }

    private Verdict leaveShop(DungeonState s, String pid) {
        if (s.getPhase() != DungeonPhase.SHOP) return Verdict.reject(DungeonMessages.SHOP_CLOSED);
        s.getShop().clear();
        spawnEnemies(s);
        s.setPhase(DungeonPhase.COMBAT);
        s.setActiveIndex(0);
        if (!s.getPlayers().get(activePlayer(s)).alive()) {
            advanceCombatTurn(s);
        }
        emit("floor_entered", pid, Map.of("floor", s.getCurrentFloor(), "enemies", s.getEnemies().size()));
        return Verdict.accept();
    }

    private void spawnEnemies(DungeonState s) {
        int floor = s.getCurrentFloor();
        List<Enemy> enemies = new ArrayList<>();
        boolean bossFloor = s.getBossEveryNFloors() > 0 && floor % s.getBossEveryNFloors() == 0;
        if (bossFloor) {
            EnemyTemplate t = s.getRandom().pick(DungeonCatalog.BOSSES);
            enemies.add(new Enemy("enemy_f" + floor + "_0", t.name(), t.hp(), t.hp(), t.atk(), t.def(),
                    t.lootTable(), true, true));
        } else {
            int count = 2 + Math.min(2, floor / 2);
            for (int i = 0; i < count; i++) {
                EnemyTemplate t = DungeonCatalog.ENEMIES.get(Math.min(floor / 2 + i, DungeonCatalog.ENEMIES.size() - 1));
                int hp = t.hp() + floor * 2;
                enemies.add(new Enemy("enemy_f" + floor + "_" + i, t.name(), hp, hp,
                        t.atk() + (int) Math.floor(floor * 0.5), t.def(), t.lootTable(), false, true));
            }
        }
        s.setEnemies(enemies);
    }

    private void generateShop(DungeonState s) {
        List<Rarity> tables = s.getCurrentFloor() <= 2
                ? List.of(Rarity.COMMON, Rarity.UNCOMMON)
                : List.of(Rarity.UNCOMMON, Rarity.RARE);
        List<LootItem> shop = new ArrayList<>();
        for (int i = 0; i < DungeonCatalog.SHOP_SIZE; i++) {
            List<LootItem> table = DungeonCatalog.LOOT.get(s.getRandom().pick(tables));
            shop.add(mint(s, s.getRandom().pick(table)));
        }
        s.setShop(shop);
    }

    /** 从模板复制物品并分配本局唯一 id */
    private LootItem mint(DungeonState s, LootItem template) {
        LootItem item = template.copy();
        item.setId("item_" + s.getNextItemId());
        s.setNextItemId(s.getNextItemId() + 1);
        return item;
    }

    // ------------------------------------------------------------------ 轮转

    private String activePlayer(DungeonState s) {
        List<String> order = s.getOrder();
        return order.get(Math.floorMod(s.getActiveIndex(), order.size()));
    }

    /** 轮到下一位存活角色；全员阵亡时不动 */
    private void advanceCombatTurn(DungeonState s) {
        List<String> order = s.getOrder();
        for (int step = 1; step <= order.size(); step++) {
            int next = Math.floorMod(s.getActiveIndex() + step, order.size());
            if (s.getPlayers().get(order.get(next)).alive()) {
                s.setActiveIndex(next);
                return;
            }
        }
    }

    private static int indexOf(List<LootItem> items, String id) {
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i).getId().equals(id)) return i;
        }
        return -1;
    }

    // ------------------------------------------------------------------ 内核钩子

    @Override
    protected boolean consumeSkip(DungeonState s, String playerId, GameAction action) {
        Hero h = s.getPlayers().get(playerId);
        if (h == null || !h.isSkipNextTurn()) return false;
        // 眩晕只吃掉自己的战斗回合；非法动作与越权动作照常被拒绝，标记保留
        if (!ACTIONS.contains(action.type())
                || s.getPhase() != DungeonPhase.COMBAT
                || !playerId.equals(activePlayer(s))) {
            return false;
        }
        h.setSkipNextTurn(false);
        advanceCombatTurn(s);
        return true;
    }

    @Override
    protected boolean isEliminated(DungeonState s, String playerId) {
        Hero h = s.getPlayers().get(playerId);
        return h == null || !h.alive();
    }

    @Override
    protected String phaseOf(DungeonState s) {
        return s.getPhase().label();
    }

    @Override
    protected DungeonState projectForPlayer(DungeonState copy, String playerId) {
        // 其他玩家的背包不可见
        copy.getPlayers().forEach((pid, h) -> {
            if (!pid.equals(playerId)) h.getInventory().clear();
        });
        return copy;
    }

    @Override
    protected boolean checkGameOver(DungeonState s) {
        return s.isGameOver();
    }

    @Override
    protected String determineWinner(DungeonState s) {
        if (!s.isGameOver()) return null;
        String best = null;
        int bestScore = -1;
        for (Map.Entry<String, Hero> e : s.getPlayers().entrySet()) {
            if (!e.getValue().alive()) continue;
            int score = e.getValue().score();
            if (score > bestScore) {
                bestScore = score;
                best = e.getKey();
            }
        }
        return best;
    }

    @Override
    protected Map<String, Integer> calculateScores(DungeonState s) {
        Map<String, Integer> scores = new LinkedHashMap<>();
        s.getPlayers().forEach((pid, h) -> scores.put(pid, h.score()));
        return scores;
    }
}
