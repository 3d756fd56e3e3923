package com.arenahub.gameservice.engine.state;

import com.arenahub.gameservice.engine.core.SeededRandom;
import com.arenahub.gameservice.games.dungeon.domain.model.DungeonPhase;
import com.arenahub.gameservice.games.dungeon.domain.model.Enemy;
import com.arenahub.gameservice.games.dungeon.domain.model.Hero;
import com.arenahub.gameservice.games.dungeon.domain.model.LootItem;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 地牢对局数据。
 * - players 按加入顺序保存（LinkedHashMap），order 为战斗轮转顺序；
 * - nextItemId 为本局物品计数器，保证 id 在本局内唯一且可复现。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class DungeonState implements GameData {

    private Map<String, Hero> players = new LinkedHashMap<>();
    private List<String> order = new ArrayList<>();
    /** 战斗阶段当前行动者在 order 中的下标 */
    private int activeIndex;
    private int currentFloor = 1;
    private int totalFloors;
    private int bossEveryNFloors;
    private String lootRarity;
    private List<Enemy> enemies = new ArrayList<>();
    private List<LootItem> lootDrops = new ArrayList<>();
    private List<LootItem> shop = new ArrayList<>();
    private DungeonPhase phase = DungeonPhase.COMBAT;
    private int nextItemId = 1;
    private boolean gameOver;
    /** 通关（而非全灭） */
    private boolean victory;
    private SeededRandom random;

    @Override
    public boolean over() {
        return gameOver;
    }

    @Override
    public DungeonState copy() {
        DungeonState s = new DungeonState();
        players.forEach((k, v) -> s.players.put(k, v.copy()));
        s.order = new ArrayList<>(order);
        s.activeIndex = activeIndex;
        s.currentFloor = currentFloor;
        s.totalFloors = totalFloors;
        s.bossEveryNFloors = bossEveryNFloors;
        s.lootRarity = lootRarity;
        enemies.forEach(e -> s.enemies.add(e.copy()));
        lootDrops.forEach(i -> s.lootDrops.add(i.copy()));
        shop.forEach(i -> s.shop.add(i.copy()));
        s.phase = phase;
        s.nextItemId = nextItemId;
        s.gameOver = gameOver;
        s.victory = victory;
        s.random = random == null ? null : random.copy();
        return s;
    }
}
