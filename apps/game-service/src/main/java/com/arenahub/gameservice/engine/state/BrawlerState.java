package com.arenahub.gameservice.engine.state;

import com.arenahub.gameservice.engine.core.SeededRandom;
import com.arenahub.gameservice.games.brawler.domain.model.Fighter;
import com.arenahub.gameservice.games.brawler.domain.model.Thug;
import com.arenahub.gameservice.games.brawler.domain.model.Weapon;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 乱斗对局数据：关卡/波次进度、场上敌人与地面武器。
 */
@Data
public final class BrawlerState implements GameData {

    private Map<String, Fighter> players = new LinkedHashMap<>();
    private List<String> order = new ArrayList<>();
    private int activeIndex;
    private int currentStage = 1;
    private int totalStages;
    private int currentWave = 1;
    private int wavesPerStage;
    private List<Thug> enemies = new ArrayList<>();
    private List<Weapon> weapons = new ArrayList<>();
    private boolean stageCleared;
    private boolean gameOver;
    private SeededRandom random;

    @Override
    public boolean over() {
        return gameOver;
    }

    @Override
    public BrawlerState copy() {
        BrawlerState s = new BrawlerState();
        players.forEach((k, v) -> s.players.put(k, v.copy()));
        s.order = new ArrayList<>(order);
        s.activeIndex = activeIndex;
        s.currentStage = currentStage;
        s.totalStages = totalStages;
        s.currentWave = currentWave;
        s.wavesPerStage = wavesPerStage;
        enemies.forEach(e -> s.enemies.add(e.copy()));
        weapons.forEach(w -> s.weapons.add(w.copy()));
        s.stageCleared = stageCleared;
        s.gameOver = gameOver;
        s.random = random == null ? null : random.copy();
        return s;
    }
}
