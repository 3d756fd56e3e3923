package com.arenahub.gameservice.engine.state;

import com.arenahub.gameservice.engine.core.SeededRandom;
import com.arenahub.gameservice.games.artillery.domain.model.ArtilleryPlayer;
import com.arenahub.gameservice.games.artillery.domain.model.Crate;
import com.arenahub.gameservice.games.artillery.domain.model.Projectile;
import com.arenahub.gameservice.games.artillery.domain.model.TurnPhase;
import com.arenahub.gameservice.games.artillery.domain.model.Worm;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 炮击对战数据。地形为每列一个地面高度 ground[x]（y 向下增长，数值越大地面越低）。
 * 计时字段 turnStartedAt / retreatStartedAt 记录的是动作时间戳，只在下一次信号到来时比较。
 */
@Data
public final class ArtilleryState implements GameData {

    private int[] ground = new int[0];
    private int width;
    private int height;
    private Map<String, ArtilleryPlayer> players = new LinkedHashMap<>();
    private Map<String, Worm> worms = new LinkedHashMap<>();
    private List<String> turnOrder = new ArrayList<>();
    private int currentTurnIndex;
    private String activeWormId;
    private TurnPhase turnPhase = TurnPhase.MOVING;
    private long turnStartedAt;
    private long retreatStartedAt;
    /** 最近一次动作携带的时间戳 */
    private long lastSignalAt;
    /** 进入当前阶段后经过的 tick 数 */
    private int phaseTicks;
    private boolean hasFiredThisTurn;
    private int wind;
    private double waterLevel;
    private boolean suddenDeath;
    private double roundTimeRemaining;
    private long totalTicks;
    private List<Projectile> projectiles = new ArrayList<>();
    private List<Crate> crates = new ArrayList<>();
    private boolean gameOver;
    private int turnCount;
    private String mode;
    private String selectedWeapon;
    /** 弧度 */
    private double aimAngle;
    private double power = 50;
    private int fuseTimer = 3;
    private int nextCrateId;
    private int nextProjectileId;
    private SeededRandom random;

    @Override
    public boolean over() {
        return gameOver;
    }

    public String currentPlayerId() {
        return turnOrder.isEmpty() ? null : turnOrder.get(Math.min(currentTurnIndex, turnOrder.size() - 1));
    }

    public int groundAt(int x) {
        if (ground.length == 0) return height;
        return ground[Math.max(0, Math.min(width - 1, x))];
    }

    @Override
    public ArtilleryState copy() {
        ArtilleryState s = new ArtilleryState();
        s.ground = ground.clone();
        s.width = width;
        s.height = height;
        players.forEach((k, v) -> s.players.put(k, v.copy()));
        worms.forEach((k, v) -> s.worms.put(k, v.copy()));
        s.turnOrder = new ArrayList<>(turnOrder);
        s.currentTurnIndex = currentTurnIndex;
        s.activeWormId = activeWormId;
        s.turnPhase = turnPhase;
        s.turnStartedAt = turnStartedAt;
        s.retreatStartedAt = retreatStartedAt;
        s.lastSignalAt = lastSignalAt;
        s.phaseTicks = phaseTicks;
        s.hasFiredThisTurn = hasFiredThisTurn;
        s.wind = wind;
        s.waterLevel = waterLevel;
        s.suddenDeath = suddenDeath;
        s.roundTimeRemaining = roundTimeRemaining;
        s.totalTicks = totalTicks;
        projectiles.forEach(p -> s.projectiles.add(p.copy()));
        crates.forEach(c -> s.crates.add(c.copy()));
        s.gameOver = gameOver;
        s.turnCount = turnCount;
        s.mode = mode;
        s.selectedWeapon = selectedWeapon;
        s.aimAngle = aimAngle;
        s.power = power;
        s.fuseTimer = fuseTimer;
        s.nextCrateId = nextCrateId;
        s.nextProjectileId = nextProjectileId;
        s.random = random == null ? null : random.copy();
        return s;
    }
}
