package com.arenahub.gameservice.engine.state;

import com.arenahub.gameservice.engine.core.SeededRandom;
import com.arenahub.gameservice.games.sumo.domain.model.Rikishi;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 相扑对局数据：两名力士在一维土俵上，先出界者负。
 */
@Data
public final class SumoState implements GameData {

    private Map<String, Rikishi> wrestlers = new LinkedHashMap<>();
    private int ringSize;
    private int tachiaiBonusWindow;
    private int turnCount;
    private boolean matchOver;
    private String winnerId;
    private Map<String, Integer> totalScore = new LinkedHashMap<>();
    private SeededRandom random;

    @Override
    public boolean over() {
        return matchOver;
    }

    @Override
    public SumoState copy() {
        SumoState s = new SumoState();
        wrestlers.forEach((k, v) -> s.wrestlers.put(k, v.copy()));
        s.ringSize = ringSize;
        s.tachiaiBonusWindow = tachiaiBonusWindow;
        s.turnCount = turnCount;
        s.matchOver = matchOver;
        s.winnerId = winnerId;
        s.totalScore = new LinkedHashMap<>(totalScore);
        s.random = random == null ? null : random.copy();
        return s;
    }
}
