package com.arenahub.gameservice.engine.state;

import com.arenahub.gameservice.engine.core.SeededRandom;
import com.arenahub.gameservice.games.wrestler.domain.model.Referee;
import com.arenahub.gameservice.games.wrestler.domain.model.Wrestler;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 摔角对局数据。
 * pinAttemptActive 为真时进入压制子状态：只有 pinDefender 可以行动。
 */
@Data
public final class WrestlerState implements GameData {

    private Map<String, Wrestler> wrestlers = new LinkedHashMap<>();
    private int crowdMeter;
    private Referee referee = new Referee();
    private String matchType;
    private List<String> turnOrder = new ArrayList<>();
    private int currentTurnIndex;
    private boolean matchOver;
    private boolean pinAttemptActive;
    private String pinAttacker;
    private String pinDefender;
    private int finisherThreshold;
    private SeededRandom random;

    @Override
    public boolean over() {
        return matchOver;
    }

    @Override
    public WrestlerState copy() {
        WrestlerState s = new WrestlerState();
        wrestlers.forEach((k, v) -> s.wrestlers.put(k, v.copy()));
        s.crowdMeter = crowdMeter;
        s.referee = referee.copy();
        s.matchType = matchType;
        s.turnOrder = new ArrayList<>(turnOrder);
        s.currentTurnIndex = currentTurnIndex;
        s.matchOver = matchOver;
        s.pinAttemptActive = pinAttemptActive;
        s.pinAttacker = pinAttacker;
        s.pinDefender = pinDefender;
        s.finisherThreshold = finisherThreshold;
        s.random = random == null ? null : random.copy();
        return s;
    }
}
