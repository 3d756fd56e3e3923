package com.arenahub.gameservice.games.wrestler.domain.model;

import lombok.Data;

/** 裁判读秒状态 */
@Data
public class Referee {

    private boolean counting;
    private int count;
    private String targetId;

    public void reset() {
        counting = false;
        count = 0;
        targetId = null;
    }

    public Referee copy() {
        Referee r = new Referee();
        r.counting = counting;
        r.count = count;
        r.targetId = targetId;
        return r;
    }
}
