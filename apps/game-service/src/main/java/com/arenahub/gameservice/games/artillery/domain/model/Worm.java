package com.arenahub.gameservice.games.artillery.domain.model;

import lombok.Data;

/**
 * 一只虫子。坐标 y 向下增长；vx/vy 任一不为 0 即视为在运动中。
 */
@Data
public class Worm {

    private String id;
    private String playerId;
    private int teamId;
    private String name;
    private double x;
    private double y;
    private double vx;
    private double vy;
    private int hp;
    private int maxHp;
    private boolean alive = true;
    private boolean facingRight = true;
    /** 本次腾空期间的最高点，落地时据此计算坠落高度；着地时为 null */
    private Double fallStartY;

    public boolean moving() {
        return vx != 0 || vy != 0;
    }

    public Worm copy() {
        Worm w = new Worm();
        w.id = id;
        w.playerId = playerId;
        w.teamId = teamId;
        w.name = name;
        w.x = x;
        w.y = y;
        w.vx = vx;
        w.vy = vy;
        w.hp = hp;
        w.maxHp = maxHp;
        w.alive = alive;
        w.facingRight = facingRight;
        w.fallStartY = fallStartY;
        return w;
    }
}
