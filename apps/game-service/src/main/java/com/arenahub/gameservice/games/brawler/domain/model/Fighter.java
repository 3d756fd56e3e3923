package com.arenahub.gameservice.games.brawler.domain.model;

import lombok.Data;

/**
 * 乱斗玩家。lives 用完且 hp 归零即 KO，不能再行动。
 */
@Data
public class Fighter {

    private int hp = 100;
    private int maxHp = 100;
    private int x;
    private int score;
    /** 手持武器，空手为 null */
    private Weapon weapon;
    private int comboCount;
    private int lives = 3;
    private String lastAction;
    private boolean knockedOut;

    public Fighter copy() {
        Fighter f = new Fighter();
        f.hp = hp;
        f.maxHp = maxHp;
        f.x = x;
        f.score = score;
        f.weapon = weapon == null ? null : weapon.copy();
        f.comboCount = comboCount;
        f.lives = lives;
        f.lastAction = lastAction;
        f.knockedOut = knockedOut;
        return f;
    }
}
