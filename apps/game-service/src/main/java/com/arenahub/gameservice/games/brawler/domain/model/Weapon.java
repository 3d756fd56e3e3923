package com.arenahub.gameservice.games.brawler.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** 地面上可拾取的武器；被拾起后随玩家移动，耐久用尽即损坏 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Weapon {

    private String id;
    private String type;
    private int x;
    private int damage;
    private int durability;

    public Weapon copy() {
        return new Weapon(id, type, x, damage, durability);
    }
}
