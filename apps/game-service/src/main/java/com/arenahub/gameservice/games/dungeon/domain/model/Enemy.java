package com.arenahub.gameservice.games.dungeon.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Enemy {

    private String id;
    private String name;
    private int hp;
    private int maxHp;
    private int atk;
    private int def;
    private Rarity lootTable;
    private boolean boss;
    private boolean alive;

    public Enemy copy() {
        return new Enemy(id, name, hp, maxHp, atk, def, lootTable, boss, alive);
    }
}
