package com.arenahub.gameservice.games.brawler.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Thug {

    private String id;
    private String name;
    private int hp;
    private int maxHp;
    private int atk;
    private int x;
    private boolean alive;

    public Thug copy() {
        return new Thug(id, name, hp, maxHp, atk, x, alive);
    }
}
