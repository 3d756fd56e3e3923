package com.arenahub.gameservice.games.artillery.domain.model;

import lombok.Data;

/**
 * 补给箱：type 为 weapon / health / utility，content 为武器 slug 或 medkit。
 */
@Data
public class Crate {

    private String id;
    private double x;
    private double y;
    private String type;
    private String content;
    private boolean falling = true;

    public Crate copy() {
        Crate c = new Crate();
        c.id = id;
        c.x = x;
        c.y = y;
        c.type = type;
        c.content = content;
        c.falling = falling;
        return c;
    }
}
