package com.arenahub.gameservice.games.dungeon.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 地牢楼层循环：战斗 → 拾取 → 下楼 → 商店 → 战斗 ……
 */
public enum DungeonPhase {
    COMBAT("combat"),
    LOOT("loot"),
    DESCEND("descend"),
    SHOP("shop");

    private final String label;

    DungeonPhase(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
