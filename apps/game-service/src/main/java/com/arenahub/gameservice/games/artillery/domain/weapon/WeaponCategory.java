package com.arenahub.gameservice.games.artillery.domain.weapon;

import com.fasterxml.jackson.annotation.JsonValue;

public enum WeaponCategory {
    PROJECTILE("projectile"),
    THROWN("thrown"),
    HITSCAN("hitscan"),
    MELEE("melee"),
    PLACED("placed"),
    AREA_STRIKE("airstrike"),
    CLUSTER("cluster"),
    HOMING("homing"),
    UTILITY("utility");

    private final String label;

    WeaponCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** 需要走弹道模拟的类别 */
    public boolean ballistic() {
        return this == PROJECTILE || this == THROWN || this == CLUSTER || this == HOMING;
    }
}
