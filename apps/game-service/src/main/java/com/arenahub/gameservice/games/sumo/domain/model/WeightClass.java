package com.arenahub.gameservice.games.sumo.domain.model;

import java.util.Locale;

/**
 * 体重级别：力量 / 稳定 / 速度。
 */
public enum WeightClass {
    LIGHT(6, 10, 10),
    MEDIUM(8, 8, 8),
    HEAVY(12, 6, 5);

    private final int strength;
    private final int stability;
    private final int speed;

    WeightClass(int strength, int stability, int speed) {
        this.strength = strength;
        this.stability = stability;
        this.speed = speed;
    }

    public int strength() {
        return strength;
    }

    public int stability() {
        return stability;
    }

    public int speed() {
        return speed;
    }

    /** 未知或为空时按 medium 处理 */
    public static WeightClass of(String name) {
        if (name == null) {
            return MEDIUM;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return MEDIUM;
        }
    }
}
