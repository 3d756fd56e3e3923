package com.arenahub.gameservice.games.dungeon.domain.rule;

/**
 * 地牢伤害与奖励公式，纯函数。
 */
public final class DungeonRules {

    private DungeonRules() {
    }

    /** 重击倍率 */
    public static final double HEAVY_MULTIPLIER = 1.8;

    /** max(1, floor(atk * (1 + spd%) - def)) */
    public static int playerDamage(int atk, int spd, int enemyDef) {
        double raw = atk * (1 + spd * 0.01) - enemyDef;
        return Math.max(1, (int) Math.floor(raw));
    }

    public static int heavyDamage(int atk, int spd, int enemyDef) {
        return (int) Math.floor(playerDamage(atk, spd, enemyDef) * HEAVY_MULTIPLIER);
    }

    /** 敌人反击：max(1, atk - def)，格挡减半（向下取整） */
    public static int counterDamage(int enemyAtk, int heroDef, boolean blocking) {
        int dmg = Math.max(1, enemyAtk - heroDef);
        return blocking ? dmg / 2 : dmg;
    }

    /** 闪避率（百分比），上限 95 */
    public static int dodgeChance(int spd) {
        return Math.min(95, 70 + spd * 2);
    }

    public static int killXp(int floor) {
        return 10 + floor * 4;
    }

    public static int killGold(int floor) {
        return 5 + floor * 3;
    }

    /** 按掉落倾向给出基础掉率 */
    public static double dropChance(String lootRarity) {
        return switch (lootRarity == null ? "balanced" : lootRarity) {
            case "generous" -> 0.8;
            case "common" -> 0.3;
            default -> 0.5;
        };
    }
}
