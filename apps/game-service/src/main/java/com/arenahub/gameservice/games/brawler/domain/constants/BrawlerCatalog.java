package com.arenahub.gameservice.games.brawler.domain.constants;

import java.util.List;
import java.util.Map;

/**
 * 乱斗数值表。
 */
public final class BrawlerCatalog {

    private BrawlerCatalog() {
    }

    public record EnemyStats(int hp, int atk) {
    }

    public record WeaponStats(int damage, int durability) {
    }

    public static final Map<String, EnemyStats> ENEMIES = Map.of(
            "Thug", new EnemyStats(20, 4),
            "Bruiser", new EnemyStats(40, 7),
            "Knife", new EnemyStats(25, 10),
            "Boss", new EnemyStats(80, 12));

    /** 顺序固定，随机抽取时依赖它保证可复现 */
    public static final List<String> WEAPON_TYPES = List.of("pipe", "bat", "chain");

    public static final Map<String, WeaponStats> WEAPONS = Map.of(
            "pipe", new WeaponStats(12, 5),
            "bat", new WeaponStats(15, 4),
            "chain", new WeaponStats(10, 8));

    public static final int ATTACK_DAMAGE = 8;
    public static final int JUMP_ATTACK_DAMAGE = 12;
    public static final int GRAB_DAMAGE = 6;
    public static final int THROW_DAMAGE = 15;
    public static final int SPECIAL_DAMAGE = 20;
    public static final int SPECIAL_HP_COST = 20;
    public static final int KILL_BONUS = 50;
    public static final double COMBO_STEP = 0.15;
}
