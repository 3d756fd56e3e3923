package com.arenahub.gameservice.games.artillery.domain.weapon;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.arenahub.gameservice.games.artillery.domain.weapon.WeaponCategory.*;

/**
 * 武器注册表：静态默认表 + 本会话的覆盖项，读取时合并。
 * 默认表不可变，覆盖只作用于持有它的那个注册表实例，不会串到别的会话。
 */
public class WeaponRegistry {

    /** 集束弹爆开后的子弹头，不进玩家背包 */
    public static final String BANANA_FRAGMENT = "banana-cluster";
    public static final String GRENADE_FRAGMENT = "grenade-cluster";
    private static final Set<String> INTERNAL = Set.of(BANANA_FRAGMENT, GRENADE_FRAGMENT);

    public static final String DEFAULT_WEAPON = "bazooka";

    private static final Map<String, WeaponDef> DEFAULTS;

    static {
        Map<String, WeaponDef> m = new LinkedHashMap<>();
        put(m, "bazooka", "Bazooka", 50, 25, PROJECTILE, -1, 8, true, true, -1, false, 0, 1, 0, true);
        put(m, "homing-missile", "Homing Missile", 50, 25, HOMING, 1, 7, true, true, -1, false, 0, 1, 0, true);
        put(m, "grenade", "Grenade", 50, 25, THROWN, -1, 7, true, false, 3, true, 0.4, 1, 0, true);
        put(m, "cluster-bomb", "Cluster Bomb", 50, 20, CLUSTER, 2, 7, true, false, 3, true, 0.4, 1, 5, true);
        put(m, "banana-bomb", "Banana Bomb", 75, 30, CLUSTER, 1, 6, true, false, 3, true, 0.35, 1, 5, true);
        put(m, "holy-hand-grenade", "Holy Hand Grenade", 100, 55, THROWN, 1, 5, true, false, 3, true, 0.2, 1, 0, true);
        put(m, "shotgun", "Shotgun", 25, 0, HITSCAN, -1, 0, false, false, -1, false, 0, 2, 0, true);
        put(m, "fire-punch", "Fire Punch", 30, 0, MELEE, -1, 0, false, false, -1, false, 0, 1, 0, true);
        put(m, "dynamite", "Dynamite", 75, 40, PLACED, 1, 0, false, false, 5, false, 0, 1, 0, true);
        put(m, "mine", "Mine", 25, 20, PLACED, 2, 0, false, false, 3, false, 0, 1, 0, true);
        put(m, "airstrike", "Airstrike", 30, 20, AREA_STRIKE, 1, 10, true, true, -1, false, 0, 5, 0, true);
        put(m, "napalm-strike", "Napalm Strike", 50, 30, AREA_STRIKE, 1, 10, true, true, -1, false, 0, 5, 0, true);
        put(m, "blowtorch", "Blowtorch", 15, 0, UTILITY, -1, 0, false, false, -1, false, 0, 1, 0, true);
        put(m, "drill", "Pneumatic Drill", 15, 0, UTILITY, -1, 0, false, false, -1, false, 0, 1, 0, true);
        put(m, "teleport", "Teleport", 0, 0, UTILITY, 2, 0, false, false, -1, false, 0, 1, 0, true);
        put(m, "ninja-rope", "Ninja Rope", 0, 0, UTILITY, 5, 0, false, false, -1, false, 0, 1, 0, false);
        put(m, "girder", "Girder", 0, 0, UTILITY, 2, 0, false, false, -1, false, 0, 1, 0, true);
        put(m, "baseball-bat", "Baseball Bat", 30, 0, MELEE, -1, 0, false, false, -1, false, 0, 1, 0, true);
        put(m, "prod", "Prod", 0, 0, MELEE, -1, 0, false, false, -1, false, 0, 1, 0, true);
        put(m, "skip", "Skip Turn", 0, 0, UTILITY, -1, 0, false, false, -1, false, 0, 1, 0, true);
        put(m, BANANA_FRAGMENT, "Banana Fragment", 75, 25, THROWN, 0, 4, true, false, 1.5, true, 0.3, 1, 0, true);
        put(m, GRENADE_FRAGMENT, "Cluster Fragment", 15, 15, THROWN, 0, 4, true, false, 1.5, true, 0.3, 1, 0, true);
        DEFAULTS = Collections.unmodifiableMap(m);
    }

    private final Map<String, WeaponOverride> overrides;

    public WeaponRegistry(Map<String, WeaponOverride> overrides) {
        Map<String, WeaponOverride> copy = new HashMap<>();
        if (overrides != null) {
            overrides.forEach((slug, o) -> {
                if (slug != null && o != null) copy.put(slug, o);
            });
        }
        this.overrides = Collections.unmodifiableMap(copy);
    }

    public static WeaponRegistry defaults() {
        return new WeaponRegistry(Map.of());
    }

    /** 合并后的定义；未知武器为空 */
    public Optional<WeaponDef> find(String slug) {
        if (slug == null) {
            return Optional.empty();
        }
        WeaponDef base = DEFAULTS.get(slug);
        return base == null ? Optional.empty() : Optional.of(base.with(overrides.get(slug)));
    }

    /** 未合并的默认定义，只读 */
    public static WeaponDef defaultOf(String slug) {
        return DEFAULTS.get(slug);
    }

    /** 开局背包：每种可选武器的弹药数（-1 无限） */
    public Map<String, Integer> startingInventory() {
        Map<String, Integer> inv = new LinkedHashMap<>();
        for (String slug : DEFAULTS.keySet()) {
            if (!INTERNAL.contains(slug)) {
                inv.put(slug, find(slug).map(WeaponDef::defaultAmmo).orElse(0));
            }
        }
        return inv;
    }

    public static boolean isFragment(String slug) {
        return INTERNAL.contains(slug);
    }

    private static void put(Map<String, WeaponDef> m, String slug, String name, int damage, int radius,
                            WeaponCategory category, int ammo, double speed, boolean gravity, boolean wind,
                            double fuse, boolean bounces, double bounciness, int shots, int clusters,
                            boolean endsTurn) {
        m.put(slug, new WeaponDef(slug, name, damage, radius, category, ammo, speed, gravity, wind,
                fuse, bounces, bounciness, shots, clusters, endsTurn));
    }
}
