package com.arenahub.gameservice.games.artillery.domain.constants;

import java.util.List;

/**
 * 炮击对战的物理与回合常量。
 */
public final class ArtilleryRules {

    private ArtilleryRules() {
    }

    /** 一个 tick 视为 1/30 秒 */
    public static final int TICKS_PER_SECOND = 30;
    public static final double SECONDS_PER_TICK = 1.0 / TICKS_PER_SECOND;

    /** NPC 回合自动结算的 tick 上限，耗尽即强制收尾 */
    public static final int AUTOPLAY_TICK_CEILING = 600;
    /** 单次调用内最多连续代打的 NPC 回合数 */
    public static final int MAX_CHAINED_NPC_TURNS = 16;
    /** 一次 tick 动作最多推进的 tick 数 */
    public static final int MAX_TICKS_PER_SIGNAL = AUTOPLAY_TICK_CEILING;

    public static final double WIND_FACTOR = 0.001;
    public static final int WIND_RANGE = 100;

    public static final int TRAIL_LIMIT = 40;
    public static final double OUT_OF_BOUNDS_MARGIN = 50;
    /** 碰撞即爆类弹体与虫子的引爆距离 */
    public static final double PROXIMITY_RADIUS = 8;
    /** 零半径武器的最小伤害范围 */
    public static final double MIN_EFFECT_RADIUS = 10;
    public static final double KNOCKBACK_LIFT = 1;
    public static final double BOUNCE_FRICTION = 0.8;
    public static final double SETTLE_SPEED = 0.5;

    public static final double WORM_FRICTION = 0.95;
    public static final double SNAP_SPEED = 0.1;
    /** 坠落时速度超过此值才结算坠落伤害 */
    public static final double FALL_DAMAGE_MIN_SPEED = 3;
    public static final int MAX_CLIMB = 4;
    public static final double JUMP_FORWARD_VX = 3;
    public static final double BACKFLIP_VX = -1.5;
    public static final double BACKFLIP_LIFT = 1.5;

    public static final double MUZZLE_OFFSET = 5;
    public static final int HITSCAN_STEPS = 300;
    public static final double HITSCAN_STEP = 2;
    public static final double HITSCAN_HIT_RADIUS = 10;
    public static final int HITSCAN_CRATER = 5;
    public static final double HITSCAN_KNOCKBACK = 5;

    public static final double MELEE_RANGE = 30;
    public static final double MELEE_KNOCKBACK = 8;
    public static final double BAT_KNOCKBACK = 14;
    public static final double PROD_KNOCKBACK = 2;

    public static final double AIRSTRIKE_SPACING = 20;
    public static final double AIRSTRIKE_DEFAULT_OFFSET = 100;

    public static final int BLOWTORCH_LENGTH = 40;
    public static final int DRILL_DEPTH = 50;
    public static final double NINJA_ROPE_LENGTH = 80;
    public static final int GIRDER_HALF_WIDTH = 20;

    public static final double CLUSTER_SPEED = 4;
    public static final double CLUSTER_LIFT = 3;
    public static final double CLUSTER_JITTER = 0.5;
    public static final double CLUSTER_FUSE = 1.5;
    public static final double CLUSTER_BOUNCINESS = 0.3;
    /** 追踪弹每 tick 向目标修正速度的比例 */
    public static final double HOMING_STEER = 0.1;

    public static final double WATER_MARGIN = 40;
    public static final double CRATE_PICKUP_RADIUS = 15;
    public static final int CRATE_MARGIN = 50;
    public static final int NUKE_INTERVAL_TICKS = 60;

    public static final int MIN_FUSE = 1;
    public static final int MAX_FUSE = 5;

    public static final List<String> CRATE_TYPES = List.of("weapon", "weapon", "health", "utility");
    public static final List<String> CRATE_WEAPONS = List.of(
            "banana-bomb", "holy-hand-grenade", "airstrike", "napalm-strike",
            "cluster-bomb", "dynamite", "homing-missile");
    public static final List<String> CRATE_UTILITIES = List.of("teleport", "ninja-rope", "girder");

    public static final List<String> NPC_WORM_NAMES = List.of(
            "Boggy", "Spadge", "Wormsworth", "Sir Wormsalot", "Captain Kaboom", "Private Partz",
            "Sergeant Squirm", "Baron von Splat", "El Nibblo", "Professor Boom", "Colonel Crawly",
            "The Mole King", "Admiral Oopsie", "General Wiggles", "Duke Splatington");
    public static final List<String> HUMAN_WORM_NAMES = List.of(
            "Ace", "Blaze", "Spike", "Tank", "Flash", "Storm",
            "Rocket", "Nitro", "Turbo", "Fury", "Bolt", "Rex");

    public static final String NPC_PREFIX = "npc_";
}
