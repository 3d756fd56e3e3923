package com.arenahub.gameservice.games.sumo.domain.constants;

import java.util.Map;
import java.util.Set;

/**
 * 相扑数值表。
 */
public final class SumoTables {

    private SumoTables() {
    }

    public static final int MAX_BALANCE = 150;
    public static final int MAX_STAMINA = 120;
    public static final int STAMINA_REGEN = 12;
    public static final int BALANCE_REGEN = 8;
    /** 平衡低于此值时被推得更远 */
    public static final int VULNERABLE_BALANCE = 30;

    public static final Map<String, Integer> STAMINA_COSTS = Map.of(
            "push", 5, "pull", 5, "grip", 5, "throw", 5,
            "sidestep", 5, "slap", 3, "charge", 5);

    /** 体力耗尽时仍可使用的动作 */
    public static final Set<String> EXHAUSTED_ACTIONS = Set.of("slap", "push");

    public static final Set<String> GRIP_TYPES = Set.of("mawashi", "arm");

    public static final int RING_OUT_BASE_SCORE = 500;
    public static final int RING_OUT_MIN_SCORE = 100;
    public static final int SCORE_PER_TURN = 10;
}
