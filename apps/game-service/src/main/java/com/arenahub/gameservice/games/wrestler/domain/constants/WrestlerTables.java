package com.arenahub.gameservice.games.wrestler.domain.constants;

import java.util.List;
import java.util.Map;

/**
 * 摔角默认数值表（只读）。
 */
public final class WrestlerTables {

    private WrestlerTables() {
    }

    public static final Map<String, Integer> STRIKE_DAMAGE = Map.of(
            "punch", 5,
            "kick", 7,
            "chop", 6);

    public static final List<String> STRIKE_TYPES = List.of("punch", "kick", "chop");

    public static final Map<String, Integer> STAMINA_COSTS = Map.ofEntries(
            Map.entry("strike", 5),
            Map.entry("grapple", 15),
            Map.entry("irish_whip", 10),
            Map.entry("finisher", 25),
            Map.entry("climb_turnbuckle", 10),
            Map.entry("pin", 5),
            Map.entry("tag_partner", 0),
            Map.entry("rope_break", 0),
            Map.entry("kick_out", 10),
            Map.entry("taunt", 5),
            Map.entry("rest", 0));

    public static final Map<String, Integer> MOMENTUM_GAINS = Map.of(
            "strike", 5,
            "grapple", 10,
            "climb_turnbuckle", 15,
            "finisher", 20,
            "taunt", 5);

    /** 抱摔被反制时发起方承受的伤害 */
    public static final int REVERSAL_DAMAGE = 5;
    /** 笼斗爬笼逃脱所需气势 */
    public static final int CAGE_ESCAPE_MOMENTUM = 90;
    /** 休息额外回复的体力 */
    public static final int REST_RECOVERY = 15;
    public static final int MAX_METER = 100;
    /** 压制时防守方生命高于此比例才能踢出 */
    public static final double KICK_OUT_HP_RATIO = 0.2;
}
