package com.arenahub.gameservice.games.wrestler;

import com.arenahub.gameservice.games.wrestler.domain.constants.WrestlerTables;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * 摔角配置。三张数值表（打击伤害、体力消耗、气势增长）只保存覆盖项，
 * 读取时与 {@link WrestlerTables} 的默认值合并，默认表本身永远不被写入。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class WrestlerConfig {

    /** singles | tag | royal-rumble | cage */
    private String matchType = "singles";
    private int finisherThreshold = 80;
    private int ropeBreaks = 3;
    private int wrestlerHp = 100;
    private int wrestlerStamina = 100;
    private int grapplingDamage = 12;
    private int aerialDamage = 15;
    private int finisherDamage = 30;
    private int staminaRegen = 5;
    private int tagPartnerHealRate = 3;
    private Map<String, Integer> strikeDamage = new HashMap<>();
    private Map<String, Integer> staminaDrain = new HashMap<>();
    private Map<String, Integer> momentumGains = new HashMap<>();
    private Long seed;

    public int strikeDamageOf(String type) {
        return merged(strikeDamage, WrestlerTables.STRIKE_DAMAGE, type, 5);
    }

    public int staminaCostOf(String action) {
        return merged(staminaDrain, WrestlerTables.STAMINA_COSTS, action, 0);
    }

    public int momentumGainOf(String action) {
        return merged(momentumGains, WrestlerTables.MOMENTUM_GAINS, action, 0);
    }

    private static int merged(Map<String, Integer> overrides, Map<String, Integer> defaults, String key, int fallback) {
        if (overrides != null && overrides.containsKey(key)) {
            return overrides.get(key);
        }
        return defaults.getOrDefault(key, fallback);
    }
}
