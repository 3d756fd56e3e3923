package com.arenahub.gameservice.games.artillery;

import com.arenahub.gameservice.games.artillery.domain.physics.PhysicsSettings;
import com.arenahub.gameservice.games.artillery.domain.weapon.WeaponOverride;
import com.arenahub.gameservice.games.artillery.domain.weapon.WeaponRegistry;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 炮击对战配置。physics 与 weapons 只保存覆盖项，
 * 分别经 {@link #physicsSettings()} 与 {@link #weaponRegistry()} 在读取时与默认值合并。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ArtilleryConfig {

    /** ffa | teams */
    private String mode = "ffa";
    private int teamCount = 2;
    private int wormsPerPlayer = 4;
    private int wormHp = 100;
    private int mapWidth = 1600;
    private int mapHeight = 800;
    /** 人数不足 maxPlayers 时用 NPC 补位 */
    private boolean npcFill = true;
    private int maxPlayers = 4;
    /** 秒 */
    private int turnTime = 45;
    private int retreatTime = 3;
    private int roundTime = 600;
    /** 每回合掉落补给箱的概率，单位 1/10 */
    private int crateFrequency = 5;
    private int healthCrateAmount = 25;
    /** water-rise | one-hp | nuke */
    private String suddenDeathType = "water-rise";
    /** slow | medium | fast */
    private String waterRiseSpeed = "medium";
    private boolean fallDamage = true;
    private boolean windEnabled = true;
    /** 自定义虫子名字，为空时用内置名单 */
    private List<String> wormNames;
    private Physics physics = new Physics();
    private Map<String, WeaponOverride> weapons = new HashMap<>();
    private Long seed;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Physics {
        private Double gravity;
        private Double walkSpeed;
        private Double jumpForce;
        private Double knockbackForce;
        private Double safeHeight;
        private Double fallDamageMultiplier;
    }

    public PhysicsSettings physicsSettings() {
        Physics p = physics == null ? new Physics() : physics;
        return new PhysicsSettings(
                or(p.getGravity(), PhysicsSettings.DEFAULT_GRAVITY),
                or(p.getWalkSpeed(), PhysicsSettings.DEFAULT_WALK_SPEED),
                or(p.getJumpForce(), PhysicsSettings.DEFAULT_JUMP_FORCE),
                or(p.getKnockbackForce(), PhysicsSettings.DEFAULT_KNOCKBACK_FORCE),
                or(p.getSafeHeight(), PhysicsSettings.DEFAULT_SAFE_HEIGHT),
                or(p.getFallDamageMultiplier(), PhysicsSettings.DEFAULT_FALL_DAMAGE_MULTIPLIER),
                windEnabled,
                fallDamage);
    }

    public WeaponRegistry weaponRegistry() {
        return new WeaponRegistry(weapons);
    }

    /** 有效的最大参战方数，夹在 2..4 */
    public int effectiveMaxPlayers() {
        return Math.max(2, Math.min(4, maxPlayers));
    }

    public int effectiveWormsPerPlayer() {
        return Math.max(1, Math.min(6, wormsPerPlayer));
    }

    public int effectiveWormHp() {
        return Math.max(1, Math.min(255, wormHp));
    }

    /** 每 tick 水位上涨像素 */
    public double waterRisePerTick() {
        if ("fast".equals(waterRiseSpeed)) return 0.15;
        if ("slow".equals(waterRiseSpeed)) return 0.03;
        return 0.07;
    }

    private static double or(Double v, double fallback) {
        return v == null ? fallback : v;
    }
}
