package com.arenahub.gameservice.games.artillery.domain.physics;

/**
 * 合并覆盖项之后的物理参数，一局之内不变。
 */
public record PhysicsSettings(
        double gravity,
        double walkSpeed,
        double jumpForce,
        double knockbackForce,
        double safeHeight,
        double fallDamageMultiplier,
        boolean windEnabled,
        boolean fallDamage) {

    public static final double DEFAULT_GRAVITY = 0.15;
    public static final double DEFAULT_WALK_SPEED = 2;
    public static final double DEFAULT_JUMP_FORCE = 4;
    public static final double DEFAULT_KNOCKBACK_FORCE = 0.15;
    public static final double DEFAULT_SAFE_HEIGHT = 25;
    public static final double DEFAULT_FALL_DAMAGE_MULTIPLIER = 0.5;

    public static PhysicsSettings defaults() {
        return new PhysicsSettings(DEFAULT_GRAVITY, DEFAULT_WALK_SPEED, DEFAULT_JUMP_FORCE,
                DEFAULT_KNOCKBACK_FORCE, DEFAULT_SAFE_HEIGHT, DEFAULT_FALL_DAMAGE_MULTIPLIER, true, true);
    }
}
