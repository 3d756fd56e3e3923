package com.arenahub.gameservice.infrastructure.redis;

/**
 * 统一集中管理 Redis Key 的前缀与拼接，避免字符串散落。
 */
public final class RedisKeys {

    private static final String PFX = "arena:";

    private RedisKeys() {}

    // ---- 会话快照 ----
    public static String sessionSnapshot(String sessionId) {
        return PFX + "session:" + sessionId + ":snapshot";
    }
}
