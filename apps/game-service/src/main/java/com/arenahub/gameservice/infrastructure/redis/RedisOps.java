package com.arenahub.gameservice.infrastructure.redis;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 公用 Redis 工具类：
 * - 只提供“原语级”方法，业务键名放在 RedisKeys / Repo 层组织；
 * - 快照以 JSON 文本存取，序列化交给 GameSnapshotCodec，这里不关心值的结构。
 */
@Component
@RequiredArgsConstructor
public class RedisOps {

    private final StringRedisTemplate strRedis;

    /**
     * 写入字符串键值（带 TTL）
     */
    public void setString(String key, String val, Duration ttl) {
        strRedis.opsForValue().set(key, val, ttl);
    }

    /**
     * 获取字符串值，不存在时为 null
     */
    public String getString(String key) {
        return strRedis.opsForValue().get(key);
    }

    /**
     * 删除 Key
     * @return 是否确实删除了
     */
    public boolean del(String key) {
        return Boolean.TRUE.equals(strRedis.delete(key));
    }
}
