package com.arenahub.gameservice.platform.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * arena.* 配置：
 * <pre>
 * arena:
 *   session:
 *     store: memory | redis
 *     ttl: 48h
 *   games:
 *     defaults:
 *       artillery: { turnTime: 30 }
 * </pre>
 * games.defaults 下每个模块一份默认配置，创建会话时垫在请求配置之下。
 */
@Data
@ConfigurationProperties(prefix = "arena")
public class ArenaProperties {

    private Session session = new Session();
    private Games games = new Games();

    @Data
    public static class Session {
        /** 快照仓储：memory（默认）或 redis */
        private String store = "memory";
        /** 快照存活时间，每次写入刷新 */
        private Duration ttl = Duration.ofHours(48);
    }

    @Data
    public static class Games {
        private Map<String, Map<String, Object>> defaults = new LinkedHashMap<>();
    }

    public Map<String, Object> defaultsOf(String slug) {
        Map<String, Object> d = games.getDefaults().get(slug);
        return d == null ? Map.of() : d;
    }
}
