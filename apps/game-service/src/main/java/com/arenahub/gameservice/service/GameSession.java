package com.arenahub.gameservice.service;

import com.arenahub.gameservice.engine.core.UnifiedGame;
import lombok.Getter;
import lombok.Setter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 一个托管中的对局。对 game 的任何读写都必须持有 lock。
 */
@Getter
public class GameSession {

    private final String id;
    private final String slug;
    /** 已合并、已补种子的配置，恢复时原样使用 */
    private final Map<String, Object> config;
    private final UnifiedGame game;
    private final ReentrantLock lock = new ReentrantLock();
    /** 与快照同步的过期时刻（毫秒），每次写快照时顺延 */
    @Setter
    private volatile long expiresAt;

    public GameSession(String id, String slug, Map<String, Object> config, UnifiedGame game) {
        this.id = id;
        this.slug = slug;
        this.config = Collections.unmodifiableMap(new LinkedHashMap<>(config));
        this.game = game;
    }

    public boolean isExpired(long now) {
        return expiresAt <= now;
    }
}
