package com.arenahub.gameservice.domain.repository;

import com.arenahub.gameservice.domain.dto.SessionSnapshot;

import java.time.Duration;
import java.util.Optional;

/**
 * SessionSnapshotRepository
 * ----------------------------------------
 * 会话快照仓储：
 * - 每次创建会话、每次动作被接受后整体覆盖写入；
 * - 内存中找不到会话时从这里恢复；
 * - 默认内存实现，arena.session.store=redis 时切换为 Redis。
 * ----------------------------------------
 */
public interface SessionSnapshotRepository {

    /**
     * 保存快照（覆盖写入）
     * @param snapshot 会话快照
     * @param ttl      过期时间
     */
    void save(SessionSnapshot snapshot, Duration ttl);

    Optional<SessionSnapshot> find(String sessionId);

    void delete(String sessionId);
}
