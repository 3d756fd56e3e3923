package com.arenahub.gameservice.infrastructure.redis;

import com.arenahub.gameservice.domain.dto.SessionSnapshot;
import com.arenahub.gameservice.domain.repository.SessionSnapshotRepository;
import com.arenahub.gameservice.infrastructure.codec.GameSnapshotCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.Optional;

/**
 * RedisSessionSnapshotRepository
 * -------------------------------------------------------
 * 会话快照的 Redis 仓储实现（arena.session.store=redis）。
 * - 值为 JSON 文本，每次写入刷新 TTL；
 * - 多节点部署时，任意节点都能据此恢复会话。
 */
@Slf4j
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "arena.session", name = "store", havingValue = "redis")
public class RedisSessionSnapshotRepository implements SessionSnapshotRepository {

    private final RedisOps ops;
    private final GameSnapshotCodec codec;

    @Override
    public void save(SessionSnapshot snapshot, Duration ttl) {
        ops.setString(RedisKeys.sessionSnapshot(snapshot.sessionId()), codec.encode(snapshot), ttl);
    }

    @Override
    public Optional<SessionSnapshot> find(String sessionId) {
        String json = ops.getString(RedisKeys.sessionSnapshot(sessionId));
        if (json == null) {
            return Optional.empty();
        }
        return Optional.of(codec.decode(json));
    }

    @Override
    public void delete(String sessionId) {
        if (!ops.del(RedisKeys.sessionSnapshot(sessionId))) {
            log.debug("[session] Redis 中不存在快照 sessionId={}", sessionId);
        }
    }
}
