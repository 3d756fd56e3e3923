package com.arenahub.gameservice.infrastructure.memory;

import com.arenahub.gameservice.domain.dto.SessionSnapshot;
import com.arenahub.gameservice.domain.repository.SessionSnapshotRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 单节点内存快照仓储（默认）。过期在读取时惰性判定。
 */
@Repository
@ConditionalOnProperty(prefix = "arena.session", name = "store", havingValue = "memory", matchIfMissing = true)
public class InMemorySessionSnapshotRepository implements SessionSnapshotRepository {

    private record Entry(SessionSnapshot snapshot, long expiresAt) {
    }

    private final Map<String, Entry> store = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySessionSnapshotRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void save(SessionSnapshot snapshot, Duration ttl) {
        store.put(snapshot.sessionId(), new Entry(snapshot, clock.millis() + ttl.toMillis()));
    }

    @Override
    public Optional<SessionSnapshot> find(String sessionId) {
        Entry e = store.get(sessionId);
        if (e == null) {
            return Optional.empty();
        }
        if (e.expiresAt() <= clock.millis()) {
            store.remove(sessionId, e);
            return Optional.empty();
        }
        return Optional.of(e.snapshot());
    }

    @Override
    public void delete(String sessionId) {
        store.remove(sessionId);
    }
}
