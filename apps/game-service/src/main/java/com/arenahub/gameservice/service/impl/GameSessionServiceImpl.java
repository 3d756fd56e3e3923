package com.arenahub.gameservice.service.impl;

import com.arenahub.gameservice.common.SessionNotFoundException;
import com.arenahub.gameservice.domain.dto.SessionSnapshot;
import com.arenahub.gameservice.domain.repository.SessionSnapshotRepository;
import com.arenahub.gameservice.engine.core.ActionResult;
import com.arenahub.gameservice.engine.core.GameAction;
import com.arenahub.gameservice.engine.core.GameEvent;
import com.arenahub.gameservice.engine.core.GameState;
import com.arenahub.gameservice.engine.core.UnifiedGame;
import com.arenahub.gameservice.interfaces.http.dto.CatalogEntry;
import com.arenahub.gameservice.interfaces.http.dto.SessionView;
import com.arenahub.gameservice.platform.catalog.GameCatalog;
import com.arenahub.gameservice.platform.catalog.GameDescriptor;
import com.arenahub.gameservice.platform.config.ArenaProperties;
import com.arenahub.gameservice.service.GameSession;
import com.arenahub.gameservice.service.GameSessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 会话托管：
 * - 内存会话表 + 每会话一把 ReentrantLock，同一会话的所有访问串行；
 * - 每次创建与每次成功动作后写快照；内存里没有的会话从快照仓储恢复（restoreState，不重放初始化）。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GameSessionServiceImpl implements GameSessionService {

    // ====== 内存会话表 ======
    private final Map<String, GameSession> sessions = new ConcurrentHashMap<>();

    private final GameCatalog catalog;
    private final SessionSnapshotRepository snapshots;
    private final ArenaProperties props;
    private final Clock clock;

    @Override
    public List<CatalogEntry> catalog() {
        List<CatalogEntry> out = new ArrayList<>();
        for (GameDescriptor<?> d : catalog.all()) {
            UnifiedGame probe = catalog.create(d.slug(), catalog.resolveConfig(d.slug(), null));
            out.add(new CatalogEntry(d.slug(), d.title(), probe.mode(), probe.minPlayers(), probe.maxPlayers()));
        }
        return out;
    }

    @Override
    public SessionView create(String game, List<String> playerIds, Map<String, Object> config) {
        evictExpired();
        // 1) 合并配置、构造并初始化（人数等问题在这里以 IllegalArgumentException 抛出）
        Map<String, Object> resolved = catalog.resolveConfig(game, config);
        UnifiedGame instance = catalog.create(game, resolved);
        instance.initialize(playerIds);
        List<GameEvent> initEvents = instance.drainPendingEvents();

        // 2) 登记并写首个快照
        String sessionId = UUID.randomUUID().toString();
        GameSession session = new GameSession(sessionId, game, resolved, instance);
        sessions.put(sessionId, session);
        persist(session);
        log.info("[session] 创建会话 id={} game={} players={} seed={}",
                sessionId, game, playerIds, resolved.get(GameCatalog.SEED_KEY));
        return toView(session, initEvents);
    }

    @Override
    public SessionView get(String sessionId) {
        GameSession s = require(sessionId);
        return locked(s, () -> toView(s, null));
    }

    @Override
    public GameState view(String sessionId, String playerId) {
        GameSession s = require(sessionId);
        return locked(s, () -> {
            if (playerId == null || !s.getGame().getPlayerIds().contains(playerId)) {
                throw new IllegalArgumentException("玩家不在该会话中: " + playerId);
            }
            return s.getGame().getStateForPlayer(playerId);
        });
    }

    @Override
    public ActionResult act(String sessionId, String playerId, String type, Map<String, Object> payload) {
        GameSession s = require(sessionId);
        return locked(s, () -> {
            GameAction action = new GameAction(type, payload, clock.millis());
            ActionResult result = s.getGame().handleAction(playerId, action);
            if (!result.success()) {
                log.debug("[session] 动作失败 id={} player={} type={} error={}", sessionId, playerId, type, result.error());
                return result;
            }
            persist(s);
            if (s.getGame().isGameOver()) {
                log.info("[session] 对局结束 id={} winner={} scores={}",
                        sessionId, s.getGame().getWinner(), s.getGame().getScores());
            }
            return result;
        });
    }

    @Override
    public void delete(String sessionId) {
        GameSession removed = sessions.remove(sessionId);
        boolean stored = snapshots.find(sessionId).isPresent();
        boolean live = removed != null && !removed.isExpired(clock.millis());
        if (!live && !stored) {
            throw new SessionNotFoundException(sessionId);
        }
        snapshots.delete(sessionId);
        log.info("[session] 删除会话 id={}", sessionId);
    }

    // ====== 内部 ======

    /**
     * 取会话：先查内存，再从快照恢复。并发恢复同一会话时以先放入者为准。
     * 内存里的会话过了 TTL 视同不存在，顺手移出会话表。
     */
    private GameSession require(String sessionId) {
        GameSession s = sessions.get(sessionId);
        if (s != null) {
            if (!s.isExpired(clock.millis())) {
                return s;
            }
            sessions.remove(sessionId, s);
            snapshots.delete(sessionId);
            log.info("[session] 会话已过期 id={}", sessionId);
            throw new SessionNotFoundException(sessionId);
        }
        SessionSnapshot snap = snapshots.find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
        UnifiedGame game = catalog.create(snap.game(), snap.config());
        try {
            game.restoreState(snap.playerIds(), snap.state());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("快照无法恢复: " + sessionId + "，" + e.getMessage(), e);
        }
        GameSession restored = new GameSession(sessionId, snap.game(), snap.config(), game);
        restored.setExpiresAt(snap.updatedAt() + props.getSession().getTtl().toMillis());
        GameSession prev = sessions.putIfAbsent(sessionId, restored);
        if (prev == null) {
            log.info("[session] 从快照恢复会话 id={} game={} turn={}", sessionId, snap.game(), snap.state().turn());
            return restored;
        }
        return prev;
    }

    private void persist(GameSession s) {
        UnifiedGame g = s.getGame();
        SessionSnapshot snap = new SessionSnapshot(
                s.getId(), s.getSlug(), g.getPlayerIds(), s.getConfig(), g.getState(), clock.millis());
        snapshots.save(snap, props.getSession().getTtl());
        s.setExpiresAt(snap.updatedAt() + props.getSession().getTtl().toMillis());
    }

    /** 清理过期会话（含已结束的对局），避免会话表无限增长 */
    private void evictExpired() {
        long now = clock.millis();
        int before = sessions.size();
        sessions.values().removeIf(s -> s.isExpired(now));
        int evicted = before - sessions.size();
        if (evicted > 0) {
            log.info("[session] 清理过期会话 {} 个", evicted);
        }
    }

    /** 当前驻留内存的会话数 */
    int cachedSessionCount() {
        return sessions.size();
    }

    private static SessionView toView(GameSession s, List<GameEvent> events) {
        UnifiedGame g = s.getGame();
        return new SessionView(s.getId(), s.getSlug(), g.getPlayerIds(), g.getState(),
                g.isGameOver(), g.getWinner(), g.getScores(), events);
    }

    private static <T> T locked(GameSession s, Supplier<T> body) {
        s.getLock().lock();
        try {
            return body.get();
        } finally {
            s.getLock().unlock();
        }
    }
}
