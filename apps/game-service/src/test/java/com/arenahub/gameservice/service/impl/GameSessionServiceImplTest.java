package com.arenahub.gameservice.service.impl;

import com.arenahub.gameservice.common.SessionNotFoundException;
import com.arenahub.gameservice.domain.dto.SessionSnapshot;
import com.arenahub.gameservice.engine.core.ActionResult;
import com.arenahub.gameservice.engine.core.GameEvent;
import com.arenahub.gameservice.engine.core.GameState;
import com.arenahub.gameservice.engine.state.SumoState;
import com.arenahub.gameservice.infrastructure.memory.InMemorySessionSnapshotRepository;
import com.arenahub.gameservice.interfaces.http.dto.CatalogEntry;
import com.arenahub.gameservice.interfaces.http.dto.SessionView;
import com.arenahub.gameservice.platform.catalog.GameCatalog;
import com.arenahub.gameservice.platform.config.ArenaProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GameSessionServiceImplTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);

    private InMemorySessionSnapshotRepository repo;
    private GameCatalog catalog;
    private ArenaProperties props;
    private GameSessionServiceImpl service;

    @BeforeEach
    void setUp() {
        props = new ArenaProperties();
        catalog = new GameCatalog(Jackson2ObjectMapperBuilder.json().build(), props);
        repo = new InMemorySessionSnapshotRepository(clock);
        service = new GameSessionServiceImpl(catalog, repo, props, clock);
    }

    @Test
    void catalogListsEveryModuleWithPlayerBounds() {
        List<CatalogEntry> entries = service.catalog();

        assertThat(entries).hasSize(5);
        assertThat(entries).filteredOn(e -> e.slug().equals("sumo"))
                .singleElement()
                .satisfies(e -> {
                    assertThat(e.minPlayers()).isEqualTo(1);
                    assertThat(e.maxPlayers()).isEqualTo(2);
                });
    }

    @Test
    void createInitializesAndPersistsWithTheResolvedSeed() {
        SessionView view = service.create("sumo", List.of("p1", "p2"), Map.of("ringSize", 4));

        assertThat(view.events()).extracting(GameEvent::type).containsExactly("game_started");
        assertThat(view.state().turn()).isZero();
        SessionSnapshot snap = repo.find(view.sessionId()).orElseThrow();
        assertThat(snap.config()).containsEntry("ringSize", 4).containsKey(GameCatalog.SEED_KEY);
        assertThat(snap.updatedAt()).isEqualTo(clock.millis());
    }

    @Test
    void onlySuccessfulActionsAreWrittenBack() {
        String id = service.create("sumo", List.of("p1", "p2"), Map.of("seed", 3)).sessionId();

        ActionResult bad = service.act(id, "p1", "throw", Map.of());
        assertThat(bad.success()).isFalse();
        assertThat(repo.find(id).orElseThrow().state().turn()).isZero();

        ActionResult ok = service.act(id, "p1", "push", Map.of());
        assertThat(ok.success()).isTrue();
        assertThat(repo.find(id).orElseThrow().state().turn()).isEqualTo(1);
    }

    @Test
    void sessionEvictedFromMemoryIsRestoredFromItsSnapshot() {
        String id = service.create("sumo", List.of("p1", "p2"), Map.of("seed", 3)).sessionId();
        service.act(id, "p1", "push", Map.of());
        GameState before = service.get(id).state();

        GameSessionServiceImpl fresh = new GameSessionServiceImpl(catalog, repo, props, clock);
        assertThat(fresh.get(id).state()).isEqualTo(before);

        ActionResult r = fresh.act(id, "p2", "push", Map.of());
        assertThat(r.success()).isTrue();
        assertThat(((SumoState) r.newState().data()).getTurnCount()).isEqualTo(2);
        assertThat(r.events()).extracting(GameEvent::type).doesNotContain("game_started");
    }

    @Test
    void viewIsLimitedToSeatedPlayers() {
        String id = service.create("artillery", List.of("p1", "p2"),
                Map.of("npcFill", false, "maxPlayers", 2, "wormsPerPlayer", 1, "seed", 5)).sessionId();

        assertThat(service.view(id, "p1").data()).isNotNull();
        assertThatThrownBy(() -> service.view(id, "mallory")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void deleteRemovesBothCopies() {
        String id = service.create("dungeon", List.of("p1"), Map.of()).sessionId();

        service.delete(id);

        assertThat(repo.find(id)).isEmpty();
        assertThatThrownBy(() -> service.get(id)).isInstanceOf(SessionNotFoundException.class);
        assertThatThrownBy(() -> service.delete(id)).isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    void unknownGameAndBadPlayerCountsAreIllegalArguments() {
        assertThatThrownBy(() -> service.create("chess", List.of("p1"), null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.create("sumo", List.of("a", "b", "c"), null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void expiredSnapshotIsGone() {
        props.getSession().setTtl(Duration.ofMillis(-1));
        String id = service.create("sumo", List.of("p1", "p2"), null).sessionId();

        assertThat(repo.find(id)).isEmpty();
    }

    @Test
    void sessionInMemoryIsNotServedAfterItsTtl() {
        MutableClock ticking = new MutableClock(clock.instant());
        InMemorySessionSnapshotRepository store = new InMemorySessionSnapshotRepository(ticking);
        GameSessionServiceImpl svc = new GameSessionServiceImpl(catalog, store, props, ticking);
        props.getSession().setTtl(Duration.ofMinutes(10));
        String id = svc.create("sumo", List.of("p1", "p2"), Map.of("seed", 3)).sessionId();

        ticking.advance(Duration.ofMinutes(5));
        assertThat(svc.act(id, "p1", "push", Map.of()).success()).isTrue();

        // 成功动作会顺延过期时间
        ticking.advance(Duration.ofMinutes(9));
        assertThat(svc.get(id).sessionId()).isEqualTo(id);

        ticking.advance(Duration.ofMinutes(2));
        assertThatThrownBy(() -> svc.get(id)).isInstanceOf(SessionNotFoundException.class);
        assertThatThrownBy(() -> svc.act(id, "p2", "push", Map.of())).isInstanceOf(SessionNotFoundException.class);
        assertThat(svc.cachedSessionCount()).isZero();
    }

    @Test
    void creatingASessionSweepsExpiredOnes() {
        MutableClock ticking = new MutableClock(clock.instant());
        InMemorySessionSnapshotRepository store = new InMemorySessionSnapshotRepository(ticking);
        GameSessionServiceImpl svc = new GameSessionServiceImpl(catalog, store, props, ticking);
        props.getSession().setTtl(Duration.ofMinutes(1));
        svc.create("dungeon", List.of("p1"), Map.of());
        svc.create("dungeon", List.of("p1"), Map.of());
        assertThat(svc.cachedSessionCount()).isEqualTo(2);

        ticking.advance(Duration.ofMinutes(2));
        svc.create("sumo", List.of("p1", "p2"), null);

        assertThat(svc.cachedSessionCount()).isEqualTo(1);
    }

    /** 可手动拨动的时钟 */
    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
