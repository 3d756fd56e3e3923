package com.arenahub.gameservice.engine.core;

import com.arenahub.gameservice.games.sumo.SumoConfig;
import com.arenahub.gameservice.games.sumo.SumoGame;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 内核生命周期与校验顺序，借用最简单的相扑模块来驱动。
 */
class BaseGameTest {

    private static SumoGame sumo(long seed, int ringSize) {
        SumoConfig c = new SumoConfig();
        c.setSeed(seed);
        c.setRingSize(ringSize);
        return new SumoGame(c);
    }

    @Test
    void initializeRejectsPlayerCountOutsideBounds() {
        SumoGame game = sumo(1, 10);
        assertThatThrownBy(() -> game.initialize(List.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> game.initialize(List.of("a", "b", "c"))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void initializeRejectsDuplicateIds() {
        assertThatThrownBy(() -> sumo(1, 10).initialize(List.of("a", "a")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void initializeEmitsGameStartedAndStartsAtTurnZero() {
        SumoGame game = sumo(1, 10);
        game.initialize(List.of("p1", "p2"));

        assertThat(game.getState().turn()).isZero();
        assertThat(game.getState().phase()).isEqualTo("tachiai");
        assertThat(game.drainPendingEvents()).extracting(GameEvent::type).containsExactly("game_started");
        assertThat(game.drainPendingEvents()).isEmpty();
    }

    @Test
    void actionBeforeInitializeFails() {
        ActionResult r = sumo(1, 10).handleAction("p1", GameAction.of("push"));
        assertThat(r.success()).isFalse();
        assertThat(r.error()).isEqualTo(KernelMessages.NOT_INITIALIZED);
    }

    @Test
    void structuralFailuresComeBeforeModuleRules() {
        SumoGame game = sumo(1, 10);
        game.initialize(List.of("p1", "p2"));

        assertThat(game.handleAction("ghost", GameAction.of("push")).error())
                .isEqualTo(KernelMessages.formatUnknownPlayer("ghost"));
        assertThat(game.handleAction("p1", null).error()).isEqualTo(KernelMessages.MISSING_ACTION_TYPE);
        assertThat(game.handleAction("p1", GameAction.of(" ")).error()).isEqualTo(KernelMessages.MISSING_ACTION_TYPE);
        assertThat(game.handleAction("p1", GameAction.of("dance")).error())
                .isEqualTo(KernelMessages.formatUnknownAction("dance"));
    }

    @Test
    void failedActionLeavesStateUntouched() {
        SumoGame game = sumo(5, 10);
        game.initialize(List.of("p1", "p2"));
        game.handleAction("p1", GameAction.of("push"));
        GameState before = game.getState();

        ActionResult r = game.handleAction("p1", GameAction.of("grip", Map.of("type", "nose")));

        assertThat(r.success()).isFalse();
        assertThat(r.newState()).isNull();
        assertThat(game.getState()).isEqualTo(before);
    }

    @Test
    void acceptedActionIncrementsTurnOnce() {
        SumoGame game = sumo(5, 10);
        game.initialize(List.of("p1", "p2"));
        ActionResult r = game.handleAction("p1", GameAction.of("push"));

        assertThat(r.success()).isTrue();
        assertThat(r.newState().turn()).isEqualTo(1);
        assertThat(r.events()).extracting(GameEvent::type).contains("push");
    }

    @Test
    void getStateReturnsDeepCopy() {
        SumoGame game = sumo(5, 10);
        game.initialize(List.of("p1", "p2"));
        GameState copy = game.getState();
        ((com.arenahub.gameservice.engine.state.SumoState) copy.data()).setRingSize(1);

        assertThat(((com.arenahub.gameservice.engine.state.SumoState) game.getState().data()).getRingSize())
                .isEqualTo(10);
    }

    @Test
    void terminalStateIsFrozenAndIdempotent() {
        SumoGame game = sumo(5, 3);
        game.initialize(List.of("p1", "p2"));
        game.handleAction("p1", GameAction.of("push"));
        ActionResult last = game.handleAction("p1", GameAction.of("push"));
        assertThat(last.events()).extracting(GameEvent::type).contains("ring_out", "game_ended");
        assertThat(game.isGameOver()).isTrue();

        GameState frozen = game.getState();
        Map<String, Integer> scores = game.getScores();
        ActionResult again1 = game.handleAction("p2", GameAction.of("push"));
        ActionResult again2 = game.handleAction("p1", GameAction.of("slap"));

        assertThat(again1.error()).isEqualTo(KernelMessages.GAME_OVER);
        assertThat(again2.error()).isEqualTo(KernelMessages.GAME_OVER);
        assertThat(game.getState()).isEqualTo(frozen);
        assertThat(game.getState().phase()).isEqualTo(BaseGame.PHASE_ENDED);
        assertThat(game.getScores()).isEqualTo(scores);
    }

    @Test
    void identicalSeedAndActionsGiveIdenticalState() {
        SumoGame a = sumo(99, 12);
        SumoGame b = sumo(99, 12);
        a.initialize(List.of("p1"));
        b.initialize(List.of("p1"));
        List<GameAction> script = List.of(
                GameAction.of("charge"), GameAction.of("grip", Map.of("type", "mawashi")),
                GameAction.of("throw"), GameAction.of("push"), GameAction.of("sidestep"));
        for (GameAction action : script) {
            ActionResult ra = a.handleAction("p1", action);
            ActionResult rb = b.handleAction("p1", action);
            assertThat(ra.success()).isEqualTo(rb.success());
        }
        assertThat(a.getState()).isEqualTo(b.getState());
    }

    @Test
    void restoreStateDoesNotReinitialize() {
        SumoGame game = sumo(5, 10);
        game.initialize(List.of("p1", "p2"));
        game.handleAction("p1", GameAction.of("push"));
        GameState saved = game.getState();

        SumoGame restored = sumo(5, 10);
        restored.restoreState(List.of("p1", "p2"), saved);

        assertThat(restored.getState()).isEqualTo(saved);
        assertThat(restored.drainPendingEvents()).isEmpty();
    }

    @Test
    void restoreStateRejectsForeignData() {
        GameState foreign = new GameState(0, "playing", new com.arenahub.gameservice.engine.state.DungeonState());
        assertThatThrownBy(() -> sumo(1, 10).restoreState(List.of("p1", "p2"), foreign))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
