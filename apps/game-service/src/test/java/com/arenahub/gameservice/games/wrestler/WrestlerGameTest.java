package com.arenahub.gameservice.games.wrestler;

import com.arenahub.gameservice.engine.core.ActionResult;
import com.arenahub.gameservice.engine.core.GameAction;
import com.arenahub.gameservice.engine.core.GameEvent;
import com.arenahub.gameservice.engine.core.GameState;
import com.arenahub.gameservice.engine.state.WrestlerState;
import com.arenahub.gameservice.games.wrestler.domain.constants.WrestlerMessages;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;

class WrestlerGameTest {

    private static WrestlerGame newGame(String matchType, String... players) {
        WrestlerConfig c = new WrestlerConfig();
        c.setMatchType(matchType);
        c.setSeed(3L);
        WrestlerGame g = new WrestlerGame(c);
        g.initialize(List.of(players));
        return g;
    }

    private static void tweak(WrestlerGame g, List<String> players, Consumer<WrestlerState> change) {
        GameState st = g.getState();
        WrestlerState s = (WrestlerState) st.data();
        change.accept(s);
        g.restoreState(players, new GameState(st.turn(), st.phase(), s));
    }

    @Test
    void failedKickOutEndsTheMatch() {
        WrestlerGame g = newGame("singles", "p1", "p2");
        tweak(g, List.of("p1", "p2"), s -> {
            s.getWrestlers().get("p1").setMomentum(80);
            s.getWrestlers().get("p2").setHp(45);
        });

        ActionResult fin = g.handleAction("p1", GameAction.of("finisher"));
        assertThat(fin.success()).isTrue();
        assertThat(fin.events()).extracting(GameEvent::type).contains("finisher", "pin_after_finisher");
        assertThat(g.getState().phase()).isEqualTo("pin");

        ActionResult meanwhile = g.handleAction("p1", GameAction.of("strike"));
        assertThat(meanwhile.error()).isEqualTo(WrestlerMessages.PIN_IN_PROGRESS);
        ActionResult wrongDefence = g.handleAction("p2", GameAction.of("strike"));
        assertThat(wrongDefence.error()).isEqualTo(WrestlerMessages.PIN_DEFENDER_ONLY);

        ActionResult kick = g.handleAction("p2", GameAction.of("kick_out"));
        assertThat(kick.success()).isTrue();
        assertThat(kick.events()).extracting(GameEvent::type).contains("pinned", "game_ended");
        assertThat(g.isGameOver()).isTrue();
        assertThat(g.getWinner()).isEqualTo("p1");
    }

    @Test
    void healthyDefenderKicksOut() {
        WrestlerGame g = newGame("singles", "p1", "p2");
        tweak(g, List.of("p1", "p2"), s -> s.getWrestlers().get("p1").setMomentum(100));

        g.handleAction("p1", GameAction.of("finisher"));
        ActionResult kick = g.handleAction("p2", GameAction.of("kick_out"));

        assertThat(kick.events()).anySatisfy(e -> {
            assertThat(e.type()).isEqualTo("kick_out");
            assertThat(e.data()).containsEntry("success", true);
        });
        assertThat(g.isGameOver()).isFalse();
        WrestlerState s = (WrestlerState) g.getState().data();
        assertThat(s.isPinAttemptActive()).isFalse();
        assertThat(s.getWrestlers().get("p2").getHp()).isEqualTo(70);
    }

    @Test
    void finisherNeedsMomentum() {
        WrestlerGame g = newGame("singles", "p1", "p2");
        ActionResult r = g.handleAction("p1", GameAction.of("finisher"));

        assertThat(r.success()).isFalse();
        assertThat(r.error()).isEqualTo(String.format(WrestlerMessages.FINISHER_MOMENTUM, 80, 0));
    }

    @Test
    void soloMatchAddsACpuOpponentThatAnswers() {
        WrestlerGame g = newGame("singles", "p1");
        WrestlerState s = (WrestlerState) g.getState().data();
        assertThat(s.getWrestlers()).containsKeys("p1", WrestlerGame.CPU_ID);

        ActionResult r = g.handleAction("p1", GameAction.of("strike", Map.of("type", "kick")));

        assertThat(r.success()).isTrue();
        assertThat(r.events()).extracting(GameEvent::playerId).contains("p1", WrestlerGame.CPU_ID);
    }

    @Test
    void unknownStrikeTypeIsRejected() {
        WrestlerGame g = newGame("singles", "p1", "p2");
        ActionResult r = g.handleAction("p1", GameAction.of("strike", Map.of("type", "headbutt")));
        assertThat(r.error()).isEqualTo(WrestlerMessages.INVALID_STRIKE);
    }

    @Test
    void tagMatchBenchesTheSecondHalf() {
        WrestlerGame g = newGame("tag", "p1", "p2", "p3", "p4");
        WrestlerState s = (WrestlerState) g.getState().data();
        assertThat(s.getTurnOrder()).containsExactly("p1", "p3");

        assertThat(g.handleAction("p2", GameAction.of("strike")).error()).isEqualTo(WrestlerMessages.NOT_ACTIVE);
        ActionResult tag = g.handleAction("p1", GameAction.of("tag_partner"));
        assertThat(tag.success()).isTrue();
        s = (WrestlerState) g.getState().data();
        assertThat(s.getWrestlers().get("p2").isActive()).isTrue();
        assertThat(s.getWrestlers().get("p1").isActive()).isFalse();
    }

    @Test
    void cageMatchHasNoRopeBreaks() {
        WrestlerGame g = newGame("cage", "p1", "p2");
        assertThat(g.handleAction("p1", GameAction.of("rope_break")).error())
                .isEqualTo(WrestlerMessages.NO_ROPE_BREAK_IN_CAGE);
    }
}
