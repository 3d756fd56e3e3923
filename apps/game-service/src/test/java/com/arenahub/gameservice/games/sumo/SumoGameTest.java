package com.arenahub.gameservice.games.sumo;

import com.arenahub.gameservice.engine.core.ActionResult;
import com.arenahub.gameservice.engine.core.GameAction;
import com.arenahub.gameservice.engine.core.GameEvent;
import com.arenahub.gameservice.engine.state.SumoState;
import com.arenahub.gameservice.games.sumo.domain.constants.SumoMessages;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SumoGameTest {

    private static SumoGame newGame(int ringSize, String... players) {
        SumoConfig c = new SumoConfig();
        c.setRingSize(ringSize);
        c.setSeed(9L);
        SumoGame g = new SumoGame(c);
        g.initialize(List.of(players));
        return g;
    }

    @Test
    void quickRingOutScoresHigher() {
        SumoGame g = newGame(3, "p1", "p2");
        g.handleAction("p1", GameAction.of("push"));
        ActionResult r = g.handleAction("p1", GameAction.of("push"));

        assertThat(r.events()).extracting(GameEvent::type).contains("ring_out", "match_won", "game_ended");
        assertThat(g.getWinner()).isEqualTo("p1");
        assertThat(g.getScores()).containsEntry("p1", 480).containsEntry("p2", 0);
    }

    @Test
    void chargeOnlyAtTachiai() {
        SumoGame g = newGame(10, "p1", "p2");
        g.handleAction("p1", GameAction.of("push"));

        ActionResult r = g.handleAction("p1", GameAction.of("charge"));
        assertThat(r.error()).isEqualTo(SumoMessages.TACHIAI_ONLY);
        assertThat(g.handleAction("p2", GameAction.of("charge")).success()).isTrue();
    }

    @Test
    void throwNeedsAGrip() {
        SumoGame g = newGame(10, "p1", "p2");
        assertThat(g.handleAction("p1", GameAction.of("throw")).error()).isEqualTo(SumoMessages.NEED_GRIP);
        assertThat(g.handleAction("p1", GameAction.of("grip", Map.of("type", "beard"))).error())
                .isEqualTo(SumoMessages.INVALID_GRIP);

        assertThat(g.handleAction("p1", GameAction.of("grip", Map.of("type", "mawashi"))).success()).isTrue();
        ActionResult t = g.handleAction("p1", GameAction.of("throw"));
        assertThat(t.success()).isTrue();
        assertThat(t.events()).extracting(GameEvent::type).containsAnyOf("throw_success", "throw_fail");
    }

    @Test
    void slapBreaksTheOpponentsGrip() {
        SumoGame g = newGame(10, "p1", "p2");
        g.handleAction("p2", GameAction.of("grip", Map.of("type", "arm")));
        g.handleAction("p1", GameAction.of("slap"));

        SumoState s = (SumoState) g.getState().data();
        assertThat(s.getWrestlers().get("p2").getGrip()).isNull();
    }

    @Test
    void soloBoutGetsACpuReply() {
        SumoGame g = newGame(10, "p1");
        ActionResult r = g.handleAction("p1", GameAction.of("push"));

        assertThat(r.events()).extracting(GameEvent::playerId).contains("p1", SumoGame.CPU_ID);
        assertThat(((SumoState) g.getState().data()).getTurnCount()).isEqualTo(2);
    }
}
