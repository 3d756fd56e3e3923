package com.arenahub.gameservice.infrastructure.codec;

import com.arenahub.gameservice.domain.dto.SessionSnapshot;
import com.arenahub.gameservice.engine.core.GameAction;
import com.arenahub.gameservice.engine.state.ArtilleryState;
import com.arenahub.gameservice.engine.state.WrestlerState;
import com.arenahub.gameservice.games.artillery.ArtilleryConfig;
import com.arenahub.gameservice.games.artillery.ArtilleryGame;
import com.arenahub.gameservice.games.wrestler.WrestlerConfig;
import com.arenahub.gameservice.games.wrestler.WrestlerGame;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GameSnapshotCodecTest {

    private final GameSnapshotCodec codec = new GameSnapshotCodec(Jackson2ObjectMapperBuilder.json().build());

    @Test
    void artilleryStateSurvivesJson() {
        ArtilleryConfig c = new ArtilleryConfig();
        c.setSeed(8L);
        c.setMaxPlayers(2);
        c.setWormsPerPlayer(2);
        ArtilleryGame g = new ArtilleryGame(c);
        g.initialize(List.of("p1"));
        g.handleAction("p1", GameAction.of("tick", Map.of("count", 30)));
        SessionSnapshot snap = new SessionSnapshot("s-1", "artillery", g.getPlayerIds(),
                Map.of("seed", 8, "maxPlayers", 2), g.getState(), 1_000L);

        String json = codec.encode(snap);
        SessionSnapshot back = codec.decode(json);

        assertThat(json).contains("\"module\":\"artillery\"");
        assertThat(back.state().data()).isInstanceOf(ArtilleryState.class);
        assertThat(back).isEqualTo(snap);
    }

    @Test
    void restoredWrestlerGamePlaysOnIdentically() {
        WrestlerConfig c = new WrestlerConfig();
        c.setSeed(2L);
        WrestlerGame original = new WrestlerGame(c);
        original.initialize(List.of("p1"));
        original.handleAction("p1", GameAction.of("strike"));

        SessionSnapshot back = codec.decode(codec.encode(new SessionSnapshot("s-2", "wrestler",
                original.getPlayerIds(), Map.of("seed", 2), original.getState(), 5L)));
        assertThat(back.state().data()).isInstanceOf(WrestlerState.class);

        WrestlerGame restored = new WrestlerGame(c);
        restored.restoreState(back.playerIds(), back.state());
        original.handleAction("p1", GameAction.of("grapple"));
        restored.handleAction("p1", GameAction.of("grapple"));

        assertThat(restored.getState()).isEqualTo(original.getState());
    }

    @Test
    void garbageIsReportedAsIllegalState() {
        assertThatThrownBy(() -> codec.decode("{not json")).isInstanceOf(IllegalStateException.class);
    }
}
