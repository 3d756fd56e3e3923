package com.arenahub.gameservice.platform.catalog;

import com.arenahub.gameservice.engine.core.UnifiedGame;
import com.arenahub.gameservice.games.artillery.ArtilleryGame;
import com.arenahub.gameservice.platform.config.ArenaProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GameCatalogTest {

    private GameCatalog catalog;

    @BeforeEach
    void setUp() {
        ArenaProperties props = new ArenaProperties();
        Map<String, Object> artillery = new LinkedHashMap<>();
        artillery.put("turnTime", 30);
        artillery.put("physics", new LinkedHashMap<>(Map.of("gravity", 0.4, "walkSpeed", 2.0)));
        props.getGames().getDefaults().put("artillery", artillery);
        catalog = new GameCatalog(new ObjectMapper(), props);
    }

    @Test
    void registersAllFiveModules() {
        assertThat(catalog.all()).extracting(GameDescriptor::slug)
                .containsExactly("dungeon", "brawler", "wrestler", "sumo", "artillery");
    }

    @Test
    void unknownSlugIsRejected() {
        assertThatThrownBy(() -> catalog.require("chess"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("chess");
    }

    @Test
    void requestOverridesDefaultsLevelByLevel() {
        Map<String, Object> requested = Map.of("physics", Map.of("gravity", 0.2), "wormsPerPlayer", 2, "seed", 42);

        Map<String, Object> resolved = catalog.resolveConfig("artillery", requested);

        assertThat(resolved).containsEntry("turnTime", 30).containsEntry("wormsPerPlayer", 2).containsEntry("seed", 42);
        assertThat(resolved.get("physics")).isEqualTo(Map.of("gravity", 0.2, "walkSpeed", 2.0));
    }

    @Test
    void missingSeedIsFilledIn() {
        Map<String, Object> resolved = catalog.resolveConfig("sumo", null);
        assertThat(resolved.get(GameCatalog.SEED_KEY)).isInstanceOf(Long.class);
    }

    @Test
    void createdGamesDoNotShareOverrides() {
        Map<String, Object> tuned = catalog.resolveConfig("artillery",
                Map.of("seed", 1, "weapons", Map.of("bazooka", Map.of("damage", 99))));
        Map<String, Object> plain = catalog.resolveConfig("artillery", Map.of("seed", 1));

        UnifiedGame a = catalog.create("artillery", tuned);
        UnifiedGame b = catalog.create("artillery", plain);

        assertThat(((ArtilleryGame) a).weapon("bazooka").orElseThrow().damage()).isEqualTo(99);
        assertThat(((ArtilleryGame) b).weapon("bazooka").orElseThrow().damage()).isEqualTo(50);
    }

    @Test
    void deepMergeLeavesInputsAlone() {
        Map<String, Object> base = new LinkedHashMap<>(Map.of("a", 1, "nested", Map.of("x", 1, "y", 2)));
        Map<String, Object> override = Map.of("nested", Map.of("y", 3), "b", List.of(1));

        Map<String, Object> merged = GameCatalog.deepMerge(base, override);

        assertThat(merged).containsEntry("a", 1).containsEntry("b", List.of(1));
        assertThat(merged.get("nested")).isEqualTo(Map.of("x", 1, "y", 3));
        assertThat(base.get("nested")).isEqualTo(Map.of("x", 1, "y", 2));
    }

    @Test
    void badConfigTypeSurfacesAsIllegalArgument() {
        Map<String, Object> resolved = catalog.resolveConfig("sumo", Map.of("ringSize", "huge"));
        assertThatThrownBy(() -> catalog.create("sumo", resolved)).isInstanceOf(IllegalArgumentException.class);
    }
}
