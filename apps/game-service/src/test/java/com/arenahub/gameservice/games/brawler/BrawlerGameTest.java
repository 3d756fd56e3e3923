package com.arenahub.gameservice.games.brawler;

import com.arenahub.gameservice.engine.core.ActionResult;
import com.arenahub.gameservice.engine.core.GameAction;
import com.arenahub.gameservice.engine.core.GameEvent;
import com.arenahub.gameservice.engine.core.KernelMessages;
import com.arenahub.gameservice.engine.state.BrawlerState;
import com.arenahub.gameservice.games.brawler.domain.constants.BrawlerMessages;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BrawlerGameTest {

    private static BrawlerGame newGame(int stages, int waves, int density, double weaponRate, String... players) {
        BrawlerConfig c = new BrawlerConfig();
        c.setStageCount(stages);
        c.setWavesPerStage(waves);
        c.setEnemyDensity(density);
        c.setWeaponSpawnRate(weaponRate);
        c.setSeed(5L);
        BrawlerGame g = new BrawlerGame(c);
        g.initialize(List.of(players));
        return g;
    }

    @Test
    void onlyTheActivePlayerMayFight() {
        BrawlerGame g = newGame(3, 3, 3, 0.0, "p1", "p2");

        ActionResult early = g.handleAction("p2", GameAction.of("attack"));
        assertThat(early.success()).isFalse();
        assertThat(early.error()).isEqualTo(KernelMessages.formatNotYourTurn("p1"));

        assertThat(g.handleAction("p1", GameAction.of("attack")).success()).isTrue();
        assertThat(g.handleAction("p2", GameAction.of("attack")).success()).isTrue();
    }

    @Test
    void invalidDirectionIsRejected() {
        BrawlerGame g = newGame(3, 3, 3, 0.0, "p1");
        ActionResult r = g.handleAction("p1", GameAction.of("move", Map.of("direction", "diagonal")));

        assertThat(r.success()).isFalse();
        assertThat(r.error()).isEqualTo(BrawlerMessages.INVALID_DIRECTION);
    }

    @Test
    void switchingMovesBuildsACombo() {
        BrawlerGame g = newGame(3, 3, 3, 0.0, "p1");
        g.handleAction("p1", GameAction.of("attack"));

        ActionResult r = g.handleAction("p1", GameAction.of("jump_attack"));

        GameEvent jump = r.events().stream().filter(e -> e.type().equals("jump_attack")).findFirst().orElseThrow();
        assertThat(jump.data()).containsEntry("combo", 1).containsEntry("damage", 13);
    }

    @Test
    void specialHitsEveryEnemyAndCostsHealth() {
        BrawlerGame g = newGame(1, 2, 2, 0.0, "p1");

        ActionResult r = g.handleAction("p1", GameAction.of("special"));

        assertThat(r.success()).isTrue();
        assertThat(r.events()).extracting(GameEvent::type)
                .contains("enemy_defeated", "special", "wave_cleared");
        BrawlerState s = (BrawlerState) g.getState().data();
        assertThat(s.getPlayers().get("p1").getHp()).isEqualTo(80);
        assertThat(s.getPlayers().get("p1").getScore()).isEqualTo(140);
        assertThat(s.getCurrentWave()).isEqualTo(2);
        assertThat(s.getEnemies()).singleElement().satisfies(t -> assertThat(t.getName()).isEqualTo("Boss"));
    }

    @Test
    void pickingUpAWeaponDoesNotUseTheTurn() {
        BrawlerGame g = newGame(3, 3, 3, 1.0, "p1", "p2");

        ActionResult pick = g.handleAction("p2", GameAction.of("pick_up"));
        assertThat(pick.success()).isTrue();

        BrawlerState s = (BrawlerState) g.getState().data();
        assertThat(s.getPlayers().get("p2").getWeapon()).isNotNull();
        assertThat(s.getWeapons()).isEmpty();
        assertThat(g.handleAction("p1", GameAction.of("attack")).success()).isTrue();
    }

    @Test
    void useWeaponWithoutOneIsRejected() {
        BrawlerGame g = newGame(3, 3, 3, 0.0, "p1");
        assertThat(g.handleAction("p1", GameAction.of("use_weapon")).error()).isEqualTo(BrawlerMessages.NO_WEAPON);
    }
}
