package com.arenahub.gameservice.games.artillery;

import com.arenahub.gameservice.engine.core.ActionResult;
import com.arenahub.gameservice.engine.core.GameAction;
import com.arenahub.gameservice.engine.core.GameEvent;
import com.arenahub.gameservice.engine.core.GameState;
import com.arenahub.gameservice.engine.core.KernelMessages;
import com.arenahub.gameservice.engine.state.ArtilleryState;
import com.arenahub.gameservice.games.artillery.domain.constants.ArtilleryMessages;
import com.arenahub.gameservice.games.artillery.domain.model.Worm;
import com.arenahub.gameservice.games.artillery.domain.weapon.WeaponOverride;
import com.arenahub.gameservice.games.artillery.domain.weapon.WeaponRegistry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ArtilleryGameTest {

    private static final List<String> DUEL = List.of("p1", "p2");

    private static ArtilleryConfig duelConfig() {
        ArtilleryConfig c = new ArtilleryConfig();
        c.setNpcFill(false);
        c.setMaxPlayers(2);
        c.setWormsPerPlayer(1);
        c.setCrateFrequency(0);
        c.setSeed(1L);
        return c;
    }

    private static ArtilleryGame start(ArtilleryConfig c, List<String> players) {
        ArtilleryGame g = new ArtilleryGame(c);
        g.initialize(players);
        return g;
    }

    private static ArtilleryState data(ArtilleryGame g) {
        return (ArtilleryState) g.getState().data();
    }

    @Test
    void meleeKillOfTheLastEnemyWormEndsTheGame() {
        ArtilleryGame g = start(duelConfig(), DUEL);
        GameState st = g.getState();
        ArtilleryState s = (ArtilleryState) st.data();
        String attacker = s.currentPlayerId();
        String victim = attacker.equals("p1") ? "p2" : "p1";
        Worm mine = s.getWorms().get(attacker + "_w0");
        Worm theirs = s.getWorms().get(victim + "_w0");
        theirs.setX(mine.getX() + 10);
        theirs.setY(mine.getY());
        theirs.setHp(1);
        g.restoreState(DUEL, new GameState(st.turn(), st.phase(), s));

        ActionResult r = g.handleAction(attacker, GameAction.of("fire", Map.of("weapon", "fire-punch")));

        assertThat(r.success()).isTrue();
        assertThat(r.events()).extracting(GameEvent::type).contains("melee_hit", "worm_died", "game_ended");
        assertThat(g.isGameOver()).isTrue();
        assertThat(g.getWinner()).isEqualTo(attacker);
        assertThat(g.getScores().get(victim)).isZero();
    }

    @Test
    void pointBlankBazookaShotResolvesThroughTicksAndEndsTheGame() {
        ArtilleryGame g = start(duelConfig(), DUEL);
        GameState st = g.getState();
        ArtilleryState s = (ArtilleryState) st.data();
        String attacker = s.currentPlayerId();
        String victim = attacker.equals("p1") ? "p2" : "p1";
        Worm mine = s.getWorms().get(attacker + "_w0");
        Worm theirs = s.getWorms().get(victim + "_w0");
        theirs.setX(mine.getX() + 16);
        theirs.setY(mine.getY());
        theirs.setHp(1);
        g.restoreState(DUEL, new GameState(st.turn(), st.phase(), s));

        List<GameEvent> events = new ArrayList<>();
        ActionResult fired = g.handleAction(attacker,
                GameAction.of("fire", Map.of("weapon", "bazooka", "angle", 0, "power", 100)));
        assertThat(fired.success()).isTrue();
        events.addAll(fired.events());
        assertThat(g.isGameOver()).isFalse();
        assertThat(data(g).getProjectiles()).isNotEmpty();

        for (int i = 0; i < 10 && !g.isGameOver(); i++) {
            ActionResult r = g.handleAction(attacker, GameAction.of("tick", Map.of("count", 600)));
            assertThat(r.success()).isTrue();
            events.addAll(r.events());
        }

        assertThat(g.isGameOver()).isTrue();
        assertThat(events).extracting(GameEvent::type).contains("weapon_fire", "explosion", "worm_died", "game_ended");
        assertThat(data(g).getWorms().get(victim + "_w0").isAlive()).isFalse();
        assertThat(data(g).getWorms().get(attacker + "_w0").isAlive()).isTrue();
        assertThat(g.getWinner()).isEqualTo(attacker);
    }

    @Test
    void onlyTheCurrentPlayerControlsTheTurn() {
        ArtilleryGame g = start(duelConfig(), DUEL);
        String current = data(g).currentPlayerId();
        String other = current.equals("p1") ? "p2" : "p1";

        ActionResult r = g.handleAction(other, GameAction.of("move", Map.of("direction", "left")));

        assertThat(r.error()).isEqualTo(KernelMessages.formatNotYourTurn(current));
        assertThat(g.handleAction(other, GameAction.of("tick")).success()).isTrue();
    }

    @Test
    void rejectedMoveLeavesStateUntouched() {
        ArtilleryGame g = start(duelConfig(), DUEL);
        String current = data(g).currentPlayerId();
        GameState before = g.getState();

        ActionResult r = g.handleAction(current, GameAction.of("move", Map.of("direction", "up")).at(1_000L));

        assertThat(r.error()).isEqualTo(ArtilleryMessages.INVALID_DIRECTION);
        assertThat(g.getState()).isEqualTo(before);
    }

    @Test
    void teleportTargetIsValidatedBeforeAmmoIsSpent() {
        ArtilleryGame g = start(duelConfig(), DUEL);
        String current = data(g).currentPlayerId();

        ActionResult r = g.handleAction(current, GameAction.of("fire", Map.of("weapon", "teleport", "x", -5, "y", 10)));

        assertThat(r.error()).isEqualTo(ArtilleryMessages.TELEPORT_OUT_OF_BOUNDS);
        assertThat(data(g).getPlayers().get(current).ammoOf("teleport")).isEqualTo(2);
    }

    @Test
    void tickCountIsBounded() {
        ArtilleryGame g = start(duelConfig(), DUEL);
        String expected = String.format(ArtilleryMessages.INVALID_TICK_COUNT, 600);

        assertThat(g.handleAction("p1", GameAction.of("tick", Map.of("count", 0))).error()).isEqualTo(expected);
        assertThat(g.handleAction("p1", GameAction.of("tick", Map.of("count", 601))).error()).isEqualTo(expected);
        assertThat(g.handleAction("p1", GameAction.of("tick", Map.of("count", 600))).success()).isTrue();
    }

    @Test
    void weaponStocksOfOtherTeamsAreHidden() {
        ArtilleryGame g = start(duelConfig(), DUEL);
        ArtilleryState view = (ArtilleryState) g.getStateForPlayer("p1").data();

        assertThat(view.getPlayers().get("p1").getWeapons()).containsKey("bazooka");
        assertThat(view.getPlayers().get("p2").getWeapons()).isEmpty();
        assertThat(data(g).getPlayers().get("p2").getWeapons()).isNotEmpty();
    }

    @Test
    void weaponOverridesStayInsideTheirGame() {
        ArtilleryConfig tuned = duelConfig();
        WeaponOverride o = new WeaponOverride();
        o.setDamage(99);
        tuned.setWeapons(new HashMap<>(Map.of("bazooka", o)));

        ArtilleryGame a = new ArtilleryGame(tuned);
        ArtilleryGame b = new ArtilleryGame(duelConfig());

        assertThat(a.weapon("bazooka")).get().satisfies(w -> assertThat(w.damage()).isEqualTo(99));
        assertThat(b.weapon("bazooka")).get().satisfies(w -> assertThat(w.damage()).isEqualTo(50));
        assertThat(WeaponRegistry.defaultOf("bazooka").damage()).isEqualTo(50);
        assertThat(WeaponRegistry.defaults().find("bazooka")).get().satisfies(w -> assertThat(w.damage()).isEqualTo(50));
    }

    @Test
    void npcTurnThatNeverSettlesIsCutOff() {
        ArtilleryConfig c = new ArtilleryConfig();
        c.setMaxPlayers(2);
        c.setWormsPerPlayer(1);
        c.setCrateFrequency(0);
        c.setSeed(4L);
        WeaponOverride stuck = new WeaponOverride();
        stuck.setSpeed(0.0001);
        stuck.setGravity(false);
        stuck.setWindAffected(false);
        c.setWeapons(new HashMap<>(Map.of("bazooka", stuck)));
        ArtilleryGame g = start(c, List.of("p1"));

        List<GameEvent> seen = new ArrayList<>(g.drainPendingEvents());
        if (seen.stream().noneMatch(e -> e.type().equals("autoplay_ceiling_reached"))) {
            assertThat(data(g).currentPlayerId()).isEqualTo("p1");
            seen.addAll(g.handleAction("p1", GameAction.of("end_turn")).events());
        }

        assertThat(seen).filteredOn(e -> e.type().equals("autoplay_ceiling_reached"))
                .singleElement()
                .satisfies(e -> assertThat(e.data()).containsEntry("ticks", 600));
        ArtilleryState s = data(g);
        assertThat(s.currentPlayerId()).isEqualTo("p1");
        assertThat(s.getProjectiles()).isEmpty();
        assertThat(g.getState().phase()).isEqualTo("moving");
    }

    @Test
    void healthNeverRisesAndTerrainOnlyErodesWithoutCrates() {
        ArtilleryConfig c = new ArtilleryConfig();
        c.setMaxPlayers(2);
        c.setWormsPerPlayer(2);
        c.setCrateFrequency(0);
        c.setSeed(7L);
        ArtilleryGame g = start(c, List.of("p1"));

        boolean sawFire = g.drainPendingEvents().stream().anyMatch(e -> e.type().equals("weapon_fire"));
        ArtilleryState prev = data(g);
        for (int round = 0; round < 30 && !g.isGameOver(); round++) {
            List<ActionResult> results = new ArrayList<>();
            if ("p1".equals(prev.currentPlayerId())) {
                results.add(g.handleAction("p1", GameAction.of("fire",
                        Map.of("weapon", "bazooka", "angle", -0.9, "power", 70))));
                results.add(g.handleAction("p1", GameAction.of("end_turn")));
            }
            results.add(g.handleAction("p1", GameAction.of("tick", Map.of("count", 600))));
            for (ActionResult r : results) {
                if (r.events() == null) continue;
                sawFire |= r.events().stream().anyMatch(e -> e.type().equals("weapon_fire"));
            }

            ArtilleryState now = data(g);
            for (Map.Entry<String, Worm> e : now.getWorms().entrySet()) {
                assertThat(e.getValue().getHp()).isLessThanOrEqualTo(prev.getWorms().get(e.getKey()).getHp());
            }
            for (int x = 0; x < now.getWidth(); x++) {
                assertThat(now.getGround()[x]).isGreaterThanOrEqualTo(prev.getGround()[x]);
            }
            prev = now;
        }
        assertThat(sawFire).isTrue();
    }

    @Test
    void sameSeedAndScriptGiveTheSameMatch() {
        ArtilleryConfig c = new ArtilleryConfig();
        c.setMaxPlayers(3);
        c.setWormsPerPlayer(2);
        c.setSeed(21L);
        ArtilleryGame a = start(c, List.of("p1"));
        ArtilleryGame b = start(c, List.of("p1"));

        for (ArtilleryGame g : List.of(a, b)) {
            for (int i = 0; i < 5 && !g.isGameOver(); i++) {
                if ("p1".equals(data(g).currentPlayerId())) {
                    g.handleAction("p1", GameAction.of("fire", Map.of("weapon", "grenade", "angle", -1.2, "power", 55)));
                    g.handleAction("p1", GameAction.of("end_turn"));
                }
                g.handleAction("p1", GameAction.of("tick", Map.of("count", 300)));
            }
        }

        assertThat(a.getState()).isEqualTo(b.getState());
        assertThat(a.getScores()).isEqualTo(b.getScores());
    }
}
