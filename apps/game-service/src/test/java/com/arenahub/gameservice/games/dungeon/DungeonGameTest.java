package com.arenahub.gameservice.games.dungeon;

import com.arenahub.gameservice.engine.core.ActionResult;
import com.arenahub.gameservice.engine.core.GameAction;
import com.arenahub.gameservice.engine.core.GameEvent;
import com.arenahub.gameservice.engine.core.GameState;
import com.arenahub.gameservice.engine.core.KernelMessages;
import com.arenahub.gameservice.engine.state.DungeonState;
import com.arenahub.gameservice.games.dungeon.domain.constants.DungeonMessages;
import com.arenahub.gameservice.games.dungeon.domain.model.DungeonPhase;
import com.arenahub.gameservice.games.dungeon.domain.model.Hero;
import com.arenahub.gameservice.games.dungeon.domain.model.ItemType;
import com.arenahub.gameservice.games.dungeon.domain.model.LootItem;
import com.arenahub.gameservice.games.dungeon.domain.model.Rarity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DungeonGameTest {

    private DungeonGame game;

    @BeforeEach
    void setUp() {
        DungeonConfig c = new DungeonConfig();
        c.setSeed(11L);
        game = new DungeonGame(c);
        game.initialize(List.of("p1", "p2"));
    }

    private DungeonState data() {
        return (DungeonState) game.getState().data();
    }

    /** 把一件物品塞进背包后重新装载状态 */
    private void giveItem(String pid, LootItem item) {
        GameState st = game.getState();
        DungeonState d = (DungeonState) st.data();
        d.getPlayers().get(pid).getInventory().add(item);
        game.restoreState(List.of("p1", "p2"), new GameState(st.turn(), st.phase(), d));
    }

    @Test
    void firstFloorStartsInCombatWithEnemies() {
        assertThat(data().getPhase()).isEqualTo(DungeonPhase.COMBAT);
        assertThat(data().getEnemies()).isNotEmpty();
        assertThat(data().getPlayers().get("p1").getEquipment()).hasSize(3);
    }

    @Test
    void equipFromInventoryMovesItemIntoSlotAndRaisesAttack() {
        giveItem("p1", new LootItem("item_900", "Rusty Sword", ItemType.WEAPON, Rarity.COMMON, 4, 0, 0, 0, 10));
        int atkBefore = data().getPlayers().get("p1").effectiveAtk();

        ActionResult r = game.handleAction("p1", GameAction.of("equip", Map.of("itemId", "item_900", "slot", "weapon")));

        assertThat(r.success()).isTrue();
        Hero hero = data().getPlayers().get("p1");
        assertThat(hero.getInventory()).extracting(LootItem::getId).doesNotContain("item_900");
        assertThat(hero.getEquipment().get(0).getItem().getId()).isEqualTo("item_900");
        assertThat(hero.effectiveAtk()).isEqualTo(atkBefore + 4);
    }

    @Test
    void equippingOverOccupiedSlotReturnsPreviousItemToInventory() {
        giveItem("p1", new LootItem("item_901", "Club", ItemType.WEAPON, Rarity.COMMON, 2, 0, 0, 0, 5));
        giveItem("p1", new LootItem("item_902", "Axe", ItemType.WEAPON, Rarity.UNCOMMON, 6, 0, 0, 0, 20));
        game.handleAction("p1", GameAction.of("equip", Map.of("itemId", "item_901", "slot", 0)));

        ActionResult r = game.handleAction("p1", GameAction.of("equip", Map.of("itemId", "item_902", "slot", 0)));

        assertThat(r.success()).isTrue();
        Hero hero = data().getPlayers().get("p1");
        assertThat(hero.getEquipment().get(0).getItem().getId()).isEqualTo("item_902");
        assertThat(hero.getInventory()).extracting(LootItem::getId).containsExactly("item_901");
    }

    @Test
    void consumablesCannotBeEquipped() {
        giveItem("p1", new LootItem("item_903", "Potion", ItemType.CONSUMABLE, Rarity.COMMON, 0, 0, 0, 20, 10));
        ActionResult r = game.handleAction("p1", GameAction.of("equip", Map.of("itemId", "item_903", "slot", 0)));

        assertThat(r.success()).isFalse();
        assertThat(r.error()).isEqualTo(DungeonMessages.CANNOT_EQUIP_CONSUMABLE);
    }

    @Test
    void combatActionsFollowTurnOrder() {
        ActionResult wrong = game.handleAction("p2", GameAction.of("attack"));
        assertThat(wrong.success()).isFalse();
        assertThat(wrong.error()).isEqualTo(KernelMessages.formatNotYourTurn("p1"));

        ActionResult ok = game.handleAction("p1", GameAction.of("attack"));
        assertThat(ok.success()).isTrue();
        assertThat(ok.events()).extracting(GameEvent::type).contains("attack");
    }

    @Test
    void heavyAttackSkipsTheAttackersNextAction() {
        game.handleAction("p1", GameAction.of("heavy_attack"));
        game.handleAction("p2", GameAction.of("block"));

        ActionResult skipped = game.handleAction("p1", GameAction.of("attack"));

        assertThat(skipped.success()).isTrue();
        assertThat(skipped.events()).extracting(GameEvent::type).containsExactly("turn_skipped");
    }

    @Test
    void stunnedPlayerStillWaitsForTheirOwnTurn() {
        game.handleAction("p1", GameAction.of("heavy_attack"));
        int turn = game.getState().turn();

        ActionResult early = game.handleAction("p1", GameAction.of("attack"));

        assertThat(early.success()).isFalse();
        assertThat(early.error()).isEqualTo(KernelMessages.formatNotYourTurn("p2"));
        assertThat(game.getState().turn()).isEqualTo(turn);
        assertThat(data().getPlayers().get("p1").isSkipNextTurn()).isTrue();

        game.handleAction("p2", GameAction.of("block"));
        ActionResult skipped = game.handleAction("p1", GameAction.of("dodge"));
        assertThat(skipped.events()).extracting(GameEvent::type).containsExactly("turn_skipped");
        assertThat(data().getPlayers().get("p1").isSkipNextTurn()).isFalse();
    }

    @Test
    void unknownActionDoesNotConsumeTheStun() {
        DungeonConfig c = new DungeonConfig();
        c.setSeed(11L);
        DungeonGame solo = new DungeonGame(c);
        solo.initialize(List.of("p1"));
        solo.handleAction("p1", GameAction.of("heavy_attack"));
        int turn = solo.getState().turn();

        ActionResult r = solo.handleAction("p1", GameAction.of("fly_to_moon"));

        assertThat(r.success()).isFalse();
        assertThat(r.error()).isEqualTo(KernelMessages.formatUnknownAction("fly_to_moon"));
        DungeonState d = (DungeonState) solo.getState().data();
        assertThat(d.getPlayers().get("p1").isSkipNextTurn()).isTrue();
        assertThat(solo.getState().turn()).isEqualTo(turn);
    }

    @Test
    void equippingArmorWithHealthBonusRaisesHpAndMaxHp() {
        giveItem("p1", new LootItem("item_905", "Chain Mail", ItemType.ARMOR, Rarity.UNCOMMON, 0, 2, 0, 10, 30));
        Hero before = data().getPlayers().get("p1");
        int hp = before.getHp();
        int maxHp = before.getMaxHp();

        ActionResult r = game.handleAction("p1", GameAction.of("equip", Map.of("itemId", "item_905", "slot", "armor")));

        assertThat(r.success()).isTrue();
        Hero after = data().getPlayers().get("p1");
        assertThat(after.getMaxHp()).isEqualTo(maxHp + 10);
        assertThat(after.getHp()).isEqualTo(hp + 10);
        assertThat(after.getEquipment().get(1).getItem().getId()).isEqualTo("item_905");
    }

    @Test
    void otherPlayersInventoriesAreHiddenInProjection() {
        giveItem("p2", new LootItem("item_904", "Ring", ItemType.ACCESSORY, Rarity.RARE, 1, 1, 1, 0, 50));
        DungeonState forP1 = (DungeonState) game.getStateForPlayer("p1").data();
        DungeonState forP2 = (DungeonState) game.getStateForPlayer("p2").data();

        assertThat(forP1.getPlayers().get("p2").getInventory()).isEmpty();
        assertThat(forP2.getPlayers().get("p2").getInventory()).hasSize(1);
    }

    @Test
    void descendIsRejectedWhileEnemiesRemain() {
        ActionResult r = game.handleAction("p1", GameAction.of("descend"));
        assertThat(r.error()).isEqualTo(DungeonMessages.CANNOT_DESCEND);
    }
}
