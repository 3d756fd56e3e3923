package com.arenahub.gameservice.games.dungeon.domain.constants;

import com.arenahub.gameservice.games.dungeon.domain.model.ItemType;
import com.arenahub.gameservice.games.dungeon.domain.model.LootItem;
import com.arenahub.gameservice.games.dungeon.domain.model.Rarity;

import java.util.List;
import java.util.Map;

/**
 * 地牢的静态数据表：怪物模板、首领模板、按稀有度分组的掉落表。
 * 表内对象只作模板，取用时必须复制并分配新 id。
 */
public final class DungeonCatalog {

    private DungeonCatalog() {
    }

    public record EnemyTemplate(String name, int hp, int atk, int def, Rarity lootTable) {
    }

    public static final List<EnemyTemplate> ENEMIES = List.of(
            new EnemyTemplate("Skeleton", 15, 5, 1, Rarity.COMMON),
            new EnemyTemplate("Zombie", 20, 4, 2, Rarity.COMMON),
            new EnemyTemplate("Goblin", 12, 7, 0, Rarity.UNCOMMON),
            new EnemyTemplate("Dark Knight", 30, 8, 4, Rarity.UNCOMMON),
            new EnemyTemplate("Wraith", 25, 10, 2, Rarity.RARE));

    public static final List<EnemyTemplate> BOSSES = List.of(
            new EnemyTemplate("Demon Lord", 60, 12, 5, Rarity.RARE),
            new EnemyTemplate("Dragon", 80, 15, 6, Rarity.EPIC),
            new EnemyTemplate("Lich King", 70, 14, 4, Rarity.EPIC));

    public static final Map<Rarity, List<LootItem>> LOOT = Map.of(
            Rarity.COMMON, List.of(
                    item("Rusty Sword", ItemType.WEAPON, Rarity.COMMON, 3, 0, 0, 0, 5),
                    item("Leather Vest", ItemType.ARMOR, Rarity.COMMON, 0, 2, 0, 0, 5),
                    item("Health Potion", ItemType.CONSUMABLE, Rarity.COMMON, 0, 0, 0, 20, 3)),
            Rarity.UNCOMMON, List.of(
                    item("Steel Blade", ItemType.WEAPON, Rarity.UNCOMMON, 6, 0, 0, 0, 12),
                    item("Chain Mail", ItemType.ARMOR, Rarity.UNCOMMON, 0, 4, 0, 0, 12),
                    item("Speed Ring", ItemType.ACCESSORY, Rarity.UNCOMMON, 0, 0, 3, 0, 10)),
            Rarity.RARE, List.of(
                    item("Enchanted Axe", ItemType.WEAPON, Rarity.RARE, 10, 0, 0, 0, 25),
                    item("Plate Armor", ItemType.ARMOR, Rarity.RARE, 0, 7, 0, 0, 25),
                    item("Amulet of Power", ItemType.ACCESSORY, Rarity.RARE, 4, 0, 2, 0, 20)),
            Rarity.EPIC, List.of(
                    item("Demon Slayer", ItemType.WEAPON, Rarity.EPIC, 15, 0, 0, 0, 50),
                    item("Dragon Scale", ItemType.ARMOR, Rarity.EPIC, 0, 12, 0, 20, 50),
                    item("Crown of Kings", ItemType.ACCESSORY, Rarity.EPIC, 5, 5, 3, 0, 45)));

    /** 装备槽名称，超出部分命名为 slot_N */
    public static final List<String> SLOT_NAMES = List.of("weapon", "armor", "accessory", "ring", "amulet");

    public static final int XP_PER_LEVEL = 100;
    public static final int SHOP_SIZE = 3;

    private static LootItem item(String name, ItemType type, Rarity rarity,
                                 int atk, int def, int spd, int hp, int value) {
        return new LootItem(null, name, type, rarity, atk, def, spd, hp, value);
    }
}
