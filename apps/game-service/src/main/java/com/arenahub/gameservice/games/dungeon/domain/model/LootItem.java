package com.arenahub.gameservice.games.dungeon.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 掉落/商店物品。id 由对局内计数器生成（item_N），同一局内唯一。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LootItem {

    private String id;
    private String name;
    private ItemType type;
    private Rarity rarity;
    private int atk;
    private int def;
    private int spd;
    /** 消耗品为回复量；装备为最大生命加成 */
    private int hp;
    private int value;

    public LootItem copy() {
        return new LootItem(id, name, type, rarity, atk, def, spd, hp, value);
    }

    public boolean consumable() {
        return type == ItemType.CONSUMABLE;
    }
}
