package com.arenahub.gameservice.games.dungeon.domain.model;

/** 物品类别；只有 CONSUMABLE 可以使用，其余只能装备 */
public enum ItemType {
    WEAPON,
    ARMOR,
    ACCESSORY,
    CONSUMABLE
}
