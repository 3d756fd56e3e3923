package com.arenahub.gameservice.games.dungeon.domain.constants;

/**
 * 地牢规则提示文案。
 */
public final class DungeonMessages {

    private DungeonMessages() {
    }

    public static final String PLAYER_DEAD = "角色已阵亡";
    public static final String NOT_IN_COMBAT = "当前不在战斗阶段";
    public static final String TARGET_NOT_FOUND = "目标不存在或已死亡";
    public static final String ITEM_NOT_IN_INVENTORY = "背包中没有该物品";
    public static final String NOT_CONSUMABLE = "该物品不可使用，请改用装备";
    public static final String CANNOT_EQUIP_CONSUMABLE = "消耗品不能装备，请改用使用物品";
    public static final String INVALID_SLOT = "装备槽无效";
    public static final String CANNOT_DESCEND = "尚未清理本层，不能下楼";
    public static final String SHOP_CLOSED = "现在不能购物";
    public static final String ITEM_NOT_IN_SHOP = "商店没有该物品";
    public static final String NOT_ENOUGH_GOLD = "金币不足（需要 %d，持有 %d）";
    public static final String NO_LOOT_PHASE = "现在没有可拾取的战利品";
    public static final String LOOT_NOT_FOUND = "战利品不存在";
    public static final String MISSING_ITEM_ID = "缺少 itemId";
    public static final String MISSING_SLOT = "缺少 slot";

    public static String formatNotEnoughGold(int price, int gold) {
        return String.format(NOT_ENOUGH_GOLD, price, gold);
    }
}
