package com.arenahub.gameservice.games.dungeon.domain.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 玩家角色。str/def/spd 为裸属性，装备加成在 {@link #effectiveAtk()} 等方法里叠加。
 */
@Data
public class Hero {

    private int hp = 50;
    private int maxHp = 50;
    private int str = 5;
    private int def = 3;
    private int spd = 3;
    private List<EquipmentSlot> equipment = new ArrayList<>();
    private List<LootItem> inventory = new ArrayList<>();
    private int xp;
    private int level = 1;
    private int gold;
    /** 重击后的硬直：下一次行动被跳过 */
    private boolean skipNextTurn;
    private boolean dodging;
    private boolean blocking;

    public boolean alive() {
        return hp > 0;
    }

    public int effectiveAtk() {
        return str + equipment.stream().filter(s -> s.getItem() != null).mapToInt(s -> s.getItem().getAtk()).sum();
    }

    public int effectiveDef() {
        return def + equipment.stream().filter(s -> s.getItem() != null).mapToInt(s -> s.getItem().getDef()).sum();
    }

    public int effectiveSpd() {
        return spd + equipment.stream().filter(s -> s.getItem() != null).mapToInt(s -> s.getItem().getSpd()).sum();
    }

    /** 结算得分：等级*100 + 金币 + 经验 */
    public int score() {
        return level * 100 + gold + xp;
    }

    public Hero copy() {
        Hero h = new Hero();
        h.hp = hp;
        h.maxHp = maxHp;
        h.str = str;
        h.def = def;
        h.spd = spd;
        equipment.forEach(s -> h.equipment.add(s.copy()));
        inventory.forEach(i -> h.inventory.add(i.copy()));
        h.xp = xp;
        h.level = level;
        h.gold = gold;
        h.skipNextTurn = skipNextTurn;
        h.dodging = dodging;
        h.blocking = blocking;
        return h;
    }
}
