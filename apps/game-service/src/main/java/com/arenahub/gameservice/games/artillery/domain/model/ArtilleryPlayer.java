package com.arenahub.gameservice.games.artillery.domain.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 参战方（真人或 NPC）。weapons 为弹药数，-1 无限，0 用尽。
 */
@Data
public class ArtilleryPlayer {

    private String id;
    private int teamId;
    private boolean npc;
    private List<String> wormIds = new ArrayList<>();
    private boolean alive = true;
    private Map<String, Integer> weapons = new LinkedHashMap<>();
    /** 轮流派出自己的虫子 */
    private int wormCycleIndex;

    public int ammoOf(String slug) {
        return weapons.getOrDefault(slug, 0);
    }

    public ArtilleryPlayer copy() {
        ArtilleryPlayer p = new ArtilleryPlayer();
        p.id = id;
        p.teamId = teamId;
        p.npc = npc;
        p.wormIds = new ArrayList<>(wormIds);
        p.alive = alive;
        p.weapons = new LinkedHashMap<>(weapons);
        p.wormCycleIndex = wormCycleIndex;
        return p;
    }
}
