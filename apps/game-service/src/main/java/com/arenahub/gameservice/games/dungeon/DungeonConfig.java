package com.arenahub.gameservice.games.dungeon;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * 地牢配置，宿主从会话配置 Map 转换而来，未给出的字段取默认值。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DungeonConfig {

    private int floorCount = 5;
    private int equipmentSlots = 3;
    private int bossEveryNFloors = 5;
    /** balanced | generous | common */
    private String lootRarity = "balanced";
    private Long seed;
}
