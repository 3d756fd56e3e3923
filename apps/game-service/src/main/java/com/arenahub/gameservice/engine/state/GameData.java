package com.arenahub.gameservice.engine.state;

import com.arenahub.gameservice.engine.core.SeededRandom;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 各游戏私有数据的封闭和类型：每个模块一个实现，内核只经由本接口访问。
 * - 必须可深拷贝：内核在副本上执行动作，失败即丢弃；
 * - 必须可 JSON 往返：宿主把它当作不透明数据整体持久化，"module" 字段区分具体类型；
 * - over() 为真后数据冻结。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "module")
@JsonSubTypes({
        @JsonSubTypes.Type(value = DungeonState.class, name = "dungeon"),
        @JsonSubTypes.Type(value = BrawlerState.class, name = "brawler"),
        @JsonSubTypes.Type(value = WrestlerState.class, name = "wrestler"),
        @JsonSubTypes.Type(value = SumoState.class, name = "sumo"),
        @JsonSubTypes.Type(value = ArtilleryState.class, name = "artillery")
})
public sealed interface GameData
        permits DungeonState, BrawlerState, WrestlerState, SumoState, ArtilleryState {

    /** 深拷贝 */
    GameData copy();

    /** 模块自身的终局标记 */
    boolean over();

    /** 本局唯一的随机源 */
    SeededRandom getRandom();
}
