package com.arenahub.gameservice.engine.core;

import java.util.List;
import java.util.Map;

/**
 * 统一游戏接口：宿主与任意游戏模块之间唯一的契约。
 * 宿主负责同一会话的串行访问，实现本身不加锁。
 */
public interface UnifiedGame {

    /** 模块标识，如 "artillery" */
    String slug();

    EngineMode mode();

    int minPlayers();

    int maxPlayers();

    /**
     * 以玩家列表初始化对局。人数越界、重复或为空时抛 IllegalArgumentException。
     */
    void initialize(List<String> playerIds);

    /**
     * 从持久化快照恢复，不重新初始化、不产生事件。
     */
    void restoreState(List<String> playerIds, GameState state);

    GameState getState();

    /** 某玩家可见的投影（战争迷雾），纯函数 */
    GameState getStateForPlayer(String playerId);

    /** 唯一的变更入口，任何失败都以 success=false 返回，不抛异常 */
    ActionResult handleAction(String playerId, GameAction action);

    boolean isGameOver();

    /** 胜者玩家 id；平局或未结束时为 null */
    String getWinner();

    Map<String, Integer> getScores();

    /** 取走尚未随结果返回的事件（初始化阶段产生的事件） */
    List<GameEvent> drainPendingEvents();

    List<String> getPlayerIds();
}
