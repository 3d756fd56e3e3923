package com.arenahub.gameservice.interfaces.http.dto;

import com.arenahub.gameservice.engine.core.GameEvent;
import com.arenahub.gameservice.engine.core.GameState;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * 会话的整体视图。events 只在创建时携带（初始化阶段产生的事件）。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionView(
        String sessionId,
        String game,
        List<String> playerIds,
        GameState state,
        boolean gameOver,
        String winner,
        Map<String, Integer> scores,
        List<GameEvent> events) {
}
