package com.arenahub.gameservice.domain.dto;

import com.arenahub.gameservice.engine.core.GameState;

import java.util.List;
import java.util.Map;

/**
 * 会话快照：足以在任意节点上用 restoreState 重建对局。
 * - config 为已合并、已补种子的配置；
 * - state 中的 data 带 "module" 类型字段，JSON 可无损往返。
 */
public record SessionSnapshot(
        String sessionId,
        String game,
        List<String> playerIds,
        Map<String, Object> config,
        GameState state,
        long updatedAt) {
}
