package com.arenahub.gameservice.games.artillery.domain.physics;

import java.util.Map;

/**
 * 物理层向外发事件的出口，由游戏模块接到内核的事件暂存区。
 */
@FunctionalInterface
public interface EventSink {

    void emit(String type, String playerId, Map<String, Object> data);
}
