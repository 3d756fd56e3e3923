package com.arenahub.gameservice.engine.core;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 对局事件（击杀、爆炸、回合开始……），随 ActionResult 返回给宿主，内核不保留历史。
 *
 * @param playerId 关联玩家，可为 null（全局事件）
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GameEvent(String type, String playerId, Map<String, Object> data, long timestamp) {

    public GameEvent {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}
