package com.arenahub.gameservice.engine.core;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 一次 handleAction 的结果。
 * 成功：newState 为提交后的快照，events 为本次产生的事件，error 为空；
 * 失败：只有 error，状态保证未被修改。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActionResult(boolean success, GameState newState, List<GameEvent> events, String error) {

    public ActionResult {
        events = events == null ? null : List.copyOf(events);
    }

    public static ActionResult ok(GameState state, List<GameEvent> events) {
        return new ActionResult(true, state, events, null);
    }

    public static ActionResult fail(String error) {
        return new ActionResult(false, null, null, error);
    }
}
