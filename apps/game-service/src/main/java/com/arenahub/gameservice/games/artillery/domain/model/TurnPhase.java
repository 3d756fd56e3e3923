package com.arenahub.gameservice.games.artillery.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 回合内阶段：移动 → 瞄准 → 撤退 → 结算 → 回合间隙。
 */
public enum TurnPhase {
    MOVING("moving"),
    AIMING("aiming"),
    RETREAT("retreat"),
    RESOLVING("resolving"),
    BETWEEN_TURNS("between_turns");

    private final String label;

    TurnPhase(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
