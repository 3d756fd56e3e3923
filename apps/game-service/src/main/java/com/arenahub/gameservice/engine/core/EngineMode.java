package com.arenahub.gameservice.engine.core;

/**
 * 引擎推进方式。
 * TURN_BASED：每条动作即结算（地牢、乱斗、摔角、相扑）。
 * TICK_BASED：物理由外部 tick 信号离散推进（炮击），没有后台循环。
 */
public enum EngineMode {
    TURN_BASED,
    TICK_BASED
}
