package com.arenahub.gameservice.engine.core;

import com.arenahub.gameservice.engine.state.GameData;

/**
 * 对外暴露的状态外壳：回合数、阶段标签、各游戏私有数据。
 * data 为深拷贝，调用方修改它不会影响对局本身。
 */
public record GameState(int turn, String phase, GameData data) {

    /** 深拷贝一份外壳与数据 */
    public GameState copy() {
        return new GameState(turn, phase, data == null ? null : data.copy());
    }
}
