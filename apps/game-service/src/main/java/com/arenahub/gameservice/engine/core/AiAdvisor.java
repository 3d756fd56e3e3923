package com.arenahub.gameservice.engine.core;

import com.arenahub.gameservice.engine.state.GameData;

/**
 * 合成参与者（CPU/NPC）的出招建议器：给定状态与行动者，返回一条建议动作。
 * - 建议出来的动作走与真人完全相同的处理路径；
 * - 随机性只能来自 state 内的 SeededRandom，保证同种子可复现；
 * - 无可行动作时返回 null，由游戏决定如何跳过。
 */
public interface AiAdvisor<D extends GameData> {

    GameAction suggest(D state, String actorId);
}
