package com.arenahub.gameservice.engine.core;

/**
 * 内核层面的失败提示（结构性错误），各游戏的规则提示放在各自的 constants 包里。
 */
public final class KernelMessages {

    private KernelMessages() {
    }

    public static final String NOT_INITIALIZED = "对局尚未初始化";

    public static final String GAME_OVER = "游戏已结束";

    public static final String MISSING_ACTION_TYPE = "缺少动作类型";

    public static final String ELIMINATED = "你已出局，不能再行动";

    public static final String INTERNAL_ERROR = "动作处理失败，状态未改变";

    public static final String UNKNOWN_PLAYER = "不是本局玩家: %s";

    public static final String UNKNOWN_ACTION = "未知动作: %s";

    public static final String NOT_YOUR_TURN = "还没轮到你（当前行动者 %s）";

    public static String formatUnknownPlayer(String playerId) {
        return String.format(UNKNOWN_PLAYER, playerId);
    }

    public static String formatUnknownAction(String type) {
        return String.format(UNKNOWN_ACTION, type);
    }

    public static String formatNotYourTurn(String current) {
        return String.format(NOT_YOUR_TURN, current);
    }
}
