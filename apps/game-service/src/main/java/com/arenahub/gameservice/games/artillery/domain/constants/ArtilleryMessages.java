package com.arenahub.gameservice.games.artillery.domain.constants;

public final class ArtilleryMessages {

    private ArtilleryMessages() {
    }

    public static final String CANNOT_MOVE = "当前阶段不能移动";
    public static final String CANNOT_FIRE = "当前阶段不能开火";
    public static final String ALREADY_FIRED = "本回合已经开过火";
    public static final String NO_ACTIVE_WORM = "没有可操作的虫子";
    public static final String OUT_OF_BOUNDS = "超出地图边界";
    public static final String SLOPE_TOO_STEEP = "坡太陡，爬不上去";
    public static final String AIRBORNE = "已经在空中";
    public static final String INVALID_DIRECTION = "方向无效（left/right）";
    public static final String INVALID_ANGLE = "角度无效";
    public static final String INVALID_POWER = "力度必须在 0~100 之间";
    public static final String UNKNOWN_WEAPON = "未知武器: %s";
    public static final String NO_AMMO = "弹药已用尽: %s";
    public static final String INVALID_FUSE = "引信必须在 1~5 秒之间";
    public static final String TELEPORT_OUT_OF_BOUNDS = "传送目标超出地图";
    public static final String INVALID_COORDINATE = "坐标无效";
    public static final String NOT_NPC_TURN = "当前不是 NPC 回合";
    public static final String INVALID_TICK_COUNT = "tick 次数必须在 1~%d 之间";
}
