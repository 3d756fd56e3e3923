package com.arenahub.gameservice.games.brawler.domain.constants;

public final class BrawlerMessages {

    private BrawlerMessages() {
    }

    public static final String INVALID_DIRECTION = "方向无效（left/right/up/down）";
    public static final String NO_ENEMIES = "没有可攻击的敌人";
    public static final String TARGET_NOT_FOUND = "目标不存在或已被击倒";
    public static final String NO_WEAPON = "手上没有武器";
    public static final String SPECIAL_HP = "生命不足，无法释放必杀";
    public static final String WEAPON_NOT_FOUND = "武器不存在";
    public static final String MISSING_TARGET = "缺少 targetId";
}
