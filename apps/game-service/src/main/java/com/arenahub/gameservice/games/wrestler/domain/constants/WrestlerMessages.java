package com.arenahub.gameservice.games.wrestler.domain.constants;

public final class WrestlerMessages {

    private WrestlerMessages() {
    }

    public static final String PIN_DEFENDER_ONLY = "压制中只能踢出（kick_out）或抓绳（rope_break）";
    public static final String PIN_IN_PROGRESS = "压制进行中，等待防守方回应";
    public static final String NOT_ACTIVE = "你不是场上选手，请先 tag_partner 换人";
    public static final String NOT_ENOUGH_STAMINA = "体力不足（需要 %d，当前 %d）";
    public static final String NO_OPPONENT = "没有可攻击的对手";
    public static final String INVALID_TARGET = "目标无效: %s";
    public static final String NO_PIN = "当前没有压制可以踢出";
    public static final String NO_ROPE_BREAK_IN_CAGE = "笼斗没有抓绳";
    public static final String NO_ROPE_BREAKS = "抓绳次数已用完";
    public static final String TAG_ONLY_IN_TAG = "只有双打赛可以换人";
    public static final String NO_PARTNER = "没有可换上的队友";
    public static final String PARTNER_ELIMINATED = "队友已出局";
    public static final String FINISHER_MOMENTUM = "终结技需要 %d 气势（当前 %d）";
    public static final String INVALID_STRIKE = "打击类型无效（punch/kick/chop）";
}
