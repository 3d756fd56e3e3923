package com.arenahub.gameservice.games.sumo.domain.constants;

public final class SumoMessages {

    private SumoMessages() {
    }

    public static final String EXHAUSTED = "体力耗尽，只能拍手（slap）或推（push）";
    public static final String NO_OPPONENT = "没有对手";
    public static final String INVALID_GRIP = "抓握类型无效（mawashi/arm）";
    public static final String NEED_GRIP = "需要先抓握才能摔";
    public static final String TACHIAI_ONLY = "冲撞只能在立合（第一次出手）时使用";
}
