package com.arenahub.gameservice.engine.core;

/**
 * 游戏钩子 processAction 的返回：接受，或带原因拒绝。
 */
public record Verdict(boolean accepted, String reason) {

    private static final Verdict ACCEPT = new Verdict(true, null);

    public static Verdict accept() {
        return ACCEPT;
    }

    public static Verdict reject(String reason) {
        return new Verdict(false, reason);
    }

    public static Verdict reject(String format, Object... args) {
        return new Verdict(false, String.format(format, args));
    }
}
