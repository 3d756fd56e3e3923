package com.arenahub.gameservice.engine.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 玩家（或 NPC）提交的一条动作。
 * - type：动作类型，由具体游戏解释；
 * - payload：游戏自定义参数，构造时拷贝为只读 Map，之后不可变；
 * - timestamp：毫秒时间戳，仅用于计时类规则（回合倒计时等）的比较。
 * 取值方法均返回 Optional，缺失或类型不符时为空，由游戏给出失败结果而不是抛异常。
 */
public record GameAction(String type, Map<String, Object> payload, long timestamp) {

    public GameAction {
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static GameAction of(String type) {
        return new GameAction(type, Map.of(), 0L);
    }

    public static GameAction of(String type, Map<String, Object> payload) {
        return new GameAction(type, payload, 0L);
    }

    public GameAction at(long ts) {
        return new GameAction(type, payload, ts);
    }

    public Optional<String> string(String key) {
        Object v = payload.get(key);
        return v instanceof String s && !s.isBlank() ? Optional.of(s) : Optional.empty();
    }

    /** 接受整数；也接受没有小数部分的浮点数与数字字符串 */
    public Optional<Integer> integer(String key) {
        Object v = payload.get(key);
        if (v instanceof Integer i) return Optional.of(i);
        if (v instanceof Long l && l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) return Optional.of(l.intValue());
        if (v instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue())
                && Math.abs(n.doubleValue()) <= Integer.MAX_VALUE) {
            return Optional.of((int) n.doubleValue());
        }
        if (v instanceof String s) {
            try {
                return Optional.of(Integer.parseInt(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public Optional<Double> decimal(String key) {
        Object v = payload.get(key);
        if (v instanceof Number n && Double.isFinite(n.doubleValue())) return Optional.of(n.doubleValue());
        if (v instanceof String s) {
            try {
                double d = Double.parseDouble(s.trim());
                return Double.isFinite(d) ? Optional.of(d) : Optional.empty();
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public Optional<Boolean> bool(String key) {
        Object v = payload.get(key);
        if (v instanceof Boolean b) return Optional.of(b);
        if (v instanceof String s && ("true".equalsIgnoreCase(s) || "false".equalsIgnoreCase(s))) {
            return Optional.of(Boolean.parseBoolean(s));
        }
        return Optional.empty();
    }
}
