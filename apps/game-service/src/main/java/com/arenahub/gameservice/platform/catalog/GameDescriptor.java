package com.arenahub.gameservice.platform.catalog;

import com.arenahub.gameservice.engine.core.UnifiedGame;

import java.util.function.Function;

/**
 * 目录里的一个游戏模块：slug、展示名、配置类型与构造方式。
 *
 * @param <C> 模块配置类型
 */
public record GameDescriptor<C>(
        String slug,
        String title,
        Class<C> configType,
        Function<C, UnifiedGame> factory) {

    public UnifiedGame create(Object config) {
        return factory.apply(configType.cast(config));
    }
}
