package com.arenahub.gameservice.interfaces.http.dto;

import com.arenahub.gameservice.engine.core.EngineMode;

/**
 * 目录条目，人数范围按默认配置计算。
 */
public record CatalogEntry(String slug, String title, EngineMode mode, int minPlayers, int maxPlayers) {
}
