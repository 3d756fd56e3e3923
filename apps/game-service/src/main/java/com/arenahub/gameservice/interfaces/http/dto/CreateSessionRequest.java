package com.arenahub.gameservice.interfaces.http.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * 创建会话请求：游戏 slug、玩家列表、可选的模块配置（覆盖 arena.games.defaults）。
 */
@Data
public class CreateSessionRequest {

    @NotBlank
    private String game;

    @NotEmpty
    private List<String> playerIds;

    private Map<String, Object> config;
}
