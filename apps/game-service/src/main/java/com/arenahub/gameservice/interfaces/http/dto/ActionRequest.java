package com.arenahub.gameservice.interfaces.http.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.Map;

/**
 * 提交动作。type 为空不在这里拦截，交给内核给出统一的失败结果。
 */
@Data
public class ActionRequest {

    @NotBlank
    private String playerId;

    private String type;

    private Map<String, Object> payload;
}
