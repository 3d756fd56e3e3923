package com.arenahub.web.common;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;

/**
 * 统一 API 响应外壳。
 * - code 与 HTTP 语义对齐：200 成功，400 参数错误，404 会话不存在，409 状态冲突，500 未知错误；
 * - 对局内的规则失败（如“未轮到你”）不是 HTTP 错误，放在 data 里的 ActionResult 中返回。
 *
 * @param <T> 响应数据类型
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(int code, String message, T data) implements Serializable {

    public static final int OK = 200;
    public static final int BAD_REQUEST = 400;
    public static final int NOT_FOUND = 404;
    public static final int CONFLICT = 409;
    public static final int SERVER_ERROR = 500;

    /** 成功（无数据），用于删除等操作 */
    public static <T> ApiResponse<T> success() {
        return new ApiResponse<>(OK, "success", null);
    }

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(OK, "success", data);
    }

    /** 成功（自定义提示） */
    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(OK, message, data);
    }

    public static <T> ApiResponse<T> badRequest(String message) {
        return new ApiResponse<>(BAD_REQUEST, message, null);
    }

    public static <T> ApiResponse<T> notFound(String message) {
        return new ApiResponse<>(NOT_FOUND, message, null);
    }

    public static <T> ApiResponse<T> conflict(String message) {
        return new ApiResponse<>(CONFLICT, message, null);
    }

    public static <T> ApiResponse<T> serverError(String message) {
        return new ApiResponse<>(SERVER_ERROR, message, null);
    }

    /** code 为 200 即视为成功 */
    @JsonIgnore
    public boolean isOk() {
        return code == OK;
    }
}
