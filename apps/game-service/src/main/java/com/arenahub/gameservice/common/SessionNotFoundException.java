package com.arenahub.gameservice.common;

/**
 * 会话不存在（内存与快照仓储中都找不到），映射为 HTTP 404。
 */
public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String sessionId) {
        super("会话不存在: " + sessionId);
    }
}
