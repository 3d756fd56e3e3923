package com.arenahub.gameservice.infrastructure.codec;

import com.arenahub.gameservice.domain.dto.SessionSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 会话快照 ⇄ JSON 文本。GameData 的具体类型由 "module" 字段决定。
 */
@Component
@RequiredArgsConstructor
public class GameSnapshotCodec {

    private final ObjectMapper mapper;

    public String encode(SessionSnapshot snapshot) {
        try {
            return mapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("快照序列化失败: " + snapshot.sessionId(), e);
        }
    }

    public SessionSnapshot decode(String json) {
        try {
            return mapper.readValue(json, SessionSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("快照反序列化失败", e);
        }
    }
}
