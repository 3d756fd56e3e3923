package com.arenahub.gameservice.infrastructure.redis;

import com.arenahub.gameservice.domain.dto.SessionSnapshot;
import com.arenahub.gameservice.engine.core.GameState;
import com.arenahub.gameservice.engine.state.SumoState;
import com.arenahub.gameservice.infrastructure.codec.GameSnapshotCodec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisSessionSnapshotRepositoryTest {

    @Mock
    private RedisOps ops;
    @Mock
    private GameSnapshotCodec codec;
    @InjectMocks
    private RedisSessionSnapshotRepository repo;

    private final SessionSnapshot snap = new SessionSnapshot("abc", "sumo", List.of("p1", "p2"),
            Map.of("seed", 1), new GameState(0, "tachiai", new SumoState()), 10L);

    @Test
    void saveWritesEncodedSnapshotUnderSessionKeyWithTtl() {
        when(codec.encode(snap)).thenReturn("{json}");

        repo.save(snap, Duration.ofHours(48));

        verify(ops).setString("arena:session:abc:snapshot", "{json}", Duration.ofHours(48));
    }

    @Test
    void findDecodesStoredText() {
        when(ops.getString("arena:session:abc:snapshot")).thenReturn("{json}");
        when(codec.decode("{json}")).thenReturn(snap);

        assertThat(repo.find("abc")).contains(snap);
    }

    @Test
    void missingKeyIsEmpty() {
        when(ops.getString("arena:session:nope:snapshot")).thenReturn(null);
        assertThat(repo.find("nope")).isEmpty();
    }

    @Test
    void deleteRemovesTheKey() {
        when(ops.del("arena:session:abc:snapshot")).thenReturn(false);
        repo.delete("abc");
        verify(ops).del("arena:session:abc:snapshot");
    }
}
