package com.playdate.playservice.realtime.infrastructure.redis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.playdate.playservice.infrastructure.redis.RedisOps;
import com.playdate.playservice.realtime.config.OutcomeProperties;
import com.playdate.playservice.realtime.domain.model.PlayerView;
import com.playdate.playservice.realtime.domain.model.SessionSnapshot;
import com.playdate.playservice.realtime.domain.model.SessionStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class RedisSessionOutcomeRepositoryTest {

    @Mock
    RedisOps ops;

    @Test
    void storesSnapshotJsonAndIndexesEachPlayer() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        RedisSessionOutcomeRepository repository =
                new RedisSessionOutcomeRepository(ops, mapper, new OutcomeProperties());
        SessionSnapshot snapshot = new SessionSnapshot("session-1", "chess",
                List.of(new PlayerView("alice", "Alice", true, false, "2026-01-01T00:00:00Z", "2026-01-01T00:05:00Z"),
                        new PlayerView("bob", "Bob", true, true, "2026-01-01T00:00:01Z", "2026-01-01T00:05:00Z")),
                Map.of("winner", "bob"), SessionStatus.COMPLETED, "2026-01-01T00:00:00Z", "2026-01-01T00:10:00Z");

        repository.recordSessionOutcome(snapshot);

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(ops).setString(eq("playdate:outcome:session-1"), json.capture(), eq(Duration.ofDays(30)));
        Map<?, ?> stored = mapper.readValue(json.getValue(), Map.class);
        assertThat(stored.get("status")).isEqualTo("completed");
        assertThat(((List<?>) stored.get("players"))).hasSize(2);
        assertThat(((Map<?, ?>) ((List<?>) stored.get("players")).get(0)).get("isReady")).isEqualTo(true);

        double finishedAt = 1767226200000d;
        verify(ops).zAdd("playdate:player:alice:outcomes", "session-1", finishedAt, Duration.ofDays(30));
        verify(ops).zAdd("playdate:player:bob:outcomes", "session-1", finishedAt, Duration.ofDays(30));
    }
}
