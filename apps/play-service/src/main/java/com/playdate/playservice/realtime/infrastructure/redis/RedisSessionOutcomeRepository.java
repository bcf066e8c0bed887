package com.playdate.playservice.realtime.infrastructure.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.playdate.playservice.infrastructure.redis.RedisOps;
import com.playdate.playservice.realtime.config.OutcomeProperties;
import com.playdate.playservice.realtime.domain.model.PlayerView;
import com.playdate.playservice.realtime.domain.model.SessionSnapshot;
import com.playdate.playservice.realtime.domain.repository.SessionOutcomeRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;

/**
 * 对局结果的 Redis 实现
 * -------------------------------------------------------
 * - playdate:outcome:{sessionId}          结束时的会话快照（JSON）
 * - playdate:player:{playerId}:outcomes   玩家参与过的会话（ZSET，score=结束时间毫秒）
 * 可通过 playdate.outcome.redis.enabled=false 关闭。
 */
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "playdate.outcome.redis", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RedisSessionOutcomeRepository implements SessionOutcomeRepository {

    private final RedisOps ops;
    private final ObjectMapper objectMapper;
    private final OutcomeProperties properties;

    @Override
    public void recordSessionOutcome(SessionSnapshot snapshot) {
        String json;
        try {
            json = objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("对局结果序列化失败: " + snapshot.sessionId(), e);
        }
        ops.setString(RedisKeys.outcome(snapshot.sessionId()), json, properties.getTtl());

        double score = snapshot.finishedAt() != null
                ? Instant.parse(snapshot.finishedAt()).toEpochMilli()
                : System.currentTimeMillis();
        for (PlayerView p : snapshot.players()) {
            ops.zAdd(RedisKeys.playerOutcomes(p.id()), snapshot.sessionId(), score, properties.getTtl());
        }
    }
}
