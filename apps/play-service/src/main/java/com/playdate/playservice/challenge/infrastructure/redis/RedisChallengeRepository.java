package com.playdate.playservice.challenge.infrastructure.redis;

import com.playdate.playservice.challenge.domain.model.Challenge;
import com.playdate.playservice.challenge.domain.repository.ChallengeRepository;
import com.playdate.playservice.infrastructure.redis.RedisOps;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 挑战记录的 Redis 实现
 * -------------------------------------------------------
 * - 记录本体 JSON，带 TTL；
 * - 双方的发出/收到索引为 SET，过期记录在读取时顺带清理；
 * - 去重与响应抢占用 SETNX。
 */
@Repository
@RequiredArgsConstructor
public class RedisChallengeRepository implements ChallengeRepository {

    /** 挑战记录保留时长 */
    static final Duration TTL = Duration.ofDays(7);

    private final RedisOps ops;

    @Override
    public boolean reservePair(String challengerId, String challengedId, String sessionId) {
        return ops.setStringNx(ChallengeRedisKeys.pair(challengerId, challengedId), sessionId, TTL);
    }

    @Override
    public void releasePair(String challengerId, String challengedId) {
        ops.del(ChallengeRedisKeys.pair(challengerId, challengedId));
    }

    @Override
    public void save(Challenge challenge) {
        ops.setEx(ChallengeRedisKeys.challenge(challenge.getSessionId()), challenge, TTL);
        ops.sAdd(ChallengeRedisKeys.sentIndex(challenge.getChallengerId()), challenge.getSessionId(), TTL);
        ops.sAdd(ChallengeRedisKeys.receivedIndex(challenge.getChallengedId()), challenge.getSessionId(), TTL);
    }

    @Override
    public Optional<Challenge> find(String sessionId) {
        return Optional.ofNullable(ops.get(ChallengeRedisKeys.challenge(sessionId), Challenge.class));
    }

    @Override
    public boolean claimResponse(String sessionId) {
        return ops.setStringNx(ChallengeRedisKeys.responded(sessionId), "1", TTL);
    }

    @Override
    public List<Challenge> findSent(String userId) {
        return loadIndex(ChallengeRedisKeys.sentIndex(userId));
    }

    @Override
    public List<Challenge> findReceived(String userId) {
        return loadIndex(ChallengeRedisKeys.receivedIndex(userId));
    }

    private List<Challenge> loadIndex(String indexKey) {
        Set<String> ids = ops.sMembers(indexKey);
        List<Challenge> out = new ArrayList<>(ids.size());
        for (String id : ids) {
            Optional<Challenge> c = find(id);
            if (c.isPresent()) {
                out.add(c.get());
            } else {
                // 记录已过期
                ops.sRem(indexKey, id);
            }
        }
        out.sort(Comparator.comparingLong(Challenge::getCreatedAt).reversed());
        return out;
    }
}
