package com.playdate.playservice.application.user;

import com.playdate.playservice.infrastructure.redis.RedisOps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * 玩家展示名缓存：playdate:player:{playerId}:name → 展示名（纯字符串）。
 * 会话里只用得到展示名，不缓存完整的用户档案。
 * Redis 不可用时按未命中处理。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlayerProfileCache {

    static final Duration TTL = Duration.ofHours(2);

    private final RedisOps redisOps;

    static String nameKey(String playerId) {
        return "playdate:player:" + playerId + ":name";
    }

    public Optional<PlayerProfile> get(String playerId) {
        try {
            String name = redisOps.getString(nameKey(playerId));
            return StringUtils.isBlank(name) ? Optional.empty() : Optional.of(new PlayerProfile(playerId, name));
        } catch (DataAccessException e) {
            log.warn("读取玩家展示名缓存失败 playerId={}", playerId, e);
            return Optional.empty();
        }
    }

    public void put(PlayerProfile profile) {
        if (profile == null || StringUtils.isAnyBlank(profile.id(), profile.name())) {
            return;
        }
        try {
            redisOps.setString(nameKey(profile.id()), profile.name(), TTL);
        } catch (DataAccessException e) {
            log.warn("写入玩家展示名缓存失败 playerId={}", profile.id(), e);
        }
    }
}
