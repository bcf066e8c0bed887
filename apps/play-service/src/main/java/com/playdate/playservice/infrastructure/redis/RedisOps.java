package com.playdate.playservice.infrastructure.redis;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.Set;

/**
 * Redis 原语封装：
 * - 只提供 String / Set / ZSet / Key 级别的方法；
 * - 业务键名由各仓储的 Keys 类组织，这里不感知业务。
 */
@Component
@RequiredArgsConstructor
public class RedisOps {

    /** 对象模板：JSON 存取 */
    private final RedisTemplate<String, Object> redis;
    /** 字符串模板：索引、标记位 */
    private final StringRedisTemplate strRedis;

    // -------------- Object --------------

    public void setEx(String key, Object val, Duration ttl) {
        redis.opsForValue().set(key, val, ttl);
    }

    @SuppressWarnings("unchecked")
    public <T> T get(String key, Class<T> type) {
        Object v = redis.opsForValue().get(key);
        return (v == null) ? null : (T) v;
    }

    // -------------- String --------------

    public void setString(String key, String val, Duration ttl) {
        strRedis.opsForValue().set(key, val, ttl);
    }

    /**
     * SETNX + TTL
     * @return true 表示写入成功，false 表示键已存在
     */
    public boolean setStringNx(String key, String val, Duration ttl) {
        Boolean ok = strRedis.opsForValue().setIfAbsent(key, val, ttl);
        return Boolean.TRUE.equals(ok);
    }

    public String getString(String key) {
        return strRedis.opsForValue().get(key);
    }

    // -------------- Set --------------

    public void sAdd(String key, String member, Duration ttl) {
        strRedis.opsForSet().add(key, member);
        strRedis.expire(key, ttl);
    }

    public Set<String> sMembers(String key) {
        Set<String> members = strRedis.opsForSet().members(key);
        return members == null ? Collections.emptySet() : members;
    }

    public void sRem(String key, String member) {
        strRedis.opsForSet().remove(key, member);
    }

    // -------------- ZSet --------------

    public void zAdd(String key, String member, double score, Duration ttl) {
        strRedis.opsForZSet().add(key, member, score);
        strRedis.expire(key, ttl);
    }

    // -------------- Key --------------

    public Long del(String... keys) {
        return strRedis.delete(Arrays.asList(keys));
    }
}
