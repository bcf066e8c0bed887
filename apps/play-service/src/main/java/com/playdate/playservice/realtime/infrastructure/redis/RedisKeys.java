package com.playdate.playservice.realtime.infrastructure.redis;

/**
 * 会话相关 Redis Key 统一在这里拼接。
 */
public final class RedisKeys {

    private static final String PFX = "playdate:";

    private RedisKeys() {}

    // ---- 对局结果 ----
    public static String outcome(String sessionId) {
        return PFX + "outcome:" + sessionId;
    }

    /** 玩家历史对局索引（ZSET，score=结束时间） */
    public static String playerOutcomes(String playerId) {
        return PFX + "player:" + playerId + ":outcomes";
    }
}
