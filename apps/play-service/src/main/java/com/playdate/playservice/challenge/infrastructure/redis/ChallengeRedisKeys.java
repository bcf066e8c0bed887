package com.playdate.playservice.challenge.infrastructure.redis;

/**
 * 挑战相关 Redis Key。
 */
public final class ChallengeRedisKeys {

    private static final String PFX = "playdate:challenge:";

    private ChallengeRedisKeys() {}

    public static String challenge(String sessionId) {
        return PFX + sessionId;
    }

    /** 响应抢占标记 */
    public static String responded(String sessionId) {
        return PFX + sessionId + ":responded";
    }

    /** 同一对玩家的待处理挑战去重 */
    public static String pair(String challengerId, String challengedId) {
        return PFX + "pair:" + challengerId + ":" + challengedId;
    }

    public static String sentIndex(String userId) {
        return "playdate:user:" + userId + ":challenges:sent";
    }

    public static String receivedIndex(String userId) {
        return "playdate:user:" + userId + ":challenges:received";
    }
}
