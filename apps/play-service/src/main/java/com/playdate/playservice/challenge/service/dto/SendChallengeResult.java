package com.playdate.playservice.challenge.service.dto;

/**
 * 发起挑战的结果：预分配的会话 ID 与被挑战方。
 */
public record SendChallengeResult(String sessionId, String gameType, ChallengeUserView challengedUser) {
}
