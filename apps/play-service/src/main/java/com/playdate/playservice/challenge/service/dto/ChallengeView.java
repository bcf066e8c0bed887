package com.playdate.playservice.challenge.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 待处理挑战列表项。
 *
 * @param sent      是否为当前用户发出的挑战
 * @param createdAt ISO-8601
 */
public record ChallengeView(
        String sessionId,
        String gameType,
        @JsonProperty("isSent") boolean sent,
        ChallengeUserView challenger,
        ChallengeUserView challenged,
        String createdAt) {
}
