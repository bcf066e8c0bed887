package com.playdate.playservice.challenge.service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.playdate.playservice.challenge.domain.model.ChallengeStatus;
import com.playdate.playservice.realtime.domain.model.SessionSnapshot;

/**
 * 响应挑战的结果。接受时附带新建立的会话快照，拒绝时 session 为 null。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChallengeResponseResult(String sessionId, ChallengeStatus status, SessionSnapshot session) {
}
