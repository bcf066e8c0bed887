package com.playdate.playservice.challenge.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 挑战状态。PENDING 即会话生命周期中的 pending 阶段：会话 ID 已分配，会话尚未建立。
 */
public enum ChallengeStatus {
    PENDING,
    ACCEPTED,
    DECLINED;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }
}
