package com.playdate.playservice.realtime.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 大厅列表项：不含对局数据与成员身份。
 */
public record SessionSummary(
        String id,
        String gameType,
        @JsonProperty("players") int playerCount,
        int maxPlayers,
        SessionStatus status,
        String createdAt) {
}
