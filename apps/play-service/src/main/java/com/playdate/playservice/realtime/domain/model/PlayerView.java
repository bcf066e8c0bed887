package com.playdate.playservice.realtime.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 玩家成员的对外形态（player_join 载荷、session_state.players 元素）。
 */
public record PlayerView(
        String id,
        String name,
        @JsonProperty("isReady") boolean ready,
        @JsonProperty("isConnected") boolean connected,
        @JsonProperty("joined_at") String joinedAt,
        @JsonProperty("last_seen") String lastSeen) {
}
