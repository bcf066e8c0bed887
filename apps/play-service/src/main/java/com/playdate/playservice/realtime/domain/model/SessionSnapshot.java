package com.playdate.playservice.realtime.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 会话完整快照：session_state 事件载荷、HTTP 查询结果、对局结果落库内容。
 *
 * @param gameData   游戏自定义数据，服务端不解析；首次更新前输出 null
 * @param finishedAt 进入终态的时间，未结束时不输出
 */
public record SessionSnapshot(
        String sessionId,
        String gameType,
        List<PlayerView> players,
        Object gameData,
        SessionStatus status,
        String createdAt,
        @JsonInclude(JsonInclude.Include.NON_NULL) String finishedAt) {

    public boolean hasPlayer(String playerId) {
        return players.stream().anyMatch(p -> p.id().equals(playerId));
    }
}
