package com.playdate.playservice.realtime.domain.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.playdate.playservice.realtime.domain.model.LeaveReason;
import com.playdate.playservice.realtime.domain.model.PlayerView;

import java.util.List;

/**
 * 下行事件名与载荷定义（服务端 → 客户端）。
 * 事件统一包在 Envelope 中推送到 /user/queue/play.events。
 */
public final class PlayEvents {

    private PlayEvents() {
    }

    public static final String CONNECTED = "connected";
    public static final String SESSION_CREATED = "session_created";
    public static final String PLAYER_JOIN = "player_join";
    public static final String SESSION_STATE = "session_state";
    public static final String PLAYER_LEAVE = "player_leave";
    public static final String PLAYER_READY = "player_ready";
    public static final String GAME_UPDATE = "game_update";
    public static final String COMMUNICATION = "communication";
    public static final String PONG = "pong";
    public static final String ERROR = "error";

    public record Connected(String message) {
    }

    public record SessionCreated(String sessionId, String gameType, List<PlayerView> players) {
    }

    public record PlayerLeft(String playerId, LeaveReason reason) {
    }

    public record PlayerReady(String playerId, @JsonProperty("isReady") boolean ready) {
    }

    /**
     * @param playerAction 发起方附带的动作描述，原样转发
     */
    public record GameUpdated(Object gameData, Object playerAction, String timestamp) {
    }

    /**
     * @param toPlayer 接收方提示，仅供客户端过滤展示，服务端仍向整个会话广播
     */
    public record Communication(String message, String fromPlayer, String toPlayer,
                                String messageType, String timestamp) {
    }

    public record Pong(String timestamp) {
    }

    public record ErrorNotice(String message) {
    }
}
