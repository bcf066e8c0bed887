package com.playdate.playservice.realtime.interfaces.ws.dto;

import lombok.Data;

/**
 * 上行指令（客户端 → 服务端），发送到 /app/{event}。
 *
 * 已认证连接上 playerId 以连接身份为准，消息体里的值被忽略；
 * 只有匿名连接（playdate.ws.require-auth=false）才读取消息体里的 playerId。
 */
public class SessionMessages {

    /** /app/create_session */
    @Data
    public static class CreateSessionCmd {
        private String gameType;
        private String playerId;
        private String playerName;
    }

    /** /app/join_session */
    @Data
    public static class JoinSessionCmd {
        private String sessionId;
        private String playerId;
        private String playerName;
    }

    /** /app/leave_session */
    @Data
    public static class LeaveSessionCmd {
        private String sessionId;
        private String playerId;
    }

    /** /app/player_ready，isReady 缺省为 false */
    @Data
    public static class PlayerReadyCmd {
        private String sessionId;
        private String playerId;
        private Boolean isReady;
    }

    /**
     * /app/game_update
     * gameData / playerAction 为游戏自定义结构，原样存储和转发；
     * status 可选，传 completed / abandoned 表示本次更新结束对局。
     */
    @Data
    public static class GameUpdateCmd {
        private String sessionId;
        private String playerId;
        private Object gameData;
        private Object playerAction;
        private String status;
    }

    /** /app/communication */
    @Data
    public static class CommunicationCmd {
        private String sessionId;
        private String playerId;
        private String message;
        private String toPlayer;
        private String messageType;
    }

    /** /app/heartbeat */
    @Data
    public static class HeartbeatCmd {
        private String playerId;
    }
}
