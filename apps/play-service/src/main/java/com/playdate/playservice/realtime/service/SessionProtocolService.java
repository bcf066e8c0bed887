package com.playdate.playservice.realtime.service;

import com.playdate.playservice.realtime.connection.ConnectionHandle;
import com.playdate.playservice.realtime.domain.model.SessionSnapshot;
import com.playdate.playservice.realtime.domain.model.SessionStatus;
import com.playdate.playservice.realtime.domain.model.SessionSummary;

import java.time.Instant;
import java.util.List;

/**
 * 会话协议引擎。
 *
 * WebSocket 与 HTTP 两个入口共用这一套语义；handle 为 null 表示请求来自 HTTP，
 * 此时不登记连接，成员初始为离线。
 * 校验失败抛 IllegalArgumentException，会话不存在抛 SessionNotFoundException，
 * 状态冲突抛 IllegalStateException；成功时由引擎自己推送相应事件。
 */
public interface SessionProtocolService {

    SessionSnapshot createSession(String playerId, String playerName, String gameType, ConnectionHandle handle);

    SessionSnapshot joinSession(String sessionId, String playerId, String playerName, ConnectionHandle handle);

    LeaveResult leaveSession(String sessionId, String playerId, ConnectionHandle handle);

    void setReady(String sessionId, String playerId, Boolean isReady, ConnectionHandle handle);

    /**
     * @param requestedStatus 可空；传 completed / abandoned 时结束会话
     */
    SessionSnapshot updateGame(String sessionId, String playerId, Object gameData, Object playerAction,
                               String requestedStatus, ConnectionHandle handle);

    void communicate(String sessionId, String playerId, String message, String toPlayer,
                     String messageType, ConnectionHandle handle);

    void heartbeat(String playerId, ConnectionHandle handle);

    /** 连接断开：等同于 reason=disconnect 的离开 */
    void handleDisconnect(ConnectionHandle handle);

    /**
     * 挑战被接受后建立会话：双方成员预先写入，均为离线。
     */
    SessionSnapshot bootstrapFromChallenge(String sessionId, String gameType, List<String> playerIds);

    SessionSnapshot findSession(String sessionId);

    List<SessionSummary> listSessions(SessionStatus status);

    // ---------- 清扫任务使用 ----------

    /**
     * 玩家仍在线且 lastSeenAt 早于 staleBefore 时，按断线移除。
     * @return 是否移除
     */
    boolean evictIfStale(String sessionId, String playerId, Instant staleBefore);

    /**
     * 未结束的会话无人在线，且最近一次成员活动早于 idleBefore 时，判为 abandoned。
     * 覆盖无人认领的挑战会话，以及成员都已转到别的会话的进行中会话。
     */
    boolean abandonIfIdle(String sessionId, Instant idleBefore);

    /**
     * 终态会话结束时间早于 finishedBefore 时，从内存中回收。
     */
    boolean expireFinishedSession(String sessionId, Instant finishedBefore);
}
