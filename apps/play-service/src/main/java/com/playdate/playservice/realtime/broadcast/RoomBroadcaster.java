package com.playdate.playservice.realtime.broadcast;

import com.playdate.playservice.platform.transport.Envelope;
import com.playdate.playservice.realtime.connection.ConnectionHandle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 会话房间广播器。
 *
 * 维护 sessionId → 连接集合，消息按连接逐一投递到该连接的用户目的地
 * （/user/queue/play.events，带 simpSessionId 头，只命中这一条 STOMP 会话）。
 * 投递是尽力而为、至多一次：失败只记日志，不向调用方抛出。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoomBroadcaster {

    /** 客户端订阅地址（去掉 /user 前缀后的部分） */
    public static final String USER_DESTINATION = "/queue/play.events";

    private final SimpMessagingTemplate messaging;
    private final Clock clock;

    private final ConcurrentMap<String, Set<ConnectionHandle>> rooms = new ConcurrentHashMap<>();

    public void join(String sessionId, ConnectionHandle handle) {
        rooms.computeIfAbsent(sessionId, k -> ConcurrentHashMap.newKeySet()).add(handle);
    }

    public void leave(String sessionId, ConnectionHandle handle) {
        rooms.computeIfPresent(sessionId, (k, members) -> {
            members.remove(handle);
            return members.isEmpty() ? null : members;
        });
    }

    /** 连接断开时从所有房间移除 */
    public void leaveAll(ConnectionHandle handle) {
        for (String sessionId : rooms.keySet()) {
            leave(sessionId, handle);
        }
    }

    public void dissolve(String sessionId) {
        rooms.remove(sessionId);
    }

    public Set<ConnectionHandle> members(String sessionId) {
        Set<ConnectionHandle> members = rooms.get(sessionId);
        return members == null ? Collections.emptySet() : Set.copyOf(members);
    }

    /**
     * 向会话房间广播。
     *
     * @param exclude 不接收本条消息的连接（通常是发起方），可空
     */
    public void broadcast(String sessionId, String event, Object payload, ConnectionHandle exclude) {
        for (ConnectionHandle handle : members(sessionId)) {
            if (!Objects.equals(handle, exclude)) {
                deliver(handle, sessionId, event, payload);
            }
        }
    }

    public void broadcast(String sessionId, String event, Object payload) {
        broadcast(sessionId, event, payload, null);
    }

    /** 单播给一条连接 */
    public void sendTo(ConnectionHandle handle, String sessionId, String event, Object payload) {
        if (handle != null) {
            deliver(handle, sessionId, event, payload);
        }
    }

    private void deliver(ConnectionHandle handle, String sessionId, String event, Object payload) {
        try {
            SimpMessageHeaderAccessor headers = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
            headers.setSessionId(handle.stompSessionId());
            headers.setLeaveMutable(true);
            messaging.convertAndSendToUser(handle.userRoute(), USER_DESTINATION,
                    Envelope.of(event, sessionId, payload, clock.millis()),
                    headers.getMessageHeaders());
        } catch (Exception e) {
            log.warn("推送失败: event={}, sessionId={}, connection={}", event, sessionId, handle.stompSessionId(), e);
        }
    }
}
