package com.playdate.playservice.platform.ws;

import com.playdate.playservice.realtime.broadcast.RoomBroadcaster;
import com.playdate.playservice.realtime.connection.ConnectionHandle;
import com.playdate.playservice.realtime.domain.constants.PlayMessages;
import com.playdate.playservice.realtime.domain.event.PlayEvents;
import com.playdate.playservice.realtime.service.SessionProtocolService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;
import org.springframework.web.socket.messaging.SessionSubscribeEvent;

import java.security.Principal;

/**
 * 监听 STOMP 连接生命周期。
 *
 * - 客户端订阅事件队列时回一条 connected，作为“已连上游戏服务器”的确认；
 * - 连接断开（正常关闭、网络中断、被服务端踢下线）时交给引擎按 disconnect 处理。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebSocketSessionManager {

    /** 客户端订阅的完整地址 */
    static final String EVENTS_SUBSCRIPTION = "/user" + RoomBroadcaster.USER_DESTINATION;

    private final SessionProtocolService sessions;
    private final RoomBroadcaster broadcaster;

    @EventListener
    public void handleSubscribe(SessionSubscribeEvent event) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(event.getMessage());
        if (!EVENTS_SUBSCRIPTION.equals(accessor.getDestination()) || accessor.getSessionId() == null) {
            return;
        }
        ConnectionHandle handle = handleOf(accessor.getSessionId(), event.getUser());
        log.info("WebSocket 连接就绪: connection={}, user={}", handle.stompSessionId(), handle.principalName());
        broadcaster.sendTo(handle, null, PlayEvents.CONNECTED, new PlayEvents.Connected(PlayMessages.CONNECTED));
    }

    @EventListener
    public void handleSessionDisconnect(SessionDisconnectEvent event) {
        String stompSessionId = event.getSessionId();
        if (stompSessionId == null) {
            log.warn("收到 SessionDisconnectEvent 但缺少 sessionId");
            return;
        }
        ConnectionHandle handle = handleOf(stompSessionId, event.getUser());
        log.info("WebSocket 连接断开: connection={}, user={}, closeStatus={}",
                stompSessionId, handle.principalName(), event.getCloseStatus());
        try {
            sessions.handleDisconnect(handle);
        } catch (Exception e) {
            log.error("处理连接断开失败: connection={}", stompSessionId, e);
        }
    }

    private static ConnectionHandle handleOf(String stompSessionId, Principal user) {
        return new ConnectionHandle(stompSessionId, user != null ? user.getName() : null);
    }
}
