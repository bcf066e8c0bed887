package com.playdate.playservice.platform.ws;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 服务端主动断开 WebSocket 连接。
 *
 * 使用场景：
 * - 同一玩家建立了新连接，旧连接被顶替；
 * - 清扫任务判定玩家心跳超时。
 */
@Slf4j
@Component
public class WebSocketDisconnectHelper {

    /** 踢下线通知的目标队列 */
    public static final String KICK_DESTINATION = "/queue/system.kick";

    private final SimpMessagingTemplate messagingTemplate;

    /** 客户端入站通道，向其投递 DISCONNECT 由框架关闭连接 */
    private final MessageChannel clientInboundChannel;

    public WebSocketDisconnectHelper(SimpMessagingTemplate messagingTemplate,
                                     @Qualifier("clientInboundChannel") MessageChannel clientInboundChannel) {
        this.messagingTemplate = messagingTemplate;
        this.clientInboundChannel = clientInboundChannel;
    }

    /**
     * 向指定连接发送踢下线通知。
     *
     * @param userRoute 用户目的地路由（Principal 名称，匿名连接为 STOMP sessionId）
     * @param stompSessionId 目标连接
     * @param reason 原因
     */
    public void sendKickMessage(String userRoute, String stompSessionId, String reason) {
        try {
            SimpMessageHeaderAccessor headerAccessor = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
            headerAccessor.setSessionId(stompSessionId);
            headerAccessor.setLeaveMutable(true);
            messagingTemplate.convertAndSendToUser(
                    userRoute,
                    KICK_DESTINATION,
                    Map.of("type", "WS_KICK", "reason", reason),
                    headerAccessor.getMessageHeaders()
            );
        } catch (Exception e) {
            log.warn("发送踢下线通知失败: user={}, stompSession={}", userRoute, stompSessionId, e);
        }
    }

    /**
     * 强制断开连接，之后框架会发布 SessionDisconnectEvent。
     */
    public void forceDisconnect(String stompSessionId) {
        try {
            StompHeaderAccessor header = StompHeaderAccessor.create(StompCommand.DISCONNECT);
            header.setSessionId(stompSessionId);
            header.setLeaveMutable(true);
            clientInboundChannel.send(MessageBuilder.createMessage(new byte[0], header.getMessageHeaders()));
        } catch (Exception e) {
            log.warn("强制断开连接失败: stompSession={}", stompSessionId, e);
        }
    }
}
