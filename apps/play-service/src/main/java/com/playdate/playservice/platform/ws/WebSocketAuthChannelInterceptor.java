package com.playdate.playservice.platform.ws;

import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.security.oauth2.server.resource.authentication.JwtGrantedAuthoritiesConverter;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

/**
 * STOMP CONNECT 认证拦截器。
 *
 * 在 CONNECT 阶段校验 JWT，并把 Principal 绑定到这条 STOMP 会话上；
 * Principal 名称取 JWT subject，即平台内的玩家 ID。后续所有上行消息都以它为准，
 * 消息体里的 playerId 会被忽略。
 *
 * playdate.ws.require-auth=true（默认）时，缺少或无效的 Token 直接拒绝 CONNECT。
 */
@Slf4j
@Component
public class WebSocketAuthChannelInterceptor implements ChannelInterceptor {

    private final JwtDecoder jwtDecoder;
    private final WsProperties wsProperties;
    private final JwtGrantedAuthoritiesConverter authoritiesConverter = new JwtGrantedAuthoritiesConverter();

    public WebSocketAuthChannelInterceptor(JwtDecoder jwtDecoder, WsProperties wsProperties) {
        this.jwtDecoder = jwtDecoder;
        this.wsProperties = wsProperties;
    }

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null || !StompCommand.CONNECT.equals(accessor.getCommand())) {
            return message;
        }

        String token = extractToken(accessor);
        if (token == null) {
            if (wsProperties.isRequireAuth()) {
                throw new MessageDeliveryException(message, "缺少认证 Token");
            }
            log.debug("匿名 STOMP 连接: session={}", accessor.getSessionId());
            return message;
        }

        try {
            Jwt jwt = jwtDecoder.decode(token);
            Collection<GrantedAuthority> authorities = authoritiesConverter.convert(jwt);
            accessor.setUser(new JwtAuthenticationToken(jwt, authorities, jwt.getSubject()));
        } catch (JwtException e) {
            log.info("STOMP CONNECT Token 校验失败: session={}, reason={}", accessor.getSessionId(), e.getMessage());
            if (wsProperties.isRequireAuth()) {
                throw new MessageDeliveryException(message, "认证 Token 无效");
            }
        }
        return message;
    }

    /**
     * 支持 Authorization: Bearer xxx 或 access_token: xxx 两种写法
     */
    private static String extractToken(StompHeaderAccessor accessor) {
        String auth = firstHeader(accessor, "Authorization");
        if (auth == null) auth = firstHeader(accessor, "authorization");
        if (auth != null && auth.regionMatches(true, 0, "Bearer ", 0, 7)) {
            String token = auth.substring(7).trim();
            return token.isEmpty() ? null : token;
        }
        String tokenOnly = firstHeader(accessor, "access_token");
        return (tokenOnly == null || tokenOnly.isBlank()) ? null : tokenOnly.trim();
    }

    private static String firstHeader(StompHeaderAccessor accessor, String key) {
        List<String> vals = accessor.getNativeHeader(key);
        return (vals == null || vals.isEmpty()) ? null : vals.get(0);
    }
}
