package com.playdate.playservice.platform.ws;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.security.oauth2.jwt.BadJwtException;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WebSocketAuthChannelInterceptorTest {

    @Mock
    JwtDecoder jwtDecoder;
    @Mock
    MessageChannel channel;

    private WsProperties properties;
    private WebSocketAuthChannelInterceptor interceptor;

    @BeforeEach
    void setUp() {
        properties = new WsProperties();
        interceptor = new WebSocketAuthChannelInterceptor(jwtDecoder, properties);
    }

    private static StompHeaderAccessor accessor(StompCommand command, String header, String value) {
        StompHeaderAccessor accessor = StompHeaderAccessor.create(command);
        accessor.setSessionId("ws-1");
        if (header != null) {
            accessor.setNativeHeader(header, value);
        }
        accessor.setLeaveMutable(true);
        return accessor;
    }

    private static Message<byte[]> message(StompHeaderAccessor accessor) {
        return MessageBuilder.createMessage(new byte[0], accessor.getMessageHeaders());
    }

    @Test
    void bearerTokenBindsSubjectAsPrincipal() {
        Jwt jwt = Jwt.withTokenValue("good").header("alg", "none").subject("player-42").build();
        when(jwtDecoder.decode("good")).thenReturn(jwt);
        StompHeaderAccessor accessor = accessor(StompCommand.CONNECT, "Authorization", "Bearer good");

        interceptor.preSend(message(accessor), channel);

        assertThat(accessor.getUser()).isNotNull();
        assertThat(accessor.getUser().getName()).isEqualTo("player-42");
    }

    @Test
    void accessTokenHeaderIsAccepted() {
        Jwt jwt = Jwt.withTokenValue("good").header("alg", "none").subject("player-7").build();
        when(jwtDecoder.decode("good")).thenReturn(jwt);
        StompHeaderAccessor accessor = accessor(StompCommand.CONNECT, "access_token", "good");

        interceptor.preSend(message(accessor), channel);

        assertThat(accessor.getUser().getName()).isEqualTo("player-7");
    }

    @Test
    void missingTokenIsRejectedWhenAuthRequired() {
        StompHeaderAccessor accessor = accessor(StompCommand.CONNECT, null, null);

        assertThatThrownBy(() -> interceptor.preSend(message(accessor), channel))
                .isInstanceOf(MessageDeliveryException.class);
    }

    @Test
    void invalidTokenIsRejectedWhenAuthRequired() {
        when(jwtDecoder.decode("bad")).thenThrow(new BadJwtException("expired"));
        StompHeaderAccessor accessor = accessor(StompCommand.CONNECT, "Authorization", "Bearer bad");

        assertThatThrownBy(() -> interceptor.preSend(message(accessor), channel))
                .isInstanceOf(MessageDeliveryException.class);
    }

    @Test
    void anonymousConnectAllowedWhenAuthOptional() {
        properties.setRequireAuth(false);
        StompHeaderAccessor accessor = accessor(StompCommand.CONNECT, null, null);

        Message<?> result = interceptor.preSend(message(accessor), channel);

        assertThat(result).isNotNull();
        assertThat(accessor.getUser()).isNull();
    }

    @Test
    void nonConnectFramesPassThrough() {
        StompHeaderAccessor accessor = accessor(StompCommand.SEND, null, null);

        interceptor.preSend(message(accessor), channel);

        verifyNoInteractions(jwtDecoder);
    }
}
