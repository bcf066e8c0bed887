package com.playdate.playservice.realtime.interfaces.ws;

import com.playdate.playservice.common.WebExceptionAdvice;
import com.playdate.playservice.realtime.broadcast.RoomBroadcaster;
import com.playdate.playservice.realtime.connection.ConnectionHandle;
import com.playdate.playservice.realtime.domain.constants.PlayMessages;
import com.playdate.playservice.realtime.domain.event.PlayEvents;
import com.playdate.playservice.realtime.domain.exception.SessionNotFoundException;
import com.playdate.playservice.realtime.interfaces.ws.dto.SessionMessages.CreateSessionCmd;
import com.playdate.playservice.realtime.interfaces.ws.dto.SessionMessages.GameUpdateCmd;
import com.playdate.playservice.realtime.interfaces.ws.dto.SessionMessages.HeartbeatCmd;
import com.playdate.playservice.realtime.interfaces.ws.dto.SessionMessages.JoinSessionCmd;
import com.playdate.playservice.realtime.interfaces.ws.dto.SessionMessages.PlayerReadyCmd;
import com.playdate.playservice.realtime.service.SessionProtocolService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;

import java.security.Principal;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SessionWsControllerTest {

    @Mock
    SessionProtocolService sessions;
    @Mock
    RoomBroadcaster broadcaster;

    private SessionWsController controller;

    @BeforeEach
    void setUp() {
        controller = new SessionWsController(sessions, broadcaster);
    }

    private static SimpMessageHeaderAccessor headers(String stompSessionId, String principal) {
        SimpMessageHeaderAccessor sha = SimpMessageHeaderAccessor.create();
        sha.setSessionId(stompSessionId);
        if (principal != null) {
            Principal user = () -> principal;
            sha.setUser(user);
        }
        return sha;
    }

    @Test
    void authenticatedIdentityOverridesPayloadPlayerId() {
        CreateSessionCmd cmd = new CreateSessionCmd();
        cmd.setGameType("chess");
        cmd.setPlayerId("someone-else");
        cmd.setPlayerName("Alice");

        controller.createSession(cmd, headers("ws-1", "alice"));

        verify(sessions).createSession("alice", "Alice", "chess", new ConnectionHandle("ws-1", "alice"));
        verifyNoInteractions(broadcaster);
    }

    @Test
    void anonymousConnectionUsesPayloadPlayerId() {
        JoinSessionCmd cmd = new JoinSessionCmd();
        cmd.setSessionId("session-1");
        cmd.setPlayerId("guest-7");

        controller.joinSession(cmd, headers("ws-2", null));

        verify(sessions).joinSession("session-1", "guest-7", null, new ConnectionHandle("ws-2", null));
    }

    @Test
    void domainFailureIsReportedToSenderOnly() {
        JoinSessionCmd cmd = new JoinSessionCmd();
        cmd.setSessionId("session-1");
        ConnectionHandle handle = new ConnectionHandle("ws-1", "carol");
        when(sessions.joinSession("session-1", "carol", null, handle))
                .thenThrow(new IllegalStateException(PlayMessages.SESSION_FULL));

        controller.joinSession(cmd, headers("ws-1", "carol"));

        verify(broadcaster).sendTo(handle, "session-1", PlayEvents.ERROR,
                new PlayEvents.ErrorNotice(PlayMessages.SESSION_FULL));
    }

    @Test
    void missingSessionIsReportedWithReason() {
        GameUpdateCmd cmd = new GameUpdateCmd();
        cmd.setSessionId("session-gone");
        cmd.setGameData("x");
        ConnectionHandle handle = new ConnectionHandle("ws-1", "alice");
        SessionNotFoundException notFound = new SessionNotFoundException("session-gone");
        when(sessions.updateGame("session-gone", "alice", "x", null, null, handle)).thenThrow(notFound);

        controller.gameUpdate(cmd, headers("ws-1", "alice"));

        verify(broadcaster).sendTo(handle, "session-gone", PlayEvents.ERROR,
                new PlayEvents.ErrorNotice(notFound.getMessage()));
    }

    @Test
    void unexpectedFailureIsMaskedWithGenericMessage() {
        PlayerReadyCmd cmd = new PlayerReadyCmd();
        cmd.setSessionId("session-1");
        cmd.setIsReady(true);
        doThrow(new NullPointerException("boom"))
                .when(sessions).setReady(eq("session-1"), eq("alice"), eq(true), any(ConnectionHandle.class));

        controller.playerReady(cmd, headers("ws-1", "alice"));

        verify(broadcaster).sendTo(any(ConnectionHandle.class), eq("session-1"), eq(PlayEvents.ERROR),
                eq(new PlayEvents.ErrorNotice(WebExceptionAdvice.INTERNAL_ERROR_MESSAGE)));
    }

    @Test
    void emptyPayloadIsRejected() {
        controller.createSession(null, headers("ws-1", "alice"));

        verifyNoInteractions(sessions);
        verify(broadcaster).sendTo(new ConnectionHandle("ws-1", "alice"), null, PlayEvents.ERROR,
                new PlayEvents.ErrorNotice(PlayMessages.MISSING_REQUIRED_DATA));
    }

    @Test
    void heartbeatWithoutBodyUsesPrincipal() {
        controller.heartbeat(null, headers("ws-1", "alice"));

        verify(sessions).heartbeat("alice", new ConnectionHandle("ws-1", "alice"));
    }

    @Test
    void anonymousHeartbeatWithoutPlayerIsAnError() {
        doThrow(new IllegalArgumentException(PlayMessages.MISSING_PLAYER))
                .when(sessions).heartbeat(null, new ConnectionHandle("ws-3", null));

        controller.heartbeat(new HeartbeatCmd(), headers("ws-3", null));

        verify(broadcaster).sendTo(new ConnectionHandle("ws-3", null), null, PlayEvents.ERROR,
                new PlayEvents.ErrorNotice(PlayMessages.MISSING_PLAYER));
    }
}
