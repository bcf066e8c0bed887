package com.playdate.playservice.realtime.interfaces.ws;

import com.playdate.playservice.common.ResourceNotFoundException;
import com.playdate.playservice.common.WebExceptionAdvice;
import com.playdate.playservice.realtime.broadcast.RoomBroadcaster;
import com.playdate.playservice.realtime.connection.ConnectionHandle;
import com.playdate.playservice.realtime.domain.constants.PlayMessages;
import com.playdate.playservice.realtime.domain.event.PlayEvents;
import com.playdate.playservice.realtime.interfaces.ws.dto.SessionMessages.CommunicationCmd;
import com.playdate.playservice.realtime.interfaces.ws.dto.SessionMessages.CreateSessionCmd;
import com.playdate.playservice.realtime.interfaces.ws.dto.SessionMessages.GameUpdateCmd;
import com.playdate.playservice.realtime.interfaces.ws.dto.SessionMessages.HeartbeatCmd;
import com.playdate.playservice.realtime.interfaces.ws.dto.SessionMessages.JoinSessionCmd;
import com.playdate.playservice.realtime.interfaces.ws.dto.SessionMessages.LeaveSessionCmd;
import com.playdate.playservice.realtime.interfaces.ws.dto.SessionMessages.PlayerReadyCmd;
import com.playdate.playservice.realtime.service.SessionProtocolService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

import java.security.Principal;

/**
 * 会话协议 WebSocket 入口
 * ----------------------------------------
 * 客户端通过 STOMP 发送到 /app/{event}，这里只做身份解析与错误转换，
 * 语义全部在 SessionProtocolService 中。
 *
 * 处理失败不会断开连接，只向发送方单播 error 事件：
 *   - 参数缺失 / 会话不存在 / 状态冲突：返回具体原因；
 *   - 其他异常：返回通用提示，完整堆栈写日志。
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class SessionWsController {

    private final SessionProtocolService sessions;
    private final RoomBroadcaster broadcaster;

    @MessageMapping("/create_session")
    public void createSession(CreateSessionCmd cmd, SimpMessageHeaderAccessor sha) {
        ConnectionHandle handle = handleOf(sha);
        try {
            requirePayload(cmd);
            sessions.createSession(playerIdOf(sha, cmd.getPlayerId()), cmd.getPlayerName(), cmd.getGameType(), handle);
        } catch (Exception e) {
            sendError(handle, null, "create_session", e);
        }
    }

    @MessageMapping("/join_session")
    public void joinSession(JoinSessionCmd cmd, SimpMessageHeaderAccessor sha) {
        ConnectionHandle handle = handleOf(sha);
        String sessionId = cmd == null ? null : cmd.getSessionId();
        try {
            requirePayload(cmd);
            sessions.joinSession(sessionId, playerIdOf(sha, cmd.getPlayerId()), cmd.getPlayerName(), handle);
        } catch (Exception e) {
            sendError(handle, sessionId, "join_session", e);
        }
    }

    @MessageMapping("/leave_session")
    public void leaveSession(LeaveSessionCmd cmd, SimpMessageHeaderAccessor sha) {
        ConnectionHandle handle = handleOf(sha);
        String sessionId = cmd == null ? null : cmd.getSessionId();
        try {
            requirePayload(cmd);
            sessions.leaveSession(sessionId, playerIdOf(sha, cmd.getPlayerId()), handle);
        } catch (Exception e) {
            sendError(handle, sessionId, "leave_session", e);
        }
    }

    @MessageMapping("/player_ready")
    public void playerReady(PlayerReadyCmd cmd, SimpMessageHeaderAccessor sha) {
        ConnectionHandle handle = handleOf(sha);
        String sessionId = cmd == null ? null : cmd.getSessionId();
        try {
            requirePayload(cmd);
            sessions.setReady(sessionId, playerIdOf(sha, cmd.getPlayerId()), cmd.getIsReady(), handle);
        } catch (Exception e) {
            sendError(handle, sessionId, "player_ready", e);
        }
    }

    @MessageMapping("/game_update")
    public void gameUpdate(GameUpdateCmd cmd, SimpMessageHeaderAccessor sha) {
        ConnectionHandle handle = handleOf(sha);
        String sessionId = cmd == null ? null : cmd.getSessionId();
        try {
            requirePayload(cmd);
            sessions.updateGame(sessionId, playerIdOf(sha, cmd.getPlayerId()),
                    cmd.getGameData(), cmd.getPlayerAction(), cmd.getStatus(), handle);
        } catch (Exception e) {
            sendError(handle, sessionId, "game_update", e);
        }
    }

    @MessageMapping("/communication")
    public void communication(CommunicationCmd cmd, SimpMessageHeaderAccessor sha) {
        ConnectionHandle handle = handleOf(sha);
        String sessionId = cmd == null ? null : cmd.getSessionId();
        try {
            requirePayload(cmd);
            sessions.communicate(sessionId, playerIdOf(sha, cmd.getPlayerId()),
                    cmd.getMessage(), cmd.getToPlayer(), cmd.getMessageType(), handle);
        } catch (Exception e) {
            sendError(handle, sessionId, "communication", e);
        }
    }

    @MessageMapping("/heartbeat")
    public void heartbeat(HeartbeatCmd cmd, SimpMessageHeaderAccessor sha) {
        ConnectionHandle handle = handleOf(sha);
        try {
            sessions.heartbeat(playerIdOf(sha, cmd == null ? null : cmd.getPlayerId()), handle);
        } catch (Exception e) {
            sendError(handle, null, "heartbeat", e);
        }
    }

    // ---------------- 工具方法 ----------------

    static ConnectionHandle handleOf(SimpMessageHeaderAccessor sha) {
        Principal user = sha.getUser();
        return new ConnectionHandle(sha.getSessionId(), user != null ? user.getName() : null);
    }

    /** 已认证连接以 Principal 为准 */
    private static String playerIdOf(SimpMessageHeaderAccessor sha, String payloadPlayerId) {
        Principal user = sha.getUser();
        return user != null ? user.getName() : payloadPlayerId;
    }

    private static void requirePayload(Object cmd) {
        if (cmd == null) {
            throw new IllegalArgumentException(PlayMessages.MISSING_REQUIRED_DATA);
        }
    }

    private void sendError(ConnectionHandle handle, String sessionId, String event, Exception e) {
        String message;
        if (e instanceof IllegalArgumentException || e instanceof IllegalStateException
                || e instanceof ResourceNotFoundException) {
            log.debug("{} 处理失败: connection={}, sessionId={}, reason={}",
                    event, handle.stompSessionId(), sessionId, e.getMessage());
            message = e.getMessage();
        } else {
            log.error("{} 处理异常: connection={}, sessionId={}", event, handle.stompSessionId(), sessionId, e);
            message = WebExceptionAdvice.INTERNAL_ERROR_MESSAGE;
        }
        broadcaster.sendTo(handle, sessionId, PlayEvents.ERROR, new PlayEvents.ErrorNotice(message));
    }
}
