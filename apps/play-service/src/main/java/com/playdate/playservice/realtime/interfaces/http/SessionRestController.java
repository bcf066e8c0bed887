package com.playdate.playservice.realtime.interfaces.http;

import com.playdate.playservice.realtime.domain.model.SessionSnapshot;
import com.playdate.playservice.realtime.domain.model.SessionStatus;
import com.playdate.playservice.realtime.domain.model.SessionSummary;
import com.playdate.playservice.realtime.interfaces.http.dto.CreateSessionRequest;
import com.playdate.playservice.realtime.interfaces.http.dto.UpdateStateRequest;
import com.playdate.playservice.realtime.service.LeaveResult;
import com.playdate.playservice.realtime.service.SessionProtocolService;
import com.playdate.web.common.ApiResponse;
import com.playdate.web.common.CurrentUserHelper;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 会话 HTTP 接口
 * ----------------------------------------
 * 与 WebSocket 共用同一个会话存储与协议引擎；HTTP 调用不登记连接，
 * 通过 HTTP 加入的成员初始为离线，连上 WebSocket 并 join_session 后转为在线。
 * 对局数据更新同样会推送给会话内在线的连接。
 */
@RestController
@RequestMapping("/api/play/sessions")
@RequiredArgsConstructor
public class SessionRestController {

    private final SessionProtocolService sessions;

    @PostMapping
    public ApiResponse<SessionSnapshot> create(@AuthenticationPrincipal Jwt jwt,
                                               @Valid @RequestBody CreateSessionRequest req) {
        String playerId = CurrentUserHelper.requireUserId(jwt);
        String name = req.getPlayerName() != null ? req.getPlayerName() : CurrentUserHelper.getDisplayName(jwt);
        return ApiResponse.success(sessions.createSession(playerId, name, req.getGameType(), null));
    }

    @GetMapping("/{sessionId}")
    public ApiResponse<SessionSnapshot> get(@PathVariable("sessionId") String sessionId) {
        return ApiResponse.success(sessions.findSession(sessionId));
    }

    /**
     * 大厅列表，默认只列 waiting 会话
     */
    @GetMapping
    public ApiResponse<List<SessionSummary>> list(
            @RequestParam(value = "status", defaultValue = "waiting") String status) {
        return ApiResponse.success(sessions.listSessions(SessionStatus.fromWire(status)));
    }

    @PostMapping("/{sessionId}/join")
    public ApiResponse<SessionSnapshot> join(@AuthenticationPrincipal Jwt jwt,
                                             @PathVariable("sessionId") String sessionId) {
        String playerId = CurrentUserHelper.requireUserId(jwt);
        return ApiResponse.success(sessions.joinSession(sessionId, playerId, CurrentUserHelper.getDisplayName(jwt), null));
    }

    @PostMapping("/{sessionId}/leave")
    public ApiResponse<LeaveResult> leave(@AuthenticationPrincipal Jwt jwt,
                                          @PathVariable("sessionId") String sessionId) {
        String playerId = CurrentUserHelper.requireUserId(jwt);
        return ApiResponse.success(sessions.leaveSession(sessionId, playerId, null));
    }

    @PutMapping("/{sessionId}/state")
    public ApiResponse<SessionSnapshot> updateState(@AuthenticationPrincipal Jwt jwt,
                                                    @PathVariable("sessionId") String sessionId,
                                                    @Valid @RequestBody UpdateStateRequest req) {
        String playerId = CurrentUserHelper.requireUserId(jwt);
        return ApiResponse.success(sessions.updateGame(sessionId, playerId,
                req.getGameData(), req.getPlayerAction(), req.getStatus(), null));
    }
}
