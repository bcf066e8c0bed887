package com.playdate.playservice.challenge.interfaces.http;

import com.playdate.playservice.challenge.interfaces.http.dto.RespondChallengeRequest;
import com.playdate.playservice.challenge.interfaces.http.dto.SendChallengeRequest;
import com.playdate.playservice.challenge.service.ChallengeService;
import com.playdate.playservice.challenge.service.dto.ChallengeResponseResult;
import com.playdate.playservice.challenge.service.dto.PendingChallenges;
import com.playdate.playservice.challenge.service.dto.SendChallengeResult;
import com.playdate.web.common.ApiResponse;
import com.playdate.web.common.CurrentUserHelper;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 挑战 HTTP 接口。接受挑战后，双方用返回的 sessionId 通过 WebSocket join_session 进入对局。
 */
@RestController
@RequestMapping("/api/play/challenges")
@RequiredArgsConstructor
public class ChallengeRestController {

    private final ChallengeService challengeService;

    @PostMapping
    public ApiResponse<SendChallengeResult> send(@AuthenticationPrincipal Jwt jwt,
                                                 @Valid @RequestBody SendChallengeRequest req) {
        String userId = CurrentUserHelper.requireUserId(jwt);
        return ApiResponse.success("挑战已发送",
                challengeService.send(userId, req.getChallengedUserId(), req.getGameType()));
    }

    @PostMapping("/{sessionId}/respond")
    public ApiResponse<ChallengeResponseResult> respond(@AuthenticationPrincipal Jwt jwt,
                                                        @PathVariable("sessionId") String sessionId,
                                                        @Valid @RequestBody RespondChallengeRequest req) {
        String userId = CurrentUserHelper.requireUserId(jwt);
        return ApiResponse.success(challengeService.respond(sessionId, userId, req.getResponse()));
    }

    @GetMapping("/pending")
    public ApiResponse<PendingChallenges> pending(@AuthenticationPrincipal Jwt jwt) {
        return ApiResponse.success(challengeService.pending(CurrentUserHelper.requireUserId(jwt)));
    }
}
