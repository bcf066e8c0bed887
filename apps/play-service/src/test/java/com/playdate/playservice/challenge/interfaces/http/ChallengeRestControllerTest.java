package com.playdate.playservice.challenge.interfaces.http;

import com.playdate.playservice.challenge.domain.model.ChallengeStatus;
import com.playdate.playservice.challenge.service.ChallengeService;
import com.playdate.playservice.challenge.service.dto.ChallengeResponseResult;
import com.playdate.playservice.challenge.service.dto.ChallengeUserView;
import com.playdate.playservice.challenge.service.dto.SendChallengeResult;
import com.playdate.playservice.common.ResourceNotFoundException;
import com.playdate.playservice.common.WebExceptionAdvice;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.security.web.method.annotation.AuthenticationPrincipalArgumentResolver;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ChallengeRestControllerTest {

    @Mock
    ChallengeService challengeService;

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders.standaloneSetup(new ChallengeRestController(challengeService))
                .setControllerAdvice(new WebExceptionAdvice())
                .setCustomArgumentResolvers(new AuthenticationPrincipalArgumentResolver())
                .build();
        Jwt jwt = Jwt.withTokenValue("t").header("alg", "none").subject("alice").build();
        SecurityContextHolder.getContext().setAuthentication(new JwtAuthenticationToken(jwt));
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void sendReturnsAllocatedSession() throws Exception {
        when(challengeService.send("alice", "bob", "chess"))
                .thenReturn(new SendChallengeResult("session-1", "chess", new ChallengeUserView("bob", "Bob")));

        mvc.perform(post("/api/play/challenges").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"challengedUserId\":\"bob\",\"gameType\":\"chess\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.sessionId").value("session-1"))
                .andExpect(jsonPath("$.data.challengedUser.name").value("Bob"));
    }

    @Test
    void blankFieldsAreBadRequest() throws Exception {
        mvc.perform(post("/api/play/challenges").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"challengedUserId\":\"\",\"gameType\":\"chess\"}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(challengeService);
    }

    @Test
    void unknownUserIsNotFound() throws Exception {
        when(challengeService.send("alice", "ghost", "chess")).thenThrow(new ResourceNotFoundException("用户不存在: ghost"));

        mvc.perform(post("/api/play/challenges").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"challengedUserId\":\"ghost\",\"gameType\":\"chess\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void duplicateResponseIsConflict() throws Exception {
        when(challengeService.respond("session-1", "alice", "accept"))
                .thenThrow(new IllegalStateException("挑战已被响应"));

        mvc.perform(post("/api/play/challenges/session-1/respond").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"response\":\"accept\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("挑战已被响应"));
    }

    @Test
    void declineHasNoSessionInBody() throws Exception {
        when(challengeService.respond("session-1", "alice", "decline"))
                .thenReturn(new ChallengeResponseResult("session-1", ChallengeStatus.DECLINED, null));

        mvc.perform(post("/api/play/challenges/session-1/respond").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"response\":\"decline\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("declined"))
                .andExpect(jsonPath("$.data.session").doesNotExist());
    }

    @Test
    void unexpectedFailureHidesDetails() throws Exception {
        when(challengeService.send("alice", "bob", "chess")).thenThrow(new NullPointerException("secret"));

        mvc.perform(post("/api/play/challenges").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"challengedUserId\":\"bob\",\"gameType\":\"chess\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value(WebExceptionAdvice.INTERNAL_ERROR_MESSAGE));
    }
}
