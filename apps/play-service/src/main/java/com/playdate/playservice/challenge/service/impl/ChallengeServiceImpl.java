package com.playdate.playservice.challenge.service.impl;

import com.playdate.playservice.application.user.IdentityService;
import com.playdate.playservice.application.user.PlayerProfile;
import com.playdate.playservice.challenge.domain.exception.ChallengeNotFoundException;
import com.playdate.playservice.challenge.domain.model.Challenge;
import com.playdate.playservice.challenge.domain.model.ChallengeStatus;
import com.playdate.playservice.challenge.domain.repository.ChallengeRepository;
import com.playdate.playservice.challenge.service.ChallengeService;
import com.playdate.playservice.challenge.service.dto.ChallengeResponseResult;
import com.playdate.playservice.challenge.service.dto.ChallengeUserView;
import com.playdate.playservice.challenge.service.dto.ChallengeView;
import com.playdate.playservice.challenge.service.dto.PendingChallenges;
import com.playdate.playservice.challenge.service.dto.SendChallengeResult;
import com.playdate.playservice.common.ResourceNotFoundException;
import com.playdate.playservice.realtime.domain.model.SessionSnapshot;
import com.playdate.playservice.realtime.service.SessionIdGenerator;
import com.playdate.playservice.realtime.service.SessionProtocolService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 挑战服务实现。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChallengeServiceImpl implements ChallengeService {

    static final String ACCEPT = "accept";
    static final String DECLINE = "decline";

    private final ChallengeRepository challengeRepository;
    private final SessionProtocolService sessions;
    private final IdentityService identityService;
    private final SessionIdGenerator idGenerator;
    private final Clock clock;

    @Override
    public SendChallengeResult send(String challengerId, String challengedUserId, String gameType) {
        if (StringUtils.isAnyBlank(challengerId, challengedUserId, gameType)) {
            throw new IllegalArgumentException("缺少 challengedUserId 或 gameType");
        }
        if (challengerId.equals(challengedUserId)) {
            throw new IllegalArgumentException("不能挑战自己");
        }
        PlayerProfile challenged = identityService.resolveProfile(challengedUserId)
                .orElseThrow(() -> new ResourceNotFoundException("用户不存在: " + challengedUserId));

        String sessionId = idGenerator.next();
        if (!challengeRepository.reservePair(challengerId, challengedUserId, sessionId)) {
            throw new IllegalStateException("挑战已发送，请等待对方响应");
        }
        Challenge challenge = Challenge.builder()
                .sessionId(sessionId)
                .challengerId(challengerId)
                .challengedId(challengedUserId)
                .gameType(gameType.trim())
                .status(ChallengeStatus.PENDING)
                .createdAt(clock.millis())
                .build();
        challengeRepository.save(challenge);
        log.info("发起挑战: sessionId={}, challenger={}, challenged={}, gameType={}",
                sessionId, challengerId, challengedUserId, challenge.getGameType());
        return new SendChallengeResult(sessionId, challenge.getGameType(),
                new ChallengeUserView(challenged.id(), challenged.name()));
    }

    @Override
    public ChallengeResponseResult respond(String sessionId, String userId, String response) {
        if (StringUtils.isAnyBlank(sessionId, userId)) {
            throw new IllegalArgumentException("缺少 sessionId");
        }
        String normalized = StringUtils.trimToEmpty(response).toLowerCase(Locale.ROOT);
        if (!ACCEPT.equals(normalized) && !DECLINE.equals(normalized)) {
            throw new IllegalArgumentException("response 只能是 accept 或 decline");
        }

        Challenge challenge = challengeRepository.find(sessionId)
                .orElseThrow(() -> new ChallengeNotFoundException(sessionId));
        if (!userId.equals(challenge.getChallengedId())) {
            throw new IllegalStateException("只有被挑战者可以响应该挑战");
        }
        if (!challenge.isPending() || !challengeRepository.claimResponse(sessionId)) {
            throw new IllegalStateException("挑战已被响应");
        }

        boolean accepted = ACCEPT.equals(normalized);
        challenge.setStatus(accepted ? ChallengeStatus.ACCEPTED : ChallengeStatus.DECLINED);
        challenge.setRespondedAt(clock.millis());
        challengeRepository.save(challenge);
        challengeRepository.releasePair(challenge.getChallengerId(), challenge.getChallengedId());
        log.info("挑战已{}: sessionId={}, challenger={}, challenged={}",
                accepted ? "接受" : "拒绝", sessionId, challenge.getChallengerId(), userId);

        SessionSnapshot session = null;
        if (accepted) {
            session = sessions.bootstrapFromChallenge(sessionId, challenge.getGameType(),
                    List.of(challenge.getChallengerId(), challenge.getChallengedId()));
        }
        return new ChallengeResponseResult(sessionId, challenge.getStatus(), session);
    }

    @Override
    public PendingChallenges pending(String userId) {
        if (StringUtils.isBlank(userId)) {
            throw new IllegalArgumentException("缺少调用方身份");
        }
        Map<String, ChallengeUserView> names = new HashMap<>();
        List<ChallengeView> sent = challengeRepository.findSent(userId).stream()
                .filter(Challenge::isPending)
                .map(c -> toView(c, true, names))
                .toList();
        List<ChallengeView> received = challengeRepository.findReceived(userId).stream()
                .filter(Challenge::isPending)
                .map(c -> toView(c, false, names))
                .toList();
        return new PendingChallenges(sent, received);
    }

    private ChallengeView toView(Challenge c, boolean sent, Map<String, ChallengeUserView> names) {
        return new ChallengeView(c.getSessionId(), c.getGameType(), sent,
                userView(c.getChallengerId(), names), userView(c.getChallengedId(), names),
                Instant.ofEpochMilli(c.getCreatedAt()).toString());
    }

    /** 同一次查询内按用户缓存展示名；查不到时用 ID 兜底 */
    private ChallengeUserView userView(String userId, Map<String, ChallengeUserView> names) {
        return names.computeIfAbsent(userId, id -> identityService.resolveProfile(id)
                .map(p -> new ChallengeUserView(id, p.name()))
                .orElseGet(() -> new ChallengeUserView(id, id)));
    }
}
