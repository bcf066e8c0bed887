package com.playdate.playservice.challenge.service;

import com.playdate.playservice.challenge.service.dto.ChallengeResponseResult;
import com.playdate.playservice.challenge.service.dto.PendingChallenges;
import com.playdate.playservice.challenge.service.dto.SendChallengeResult;

/**
 * 挑战：异步邀请，被接受后建立一个双人会话。
 */
public interface ChallengeService {

    /**
     * 发起挑战。
     * 被挑战用户不存在 → ResourceNotFoundException；对同一用户已有待处理挑战 → IllegalStateException。
     */
    SendChallengeResult send(String challengerId, String challengedUserId, String gameType);

    /**
     * 响应挑战（accept / decline），只有被挑战方可以响应，且只能响应一次。
     */
    ChallengeResponseResult respond(String sessionId, String userId, String response);

    /** 当前用户发出与收到的待处理挑战 */
    PendingChallenges pending(String userId);
}
