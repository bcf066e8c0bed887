package com.playdate.playservice.challenge.domain.repository;

import com.playdate.playservice.challenge.domain.model.Challenge;

import java.util.List;
import java.util.Optional;

/**
 * 挑战记录仓储：只做存取与原子标记，不承载业务规则。
 */
public interface ChallengeRepository {

    /**
     * 占用“发起方 → 被挑战方”的待处理名额。
     * @return false 表示已有一条待处理的挑战
     */
    boolean reservePair(String challengerId, String challengedId, String sessionId);

    void releasePair(String challengerId, String challengedId);

    /** 保存并维护双方的发出/收到索引 */
    void save(Challenge challenge);

    Optional<Challenge> find(String sessionId);

    /**
     * 抢占响应权，并发响应时只有第一个成功。
     */
    boolean claimResponse(String sessionId);

    List<Challenge> findSent(String userId);

    List<Challenge> findReceived(String userId);
}
