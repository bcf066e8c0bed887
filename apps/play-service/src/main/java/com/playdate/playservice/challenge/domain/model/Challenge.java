package com.playdate.playservice.challenge.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 挑战记录（Redis JSON 存储）。
 * sessionId 在发起时分配，接受后用它建立会话。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Challenge {

    private String sessionId;
    private String challengerId;
    private String challengedId;
    private String gameType;
    private ChallengeStatus status;
    /** 发起时间（epoch 毫秒） */
    private long createdAt;
    /** 响应时间（epoch 毫秒），未响应为 null */
    private Long respondedAt;

    public boolean isPending() {
        return status == ChallengeStatus.PENDING;
    }
}
