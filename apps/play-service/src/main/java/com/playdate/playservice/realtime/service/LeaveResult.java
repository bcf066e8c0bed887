package com.playdate.playservice.realtime.service;

import com.playdate.playservice.realtime.domain.model.LeaveReason;

/**
 * 离开结果。
 *
 * @param removed        是否确实移除了成员（非成员离开为 false）
 * @param sessionDeleted 会话是否因此被移除
 */
public record LeaveResult(String sessionId, String playerId, LeaveReason reason,
                          boolean removed, boolean sessionDeleted) {
}
