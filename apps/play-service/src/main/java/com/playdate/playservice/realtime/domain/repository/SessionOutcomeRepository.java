package com.playdate.playservice.realtime.domain.repository;

import com.playdate.playservice.realtime.domain.model.SessionSnapshot;

/**
 * 对局结果持久化（会话进入终态时写入一次）。
 * 实现可以抛出异常，由调用方负责重试。
 */
public interface SessionOutcomeRepository {

    void recordSessionOutcome(SessionSnapshot snapshot);
}
