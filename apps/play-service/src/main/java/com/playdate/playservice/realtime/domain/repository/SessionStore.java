package com.playdate.playservice.realtime.domain.repository;

import com.playdate.playservice.realtime.domain.model.GameSession;
import com.playdate.playservice.realtime.domain.model.SessionStatus;
import com.playdate.playservice.realtime.domain.model.SessionSummary;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * 活跃会话存储。
 *
 * 每个会话一把锁，mutate 内的读改写对同一会话是原子的，不同会话之间互不阻塞。
 * 对外返回的 GameSession 都是副本，修改副本不影响存储。
 */
public interface SessionStore {

    /**
     * 保存一个新会话（至少包含一名成员）。
     * @throws com.playdate.playservice.realtime.domain.exception.SessionAlreadyExistsException ID 已存在
     */
    GameSession create(GameSession session);

    Optional<GameSession> get(String sessionId);

    /**
     * 在会话锁内执行修改。函数执行后成员为空的会话会被同一次调用移除。
     * 函数抛出的异常原样传播。
     *
     * @throws com.playdate.playservice.realtime.domain.exception.SessionNotFoundException 会话不存在
     */
    <T> T mutate(String sessionId, Function<GameSession, T> mutation);

    boolean delete(String sessionId);

    /**
     * 条件删除：在会话锁内判断，满足条件才移除。
     * @return 被移除会话的副本
     */
    Optional<GameSession> removeIf(String sessionId, Predicate<GameSession> condition);

    /** 按创建时间倒序 */
    List<SessionSummary> listByStatus(SessionStatus status);

    Set<String> sessionIds();
}
