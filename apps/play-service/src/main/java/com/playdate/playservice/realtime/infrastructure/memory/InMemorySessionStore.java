package com.playdate.playservice.realtime.infrastructure.memory;

import com.playdate.playservice.realtime.domain.exception.SessionAlreadyExistsException;
import com.playdate.playservice.realtime.domain.exception.SessionNotFoundException;
import com.playdate.playservice.realtime.domain.model.GameSession;
import com.playdate.playservice.realtime.domain.model.SessionStatus;
import com.playdate.playservice.realtime.domain.model.SessionSummary;
import com.playdate.playservice.realtime.domain.repository.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * 内存会话存储。
 *
 * 每个会话对应一个 Entry（会话 + 独占锁 + removed 标记）。
 * 移除时先在锁内置 removed，再从 map 摘除；已经拿到旧 Entry 的并发调用
 * 进锁后看到 removed 会按“会话不存在”处理。
 */
@Slf4j
@Component
public class InMemorySessionStore implements SessionStore {

    private final ConcurrentMap<String, Entry> sessions = new ConcurrentHashMap<>();

    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock();
        final GameSession session;
        boolean removed;

        Entry(GameSession session) {
            this.session = session;
        }
    }

    @Override
    public GameSession create(GameSession session) {
        if (session.isEmpty()) {
            throw new IllegalArgumentException("会话至少需要一名成员");
        }
        GameSession stored = session.copy();
        if (sessions.putIfAbsent(stored.getId(), new Entry(stored)) != null) {
            throw new SessionAlreadyExistsException(stored.getId());
        }
        log.debug("会话已创建: sessionId={}, gameType={}", stored.getId(), stored.getGameType());
        return stored.copy();
    }

    @Override
    public Optional<GameSession> get(String sessionId) {
        Entry e = sessionId == null ? null : sessions.get(sessionId);
        if (e == null) {
            return Optional.empty();
        }
        e.lock.lock();
        try {
            return e.removed ? Optional.empty() : Optional.of(e.session.copy());
        } finally {
            e.lock.unlock();
        }
    }

    @Override
    public <T> T mutate(String sessionId, Function<GameSession, T> mutation) {
        Entry e = sessionId == null ? null : sessions.get(sessionId);
        if (e == null) {
            throw new SessionNotFoundException(sessionId);
        }
        e.lock.lock();
        try {
            if (e.removed) {
                throw new SessionNotFoundException(sessionId);
            }
            T result = mutation.apply(e.session);
            if (e.session.isEmpty()) {
                detach(sessionId, e);
                log.info("会话成员已清空，移除会话: sessionId={}", sessionId);
            }
            return result;
        } finally {
            e.lock.unlock();
        }
    }

    @Override
    public boolean delete(String sessionId) {
        return removeIf(sessionId, s -> true).isPresent();
    }

    @Override
    public Optional<GameSession> removeIf(String sessionId, Predicate<GameSession> condition) {
        Entry e = sessionId == null ? null : sessions.get(sessionId);
        if (e == null) {
            return Optional.empty();
        }
        e.lock.lock();
        try {
            if (e.removed || !condition.test(e.session)) {
                return Optional.empty();
            }
            detach(sessionId, e);
            return Optional.of(e.session.copy());
        } finally {
            e.lock.unlock();
        }
    }

    @Override
    public List<SessionSummary> listByStatus(SessionStatus status) {
        List<GameSession> matched = new ArrayList<>();
        for (String id : sessions.keySet()) {
            get(id).filter(s -> status == null || s.getStatus() == status).ifPresent(matched::add);
        }
        matched.sort(Comparator.comparing(GameSession::getCreatedAt).reversed());
        return matched.stream().map(GameSession::toSummary).toList();
    }

    @Override
    public Set<String> sessionIds() {
        return Set.copyOf(sessions.keySet());
    }

    /** 调用方须持有 e.lock */
    private void detach(String sessionId, Entry e) {
        e.removed = true;
        sessions.remove(sessionId, e);
    }
}
