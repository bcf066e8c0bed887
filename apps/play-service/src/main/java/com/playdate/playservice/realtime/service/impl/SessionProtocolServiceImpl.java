package com.playdate.playservice.realtime.service.impl;

import com.playdate.playservice.application.user.IdentityService;
import com.playdate.playservice.application.user.PlayerProfile;
import com.playdate.playservice.platform.ws.WebSocketDisconnectHelper;
import com.playdate.playservice.realtime.application.SessionOutcomeRecorder;
import com.playdate.playservice.realtime.broadcast.RoomBroadcaster;
import com.playdate.playservice.realtime.connection.ConnectionBinding;
import com.playdate.playservice.realtime.connection.ConnectionHandle;
import com.playdate.playservice.realtime.connection.ConnectionRegistry;
import com.playdate.playservice.realtime.domain.constants.PlayMessages;
import com.playdate.playservice.realtime.domain.event.PlayEvents;
import com.playdate.playservice.realtime.domain.exception.SessionAlreadyExistsException;
import com.playdate.playservice.realtime.domain.exception.SessionNotFoundException;
import com.playdate.playservice.realtime.domain.model.GameSession;
import com.playdate.playservice.realtime.domain.model.LeaveReason;
import com.playdate.playservice.realtime.domain.model.PlayerMembership;
import com.playdate.playservice.realtime.domain.model.SessionSnapshot;
import com.playdate.playservice.realtime.domain.model.SessionStatus;
import com.playdate.playservice.realtime.domain.model.SessionSummary;
import com.playdate.playservice.realtime.domain.repository.SessionStore;
import com.playdate.playservice.realtime.service.LeaveResult;
import com.playdate.playservice.realtime.service.SessionIdGenerator;
import com.playdate.playservice.realtime.service.SessionProtocolService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * 会话协议引擎实现。
 *
 * 约定：
 * 1. 所有会话修改都走 SessionStore.mutate，连接登记、房间进出和事件入队都在同一个临界区内完成，
 *    同一会话的事件顺序与状态变化顺序一致；
 * 2. 用户域查询、对局结果落库、强制断开旧连接这类可能阻塞的操作放在锁外；
 * 3. 失败直接抛异常，由入口（WS 控制器 / HTTP 异常映射）转成 error 或对应状态码，
 *    抛出前不做任何修改。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionProtocolServiceImpl implements SessionProtocolService {

    /** 会话 ID 冲突时的最大重试次数 */
    private static final int MAX_ID_ATTEMPTS = 5;

    private final SessionStore store;
    private final ConnectionRegistry registry;
    private final RoomBroadcaster broadcaster;
    private final IdentityService identityService;
    private final SessionOutcomeRecorder outcomeRecorder;
    private final WebSocketDisconnectHelper disconnectHelper;
    private final SessionIdGenerator idGenerator;
    private final Clock clock;

    /** 一次加入/创建在锁内产生的结果 */
    private record JoinOutcome(SessionSnapshot snapshot, ConnectionBinding superseded) {
    }

    /** 一次对局更新在锁内产生的结果 */
    private record UpdateOutcome(SessionSnapshot snapshot, boolean finished) {
    }

    // ==================== 会话成员 ====================

    @Override
    public SessionSnapshot createSession(String playerId, String playerName, String gameType, ConnectionHandle handle) {
        if (StringUtils.isAnyBlank(gameType, playerId)) {
            throw new IllegalArgumentException(PlayMessages.MISSING_GAME_TYPE_OR_PLAYER);
        }
        String name = resolveName(playerId, playerName);
        Instant now = clock.instant();
        GameSession created = createWithFreshId(gameType.trim(), now, session ->
                session.join(playerId, name, handle != null, now));

        String sessionId = created.getId();
        JoinOutcome outcome = store.mutate(sessionId, s -> {
            ConnectionBinding superseded = bindConnection(s, playerId, handle);
            SessionSnapshot snapshot = s.toSnapshot();
            broadcaster.sendTo(handle, sessionId, PlayEvents.SESSION_CREATED,
                    new PlayEvents.SessionCreated(sessionId, snapshot.gameType(), snapshot.players()));
            return new JoinOutcome(snapshot, superseded);
        });
        log.info("会话创建: sessionId={}, gameType={}, creator={}, viaConnection={}",
                sessionId, created.getGameType(), playerId, handle != null);

        releaseSuperseded(playerId, handle, sessionId, outcome.superseded());
        return outcome.snapshot();
    }

    @Override
    public SessionSnapshot joinSession(String sessionId, String playerId, String playerName, ConnectionHandle handle) {
        if (StringUtils.isAnyBlank(sessionId, playerId)) {
            throw new IllegalArgumentException(PlayMessages.MISSING_SESSION_OR_PLAYER);
        }
        // 客户端给了展示名就直接用；没给且已是成员（重连）时省去一次用户域查询
        String name;
        if (StringUtils.isNotBlank(playerName)) {
            name = playerName.trim();
        } else {
            boolean knownMember = store.get(sessionId).map(s -> s.isMember(playerId)).orElse(false);
            name = knownMember ? PlayMessages.DEFAULT_PLAYER_NAME : resolveName(playerId, null);
        }
        Instant now = clock.instant();

        JoinOutcome outcome = store.mutate(sessionId, s -> {
            boolean added = s.join(playerId, name, handle != null, now);
            ConnectionBinding superseded = bindConnection(s, playerId, handle);
            PlayerMembership member = s.requireMember(playerId);
            SessionSnapshot snapshot = s.toSnapshot();
            broadcaster.broadcast(sessionId, PlayEvents.PLAYER_JOIN, member.toView());
            broadcaster.sendTo(handle, sessionId, PlayEvents.SESSION_STATE, snapshot);
            log.info("玩家{}会话: sessionId={}, playerId={}, players={}",
                    added ? "加入" : "重新加入", sessionId, playerId, snapshot.players().size());
            return new JoinOutcome(snapshot, superseded);
        });

        releaseSuperseded(playerId, handle, sessionId, outcome.superseded());
        return outcome.snapshot();
    }

    @Override
    public LeaveResult leaveSession(String sessionId, String playerId, ConnectionHandle handle) {
        if (StringUtils.isAnyBlank(sessionId, playerId)) {
            throw new IllegalArgumentException(PlayMessages.MISSING_SESSION_OR_PLAYER);
        }
        LeaveResult result = store.mutate(sessionId, s -> {
            LeaveResult r = detachMember(s, playerId, LeaveReason.LEAVE);
            if (handle != null) {
                broadcaster.leave(sessionId, handle);
            }
            return r;
        });
        if (!result.removed()) {
            log.debug("非成员离开会话，忽略: sessionId={}, playerId={}", sessionId, playerId);
        }
        return result;
    }

    @Override
    public void handleDisconnect(ConnectionHandle handle) {
        Optional<ConnectionBinding> binding = registry.bindingOf(handle);
        if (binding.isEmpty()) {
            // 未进入过会话，或已被新连接顶替
            broadcaster.leaveAll(handle);
            log.debug("连接断开，无会话绑定: connection={}", handle.stompSessionId());
            return;
        }
        ConnectionBinding b = binding.get();
        try {
            LeaveResult result = store.mutate(b.sessionId(), s -> {
                // 进锁后复核：等锁期间玩家可能已换连接或换会话
                Optional<ConnectionBinding> current = registry.bindingOf(handle);
                if (current.isEmpty() || !current.get().sessionId().equals(b.sessionId())) {
                    return null;
                }
                return detachMember(s, b.playerId(), LeaveReason.DISCONNECT);
            });
            if (result != null) {
                log.info("连接断开，玩家移出会话: sessionId={}, playerId={}, connection={}",
                        b.sessionId(), b.playerId(), handle.stompSessionId());
            }
        } catch (SessionNotFoundException e) {
            log.debug("连接断开时会话已不存在: sessionId={}, playerId={}", b.sessionId(), b.playerId());
        } finally {
            // 仍指向这条连接的残留绑定一并清掉
            registry.unregisterByHandle(handle);
            broadcaster.leaveAll(handle);
        }
    }

    @Override
    public void setReady(String sessionId, String playerId, Boolean isReady, ConnectionHandle handle) {
        if (StringUtils.isAnyBlank(sessionId, playerId)) {
            throw new IllegalArgumentException(PlayMessages.MISSING_SESSION_OR_PLAYER);
        }
        boolean ready = Boolean.TRUE.equals(isReady);
        Instant now = clock.instant();
        store.mutate(sessionId, s -> {
            s.setReady(playerId, ready, now);
            broadcaster.broadcast(sessionId, PlayEvents.PLAYER_READY, new PlayEvents.PlayerReady(playerId, ready));
            return null;
        });
    }

    // ==================== 对局数据与消息 ====================

    @Override
    public SessionSnapshot updateGame(String sessionId, String playerId, Object gameData, Object playerAction,
                                      String requestedStatus, ConnectionHandle handle) {
        if (StringUtils.isAnyBlank(sessionId, playerId) || gameData == null) {
            throw new IllegalArgumentException(PlayMessages.MISSING_REQUIRED_DATA);
        }
        SessionStatus requested = StringUtils.isBlank(requestedStatus) ? null : SessionStatus.fromWire(requestedStatus);
        Instant now = clock.instant();
        // HTTP 发起的更新不带连接，按玩家当前连接排除回显
        ConnectionHandle origin = handle != null ? handle : registry.resolve(playerId).orElse(null);

        UpdateOutcome outcome = store.mutate(sessionId, s -> {
            boolean finished = s.applyUpdate(playerId, gameData, requested, now);
            SessionSnapshot snapshot = s.toSnapshot();
            broadcaster.broadcast(sessionId, PlayEvents.GAME_UPDATE,
                    new PlayEvents.GameUpdated(gameData, playerAction, now.toString()), origin);
            if (finished) {
                broadcaster.broadcast(sessionId, PlayEvents.SESSION_STATE, snapshot);
            }
            return new UpdateOutcome(snapshot, finished);
        });

        if (outcome.finished()) {
            log.info("会话结束: sessionId={}, status={}, by={}", sessionId, outcome.snapshot().status().wire(), playerId);
            outcomeRecorder.record(outcome.snapshot());
        }
        return outcome.snapshot();
    }

    @Override
    public void communicate(String sessionId, String playerId, String message, String toPlayer,
                            String messageType, ConnectionHandle handle) {
        if (StringUtils.isAnyBlank(sessionId, playerId) || message == null) {
            throw new IllegalArgumentException(PlayMessages.MISSING_REQUIRED_DATA);
        }
        Instant now = clock.instant();
        String type = StringUtils.defaultIfBlank(messageType, PlayMessages.DEFAULT_MESSAGE_TYPE);
        store.mutate(sessionId, s -> {
            s.requireMember(playerId);
            s.touch(playerId, now);
            broadcaster.broadcast(sessionId, PlayEvents.COMMUNICATION,
                    new PlayEvents.Communication(message, playerId, toPlayer, type, now.toString()));
            return null;
        });
    }

    @Override
    public void heartbeat(String playerId, ConnectionHandle handle) {
        if (StringUtils.isBlank(playerId)) {
            throw new IllegalArgumentException(PlayMessages.MISSING_PLAYER);
        }
        Instant now = clock.instant();
        registry.bindingOf(playerId).ifPresent(b -> {
            try {
                store.mutate(b.sessionId(), s -> {
                    s.touch(playerId, now);
                    return null;
                });
            } catch (SessionNotFoundException e) {
                log.debug("心跳对应的会话已不存在: playerId={}, sessionId={}", playerId, b.sessionId());
            }
        });
        broadcaster.sendTo(handle, null, PlayEvents.PONG, new PlayEvents.Pong(now.toString()));
    }

    // ==================== 挑战与查询 ====================

    @Override
    public SessionSnapshot bootstrapFromChallenge(String sessionId, String gameType, List<String> playerIds) {
        if (StringUtils.isAnyBlank(sessionId, gameType) || playerIds == null || playerIds.isEmpty()) {
            throw new IllegalArgumentException(PlayMessages.MISSING_REQUIRED_DATA);
        }
        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(playerIds));
        if (distinct.size() > GameSession.MAX_PLAYERS) {
            throw new IllegalStateException(PlayMessages.SESSION_FULL);
        }
        Instant now = clock.instant();
        GameSession session = new GameSession(sessionId, gameType.trim(), now);
        for (String playerId : distinct) {
            session.join(playerId, resolveName(playerId, null), false, now);
        }
        GameSession created = store.create(session);
        log.info("挑战会话建立: sessionId={}, gameType={}, players={}", sessionId, gameType, distinct);
        return created.toSnapshot();
    }

    @Override
    public SessionSnapshot findSession(String sessionId) {
        return store.get(sessionId)
                .map(GameSession::toSnapshot)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    @Override
    public List<SessionSummary> listSessions(SessionStatus status) {
        return store.listByStatus(status);
    }

    // ==================== 清扫 ====================

    @Override
    public boolean evictIfStale(String sessionId, String playerId, Instant staleBefore) {
        Optional<ConnectionHandle> staleHandle;
        try {
            staleHandle = store.mutate(sessionId, s -> {
                Optional<PlayerMembership> m = s.member(playerId);
                if (m.isEmpty() || !m.get().isConnected() || !m.get().getLastSeenAt().isBefore(staleBefore)) {
                    return null;
                }
                Optional<ConnectionHandle> handle = registry.bindingOf(playerId)
                        .filter(b -> sessionId.equals(b.sessionId()))
                        .map(ConnectionBinding::handle);
                detachMember(s, playerId, LeaveReason.DISCONNECT);
                return handle;
            });
        } catch (SessionNotFoundException e) {
            return false;
        }
        if (staleHandle == null) {
            return false;
        }
        log.info("心跳超时，玩家移出会话: sessionId={}, playerId={}", sessionId, playerId);
        staleHandle.ifPresent(h -> {
            broadcaster.leaveAll(h);
            disconnectHelper.sendKickMessage(h.userRoute(), h.stompSessionId(), PlayMessages.HEARTBEAT_TIMEOUT);
            disconnectHelper.forceDisconnect(h.stompSessionId());
        });
        return true;
    }

    @Override
    public boolean abandonIfIdle(String sessionId, Instant idleBefore) {
        SessionSnapshot abandoned;
        try {
            abandoned = store.mutate(sessionId, s -> {
                if (s.getStatus().isTerminal() || s.hasConnectedPlayer()
                        || !s.lastActivityAt().isBefore(idleBefore)) {
                    return null;
                }
                s.finish(SessionStatus.ABANDONED, clock.instant());
                SessionSnapshot snapshot = s.toSnapshot();
                broadcaster.broadcast(sessionId, PlayEvents.SESSION_STATE, snapshot);
                return snapshot;
            });
        } catch (SessionNotFoundException e) {
            return false;
        }
        if (abandoned == null) {
            return false;
        }
        log.info("会话长时间无人在线，判为放弃: sessionId={}", sessionId);
        outcomeRecorder.record(abandoned);
        return true;
    }

    @Override
    public boolean expireFinishedSession(String sessionId, Instant finishedBefore) {
        Optional<GameSession> removed = store.removeIf(sessionId, s -> s.getStatus().isTerminal()
                && s.getFinishedAt() != null && s.getFinishedAt().isBefore(finishedBefore));
        removed.ifPresent(s -> {
            s.getPlayers().forEach(p -> registry.unregisterIfBoundTo(p.getId(), sessionId));
            broadcaster.dissolve(sessionId);
            log.info("已结束会话回收: sessionId={}, status={}", sessionId, s.getStatus().wire());
        });
        return removed.isPresent();
    }

    // ==================== 内部 ====================

    /**
     * 生成不冲突的会话 ID 并保存。
     */
    private GameSession createWithFreshId(String gameType, Instant now, Consumer<GameSession> init) {
        for (int attempt = 1; ; attempt++) {
            GameSession session = new GameSession(idGenerator.next(), gameType, now);
            init.accept(session);
            try {
                return store.create(session);
            } catch (SessionAlreadyExistsException e) {
                if (attempt >= MAX_ID_ATTEMPTS) {
                    throw e;
                }
                log.debug("会话 ID 冲突，重新生成: {}", e.getSessionId());
            }
        }
    }

    /**
     * 锁内：登记连接并加入房间。同一会话内换了连接时，旧连接立即离开房间。
     *
     * @return 被顶替的旧绑定，没有则为 null
     */
    private ConnectionBinding bindConnection(GameSession session, String playerId, ConnectionHandle handle) {
        if (handle == null) {
            return null;
        }
        String sessionId = session.getId();
        ConnectionBinding previous = registry.register(playerId, handle, sessionId).orElse(null);
        if (previous != null && previous.sessionId().equals(sessionId) && !previous.handle().equals(handle)) {
            broadcaster.leave(sessionId, previous.handle());
        }
        broadcaster.join(sessionId, handle);
        return previous;
    }

    /**
     * 锁外：处理被顶替的旧绑定。
     * 旧绑定在别的会话：把玩家在旧会话中标记为离线并让旧连接离开旧房间；
     * 旧绑定是另一条连接：通知并强制断开。
     */
    private void releaseSuperseded(String playerId, ConnectionHandle handle, String sessionId, ConnectionBinding previous) {
        if (previous == null) {
            return;
        }
        boolean sameConnection = previous.handle().equals(handle);
        boolean sameSession = previous.sessionId().equals(sessionId);
        if (!sameSession) {
            try {
                store.mutate(previous.sessionId(), s -> {
                    s.markDisconnected(playerId);
                    broadcaster.leave(previous.sessionId(), previous.handle());
                    return null;
                });
            } catch (SessionNotFoundException e) {
                log.debug("旧会话已不存在: playerId={}, sessionId={}", playerId, previous.sessionId());
            }
        }
        if (!sameConnection) {
            log.info("玩家连接被顶替: playerId={}, old={}, new={}",
                    playerId, previous.handle().stompSessionId(), handle.stompSessionId());
            disconnectHelper.sendKickMessage(previous.handle().userRoute(),
                    previous.handle().stompSessionId(), PlayMessages.SUPERSEDED);
            disconnectHelper.forceDisconnect(previous.handle().stompSessionId());
        }
    }

    /**
     * 锁内：移除成员，解除该会话上的连接绑定，通知剩余成员。
     * 非成员为空操作；会话因此清空时解散房间（存储层随后移除会话）。
     */
    private LeaveResult detachMember(GameSession s, String playerId, LeaveReason reason) {
        String sessionId = s.getId();
        boolean removed = s.removePlayer(playerId);
        if (!removed) {
            return new LeaveResult(sessionId, playerId, reason, false, false);
        }
        registry.unregisterIfBoundTo(playerId, sessionId)
                .ifPresent(b -> broadcaster.leave(sessionId, b.handle()));
        boolean deleted = s.isEmpty();
        if (deleted) {
            broadcaster.dissolve(sessionId);
        } else {
            broadcaster.broadcast(sessionId, PlayEvents.PLAYER_LEAVE, new PlayEvents.PlayerLeft(playerId, reason));
        }
        log.info("玩家离开会话: sessionId={}, playerId={}, reason={}, sessionDeleted={}",
                sessionId, playerId, reason.wire(), deleted);
        return new LeaveResult(sessionId, playerId, reason, true, deleted);
    }

    /**
     * 展示名：客户端传入优先，其次用户域，最后默认值。
     */
    private String resolveName(String playerId, String playerName) {
        if (StringUtils.isNotBlank(playerName)) {
            return playerName.trim();
        }
        return identityService.resolveProfile(playerId)
                .map(PlayerProfile::name)
                .filter(StringUtils::isNotBlank)
                .orElse(PlayMessages.DEFAULT_PLAYER_NAME);
    }
}
