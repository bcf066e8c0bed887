package com.playdate.playservice.realtime.domain.model;

import com.playdate.playservice.realtime.domain.constants.PlayMessages;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 游戏会话聚合。
 *
 * <p>所有修改都经由 SessionStore.mutate 在会话锁内进行，本类自身不做同步。
 * 人数上限、终态冻结、成员唯一等规则在这里校验，违反时抛 IllegalStateException，
 * 且校验先于任何修改，失败不会留下半截状态。
 */
@Getter
public class GameSession {

    /** 每个会话的人数上限 */
    public static final int MAX_PLAYERS = 2;

    private final String id;
    private final String gameType;
    private final Instant createdAt;
    private SessionStatus status;
    /** 按加入顺序排列 */
    private final List<PlayerMembership> players;
    /** 游戏自定义数据，不解析 */
    private Object gameData;
    private Instant finishedAt;

    public GameSession(String id, String gameType, Instant createdAt) {
        this(id, gameType, createdAt, SessionStatus.WAITING, new ArrayList<>(), null, null);
    }

    private GameSession(String id, String gameType, Instant createdAt, SessionStatus status,
                        List<PlayerMembership> players, Object gameData, Instant finishedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.gameType = Objects.requireNonNull(gameType, "gameType");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.status = status;
        this.players = players;
        this.gameData = gameData;
        this.finishedAt = finishedAt;
    }

    public List<PlayerMembership> getPlayers() {
        return Collections.unmodifiableList(players);
    }

    public Optional<PlayerMembership> member(String playerId) {
        return players.stream().filter(p -> p.getId().equals(playerId)).findFirst();
    }

    public boolean isMember(String playerId) {
        return member(playerId).isPresent();
    }

    public PlayerMembership requireMember(String playerId) {
        return member(playerId).orElseThrow(() -> new IllegalStateException(PlayMessages.NOT_A_MEMBER));
    }

    public boolean isFull() {
        return players.size() >= MAX_PLAYERS;
    }

    public boolean isEmpty() {
        return players.isEmpty();
    }

    public boolean hasConnectedPlayer() {
        return players.stream().anyMatch(PlayerMembership::isConnected);
    }

    /**
     * 会话最近一次有成员活动的时间：成员 lastSeenAt 的最大值，无成员时为创建时间。
     */
    public Instant lastActivityAt() {
        return players.stream()
                .map(PlayerMembership::getLastSeenAt)
                .reduce(createdAt, (a, b) -> b.isAfter(a) ? b : a);
    }

    /**
     * 加入或重新加入。
     *
     * <p>已是成员：不新增记录，刷新 lastSeenAt；经由连接加入时标记在线并刷新 joinedAt。
     * <p>新成员：会话已结束或已满时拒绝。
     *
     * @param viaConnection 是否通过实时连接加入（HTTP 加入的成员初始为离线）
     * @return true 表示新增了成员
     */
    public boolean join(String playerId, String displayName, boolean viaConnection, Instant now) {
        Optional<PlayerMembership> existing = member(playerId);
        if (existing.isPresent()) {
            PlayerMembership m = existing.get();
            if (viaConnection) {
                m.setConnected(true);
                m.setJoinedAt(now);
            }
            m.setLastSeenAt(now);
            return false;
        }
        if (status.isTerminal()) {
            throw new IllegalStateException(PlayMessages.SESSION_FINISHED);
        }
        if (isFull()) {
            throw new IllegalStateException(PlayMessages.SESSION_FULL);
        }
        players.add(new PlayerMembership(playerId, displayName, false, viaConnection, now, now));
        return true;
    }

    /**
     * @return true 表示确实移除了成员
     */
    public boolean removePlayer(String playerId) {
        return players.removeIf(p -> p.getId().equals(playerId));
    }

    public void setReady(String playerId, boolean ready, Instant now) {
        PlayerMembership m = requireMember(playerId);
        m.setReady(ready);
        m.setLastSeenAt(now);
    }

    public void touch(String playerId, Instant now) {
        member(playerId).ifPresent(m -> m.setLastSeenAt(now));
    }

    public void markDisconnected(String playerId) {
        member(playerId).ifPresent(m -> m.setConnected(false));
    }

    /**
     * 应用一次对局数据更新：整体替换 gameData，状态推进到 active；
     * 携带终态时同时结束会话。
     *
     * @param requestedStatus 可空；只接受 active / completed / abandoned
     * @return true 表示本次更新使会话进入终态
     */
    public boolean applyUpdate(String playerId, Object newGameData, SessionStatus requestedStatus, Instant now) {
        PlayerMembership m = requireMember(playerId);
        if (status.isTerminal()) {
            throw new IllegalStateException(PlayMessages.SESSION_FINISHED);
        }
        if (requestedStatus == SessionStatus.WAITING) {
            throw new IllegalArgumentException(PlayMessages.INVALID_FINAL_STATUS);
        }
        m.setLastSeenAt(now);
        this.gameData = newGameData;
        this.status = SessionStatus.ACTIVE;
        if (requestedStatus != null && requestedStatus.isTerminal()) {
            finish(requestedStatus, now);
            return true;
        }
        return false;
    }

    /**
     * 进入终态。重复结束视为冲突。
     */
    public void finish(SessionStatus finalStatus, Instant now) {
        if (finalStatus == null || !finalStatus.isTerminal()) {
            throw new IllegalArgumentException(PlayMessages.INVALID_FINAL_STATUS);
        }
        if (status.isTerminal()) {
            throw new IllegalStateException(PlayMessages.SESSION_FINISHED);
        }
        this.status = finalStatus;
        this.finishedAt = now;
    }

    /** 深拷贝成员列表；gameData 只会被整体替换，共享引用 */
    public GameSession copy() {
        List<PlayerMembership> copied = new ArrayList<>(players.size());
        players.forEach(p -> copied.add(p.copy()));
        return new GameSession(id, gameType, createdAt, status, copied, gameData, finishedAt);
    }

    public SessionSnapshot toSnapshot() {
        return new SessionSnapshot(id, gameType,
                players.stream().map(PlayerMembership::toView).toList(),
                gameData, status, createdAt.toString(),
                finishedAt != null ? finishedAt.toString() : null);
    }

    public SessionSummary toSummary() {
        return new SessionSummary(id, gameType, players.size(), MAX_PLAYERS, status, createdAt.toString());
    }
}
