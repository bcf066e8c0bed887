package com.playdate.playservice.realtime.connection;

import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 玩家 ⇄ 连接 双向登记表。
 *
 * 正向：playerId → 绑定（连接 + 会话）；反向：STOMP 会话 ID → playerId。
 * 一个玩家同时只有一条连接（后连接者生效），一条连接同时只代表一个玩家。
 * 两张表在同一把监视器下更新，临界区内不调用任何外部组件。
 */
@Component
public class ConnectionRegistry {

    private final Map<String, ConnectionBinding> byPlayer = new HashMap<>();
    private final Map<String, String> playerByConnection = new HashMap<>();

    /**
     * 登记或替换玩家的绑定。
     *
     * @return 被替换的旧绑定（可能是另一条连接，或同一连接的另一个会话）
     */
    public synchronized Optional<ConnectionBinding> register(String playerId, ConnectionHandle handle, String sessionId) {
        Objects.requireNonNull(playerId, "playerId");
        Objects.requireNonNull(handle, "handle");

        // 这条连接此前代表的是另一个玩家：解除那个玩家的绑定
        String previousOwner = playerByConnection.get(handle.stompSessionId());
        if (previousOwner != null && !previousOwner.equals(playerId)) {
            ConnectionBinding ownerBinding = byPlayer.get(previousOwner);
            if (ownerBinding != null && ownerBinding.handle().equals(handle)) {
                byPlayer.remove(previousOwner);
            }
        }

        ConnectionBinding previous = byPlayer.put(playerId, new ConnectionBinding(playerId, handle, sessionId));
        if (previous != null && !previous.handle().equals(handle)) {
            playerByConnection.remove(previous.handle().stompSessionId(), playerId);
        }
        playerByConnection.put(handle.stompSessionId(), playerId);
        return Optional.ofNullable(previous);
    }

    public synchronized Optional<ConnectionHandle> resolve(String playerId) {
        ConnectionBinding b = playerId == null ? null : byPlayer.get(playerId);
        return b == null ? Optional.empty() : Optional.of(b.handle());
    }

    public synchronized Optional<ConnectionBinding> bindingOf(String playerId) {
        return playerId == null ? Optional.empty() : Optional.ofNullable(byPlayer.get(playerId));
    }

    /** 按连接反查当前绑定（不修改） */
    public synchronized Optional<ConnectionBinding> bindingOf(ConnectionHandle handle) {
        String playerId = playerByConnection.get(handle.stompSessionId());
        if (playerId == null) {
            return Optional.empty();
        }
        ConnectionBinding b = byPlayer.get(playerId);
        return (b != null && b.handle().equals(handle)) ? Optional.of(b) : Optional.empty();
    }

    /**
     * 连接断开时按连接移除。
     * @return 被移除的绑定；该连接已被顶替或从未登记时为 empty
     */
    public synchronized Optional<ConnectionBinding> unregisterByHandle(ConnectionHandle handle) {
        String playerId = playerByConnection.remove(handle.stompSessionId());
        if (playerId == null) {
            return Optional.empty();
        }
        ConnectionBinding b = byPlayer.get(playerId);
        if (b == null || !b.handle().equals(handle)) {
            return Optional.empty();
        }
        byPlayer.remove(playerId);
        return Optional.of(b);
    }

    /**
     * 只有当玩家当前绑定在指定会话上时才移除。
     */
    public synchronized Optional<ConnectionBinding> unregisterIfBoundTo(String playerId, String sessionId) {
        ConnectionBinding b = byPlayer.get(playerId);
        if (b == null || !Objects.equals(b.sessionId(), sessionId)) {
            return Optional.empty();
        }
        byPlayer.remove(playerId);
        playerByConnection.remove(b.handle().stompSessionId(), playerId);
        return Optional.of(b);
    }

    public synchronized int size() {
        return byPlayer.size();
    }
}
