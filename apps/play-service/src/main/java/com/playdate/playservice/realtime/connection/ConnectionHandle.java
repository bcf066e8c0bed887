package com.playdate.playservice.realtime.connection;

import java.util.Objects;

/**
 * 一条实时连接的句柄。
 *
 * @param stompSessionId STOMP 会话 ID，连接的唯一标识
 * @param principalName  认证后的 Principal 名称，匿名连接为 null
 */
public record ConnectionHandle(String stompSessionId, String principalName) {

    public ConnectionHandle {
        Objects.requireNonNull(stompSessionId, "stompSessionId");
    }

    /**
     * 用户目的地路由：有 Principal 用名称，匿名连接用 STOMP 会话 ID。
     */
    public String userRoute() {
        return principalName != null ? principalName : stompSessionId;
    }

    /** 同一条连接只看 STOMP 会话 ID */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConnectionHandle other)) return false;
        return stompSessionId.equals(other.stompSessionId);
    }

    @Override
    public int hashCode() {
        return stompSessionId.hashCode();
    }
}
