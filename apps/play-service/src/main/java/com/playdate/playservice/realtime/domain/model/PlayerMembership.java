package com.playdate.playservice.realtime.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

/**
 * 玩家在某个会话中的成员记录。
 * 只在会话锁内修改，对外暴露的都是 copy / view。
 */
@Data
@AllArgsConstructor
public class PlayerMembership {

    private final String id;
    private String displayName;
    private boolean ready;
    /** 当前是否有活跃连接绑定在这个会话上 */
    private boolean connected;
    private Instant joinedAt;
    /** 最近一次收到该玩家消息（含心跳）的时间 */
    private Instant lastSeenAt;

    public PlayerMembership copy() {
        return new PlayerMembership(id, displayName, ready, connected, joinedAt, lastSeenAt);
    }

    public PlayerView toView() {
        return new PlayerView(id, displayName, ready, connected,
                joinedAt != null ? joinedAt.toString() : null,
                lastSeenAt != null ? lastSeenAt.toString() : null);
    }
}
