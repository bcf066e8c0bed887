package com.playdate.playservice.realtime.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 玩家离开会话的原因：主动离开 / 连接断开（含心跳超时）。
 */
public enum LeaveReason {
    LEAVE("leave"),
    DISCONNECT("disconnect");

    private final String wire;

    LeaveReason(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }
}
