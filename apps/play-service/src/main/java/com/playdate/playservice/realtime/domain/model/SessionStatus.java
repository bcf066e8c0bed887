package com.playdate.playservice.realtime.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 会话状态（线上传输为小写）。
 *
 * waiting → active → completed / abandoned。
 * 挑战尚未被接受时的 pending 状态记录在挑战上，内存中不存在 pending 会话。
 */
public enum SessionStatus {
    WAITING,
    ACTIVE,
    COMPLETED,
    ABANDONED;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** 终态：不再接受对局数据更新 */
    public boolean isTerminal() {
        return this == COMPLETED || this == ABANDONED;
    }

    /**
     * 解析客户端传入的状态值（大小写不敏感）
     * @throws IllegalArgumentException 未知状态
     */
    public static SessionStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("状态不能为空");
        }
        for (SessionStatus s : values()) {
            if (s.name().equalsIgnoreCase(value.trim())) {
                return s;
            }
        }
        throw new IllegalArgumentException("未知的会话状态: " + value);
    }
}
