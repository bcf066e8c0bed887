package com.playdate.playservice.realtime.service;

import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * 会话 ID 生成：session- + 8 位小写十六进制，可直接放进 URL。
 * 冲突由 SessionStore.create 检出后重新生成。
 */
@Component
public class SessionIdGenerator {

    public static final String PREFIX = "session-";

    public String next() {
        return PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}
