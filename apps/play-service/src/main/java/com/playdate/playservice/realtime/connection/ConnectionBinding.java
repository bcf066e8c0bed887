package com.playdate.playservice.realtime.connection;

/**
 * 玩家当前的连接绑定：哪条连接、在哪个会话里。
 */
public record ConnectionBinding(String playerId, ConnectionHandle handle, String sessionId) {
}
