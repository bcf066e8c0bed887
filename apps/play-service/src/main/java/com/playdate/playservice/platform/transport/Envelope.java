package com.playdate.playservice.platform.transport;

/**
 * 下行消息外壳：所有推送给客户端的事件都包在这里。
 *
 * 客户端订阅 /user/queue/play.events，按 event 分发：
 * <pre>
 * { "event": "player_join", "sessionId": "session-1a2b3c4d", "payload": {...}, "ts": 1700000000000 }
 * </pre>
 *
 * @param event     事件名（session_created / player_join / error ...）
 * @param sessionId 所属会话，连接级事件（connected / pong / 部分 error）为 null
 * @param payload   事件载荷
 * @param ts        服务器时间戳（ms）
 */
public record Envelope<T>(String event, String sessionId, T payload, long ts) {

    public static <T> Envelope<T> of(String event, String sessionId, T payload, long ts) {
        return new Envelope<>(event, sessionId, payload, ts);
    }
}
