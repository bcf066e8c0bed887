package com.playdate.playservice.support;

import com.playdate.playservice.platform.transport.Envelope;
import com.playdate.playservice.realtime.broadcast.RoomBroadcaster;
import org.mockito.ArgumentCaptor;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.verify;

/**
 * 从 mock 的 SimpMessagingTemplate 中取出推送到 /user/queue/play.events 的事件。
 */
public final class Deliveries {

    private Deliveries() {
    }

    /**
     * @param connection 目标连接（simpSessionId 头）
     */
    public record Delivery(String route, String connection, Envelope<?> envelope) {

        public String event() {
            return envelope.event();
        }

        public Object payload() {
            return envelope.payload();
        }
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    public static List<Delivery> captured(SimpMessagingTemplate messaging) {
        ArgumentCaptor<String> route = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> destination = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        ArgumentCaptor<Map<String, Object>> headers = ArgumentCaptor.forClass((Class) Map.class);
        verify(messaging, atLeast(0)).convertAndSendToUser(
                route.capture(), destination.capture(), payload.capture(), headers.capture());

        List<Delivery> result = new ArrayList<>();
        for (int i = 0; i < route.getAllValues().size(); i++) {
            if (!RoomBroadcaster.USER_DESTINATION.equals(destination.getAllValues().get(i))) {
                continue;
            }
            Object connection = headers.getAllValues().get(i).get(SimpMessageHeaderAccessor.SESSION_ID_HEADER);
            result.add(new Delivery(route.getAllValues().get(i), (String) connection,
                    (Envelope<?>) payload.getAllValues().get(i)));
        }
        return result;
    }

    /** 某条连接收到的事件 */
    public static List<Delivery> to(SimpMessagingTemplate messaging, String connection) {
        return captured(messaging).stream().filter(d -> connection.equals(d.connection())).toList();
    }

    public static List<String> eventsTo(SimpMessagingTemplate messaging, String connection) {
        return to(messaging, connection).stream().map(Delivery::event).toList();
    }

    public static <T> T lastPayload(SimpMessagingTemplate messaging, String connection, String event, Class<T> type) {
        List<Delivery> matched = to(messaging, connection).stream().filter(d -> event.equals(d.event())).toList();
        if (matched.isEmpty()) {
            throw new AssertionError("连接 " + connection + " 未收到事件 " + event);
        }
        return type.cast(matched.get(matched.size() - 1).payload());
    }
}
