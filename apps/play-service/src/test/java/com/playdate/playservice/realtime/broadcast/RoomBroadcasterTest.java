package com.playdate.playservice.realtime.broadcast;

import com.playdate.playservice.realtime.connection.ConnectionHandle;
import com.playdate.playservice.support.Deliveries;
import com.playdate.playservice.support.Deliveries.Delivery;
import com.playdate.playservice.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class RoomBroadcasterTest {

    @Mock
    SimpMessagingTemplate messaging;

    private RoomBroadcaster broadcaster;

    private final ConnectionHandle alice = new ConnectionHandle("ws-a", "alice");
    private final ConnectionHandle anonymous = new ConnectionHandle("ws-b", null);

    @BeforeEach
    void setUp() {
        broadcaster = new RoomBroadcaster(messaging, MutableClock.startingAt("2026-01-01T00:00:00Z"));
        broadcaster.join("s1", alice);
        broadcaster.join("s1", anonymous);
    }

    @Test
    void broadcastReachesEveryConnectionExceptExcluded() {
        broadcaster.broadcast("s1", "game_update", Map.of("k", "v"), alice);

        List<Delivery> sent = Deliveries.captured(messaging);
        assertThat(sent).hasSize(1);
        Delivery d = sent.get(0);
        assertThat(d.connection()).isEqualTo("ws-b");
        assertThat(d.route()).isEqualTo("ws-b");
        assertThat(d.event()).isEqualTo("game_update");
        assertThat(d.envelope().sessionId()).isEqualTo("s1");
        assertThat(d.envelope().ts()).isEqualTo(1767225600000L);
    }

    @Test
    void authenticatedConnectionIsRoutedByPrincipal() {
        broadcaster.sendTo(alice, "s1", "pong", "x");

        assertThat(Deliveries.captured(messaging)).singleElement()
                .satisfies(d -> {
                    assertThat(d.route()).isEqualTo("alice");
                    assertThat(d.connection()).isEqualTo("ws-a");
                });
    }

    @Test
    void leaveAllRemovesConnectionFromRooms() {
        broadcaster.join("s2", alice);

        broadcaster.leaveAll(alice);

        assertThat(broadcaster.members("s1")).containsExactly(anonymous);
        assertThat(broadcaster.members("s2")).isEmpty();
    }

    @Test
    void dissolvedRoomReceivesNothing() {
        broadcaster.dissolve("s1");

        broadcaster.broadcast("s1", "player_leave", "x");

        verifyNoInteractions(messaging);
    }

    @Test
    void deliveryFailureDoesNotPropagate() {
        doThrow(new MessagingException("broken pipe"))
                .when(messaging).convertAndSendToUser(eq("alice"), anyString(), any(Object.class), anyMap());

        assertThatCode(() -> broadcaster.broadcast("s1", "communication", "hi")).doesNotThrowAnyException();
        assertThat(Deliveries.captured(messaging)).extracting(Delivery::connection).contains("ws-b");
    }

    @Test
    void sendToNullHandleIsNoop() {
        broadcaster.sendTo(null, "s1", "error", "x");

        verifyNoInteractions(messaging);
    }
}
