package com.playdate.playservice.realtime.infrastructure.memory;

import com.playdate.playservice.realtime.domain.exception.SessionAlreadyExistsException;
import com.playdate.playservice.realtime.domain.exception.SessionNotFoundException;
import com.playdate.playservice.realtime.domain.model.GameSession;
import com.playdate.playservice.realtime.domain.model.SessionStatus;
import com.playdate.playservice.realtime.domain.model.SessionSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemorySessionStoreTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private InMemorySessionStore store;

    @BeforeEach
    void setUp() {
        store = new InMemorySessionStore();
    }

    private static GameSession sessionWith(String id, Instant createdAt, String... players) {
        GameSession s = new GameSession(id, "chess", createdAt);
        for (String p : players) {
            s.join(p, p, true, createdAt);
        }
        return s;
    }

    @Test
    void createRejectsEmptySession() {
        assertThatThrownBy(() -> store.create(new GameSession("s1", "chess", T0)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void createRejectsDuplicateId() {
        store.create(sessionWith("s1", T0, "alice"));

        assertThatThrownBy(() -> store.create(sessionWith("s1", T0, "bob")))
                .isInstanceOf(SessionAlreadyExistsException.class);
        assertThat(store.get("s1").orElseThrow().isMember("alice")).isTrue();
    }

    @Test
    void getReturnsDetachedCopy() {
        store.create(sessionWith("s1", T0, "alice"));

        GameSession copy = store.get("s1").orElseThrow();
        copy.removePlayer("alice");

        assertThat(store.get("s1").orElseThrow().isMember("alice")).isTrue();
    }

    @Test
    void mutateUnknownSessionThrowsNotFound() {
        assertThatThrownBy(() -> store.mutate("missing", s -> null))
                .isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    void sessionEmptiedByMutationIsRemoved() {
        store.create(sessionWith("s1", T0, "alice"));

        store.mutate("s1", s -> s.removePlayer("alice"));

        assertThat(store.get("s1")).isEmpty();
        assertThat(store.sessionIds()).isEmpty();
        assertThatThrownBy(() -> store.mutate("s1", s -> null)).isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    void removeIfOnlyRemovesWhenConditionHolds() {
        store.create(sessionWith("s1", T0, "alice"));

        assertThat(store.removeIf("s1", s -> s.getStatus().isTerminal())).isEmpty();
        assertThat(store.removeIf("s1", s -> s.isMember("alice"))).isPresent();
        assertThat(store.get("s1")).isEmpty();
    }

    @Test
    void listByStatusFiltersAndOrdersNewestFirst() {
        store.create(sessionWith("old", T0, "alice"));
        store.create(sessionWith("new", T0.plusSeconds(60), "bob"));
        store.create(sessionWith("done", T0.plusSeconds(30), "carol"));
        store.mutate("done", s -> {
            s.finish(SessionStatus.COMPLETED, T0.plusSeconds(90));
            return null;
        });

        List<SessionSummary> waiting = store.listByStatus(SessionStatus.WAITING);

        assertThat(waiting).extracting(SessionSummary::id).containsExactly("new", "old");
        assertThat(waiting.get(0).playerCount()).isEqualTo(1);
        assertThat(waiting.get(0).maxPlayers()).isEqualTo(GameSession.MAX_PLAYERS);
        assertThat(store.listByStatus(null)).hasSize(3);
    }

    @Test
    void concurrentJoinsNeverExceedCapacity() throws Exception {
        store.create(sessionWith("s1", T0, "host"));
        int contenders = 16;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger accepted = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        try {
            for (int i = 0; i < contenders; i++) {
                String player = "p" + i;
                pool.submit(() -> {
                    start.await();
                    try {
                        store.mutate("s1", s -> s.join(player, player, true, T0));
                        accepted.incrementAndGet();
                    } catch (IllegalStateException e) {
                        rejected.incrementAndGet();
                    }
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }

        assertThat(accepted.get()).isEqualTo(1);
        assertThat(rejected.get()).isEqualTo(contenders - 1);
        assertThat(store.get("s1").orElseThrow().getPlayers()).hasSize(GameSession.MAX_PLAYERS);
    }
}
