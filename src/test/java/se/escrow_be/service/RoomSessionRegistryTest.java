package se.escrow_be.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.WebSocketSession;
import se.escrow_be.pojo.enums.Party;

import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class RoomSessionRegistryTest {

    private static final String PHRASE = "amber river quiet stone";

    private final RoomSessionRegistry registry = new RoomSessionRegistry();

    @Test
    @DisplayName("Sessions are listed per room and removed on unregister")
    void registerAndUnregister() {
        ParticipantSession seller = participant("seller-1", Party.SELLER);
        ParticipantSession buyer = participant("buyer-1", Party.BUYER);
        registry.register(seller);
        registry.register(buyer);
        registry.register(participant("other", Party.SELLER, "another room"));

        assertThat(registry.sessionsOf(PHRASE)).containsExactlyInAnyOrder(seller, buyer);
        assertThat(registry.unregister(seller)).isTrue();
        assertThat(registry.unregister(seller)).isFalse();
        assertThat(registry.sessionsOf(PHRASE)).containsExactly(buyer);
        assertThat(registry.sessionCount("another room")).isEqualTo(1);
    }

    @Test
    @DisplayName("Two connections of the same user are separate participants")
    void sameUserTwice() {
        ParticipantSession first = participant("buyer-1", Party.BUYER);
        ParticipantSession second = participant("buyer-1", Party.BUYER);
        registry.register(first);
        registry.register(second);

        registry.unregister(first);

        assertThat(registry.sessionsOf(PHRASE)).containsExactly(second);
    }

    @Test
    @DisplayName("A join racing the last departure of a room is never lost")
    void joinRacingLastDeparture() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 500; round++) {
                ParticipantSession leaving = participant("seller-1", Party.SELLER);
                ParticipantSession joining = participant("buyer-1", Party.BUYER);
                registry.register(leaving);
                CyclicBarrier start = new CyclicBarrier(2);

                Future<?> leave = pool.submit(() -> {
                    start.await();
                    return registry.unregister(leaving);
                });
                Future<?> join = pool.submit(() -> {
                    start.await();
                    registry.register(joining);
                    return null;
                });
                leave.get(5, TimeUnit.SECONDS);
                join.get(5, TimeUnit.SECONDS);

                assertThat(registry.sessionsOf(PHRASE)).containsExactly(joining);
                registry.unregister(joining);
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(registry.sessionCount(PHRASE)).isZero();
    }

    private static ParticipantSession participant(String userId, Party party) {
        return participant(userId, party, PHRASE);
    }

    private static ParticipantSession participant(String userId, Party party, String phrase) {
        return new ParticipantSession(mock(WebSocketSession.class), phrase, userId, party, userId);
    }
}
