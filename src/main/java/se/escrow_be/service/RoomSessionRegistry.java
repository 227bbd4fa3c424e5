package se.escrow_be.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connected sessions per room. Entries are added on an accepted join and removed on
 * disconnect or on a failed send.
 */
@Component
@Slf4j
public class RoomSessionRegistry {

    private final Map<String, Set<ParticipantSession>> rooms = new ConcurrentHashMap<>();

    public void register(ParticipantSession participant) {
        // Inside compute so a concurrent unregister cannot drop the set this session lands in
        rooms.compute(participant.roomPhrase(), (phrase, sessions) -> {
            Set<ParticipantSession> target = sessions != null ? sessions : ConcurrentHashMap.newKeySet();
            target.add(participant);
            return target;
        });
        log.debug("Registered session {} of user {} in room '{}'", participant.sessionId(), participant.userId(), participant.roomPhrase());
    }

    /**
     * @return whether the session was still registered
     */
    public boolean unregister(ParticipantSession participant) {
        boolean[] removed = {false};
        rooms.computeIfPresent(participant.roomPhrase(), (phrase, sessions) -> {
            removed[0] = sessions.remove(participant);
            return sessions.isEmpty() ? null : sessions;
        });
        return removed[0];
    }

    public List<ParticipantSession> sessionsOf(String roomPhrase) {
        Set<ParticipantSession> sessions = rooms.get(roomPhrase);
        return sessions == null ? List.of() : List.copyOf(sessions);
    }

    public int sessionCount(String roomPhrase) {
        Set<ParticipantSession> sessions = rooms.get(roomPhrase);
        return sessions == null ? 0 : sessions.size();
    }
}
