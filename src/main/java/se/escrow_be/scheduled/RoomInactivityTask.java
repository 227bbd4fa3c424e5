package se.escrow_be.scheduled;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import se.escrow_be.repository.RoomRepository;
import se.escrow_be.service.RoomIntentDispatcher;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Applies the default resolution to rooms whose inactivity deadline has passed. Candidates are
 * re-checked under the room lock, so a room is resolved at most once and a transition that
 * lands first cancels the timeout.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RoomInactivityTask {

    private final RoomRepository roomRepository;
    private final RoomIntentDispatcher dispatcher;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${escrow.inactivity.scan-interval-ms:60000}")
    public void scanInactiveRooms() {
        resolveInactiveRooms(LocalDateTime.now(clock));
    }

    public int resolveInactiveRooms(LocalDateTime now) {
        List<String> expired = roomRepository.findRoomPhrasesInactiveSince(now);
        if (expired.isEmpty()) {
            log.debug("No inactive rooms found");
            return 0;
        }

        log.info("Found {} rooms past their inactivity deadline", expired.size());
        int resolved = 0;
        for (String phrase : expired) {
            try {
                if (dispatcher.resolveInactive(phrase, now).isPresent()) {
                    resolved++;
                }
            } catch (Exception e) {
                log.error("Failed to resolve inactive room '{}': {}", phrase, e.getMessage(), e);
            }
        }
        log.info("Inactivity scan resolved {} of {} rooms", resolved, expired.size());
        return resolved;
    }
}
