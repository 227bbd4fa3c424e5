package se.escrow_be.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import se.escrow_be.dto.response.ChatMessageResponse;
import se.escrow_be.dto.response.RoomResponse;
import se.escrow_be.exception.ErrorKind;
import se.escrow_be.mapper.RoomMapper;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pushes frames to the sessions of a room. Every room-wide frame is queued on the participant's
 * own outbox and drained on the broadcast executor, so the writer never blocks and each session
 * receives frames in the order they were queued. A session that fails a send is dropped.
 */
@Component
@Slf4j
public class RoomBroadcaster {

    public static final String STATE_UPDATE = "state_update";

    private final RoomSessionRegistry sessionRegistry;
    private final ObjectMapper objectMapper;
    private final TaskExecutor broadcastExecutor;
    private final Clock clock;

    public RoomBroadcaster(RoomSessionRegistry sessionRegistry,
                           ObjectMapper objectMapper,
                           @Qualifier("broadcastExecutor") TaskExecutor broadcastExecutor,
                           Clock clock) {
        this.sessionRegistry = sessionRegistry;
        this.objectMapper = objectMapper;
        this.broadcastExecutor = broadcastExecutor;
        this.clock = clock;
    }

    public void broadcastState(RoomResponse room) {
        broadcast(room.getRoomPhrase(), stateFrame(room));
    }

    public void broadcastChat(String roomPhrase, ChatMessageResponse message) {
        broadcast(roomPhrase, message);
    }

    public void broadcastNotice(String roomPhrase, String message) {
        broadcast(roomPhrase, ChatMessageResponse.builder()
                .type(RoomMapper.ADMIN_MESSAGE)
                .message(message)
                .timestamp(LocalDateTime.now(clock))
                .build());
    }

    public void broadcast(String roomPhrase, Object frame) {
        List<ParticipantSession> participants = sessionRegistry.sessionsOf(roomPhrase);
        if (participants.isEmpty()) {
            return;
        }
        TextMessage message = serialize(roomPhrase, frame);
        if (message == null) {
            return;
        }
        for (ParticipantSession participant : participants) {
            enqueue(participant, message);
        }
    }

    /**
     * Queues the join snapshot ahead of any later room frame for this participant.
     */
    public void sendConnected(ParticipantSession participant, RoomResponse room) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", "connected");
        frame.put("user_id", participant.userId());
        frame.put("role", participant.party().name());
        frame.put("revision", room.getRevision());
        frame.put("room", room);
        TextMessage message = serialize(participant.roomPhrase(), frame);
        if (message != null) {
            enqueue(participant, message);
        }
    }

    public void sendError(WebSocketSession session, String message, ErrorKind kind) {
        sendToSession(session, Map.of("type", "error", "message", Objects.requireNonNullElse(message, kind.name()), "kind", kind.name()));
    }

    public void sendWarning(WebSocketSession session, String message) {
        sendToSession(session, Map.of("type", "warning", "message", message));
    }

    public void sendPong(WebSocketSession session) {
        sendToSession(session, Map.of("type", "pong", "timestamp", LocalDateTime.now(clock)));
    }

    /**
     * Direct reply to one session on the caller's thread.
     */
    public void sendToSession(WebSocketSession session, Object frame) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(frame)));
        } catch (IOException | IllegalStateException e) {
            log.error("Failed to send frame to session {}: {}", session.getId(), e.getMessage(), e);
        }
    }

    private Map<String, Object> stateFrame(RoomResponse room) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", STATE_UPDATE);
        frame.put("status", room.getStatus());
        frame.put("revision", room.getRevision());
        frame.put("room", room);
        return frame;
    }

    private TextMessage serialize(String roomPhrase, Object frame) {
        try {
            return new TextMessage(objectMapper.writeValueAsString(frame));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize frame for room '{}': {}", roomPhrase, e.getMessage(), e);
            return null;
        }
    }

    private void enqueue(ParticipantSession participant, TextMessage message) {
        participant.outbox().offer(message);
        scheduleDrain(participant);
    }

    private void scheduleDrain(ParticipantSession participant) {
        SessionOutbox outbox = participant.outbox();
        if (!outbox.claim()) {
            return;
        }
        try {
            broadcastExecutor.execute(() -> drain(participant));
        } catch (TaskRejectedException e) {
            outbox.release();
            log.error("Broadcast executor rejected frames for session {} in room '{}': {}",
                    participant.sessionId(), participant.roomPhrase(), e.getMessage());
        }
    }

    private void drain(ParticipantSession participant) {
        SessionOutbox outbox = participant.outbox();
        try {
            TextMessage next;
            while ((next = outbox.poll()) != null) {
                if (!deliver(participant, next)) {
                    outbox.clear();
                    return;
                }
            }
        } finally {
            outbox.release();
        }
        // A frame queued between the last poll and the release has no drainer yet
        if (outbox.hasPending()) {
            scheduleDrain(participant);
        }
    }

    private boolean deliver(ParticipantSession participant, TextMessage message) {
        WebSocketSession session = participant.session();
        if (!session.isOpen()) {
            sessionRegistry.unregister(participant);
            return false;
        }
        try {
            session.sendMessage(message);
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("Broadcast to session {} of user {} in room '{}' failed; dropping it: {}",
                    participant.sessionId(), participant.userId(), participant.roomPhrase(), e.getMessage(), e);
            sessionRegistry.unregister(participant);
            closeQuietly(session);
            return false;
        }
    }

    private void closeQuietly(WebSocketSession session) {
        try {
            session.close(CloseStatus.SESSION_NOT_RELIABLE);
        } catch (IOException e) {
            log.debug("Closing unreliable session {} failed: {}", session.getId(), e.getMessage());
        }
    }
}
