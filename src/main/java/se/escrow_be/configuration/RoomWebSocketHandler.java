package se.escrow_be.configuration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.*;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import se.escrow_be.exception.*;
import se.escrow_be.pojo.enums.IntentType;
import se.escrow_be.service.*;

import java.io.IOException;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Room socket at {@code /api/ws/{room_phrase}/{user_id}}. Joins on connect, turns each text frame
 * into an intent, and answers rejections to the sender only.
 */
@Component
@Slf4j
public class RoomWebSocketHandler implements WebSocketHandler {

    static final String PARTICIPANT_ATTRIBUTE = "escrow.participant";

    private final RoomIntentDispatcher dispatcher;
    private final RoomSessionRegistry sessionRegistry;
    private final RoomBroadcaster broadcaster;
    private final ObjectMapper objectMapper;
    private final int sendTimeLimitMs;
    private final int bufferSizeLimit;

    public RoomWebSocketHandler(RoomIntentDispatcher dispatcher,
                                RoomSessionRegistry sessionRegistry,
                                RoomBroadcaster broadcaster,
                                ObjectMapper objectMapper,
                                @Value("${escrow.websocket.send-time-limit-ms:10000}") int sendTimeLimitMs,
                                @Value("${escrow.websocket.buffer-size-limit:524288}") int bufferSizeLimit) {
        this.dispatcher = dispatcher;
        this.sessionRegistry = sessionRegistry;
        this.broadcaster = broadcaster;
        this.objectMapper = objectMapper;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferSizeLimit = bufferSizeLimit;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession rawSession) throws Exception {
        WebSocketSession session = new ConcurrentWebSocketSessionDecorator(rawSession, sendTimeLimitMs, bufferSizeLimit);

        Optional<String[]> target = parsePath(session.getUri());
        if (target.isEmpty()) {
            log.warn("Rejecting session {} with malformed path {}", session.getId(), session.getUri());
            close(session, CloseStatus.PROTOCOL_ERROR.withReason("Expected /api/ws/{room_phrase}/{user_id}"));
            return;
        }
        String roomPhrase = target.get()[0];
        String userId = target.get()[1];

        ParticipantSession participant;
        try {
            participant = dispatcher.join(roomPhrase, userId, session);
        } catch (UnauthorizedPartyException | ResourceNotFoundException e) {
            log.warn("Refused join of user {} to room '{}': {}", userId, roomPhrase, e.getMessage());
            close(session, CloseStatus.POLICY_VIOLATION.withReason(reason(e.getMessage())));
            return;
        } catch (RuntimeException e) {
            log.error("Join of user {} to room '{}' failed: {}", userId, roomPhrase, e.getMessage(), e);
            close(session, CloseStatus.SERVER_ERROR.withReason("Internal error"));
            return;
        }

        rawSession.getAttributes().put(PARTICIPANT_ATTRIBUTE, participant);
        broadcaster.broadcastNotice(roomPhrase, participant.party() + " " + participant.username() + " joined the room");
        log.info("User {} connected to room '{}' as {} with session {}", userId, roomPhrase, participant.party(), session.getId());
    }

    @Override
    public void handleMessage(WebSocketSession rawSession, WebSocketMessage<?> message) throws Exception {
        ParticipantSession participant = participantOf(rawSession);
        if (participant == null) {
            close(rawSession, CloseStatus.POLICY_VIOLATION.withReason("Not joined"));
            return;
        }
        WebSocketSession session = participant.session();

        if (!(message instanceof TextMessage textMessage)) {
            close(session, CloseStatus.PROTOCOL_ERROR.withReason("Only text frames are accepted"));
            return;
        }

        JsonNode envelope;
        try {
            envelope = objectMapper.readTree(textMessage.getPayload());
        } catch (JsonProcessingException e) {
            log.warn("Malformed frame from user {} in room '{}': {}", participant.userId(), participant.roomPhrase(), e.getOriginalMessage());
            close(session, CloseStatus.PROTOCOL_ERROR.withReason("Malformed JSON envelope"));
            return;
        }
        JsonNode typeNode = envelope == null ? null : envelope.get("type");
        if (envelope == null || !envelope.isObject() || typeNode == null || !typeNode.isTextual()) {
            close(session, CloseStatus.PROTOCOL_ERROR.withReason("Envelope must be an object with a string type"));
            return;
        }

        String type = typeNode.asText();
        try {
            IntentType intent = IntentType.fromWireName(type)
                    .orElseThrow(() -> new UnknownMessageTypeException("Unknown message type: " + type));
            if (intent == IntentType.PING) {
                broadcaster.sendPong(session);
                return;
            }
            dispatcher.dispatch(participant, intent, envelope);
        } catch (UnknownMessageTypeException e) {
            log.warn("User {} in room '{}' sent unknown type '{}'", participant.userId(), participant.roomPhrase(), type);
            broadcaster.sendWarning(session, e.getMessage());
        } catch (EscrowStateException e) {
            log.error("Internal fault handling {} from user {} in room '{}': {}",
                    type, participant.userId(), participant.roomPhrase(), e.getMessage(), e);
            broadcaster.sendError(session, "Internal error", ErrorKind.INTERNAL);
        } catch (EscrowException e) {
            log.warn("Rejected {} from user {} in room '{}': {}", type, participant.userId(), participant.roomPhrase(), e.getMessage());
            broadcaster.sendError(session, e.getMessage(), e.getKind());
        } catch (RuntimeException e) {
            log.error("Error handling {} from user {} in room '{}': {}",
                    type, participant.userId(), participant.roomPhrase(), e.getMessage(), e);
            broadcaster.sendError(session, "Internal error", ErrorKind.INTERNAL);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) throws Exception {
        log.error("Transport error for session {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus closeStatus) throws Exception {
        ParticipantSession participant = participantOf(session);
        if (participant == null) {
            return;
        }
        sessionRegistry.unregister(participant);
        broadcaster.broadcastNotice(participant.roomPhrase(), participant.party() + " " + participant.username() + " left the room");
        log.info("User {} left room '{}' ({})", participant.userId(), participant.roomPhrase(), closeStatus);
    }

    @Override
    public boolean supportsPartialMessages() {
        return false;
    }

    static Optional<String[]> parsePath(URI uri) {
        if (uri == null || uri.getRawPath() == null) {
            return Optional.empty();
        }
        String[] segments = uri.getRawPath().split("/");
        // ["", "api", "ws", phrase, userId]
        if (segments.length != 5 || !"api".equals(segments[1]) || !"ws".equals(segments[2])) {
            return Optional.empty();
        }
        String phrase = URLDecoder.decode(segments[3], StandardCharsets.UTF_8).trim();
        String userId = URLDecoder.decode(segments[4], StandardCharsets.UTF_8).trim();
        if (phrase.isEmpty() || userId.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new String[]{phrase, userId});
    }

    private static ParticipantSession participantOf(WebSocketSession session) {
        Object participant = session.getAttributes().get(PARTICIPANT_ATTRIBUTE);
        return participant instanceof ParticipantSession p ? p : null;
    }

    // Close reasons are limited to 123 bytes
    private static String reason(String message) {
        if (message == null) {
            return "Refused";
        }
        return message.length() > 100 ? message.substring(0, 100) : message;
    }

    private static void close(WebSocketSession session, CloseStatus status) {
        try {
            session.close(status);
        } catch (IOException e) {
            log.debug("Closing session {} failed: {}", session.getId(), e.getMessage());
        }
    }
}
