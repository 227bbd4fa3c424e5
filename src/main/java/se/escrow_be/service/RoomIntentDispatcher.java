package se.escrow_be.service;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.socket.WebSocketSession;
import se.escrow_be.dto.oracle.OracleVerdict;
import se.escrow_be.dto.response.ChatMessageResponse;
import se.escrow_be.dto.response.EvidenceSubmissionResponse;
import se.escrow_be.dto.response.RoomResponse;
import se.escrow_be.exception.BusinessLogicException;
import se.escrow_be.pojo.enums.Decision;
import se.escrow_be.pojo.enums.IntentType;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Optional;

/**
 * Single entry point for every room writer: WebSocket intents, REST evidence uploads, oracle
 * verdicts and the inactivity task. Runs each change under the room lock and lets the
 * transaction commit inside it. The committed snapshot is queued for broadcast before the lock
 * is released, so every session receives snapshots in commit order; delivery itself happens on
 * the broadcast executor.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RoomIntentDispatcher {

    private final RoomLockRegistry lockRegistry;
    private final RoomService roomService;
    private final DisputeService disputeService;
    private final RoomBroadcaster broadcaster;
    private final RoomSessionRegistry sessionRegistry;

    /**
     * Admits a connection and registers it in the same locked section, so no transition can
     * commit between the join snapshot and the session joining the broadcast set.
     */
    public ParticipantSession join(String roomPhrase, String userId, WebSocketSession session) {
        return lockRegistry.withRoomLock(roomPhrase, () -> {
            JoinResult result = roomService.join(roomPhrase, userId);
            ParticipantSession participant = new ParticipantSession(session, roomPhrase, userId, result.party(), result.username());
            sessionRegistry.register(participant);
            broadcaster.sendConnected(participant, result.room());
            if (result.buyerAssigned()) {
                broadcaster.broadcastState(result.room());
            }
            return participant;
        });
    }

    /**
     * Applies one client intent. Rejections propagate as exceptions to the caller, which answers
     * the sender only.
     */
    public void dispatch(ParticipantSession participant, IntentType intent, JsonNode payload) {
        String phrase = participant.roomPhrase();
        String userId = participant.userId();
        log.debug("Intent {} from user {} in room '{}'", intent.getWireName(), userId, phrase);

        if (intent == IntentType.CHAT_MESSAGE) {
            lockRegistry.withRoomLock(phrase, () -> {
                ChatMessageResponse chat = roomService.appendChat(phrase, userId, text(payload, "message"));
                broadcaster.broadcastChat(phrase, chat);
                return chat;
            });
            return;
        }

        lockRegistry.withRoomLock(phrase, () -> publish(switch (intent) {
            case PROPOSE_DESCRIPTION -> roomService.proposeDescription(phrase, userId, text(payload, "description"));
            case EDIT_DESCRIPTION -> roomService.editDescription(phrase, userId, text(payload, "description"));
            case APPROVE_DESCRIPTION -> roomService.approveDescription(phrase, userId);
            case CONFIRM_SELLER_READY -> roomService.confirmSellerReady(phrase, userId);
            case BUYER_LOCK_FUNDS -> roomService.lockFunds(phrase, userId);
            case PRODUCT_DELIVERED -> roomService.markDelivered(phrase, userId, requiredText(payload, "signed_message"));
            case TRANSACTION_SUCCESSFULL -> roomService.confirmReceipt(phrase, userId, requiredText(payload, "signed_message"));
            case SUBMIT_SIGNATURE -> roomService.submitSignature(phrase, userId,
                    decision(payload), requiredText(payload, "signed_message"));
            case INIT_DISPUTE -> disputeService.initDispute(phrase, userId, text(payload, "signed_message"));
            case FINALIZE_SUBMISSION -> disputeService.finalizeSubmission(phrase, userId);
            case CHAT_MESSAGE, PING -> throw new IllegalArgumentException(intent + " is not a state transition");
        }));
    }

    public EvidenceSubmissionResponse uploadEvidence(String roomPhrase, String userId, String evidenceType, MultipartFile file) {
        return lockRegistry.withRoomLock(roomPhrase, () -> {
            EvidenceSubmissionResponse submission = disputeService.uploadEvidence(roomPhrase, userId, evidenceType, file);
            publish(roomService.getRoom(roomPhrase));
            return submission;
        });
    }

    public Optional<RoomResponse> applyVerdict(String roomPhrase, OracleVerdict verdict) {
        return lockRegistry.withRoomLock(roomPhrase, () -> {
            Optional<RoomResponse> snapshot = disputeService.applyVerdict(roomPhrase, verdict);
            snapshot.ifPresent(this::publish);
            return snapshot;
        });
    }

    public Optional<RoomResponse> resolveAfterOracleFailure(String roomPhrase) {
        return lockRegistry.withRoomLock(roomPhrase, () -> {
            Optional<RoomResponse> snapshot = disputeService.resolveAfterOracleFailure(roomPhrase);
            snapshot.ifPresent(this::publish);
            return snapshot;
        });
    }

    public Optional<RoomResponse> resolveInactive(String roomPhrase, LocalDateTime now) {
        return lockRegistry.withRoomLock(roomPhrase, () -> {
            Optional<RoomResponse> snapshot = roomService.resolveInactive(roomPhrase, now);
            snapshot.ifPresent(this::publish);
            return snapshot;
        });
    }

    private RoomResponse publish(RoomResponse snapshot) {
        broadcaster.broadcastState(snapshot);
        return snapshot;
    }

    private static String text(JsonNode payload, String field) {
        JsonNode node = payload == null ? null : payload.get(field);
        return node != null && node.isTextual() ? node.asText() : null;
    }

    private static String requiredText(JsonNode payload, String field) {
        String value = text(payload, field);
        if (value == null || value.isBlank()) {
            throw new BusinessLogicException("Field '" + field + "' is required");
        }
        return value;
    }

    private static Decision decision(JsonNode payload) {
        String value = requiredText(payload, "decision");
        try {
            return Decision.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new BusinessLogicException("Unknown decision '" + value + "'; expected RELEASE_TO_SELLER or REFUND_TO_BUYER");
        }
    }
}
