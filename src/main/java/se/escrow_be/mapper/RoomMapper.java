package se.escrow_be.mapper;

import org.springframework.stereotype.Component;
import se.escrow_be.dto.response.*;
import se.escrow_be.pojo.*;
import se.escrow_be.pojo.enums.MessageType;
import se.escrow_be.pojo.enums.Party;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Converts rooms and their owned records into the snapshots sent over REST and WebSocket.
 */
@Component
public class RoomMapper {

    public static final String CHAT_MESSAGE = "chat_message";
    public static final String ADMIN_MESSAGE = "admin_message";

    public RoomResponse convertToResponse(Room room) {
        DescriptionNegotiation negotiation = room.getNegotiation();

        Map<String, EvidenceSubmissionResponse> evidence = new LinkedHashMap<>();
        room.getSubmittedEvidence().forEach((type, submission) -> evidence.put(type, convertEvidence(submission)));

        return RoomResponse.builder()
                .roomPhrase(room.getRoomPhrase())
                .revision(room.getRevision())
                .sellerId(room.getSellerId())
                .buyerId(room.getBuyerId())
                .amount(room.getAmount())
                .description(room.getDescription())
                .status(room.getStatus())
                .negotiationTurn(negotiation != null ? negotiation.getTurn() : null)
                .proposedBy(negotiation != null ? negotiation.getProposedBy() : null)
                .disputeStatus(room.getDisputeStatus())
                .transactionCategory(room.getTransactionCategory())
                .requiredEvidence(new ArrayList<>(room.getRequiredEvidence()))
                .submittedEvidence(evidence)
                .contract(room.getContract() != null ? convertContract(room.getContract()) : null)
                .aiVerdict(convertVerdict(room.getAiVerdict()))
                .messages(room.getMessages().stream().map(this::convertMessage).collect(Collectors.toList()))
                .createdAt(room.getCreatedAt())
                .buyerJoinedAt(room.getBuyerJoinedAt())
                .fundsLockedAt(room.getFundsLockedAt())
                .deliveredAt(room.getDeliveredAt())
                .completedAt(room.getCompletedAt())
                .inactivityDeadline(room.getInactivityDeadline())
                .build();
    }

    public RoomSummaryResponse convertToSummary(Room room) {
        return RoomSummaryResponse.builder()
                .roomPhrase(room.getRoomPhrase())
                .sellerId(room.getSellerId())
                .amount(room.getAmount())
                .status(room.getStatus())
                .createdAt(room.getCreatedAt())
                .build();
    }

    public ContractResponse convertContract(EscrowContract contract) {
        Map<Party, ContractResponse.SignatureView> signatures = new LinkedHashMap<>();
        contract.signaturesByParty().forEach((party, signature) -> signatures.put(party,
                ContractResponse.SignatureView.builder()
                        .decision(signature.getDecision())
                        .signatureHex(signature.getSignatureHex())
                        .verified(signature.isVerified())
                        .signedAt(signature.getSignedAt())
                        .build()));

        return ContractResponse.builder()
                .contractId(contract.getContractId())
                .status(contract.getStatus())
                .fundsLocked(contract.isFundsLocked())
                .amount(contract.getAmount())
                .signatures(signatures)
                .releasedTo(contract.getReleasedTo())
                .releasedToUserId(contract.getReleasedToUserId())
                .releasedAt(contract.getReleasedAt())
                .resolution(contract.getResolution())
                .build();
    }

    public EvidenceSubmissionResponse convertEvidence(EvidenceSubmission submission) {
        return EvidenceSubmissionResponse.builder()
                .evidenceType(submission.getEvidenceType())
                .payloadReference(submission.getPayloadReference())
                .filename(submission.getOriginalFilename())
                .contentType(submission.getContentType())
                .sizeBytes(submission.getSizeBytes())
                .submittedAt(submission.getSubmittedAt())
                .build();
    }

    public ChatMessageResponse convertMessage(RoomMessage message) {
        boolean chat = message.getType() == MessageType.CHAT;
        return ChatMessageResponse.builder()
                .type(chat ? CHAT_MESSAGE : ADMIN_MESSAGE)
                .senderId(message.getSenderId())
                .senderUsername(message.getSenderUsername())
                .message(message.getContent())
                .timestamp(message.getSentAt())
                .build();
    }

    private VerdictResponse convertVerdict(ArbitrationVerdict verdict) {
        // Hibernate leaves an all-null embeddable as null
        if (verdict == null || verdict.getDecision() == null) {
            return null;
        }
        return VerdictResponse.builder()
                .decision(verdict.getDecision())
                .confidence(verdict.getConfidence())
                .reasoning(verdict.getReasoning())
                .summary(verdict.getSummary())
                .decidedAt(verdict.getDecidedAt())
                .build();
    }

    public List<RoomSummaryResponse> convertToSummaries(List<Room> rooms) {
        return rooms.stream().map(this::convertToSummary).collect(Collectors.toList());
    }
}
