package se.escrow_be.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.escrow_be.pojo.enums.DisputeStatus;
import se.escrow_be.pojo.enums.Party;
import se.escrow_be.pojo.enums.RoomStatus;
import se.escrow_be.pojo.enums.TransactionCategory;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Full room snapshot. Sent on join, pushed on every committed transition and returned by the REST API.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoomResponse {
    private String roomPhrase;
    private long revision;
    private String sellerId;
    private String buyerId;
    private BigDecimal amount;
    private String description;
    private RoomStatus status;
    private Party negotiationTurn;
    private Party proposedBy;
    private DisputeStatus disputeStatus;
    private TransactionCategory transactionCategory;
    private List<String> requiredEvidence;
    private Map<String, EvidenceSubmissionResponse> submittedEvidence;
    private ContractResponse contract;
    private VerdictResponse aiVerdict;
    private List<ChatMessageResponse> messages;
    private LocalDateTime createdAt;
    private LocalDateTime buyerJoinedAt;
    private LocalDateTime fundsLockedAt;
    private LocalDateTime deliveredAt;
    private LocalDateTime completedAt;
    private LocalDateTime inactivityDeadline;
}
