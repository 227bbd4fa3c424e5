package se.escrow_be.pojo;

import jakarta.persistence.*;
import lombok.*;
import se.escrow_be.pojo.enums.DisputeStatus;
import se.escrow_be.pojo.enums.RoomStatus;
import se.escrow_be.pojo.enums.TransactionCategory;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Entity
@Table(name = "rooms")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Room {

    @Id
    @Column(name = "room_phrase", length = 120)
    private String roomPhrase;

    @Column(nullable = false, length = 36, updatable = false)
    private String sellerId;

    @Column(length = 36)
    private String buyerId;

    @Column(nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal amount;

    // Always the most recently submitted proposal
    @Column(columnDefinition = "text")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    @Builder.Default
    private RoomStatus status = RoomStatus.WAITING_FOR_BUYER;

    @Embedded
    @Builder.Default
    private DescriptionNegotiation negotiation = new DescriptionNegotiation();

    @Enumerated(EnumType.STRING)
    @Column(length = 32)
    private DisputeStatus disputeStatus;

    @Enumerated(EnumType.STRING)
    @Column(length = 32)
    private TransactionCategory transactionCategory;

    @ElementCollection
    @CollectionTable(name = "room_required_evidence", joinColumns = @JoinColumn(name = "room_phrase"))
    @OrderColumn(name = "position")
    @Column(name = "evidence_type", length = 64)
    @Builder.Default
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<String> requiredEvidence = new ArrayList<>();

    @OneToMany(mappedBy = "room", cascade = CascadeType.ALL, orphanRemoval = true)
    @MapKey(name = "evidenceType")
    @Builder.Default
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Map<String, EvidenceSubmission> submittedEvidence = new LinkedHashMap<>();

    @OneToOne(mappedBy = "room", cascade = CascadeType.ALL, orphanRemoval = true)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private EscrowContract contract;

    @Embedded
    private ArbitrationVerdict aiVerdict;

    @OneToMany(mappedBy = "room", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("messageId ASC")
    @Builder.Default
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<RoomMessage> messages = new ArrayList<>();

    private LocalDateTime createdAt;
    private LocalDateTime buyerJoinedAt;
    private LocalDateTime fundsLockedAt;
    private LocalDateTime deliveredAt;
    private LocalDateTime completedAt;

    private LocalDateTime lastTransitionAt;

    // Null once the room is terminal
    private LocalDateTime inactivityDeadline;

    // Bumped on every committed transition; clients drop snapshots older than the last one seen
    @Column(nullable = false)
    @Builder.Default
    private long revision = 0L;

    @Version
    private Long version;

    // Hibernate materializes an all-null embeddable as null
    public DescriptionNegotiation getNegotiation() {
        if (negotiation == null) {
            negotiation = new DescriptionNegotiation();
        }
        return negotiation;
    }

    public void attachContract(EscrowContract contract) {
        contract.setRoom(this);
        this.contract = contract;
    }

    public void appendMessage(RoomMessage message) {
        message.setRoom(this);
        messages.add(message);
    }

    public void putEvidence(EvidenceSubmission submission) {
        submission.setRoom(this);
        submittedEvidence.put(submission.getEvidenceType(), submission);
    }
}
