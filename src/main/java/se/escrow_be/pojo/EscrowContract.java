package se.escrow_be.pojo;

import jakarta.persistence.*;
import lombok.*;
import se.escrow_be.pojo.enums.ContractStatus;
import se.escrow_be.pojo.enums.Party;
import se.escrow_be.pojo.enums.ResolutionSource;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Release authorization record owned by exactly one room, created when the buyer locks funds.
 */
@Entity
@Table(name = "escrow_contracts")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EscrowContract {

    @Id
    @Column(length = 32)
    private String contractId;

    @OneToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "room_phrase", nullable = false, unique = true)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Room room;

    @Column(nullable = false, length = 36)
    private String buyerId;

    @Column(nullable = false, length = 36)
    private String sellerId;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private ContractStatus status = ContractStatus.PENDING;

    @Builder.Default
    private boolean fundsLocked = true;

    @OneToMany(mappedBy = "contract", cascade = CascadeType.ALL, orphanRemoval = true)
    @MapKey(name = "party")
    @Builder.Default
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Map<Party, PartySignature> signatures = new HashMap<>();

    @Enumerated(EnumType.STRING)
    @Column(length = 10)
    private Party releasedTo;

    @Column(length = 36)
    private String releasedToUserId;

    private LocalDateTime releasedAt;

    @Enumerated(EnumType.STRING)
    @Column(length = 32)
    private ResolutionSource resolution;

    private LocalDateTime createdAt;

    public String userIdOf(Party party) {
        return switch (party) {
            case BUYER -> buyerId;
            case SELLER -> sellerId;
            case AI_ORACLE -> null;
        };
    }

    public void putSignature(PartySignature signature) {
        signature.setContract(this);
        signatures.put(signature.getParty(), signature);
    }

    public Map<Party, PartySignature> signaturesByParty() {
        Map<Party, PartySignature> ordered = new EnumMap<>(Party.class);
        ordered.putAll(signatures);
        return ordered;
    }
}
