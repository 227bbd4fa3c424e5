package se.escrow_be.pojo;

import jakarta.persistence.*;
import lombok.*;
import se.escrow_be.pojo.enums.Decision;
import se.escrow_be.pojo.enums.Party;

import java.time.LocalDateTime;

@Entity
@Table(name = "party_signatures")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PartySignature {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long signatureId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "contract_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private EscrowContract contract;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private Party party;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private Decision decision;

    @Column(nullable = false, columnDefinition = "text")
    @ToString.Exclude
    private String signatureHex;

    private boolean verified;

    @Column(nullable = false)
    private LocalDateTime signedAt;
}
