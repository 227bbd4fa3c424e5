package se.escrow_be.pojo;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.escrow_be.pojo.enums.Party;
import se.escrow_be.pojo.enums.RoomStatus;

/**
 * Two-state negotiation over the room description. {@code turn} is the party that must
 * approve or counter the latest proposal; it is always the counterparty of {@code proposedBy}.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DescriptionNegotiation {

    @Enumerated(EnumType.STRING)
    @Column(name = "negotiation_turn", length = 10)
    private Party turn;

    @Enumerated(EnumType.STRING)
    @Column(name = "proposed_by", length = 10)
    private Party proposedBy;

    @Column(name = "negotiation_rounds")
    private int rounds;

    public void recordProposal(Party author) {
        this.proposedBy = author;
        this.turn = author.counterparty();
        this.rounds++;
    }

    public boolean isTurnOf(Party party) {
        return turn == party;
    }

    public RoomStatus awaitingStatus() {
        if (turn == null) {
            throw new IllegalStateException("No proposal is open");
        }
        return turn == Party.SELLER ? RoomStatus.AWAITING_SELLER_APPROVAL : RoomStatus.AWAITING_BUYER_APPROVAL;
    }

    public void close() {
        this.turn = null;
    }
}
