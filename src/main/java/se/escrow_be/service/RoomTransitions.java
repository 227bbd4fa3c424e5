package se.escrow_be.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import se.escrow_be.configuration.properties.InactivityProperties;
import se.escrow_be.exception.EscrowStateException;
import se.escrow_be.pojo.EscrowContract;
import se.escrow_be.pojo.Room;
import se.escrow_be.pojo.RoomMessage;
import se.escrow_be.pojo.enums.Decision;
import se.escrow_be.pojo.enums.MessageType;
import se.escrow_be.pojo.enums.DisputeStatus;
import se.escrow_be.pojo.enums.Party;
import se.escrow_be.pojo.enums.ResolutionSource;
import se.escrow_be.pojo.enums.RoomStatus;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Status bookkeeping shared by every service that moves a room: the transition timestamp,
 * the inactivity deadline and the structural invariants checked before commit.
 */
@Component
@RequiredArgsConstructor
public class RoomTransitions {

    private final Clock clock;
    private final InactivityProperties inactivityProperties;

    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    public void advance(Room room, RoomStatus next) {
        room.setStatus(next);
        touch(room);
    }

    /**
     * Records a committed transition without a status change (dispute sub-state moves,
     * accepted signatures). Restarts the inactivity window.
     */
    public void touch(Room room) {
        LocalDateTime now = now();
        room.setLastTransitionAt(now);
        room.setRevision(room.getRevision() + 1);
        if (room.getStatus().isTerminal()) {
            room.setInactivityDeadline(null);
            if (room.getCompletedAt() == null) {
                room.setCompletedAt(now);
            }
        } else {
            room.setInactivityDeadline(now.plus(inactivityProperties.getTimeout()));
        }
    }

    public void complete(Room room) {
        room.setDisputeStatus(null);
        advance(room, RoomStatus.COMPLETE);
    }

    public void cancel(Room room) {
        room.setDisputeStatus(null);
        advance(room, RoomStatus.CANCELLED);
    }

    public void appendSystemMessage(Room room, String content) {
        room.appendMessage(RoomMessage.builder()
                .type(MessageType.SYSTEM)
                .content(content)
                .sentAt(now())
                .build());
    }

    public void verifyInvariants(Room room) {
        RoomStatus status = room.getStatus();
        String phrase = room.getRoomPhrase();
        if (room.getAmount() == null || room.getAmount().compareTo(BigDecimal.ZERO) <= 0) {
            throw new EscrowStateException("Room " + phrase + " has a non-positive amount");
        }
        if (room.getBuyerId() != null && status == RoomStatus.WAITING_FOR_BUYER) {
            throw new EscrowStateException("Room " + phrase + " has a buyer while waiting for one");
        }
        if (status.requiresBuyer() && room.getBuyerId() == null) {
            throw new EscrowStateException("Room " + phrase + " has no buyer in status " + status);
        }
        if (status.requiresContract() != (room.getContract() != null)) {
            throw new EscrowStateException("Room " + phrase + " contract presence does not match status " + status);
        }
        if ((status == RoomStatus.DISPUTE) != (room.getDisputeStatus() != null)) {
            throw new EscrowStateException("Room " + phrase + " dispute status does not match status " + status);
        }
        if (room.getDisputeStatus() == DisputeStatus.AWAITING_EVIDENCE && room.getRequiredEvidence().isEmpty()) {
            throw new EscrowStateException("Room " + phrase + " is collecting evidence with no requirements");
        }

        EscrowContract contract = room.getContract();
        if (contract != null && contract.getReleasedTo() != null
                && contract.getResolution() == ResolutionSource.SIGNATURE_THRESHOLD) {
            Decision released = contract.getReleasedTo() == Party.SELLER
                    ? Decision.RELEASE_TO_SELLER
                    : Decision.REFUND_TO_BUYER;
            if (ThresholdPolicy.verifiedVotesFor(contract.getSignatures().values(), released)
                    < ThresholdPolicy.REQUIRED_SIGNATURES) {
                throw new EscrowStateException("Contract " + contract.getContractId() + " released without a signature threshold");
            }
        }
    }
}
