package se.escrow_be.service;

import se.escrow_be.dto.response.RoomResponse;
import se.escrow_be.pojo.enums.Party;

/**
 * Outcome of an accepted join. {@code buyerAssigned} is set when this join filled the buyer slot.
 */
public record JoinResult(Party party, String username, RoomResponse room, boolean buyerAssigned) {
}
