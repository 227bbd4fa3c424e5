package se.escrow_be.service;

/**
 * Published when a seller finalizes evidence; consumed after commit to call the oracle.
 */
public record DisputeFinalizedEvent(String roomPhrase) {
}
