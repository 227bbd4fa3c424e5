package se.escrow_be.service;

import se.escrow_be.pojo.PartySignature;
import se.escrow_be.pojo.enums.Decision;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * 2-of-3 release rule: a decision is binding once two distinct parties hold a verified
 * signature for it. Unverified signatures never count.
 */
public final class ThresholdPolicy {

    public static final int REQUIRED_SIGNATURES = 2;

    private ThresholdPolicy() {
    }

    public static Optional<Decision> reached(Collection<PartySignature> signatures) {
        Map<Decision, Integer> tally = new EnumMap<>(Decision.class);
        for (PartySignature signature : signatures) {
            if (signature.isVerified() && signature.getDecision() != null) {
                tally.merge(signature.getDecision(), 1, Integer::sum);
            }
        }
        return tally.entrySet().stream()
                .filter(entry -> entry.getValue() >= REQUIRED_SIGNATURES)
                .map(Map.Entry::getKey)
                .findFirst();
    }

    public static long verifiedVotesFor(Collection<PartySignature> signatures, Decision decision) {
        return signatures.stream()
                .filter(PartySignature::isVerified)
                .filter(signature -> signature.getDecision() == decision)
                .count();
    }
}
