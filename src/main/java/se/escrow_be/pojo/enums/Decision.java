package se.escrow_be.pojo.enums;

import java.util.Locale;
import java.util.Optional;

public enum Decision {
    RELEASE_TO_SELLER(Party.SELLER),
    REFUND_TO_BUYER(Party.BUYER);

    private final Party beneficiary;

    Decision(Party beneficiary) {
        this.beneficiary = beneficiary;
    }

    public Party getBeneficiary() {
        return beneficiary;
    }

    /**
     * Maps an arbitration verdict onto a release decision. Accepts the arbiter's
     * APPROVE / REJECT vocabulary as well as the decision names themselves.
     */
    public static Optional<Decision> fromVerdict(String verdict) {
        if (verdict == null) {
            return Optional.empty();
        }
        return switch (verdict.trim().toUpperCase(Locale.ROOT)) {
            case "APPROVE", "RELEASE_TO_SELLER" -> Optional.of(RELEASE_TO_SELLER);
            case "REJECT", "REFUND_TO_BUYER" -> Optional.of(REFUND_TO_BUYER);
            default -> Optional.empty();
        };
    }
}
