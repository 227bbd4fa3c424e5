package se.escrow_be.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import se.escrow_be.pojo.PartySignature;
import se.escrow_be.pojo.enums.Decision;
import se.escrow_be.pojo.enums.Party;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ThresholdPolicyTest {

    @Test
    @DisplayName("Two verified signatures for the same decision reach the threshold")
    void twoMatchingVerified() {
        List<PartySignature> signatures = List.of(
                signature(Party.BUYER, Decision.REFUND_TO_BUYER, true),
                signature(Party.AI_ORACLE, Decision.REFUND_TO_BUYER, true));

        assertThat(ThresholdPolicy.reached(signatures)).contains(Decision.REFUND_TO_BUYER);
    }

    @Test
    @DisplayName("Split decisions do not reach the threshold")
    void splitDecisions() {
        List<PartySignature> signatures = List.of(
                signature(Party.BUYER, Decision.REFUND_TO_BUYER, true),
                signature(Party.SELLER, Decision.RELEASE_TO_SELLER, true));

        assertThat(ThresholdPolicy.reached(signatures)).isEmpty();
    }

    @Test
    @DisplayName("Unverified signatures never count toward the threshold")
    void unverifiedIgnored() {
        List<PartySignature> signatures = List.of(
                signature(Party.BUYER, Decision.RELEASE_TO_SELLER, false),
                signature(Party.SELLER, Decision.RELEASE_TO_SELLER, true));

        assertThat(ThresholdPolicy.reached(signatures)).isEmpty();
        assertThat(ThresholdPolicy.verifiedVotesFor(signatures, Decision.RELEASE_TO_SELLER)).isEqualTo(1);
    }

    @Test
    @DisplayName("A single signature is never enough")
    void singleSignature() {
        assertThat(ThresholdPolicy.reached(List.of(signature(Party.AI_ORACLE, Decision.REFUND_TO_BUYER, true))))
                .isEmpty();
        assertThat(ThresholdPolicy.reached(List.of())).isEmpty();
    }

    private static PartySignature signature(Party party, Decision decision, boolean verified) {
        return PartySignature.builder()
                .party(party)
                .decision(decision)
                .signatureHex("00")
                .verified(verified)
                .signedAt(LocalDateTime.now())
                .build();
    }
}
