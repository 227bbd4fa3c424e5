package se.escrow_be.service;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import se.escrow_be.exception.BusinessLogicException;
import se.escrow_be.pojo.enums.Decision;
import se.escrow_be.pojo.enums.Party;

import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.spec.PSSParameterSpec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SignatureVerifierTest {

    private static KeyPair buyerKeys;
    private static KeyPair sellerKeys;

    private final SignatureVerifier verifier = new SignatureVerifier();

    @BeforeAll
    static void generateKeys() throws NoSuchAlgorithmException {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);
        buyerKeys = generator.generateKeyPair();
        sellerKeys = generator.generateKeyPair();
    }

    @Test
    @DisplayName("Canonical message joins contract id, party and decision with colons")
    void canonicalMessageFormat() {
        assertThat(SignatureVerifier.canonicalMessage("abc123", Party.BUYER, Decision.REFUND_TO_BUYER))
                .isEqualTo("abc123:BUYER:REFUND_TO_BUYER");
    }

    @Test
    @DisplayName("A signature made with the matching private key verifies")
    void signAndVerify() {
        String message = SignatureVerifier.canonicalMessage("c1", Party.SELLER, Decision.RELEASE_TO_SELLER);
        String signature = verifier.sign(sellerKeys.getPrivate(), message);

        assertThat(verifier.verify(verifier.toPem(sellerKeys.getPublic()), message, signature)).isTrue();
    }

    @Test
    @DisplayName("A signature over a different decision does not verify")
    void tamperedMessageFails() {
        String signature = verifier.sign(buyerKeys.getPrivate(),
                SignatureVerifier.canonicalMessage("c1", Party.BUYER, Decision.RELEASE_TO_SELLER));

        String other = SignatureVerifier.canonicalMessage("c1", Party.BUYER, Decision.REFUND_TO_BUYER);
        assertThat(verifier.verify(verifier.toPem(buyerKeys.getPublic()), other, signature)).isFalse();
    }

    @Test
    @DisplayName("A signature checked against another party's key does not verify")
    void wrongKeyFails() {
        String message = SignatureVerifier.canonicalMessage("c1", Party.BUYER, Decision.REFUND_TO_BUYER);
        String signature = verifier.sign(buyerKeys.getPrivate(), message);

        assertThat(verifier.verify(verifier.toPem(sellerKeys.getPublic()), message, signature)).isFalse();
    }

    @Test
    @DisplayName("Malformed hex, blank input and a garbage key yield false instead of throwing")
    void malformedInputFails() {
        String pem = verifier.toPem(buyerKeys.getPublic());

        assertThat(verifier.verify(pem, "m", "not-hex")).isFalse();
        assertThat(verifier.verify(pem, "m", "")).isFalse();
        assertThat(verifier.verify(pem, "m", null)).isFalse();
        assertThat(verifier.verify("garbage", "m", "abcd")).isFalse();
    }

    @Test
    @DisplayName("PEM round trip yields the same public key")
    void pemRoundTrip() {
        String pem = verifier.toPem(buyerKeys.getPublic());

        assertThat(pem).startsWith("-----BEGIN PUBLIC KEY-----");
        assertThat(verifier.parsePublicKey(pem)).isEqualTo(buyerKeys.getPublic());
    }

    @Test
    @DisplayName("Parsing a non-key PEM raises a business error")
    void parseInvalidKey() {
        assertThatThrownBy(() -> verifier.parsePublicKey("-----BEGIN PUBLIC KEY-----\nAAAA\n-----END PUBLIC KEY-----"))
                .isInstanceOf(BusinessLogicException.class);
    }

    @Test
    @DisplayName("Salt length is the maximum for a 2048-bit key with SHA-256")
    void maximumSaltLength() {
        PSSParameterSpec spec = SignatureVerifier.pssParameters(buyerKeys.getPublic());

        assertThat(spec.getSaltLength()).isEqualTo(222);
        assertThat(spec.getDigestAlgorithm()).isEqualTo("SHA-256");
    }
}
