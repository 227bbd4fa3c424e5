package se.escrow_be.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import se.escrow_be.pojo.enums.Decision;
import se.escrow_be.pojo.enums.Party;

import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;

/**
 * Holds the AI oracle's key pair and produces its vote. The oracle's signature goes through the
 * same verification as a human party's.
 */
@Component
@Slf4j
public class OracleSigner {

    private final SignatureVerifier signatureVerifier;
    private final PrivateKey privateKey;
    private final String publicKeyPem;

    public OracleSigner(SignatureVerifier signatureVerifier,
                        @Value("${escrow.oracle.private-key:}") String privateKeyPem,
                        @Value("${escrow.oracle.public-key:}") String publicKeyPem) {
        this.signatureVerifier = signatureVerifier;
        if (privateKeyPem.isBlank() || publicKeyPem.isBlank()) {
            log.warn("No oracle key pair configured; generating an ephemeral RSA-2048 pair. "
                    + "Oracle signatures will not verify after a restart.");
            try {
                KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
                generator.initialize(2048);
                var keyPair = generator.generateKeyPair();
                this.privateKey = keyPair.getPrivate();
                this.publicKeyPem = signatureVerifier.toPem(keyPair.getPublic());
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalStateException("RSA is not available", e);
            }
        } else {
            this.privateKey = signatureVerifier.parsePrivateKey(privateKeyPem);
            PublicKey parsed = signatureVerifier.parsePublicKey(publicKeyPem);
            this.publicKeyPem = signatureVerifier.toPem(parsed);
        }
    }

    public String sign(String contractId, Decision decision) {
        return signatureVerifier.sign(privateKey,
                SignatureVerifier.canonicalMessage(contractId, Party.AI_ORACLE, decision));
    }

    public String getPublicKeyPem() {
        return publicKeyPem;
    }
}
