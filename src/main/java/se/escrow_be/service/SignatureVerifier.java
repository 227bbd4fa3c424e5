package se.escrow_be.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import se.escrow_be.exception.BusinessLogicException;
import se.escrow_be.pojo.enums.Decision;
import se.escrow_be.pojo.enums.Party;

import java.nio.charset.StandardCharsets;
import java.security.*;
import java.security.interfaces.RSAKey;
import java.security.spec.*;
import java.util.Base64;
import java.util.HexFormat;

/**
 * RSA-PSS (SHA-256, MGF1-SHA-256, maximum salt length) signing and verification over the
 * canonical release message {@code "{contract_id}:{party}:{decision}"}.
 */
@Service
@Slf4j
public class SignatureVerifier {

    private static final String ALGORITHM = "RSASSA-PSS";
    private static final int SHA256_LENGTH = 32;
    private static final HexFormat HEX = HexFormat.of();

    public static String canonicalMessage(String contractId, Party party, Decision decision) {
        return contractId + ":" + party.name() + ":" + decision.name();
    }

    /**
     * Returns {@code false} for any signature that does not check out, including malformed hex
     * and a key that cannot be parsed. Never throws for bad client input.
     */
    public boolean verify(String publicKeyPem, String message, String signatureHex) {
        if (publicKeyPem == null || message == null || signatureHex == null || signatureHex.isBlank()) {
            return false;
        }
        try {
            PublicKey publicKey = parsePublicKey(publicKeyPem);
            byte[] signatureBytes = HEX.parseHex(signatureHex.trim());

            Signature verifier = Signature.getInstance(ALGORITHM);
            verifier.setParameter(pssParameters(publicKey));
            verifier.initVerify(publicKey);
            verifier.update(message.getBytes(StandardCharsets.UTF_8));
            return verifier.verify(signatureBytes);
        } catch (IllegalArgumentException | BusinessLogicException e) {
            log.warn("Rejected malformed signature input: {}", e.getMessage());
            return false;
        } catch (GeneralSecurityException e) {
            log.warn("Signature verification failed: {}", e.getMessage());
            return false;
        }
    }

    public String sign(PrivateKey privateKey, String message) {
        try {
            Signature signer = Signature.getInstance(ALGORITHM);
            signer.setParameter(pssParameters(privateKey));
            signer.initSign(privateKey);
            signer.update(message.getBytes(StandardCharsets.UTF_8));
            return HEX.formatHex(signer.sign());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to sign message", e);
        }
    }

    /**
     * Parses an X.509 SubjectPublicKeyInfo PEM holding an RSA key.
     *
     * @throws BusinessLogicException when the text is not such a key
     */
    public PublicKey parsePublicKey(String pem) {
        try {
            byte[] der = decodePem(pem, "PUBLIC KEY");
            return KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(der));
        } catch (IllegalArgumentException | InvalidKeySpecException e) {
            throw new BusinessLogicException("Public key must be an RSA public key in PEM (SPKI) format");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("RSA is not available", e);
        }
    }

    /**
     * Parses a PKCS#8 PEM holding an RSA private key.
     */
    public PrivateKey parsePrivateKey(String pem) {
        try {
            byte[] der = decodePem(pem, "PRIVATE KEY");
            return KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(der));
        } catch (IllegalArgumentException | InvalidKeySpecException e) {
            throw new BusinessLogicException("Private key must be an RSA private key in PEM (PKCS#8) format");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("RSA is not available", e);
        }
    }

    public String toPem(PublicKey publicKey) {
        String body = Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII))
                .encodeToString(publicKey.getEncoded());
        return "-----BEGIN PUBLIC KEY-----\n" + body + "\n-----END PUBLIC KEY-----\n";
    }

    static PSSParameterSpec pssParameters(Key key) {
        if (!(key instanceof RSAKey rsaKey)) {
            throw new IllegalArgumentException("Not an RSA key");
        }
        int modulusBits = rsaKey.getModulus().bitLength();
        int encodedLength = (modulusBits - 1 + 7) / 8;
        int maxSalt = encodedLength - SHA256_LENGTH - 2;
        return new PSSParameterSpec("SHA-256", "MGF1", MGF1ParameterSpec.SHA256, maxSalt, PSSParameterSpec.TRAILER_FIELD_BC);
    }

    private static byte[] decodePem(String pem, String label) {
        if (pem == null || pem.isBlank()) {
            throw new IllegalArgumentException("Empty key");
        }
        String body = pem
                .replace("-----BEGIN " + label + "-----", "")
                .replace("-----END " + label + "-----", "")
                .replaceAll("\\s", "");
        if (body.contains("-----")) {
            throw new IllegalArgumentException("Unexpected PEM label");
        }
        return Base64.getDecoder().decode(body);
    }
}
