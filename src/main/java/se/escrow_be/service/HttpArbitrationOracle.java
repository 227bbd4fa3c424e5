package se.escrow_be.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import se.escrow_be.configuration.properties.OracleProperties;
import se.escrow_be.dto.oracle.ArbitrationRequest;
import se.escrow_be.dto.oracle.OracleVerdict;
import se.escrow_be.exception.ExternalOracleException;
import se.escrow_be.pojo.enums.Decision;

/**
 * JSON-over-HTTP arbiter client. Failed calls and unusable verdicts are retried with exponential
 * backoff; the last failure is rethrown once attempts run out.
 */
@Service
@Slf4j
public class HttpArbitrationOracle implements ArbitrationOracle {

    private final RestTemplate restTemplate;
    private final OracleProperties oracleProperties;

    public HttpArbitrationOracle(@Qualifier("oracleRestTemplate") RestTemplate restTemplate,
                                 OracleProperties oracleProperties) {
        this.restTemplate = restTemplate;
        this.oracleProperties = oracleProperties;
    }

    @Override
    @Retryable(retryFor = ExternalOracleException.class,
            maxAttemptsExpression = "${escrow.oracle.max-attempts:3}",
            backoff = @Backoff(delayExpression = "${escrow.oracle.backoff-delay-ms:2000}",
                    multiplierExpression = "${escrow.oracle.backoff-multiplier:2}"))
    public OracleVerdict arbitrate(ArbitrationRequest request) {
        log.info("Requesting arbitration for room '{}' ({})", request.getRoomPhrase(), request.getCategory());
        ResponseEntity<OracleVerdict> response;
        try {
            response = restTemplate.postForEntity(oracleProperties.getUrl(), request, OracleVerdict.class);
        } catch (RestClientException e) {
            log.error("Arbitration call for room '{}' failed: {}", request.getRoomPhrase(), e.getMessage());
            throw new ExternalOracleException("Arbitration oracle unreachable: " + e.getMessage(), e);
        }
        OracleVerdict verdict = response.getBody();
        validate(verdict);
        log.info("Arbitration for room '{}' returned {} with confidence {}",
                request.getRoomPhrase(), verdict.getDecision(), verdict.getConfidence());
        return verdict;
    }

    static void validate(OracleVerdict verdict) {
        if (verdict == null) {
            throw new ExternalOracleException("Arbitration oracle returned an empty body");
        }
        if (Decision.fromVerdict(verdict.getDecision()).isEmpty()) {
            throw new ExternalOracleException("Arbitration oracle returned unknown decision: " + verdict.getDecision());
        }
        Double confidence = verdict.getConfidence();
        if (confidence == null || confidence < 0.0 || confidence > 1.0) {
            throw new ExternalOracleException("Arbitration oracle returned confidence outside [0, 1]: " + confidence);
        }
    }
}
