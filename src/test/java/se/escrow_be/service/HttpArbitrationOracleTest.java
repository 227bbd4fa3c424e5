package se.escrow_be.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;
import se.escrow_be.configuration.properties.OracleProperties;
import se.escrow_be.dto.oracle.ArbitrationRequest;
import se.escrow_be.dto.oracle.OracleVerdict;
import se.escrow_be.exception.ExternalOracleException;
import se.escrow_be.pojo.enums.TransactionCategory;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpArbitrationOracleTest {

    private static final String URL = "http://oracle.test/api/arbitrate";

    private MockRestServiceServer server;
    private HttpArbitrationOracle oracle;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        OracleProperties properties = new OracleProperties();
        properties.setUrl(URL);
        oracle = new HttpArbitrationOracle(restTemplate, properties);
    }

    @Test
    @DisplayName("A well-formed verdict is returned as is")
    void validVerdict() {
        server.expect(requestTo(URL)).andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess("{\"decision\":\"REJECT\",\"confidence\":0.82,\"reasoning\":\"no proof\",\"summary\":\"refund\"}",
                        MediaType.APPLICATION_JSON));

        OracleVerdict verdict = oracle.arbitrate(request());

        assertThat(verdict.getDecision()).isEqualTo("REJECT");
        assertThat(verdict.getConfidence()).isEqualTo(0.82);
        server.verify();
    }

    @Test
    @DisplayName("A server error is reported as an oracle failure")
    void serverError() {
        server.expect(requestTo(URL)).andRespond(withServerError());

        assertThatThrownBy(() -> oracle.arbitrate(request())).isInstanceOf(ExternalOracleException.class);
    }

    @Test
    @DisplayName("Verdicts with an unknown decision or out-of-range confidence are unusable")
    void invalidVerdicts() {
        assertThatThrownBy(() -> HttpArbitrationOracle.validate(null)).isInstanceOf(ExternalOracleException.class);
        assertThatThrownBy(() -> HttpArbitrationOracle.validate(OracleVerdict.builder().decision("MAYBE").confidence(0.5).build()))
                .isInstanceOf(ExternalOracleException.class);
        assertThatThrownBy(() -> HttpArbitrationOracle.validate(OracleVerdict.builder().decision("APPROVE").confidence(1.5).build()))
                .isInstanceOf(ExternalOracleException.class);
        assertThatThrownBy(() -> HttpArbitrationOracle.validate(OracleVerdict.builder().decision("APPROVE").build()))
                .isInstanceOf(ExternalOracleException.class);
    }

    private static ArbitrationRequest request() {
        return ArbitrationRequest.builder()
                .roomPhrase("amber river quiet stone")
                .description("Laptop repair")
                .amount(new BigDecimal("500.00"))
                .category(TransactionCategory.SERVICES_DELIVERABLE)
                .evidence(Map.of("completed_work_upload", "room/work.png"))
                .build();
    }
}
