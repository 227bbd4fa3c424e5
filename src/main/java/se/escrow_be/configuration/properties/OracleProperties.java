package se.escrow_be.configuration.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "escrow.oracle")
public class OracleProperties {

    private String url = "http://localhost:8090/api/arbitrate";

    private int connectTimeoutMs = 5_000;

    private int readTimeoutMs = 60_000;
}
