package se.escrow_be.configuration;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;
import se.escrow_be.configuration.properties.OracleProperties;

import java.time.Duration;

@Configuration
@RequiredArgsConstructor
public class RestTemplateConfig {

    private final OracleProperties oracleProperties;

    @Bean(name = "oracleRestTemplate")
    public RestTemplate oracleRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofMillis(oracleProperties.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(oracleProperties.getReadTimeoutMs()))
                .build();
    }
}
