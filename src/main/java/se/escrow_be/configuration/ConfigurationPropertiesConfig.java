package se.escrow_be.configuration;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import se.escrow_be.configuration.properties.DisputeProperties;
import se.escrow_be.configuration.properties.InactivityProperties;
import se.escrow_be.configuration.properties.OracleProperties;

@Configuration
@EnableConfigurationProperties({
        InactivityProperties.class,
        DisputeProperties.class,
        OracleProperties.class
})
public class ConfigurationPropertiesConfig {
}
