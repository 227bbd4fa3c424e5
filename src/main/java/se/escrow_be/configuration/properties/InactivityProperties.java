package se.escrow_be.configuration.properties;

import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import se.escrow_be.pojo.enums.Decision;
import se.escrow_be.pojo.enums.RoomStatus;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Inactivity watchdog settings (escrow.inactivity.*). The default-resolution policy lives here
 * so it can be audited from configuration alone.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "escrow.inactivity")
public class InactivityProperties {

    @NotNull
    private Duration timeout = Duration.ofHours(24);

    private long scanIntervalMs = 60_000;

    @NotNull
    private Decision defaultDecision = Decision.REFUND_TO_BUYER;

    private Map<RoomStatus, Decision> decisionsByStatus = new EnumMap<>(RoomStatus.class);

    public Decision decisionFor(RoomStatus status) {
        return decisionsByStatus.getOrDefault(status, defaultDecision);
    }
}
