package se.escrow_be.configuration.properties;

import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import se.escrow_be.pojo.enums.TransactionCategory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Classification rules and the category to required-evidence table (escrow.dispute.*).
 * Categories are matched in declaration order; the first keyword hit wins.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "escrow.dispute")
public class DisputeProperties {

    private Map<TransactionCategory, List<String>> categories = new LinkedHashMap<>();

    private Map<TransactionCategory, List<String>> evidenceRequirements = new LinkedHashMap<>();

    @NotNull
    private TransactionCategory fallbackCategory = TransactionCategory.PHYSICAL_GOODS;
}
