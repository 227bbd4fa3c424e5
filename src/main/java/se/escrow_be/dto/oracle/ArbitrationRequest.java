package se.escrow_be.dto.oracle;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.escrow_be.pojo.enums.TransactionCategory;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Bundle posted to the arbitration oracle: the agreed description plus one reference per
 * required evidence type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArbitrationRequest {
    private String roomPhrase;
    private String description;
    private BigDecimal amount;
    private TransactionCategory category;
    private Map<String, String> evidence;
}
