package se.escrow_be.dto.oracle;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OracleVerdict {
    // APPROVE / RELEASE_TO_SELLER or REJECT / REFUND_TO_BUYER
    private String decision;
    private Double confidence;
    private String reasoning;
    private String summary;
}
