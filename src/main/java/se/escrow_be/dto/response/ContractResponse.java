package se.escrow_be.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.escrow_be.pojo.enums.ContractStatus;
import se.escrow_be.pojo.enums.Decision;
import se.escrow_be.pojo.enums.Party;
import se.escrow_be.pojo.enums.ResolutionSource;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContractResponse {
    private String contractId;
    private ContractStatus status;
    private boolean fundsLocked;
    private BigDecimal amount;
    private Map<Party, SignatureView> signatures;
    private Party releasedTo;
    private String releasedToUserId;
    private LocalDateTime releasedAt;
    private ResolutionSource resolution;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SignatureView {
        private Decision decision;
        private String signatureHex;
        private boolean verified;
        private LocalDateTime signedAt;
    }
}
