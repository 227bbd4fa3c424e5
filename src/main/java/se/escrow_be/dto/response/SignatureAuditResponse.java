package se.escrow_be.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.escrow_be.pojo.enums.Decision;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignatureAuditResponse {
    private Decision decision;
    private boolean recordedAsVerified;
    private boolean verified;
    private String note;
}
