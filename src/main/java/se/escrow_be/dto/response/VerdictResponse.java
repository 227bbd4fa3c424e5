package se.escrow_be.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.escrow_be.pojo.enums.Decision;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerdictResponse {
    private Decision decision;
    private Double confidence;
    private String reasoning;
    private String summary;
    private LocalDateTime decidedAt;
}
