package se.escrow_be.pojo;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.escrow_be.pojo.enums.Decision;

import java.time.LocalDateTime;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ArbitrationVerdict {

    @Enumerated(EnumType.STRING)
    @Column(name = "ai_decision", length = 32)
    private Decision decision;

    @Column(name = "ai_raw_decision", length = 32)
    private String rawDecision;

    @Column(name = "ai_confidence")
    private Double confidence;

    @Column(name = "ai_reasoning", columnDefinition = "text")
    private String reasoning;

    @Column(name = "ai_summary", columnDefinition = "text")
    private String summary;

    @Column(name = "ai_decided_at")
    private LocalDateTime decidedAt;
}
