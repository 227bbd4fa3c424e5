package se.escrow_be.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvidenceSubmissionResponse {
    private String evidenceType;
    private String payloadReference;
    private String filename;
    private String contentType;
    private long sizeBytes;
    private LocalDateTime submittedAt;
}
