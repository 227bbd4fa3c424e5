package se.escrow_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import se.escrow_be.dto.response.ApiResponse;
import se.escrow_be.dto.response.EvidenceSubmissionResponse;
import se.escrow_be.service.RoomIntentDispatcher;

@RestController
@RequestMapping("/api/rooms")
@Tag(name = "Dispute Evidence", description = "Seller evidence uploads while a dispute awaits evidence")
@RequiredArgsConstructor
@Slf4j
public class EvidenceController {

    private final RoomIntentDispatcher dispatcher;

    @Operation(
            summary = "Upload one evidence item",
            description = "Accepted only from the seller, only while the dispute awaits evidence and only for a required type. "
                    + "Uploading the same type again replaces the earlier submission."
    )
    @PostMapping(value = "/{roomPhrase}/{userId}/upload_evidence", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<EvidenceSubmissionResponse>> uploadEvidence(
            @PathVariable String roomPhrase,
            @PathVariable String userId,
            @Parameter(description = "Required evidence type, e.g. shipping_receipt", required = true)
            @RequestParam("evidence_type") String evidenceType,
            @RequestParam("file") MultipartFile file) {
        log.info("Evidence upload '{}' by user {} in room '{}'", evidenceType, userId, roomPhrase);
        EvidenceSubmissionResponse submission = dispatcher.uploadEvidence(roomPhrase, userId, evidenceType, file);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Evidence uploaded successfully", submission));
    }
}
