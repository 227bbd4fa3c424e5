package se.escrow_be.pojo;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * One uploaded piece of dispute evidence. Records are never edited; a re-upload for the
 * same type replaces the whole record.
 */
@Entity
@Table(name = "evidence_submissions")
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class EvidenceSubmission {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long submissionId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "room_phrase", nullable = false)
    @Setter(AccessLevel.PACKAGE)
    private Room room;

    @Column(nullable = false, length = 64, updatable = false)
    private String evidenceType;

    @Column(nullable = false, length = 512, updatable = false)
    private String payloadReference;

    @Column(length = 255, updatable = false)
    private String originalFilename;

    @Column(length = 100, updatable = false)
    private String contentType;

    @Column(updatable = false)
    private long sizeBytes;

    @Column(nullable = false, updatable = false)
    private LocalDateTime submittedAt;
}
