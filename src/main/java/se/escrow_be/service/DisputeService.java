package se.escrow_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.web.multipart.MultipartFile;
import se.escrow_be.configuration.properties.InactivityProperties;
import se.escrow_be.dto.oracle.ArbitrationRequest;
import se.escrow_be.dto.oracle.OracleVerdict;
import se.escrow_be.dto.response.EvidenceSubmissionResponse;
import se.escrow_be.dto.response.RoomResponse;
import se.escrow_be.exception.*;
import se.escrow_be.mapper.RoomMapper;
import se.escrow_be.pojo.ArbitrationVerdict;
import se.escrow_be.pojo.EscrowContract;
import se.escrow_be.pojo.EvidenceSubmission;
import se.escrow_be.pojo.Room;
import se.escrow_be.pojo.enums.*;
import se.escrow_be.repository.RoomRepository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Dispute sub-protocol: opening, evidence collection, hand-off to the oracle and application of
 * its verdict as the third vote.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
@Slf4j
public class DisputeService {

    private final RoomRepository roomRepository;
    private final TransactionClassifier transactionClassifier;
    private final ContractAuthorizationService contractAuthorizationService;
    private final EvidenceStorage evidenceStorage;
    private final RoomTransitions roomTransitions;
    private final InactivityProperties inactivityProperties;
    private final ApplicationEventPublisher eventPublisher;
    private final RoomMapper roomMapper;

    /**
     * Buyer opens a dispute. An optional signature is the buyer's refund vote and is verified
     * before the room changes.
     */
    @Transactional(noRollbackFor = SignatureInvalidException.class)
    public RoomResponse initDispute(String roomPhrase, String userId, String signedMessage) {
        Room room = findRoom(roomPhrase);
        Party party = RoomService.partyOf(room, userId);
        RoomService.requireStatus(room, IntentType.INIT_DISPUTE, RoomStatus.PRODUCT_DELIVERED);
        RoomService.requireParty(party, Party.BUYER, IntentType.INIT_DISPUTE);

        if (signedMessage != null && !signedMessage.isBlank()) {
            Optional<Decision> binding = contractAuthorizationService.submitSignature(
                    RoomService.requireContract(room), Party.BUYER, Decision.REFUND_TO_BUYER, signedMessage);
            if (binding.isPresent()) {
                throw new EscrowStateException("Contract of room '" + roomPhrase + "' settled while opening a dispute");
            }
        }

        TransactionCategory category = transactionClassifier.classify(room.getDescription());
        List<String> required = transactionClassifier.requiredEvidence(category);

        room.setTransactionCategory(category);
        room.getRequiredEvidence().clear();
        room.getRequiredEvidence().addAll(required);
        room.getSubmittedEvidence().clear();
        room.setDisputeStatus(DisputeStatus.AWAITING_EVIDENCE);
        roomTransitions.advance(room, RoomStatus.DISPUTE);
        roomTransitions.appendSystemMessage(room, "Dispute opened. Seller must submit: " + String.join(", ", required));

        log.info("Dispute opened in room '{}' classified as {}, requiring {}", roomPhrase, category, required);
        return roomMapper.convertToResponse(persist(room));
    }

    /**
     * Seller uploads one required evidence item. A second upload of the same type replaces the first.
     */
    @Transactional
    public EvidenceSubmissionResponse uploadEvidence(String roomPhrase, String userId, String evidenceType, MultipartFile file) {
        Room room = findRoom(roomPhrase);
        Party party = RoomService.partyOf(room, userId);
        if (room.getStatus() != RoomStatus.DISPUTE || room.getDisputeStatus() != DisputeStatus.AWAITING_EVIDENCE) {
            throw new InvalidTransitionException("Evidence is only accepted while a dispute awaits evidence");
        }
        if (party != Party.SELLER) {
            throw new UnauthorizedPartyException("Only the seller may upload evidence");
        }
        if (evidenceType == null || !room.getRequiredEvidence().contains(evidenceType)) {
            throw new BusinessLogicException(String.format(
                    "Evidence type '%s' is not required; expected one of %s", evidenceType, room.getRequiredEvidence()));
        }

        String reference = evidenceStorage.store(roomPhrase, evidenceType, file);
        EvidenceSubmission previous = room.getSubmittedEvidence().get(evidenceType);
        String replaced = previous != null ? previous.getPayloadReference() : null;
        boolean deferred = cleanUpOnCompletion(reference, replaced);
        try {
            EvidenceSubmission submission = EvidenceSubmission.builder()
                    .evidenceType(evidenceType)
                    .payloadReference(reference)
                    .originalFilename(file.getOriginalFilename())
                    .contentType(file.getContentType())
                    .sizeBytes(file.getSize())
                    .submittedAt(roomTransitions.now())
                    .build();
            room.putEvidence(submission);
            roomTransitions.touch(room);
            persist(room);

            if (!deferred && replaced != null) {
                evidenceStorage.delete(replaced);
            }
            log.info("{} {} evidence in room '{}'", replaced != null ? "Replaced" : "Received", evidenceType, roomPhrase);
            return roomMapper.convertEvidence(submission);
        } catch (RuntimeException e) {
            if (!deferred) {
                evidenceStorage.delete(reference);
            }
            throw e;
        }
    }

    /**
     * Ties the stored files to the transaction outcome: the replaced file goes once the new record
     * is committed, the new file goes if the transaction rolls back. Commit failures surface after
     * this method returns, so neither file may be touched before then.
     *
     * @return false when no transaction is active and the caller must clean up itself
     */
    private boolean cleanUpOnCompletion(String stored, String replaced) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            return false;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status == STATUS_COMMITTED) {
                    if (replaced != null) {
                        evidenceStorage.delete(replaced);
                    }
                } else if (status == STATUS_ROLLED_BACK) {
                    evidenceStorage.delete(stored);
                } else {
                    log.warn("Outcome of the upload storing {} is unknown; keeping it and {}", stored, replaced);
                }
            }
        });
        return true;
    }

    @Transactional
    public RoomResponse finalizeSubmission(String roomPhrase, String userId) {
        Room room = findRoom(roomPhrase);
        Party party = RoomService.partyOf(room, userId);
        if (room.getStatus() != RoomStatus.DISPUTE || room.getDisputeStatus() != DisputeStatus.AWAITING_EVIDENCE) {
            throw new InvalidTransitionException(String.format(
                    "finalize_submission is not allowed while the room is %s/%s", room.getStatus(), room.getDisputeStatus()));
        }
        RoomService.requireParty(party, Party.SELLER, IntentType.FINALIZE_SUBMISSION);

        List<String> missing = room.getRequiredEvidence().stream()
                .filter(type -> !room.getSubmittedEvidence().containsKey(type))
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new IncompleteEvidenceException("Missing evidence: " + String.join(", ", missing));
        }

        room.setDisputeStatus(DisputeStatus.AWAITING_AI_DECISION);
        roomTransitions.touch(room);
        roomTransitions.appendSystemMessage(room, "Evidence submitted; awaiting arbitration");
        Room saved = persist(room);

        eventPublisher.publishEvent(new DisputeFinalizedEvent(roomPhrase));
        log.info("Evidence finalized in room '{}'; arbitration requested", roomPhrase);
        return roomMapper.convertToResponse(saved);
    }

    public ArbitrationRequest buildArbitrationRequest(String roomPhrase) {
        Room room = findRoom(roomPhrase);
        Map<String, String> evidence = new LinkedHashMap<>();
        for (String type : room.getRequiredEvidence()) {
            EvidenceSubmission submission = room.getSubmittedEvidence().get(type);
            if (submission != null) {
                evidence.put(type, submission.getPayloadReference());
            }
        }
        return ArbitrationRequest.builder()
                .roomPhrase(roomPhrase)
                .description(room.getDescription())
                .amount(room.getAmount())
                .category(room.getTransactionCategory())
                .evidence(evidence)
                .build();
    }

    /**
     * Stores the verdict and casts the oracle's vote. A verdict for a room that is no longer
     * awaiting one is discarded.
     *
     * @return the new snapshot, or empty when the verdict was discarded
     */
    @Transactional
    public Optional<RoomResponse> applyVerdict(String roomPhrase, OracleVerdict verdict) {
        Room room = findRoom(roomPhrase);
        if (!awaitingArbitration(room)) {
            log.warn("Discarding verdict for room '{}' in {}/{}", roomPhrase, room.getStatus(), room.getDisputeStatus());
            return Optional.empty();
        }
        Decision decision = Decision.fromVerdict(verdict.getDecision())
                .orElseThrow(() -> new ExternalOracleException("Unrecognised verdict: " + verdict.getDecision()));

        room.setAiVerdict(ArbitrationVerdict.builder()
                .decision(decision)
                .rawDecision(verdict.getDecision())
                .confidence(verdict.getConfidence())
                .reasoning(verdict.getReasoning())
                .summary(verdict.getSummary())
                .decidedAt(roomTransitions.now())
                .build());

        Optional<Decision> binding;
        try {
            binding = contractAuthorizationService.submitOracleSignature(RoomService.requireContract(room), decision);
        } catch (SignatureInvalidException e) {
            throw new EscrowStateException("Oracle signature did not verify; check the oracle key pair", e);
        }

        if (binding.isPresent()) {
            roomTransitions.complete(room);
            roomTransitions.appendSystemMessage(room, "Arbitration decided " + decision + "; funds released");
            log.info("Room '{}' settled after arbitration: {}", roomPhrase, binding.get());
        } else {
            room.setDisputeStatus(DisputeStatus.AWAITING_SIGNATURES);
            roomTransitions.touch(room);
            roomTransitions.appendSystemMessage(room, "Arbitration decided " + decision + "; awaiting a matching signature");
            log.info("Oracle voted {} in room '{}'; awaiting a matching party signature", decision, roomPhrase);
        }
        return Optional.of(roomMapper.convertToResponse(persist(room)));
    }

    /**
     * Applies the configured default once the oracle could not be reached.
     */
    @Transactional
    public Optional<RoomResponse> resolveAfterOracleFailure(String roomPhrase) {
        Room room = findRoom(roomPhrase);
        if (!awaitingArbitration(room)) {
            return Optional.empty();
        }
        Decision decision = inactivityProperties.decisionFor(RoomStatus.DISPUTE);
        EscrowContract contract = RoomService.requireContract(room);
        contractAuthorizationService.resolveByDefault(contract, decision, ResolutionSource.ORACLE_UNAVAILABLE);
        roomTransitions.complete(room);
        roomTransitions.appendSystemMessage(room, "Arbitration unavailable; default resolution " + decision + " applied");

        log.warn("Room '{}' resolved by default {} after oracle failure", roomPhrase, decision);
        return Optional.of(roomMapper.convertToResponse(persist(room)));
    }

    private static boolean awaitingArbitration(Room room) {
        return room.getStatus() == RoomStatus.DISPUTE && room.getDisputeStatus() == DisputeStatus.AWAITING_AI_DECISION;
    }

    private Room findRoom(String roomPhrase) {
        return roomRepository.findById(roomPhrase)
                .orElseThrow(() -> new ResourceNotFoundException("Room not found: " + roomPhrase));
    }

    private Room persist(Room room) {
        roomTransitions.verifyInvariants(room);
        return roomRepository.save(room);
    }
}
