package se.escrow_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import se.escrow_be.dto.oracle.ArbitrationRequest;
import se.escrow_be.dto.oracle.OracleVerdict;
import se.escrow_be.exception.EscrowException;
import se.escrow_be.exception.ExternalOracleException;

/**
 * Calls the oracle once a dispute's evidence is committed. The call runs on the task executor
 * without the room lock; only applying the verdict re-enters the room.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ArbitrationService {

    private final DisputeService disputeService;
    private final ArbitrationOracle arbitrationOracle;
    private final RoomIntentDispatcher dispatcher;

    @Async("escrowTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onDisputeFinalized(DisputeFinalizedEvent event) {
        String phrase = event.roomPhrase();
        ArbitrationRequest request = disputeService.buildArbitrationRequest(phrase);

        OracleVerdict verdict;
        try {
            verdict = arbitrationOracle.arbitrate(request);
        } catch (ExternalOracleException e) {
            log.error("Arbitration for room '{}' failed after retries; applying default resolution", phrase, e);
            dispatcher.resolveAfterOracleFailure(phrase);
            return;
        }

        try {
            dispatcher.applyVerdict(phrase, verdict);
        } catch (EscrowException e) {
            log.error("Applying verdict to room '{}' failed; applying default resolution", phrase, e);
            dispatcher.resolveAfterOracleFailure(phrase);
        }
    }
}
