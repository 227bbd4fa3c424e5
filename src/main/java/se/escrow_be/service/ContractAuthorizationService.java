package se.escrow_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.escrow_be.dto.response.SignatureAuditResponse;
import se.escrow_be.exception.EscrowStateException;
import se.escrow_be.exception.InvalidTransitionException;
import se.escrow_be.exception.SignatureInvalidException;
import se.escrow_be.pojo.EscrowContract;
import se.escrow_be.pojo.PartySignature;
import se.escrow_be.pojo.Room;
import se.escrow_be.pojo.UserAccount;
import se.escrow_be.pojo.enums.ContractStatus;
import se.escrow_be.pojo.enums.Decision;
import se.escrow_be.pojo.enums.Party;
import se.escrow_be.pojo.enums.ResolutionSource;
import se.escrow_be.repository.UserAccountRepository;

import java.security.SecureRandom;
import java.util.EnumMap;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;

/**
 * 2-of-3 release authorization. Every method runs inside the caller's room transaction, so
 * signature bookkeeping and fund movement commit together with the room status.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
@Slf4j
public class ContractAuthorizationService {

    private static final SecureRandom RANDOM = new SecureRandom();

    private final SignatureVerifier signatureVerifier;
    private final OracleSigner oracleSigner;
    private final WalletService walletService;
    private final UserAccountRepository userAccountRepository;
    private final RoomTransitions roomTransitions;

    /**
     * Locks the buyer's funds and attaches a fresh contract to the room.
     */
    @Transactional
    public EscrowContract openContract(Room room) {
        if (room.getContract() != null) {
            throw new EscrowStateException("Room " + room.getRoomPhrase() + " already owns a contract");
        }
        walletService.lockFunds(room.getBuyerId(), room.getAmount());

        byte[] id = new byte[16];
        RANDOM.nextBytes(id);
        EscrowContract contract = EscrowContract.builder()
                .contractId(HexFormat.of().formatHex(id))
                .buyerId(room.getBuyerId())
                .sellerId(room.getSellerId())
                .amount(room.getAmount())
                .status(ContractStatus.PENDING)
                .fundsLocked(true)
                .createdAt(roomTransitions.now())
                .build();
        room.attachContract(contract);

        log.info("Opened contract {} for room '{}' locking {}", contract.getContractId(), room.getRoomPhrase(), room.getAmount());
        return contract;
    }

    /**
     * Verifies and records one party's vote. A failed check is recorded as unverified (unless
     * the party already holds a verified vote) and reported with {@link SignatureInvalidException},
     * which does not roll the record back.
     *
     * @return the decision that became binding with this vote, if any
     */
    @Transactional(noRollbackFor = SignatureInvalidException.class)
    public Optional<Decision> submitSignature(EscrowContract contract, Party party, Decision decision, String signatureHex) {
        if (contract.getStatus() == ContractStatus.COMPLETED) {
            throw new InvalidTransitionException("Contract " + contract.getContractId() + " is already settled");
        }

        String message = SignatureVerifier.canonicalMessage(contract.getContractId(), party, decision);
        boolean verified = signatureVerifier.verify(publicKeyOf(contract, party), message, signatureHex);

        PartySignature existing = contract.getSignatures().get(party);
        if (!verified) {
            if (existing == null || !existing.isVerified()) {
                record(contract, party, decision, signatureHex, false);
            }
            log.warn("Rejected {} signature for {} on contract {}", party, decision, contract.getContractId());
            throw new SignatureInvalidException("Signature for " + decision + " by " + party + " did not verify");
        }

        record(contract, party, decision, signatureHex, true);
        log.info("Recorded verified {} signature for {} on contract {}", party, decision, contract.getContractId());

        Optional<Decision> binding = ThresholdPolicy.reached(contract.getSignatures().values());
        binding.ifPresent(reached -> commitRelease(contract, reached, ResolutionSource.SIGNATURE_THRESHOLD));
        return binding;
    }

    /**
     * Signs and submits the oracle's vote with the server-held oracle key.
     */
    @Transactional(noRollbackFor = SignatureInvalidException.class)
    public Optional<Decision> submitOracleSignature(EscrowContract contract, Decision decision) {
        return submitSignature(contract, Party.AI_ORACLE, decision, oracleSigner.sign(contract.getContractId(), decision));
    }

    /**
     * Settles without a signature threshold. Only the inactivity and oracle-failure fallbacks
     * use this path, and the contract records which one did.
     */
    @Transactional
    public void resolveByDefault(EscrowContract contract, Decision decision, ResolutionSource source) {
        if (source == ResolutionSource.SIGNATURE_THRESHOLD) {
            throw new IllegalArgumentException("Threshold releases go through submitSignature");
        }
        commitRelease(contract, decision, source);
    }

    public Map<Party, SignatureAuditResponse> audit(EscrowContract contract) {
        Map<Party, SignatureAuditResponse> report = new EnumMap<>(Party.class);
        contract.signaturesByParty().forEach((party, signature) -> {
            String message = SignatureVerifier.canonicalMessage(contract.getContractId(), party, signature.getDecision());
            boolean verified = signatureVerifier.verify(publicKeyOf(contract, party), message, signature.getSignatureHex());
            String note = verified == signature.isVerified()
                    ? (verified ? "valid" : "invalid")
                    : "verification result changed since the signature was recorded";
            report.put(party, SignatureAuditResponse.builder()
                    .decision(signature.getDecision())
                    .recordedAsVerified(signature.isVerified())
                    .verified(verified)
                    .note(note)
                    .build());
        });
        return report;
    }

    private void commitRelease(EscrowContract contract, Decision decision, ResolutionSource source) {
        if (!contract.isFundsLocked() || contract.getStatus() == ContractStatus.COMPLETED) {
            throw new EscrowStateException("Contract " + contract.getContractId() + " holds no locked funds to release");
        }
        Party recipient = decision.getBeneficiary();
        String recipientId = contract.userIdOf(recipient);
        walletService.settleLocked(contract.getBuyerId(), recipientId, contract.getAmount());

        contract.setFundsLocked(false);
        contract.setStatus(ContractStatus.COMPLETED);
        contract.setReleasedTo(recipient);
        contract.setReleasedToUserId(recipientId);
        contract.setReleasedAt(roomTransitions.now());
        contract.setResolution(source);

        log.info("Contract {} settled: {} to {} ({}) via {}",
                contract.getContractId(), contract.getAmount(), recipient, recipientId, source);
    }

    private void record(EscrowContract contract, Party party, Decision decision, String signatureHex, boolean verified) {
        PartySignature signature = contract.getSignatures().get(party);
        if (signature == null) {
            signature = PartySignature.builder().party(party).build();
        }
        signature.setDecision(decision);
        signature.setSignatureHex(signatureHex == null ? "" : signatureHex);
        signature.setVerified(verified);
        signature.setSignedAt(roomTransitions.now());
        contract.putSignature(signature);
    }

    private String publicKeyOf(EscrowContract contract, Party party) {
        if (party == Party.AI_ORACLE) {
            return oracleSigner.getPublicKeyPem();
        }
        String userId = contract.userIdOf(party);
        return userAccountRepository.findById(userId)
                .map(UserAccount::getPublicKey)
                .orElseThrow(() -> new EscrowStateException("No registered account for " + party + " " + userId));
    }
}
