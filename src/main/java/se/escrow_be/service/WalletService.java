package se.escrow_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.escrow_be.dto.response.WalletResponse;
import se.escrow_be.exception.EscrowStateException;
import se.escrow_be.exception.InsufficientFundsException;
import se.escrow_be.exception.ResourceNotFoundException;
import se.escrow_be.pojo.Wallet;
import se.escrow_be.pojo.enums.UserRole;
import se.escrow_be.repository.WalletRepository;

import java.math.BigDecimal;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
@Slf4j
public class WalletService {

    private final WalletRepository walletRepository;

    @Value("${escrow.wallet.initial-balance.buyer:1000}")
    private BigDecimal buyerInitialBalance;

    @Value("${escrow.wallet.initial-balance.seller:500}")
    private BigDecimal sellerInitialBalance;

    @Transactional
    public Wallet openWallet(String userId, UserRole role) {
        BigDecimal initial = role == UserRole.BUYER ? buyerInitialBalance : sellerInitialBalance;
        Wallet wallet = Wallet.builder()
                .userId(userId)
                .availableBalance(initial)
                .lockedBalance(BigDecimal.ZERO)
                .build();
        log.info("Opened wallet for user {} with balance {}", userId, initial);
        return walletRepository.save(wallet);
    }

    public WalletResponse getWallet(String userId) {
        Wallet wallet = findWallet(userId);
        return WalletResponse.builder()
                .userId(wallet.getUserId())
                .balance(wallet.getAvailableBalance())
                .locked(wallet.getLockedBalance())
                .build();
    }

    /**
     * Moves {@code amount} from available to locked. Checked before anything is mutated.
     */
    @Transactional
    public void lockFunds(String userId, BigDecimal amount) {
        Wallet wallet = findWallet(userId);
        if (wallet.getAvailableBalance().compareTo(amount) < 0) {
            throw new InsufficientFundsException(String.format(
                    "Insufficient funds: available %s, required %s", wallet.getAvailableBalance(), amount));
        }
        wallet.setAvailableBalance(wallet.getAvailableBalance().subtract(amount));
        wallet.setLockedBalance(wallet.getLockedBalance().add(amount));
        walletRepository.save(wallet);
        log.info("Locked {} in wallet of user {}", amount, userId);
    }

    /**
     * Releases funds locked by {@code payerId} into the available balance of {@code recipientId}.
     * The two ids are the same on a refund.
     */
    @Transactional
    public void settleLocked(String payerId, String recipientId, BigDecimal amount) {
        Wallet payer = findWallet(payerId);
        if (payer.getLockedBalance().compareTo(amount) < 0) {
            throw new EscrowStateException(String.format(
                    "Wallet of user %s holds %s locked, cannot release %s", payerId, payer.getLockedBalance(), amount));
        }
        payer.setLockedBalance(payer.getLockedBalance().subtract(amount));

        Wallet recipient = payerId.equals(recipientId) ? payer : findWallet(recipientId);
        recipient.setAvailableBalance(recipient.getAvailableBalance().add(amount));

        walletRepository.save(payer);
        if (recipient != payer) {
            walletRepository.save(recipient);
        }
        log.info("Settled {} locked by user {} to user {}", amount, payerId, recipientId);
    }

    private Wallet findWallet(String userId) {
        return walletRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("Wallet not found for user: " + userId));
    }
}
