package se.escrow_be.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import se.escrow_be.dto.response.WalletResponse;
import se.escrow_be.exception.EscrowStateException;
import se.escrow_be.exception.InsufficientFundsException;
import se.escrow_be.exception.ResourceNotFoundException;
import se.escrow_be.pojo.Wallet;
import se.escrow_be.pojo.enums.UserRole;
import se.escrow_be.repository.WalletRepository;

import java.math.BigDecimal;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WalletServiceTest {

    @Mock
    private WalletRepository walletRepository;

    @InjectMocks
    private WalletService walletService;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(walletService, "buyerInitialBalance", new BigDecimal("1000"));
        ReflectionTestUtils.setField(walletService, "sellerInitialBalance", new BigDecimal("500"));
    }

    @Test
    @DisplayName("New wallets start with the role's configured balance")
    void openWalletByRole() {
        when(walletRepository.save(any(Wallet.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Wallet buyer = walletService.openWallet("b", UserRole.BUYER);
        Wallet seller = walletService.openWallet("s", UserRole.SELLER);

        assertThat(buyer.getAvailableBalance()).isEqualByComparingTo("1000");
        assertThat(seller.getAvailableBalance()).isEqualByComparingTo("500");
        assertThat(buyer.getLockedBalance()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Locking moves funds from available to locked")
    void lockFunds() {
        Wallet wallet = wallet("b", "1000", "0");
        when(walletRepository.findById("b")).thenReturn(Optional.of(wallet));

        walletService.lockFunds("b", new BigDecimal("400"));

        assertThat(wallet.getAvailableBalance()).isEqualByComparingTo("600");
        assertThat(wallet.getLockedBalance()).isEqualByComparingTo("400");
    }

    @Test
    @DisplayName("Locking more than the available balance fails without mutating the wallet")
    void lockFundsInsufficient() {
        Wallet wallet = wallet("b", "100", "0");
        when(walletRepository.findById("b")).thenReturn(Optional.of(wallet));

        assertThatThrownBy(() -> walletService.lockFunds("b", new BigDecimal("100.01")))
                .isInstanceOf(InsufficientFundsException.class);

        assertThat(wallet.getAvailableBalance()).isEqualByComparingTo("100");
        verify(walletRepository, never()).save(any());
    }

    @Test
    @DisplayName("Settling pays the recipient out of the payer's locked funds")
    void settleToRecipient() {
        Wallet buyer = wallet("b", "600", "400");
        Wallet seller = wallet("s", "500", "0");
        when(walletRepository.findById("b")).thenReturn(Optional.of(buyer));
        when(walletRepository.findById("s")).thenReturn(Optional.of(seller));

        walletService.settleLocked("b", "s", new BigDecimal("400"));

        assertThat(buyer.getLockedBalance()).isEqualByComparingTo("0");
        assertThat(buyer.getAvailableBalance()).isEqualByComparingTo("600");
        assertThat(seller.getAvailableBalance()).isEqualByComparingTo("900");
    }

    @Test
    @DisplayName("A refund returns locked funds to the payer's available balance")
    void settleRefund() {
        Wallet buyer = wallet("b", "600", "400");
        when(walletRepository.findById("b")).thenReturn(Optional.of(buyer));

        walletService.settleLocked("b", "b", new BigDecimal("400"));

        assertThat(buyer.getAvailableBalance()).isEqualByComparingTo("1000");
        assertThat(buyer.getLockedBalance()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Settling more than is locked is an internal error")
    void settleMoreThanLocked() {
        when(walletRepository.findById("b")).thenReturn(Optional.of(wallet("b", "600", "100")));

        assertThatThrownBy(() -> walletService.settleLocked("b", "s", new BigDecimal("400")))
                .isInstanceOf(EscrowStateException.class);
    }

    @Test
    @DisplayName("Wallet view reports available and locked balances")
    void getWallet() {
        when(walletRepository.findById("b")).thenReturn(Optional.of(wallet("b", "600", "400")));

        WalletResponse response = walletService.getWallet("b");

        assertThat(response.getBalance()).isEqualByComparingTo("600");
        assertThat(response.getLocked()).isEqualByComparingTo("400");
    }

    @Test
    @DisplayName("Unknown wallets are reported as not found")
    void unknownWallet() {
        when(walletRepository.findById("x")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> walletService.getWallet("x")).isInstanceOf(ResourceNotFoundException.class);
    }

    private static Wallet wallet(String userId, String available, String locked) {
        return Wallet.builder()
                .userId(userId)
                .availableBalance(new BigDecimal(available))
                .lockedBalance(new BigDecimal(locked))
                .build();
    }
}
