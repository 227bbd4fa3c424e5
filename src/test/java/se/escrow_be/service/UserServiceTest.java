package se.escrow_be.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import se.escrow_be.dto.request.RegisterRequest;
import se.escrow_be.dto.response.UserResponse;
import se.escrow_be.exception.BusinessLogicException;
import se.escrow_be.exception.ResourceConflictException;
import se.escrow_be.pojo.UserAccount;
import se.escrow_be.pojo.Wallet;
import se.escrow_be.pojo.enums.UserRole;
import se.escrow_be.repository.UserAccountRepository;

import java.math.BigDecimal;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    @Mock
    private UserAccountRepository userAccountRepository;

    @Mock
    private WalletService walletService;

    private final SignatureVerifier signatureVerifier = new SignatureVerifier();
    private UserService userService;
    private String publicKeyPem;

    @BeforeEach
    void setUp() throws NoSuchAlgorithmException {
        userService = new UserService(userAccountRepository, walletService, signatureVerifier);
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);
        publicKeyPem = signatureVerifier.toPem(generator.generateKeyPair().getPublic());
    }

    @Test
    @DisplayName("Registration stores a normalized username and opens a wallet")
    void register() {
        when(userAccountRepository.existsByUsername("alice")).thenReturn(false);
        when(userAccountRepository.save(any(UserAccount.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(walletService.openWallet(anyString(), any())).thenAnswer(invocation -> Wallet.builder()
                .userId(invocation.getArgument(0))
                .availableBalance(new BigDecimal("1000"))
                .lockedBalance(BigDecimal.ZERO)
                .build());

        UserResponse response = userService.register(request("  Alice ", publicKeyPem));

        ArgumentCaptor<UserAccount> saved = ArgumentCaptor.forClass(UserAccount.class);
        verify(userAccountRepository).save(saved.capture());
        assertThat(saved.getValue().getUsername()).isEqualTo("alice");
        assertThat(saved.getValue().getPublicKey()).isEqualTo(publicKeyPem);
        assertThat(response.getUserId()).isEqualTo(saved.getValue().getUserId());
        assertThat(response.getBalance()).isEqualByComparingTo("1000");
        verify(walletService).openWallet(response.getUserId(), UserRole.BUYER);
    }

    @Test
    @DisplayName("A taken username is a conflict")
    void duplicateUsername() {
        when(userAccountRepository.existsByUsername("alice")).thenReturn(true);

        assertThatThrownBy(() -> userService.register(request("alice", publicKeyPem)))
                .isInstanceOf(ResourceConflictException.class);
        verify(userAccountRepository, never()).save(any());
    }

    @Test
    @DisplayName("A public key that cannot be parsed is rejected before anything is stored")
    void invalidPublicKey() {
        when(userAccountRepository.existsByUsername("alice")).thenReturn(false);

        assertThatThrownBy(() -> userService.register(request("alice", "not a key")))
                .isInstanceOf(BusinessLogicException.class);
        verify(userAccountRepository, never()).save(any());
    }

    private static RegisterRequest request(String username, String publicKey) {
        return RegisterRequest.builder()
                .username(username)
                .role(UserRole.BUYER)
                .publicKey(publicKey)
                .build();
    }
}
