package se.escrow_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.escrow_be.dto.request.RegisterRequest;
import se.escrow_be.dto.response.UserResponse;
import se.escrow_be.exception.ResourceConflictException;
import se.escrow_be.exception.ResourceNotFoundException;
import se.escrow_be.pojo.UserAccount;
import se.escrow_be.pojo.Wallet;
import se.escrow_be.repository.UserAccountRepository;

import java.util.Locale;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
@Slf4j
public class UserService {

    private final UserAccountRepository userAccountRepository;
    private final WalletService walletService;
    private final SignatureVerifier signatureVerifier;

    @Transactional
    public UserResponse register(RegisterRequest request) {
        String username = request.getUsername().trim().toLowerCase(Locale.ROOT);
        if (userAccountRepository.existsByUsername(username)) {
            throw new ResourceConflictException("Username already taken: " + username);
        }

        // Reject keys we could never verify against
        String publicKeyPem = signatureVerifier.toPem(signatureVerifier.parsePublicKey(request.getPublicKey()));

        UserAccount account = UserAccount.builder()
                .userId(UUID.randomUUID().toString())
                .username(username)
                .role(request.getRole())
                .publicKey(publicKeyPem)
                .build();
        account = userAccountRepository.save(account);
        Wallet wallet = walletService.openWallet(account.getUserId(), account.getRole());

        log.info("Registered {} '{}' as user {}", account.getRole(), username, account.getUserId());
        return UserResponse.builder()
                .userId(account.getUserId())
                .username(account.getUsername())
                .role(account.getRole())
                .balance(wallet.getAvailableBalance())
                .build();
    }

    public UserAccount getUser(String userId) {
        return userAccountRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User not found with ID: " + userId));
    }
}
