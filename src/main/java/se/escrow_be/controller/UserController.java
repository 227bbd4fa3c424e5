package se.escrow_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import se.escrow_be.dto.request.RegisterRequest;
import se.escrow_be.dto.response.ApiResponse;
import se.escrow_be.dto.response.UserResponse;
import se.escrow_be.dto.response.WalletResponse;
import se.escrow_be.service.UserService;
import se.escrow_be.service.WalletService;

@RestController
@RequestMapping("/api")
@Tag(name = "Parties", description = "Registration with a signing key, and wallet balances")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;
    private final WalletService walletService;

    @Operation(
            summary = "Register a party",
            description = "Registers a buyer or seller with the RSA public key (SPKI PEM) their signatures are verified against, "
                    + "and opens a wallet with the role's starting balance."
    )
    @PostMapping("/register")
    public ResponseEntity<ApiResponse<UserResponse>> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("User registered successfully", userService.register(request)));
    }

    @Operation(summary = "Get wallet balance", description = "Available and locked balance of a user's wallet")
    @GetMapping("/wallet/{userId}")
    public ResponseEntity<ApiResponse<WalletResponse>> getWallet(@PathVariable String userId) {
        return ResponseEntity.ok(ApiResponse.success(walletService.getWallet(userId)));
    }
}
