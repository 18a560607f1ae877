package com.pocketledger.controller;

import com.pocketledger.domain.User;
import com.pocketledger.dto.ApiResponses;
import com.pocketledger.dto.RegisterUserRequest;
import com.pocketledger.mail.VerificationMailer;
import com.pocketledger.security.JwtTokenProvider;
import com.pocketledger.service.UserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

/**
 * Authentication controller.
 *
 * POST /auth/register: create an unverified user and mail the verification link
 * GET  /auth/verify  : confirm the e-mail address
 * POST /auth/login   : validate credentials, return a signed JWT
 *
 * The JWT must be included in subsequent requests as:
 *   Authorization: Bearer <token>
 */
@RestController
@RequestMapping("/auth")
@Tag(name = "Authentication", description = "Registration, e-mail verification and login")
public class AuthController {

    private static final Logger log = LoggerFactory.getLogger(AuthController.class);

    private final UserService        userService;
    private final JwtTokenProvider   tokenProvider;
    private final VerificationMailer verificationMailer;

    public AuthController(UserService        userService,
                          JwtTokenProvider   tokenProvider,
                          VerificationMailer verificationMailer) {
        this.userService        = userService;
        this.tokenProvider      = tokenProvider;
        this.verificationMailer = verificationMailer;
    }

    // ── Request / Response DTOs (local, no domain leakage) ───────────────────

    public record LoginRequest(
            @NotBlank @Email String email,
            @NotBlank        String password) {}

    public record LoginResponse(
            String  token,
            Long    id,
            String  name,
            String  email,
            Instant expiresAt) {}

    // ── Endpoints ─────────────────────────────────────────────────────────────

    /**
     * HTTP Contract:
     *  200 OK          → user created; verification e-mail queued
     *  400 Bad Request → invalid fields or email already registered
     */
    @PostMapping("/register")
    @Operation(
        summary     = "Register",
        description = "Create a user with a default account and categories, and e-mail a verification link.")
    public ResponseEntity<ApiResponses.MessageResponse> register(
            @Valid @RequestBody RegisterUserRequest request) {

        User user = userService.registerUser(request.getName(), request.getEmail(), request.getPassword());

        // Registration has committed at this point; delivery runs asynchronously
        verificationMailer.sendVerificationEmail(user);

        return ResponseEntity.ok(new ApiResponses.MessageResponse(
                "User registered. Check your e-mail to verify your address."));
    }

    /**
     * HTTP Contract:
     *  200 OK          → verified (or already verified)
     *  400 Bad Request → invalid or expired token
     */
    @GetMapping("/verify")
    @Operation(summary = "Verify e-mail", description = "Confirm an e-mail address with the token from the link.")
    public ResponseEntity<ApiResponses.MessageResponse> verify(@RequestParam("token") String token) {
        UserService.VerificationOutcome outcome = userService.verifyEmail(token);
        String message = outcome == UserService.VerificationOutcome.ALREADY_VERIFIED
                ? "Email already verified"
                : "Email verified successfully";
        return ResponseEntity.ok(new ApiResponses.MessageResponse(message));
    }

    /**
     * HTTP Contract:
     *  200 OK          → credentials valid, token returned
     *  400 Bad Request → wrong email or password (same message), or e-mail not verified
     */
    @PostMapping("/login")
    @Operation(
        summary     = "Login",
        description = "Validate credentials and receive a Bearer JWT token.")
    public ResponseEntity<LoginResponse> login(
            @Valid @RequestBody LoginRequest request) {

        User user = userService.authenticate(request.email(), request.password());
        String token = tokenProvider.generateToken(user.getId(), user.getEmail());
        log.info("Login successful - userId={}", user.getId());

        return ResponseEntity.ok(new LoginResponse(
                token,
                user.getId(),
                user.getName(),
                user.getEmail(),
                tokenProvider.accessTokenExpiry()
        ));
    }
}
