package com.pocketledger.service;

import com.pocketledger.domain.User;
import com.pocketledger.exception.ResourceNotFoundException;
import com.pocketledger.repository.UserRepository;
import com.pocketledger.security.JwtTokenProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;

/**
 * Service for registration, e-mail verification and credential checks.
 *
 * Password hashing uses BCryptPasswordEncoder (cost factor 12).
 * Plaintext passwords are never stored or logged.
 */
@Service
@Transactional
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final UserRepository   userRepository;
    private final PasswordEncoder  passwordEncoder;
    private final AccountService   accountService;
    private final CategoryService  categoryService;
    private final JwtTokenProvider tokenProvider;

    public UserService(UserRepository   userRepository,
                       PasswordEncoder  passwordEncoder,
                       AccountService   accountService,
                       CategoryService  categoryService,
                       JwtTokenProvider tokenProvider) {
        this.userRepository  = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.accountService  = accountService;
        this.categoryService = categoryService;
        this.tokenProvider   = tokenProvider;
    }

    public enum VerificationOutcome {
        VERIFIED,
        ALREADY_VERIFIED
    }

    /**
     * Register a new, unverified user together with the default account and
     * the default categories, all in one transaction.
     *
     * @throws IllegalArgumentException if the email is already registered
     */
    public User registerUser(String name, String email, String plainPassword) {
        String normalizedEmail = normalizeEmail(email);
        if (userRepository.existsByEmail(normalizedEmail)) {
            log.warn("Registration rejected - email already registered: {}", normalizedEmail);
            throw new IllegalArgumentException("Email already registered: " + normalizedEmail);
        }

        User user = userRepository.save(new User(name.strip(), normalizedEmail, passwordEncoder.encode(plainPassword)));
        accountService.createDefault(user);
        categoryService.createDefaults(user);

        log.info("User registered - userId={}, email={}", user.getId(), user.getEmail());
        return user;
    }

    /**
     * Confirm an e-mail address from the token in the verification link.
     *
     * @throws IllegalArgumentException if the token is invalid, expired or of the wrong kind
     */
    public VerificationOutcome verifyEmail(String token) {
        String email = tokenProvider.verifyVerificationToken(token)
                .orElseThrow(() -> new IllegalArgumentException("Invalid or expired verification token"));
        User user = userRepository.findByEmail(email)
                .orElseThrow(() -> new IllegalArgumentException("Invalid or expired verification token"));

        if (user.isVerified()) {
            return VerificationOutcome.ALREADY_VERIFIED;
        }
        user.markVerified();
        userRepository.save(user);
        log.info("E-mail verified - userId={}", user.getId());
        return VerificationOutcome.VERIFIED;
    }

    /**
     * Check credentials for login. Wrong email and wrong password get the same message.
     *
     * @throws IllegalArgumentException on bad credentials or an unverified address
     */
    @Transactional(readOnly = true)
    public User authenticate(String email, String plainPassword) {
        User user = userRepository.findByEmail(normalizeEmail(email))
                .filter(candidate -> passwordEncoder.matches(plainPassword, candidate.getPasswordHash()))
                .orElseThrow(() -> {
                    log.warn("Login failed - bad credentials for email={}", email);
                    return new IllegalArgumentException("Invalid email or password");
                });
        if (!user.isVerified()) {
            log.warn("Login failed - email not verified, userId={}", user.getId());
            throw new IllegalArgumentException("Email not verified. Check your inbox for the verification link");
        }
        return user;
    }

    @Transactional(readOnly = true)
    public User get(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> ResourceNotFoundException.of("User", userId));
    }

    private static String normalizeEmail(String email) {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("Email is required");
        }
        return email.strip().toLowerCase(Locale.ROOT);
    }
}
