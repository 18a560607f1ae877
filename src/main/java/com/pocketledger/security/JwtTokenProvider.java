package com.pocketledger.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

/**
 * JWT token lifecycle management.
 *
 * Two kinds of token share one HS256 key and are told apart by the
 * {@code purpose} claim; neither is accepted where the other is expected.
 *
 * Access token:       subject=email, userId, purpose=access, lifetime expiry-ms
 * Verification token: subject=email, purpose=email-verification, lifetime verification-expiry-ms
 */
@Component
public class JwtTokenProvider {

    static final String PURPOSE_CLAIM = "purpose";
    static final String ACCESS = "access";
    static final String EMAIL_VERIFICATION = "email-verification";

    private final SecretKey secretKey;
    private final long      expiryMs;
    private final long      verificationExpiryMs;

    public JwtTokenProvider(
            @Value("${pocketledger.jwt.secret}") String secret,
            @Value("${pocketledger.jwt.expiry-ms:3600000}") long expiryMs,
            @Value("${pocketledger.jwt.verification-expiry-ms:86400000}") long verificationExpiryMs) {

        if (secret == null || secret.length() < 32) {
            throw new IllegalStateException(
                "pocketledger.jwt.secret must be at least 32 characters");
        }
        this.secretKey            = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.expiryMs             = expiryMs;
        this.verificationExpiryMs = verificationExpiryMs;
    }

    /** Generate a signed access token for the given user. */
    public String generateToken(Long userId, String email) {
        Date now = new Date();
        return Jwts.builder()
                .subject(email)
                .claim("userId", userId)
                .claim(PURPOSE_CLAIM, ACCESS)
                .issuedAt(now)
                .expiration(new Date(now.getTime() + expiryMs))
                .signWith(secretKey)
                .compact();
    }

    /** Generate the token embedded in the e-mail verification link. */
    public String generateVerificationToken(String email) {
        Date now = new Date();
        return Jwts.builder()
                .subject(email)
                .claim(PURPOSE_CLAIM, EMAIL_VERIFICATION)
                .issuedAt(now)
                .expiration(new Date(now.getTime() + verificationExpiryMs))
                .signWith(secretKey)
                .compact();
    }

    /** Expiry instant of an access token issued now. */
    public Instant accessTokenExpiry() {
        return Instant.now().plusMillis(expiryMs);
    }

    /** Extract the email (subject) from a valid token. */
    public String extractEmail(String token) {
        return parseClaims(token).getSubject();
    }

    /** Extract the userId claim from a valid access token. */
    public Long extractUserId(String token) {
        return parseClaims(token).get("userId", Long.class);
    }

    /**
     * Validate signature, expiry and that this is an access token.
     * Returns false instead of throwing; caller decides how to respond.
     */
    public boolean isValid(String token) {
        return claimsFor(token, ACCESS).isPresent();
    }

    /**
     * @return the e-mail address of a valid, unexpired verification token
     */
    public Optional<String> verifyVerificationToken(String token) {
        return claimsFor(token, EMAIL_VERIFICATION).map(Claims::getSubject);
    }

    private Optional<Claims> claimsFor(String token, String purpose) {
        try {
            Claims claims = parseClaims(token);
            return purpose.equals(claims.get(PURPOSE_CLAIM, String.class))
                    ? Optional.of(claims)
                    : Optional.empty();
        } catch (JwtException | IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private Claims parseClaims(String token) {
        return Jwts.parser()
                .verifyWith(secretKey)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }
}
