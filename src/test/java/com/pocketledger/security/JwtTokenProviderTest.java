package com.pocketledger.security;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class JwtTokenProviderTest {

    private static final String SECRET = "test-secret-key-that-is-long-enough!!";

    private JwtTokenProvider provider;

    @BeforeEach
    void setUp() {
        provider = new JwtTokenProvider(SECRET, 3_600_000L, 86_400_000L);
    }

    @Test @DisplayName("generateToken → isValid returns true")
    void generateAndValidate() {
        String token = provider.generateToken(1L, "user@test.com");
        assertThat(provider.isValid(token)).isTrue();
    }

    @Test @DisplayName("extractEmail returns correct subject")
    void extractEmail() {
        String token = provider.generateToken(42L, "alice@test.com");
        assertThat(provider.extractEmail(token)).isEqualTo("alice@test.com");
    }

    @Test @DisplayName("extractUserId returns correct claim")
    void extractUserId() {
        String token = provider.generateToken(99L, "bob@test.com");
        assertThat(provider.extractUserId(token)).isEqualTo(99L);
    }

    @Test @DisplayName("tampered token → isValid returns false")
    void tamperedToken() {
        String token = provider.generateToken(1L, "user@test.com");
        assertThat(provider.isValid(token + "x")).isFalse();
    }

    @Test @DisplayName("null token → isValid returns false")
    void nullToken() {
        assertThat(provider.isValid(null)).isFalse();
    }

    @Test @DisplayName("expired token → isValid returns false")
    void expiredToken() {
        var expired = new JwtTokenProvider(SECRET, -1L, -1L);
        String token = expired.generateToken(1L, "user@test.com");
        assertThat(expired.isValid(token)).isFalse();
    }

    @Test @DisplayName("verification token → accepted for verification only")
    void verificationToken() {
        String token = provider.generateVerificationToken("carol@test.com");

        assertThat(provider.verifyVerificationToken(token)).contains("carol@test.com");
        assertThat(provider.isValid(token)).isFalse();
    }

    @Test @DisplayName("access token → rejected as a verification token")
    void accessTokenCannotVerify() {
        String token = provider.generateToken(1L, "user@test.com");
        assertThat(provider.verifyVerificationToken(token)).isEmpty();
    }

    @Test @DisplayName("expired verification token → empty")
    void expiredVerificationToken() {
        var expired = new JwtTokenProvider(SECRET, 3_600_000L, -1L);
        String token = expired.generateVerificationToken("carol@test.com");
        assertThat(expired.verifyVerificationToken(token)).isEmpty();
    }

    @Test @DisplayName("token signed with another key → rejected")
    void foreignKey() {
        var other = new JwtTokenProvider("another-secret-key-that-is-long-enough", 3_600_000L, 86_400_000L);
        assertThat(provider.isValid(other.generateToken(1L, "user@test.com"))).isFalse();
    }

    @Test @DisplayName("short secret < 32 chars → IllegalStateException on construction")
    void shortSecret() {
        assertThatThrownBy(() -> new JwtTokenProvider("tooshort", 3600L, 3600L))
            .isInstanceOf(IllegalStateException.class);
    }
}
