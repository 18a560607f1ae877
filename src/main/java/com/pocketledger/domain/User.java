package com.pocketledger.domain;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.Objects;

/**
 * User entity: the owner of accounts, categories and transactions.
 *
 * Users are created at registration in an unverified state and become able
 * to log in once the e-mail verification link has been followed.
 * Users are never deleted.
 *
 * Notes:
 * - Email is stored lower-cased and is the business key (equals/hashCode)
 * - Only the BCrypt hash of the password is persisted
 */
@Entity
@Table(
    name = "users",
    indexes = {
        @Index(name = "idx_users_email", columnList = "email", unique = true)
    }
)
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 120)
    private String name;

    @Column(nullable = false, unique = true, length = 255)
    private String email;

    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    @Column(nullable = false)
    private boolean verified;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * JPA requires a no-arg constructor.
     */
    protected User() {
    }

    /**
     * Create a new, unverified user.
     *
     * @param name         display name
     * @param email        user's email (must be unique)
     * @param passwordHash BCrypt hashed password
     */
    public User(String name, String email, String passwordHash) {
        this.name = name;
        this.email = email;
        this.passwordHash = passwordHash;
        this.verified = false;
        this.createdAt = Instant.now();
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getEmail() {
        return email;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public boolean isVerified() {
        return verified;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Mark the e-mail address as confirmed. Idempotent.
     */
    public void markVerified() {
        this.verified = true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        User user = (User) o;
        return Objects.equals(email, user.email);
    }

    @Override
    public int hashCode() {
        return Objects.hash(email);
    }

    @Override
    public String toString() {
        return "User{" +
                "id=" + id +
                ", email='" + email + '\'' +
                ", verified=" + verified +
                '}';
    }
}
