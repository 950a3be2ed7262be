package com.example.identityapi.entity;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * Past password hash of a user, mapping to 'password_histories' table.
 *
 * Rows are append-only. The identity id gives a total insertion order
 * that breaks ties between equal created_date values.
 */
@Entity
@Table(name = "password_histories", indexes = {
    @Index(name = "idx_password_histories_user", columnList = "user_id, created_date")
})
public class PasswordHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    @Column(name = "created_date", nullable = false, updatable = false)
    private Instant createdDate;

    protected PasswordHistory() {
    }

    public PasswordHistory(String userId, String passwordHash, Instant createdDate) {
        this.userId = userId;
        this.passwordHash = passwordHash;
        this.createdDate = createdDate;
    }

    public Long getId() {
        return id;
    }

    public String getUserId() {
        return userId;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public Instant getCreatedDate() {
        return createdDate;
    }
}
