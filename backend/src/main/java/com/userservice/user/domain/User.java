package com.userservice.user.domain;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

@Entity
@Table(name = "users")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, unique = true)
    private String email;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = now();
        createdAt = now;
        updatedAt = now;
    }

    @Builder
    public User(String email, String name) {
        this.email = email;
        this.name = name;
    }

    public void changeEmail(String email) {
        this.email = email;
    }

    public void changeName(String name) {
        this.name = name;
    }

    /**
     * Refreshes {@code updatedAt}. The new value is always strictly after the
     * previous one, even when the clock has not advanced at storage precision.
     */
    public void touch() {
        Instant now = now();
        if (updatedAt == null || now.isAfter(updatedAt)) {
            updatedAt = now;
        } else {
            updatedAt = updatedAt.plus(1, ChronoUnit.MICROS);
        }
    }

    // Database timestamps keep microseconds
    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MICROS);
    }
}
