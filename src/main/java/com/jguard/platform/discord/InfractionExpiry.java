package com.jguard.platform.discord;

import com.jguard.filtering.action.Infraction;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A temporary infraction that has to be lifted on Discord once it expires.
 */
@Entity
@Table(name = "infraction_expiries")
public class InfractionExpiry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "guild_id", nullable = false, length = 64)
    private String guildId;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Infraction infraction;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ExpiryStatus status = ExpiryStatus.ACTIVE;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    public InfractionExpiry() {}

    public InfractionExpiry(String guildId, String userId, Infraction infraction, Instant expiresAt) {
        this.guildId = guildId;
        this.userId = userId;
        this.infraction = infraction;
        this.expiresAt = expiresAt;
    }

    public UUID getId() { return id; }
    public String getGuildId() { return guildId; }
    public String getUserId() { return userId; }
    public Infraction getInfraction() { return infraction; }
    public Instant getExpiresAt() { return expiresAt; }
    public ExpiryStatus getStatus() { return status; }
    public void setStatus(ExpiryStatus status) { this.status = status; }
    public Instant getCreatedAt() { return createdAt; }

    public enum ExpiryStatus {
        ACTIVE, LIFTED, SUPERSEDED, FAILED
    }
}
