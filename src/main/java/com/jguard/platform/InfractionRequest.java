package com.jguard.platform;

import com.jguard.filtering.action.Infraction;

import java.time.Instant;

/**
 * A request to issue an infraction. {@code expiresAt} is null for permanent
 * infractions; {@code invokedIn} is the channel the confirmation is posted to.
 */
public record InfractionRequest(
        Actor target,
        Infraction infraction,
        Instant expiresAt,
        String reason,
        ChannelRef invokedIn
) {
    public boolean permanent() {
        return expiresAt == null;
    }
}
