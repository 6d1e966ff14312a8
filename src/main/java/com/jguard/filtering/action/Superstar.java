package com.jguard.filtering.action;

import java.time.Duration;

/**
 * A forced rename riding alongside a primary infraction. A null duration is permanent.
 */
public record Superstar(String reason, Duration duration) {

    public Superstar {
        reason = reason != null ? reason : "";
    }

    /**
     * Merges two optional superstars; a null operand is ignored.
     */
    public static Superstar merge(Superstar first, Superstar second) {
        if (first == null) return second;
        if (second == null) return first;
        return new Superstar(
                InfractionAndNotification.mergeMessages(first.reason, second.reason),
                InfractionAndNotification.mergeDurations(first.duration, second.duration));
    }
}
