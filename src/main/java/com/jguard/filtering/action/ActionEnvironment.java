package com.jguard.filtering.action;

import com.jguard.observability.JguardMetrics;
import com.jguard.platform.ChannelRef;
import com.jguard.platform.ModerationPlatform;

import java.time.Clock;

/**
 * Collaborators available to action entries while they are applied.
 * {@code modAlertsChannel} is null when it could not be resolved at startup.
 */
public record ActionEnvironment(
        ModerationPlatform platform,
        Clock clock,
        ChannelRef modAlertsChannel,
        JguardMetrics metrics
) {
}
