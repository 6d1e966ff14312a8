package com.jguard.platform;

import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Enforcement side of the chat platform. The filtering core decides what to
 * request and in which order; implementations decide how it is delivered.
 */
public interface ModerationPlatform {

    /**
     * Privately notifies the actor. Completes with {@link DeliveryResult#FORBIDDEN}
     * rather than an error when the actor does not accept private messages.
     */
    Mono<DeliveryResult> sendDirectMessage(Actor actor, String content, RichContent embed);

    Mono<Void> sendToChannel(ChannelRef channel, String content, RichContent embed);

    Mono<Void> issueInfraction(InfractionRequest request);

    /**
     * Forces a nickname on the actor until {@code expiresAt} (null means permanent).
     */
    Mono<Void> forceRename(Actor actor, Instant expiresAt, String reason, ChannelRef invokedIn);

    Mono<Void> sendAlert(ChannelRef alertChannel, String title, String content, List<RichContent> embeds);

    /**
     * Resolves a channel by id; empty when it does not exist or is not visible.
     */
    Mono<ChannelRef> fetchChannel(String channelId);

    default boolean isConnected() { return true; }
}
