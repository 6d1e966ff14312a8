package com.jguard.channel;

import reactor.core.publisher.Flux;

/**
 * A stream of chat events to run through the filters.
 */
public interface FilterEventSource {

    String sourceType();

    Flux<InboundMessage> receiveMessages();

    default boolean isConnected() { return true; }
}
