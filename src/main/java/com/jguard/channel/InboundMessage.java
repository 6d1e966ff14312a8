package com.jguard.channel;

import com.jguard.filtering.Event;
import com.jguard.platform.Actor;
import com.jguard.platform.ChannelRef;
import com.jguard.platform.MessageRef;
import com.jguard.platform.RichContent;

import java.time.Instant;
import java.util.List;

public record InboundMessage(
        Event event,
        Actor author,
        ChannelRef channel,
        String content,
        MessageRef message,
        List<RichContent> embeds,
        Instant receivedAt
) {
    public InboundMessage(Event event, Actor author, ChannelRef channel, String content, MessageRef message) {
        this(event, author, channel, content, message, List.of(), Instant.now());
    }
}
