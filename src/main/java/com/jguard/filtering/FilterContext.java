package com.jguard.filtering;

import com.jguard.channel.InboundMessage;
import com.jguard.platform.Actor;
import com.jguard.platform.ChannelRef;
import com.jguard.platform.MessageRef;
import com.jguard.platform.RichContent;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything known about one filtered event, plus what the triggered actions
 * decided to do about it.
 *
 * <p>Input fields are fixed at construction. Output fields are written in
 * phases: {@link #addMatches} only by the dispatcher once every filter list
 * has answered, the remaining setters only by action entries while they are
 * applied. The alert composer reads the result and writes nothing.
 *
 * <p>A context belongs to a single dispatch and is not thread-safe.
 */
public class FilterContext {

    // Input
    private final Event event;
    private final Actor author;
    private final ChannelRef channel;
    private final String content;
    private final MessageRef message;
    private final List<RichContent> embeds;

    // Output
    private String dmContent = "";
    private RichContent dmEmbed = RichContent.empty();
    private boolean sendAlert = true;
    private String alertContent = "";
    private final List<RichContent> alertEmbeds = new ArrayList<>();
    private final List<String> actionDescriptions = new ArrayList<>();
    private final List<String> matches = new ArrayList<>();

    public FilterContext(Event event, Actor author, ChannelRef channel, String content,
                         MessageRef message, List<RichContent> embeds) {
        this.event = event;
        this.author = author;
        this.channel = channel;
        this.content = content != null ? content : "";
        this.message = message;
        this.embeds = embeds != null ? List.copyOf(embeds) : List.of();
    }

    public static FilterContext of(InboundMessage msg) {
        return new FilterContext(msg.event(), msg.author(), msg.channel(), msg.content(),
                msg.message(), msg.embeds());
    }

    // --- copy with overrides ---

    public FilterContext withEvent(Event event) {
        return copy(event, content, embeds);
    }

    public FilterContext withContent(String content) {
        return copy(event, content, embeds);
    }

    public FilterContext withEmbeds(List<RichContent> embeds) {
        return copy(event, content, embeds);
    }

    private FilterContext copy(Event event, String content, List<RichContent> embeds) {
        FilterContext copy = new FilterContext(event, author, channel, content, message, embeds);
        copy.dmContent = dmContent;
        copy.dmEmbed = dmEmbed;
        copy.sendAlert = sendAlert;
        copy.alertContent = alertContent;
        copy.alertEmbeds.addAll(alertEmbeds);
        copy.actionDescriptions.addAll(actionDescriptions);
        copy.matches.addAll(matches);
        return copy;
    }

    // --- input ---

    public Event event() { return event; }
    public Actor author() { return author; }
    public ChannelRef channel() { return channel; }
    public String content() { return content; }
    public MessageRef message() { return message; }
    public List<RichContent> embeds() { return embeds; }

    // --- output ---

    public String getDmContent() { return dmContent; }
    public void setDmContent(String dmContent) { this.dmContent = dmContent != null ? dmContent : ""; }

    public RichContent getDmEmbed() { return dmEmbed; }
    public void setDmEmbed(RichContent dmEmbed) { this.dmEmbed = dmEmbed != null ? dmEmbed : RichContent.empty(); }

    public boolean isSendAlert() { return sendAlert; }
    public void setSendAlert(boolean sendAlert) { this.sendAlert = sendAlert; }

    public String getAlertContent() { return alertContent; }
    public void setAlertContent(String alertContent) { this.alertContent = alertContent != null ? alertContent : ""; }

    public List<RichContent> getAlertEmbeds() { return List.copyOf(alertEmbeds); }
    public void addAlertEmbed(RichContent embed) { alertEmbeds.add(embed); }

    public List<String> getActionDescriptions() { return List.copyOf(actionDescriptions); }
    public void addActionDescription(String description) { actionDescriptions.add(description); }

    public List<String> getMatches() { return List.copyOf(matches); }
    public void addMatches(List<String> found) { matches.addAll(found); }
}
