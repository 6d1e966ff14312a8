package com.jguard.audit;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "audit_log")
public class AuditEvent {

    public static final String TYPE_FILTER_TRIGGERED = "FILTER_TRIGGERED";
    public static final String TYPE_ALERT_FAILED = "ALERT_FAILED";
    public static final String TYPE_FILTER_LISTS_LOADED = "FILTER_LISTS_LOADED";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private Instant timestamp = Instant.now();

    @Column(name = "event_type", nullable = false, length = 64)
    private String eventType;

    @Column(name = "author_id", length = 64)
    private String authorId;

    @Column(name = "channel_id", length = 64)
    private String channelId;

    @Column(nullable = false, length = 256)
    private String action;

    @Column(name = "resource_type", length = 64)
    private String resourceType;

    @Column(name = "resource_id", length = 256)
    private String resourceId;

    @Column(length = 4000)
    private String details = "{}";

    @Column(nullable = false, length = 16)
    private String outcome = "SUCCESS";

    public AuditEvent() {}

    public static AuditEvent of(String eventType, String action) {
        AuditEvent event = new AuditEvent();
        event.eventType = eventType;
        event.action = action;
        return event;
    }

    public AuditEvent withAuthorId(String authorId) { this.authorId = authorId; return this; }
    public AuditEvent withChannelId(String channelId) { this.channelId = channelId; return this; }
    public AuditEvent withResource(String type, String id) { this.resourceType = type; this.resourceId = id; return this; }
    public AuditEvent withDetails(String details) { this.details = details; return this; }
    public AuditEvent withOutcome(String outcome) { this.outcome = outcome; return this; }
    public AuditEvent withTimestamp(Instant timestamp) { this.timestamp = timestamp; return this; }

    public UUID getId() { return id; }
    public Instant getTimestamp() { return timestamp; }
    public String getEventType() { return eventType; }
    public String getAuthorId() { return authorId; }
    public String getChannelId() { return channelId; }
    public String getAction() { return action; }
    public String getResourceType() { return resourceType; }
    public String getResourceId() { return resourceId; }
    public String getDetails() { return details; }
    public String getOutcome() { return outcome; }
}
