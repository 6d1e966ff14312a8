package com.jguard.filtering.action;

/**
 * Discriminant of {@link ActionEntry} implementations. An {@link ActionSet}
 * holds at most one entry per kind and applies them in declaration order.
 */
public enum ActionKind {
    SEND_ALERT("send_alert"),
    PING("ping"),
    INFRACTION_AND_NOTIFICATION("infraction_and_notification");

    private final String label;

    ActionKind(String label) {
        this.label = label;
    }

    public String label() { return label; }
}
