package com.jguard.filtering.action;

import java.util.Locale;

/**
 * Infraction types, most severe first. {@link #NONE} stands for "no infraction"
 * and is the identity when merging.
 */
public enum Infraction {
    BAN,
    KICK,
    MUTE,
    VOICE_BAN,
    WARNING,
    WATCH,
    SUPERSTAR,
    NOTE,
    NONE;

    public boolean isNone() {
        return this == NONE;
    }

    public boolean isMoreSevereThan(Infraction other) {
        return ordinal() < other.ordinal();
    }

    /**
     * Parses names as they appear in filter configuration ("ban", "Voice Ban").
     * A null or blank value means {@link #NONE}.
     */
    public static Infraction parse(String value) {
        if (value == null || value.isBlank()) return NONE;
        return valueOf(value.trim().replace(' ', '_').toUpperCase(Locale.ROOT));
    }

    /**
     * The label recorded in an alert's action list, e.g. "voice_ban".
     */
    public String actionLabel() {
        return name().toLowerCase(Locale.ROOT);
    }
}
