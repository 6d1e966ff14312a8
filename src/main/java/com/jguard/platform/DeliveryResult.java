package com.jguard.platform;

public enum DeliveryResult {
    DELIVERED,
    /** The recipient does not accept private messages from the bot. */
    FORBIDDEN
}
