package com.jguard.filtering;

/**
 * Kinds of events filter lists can subscribe to.
 */
public enum Event {
    MESSAGE,
    MESSAGE_EDIT;

    /**
     * Human-readable name, e.g. "Message Edit".
     */
    public String title() {
        String[] words = name().toLowerCase().split("_");
        StringBuilder sb = new StringBuilder();
        for (String word : words) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return sb.toString();
    }
}
