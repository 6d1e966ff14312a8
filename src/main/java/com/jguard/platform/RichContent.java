package com.jguard.platform;

/**
 * Platform-neutral rich content block (a Discord embed).
 * Every field is optional; {@link #isEmpty()} is true when nothing is set.
 */
public record RichContent(
        String title,
        String description,
        Integer colour,
        String url,
        String thumbnailUrl
) {
    private static final RichContent EMPTY = new RichContent(null, null, null, null, null);

    public static RichContent empty() { return EMPTY; }

    public static RichContent ofDescription(String description) {
        return new RichContent(null, description, null, null, null);
    }

    public RichContent withDescription(String description) {
        return new RichContent(title, description, colour, url, thumbnailUrl);
    }

    public RichContent withColour(Integer colour) {
        return new RichContent(title, description, colour, url, thumbnailUrl);
    }

    public String descriptionOrEmpty() {
        return description != null ? description : "";
    }

    public boolean isEmpty() {
        return isBlank(title) && isBlank(description) && isBlank(url) && isBlank(thumbnailUrl);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isEmpty();
    }
}
