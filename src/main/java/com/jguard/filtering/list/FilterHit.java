package com.jguard.filtering.list;

/**
 * A filter that matched, with the text that made it match.
 */
public record FilterHit(Filter filter, String match) {
}
