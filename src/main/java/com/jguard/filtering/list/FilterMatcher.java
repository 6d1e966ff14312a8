package com.jguard.filtering.list;

import com.jguard.filtering.FilterContext;

import java.util.Optional;

/**
 * Compiled matching logic of one filter. Must not modify the context.
 */
@FunctionalInterface
public interface FilterMatcher {

    Optional<String> find(FilterContext context);
}
