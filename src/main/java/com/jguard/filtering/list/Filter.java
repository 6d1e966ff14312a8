package com.jguard.filtering.list;

import com.jguard.filtering.action.ActionSet;

/**
 * A single rule of a filter list and the actions to take when it matches.
 * {@code description} may be null.
 */
public record Filter(long id, String content, String description, ActionSet actions) {

    public Filter {
        actions = actions != null ? actions : ActionSet.empty();
    }
}
