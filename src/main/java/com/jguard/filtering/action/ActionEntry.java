package com.jguard.filtering.action;

import com.jguard.filtering.FilterContext;
import reactor.core.publisher.Mono;

/**
 * One family of side effects a filter can request when it matches.
 */
public interface ActionEntry {

    ActionKind kind();

    /**
     * Merges two entries of the same kind into one whose effect covers both.
     * The operation is associative and never mutates either operand.
     *
     * @throws IncompatibleActionException if {@code other} is of another kind
     */
    ActionEntry combine(ActionEntry other);

    /**
     * Performs the action, recording what was done on the context.
     */
    Mono<Void> apply(FilterContext context, ActionEnvironment environment);

    /**
     * Casts {@code other} to this entry's type after checking the kinds agree.
     */
    static <T extends ActionEntry> T requireSameKind(ActionEntry self, ActionEntry other, Class<T> type) {
        if (other.kind() != self.kind() || !type.isInstance(other)) {
            throw new IncompatibleActionException(self.kind(), other.kind());
        }
        return type.cast(other);
    }
}
