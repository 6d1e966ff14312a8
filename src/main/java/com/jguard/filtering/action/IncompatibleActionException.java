package com.jguard.filtering.action;

/**
 * Thrown when two action entries of different kinds are combined directly.
 * {@link ActionSet} keys entries by kind, so reaching this is a programming error.
 */
public class IncompatibleActionException extends RuntimeException {

    public IncompatibleActionException(ActionKind left, ActionKind right) {
        super("Cannot combine " + left.label() + " with " + right.label());
    }
}
