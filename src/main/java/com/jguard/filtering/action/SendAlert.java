package com.jguard.filtering.action;

import com.jguard.filtering.FilterContext;
import reactor.core.publisher.Mono;

/**
 * Whether moderators get an alert. If any triggered filter wants one, one is sent.
 */
public record SendAlert(boolean enabled) implements ActionEntry {

    @Override
    public ActionKind kind() { return ActionKind.SEND_ALERT; }

    @Override
    public SendAlert combine(ActionEntry other) {
        SendAlert that = ActionEntry.requireSameKind(this, other, SendAlert.class);
        return new SendAlert(enabled || that.enabled);
    }

    @Override
    public Mono<Void> apply(FilterContext context, ActionEnvironment environment) {
        return Mono.fromRunnable(() -> context.setSendAlert(enabled));
    }
}
