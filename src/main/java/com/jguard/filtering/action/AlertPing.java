package com.jguard.filtering.action;

import com.jguard.filtering.FilterContext;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Mentions (roles or users) added to the alert content.
 */
public record AlertPing(Set<String> mentions) implements ActionEntry {

    public AlertPing {
        mentions = Collections.unmodifiableSet(new LinkedHashSet<>(mentions));
    }

    public static AlertPing of(Collection<String> mentions) {
        return new AlertPing(new LinkedHashSet<>(mentions));
    }

    @Override
    public ActionKind kind() { return ActionKind.PING; }

    @Override
    public AlertPing combine(ActionEntry other) {
        AlertPing that = ActionEntry.requireSameKind(this, other, AlertPing.class);
        Set<String> union = new LinkedHashSet<>(mentions);
        union.addAll(that.mentions);
        return new AlertPing(union);
    }

    @Override
    public Mono<Void> apply(FilterContext context, ActionEnvironment environment) {
        return Mono.fromRunnable(() -> {
            if (mentions.isEmpty()) return;
            String pings = String.join(" ", mentions);
            String existing = context.getAlertContent();
            context.setAlertContent(existing.isEmpty() ? pings : existing + " " + pings);
        });
    }
}
