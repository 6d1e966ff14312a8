package com.jguard.filtering.action;

import com.jguard.filtering.FilterContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The actions of one filter, or the merged actions of every filter that
 * triggered on an event. Holds at most one entry per {@link ActionKind}.
 */
public final class ActionSet {

    private static final Logger log = LoggerFactory.getLogger(ActionSet.class);

    private static final ActionSet EMPTY = new ActionSet(new EnumMap<>(ActionKind.class));

    private final Map<ActionKind, ActionEntry> entries;

    private ActionSet(EnumMap<ActionKind, ActionEntry> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static ActionSet empty() {
        return EMPTY;
    }

    /**
     * Builds a set from entries; entries sharing a kind are combined.
     */
    public static ActionSet of(ActionEntry... entries) {
        EnumMap<ActionKind, ActionEntry> map = new EnumMap<>(ActionKind.class);
        for (ActionEntry entry : entries) {
            map.merge(entry.kind(), entry, ActionEntry::combine);
        }
        return new ActionSet(map);
    }

    public static ActionSet fromSettings(ActionSettings settings) {
        if (settings == null) return EMPTY;
        EnumMap<ActionKind, ActionEntry> map = new EnumMap<>(ActionKind.class);

        if (settings.getSendAlert() != null) {
            map.put(ActionKind.SEND_ALERT, new SendAlert(settings.getSendAlert()));
        }
        if (settings.getPings() != null && !settings.getPings().isEmpty()) {
            map.put(ActionKind.PING, AlertPing.of(settings.getPings()));
        }

        ActionSettings.SuperstarSettings star = settings.getSuperstar();
        InfractionAndNotification infraction = new InfractionAndNotification(
                Infraction.parse(settings.getInfractionType()),
                settings.getInfractionReason(),
                settings.getInfractionDuration(),
                settings.getDmContent(),
                settings.getDmEmbed(),
                star != null ? new Superstar(star.getReason(), star.getDuration()) : null);
        if (!infraction.isEmpty()) {
            map.put(ActionKind.INFRACTION_AND_NOTIFICATION, infraction);
        }
        return new ActionSet(map);
    }

    /**
     * Returns a set containing the entries of both sets, combining entries of the same kind.
     */
    public ActionSet union(ActionSet other) {
        if (other == null || other.isEmpty()) return this;
        if (isEmpty()) return other;
        EnumMap<ActionKind, ActionEntry> merged = new EnumMap<>(ActionKind.class);
        merged.putAll(entries);
        other.entries.forEach((kind, entry) -> merged.merge(kind, entry, ActionEntry::combine));
        return new ActionSet(merged);
    }

    /**
     * Unions every set, left to right. Since each entry's combine is associative
     * the grouping does not affect the result.
     */
    public static ActionSet unionAll(Collection<ActionSet> sets) {
        return sets.stream().reduce(EMPTY, ActionSet::union);
    }

    /**
     * Applies every entry once, in kind order. A failing entry is logged and
     * does not prevent the following ones from running.
     */
    public Mono<Void> apply(FilterContext context, ActionEnvironment environment) {
        return Flux.fromIterable(entries.values())
                .concatMap(entry -> Mono.defer(() -> entry.apply(context, environment))
                        .doOnSuccess(v -> {
                            if (environment.metrics() != null) {
                                environment.metrics().recordActionApplied(entry.kind().label());
                            }
                        })
                        .onErrorResume(e -> {
                            log.error("Action {} failed for author={}", entry.kind().label(),
                                    context.author().id(), e);
                            if (environment.metrics() != null) {
                                environment.metrics().recordActionFailed(entry.kind().label());
                            }
                            return Mono.empty();
                        }))
                .then();
    }

    public Optional<ActionEntry> get(ActionKind kind) {
        return Optional.ofNullable(entries.get(kind));
    }

    public <T extends ActionEntry> Optional<T> get(ActionKind kind, Class<T> type) {
        return get(kind).filter(type::isInstance).map(type::cast);
    }

    public Set<ActionKind> kinds() {
        return entries.keySet();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ActionSet that)) return false;
        return entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "ActionSet" + entries.values();
    }
}
