package com.jguard.filtering.list;

import com.jguard.filtering.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The loaded filter lists and which events each of them is subscribed to.
 *
 * <p>Lists are built from definitions at startup. {@link #load} builds a new
 * snapshot and swaps it in, so dispatches running concurrently with a reload
 * see either the old or the new lists, never a mix.
 */
public class FilterListRegistry {

    private static final Logger log = LoggerFactory.getLogger(FilterListRegistry.class);

    private final Map<String, FilterListFactory> factories;
    private final Set<String> warnedNames = ConcurrentHashMap.newKeySet();
    private volatile Snapshot snapshot = new Snapshot(Map.of(), Map.of());

    public FilterListRegistry(List<FilterListFactory> factories) {
        this.factories = factories.stream()
                .collect(Collectors.toMap(FilterListFactory::name, Function.identity()));
    }

    /**
     * Replaces the loaded lists with ones built from {@code definitions}.
     * Definitions naming an unknown list are skipped with a single warning per name.
     *
     * @throws FilterListConfigurationException if a filter cannot be compiled
     */
    public void load(List<FilterListDefinition> definitions) {
        Map<String, FilterList> lists = new LinkedHashMap<>();
        for (FilterListDefinition definition : definitions) {
            String listName = definition.getName();
            FilterList list = lists.get(listName);
            if (list == null) {
                FilterListFactory factory = factories.get(listName);
                if (factory == null) {
                    if (warnedNames.add(String.valueOf(listName))) {
                        log.warn("A filter list named {} was configured, but there is no matching implementation",
                                listName);
                    }
                    continue;
                }
                list = factory.create();
                lists.put(listName, list);
            }
            list.addFilters(definition);
        }

        Map<Event, List<FilterList>> subscriptions = new EnumMap<>(Event.class);
        for (FilterList list : lists.values()) {
            subscribe(subscriptions, list, list.events());
        }
        Map<Event, List<FilterList>> frozen = new EnumMap<>(Event.class);
        subscriptions.forEach((event, subscribers) -> frozen.put(event, List.copyOf(subscribers)));

        this.snapshot = new Snapshot(Collections.unmodifiableMap(lists), Collections.unmodifiableMap(frozen));
        log.info("Loaded {} filter lists: {}", lists.size(), lists.values());
    }

    /**
     * Adds the list to the subscribers of each event, keeping registration order
     * and ignoring repeated subscriptions.
     */
    static void subscribe(Map<Event, List<FilterList>> subscriptions, FilterList list, Collection<Event> events) {
        for (Event event : events) {
            List<FilterList> subscribers = subscriptions.computeIfAbsent(event, e -> new ArrayList<>());
            if (!subscribers.contains(list)) {
                subscribers.add(list);
            }
        }
    }

    public List<FilterList> subscribers(Event event) {
        return snapshot.subscriptions().getOrDefault(event, List.of());
    }

    public Optional<FilterList> get(String name) {
        return Optional.ofNullable(snapshot.lists().get(name));
    }

    public Collection<FilterList> filterLists() {
        return snapshot.lists().values();
    }

    private record Snapshot(Map<String, FilterList> lists, Map<Event, List<FilterList>> subscriptions) {}
}
