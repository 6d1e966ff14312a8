package com.jguard.filtering.list;

import com.jguard.filtering.Event;
import com.jguard.filtering.FilterContext;
import com.jguard.filtering.action.ActionSet;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A named collection of filters evaluated against the same kinds of events.
 */
public abstract class FilterList {

    private final String name;
    private final List<CompiledFilter> filters = new CopyOnWriteArrayList<>();

    protected FilterList(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    /**
     * Events this list wants to be dispatched.
     */
    public abstract Set<Event> events();

    /**
     * Compiles the matching logic of a filter.
     *
     * @throws RuntimeException if the filter content is not valid for this list
     */
    protected abstract FilterMatcher compile(FilterDefinition definition);

    public void addFilters(FilterListDefinition definition) {
        ActionSet defaults;
        try {
            defaults = ActionSet.fromSettings(definition.getDefaults());
        } catch (RuntimeException e) {
            throw new FilterListConfigurationException(name, "list defaults", e);
        }
        List<CompiledFilter> compiled = new ArrayList<>();
        for (FilterDefinition def : definition.getFilters()) {
            try {
                ActionSet actions = def.getActions() != null
                        ? ActionSet.fromSettings(def.getActions()) : defaults;
                Filter filter = new Filter(def.getId(), def.getContent(), def.getDescription(), actions);
                compiled.add(new CompiledFilter(filter, compile(def)));
            } catch (RuntimeException e) {
                throw new FilterListConfigurationException(name,
                        "filter #" + def.getId() + " (" + def.getContent() + ")", e);
            }
        }
        filters.addAll(compiled);
    }

    public List<Filter> filters() {
        return filters.stream().map(CompiledFilter::filter).toList();
    }

    /**
     * Returns the filters that match the context. Matching only reads the context.
     */
    public Mono<List<FilterHit>> triggersFor(FilterContext context) {
        return Mono.fromCallable(() -> {
            List<FilterHit> hits = new ArrayList<>();
            for (CompiledFilter compiled : filters) {
                Optional<String> match = compiled.matcher().find(context);
                match.ifPresent(m -> hits.add(new FilterHit(compiled.filter(), m)));
            }
            return hits;
        });
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + ", " + filters.size() + " filters]";
    }

    private record CompiledFilter(Filter filter, FilterMatcher matcher) {}
}
