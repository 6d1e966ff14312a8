package com.jguard.filtering;

import com.jguard.filtering.list.Filter;
import com.jguard.filtering.list.FilterHit;

import java.util.List;

/**
 * The filters of one list that matched an event, in list order.
 */
public record TriggeredFilters(String listName, List<FilterHit> hits) {

    public TriggeredFilters {
        hits = List.copyOf(hits);
    }

    public List<Filter> filters() {
        return hits.stream().map(FilterHit::filter).toList();
    }
}
