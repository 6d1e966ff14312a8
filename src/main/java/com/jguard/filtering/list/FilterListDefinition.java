package com.jguard.filtering.list;

import com.jguard.filtering.action.ActionSettings;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw configuration of a filter list. Several definitions may share a name;
 * their filters end up in the same list.
 */
public class FilterListDefinition {

    private String name;
    private ActionSettings defaults = new ActionSettings();
    private List<FilterDefinition> filters = new ArrayList<>();

    public FilterListDefinition() {}

    public FilterListDefinition(String name, List<FilterDefinition> filters) {
        this.name = name;
        this.filters = filters;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public ActionSettings getDefaults() { return defaults; }
    public void setDefaults(ActionSettings defaults) { this.defaults = defaults; }
    public List<FilterDefinition> getFilters() { return filters; }
    public void setFilters(List<FilterDefinition> filters) { this.filters = filters; }
}
