package com.jguard.filtering.list;

import com.jguard.filtering.action.ActionSettings;

/**
 * Raw configuration of a single filter. Filters without {@code actions}
 * inherit the defaults of their list.
 */
public class FilterDefinition {

    private long id;
    private String content;
    private String description;
    private ActionSettings actions;

    public FilterDefinition() {}

    public FilterDefinition(long id, String content) {
        this.id = id;
        this.content = content;
    }

    public long getId() { return id; }
    public void setId(long id) { this.id = id; }
    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public ActionSettings getActions() { return actions; }
    public void setActions(ActionSettings actions) { this.actions = actions; }
}
