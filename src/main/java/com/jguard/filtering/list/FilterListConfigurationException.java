package com.jguard.filtering.list;

public class FilterListConfigurationException extends RuntimeException {

    private final String listName;

    public FilterListConfigurationException(String listName, String message, Throwable cause) {
        super("Invalid filter list " + listName + ": " + message, cause);
        this.listName = listName;
    }

    public String getListName() { return listName; }
}
