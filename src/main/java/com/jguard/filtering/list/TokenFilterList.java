package com.jguard.filtering.list;

import com.jguard.filtering.Event;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Filters whose content is a regular expression searched for in the message text.
 */
public class TokenFilterList extends FilterList {

    public static final String NAME = "token";

    public TokenFilterList() {
        super(NAME);
    }

    @Override
    public Set<Event> events() {
        return EnumSet.of(Event.MESSAGE, Event.MESSAGE_EDIT);
    }

    @Override
    protected FilterMatcher compile(FilterDefinition definition) {
        Pattern pattern = Pattern.compile(definition.getContent(), Pattern.CASE_INSENSITIVE);
        return context -> {
            Matcher matcher = pattern.matcher(context.content());
            return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
        };
    }
}
