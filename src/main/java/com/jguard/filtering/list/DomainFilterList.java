package com.jguard.filtering.list;

import com.jguard.filtering.Event;
import com.jguard.platform.RichContent;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Filters whose content is a domain, matched against links in the message
 * text and in its embeds. Subdomains match their parent domain.
 */
public class DomainFilterList extends FilterList {

    public static final String NAME = "domain";

    private static final Pattern URL = Pattern.compile("(?i)https?://([^\\s/?#<>]+)[^\\s<>]*");

    public DomainFilterList() {
        super(NAME);
    }

    @Override
    public Set<Event> events() {
        return EnumSet.of(Event.MESSAGE);
    }

    @Override
    protected FilterMatcher compile(FilterDefinition definition) {
        String domain = definition.getContent().trim().toLowerCase(Locale.ROOT);
        if (domain.isEmpty() || domain.contains("/")) {
            throw new IllegalArgumentException("not a domain: " + definition.getContent());
        }
        return context -> {
            List<String> texts = new ArrayList<>();
            texts.add(context.content());
            for (RichContent embed : context.embeds()) {
                if (embed.url() != null) texts.add(embed.url());
            }
            for (String text : texts) {
                Matcher matcher = URL.matcher(text);
                while (matcher.find()) {
                    String host = matcher.group(1).toLowerCase(Locale.ROOT);
                    int port = host.indexOf(':');
                    if (port >= 0) host = host.substring(0, port);
                    if (host.equals(domain) || host.endsWith("." + domain)) {
                        return Optional.of(matcher.group());
                    }
                }
            }
            return Optional.empty();
        };
    }
}
