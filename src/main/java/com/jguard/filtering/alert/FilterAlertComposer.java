package com.jguard.filtering.alert;

import com.jguard.config.JguardProperties;
import com.jguard.filtering.FilterContext;
import com.jguard.filtering.TriggeredFilters;
import com.jguard.filtering.list.Filter;
import com.jguard.platform.Actor;
import com.jguard.platform.ChannelRef;
import com.jguard.platform.RichContent;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds the moderator alert for a dispatch: who triggered which filters
 * where, what matched, and what was done about it.
 */
@Component
public class FilterAlertComposer {

    static final String TRUNCATION_MARKER = " [...]";

    private final int maxLength;
    private final int colour;

    @Autowired
    public FilterAlertComposer(JguardProperties properties) {
        this(properties.getFiltering().getAlertMaxLength(), properties.getFiltering().getAlertColour());
    }

    public FilterAlertComposer(int maxLength, int colour) {
        this.maxLength = maxLength;
        this.colour = colour;
    }

    public FilterAlert compose(FilterContext context, List<TriggeredFilters> triggered) {
        String title = context.event().title() + " Filter";

        String triggeredBy = "**Triggered by:** " + formatUser(context.author());
        String triggeredIn = context.channel().inGuild()
                ? "**Triggered in:** " + formatChannel(context.channel())
                : "**DM**";
        String filters = describeFilters(triggered);
        String matches = "**Matches:** " + context.getMatches().stream()
                .map(match -> "'" + match + "'")
                .collect(Collectors.joining(", "));
        List<String> actions = context.getActionDescriptions();
        String actionsTaken = "**Actions Taken:** " + (actions.isEmpty() ? "-" : String.join(", ", actions));
        String original = context.message() != null && context.message().jumpUrl() != null
                ? "**[Original Content](" + context.message().jumpUrl() + ")**: "
                : "**Original Content**: ";
        String content = original + escapeMarkdown(context.content());

        String body = Stream.of(triggeredBy, triggeredIn, filters, matches, actionsTaken, content)
                .filter(part -> !part.isEmpty())
                .collect(Collectors.joining("\n"));
        body = truncate(body, maxLength);

        RichContent embed = new RichContent(null, body, colour, null, context.author().avatarUrl());
        List<RichContent> embeds = new ArrayList<>();
        embeds.add(embed);
        embeds.addAll(context.getAlertEmbeds());
        return new FilterAlert(title, context.getAlertContent(), embeds);
    }

    /**
     * A single filter from a single list is described on one line with its
     * description; otherwise there is one line per list.
     */
    static String describeFilters(List<TriggeredFilters> triggered) {
        if (triggered.size() == 1 && triggered.get(0).hits().size() == 1) {
            TriggeredFilters only = triggered.get(0);
            Filter filter = only.filters().get(0);
            String line = "**" + titleCase(only.listName()) + " Filters:** " + formatFilter(filter);
            if (filter.description() != null && !filter.description().isEmpty()) {
                line += " - " + filter.description();
            }
            return line;
        }
        return triggered.stream()
                .map(list -> "**" + titleCase(list.listName()) + " Filters:** " + list.filters().stream()
                        .map(FilterAlertComposer::formatFilter)
                        .collect(Collectors.joining(", ")))
                .collect(Collectors.joining("\n"));
    }

    static String truncate(String body, int maxLength) {
        if (body.length() <= maxLength) return body;
        int end = Character.isHighSurrogate(body.charAt(maxLength - 1)) ? maxLength - 1 : maxLength;
        return body.substring(0, end) + TRUNCATION_MARKER;
    }

    static String escapeMarkdown(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean lineStart = true;
        for (char c : text.toCharArray()) {
            switch (c) {
                case '\\', '*', '_', '`', '~', '|' -> sb.append('\\').append(c);
                case '>' -> sb.append(lineStart ? "\\>" : ">");
                default -> sb.append(c);
            }
            lineStart = c == '\n';
        }
        return sb.toString();
    }

    private static String formatFilter(Filter filter) {
        return "#" + filter.id() + " (`" + filter.content() + "`)";
    }

    private static String formatUser(Actor actor) {
        return actor.mention() + " (`" + actor.id() + "`)";
    }

    private static String formatChannel(ChannelRef channel) {
        return channel.mention() + " (`" + channel.id() + "`)";
    }

    private static String titleCase(String name) {
        StringBuilder sb = new StringBuilder();
        for (String word : name.replace('_', ' ').split(" ")) {
            if (word.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }
}
