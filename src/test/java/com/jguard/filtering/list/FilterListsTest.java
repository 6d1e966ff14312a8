package com.jguard.filtering.list;

import com.jguard.filtering.Event;
import com.jguard.filtering.FilterContext;
import com.jguard.filtering.action.ActionKind;
import com.jguard.filtering.action.ActionSettings;
import com.jguard.platform.Actor;
import com.jguard.platform.ChannelRef;
import com.jguard.platform.RichContent;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FilterListsTest {

    private static FilterContext context(String content, List<RichContent> embeds) {
        return new FilterContext(Event.MESSAGE, new Actor("1", "user"), new ChannelRef("2", "general", "3"),
                content, null, embeds);
    }

    private static FilterDefinition filter(long id, String content) {
        return new FilterDefinition(id, content);
    }

    @Test
    void tokenListReportsTheMatchedText() {
        TokenFilterList list = new TokenFilterList();
        list.addFilters(new FilterListDefinition("token", List.of(filter(1, "free\\s+nitro"), filter(2, "scam"))));

        List<FilterHit> hits = list.triggersFor(context("get FREE  Nitro here", List.of())).block();

        assertNotNull(hits);
        assertEquals(1, hits.size());
        assertEquals(1, hits.get(0).filter().id());
        assertEquals("FREE  Nitro", hits.get(0).match());
    }

    @Test
    void matchingDoesNotTouchTheContext() {
        TokenFilterList list = new TokenFilterList();
        list.addFilters(new FilterListDefinition("token", List.of(filter(1, "bad"))));
        FilterContext ctx = context("bad words", List.of());

        list.triggersFor(ctx).block();

        assertTrue(ctx.getMatches().isEmpty());
        assertTrue(ctx.getActionDescriptions().isEmpty());
    }

    @Test
    void domainListMatchesSubdomainsAndEmbedLinks() {
        DomainFilterList list = new DomainFilterList();
        list.addFilters(new FilterListDefinition("domain", List.of(filter(7, "grabify.link"))));

        List<FilterHit> inText = list.triggersFor(
                context("look https://www.grabify.link/abc", List.of())).block();
        List<FilterHit> inEmbed = list.triggersFor(context("look at this",
                List.of(new RichContent("t", null, null, "https://grabify.link:443/x", null)))).block();
        List<FilterHit> lookalike = list.triggersFor(
                context("https://notgrabify.link/abc", List.of())).block();

        assertEquals("https://www.grabify.link/abc", inText.get(0).match());
        assertEquals(1, inEmbed.size());
        assertTrue(lookalike.isEmpty());
    }

    @Test
    void filtersWithoutActionsInheritTheListDefaults() {
        ActionSettings defaults = new ActionSettings();
        defaults.setInfractionType("warning");
        FilterDefinition own = filter(2, "b");
        ActionSettings ownActions = new ActionSettings();
        ownActions.setSendAlert(false);
        own.setActions(ownActions);
        FilterListDefinition definition = new FilterListDefinition("token", List.of(filter(1, "a"), own));
        definition.setDefaults(defaults);

        TokenFilterList list = new TokenFilterList();
        list.addFilters(definition);

        List<Filter> filters = list.filters();
        assertTrue(filters.get(0).actions().get(ActionKind.INFRACTION_AND_NOTIFICATION).isPresent());
        assertEquals(Set.of(ActionKind.SEND_ALERT), filters.get(1).actions().kinds());
    }

    @Test
    void invalidFilterContentIsAConfigurationError() {
        TokenFilterList tokens = new TokenFilterList();
        DomainFilterList domains = new DomainFilterList();

        FilterListConfigurationException e = assertThrows(FilterListConfigurationException.class,
                () -> tokens.addFilters(new FilterListDefinition("token", List.of(filter(9, "(unclosed")))));
        assertEquals("token", e.getListName());
        assertThrows(FilterListConfigurationException.class,
                () -> domains.addFilters(new FilterListDefinition("domain", List.of(filter(1, "a.com/path")))));
        assertTrue(tokens.filters().isEmpty());
    }

    @Test
    void invalidListDefaultsAreAConfigurationError() {
        ActionSettings defaults = new ActionSettings();
        defaults.setInfractionType("yeet");
        FilterListDefinition definition = new FilterListDefinition("token", List.of(filter(1, "spam")));
        definition.setDefaults(defaults);
        TokenFilterList tokens = new TokenFilterList();

        FilterListConfigurationException e = assertThrows(FilterListConfigurationException.class,
                () -> tokens.addFilters(definition));
        assertEquals("token", e.getListName());
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
        assertTrue(tokens.filters().isEmpty());
    }
}
