package com.jguard.filtering;

import com.jguard.channel.InboundMessage;
import com.jguard.platform.Actor;
import com.jguard.platform.ChannelRef;
import com.jguard.platform.MessageRef;
import com.jguard.platform.RichContent;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FilterContextTest {

    private final InboundMessage message = new InboundMessage(Event.MESSAGE, new Actor("1", "user"),
            new ChannelRef("2", "general", "3"), "original", new MessageRef("4", "https://jump"));

    @Test
    void newContextHasDefaultOutputs() {
        FilterContext ctx = FilterContext.of(message);

        assertEquals("original", ctx.content());
        assertEquals("", ctx.getDmContent());
        assertTrue(ctx.getDmEmbed().isEmpty());
        assertTrue(ctx.isSendAlert());
        assertEquals("", ctx.getAlertContent());
        assertTrue(ctx.getActionDescriptions().isEmpty());
        assertTrue(ctx.getMatches().isEmpty());
    }

    @Test
    void copyReplacesOnlyTheOverriddenField() {
        FilterContext ctx = FilterContext.of(message);
        ctx.setDmContent("hi");
        ctx.addMatches(List.of("m"));

        FilterContext copy = ctx.withContent("edited");

        assertEquals("edited", copy.content());
        assertEquals("original", ctx.content());
        assertSame(ctx.author(), copy.author());
        assertEquals(ctx.channel(), copy.channel());
        assertEquals(ctx.message(), copy.message());
        assertEquals("hi", copy.getDmContent());
        assertEquals(List.of("m"), copy.getMatches());
    }

    @Test
    void copyDoesNotShareAccumulators() {
        FilterContext ctx = FilterContext.of(message);

        FilterContext copy = ctx.withEvent(Event.MESSAGE_EDIT);
        copy.addActionDescription("notified");
        copy.setSendAlert(false);

        assertEquals(Event.MESSAGE_EDIT, copy.event());
        assertTrue(ctx.getActionDescriptions().isEmpty());
        assertTrue(ctx.isSendAlert());
    }

    @Test
    void embedsCanBeReplacedWithoutTouchingTheOriginal() {
        FilterContext ctx = FilterContext.of(message);
        ctx.addAlertEmbed(RichContent.ofDescription("alert"));

        FilterContext copy = ctx.withEmbeds(List.of(RichContent.ofDescription("embed")));

        assertEquals(List.of(RichContent.ofDescription("embed")), copy.embeds());
        assertTrue(ctx.embeds().isEmpty());
        assertEquals("original", copy.content());
        assertEquals(ctx.getAlertEmbeds(), copy.getAlertEmbeds());
    }

    @Test
    void eventTitlesAreHumanReadable() {
        assertEquals("Message", Event.MESSAGE.title());
        assertEquals("Message Edit", Event.MESSAGE_EDIT.title());
    }
}
