package com.jguard.filtering.action;

import com.jguard.filtering.Event;
import com.jguard.filtering.FilterContext;
import com.jguard.observability.JguardMetrics;
import com.jguard.platform.Actor;
import com.jguard.platform.ChannelRef;
import com.jguard.platform.DeliveryResult;
import com.jguard.platform.InfractionRequest;
import com.jguard.platform.MessageRef;
import com.jguard.platform.ModerationPlatform;
import com.jguard.platform.RichContent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class InfractionAndNotificationApplyTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final ChannelRef GUILD_CHANNEL = new ChannelRef("100", "general", "1");
    private static final ChannelRef MOD_ALERTS = new ChannelRef("200", "mod-alerts", "1");

    @Mock
    private ModerationPlatform platform;

    private final JguardMetrics metrics = new JguardMetrics(new SimpleMeterRegistry());
    private ActionEnvironment environment;
    private final Actor author = new Actor("42", "spammer");

    @BeforeEach
    void setUp() {
        environment = new ActionEnvironment(platform, Clock.fixed(NOW, ZoneOffset.UTC), MOD_ALERTS, metrics);
        when(platform.sendDirectMessage(any(), anyString(), any())).thenReturn(Mono.just(DeliveryResult.DELIVERED));
        when(platform.sendToChannel(any(), anyString(), any())).thenReturn(Mono.empty());
        when(platform.issueInfraction(any())).thenReturn(Mono.empty());
        when(platform.forceRename(any(), any(), anyString(), any())).thenReturn(Mono.empty());
    }

    private FilterContext context(ChannelRef channel) {
        return new FilterContext(Event.MESSAGE, author, channel, "some content",
                new MessageRef("1", "https://discord.com/channels/1/100/1"), List.of());
    }

    @Test
    void notifiesBeforeIssuingTheInfraction() {
        FilterContext ctx = context(GUILD_CHANNEL);
        InfractionAndNotification entry = new InfractionAndNotification(
                Infraction.WARNING, "rude", Duration.ofHours(1), "be nice", "", null);

        StepVerifier.create(entry.apply(ctx, environment)).verifyComplete();

        var order = inOrder(platform);
        order.verify(platform).sendDirectMessage(eq(author), eq("Hey <@42>!\nbe nice"), any());
        ArgumentCaptor<InfractionRequest> request = ArgumentCaptor.forClass(InfractionRequest.class);
        order.verify(platform).issueInfraction(request.capture());

        assertEquals(Infraction.WARNING, request.getValue().infraction());
        assertEquals(NOW.plus(Duration.ofHours(1)), request.getValue().expiresAt());
        assertEquals(GUILD_CHANNEL, request.getValue().invokedIn());
        assertEquals(List.of("notified", "warning"), ctx.getActionDescriptions());
        assertEquals("be nice", ctx.getDmContent());
    }

    @Test
    void forbiddenDirectMessageFallsBackToTheChannel() {
        when(platform.sendDirectMessage(any(), anyString(), any())).thenReturn(Mono.just(DeliveryResult.FORBIDDEN));
        FilterContext ctx = context(GUILD_CHANNEL);
        InfractionAndNotification entry = new InfractionAndNotification(
                Infraction.KICK, "raid", null, "you were kicked", "rule 3", null);

        StepVerifier.create(entry.apply(ctx, environment)).verifyComplete();

        ArgumentCaptor<RichContent> embed = ArgumentCaptor.forClass(RichContent.class);
        verify(platform).sendToChannel(eq(GUILD_CHANNEL), eq("Hey <@42>!\nyou were kicked"), embed.capture());
        assertEquals("rule 3", embed.getValue().description());
        assertEquals(InfractionAndNotification.DEFAULT_DM_COLOUR, embed.getValue().colour());
        assertEquals(List.of("notified", "kick"), ctx.getActionDescriptions());
    }

    @Test
    void dmIsMergedWithWhatTheContextAlreadyHolds() {
        FilterContext ctx = context(GUILD_CHANNEL);
        ctx.setDmContent("first");
        InfractionAndNotification entry = InfractionAndNotification.notification("second", "");

        StepVerifier.create(entry.apply(ctx, environment)).verifyComplete();

        verify(platform).sendDirectMessage(eq(author), eq("Hey <@42>!\n• first\n\n• second"), any());
        verify(platform, never()).issueInfraction(any());
        assertEquals(List.of("notified"), ctx.getActionDescriptions());
    }

    @Test
    void bansAreIssuedInTheModAlertsChannel() {
        FilterContext ctx = context(GUILD_CHANNEL);

        StepVerifier.create(InfractionAndNotification.infraction(Infraction.BAN, "raid", null)
                .apply(ctx, environment)).verifyComplete();

        ArgumentCaptor<InfractionRequest> request = ArgumentCaptor.forClass(InfractionRequest.class);
        verify(platform).issueInfraction(request.capture());
        assertEquals(MOD_ALERTS, request.getValue().invokedIn());
        assertTrue(request.getValue().permanent());
        verify(platform, never()).sendDirectMessage(any(), anyString(), any());
        assertEquals(List.of("ban"), ctx.getActionDescriptions());
    }

    @Test
    void infractionsFromDirectMessagesAreIssuedInTheModAlertsChannel() {
        FilterContext ctx = context(ChannelRef.direct("300"));

        StepVerifier.create(InfractionAndNotification.infraction(Infraction.WARNING, "", null)
                .apply(ctx, environment)).verifyComplete();

        ArgumentCaptor<InfractionRequest> request = ArgumentCaptor.forClass(InfractionRequest.class);
        verify(platform).issueInfraction(request.capture());
        assertEquals(MOD_ALERTS, request.getValue().invokedIn());
    }

    @Test
    void embeddedSuperstarRenamesBeforeTheInfraction() {
        FilterContext ctx = context(GUILD_CHANNEL);
        InfractionAndNotification entry = InfractionAndNotification.infraction(Infraction.WARNING, "rude", null)
                .withSuperstar(new Superstar("offensive name", Duration.ofMinutes(30)));

        StepVerifier.create(entry.apply(ctx, environment)).verifyComplete();

        var order = inOrder(platform);
        order.verify(platform).forceRename(author, NOW.plus(Duration.ofMinutes(30)), "offensive name", GUILD_CHANNEL);
        order.verify(platform).issueInfraction(any());
        assertEquals(List.of("superstarred", "warning"), ctx.getActionDescriptions());
    }

    @Test
    void failedNotificationDoesNotPreventTheInfraction() {
        when(platform.sendDirectMessage(any(), anyString(), any()))
                .thenReturn(Mono.error(new IllegalStateException("gateway down")));
        FilterContext ctx = context(GUILD_CHANNEL);
        InfractionAndNotification entry = new InfractionAndNotification(
                Infraction.MUTE, "spam", Duration.ofMinutes(10), "stop", "", null);

        StepVerifier.create(entry.apply(ctx, environment)).verifyComplete();

        verify(platform).issueInfraction(any());
        assertEquals(List.of("mute"), ctx.getActionDescriptions());
        assertEquals(1.0, metrics.getRegistry().get("jguard.actions.failed").tag("action", "notify")
                .counter().count());
    }
}
