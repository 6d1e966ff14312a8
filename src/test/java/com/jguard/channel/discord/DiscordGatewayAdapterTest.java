package com.jguard.channel.discord;

import com.jguard.channel.InboundMessage;
import com.jguard.config.SecretsConfig;
import com.jguard.filtering.Event;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.Message;
import net.dv8tion.jda.api.entities.User;
import net.dv8tion.jda.api.entities.channel.unions.MessageChannelUnion;
import net.dv8tion.jda.api.events.message.MessageReceivedEvent;
import net.dv8tion.jda.api.events.message.MessageUpdateEvent;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DiscordGatewayAdapterTest {

    private final DiscordGatewayAdapter adapter = new DiscordGatewayAdapter(mock(SecretsConfig.class));

    private static User user(boolean bot) {
        User user = mock(User.class);
        when(user.getId()).thenReturn("42");
        when(user.getName()).thenReturn("someone");
        when(user.getAsMention()).thenReturn("<@42>");
        when(user.getEffectiveAvatarUrl()).thenReturn("https://cdn/avatar.png");
        when(user.isBot()).thenReturn(bot);
        return user;
    }

    private static Message message() {
        Message message = mock(Message.class);
        when(message.getId()).thenReturn("5");
        when(message.getContentRaw()).thenReturn("hello world");
        when(message.getJumpUrl()).thenReturn("https://discord.com/channels/1/100/5");
        when(message.getEmbeds()).thenReturn(List.of());
        return message;
    }

    private static MessageChannelUnion channel() {
        MessageChannelUnion channel = mock(MessageChannelUnion.class);
        when(channel.getId()).thenReturn("100");
        when(channel.getName()).thenReturn("general");
        return channel;
    }

    @Test
    void guildMessagesAreEmitted() {
        User author = user(false);
        Message message = message();
        MessageChannelUnion channel = channel();
        Guild guild = mock(Guild.class);
        when(guild.getId()).thenReturn("1");
        MessageReceivedEvent event = mock(MessageReceivedEvent.class);
        when(event.getAuthor()).thenReturn(author);
        when(event.getMessage()).thenReturn(message);
        when(event.getChannel()).thenReturn(channel);
        when(event.isFromGuild()).thenReturn(true);
        when(event.getGuild()).thenReturn(guild);

        StepVerifier.create(adapter.receiveMessages().take(1))
                .then(() -> adapter.onMessageReceived(event))
                .assertNext(msg -> {
                    assertEquals(Event.MESSAGE, msg.event());
                    assertEquals("42", msg.author().id());
                    assertEquals("<@42>", msg.author().mention());
                    assertEquals("1", msg.channel().guildId());
                    assertTrue(msg.channel().inGuild());
                    assertEquals("hello world", msg.content());
                    assertEquals("https://discord.com/channels/1/100/5", msg.message().jumpUrl());
                })
                .verifyComplete();
    }

    @Test
    void directMessageEditsAreEmittedWithoutAGuild() {
        User author = user(false);
        Message message = message();
        MessageChannelUnion channel = channel();
        MessageUpdateEvent event = mock(MessageUpdateEvent.class);
        when(event.getAuthor()).thenReturn(author);
        when(event.getMessage()).thenReturn(message);
        when(event.getChannel()).thenReturn(channel);
        when(event.isFromGuild()).thenReturn(false);

        StepVerifier.create(adapter.receiveMessages().take(1))
                .then(() -> adapter.onMessageUpdate(event))
                .assertNext(msg -> {
                    assertEquals(Event.MESSAGE_EDIT, msg.event());
                    assertFalse(msg.channel().inGuild());
                })
                .verifyComplete();
    }

    @Test
    void botMessagesAreNotEmitted() {
        User bot = user(true);
        MessageReceivedEvent event = mock(MessageReceivedEvent.class);
        when(event.getAuthor()).thenReturn(bot);

        StepVerifier.create(adapter.receiveMessages().take(1))
                .then(() -> adapter.onMessageReceived(event))
                .then(() -> adapter.onMessageReceived(guildlessEvent()))
                .assertNext(msg -> assertEquals("hello world", msg.content()))
                .verifyComplete();
    }

    private static MessageReceivedEvent guildlessEvent() {
        User author = user(false);
        Message message = message();
        MessageChannelUnion channel = channel();
        MessageReceivedEvent event = mock(MessageReceivedEvent.class);
        when(event.getAuthor()).thenReturn(author);
        when(event.getMessage()).thenReturn(message);
        when(event.getChannel()).thenReturn(channel);
        when(event.isFromGuild()).thenReturn(false);
        return event;
    }

    @Test
    void gatewayWithoutTokenStaysDisconnected() {
        adapter.init();

        assertTrue(adapter.jda().isEmpty());
        assertFalse(adapter.isConnected());
        assertEquals("discord", adapter.sourceType());
    }
}
