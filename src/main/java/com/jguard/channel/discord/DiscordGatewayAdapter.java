package com.jguard.channel.discord;

import com.jguard.channel.FilterEventSource;
import com.jguard.channel.InboundMessage;
import com.jguard.config.SecretsConfig;
import com.jguard.filtering.Event;
import com.jguard.platform.Actor;
import com.jguard.platform.ChannelRef;
import com.jguard.platform.MessageRef;
import com.jguard.platform.RichContent;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.Message;
import net.dv8tion.jda.api.entities.MessageEmbed;
import net.dv8tion.jda.api.entities.User;
import net.dv8tion.jda.api.entities.channel.middleman.MessageChannel;
import net.dv8tion.jda.api.events.message.MessageReceivedEvent;
import net.dv8tion.jda.api.events.message.MessageUpdateEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import net.dv8tion.jda.api.requests.GatewayIntent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Discord gateway connection. Emits created and edited messages from
 * non-bot users and exposes the JDA instance to the moderation platform.
 */
@Component
public class DiscordGatewayAdapter extends ListenerAdapter implements FilterEventSource {

    private static final Logger log = LoggerFactory.getLogger(DiscordGatewayAdapter.class);

    private final SecretsConfig secretsConfig;
    private final Sinks.Many<InboundMessage> messageSink =
            Sinks.many().multicast().onBackpressureBuffer();
    private volatile JDA jda;

    public DiscordGatewayAdapter(SecretsConfig secretsConfig) {
        this.secretsConfig = secretsConfig;
    }

    @PostConstruct
    public void init() {
        try {
            String token = secretsConfig.getDiscordBotToken();
            if (token == null || token.isEmpty()) {
                log.warn("Discord bot token not configured, gateway disabled");
                return;
            }

            jda = JDABuilder.createDefault(token)
                    .enableIntents(GatewayIntent.MESSAGE_CONTENT, GatewayIntent.GUILD_MESSAGES,
                            GatewayIntent.DIRECT_MESSAGES, GatewayIntent.GUILD_MEMBERS)
                    .addEventListeners(this)
                    .build();
            log.info("Discord gateway initialized");
        } catch (Exception e) {
            log.error("Failed to initialize Discord gateway", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        if (jda != null) jda.shutdown();
    }

    @Override
    public void onMessageReceived(MessageReceivedEvent event) {
        if (event.getAuthor().isBot()) return;
        emit(Event.MESSAGE, event.getAuthor(), event.getMessage(), event.getChannel(),
                event.isFromGuild() ? event.getGuild() : null);
    }

    @Override
    public void onMessageUpdate(MessageUpdateEvent event) {
        if (event.getAuthor().isBot()) return;
        emit(Event.MESSAGE_EDIT, event.getAuthor(), event.getMessage(), event.getChannel(),
                event.isFromGuild() ? event.getGuild() : null);
    }

    private void emit(Event type, User author, Message message, MessageChannel channel, Guild guild) {
        InboundMessage msg = new InboundMessage(
                type,
                toActor(author),
                new ChannelRef(channel.getId(), channel.getName(), guild != null ? guild.getId() : null),
                message.getContentRaw(),
                new MessageRef(message.getId(), message.getJumpUrl()),
                toRichContent(message.getEmbeds()),
                Instant.now());
        Sinks.EmitResult result = messageSink.tryEmitNext(msg);
        if (result.isFailure()) {
            log.warn("Dropped {} from author={}: {}", type, author.getId(), result);
        }
    }

    static Actor toActor(User user) {
        return new Actor(user.getId(), user.getName(), user.getAsMention(),
                user.getEffectiveAvatarUrl(), user.isBot());
    }

    static List<RichContent> toRichContent(List<MessageEmbed> embeds) {
        return embeds.stream()
                .map(embed -> new RichContent(
                        embed.getTitle(),
                        embed.getDescription(),
                        embed.getColorRaw(),
                        embed.getUrl(),
                        embed.getThumbnail() != null ? embed.getThumbnail().getUrl() : null))
                .toList();
    }

    @Override
    public String sourceType() { return "discord"; }

    @Override
    public Flux<InboundMessage> receiveMessages() {
        return messageSink.asFlux();
    }

    public Optional<JDA> jda() {
        return Optional.ofNullable(jda);
    }

    @Override
    public boolean isConnected() {
        return jda != null && jda.getStatus() == JDA.Status.CONNECTED;
    }
}
