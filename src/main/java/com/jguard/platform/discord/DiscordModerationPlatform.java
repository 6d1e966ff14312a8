package com.jguard.platform.discord;

import com.jguard.channel.discord.DiscordGatewayAdapter;
import com.jguard.config.JguardProperties;
import com.jguard.filtering.action.Infraction;
import com.jguard.platform.Actor;
import com.jguard.platform.ChannelRef;
import com.jguard.platform.DeliveryResult;
import com.jguard.platform.InfractionRequest;
import com.jguard.platform.ModerationPlatform;
import com.jguard.platform.RichContent;
import net.dv8tion.jda.api.EmbedBuilder;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.MessageEmbed;
import net.dv8tion.jda.api.entities.Role;
import net.dv8tion.jda.api.entities.User;
import net.dv8tion.jda.api.entities.UserSnowflake;
import net.dv8tion.jda.api.entities.channel.middleman.GuildChannel;
import net.dv8tion.jda.api.entities.channel.middleman.MessageChannel;
import net.dv8tion.jda.api.exceptions.ErrorResponseException;
import net.dv8tion.jda.api.requests.ErrorResponse;
import net.dv8tion.jda.api.utils.messages.MessageCreateBuilder;
import net.dv8tion.jda.api.utils.messages.MessageCreateData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * {@link ModerationPlatform} backed by the JDA connection of {@link DiscordGatewayAdapter}.
 *
 * <p>Bans, kicks, mutes, voice bans and superstar renames are enforced through
 * the guild. Warnings, watches and notes have no Discord-side effect: the
 * confirmation message posted for every infraction is their only record.
 *
 * <p>Temporary bans, voice bans and renames are stored as {@link InfractionExpiry}
 * rows and lifted by {@link InfractionExpiryScheduler}. Mutes use Discord's own
 * timeout expiry.
 */
@Component
public class DiscordModerationPlatform implements ModerationPlatform {

    private static final Logger log = LoggerFactory.getLogger(DiscordModerationPlatform.class);

    static final int MAX_MESSAGE_LENGTH = 2000;
    static final int MAX_REASON_LENGTH = 512;
    static final int MAX_EMBEDS = 10;
    static final String EXPIRED_REASON = "Infraction expired";
    static final Duration MAX_TIMEOUT = Duration.ofDays(28);
    static final String FALLBACK_SUPERSTAR_NAME = "Superstar";
    static final Set<Infraction> EXPIRING = EnumSet.of(Infraction.BAN, Infraction.VOICE_BAN, Infraction.SUPERSTAR);

    private final DiscordGatewayAdapter gateway;
    private final JguardProperties properties;
    private final InfractionExpiryRepository expiryRepository;
    private final Clock clock;

    public DiscordModerationPlatform(DiscordGatewayAdapter gateway,
                                     JguardProperties properties,
                                     InfractionExpiryRepository expiryRepository,
                                     Clock clock) {
        this.gateway = gateway;
        this.properties = properties;
        this.expiryRepository = expiryRepository;
        this.clock = clock;
    }

    @Override
    public Mono<DeliveryResult> sendDirectMessage(Actor actor, String content, RichContent embed) {
        return Mono.defer(() -> {
            JDA jda = requireJda();
            MessageCreateData data = createData(content, embed != null ? List.of(embed) : List.of());
            return Mono.fromFuture(() -> jda.retrieveUserById(actor.id())
                    .flatMap(User::openPrivateChannel)
                    .flatMap(channel -> channel.sendMessage(data))
                    .submit());
        })
                .thenReturn(DeliveryResult.DELIVERED)
                .onErrorResume(ErrorResponseException.class, e ->
                        e.getErrorResponse() == ErrorResponse.CANNOT_SEND_TO_USER
                                ? Mono.just(DeliveryResult.FORBIDDEN)
                                : Mono.error(e));
    }

    @Override
    public Mono<Void> sendToChannel(ChannelRef channel, String content, RichContent embed) {
        return Mono.defer(() -> send(channel, createData(content, embed != null ? List.of(embed) : List.of())));
    }

    @Override
    public Mono<Void> issueInfraction(InfractionRequest request) {
        return Mono.defer(() -> {
            Guild guild = requireGuild();
            UserSnowflake user = UserSnowflake.fromId(request.target().id());
            String reason = truncate(request.reason(), MAX_REASON_LENGTH);

            Mono<Void> enforcement = switch (request.infraction()) {
                case BAN -> Mono.fromFuture(() -> guild.ban(user, 0, TimeUnit.SECONDS)
                        .reason(reason).submit()).then();
                case KICK -> Mono.fromFuture(() -> guild.kick(user).reason(reason).submit()).then();
                case MUTE -> Mono.fromFuture(() -> guild.timeoutUntil(user, timeoutEnd(request.expiresAt()))
                        .reason(reason).submit()).then();
                case VOICE_BAN -> voiceBan(guild, user, reason);
                case SUPERSTAR -> rename(guild, request.target(), reason).then();
                default -> Mono.empty();
            };
            return enforcement
                    .then(trackExpiry(guild, request.target(), request.infraction(), request.expiresAt()))
                    .then(confirm(request.invokedIn(), request.infraction().actionLabel(),
                            request.target(), request.expiresAt(), reason));
        });
    }

    @Override
    public Mono<Void> forceRename(Actor actor, Instant expiresAt, String reason, ChannelRef invokedIn) {
        return Mono.defer(() -> {
            Guild guild = requireGuild();
            String auditReason = truncate(reason, MAX_REASON_LENGTH);
            return rename(guild, actor, auditReason)
                    .flatMap(nickname -> trackExpiry(guild, actor, Infraction.SUPERSTAR, expiresAt)
                            .then(confirm(invokedIn, "superstar", actor, expiresAt,
                                    "renamed to " + nickname + (auditReason.isEmpty() ? "" : " - " + auditReason))));
        });
    }

    /**
     * Reverts the Discord-side effect of an expired infraction.
     */
    public Mono<Void> liftInfraction(InfractionExpiry expiry) {
        return Mono.defer(() -> {
            JDA jda = requireJda();
            Guild guild = jda.getGuildById(expiry.getGuildId());
            if (guild == null) {
                return Mono.error(new IllegalStateException("Guild " + expiry.getGuildId() + " is not available"));
            }
            UserSnowflake user = UserSnowflake.fromId(expiry.getUserId());
            return switch (expiry.getInfraction()) {
                case BAN -> Mono.fromFuture(() -> guild.unban(user).reason(EXPIRED_REASON).submit()).then();
                case VOICE_BAN -> Mono.fromFuture(() -> guild.addRoleToMember(user, requireVoiceRole(guild))
                        .reason(EXPIRED_REASON).submit()).then();
                case SUPERSTAR -> Mono.fromFuture(() -> guild.retrieveMember(user)
                        .flatMap(member -> guild.modifyNickname(member, null).reason(EXPIRED_REASON))
                        .submit()).then();
                default -> Mono.empty();
            };
        }).doOnSuccess(v -> log.info("Lifted expired {} for user={}", expiry.getInfraction().actionLabel(),
                expiry.getUserId()));
    }

    private Mono<String> rename(Guild guild, Actor actor, String reason) {
        String nickname = superstarName(actor);
        return Mono.fromFuture(() -> guild.retrieveMember(UserSnowflake.fromId(actor.id()))
                        .flatMap(member -> guild.modifyNickname(member, nickname).reason(reason))
                        .submit())
                .thenReturn(nickname);
    }

    /**
     * Removes the voice role. Without a configured role a voice ban is only recorded.
     */
    private Mono<Void> voiceBan(Guild guild, UserSnowflake user, String reason) {
        if (voiceRoleId() == null) {
            log.warn("No voice role configured, voice ban of user={} is record-only", user.getId());
            return Mono.empty();
        }
        return Mono.fromFuture(() -> guild.removeRoleFromMember(user, requireVoiceRole(guild))
                .reason(reason).submit()).then();
    }

    /**
     * Replaces any pending expiry of the same infraction for the target, so a
     * permanent infraction is never lifted by an earlier temporary one.
     */
    private Mono<Void> trackExpiry(Guild guild, Actor target, Infraction infraction, Instant expiresAt) {
        if (!EXPIRING.contains(infraction)) {
            return Mono.empty();
        }
        if (infraction == Infraction.VOICE_BAN && voiceRoleId() == null) {
            return Mono.empty();
        }
        return Mono.fromRunnable(() -> {
                    List<InfractionExpiry> pending = expiryRepository.findByStatusAndUserIdAndInfraction(
                            InfractionExpiry.ExpiryStatus.ACTIVE, target.id(), infraction);
                    pending.forEach(expiry -> expiry.setStatus(InfractionExpiry.ExpiryStatus.SUPERSEDED));
                    expiryRepository.saveAll(pending);
                    if (expiresAt != null) {
                        expiryRepository.save(new InfractionExpiry(guild.getId(), target.id(), infraction, expiresAt));
                        log.debug("Scheduled expiry of {} for user={} at {}", infraction.actionLabel(),
                                target.id(), expiresAt);
                    }
                })
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    @Override
    public Mono<Void> sendAlert(ChannelRef alertChannel, String title, String content, List<RichContent> embeds) {
        List<RichContent> titled = embeds.isEmpty() ? embeds : withTitle(embeds, title);
        return Mono.defer(() -> send(alertChannel, createData(content, titled)));
    }

    @Override
    public Mono<ChannelRef> fetchChannel(String channelId) {
        return Mono.fromCallable(() -> {
                    JDA jda = requireJda();
                    jda.awaitReady();
                    GuildChannel channel = jda.getGuildChannelById(channelId);
                    if (channel == null) return null;
                    return new ChannelRef(channel.getId(), channel.getName(), channel.getGuild().getId());
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public boolean isConnected() {
        return gateway.isConnected();
    }

    private Mono<Void> confirm(ChannelRef channel, String label, Actor target, Instant expiresAt, String reason) {
        String until = expiresAt == null ? "permanently" : "until <t:" + expiresAt.getEpochSecond() + ":f>";
        String text = ":incoming_envelope: applied **" + label + "** to " + target.mention() + " " + until
                + (reason == null || reason.isEmpty() ? "" : ": " + reason);
        return send(channel, createData(text, List.of()));
    }

    private Mono<Void> send(ChannelRef ref, MessageCreateData data) {
        return Mono.defer(() -> {
            JDA jda = requireJda();
            MessageChannel channel = ref.inGuild()
                    ? jda.getChannelById(MessageChannel.class, ref.id())
                    : jda.getPrivateChannelById(ref.id());
            if (channel == null) {
                return Mono.error(new IllegalStateException("Channel " + ref.id() + " is not available"));
            }
            return Mono.fromFuture(() -> channel.sendMessage(data).submit()).then();
        });
    }

    String superstarName(Actor actor) {
        List<String> names = properties.getDiscord().getSuperstarNames();
        if (names == null || names.isEmpty()) {
            return FALLBACK_SUPERSTAR_NAME;
        }
        return names.get(Math.floorMod(actor.id().hashCode(), names.size()));
    }

    private String voiceRoleId() {
        String roleId = properties.getDiscord().getVoiceVerifiedRoleId();
        return roleId == null || roleId.isBlank() ? null : roleId;
    }

    private Role requireVoiceRole(Guild guild) {
        String roleId = voiceRoleId();
        Role role = roleId != null ? guild.getRoleById(roleId) : null;
        if (role == null) {
            throw new IllegalStateException("Voice role " + roleId + " is not available");
        }
        return role;
    }

    private Instant timeoutEnd(Instant expiresAt) {
        Instant longest = clock.instant().plus(MAX_TIMEOUT);
        if (expiresAt == null || expiresAt.isAfter(longest)) {
            log.debug("Capping timeout at {}", MAX_TIMEOUT);
            return longest;
        }
        return expiresAt;
    }

    private JDA requireJda() {
        return gateway.jda().orElseThrow(() -> new IllegalStateException("Discord gateway is not connected"));
    }

    private Guild requireGuild() {
        String guildId = properties.getDiscord().getGuildId();
        Guild guild = guildId != null ? requireJda().getGuildById(guildId) : null;
        if (guild == null) {
            throw new IllegalStateException("Guild " + guildId + " is not available");
        }
        return guild;
    }

    private static List<RichContent> withTitle(List<RichContent> embeds, String title) {
        RichContent first = embeds.get(0);
        RichContent titledFirst = first.title() != null ? first
                : new RichContent(title, first.description(), first.colour(), first.url(), first.thumbnailUrl());
        List<RichContent> result = new ArrayList<>(embeds);
        result.set(0, titledFirst);
        return result;
    }

    static MessageCreateData createData(String content, List<RichContent> embeds) {
        MessageCreateBuilder builder = new MessageCreateBuilder();
        if (content != null && !content.isEmpty()) {
            builder.setContent(truncate(content, MAX_MESSAGE_LENGTH));
        }
        List<MessageEmbed> built = embeds.stream()
                .filter(embed -> embed != null && !embed.isEmpty())
                .limit(MAX_EMBEDS)
                .map(DiscordModerationPlatform::toEmbed)
                .toList();
        if (!built.isEmpty()) {
            builder.setEmbeds(built);
        }
        return builder.build();
    }

    static MessageEmbed toEmbed(RichContent content) {
        EmbedBuilder builder = new EmbedBuilder();
        if (content.title() != null) builder.setTitle(content.title(), content.url());
        if (content.description() != null) builder.setDescription(content.description());
        if (content.colour() != null) builder.setColor(content.colour());
        if (content.thumbnailUrl() != null) builder.setThumbnail(content.thumbnailUrl());
        return builder.build();
    }

    static String truncate(String text, int max) {
        if (text == null) return "";
        return text.length() <= max ? text : text.substring(0, max - 3) + "...";
    }
}
