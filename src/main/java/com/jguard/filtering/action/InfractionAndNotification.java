package com.jguard.filtering.action;

import com.jguard.filtering.FilterContext;
import com.jguard.platform.ChannelRef;
import com.jguard.platform.DeliveryResult;
import com.jguard.platform.InfractionRequest;
import com.jguard.platform.RichContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;

/**
 * The infraction to issue and the notification to DM the author.
 *
 * <p>The two are grouped because a DM can no longer be delivered once the
 * author is banned or kicked: the notification always goes out first.
 *
 * <p>A null {@code infractionDuration} means the infraction is permanent.
 * {@code superstar} is an optional forced rename applied in addition to the
 * primary infraction.
 */
public record InfractionAndNotification(
        Infraction infractionType,
        String infractionReason,
        Duration infractionDuration,
        String dmContent,
        String dmEmbed,
        Superstar superstar
) implements ActionEntry {

    private static final Logger log = LoggerFactory.getLogger(InfractionAndNotification.class);

    static final String BULLET = "•";
    static final int DEFAULT_DM_COLOUR = 0x5865F2;

    public InfractionAndNotification {
        infractionType = infractionType != null ? infractionType : Infraction.NONE;
        infractionReason = infractionReason != null ? infractionReason : "";
        dmContent = dmContent != null ? dmContent : "";
        dmEmbed = dmEmbed != null ? dmEmbed : "";
    }

    public static InfractionAndNotification infraction(Infraction type, String reason, Duration duration) {
        return new InfractionAndNotification(type, reason, duration, "", "", null);
    }

    public static InfractionAndNotification notification(String dmContent, String dmEmbed) {
        return new InfractionAndNotification(Infraction.NONE, "", null, dmContent, dmEmbed, null);
    }

    public InfractionAndNotification withSuperstar(Superstar superstar) {
        return new InfractionAndNotification(infractionType, infractionReason, infractionDuration,
                dmContent, dmEmbed, superstar);
    }

    /**
     * True when applying this entry would do nothing at all.
     */
    public boolean isEmpty() {
        return infractionType.isNone() && dmContent.isEmpty() && dmEmbed.isEmpty() && superstar == null;
    }

    @Override
    public ActionKind kind() { return ActionKind.INFRACTION_AND_NOTIFICATION; }

    @Override
    public InfractionAndNotification combine(ActionEntry other) {
        InfractionAndNotification that = ActionEntry.requireSameKind(this, other, InfractionAndNotification.class);

        if (infractionType.isNone() && that.infractionType.isNone()) {
            return mergeSecondaryFields(this, that, Infraction.NONE, "", null);
        }
        if (infractionType.isNone()) {
            return isEmpty() ? that : mergeSecondaryFields(this, that,
                    that.infractionType, that.infractionReason, that.infractionDuration);
        }
        if (that.infractionType.isNone()) {
            return that.isEmpty() ? this : mergeSecondaryFields(this, that,
                    infractionType, infractionReason, infractionDuration);
        }

        boolean oneSideSuperstar = infractionType != that.infractionType
                && (infractionType == Infraction.SUPERSTAR || that.infractionType == Infraction.SUPERSTAR);
        if (oneSideSuperstar) {
            return foldSuperstar(that);
        }

        Infraction type;
        Duration duration;
        if (infractionType != that.infractionType) {
            InfractionAndNotification higher = infractionType.isMoreSevereThan(that.infractionType) ? this : that;
            type = higher.infractionType;
            duration = higher.infractionDuration;
        } else {
            type = infractionType;
            duration = mergeDurations(infractionDuration, that.infractionDuration);
        }
        return new InfractionAndNotification(
                type,
                mergeMessages(infractionReason, that.infractionReason),
                duration,
                mergeMessages(dmContent, that.dmContent),
                mergeMessages(dmEmbed, that.dmEmbed),
                Superstar.merge(superstar, that.superstar));
    }

    /**
     * Exactly one side is a SUPERSTAR infraction: the other side stays primary
     * and the superstar's own reason and duration become the embedded rename.
     */
    private InfractionAndNotification foldSuperstar(InfractionAndNotification that) {
        InfractionAndNotification star = infractionType == Infraction.SUPERSTAR ? this : that;
        InfractionAndNotification primary = star == this ? that : this;

        Superstar promoted = new Superstar(star.infractionReason, star.infractionDuration);
        Superstar embedded = star == this
                ? Superstar.merge(Superstar.merge(promoted, star.superstar), primary.superstar)
                : Superstar.merge(primary.superstar, Superstar.merge(promoted, star.superstar));

        return new InfractionAndNotification(
                primary.infractionType,
                primary.infractionReason,
                primary.infractionDuration,
                mergeMessages(dmContent, that.dmContent),
                mergeMessages(dmEmbed, that.dmEmbed),
                embedded);
    }

    private static InfractionAndNotification mergeSecondaryFields(InfractionAndNotification first,
                                                                  InfractionAndNotification second,
                                                                  Infraction type, String reason,
                                                                  Duration duration) {
        return new InfractionAndNotification(
                type, reason, duration,
                mergeMessages(first.dmContent, second.dmContent),
                mergeMessages(first.dmEmbed, second.dmEmbed),
                Superstar.merge(first.superstar, second.superstar));
    }

    /**
     * Combines two messages into bullet points of a single message.
     */
    public static String mergeMessages(String message1, String message2) {
        boolean firstEmpty = message1 == null || message1.isEmpty();
        boolean secondEmpty = message2 == null || message2.isEmpty();
        if (firstEmpty && secondEmpty) return "";
        if (firstEmpty || message1.equals(message2)) return message2;
        if (secondEmpty) return message1;

        String first = message1.startsWith(BULLET) ? message1 : BULLET + " " + message1;
        String second = message2.startsWith(BULLET) ? message2 : BULLET + " " + message2;
        return first + "\n\n" + second;
    }

    /**
     * Returns the longer of two durations, where null (permanent) beats any finite duration.
     */
    public static Duration mergeDurations(Duration duration1, Duration duration2) {
        if (duration1 == null || duration2 == null) return null;
        return duration1.compareTo(duration2) >= 0 ? duration1 : duration2;
    }

    @Override
    public Mono<Void> apply(FilterContext context, ActionEnvironment environment) {
        return Mono.defer(() -> notifyAuthor(context, environment))
                .then(Mono.defer(() -> superstarify(context, environment)))
                .then(Mono.defer(() -> issueInfraction(context, environment)));
    }

    private Mono<Void> notifyAuthor(FilterContext context, ActionEnvironment environment) {
        String content = mergeMessages(context.getDmContent(), dmContent);
        String embedText = mergeMessages(context.getDmEmbed().descriptionOrEmpty(), dmEmbed);
        if (content.isEmpty() && embedText.isEmpty()) {
            return Mono.empty();
        }

        RichContent embed = context.getDmEmbed().withDescription(embedText);
        if (embed.colour() == null) {
            embed = embed.withColour(DEFAULT_DM_COLOUR);
        }
        context.setDmContent(content);
        context.setDmEmbed(embed);

        String greeting = "Hey " + context.author().mention() + "!\n" + content;
        RichContent payload = embed;
        return environment.platform().sendDirectMessage(context.author(), greeting, payload)
                .flatMap(result -> {
                    if (result == DeliveryResult.FORBIDDEN) {
                        log.info("DMs closed for author={}, notifying in channel={}",
                                context.author().id(), context.channel().id());
                        return environment.platform().sendToChannel(context.channel(), greeting, payload)
                                .thenReturn(result);
                    }
                    return Mono.just(result);
                })
                .doOnSuccess(result -> context.addActionDescription("notified"))
                .then()
                .onErrorResume(e -> failed("notify", context, environment, e));
    }

    private Mono<Void> superstarify(FilterContext context, ActionEnvironment environment) {
        if (superstar == null) {
            return Mono.empty();
        }
        Instant expiresAt = expiry(superstar.duration(), environment);
        return environment.platform()
                .forceRename(context.author(), expiresAt, superstar.reason(), context.channel())
                .doOnSuccess(v -> context.addActionDescription("superstarred"))
                .onErrorResume(e -> failed("superstar", context, environment, e));
    }

    private Mono<Void> issueInfraction(FilterContext context, ActionEnvironment environment) {
        if (infractionType.isNone()) {
            return Mono.empty();
        }
        ChannelRef target = context.channel();
        if (infractionType == Infraction.BAN || !context.channel().inGuild()) {
            if (environment.modAlertsChannel() != null) {
                target = environment.modAlertsChannel();
            } else {
                log.warn("Mod alerts channel unavailable, issuing {} in channel={}",
                        infractionType, context.channel().id());
            }
        }
        InfractionRequest request = new InfractionRequest(context.author(), infractionType,
                expiry(infractionDuration, environment), infractionReason, target);
        return environment.platform().issueInfraction(request)
                .doOnSuccess(v -> context.addActionDescription(infractionType.actionLabel()))
                .onErrorResume(e -> failed(infractionType.actionLabel(), context, environment, e));
    }

    private static Instant expiry(Duration duration, ActionEnvironment environment) {
        return duration == null ? null : environment.clock().instant().plus(duration);
    }

    private static Mono<Void> failed(String step, FilterContext context, ActionEnvironment environment,
                                     Throwable e) {
        log.error("Failed to {} author={} in channel={}", step, context.author().id(),
                context.channel().id(), e);
        if (environment.metrics() != null) {
            environment.metrics().recordActionFailed(step);
        }
        return Mono.empty();
    }
}
