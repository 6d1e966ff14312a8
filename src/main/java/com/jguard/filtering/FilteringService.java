package com.jguard.filtering;

import com.jguard.audit.AuditService;
import com.jguard.channel.InboundMessage;
import com.jguard.config.JguardProperties;
import com.jguard.filtering.action.ActionEnvironment;
import com.jguard.filtering.action.ActionSet;
import com.jguard.filtering.alert.FilterAlert;
import com.jguard.filtering.alert.FilterAlertComposer;
import com.jguard.filtering.list.FilterHit;
import com.jguard.filtering.list.FilterList;
import com.jguard.filtering.list.FilterListRegistry;
import com.jguard.observability.JguardMetrics;
import com.jguard.platform.ChannelRef;
import com.jguard.platform.ModerationPlatform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.List;
import java.util.function.Supplier;

/**
 * Runs events through the subscribed filter lists, applies the merged
 * actions of every triggered filter and alerts moderators.
 *
 * <p>Each dispatch owns its {@link FilterContext}. Failures of one filter
 * list, one action or the alert are logged and do not undo or block the
 * rest of the dispatch.
 */
@Service
public class FilteringService {

    private static final Logger log = LoggerFactory.getLogger(FilteringService.class);

    private final FilterListRegistry registry;
    private final ModerationPlatform platform;
    private final FilterAlertComposer alertComposer;
    private final AuditService auditService;
    private final JguardMetrics metrics;
    private final JguardProperties properties;
    private final Clock clock;

    private volatile ChannelRef alertChannel;
    private volatile ChannelRef modAlertsChannel;

    public FilteringService(FilterListRegistry registry,
                            ModerationPlatform platform,
                            FilterAlertComposer alertComposer,
                            AuditService auditService,
                            JguardMetrics metrics,
                            JguardProperties properties,
                            Clock clock) {
        this.registry = registry;
        this.platform = platform;
        this.alertComposer = alertComposer;
        this.auditService = auditService;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Resolves the alert and mod-alerts channels. A channel that cannot be
     * resolved is logged and left unset; filtering keeps working without it.
     */
    public Mono<Void> resolveChannels() {
        JguardProperties.FilteringProperties filtering = properties.getFiltering();
        Mono<Void> alerts = resolve(filtering.getAlertChannelId(), "alert")
                .doOnNext(channel -> this.alertChannel = channel)
                .then();
        Mono<Void> modAlerts = resolve(filtering.getModAlertsChannelId(), "mod alerts")
                .doOnNext(channel -> this.modAlertsChannel = channel)
                .then();
        return alerts.then(modAlerts);
    }

    private Mono<ChannelRef> resolve(String channelId, String purpose) {
        if (channelId == null || channelId.isBlank()) {
            log.warn("No {} channel configured", purpose);
            return Mono.empty();
        }
        return platform.fetchChannel(channelId)
                .switchIfEmpty(Mono.fromRunnable(() ->
                        log.error("Failed to find {} channel with id {}", purpose, channelId)))
                .onErrorResume(e -> {
                    log.error("Failed to fetch {} channel with id {}", purpose, channelId, e);
                    return Mono.empty();
                });
    }

    public Mono<Void> dispatch(InboundMessage message) {
        if (message.author().bot()) {
            return Mono.empty();
        }
        return dispatch(FilterContext.of(message));
    }

    public Mono<Void> dispatch(FilterContext context) {
        metrics.recordMessageEvaluated(context.event().name());
        List<FilterList> subscribers = registry.subscribers(context.event());

        return Flux.fromIterable(subscribers)
                .concatMap(list -> Mono.defer(() -> list.triggersFor(context))
                        .map(hits -> new TriggeredFilters(list.name(), hits))
                        .onErrorResume(e -> {
                            log.error("Filter list {} failed to evaluate {} from author={}",
                                    list.name(), context.event(), context.author().id(), e);
                            metrics.recordFilterListError(list.name());
                            return Mono.empty();
                        }))
                .filter(result -> !result.hits().isEmpty())
                .collectList()
                .flatMap(triggered -> triggered.isEmpty()
                        ? Mono.<Void>empty()
                        : handleTriggered(context, triggered));
    }

    private Mono<Void> handleTriggered(FilterContext context, List<TriggeredFilters> triggered) {
        return withMdc(context, () -> {
                    List<FilterHit> hits = triggered.stream().flatMap(t -> t.hits().stream()).toList();
                    context.addMatches(hits.stream().map(FilterHit::match).toList());
                    triggered.forEach(t -> metrics.recordFilterTriggered(t.listName()));
                    log.info("{} filters triggered on {} from author={}", hits.size(), context.event(),
                            context.author().id());

                    ActionSet actions = ActionSet.unionAll(hits.stream().map(hit -> hit.filter().actions()).toList());
                    ActionEnvironment environment = new ActionEnvironment(platform, clock, modAlertsChannel, metrics);
                    return actions.apply(context, environment);
                })
                .then(Mono.defer(() -> audit(context, triggered)))
                .then(withMdc(context, () -> context.isSendAlert()
                        ? sendAlert(context, triggered)
                        : Mono.<Void>empty()));
    }

    /**
     * Runs a dispatch step with the event, author and channel in the MDC of
     * the thread that subscribes to it. The keys are removed when the step terminates.
     */
    private static Mono<Void> withMdc(FilterContext context, Supplier<Mono<Void>> step) {
        return Mono.defer(() -> {
                    putMdc(context);
                    return step.get();
                })
                .doFinally(signal -> clearMdc());
    }

    private static void putMdc(FilterContext context) {
        MDC.put("event", context.event().name());
        MDC.put("authorId", context.author().id());
        MDC.put("channelId", context.channel().id());
    }

    private static void clearMdc() {
        MDC.remove("event");
        MDC.remove("authorId");
        MDC.remove("channelId");
    }

    private Mono<Void> audit(FilterContext context, List<TriggeredFilters> triggered) {
        List<String> filters = triggered.stream()
                .flatMap(t -> t.filters().stream().map(f -> t.listName() + "#" + f.id()))
                .toList();
        return Mono.fromRunnable(() -> {
                    putMdc(context);
                    try {
                        auditService.logFilterTriggered(context.event().name(), context.author().id(),
                                context.channel().id(), filters, context.getActionDescriptions());
                    } finally {
                        clearMdc();
                    }
                })
                .subscribeOn(Schedulers.boundedElastic())
                .then()
                .onErrorResume(e -> {
                    log.error("Failed to audit filter trigger for author={}", context.author().id(), e);
                    return Mono.empty();
                });
    }

    private Mono<Void> sendAlert(FilterContext context, List<TriggeredFilters> triggered) {
        ChannelRef channel = alertChannel;
        if (channel == null) {
            log.warn("Alert channel unavailable, skipping alert for author={}", context.author().id());
            metrics.recordAlert("skipped");
            return Mono.empty();
        }
        FilterAlert alert = alertComposer.compose(context, triggered);
        return platform.sendAlert(channel, alert.title(), alert.content(), alert.embeds())
                .doOnSuccess(v -> metrics.recordAlert("sent"))
                .onErrorResume(e -> {
                    log.error("Failed to send filter alert to channel={}", channel.id(), e);
                    metrics.recordAlert("failed");
                    return Mono.fromRunnable(() -> auditService.logAlertFailed(context.author().id(),
                                    context.channel().id(), e.getMessage()))
                            .subscribeOn(Schedulers.boundedElastic())
                            .then()
                            .onErrorResume(auditError -> {
                                log.error("Failed to audit alert failure", auditError);
                                return Mono.empty();
                            });
                });
    }

    public ChannelRef getAlertChannel() { return alertChannel; }

    public ChannelRef getModAlertsChannel() { return modAlertsChannel; }
}
