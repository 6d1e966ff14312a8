package com.jguard.channel;

import com.jguard.filtering.FilteringService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Feeds every event source into the filtering service. Each event is
 * dispatched independently; a failing dispatch never ends the stream.
 */
@Service
public class EventRouter {

    private static final Logger log = LoggerFactory.getLogger(EventRouter.class);

    private final List<FilterEventSource> sources;
    private final FilteringService filteringService;
    private final List<Disposable> subscriptions = new ArrayList<>();

    public EventRouter(List<FilterEventSource> sources, FilteringService filteringService) {
        this.sources = sources;
        this.filteringService = filteringService;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startRouting() {
        filteringService.resolveChannels()
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe(
                        v -> { },
                        error -> log.error("Failed to resolve alert channels", error));

        sources.forEach(source -> subscriptions.add(
            source.receiveMessages()
                .publishOn(Schedulers.boundedElastic())
                .flatMap(msg -> filteringService.dispatch(msg)
                    .onErrorResume(e -> {
                        log.error("Error filtering {} from source={} author={}",
                                msg.event(), source.sourceType(), msg.author().id(), e);
                        return Mono.empty();
                    }))
                .retryWhen(Retry.backoff(Long.MAX_VALUE, Duration.ofSeconds(5))
                        .maxBackoff(Duration.ofMinutes(1)))
                .subscribe(
                    result -> { },
                    error -> log.error("Fatal error in routing for source={}", source.sourceType(), error)
                )
        ));
        log.info("Event routing started for {} sources", sources.size());
    }

    @PreDestroy
    public void stopRouting() {
        subscriptions.forEach(Disposable::dispose);
        subscriptions.clear();
    }
}
