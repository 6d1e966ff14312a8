package com.jguard.observability;

import com.jguard.channel.FilterEventSource;
import com.jguard.filtering.FilteringService;
import com.jguard.filtering.list.FilterListRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class FilteringHealthIndicator implements HealthIndicator {

    private final List<FilterEventSource> sources;
    private final FilterListRegistry registry;
    private final FilteringService filteringService;

    public FilteringHealthIndicator(List<FilterEventSource> sources,
                                    FilterListRegistry registry,
                                    FilteringService filteringService) {
        this.sources = sources;
        this.registry = registry;
        this.filteringService = filteringService;
    }

    @Override
    public Health health() {
        if (sources.isEmpty()) {
            return Health.unknown().withDetail("reason", "No event sources registered").build();
        }

        Map<String, String> sourceStatus = new LinkedHashMap<>();
        boolean anyDown = false;
        for (FilterEventSource source : sources) {
            boolean connected = source.isConnected();
            sourceStatus.put(source.sourceType(), connected ? "connected" : "disconnected");
            if (!connected) anyDown = true;
        }

        Health.Builder builder = anyDown ? Health.down() : Health.up();
        return builder
                .withDetail("sources", sourceStatus)
                .withDetail("filterLists", registry.filterLists().size())
                .withDetail("alertChannel", filteringService.getAlertChannel() != null ? "resolved" : "missing")
                .build();
    }
}
