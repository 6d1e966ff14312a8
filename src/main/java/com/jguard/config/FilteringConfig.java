package com.jguard.config;

import com.jguard.audit.AuditService;
import com.jguard.filtering.list.DomainFilterList;
import com.jguard.filtering.list.FilterList;
import com.jguard.filtering.list.FilterListFactory;
import com.jguard.filtering.list.FilterListRegistry;
import com.jguard.filtering.list.TokenFilterList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Configuration
public class FilteringConfig {

    private static final Logger log = LoggerFactory.getLogger(FilteringConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public FilterListFactory tokenFilterListFactory() {
        return FilterListFactory.of(TokenFilterList.NAME, TokenFilterList::new);
    }

    @Bean
    public FilterListFactory domainFilterListFactory() {
        return FilterListFactory.of(DomainFilterList.NAME, DomainFilterList::new);
    }

    /**
     * Builds the filter lists from configuration. Invalid filter definitions
     * fail startup.
     */
    @Bean
    public FilterListRegistry filterListRegistry(List<FilterListFactory> factories,
                                                 JguardProperties properties,
                                                 AuditService auditService) {
        FilterListRegistry registry = new FilterListRegistry(factories);
        registry.load(properties.getFiltering().getLists());
        List<String> loaded = registry.filterLists().stream().map(FilterList::name).toList();
        try {
            auditService.logFilterListsLoaded(loaded);
        } catch (RuntimeException e) {
            log.warn("Failed to audit filter list load: {}", e.getMessage());
        }
        return registry;
    }
}
