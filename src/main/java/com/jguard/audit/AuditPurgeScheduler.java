package com.jguard.audit;

import com.jguard.config.JguardProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

@Component
public class AuditPurgeScheduler {

    private static final Logger log = LoggerFactory.getLogger(AuditPurgeScheduler.class);

    private final AuditRepository auditRepository;
    private final JguardProperties properties;
    private final Clock clock;

    public AuditPurgeScheduler(AuditRepository auditRepository, JguardProperties properties, Clock clock) {
        this.auditRepository = auditRepository;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(cron = "${jguard.audit.purge-cron:0 0 3 * * *}")
    @Transactional
    public long purgeExpiredAuditEvents() {
        int retentionDays = properties.getSecurity().getDataRetention().getAuditLogDays();
        Instant cutoff = clock.instant().minus(retentionDays, ChronoUnit.DAYS);
        long deleted = auditRepository.deleteByTimestampBefore(cutoff);
        log.info("Purged {} audit events (retention: {} days)", deleted, retentionDays);
        return deleted;
    }
}
