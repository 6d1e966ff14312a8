package com.jguard.platform.discord;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Lifts temporary bans, voice bans and superstar nicknames whose time is up.
 */
@Component
public class InfractionExpiryScheduler {

    private static final Logger log = LoggerFactory.getLogger(InfractionExpiryScheduler.class);

    static final Duration LIFT_TIMEOUT = Duration.ofSeconds(30);

    private final InfractionExpiryRepository expiryRepository;
    private final DiscordModerationPlatform platform;
    private final Clock clock;

    public InfractionExpiryScheduler(InfractionExpiryRepository expiryRepository,
                                     DiscordModerationPlatform platform,
                                     Clock clock) {
        this.expiryRepository = expiryRepository;
        this.platform = platform;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${jguard.discord.expiry-check-interval:60000}")
    public int liftExpiredInfractions() {
        if (!platform.isConnected()) {
            log.debug("Discord gateway not connected, postponing infraction expiry");
            return 0;
        }
        List<InfractionExpiry> due = expiryRepository.findByStatusAndExpiresAtLessThanEqual(
                InfractionExpiry.ExpiryStatus.ACTIVE, clock.instant());

        int lifted = 0;
        for (InfractionExpiry expiry : due) {
            try {
                platform.liftInfraction(expiry).block(LIFT_TIMEOUT);
                expiry.setStatus(InfractionExpiry.ExpiryStatus.LIFTED);
                lifted++;
            } catch (RuntimeException e) {
                log.error("Failed to lift {} for user={}", expiry.getInfraction().actionLabel(),
                        expiry.getUserId(), e);
                expiry.setStatus(InfractionExpiry.ExpiryStatus.FAILED);
            }
            expiryRepository.save(expiry);
        }
        if (!due.isEmpty()) {
            log.info("Lifted {} of {} expired infractions", lifted, due.size());
        }
        return lifted;
    }
}
