package com.jguard.platform.discord;

import com.jguard.filtering.action.Infraction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface InfractionExpiryRepository extends JpaRepository<InfractionExpiry, UUID> {

    List<InfractionExpiry> findByStatusAndExpiresAtLessThanEqual(InfractionExpiry.ExpiryStatus status, Instant cutoff);

    List<InfractionExpiry> findByStatusAndUserIdAndInfraction(InfractionExpiry.ExpiryStatus status, String userId,
                                                              Infraction infraction);
}
