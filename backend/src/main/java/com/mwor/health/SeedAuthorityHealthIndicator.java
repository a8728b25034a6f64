package com.mwor.health;

import com.mwor.model.DailySeed;
import com.mwor.service.SeedAuthority;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

@Component
public class SeedAuthorityHealthIndicator implements HealthIndicator {

    static final String DEGRADED = "DEGRADED";

    private final SeedAuthority seedAuthority;
    private final Clock clock;

    public SeedAuthorityHealthIndicator(SeedAuthority seedAuthority, Clock clock) {
        this.seedAuthority = seedAuthority;
        this.clock = clock;
    }

    @Override
    public Health health() {
        Optional<DailySeed> active = seedAuthority.peekActiveSeed();
        if (active.isEmpty()) {
            return Health.unknown()
                    .withDetail("oracle", seedAuthority.oracleDescription())
                    .withDetail("reason", "no seed issued yet")
                    .build();
        }

        DailySeed seed = active.get();
        Health.Builder builder;
        if (!clock.instant().isBefore(seed.rotatesAt())) {
            builder = Health.down().withDetail("reason", "active seed is past its rotation time");
        } else if (!seed.verifiable()) {
            builder = Health.status(DEGRADED).withDetail("reason", "seed was generated locally and is not verifiable");
        } else {
            builder = Health.up();
        }
        return builder
                .withDetail("oracle", seedAuthority.oracleDescription())
                .withDetail("day", seed.day().toString())
                .withDetail("rotatesAt", seed.rotatesAt().toString())
                .withDetail("verifiable", seed.verifiable())
                .withDetail("vrfSignature", seed.vrfSignature())
                .build();
    }
}
