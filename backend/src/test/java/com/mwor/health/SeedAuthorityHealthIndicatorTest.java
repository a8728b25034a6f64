package com.mwor.health;

import com.mwor.model.DailySeed;
import com.mwor.service.SeedAuthority;
import com.mwor.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SeedAuthorityHealthIndicatorTest {

    private static final Instant NOW = Instant.parse("2026-03-14T12:00:00Z");

    @Mock
    private SeedAuthority seedAuthority;

    private final MutableClock clock = new MutableClock(NOW);

    @Test
    void unknownBeforeFirstSeed() {
        when(seedAuthority.peekActiveSeed()).thenReturn(Optional.empty());
        when(seedAuthority.oracleDescription()).thenReturn("mock");

        Health health = new SeedAuthorityHealthIndicator(seedAuthority, clock).health();

        assertEquals(Status.UNKNOWN, health.getStatus());
    }

    @Test
    void upForVerifiableCurrentSeed() {
        when(seedAuthority.peekActiveSeed()).thenReturn(Optional.of(seed(true, NOW.plusSeconds(3600))));
        when(seedAuthority.oracleDescription()).thenReturn("mock");

        Health health = new SeedAuthorityHealthIndicator(seedAuthority, clock).health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("2026-03-14", health.getDetails().get("day"));
        assertEquals(true, health.getDetails().get("verifiable"));
    }

    @Test
    void degradedForLocalFallbackSeed() {
        when(seedAuthority.peekActiveSeed()).thenReturn(Optional.of(seed(false, NOW.plusSeconds(3600))));
        when(seedAuthority.oracleDescription()).thenReturn("mock");

        Health health = new SeedAuthorityHealthIndicator(seedAuthority, clock).health();

        assertEquals(new Status(SeedAuthorityHealthIndicator.DEGRADED), health.getStatus());
    }

    @Test
    void downWhenSeedIsPastRotation() {
        when(seedAuthority.peekActiveSeed()).thenReturn(Optional.of(seed(true, NOW.minusSeconds(1))));
        when(seedAuthority.oracleDescription()).thenReturn("mock");

        Health health = new SeedAuthorityHealthIndicator(seedAuthority, clock).health();

        assertEquals(Status.DOWN, health.getStatus());
    }

    private static DailySeed seed(boolean verifiable, Instant rotatesAt) {
        return new DailySeed(LocalDate.of(2026, 3, 14), new byte[32], new byte[0], "sig", NOW, rotatesAt, verifiable, true);
    }
}
