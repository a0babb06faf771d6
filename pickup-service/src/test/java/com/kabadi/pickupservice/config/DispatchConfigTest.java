package com.kabadi.pickupservice.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DispatchConfig Unit Tests")
class DispatchConfigTest {

    @Test
    @DisplayName("should measure offer timer delays on the injected clock")
    void shouldUseInjectedClockForOfferTimers() {
        // Arrange
        Clock clock = Clock.fixed(Instant.parse("2026-01-01T10:00:00Z"), ZoneOffset.UTC);
        DispatchProperties properties = new DispatchProperties();
        properties.setTimerPoolSize(1);

        // Act
        ThreadPoolTaskScheduler scheduler = new DispatchConfig().offerTimerScheduler(properties, clock);

        // Assert
        try {
            assertThat(scheduler.getClock()).isSameAs(clock);
            assertThat(scheduler.getThreadNamePrefix()).isEqualTo("offer-timer-");
        } finally {
            scheduler.shutdown();
        }
    }
}
