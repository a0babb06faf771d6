package com.kabadi.pickupservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "dispatch")
public class DispatchProperties {

    // How long a vendor holds an offer before it expires
    private Duration offerWindow = Duration.ofSeconds(10);

    // Upper bound for the outbound offer call
    private Duration sendTimeout = Duration.ofSeconds(10);

    private long sweepIntervalMs = 10_000;

    // HMAC-SHA256 key for the X-Kabadi-Signature header
    private String signingSecret;

    private int executorPoolSize = 8;

    private int timerPoolSize = 2;
}
