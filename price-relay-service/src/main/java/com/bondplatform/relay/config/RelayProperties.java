package com.bondplatform.relay.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigInteger;
import java.time.Duration;

/**
 * Source-domain settings: who this relayer is, which feed it reads and where rounds go.
 */
@ConfigurationProperties(prefix = "relay")
public record RelayProperties(
    String address,
    String sourceDomain,
    Feed feed,
    Destination destination,
    Schedule schedule
) {

    public record Feed(int decimals, String description, BigInteger initialAnswer) {}

    /**
     * The single remote domain this service ships rounds to. {@code token} is presented
     * to the destination's relay inbox on every delivery.
     */
    public record Destination(String baseUrl, String domain, String address, String token, long gasLimit) {}

    public record Schedule(boolean enabled, Duration interval, Duration fallbackInterval) {}
}
