package com.bondplatform.relay.scheduler;

import com.bondplatform.common.model.Address;
import com.bondplatform.common.model.Bytes32;
import com.bondplatform.common.relay.PriceRelayer;
import com.bondplatform.relay.config.RelayProperties;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.time.Duration;

/**
 * Periodically ships the local feed's latest round to the configured destination.
 *
 * <pre>
 *   delay(interval) → sendLatestRoundData → reschedule
 * </pre>
 *
 * Each cycle is a fresh {@link Mono}; the loop never stops. A failed send reschedules
 * with the fallback interval.
 */
@Component
@ConditionalOnProperty(name = "relay.schedule.enabled", havingValue = "true")
public class RoundRelayScheduler {

    private static final Logger log = LoggerFactory.getLogger(RoundRelayScheduler.class);

    private final PriceRelayer relayer;
    private final RelayProperties.Destination destination;
    private final RelayProperties.Schedule schedule;

    public RoundRelayScheduler(PriceRelayer relayer, RelayProperties props) {
        this.relayer     = relayer;
        this.destination = props.destination();
        this.schedule    = props.schedule();
    }

    @PostConstruct
    public void start() {
        log.info("Round relay loop started. destination={}/{} intervalSeconds={}",
                 destination.domain(), destination.address(), schedule.interval().toSeconds());
        scheduleNextCycle(schedule.interval());
    }

    private void scheduleNextCycle(Duration delay) {
        Mono.delay(delay)
            .then(Mono.fromCallable(this::sendOnce))
            .subscribe(
                messageId -> scheduleNextCycle(schedule.interval()),
                err -> {
                    log.error("Relay cycle failed, rescheduling with fallback interval. fallbackSeconds={}",
                              schedule.fallbackInterval().toSeconds(), err);
                    scheduleNextCycle(schedule.fallbackInterval());
                }
            );
    }

    Bytes32 sendOnce() {
        Bytes32 messageId = relayer.sendLatestRoundData(
            Bytes32.of(destination.domain()), Address.of(destination.address()),
            Address.ZERO, BigInteger.ZERO, destination.gasLimit());
        log.info("SCHEDULED_RELAY messageId={}", messageId);
        return messageId;
    }
}
