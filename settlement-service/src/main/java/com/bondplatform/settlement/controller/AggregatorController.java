package com.bondplatform.settlement.controller;

import com.bondplatform.common.aggregator.PriceAggregator;
import com.bondplatform.common.model.PriceRound;
import com.bondplatform.settlement.dto.FeedInfoResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.math.BigInteger;

@RestController
@RequestMapping("/api/v1/aggregator")
@ConditionalOnProperty(name = "settlement.aggregator.enabled", havingValue = "true")
public class AggregatorController {

    private static final Logger log = LoggerFactory.getLogger(AggregatorController.class);

    private final PriceAggregator aggregator;

    public AggregatorController(PriceAggregator aggregator) {
        this.aggregator = aggregator;
    }

    @GetMapping
    public Mono<ResponseEntity<FeedInfoResponse>> info() {
        return Mono.just(ResponseEntity.ok(FeedInfoResponse.of(aggregator)));
    }

    @GetMapping("/latest")
    public Mono<ResponseEntity<PriceRound>> latest() {
        return Mono.fromCallable(aggregator::latestRoundData)
            .map(ResponseEntity::ok)
            .doOnError(e -> log.warn("Aggregated read failed. feed={}", aggregator.description()));
    }

    @GetMapping("/rounds/{roundId}")
    public Mono<ResponseEntity<PriceRound>> round(@PathVariable BigInteger roundId) {
        return Mono.fromCallable(() -> aggregator.getRoundData(roundId))
            .map(ResponseEntity::ok)
            .doOnError(e -> log.warn("Aggregated read failed. feed={} roundId={}", aggregator.description(), roundId));
    }
}
