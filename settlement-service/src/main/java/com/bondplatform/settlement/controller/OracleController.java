package com.bondplatform.settlement.controller;

import com.bondplatform.common.model.PriceRound;
import com.bondplatform.settlement.dto.FeedInfoResponse;
import com.bondplatform.settlement.oracle.OracleDirectory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.util.Set;

/**
 * Read-only view of the relay-fed oracles. An oracle that has not received anything
 * yet reports the empty round ({@code roundId == 0}).
 */
@RestController
@RequestMapping("/api/v1/oracles")
public class OracleController {

    private final OracleDirectory oracles;

    public OracleController(OracleDirectory oracles) {
        this.oracles = oracles;
    }

    @GetMapping
    public Mono<Set<String>> names() {
        return Mono.just(oracles.names());
    }

    @GetMapping("/{name}")
    public Mono<ResponseEntity<FeedInfoResponse>> info(@PathVariable String name) {
        return Mono.fromCallable(() -> FeedInfoResponse.of(oracles.byName(name)))
            .map(ResponseEntity::ok);
    }

    @GetMapping("/{name}/latest")
    public Mono<ResponseEntity<PriceRound>> latest(@PathVariable String name) {
        return Mono.fromCallable(() -> oracles.byName(name).latestRoundData())
            .map(ResponseEntity::ok);
    }

    @GetMapping("/{name}/rounds/{roundId}")
    public Mono<ResponseEntity<PriceRound>> round(@PathVariable String name, @PathVariable BigInteger roundId) {
        return Mono.fromCallable(() -> oracles.byName(name).getRoundData(roundId))
            .map(ResponseEntity::ok);
    }
}
