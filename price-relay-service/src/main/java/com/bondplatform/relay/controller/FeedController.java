package com.bondplatform.relay.controller;

import com.bondplatform.common.feed.MockRoundDataFeed;
import com.bondplatform.common.model.PriceRound;
import com.bondplatform.relay.dto.AnswerUpdateRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.math.BigInteger;

@RestController
@RequestMapping("/api/v1/feed")
public class FeedController {

    private static final Logger log = LoggerFactory.getLogger(FeedController.class);

    private final MockRoundDataFeed localFeed;

    public FeedController(MockRoundDataFeed localFeed) {
        this.localFeed = localFeed;
    }

    @PostMapping("/answer")
    public Mono<ResponseEntity<PriceRound>> updateAnswer(@RequestBody AnswerUpdateRequest request) {
        if (request.answer() == null) {
            return Mono.error(new IllegalArgumentException("answer is required"));
        }
        log.info("Local answer update requested. answer={}", request.answer());
        return Mono.fromCallable(() -> localFeed.updateAnswer(request.answer()))
            .map(ResponseEntity::ok);
    }

    @GetMapping("/latest")
    public Mono<ResponseEntity<PriceRound>> latest() {
        return Mono.fromCallable(localFeed::latestRoundData)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/rounds/{roundId}")
    public Mono<ResponseEntity<PriceRound>> round(@PathVariable BigInteger roundId) {
        return Mono.fromCallable(() -> localFeed.getRoundData(roundId))
            .map(ResponseEntity::ok);
    }
}
