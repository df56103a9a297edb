package com.bondplatform.relay.controller;

import com.bondplatform.common.model.Address;
import com.bondplatform.common.model.Bytes32;
import com.bondplatform.common.model.PriceRound;
import com.bondplatform.common.model.RelayEnvelope;
import com.bondplatform.common.relay.PriceRelayer;
import com.bondplatform.relay.config.RelayProperties;
import com.bondplatform.relay.dto.SendRoundRequest;
import com.bondplatform.relay.dto.SendRoundResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.math.BigInteger;

/**
 * Source-domain relay API. Sending only submits the round; delivery happens later.
 */
@RestController
@RequestMapping("/api/v1/relay")
public class RelayController {

    private static final Logger log = LoggerFactory.getLogger(RelayController.class);

    private final PriceRelayer relayer;
    private final RelayProperties.Destination defaults;

    public RelayController(PriceRelayer relayer, RelayProperties props) {
        this.relayer  = relayer;
        this.defaults = props.destination();
    }

    @PostMapping("/send")
    public Mono<ResponseEntity<SendRoundResponse>> send(@RequestBody SendRoundRequest request) {
        Bytes32 domain = request.destinationDomain() != null
            ? request.destinationDomain() : Bytes32.of(defaults.domain());
        Address target = request.destinationAddress() != null
            ? request.destinationAddress() : Address.of(defaults.address());
        long gasLimit = request.gasLimit() != null ? request.gasLimit() : defaults.gasLimit();
        BigInteger feeAmount = request.feeAmount() != null ? request.feeAmount() : BigInteger.ZERO;

        log.info("Relay send requested. destination={}/{} feeAmount={} gasLimit={}",
                 domain, target, feeAmount, gasLimit);
        return Mono.fromCallable(() -> relayer.sendLatestRoundData(domain, target, request.feeToken(), feeAmount, gasLimit))
            .map(id -> ResponseEntity.ok(new SendRoundResponse(id)))
            .doOnError(e -> log.error("Relay send endpoint error. destination={}/{}", domain, target, e));
    }

    @GetMapping("/latest")
    public Mono<ResponseEntity<PriceRound>> latest() {
        return Mono.fromCallable(relayer::getLatestRoundData)
            .map(ResponseEntity::ok);
    }

    /**
     * Always rejected: the relayer is send-only.
     */
    @PostMapping("/receive")
    public Mono<ResponseEntity<Void>> receive(@RequestBody RelayEnvelope envelope) {
        return Mono.fromRunnable(() -> relayer.receiveRelayedMessage(
                envelope.sourceDomain(), envelope.sourceSender(), new byte[0]))
            .then(Mono.just(ResponseEntity.accepted().<Void>build()));
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }
}
