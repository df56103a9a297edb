package com.bondplatform.settlement.controller;

import com.bondplatform.common.model.RelayEnvelope;
import com.bondplatform.settlement.service.RelayInboxService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/relay")
public class RelayInboxController {

    public static final String RELAY_TOKEN_HEADER = "X-Relay-Token";

    private final RelayInboxService inbox;

    public RelayInboxController(RelayInboxService inbox) {
        this.inbox = inbox;
    }

    @PostMapping("/receive")
    public Mono<ResponseEntity<Void>> receive(
            @RequestHeader(value = RELAY_TOKEN_HEADER, required = false) String token,
            @RequestBody RelayEnvelope envelope) {
        return Mono.fromRunnable(() -> inbox.receive(token, envelope))
            .then(Mono.just(ResponseEntity.accepted().<Void>build()));
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }
}
