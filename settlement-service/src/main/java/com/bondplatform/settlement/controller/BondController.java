package com.bondplatform.settlement.controller;

import com.bondplatform.common.model.Address;
import com.bondplatform.common.registry.InMemoryBondRegistry;
import com.bondplatform.settlement.dto.AddressRequest;
import com.bondplatform.settlement.dto.OwnerResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.math.BigInteger;

/**
 * Bond ownership. Transferring the bond moves the creditor role with it.
 */
@RestController
@RequestMapping("/api/v1/bonds")
public class BondController {

    private static final Logger log = LoggerFactory.getLogger(BondController.class);

    private final InMemoryBondRegistry registry;

    public BondController(InMemoryBondRegistry registry) {
        this.registry = registry;
    }

    @GetMapping("/{bondId}/owner")
    public Mono<ResponseEntity<OwnerResponse>> owner(@PathVariable BigInteger bondId) {
        return Mono.fromCallable(() -> new OwnerResponse(bondId, registry.ownerOf(bondId)))
            .map(ResponseEntity::ok);
    }

    @PostMapping("/{bondId}/transfer")
    public Mono<ResponseEntity<OwnerResponse>> transfer(@RequestHeader(VaultController.CALLER_HEADER) Address caller,
                                                        @PathVariable BigInteger bondId,
                                                        @RequestBody AddressRequest request) {
        log.info("Bond transfer requested. bondId={} caller={} to={}", bondId, caller, request.address());
        return Mono.fromCallable(() -> {
                registry.transfer(caller, bondId, request.address());
                return new OwnerResponse(bondId, registry.ownerOf(bondId));
            })
            .map(ResponseEntity::ok);
    }
}
