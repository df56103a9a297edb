package com.bondplatform.settlement.controller;

import com.bondplatform.common.model.Address;
import com.bondplatform.common.vault.DepositReceipt;
import com.bondplatform.common.vault.RepaymentVault;
import com.bondplatform.common.vault.VaultSnapshot;
import com.bondplatform.settlement.dto.*;
import com.bondplatform.settlement.model.VaultEventRecord;
import com.bondplatform.settlement.repository.VaultEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Vault operations. The acting account is taken from {@value #CALLER_HEADER}.
 */
@RestController
@RequestMapping("/api/v1/vault")
public class VaultController {

    private static final Logger log = LoggerFactory.getLogger(VaultController.class);

    public static final String CALLER_HEADER = "X-Caller-Address";
    static final int MAX_EVENTS = 500;

    private final RepaymentVault vault;
    private final VaultEventRepository events;

    public VaultController(RepaymentVault vault, VaultEventRepository events) {
        this.vault  = vault;
        this.events = events;
    }

    @GetMapping
    public Mono<ResponseEntity<VaultSnapshot>> snapshot() {
        return Mono.fromCallable(vault::snapshot)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/creditor")
    public Mono<ResponseEntity<Address>> creditor() {
        return Mono.fromCallable(vault::creditor)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/shares/{account}")
    public Mono<ResponseEntity<BalanceResponse>> shares(@PathVariable Address account) {
        return Mono.fromCallable(() -> new BalanceResponse(account, vault.balanceOf(account)))
            .map(ResponseEntity::ok);
    }

    @PostMapping("/deposit")
    public Mono<ResponseEntity<DepositReceipt>> deposit(@RequestHeader(CALLER_HEADER) Address caller,
                                                        @RequestBody DepositRequest request) {
        log.info("Deposit requested. caller={} principal={} targetValue={} maxAssets={}",
                 caller, request.principal(), request.targetValue(), request.maxAssets());
        return Mono.fromCallable(() -> vault.deposit(caller, request.maxAssets(), request.targetValue(), request.principal()))
            .map(ResponseEntity::ok)
            .doOnError(e -> log.warn("Deposit rejected. caller={} reason={}", caller, e.getMessage()));
    }

    @PostMapping("/quote")
    public Mono<ResponseEntity<QuoteResponse>> quote(@RequestBody ValueRequest request) {
        return Mono.fromCallable(() -> new QuoteResponse(request.targetValue(), vault.quoteAssets(request.targetValue())))
            .map(ResponseEntity::ok);
    }

    @PostMapping("/withdraw")
    public Mono<ResponseEntity<PayoutResponse>> withdraw(@RequestHeader(CALLER_HEADER) Address caller,
                                                         @RequestBody PayoutRequest request) {
        Address receiver = request.receiver() != null ? request.receiver() : caller;
        Address owner    = request.owner() != null ? request.owner() : caller;
        log.info("Withdraw requested. caller={} owner={} receiver={} assets={}", caller, owner, receiver, request.amount());
        return Mono.fromCallable(() -> new PayoutResponse(request.amount(),
                vault.withdraw(caller, request.amount(), receiver, owner)))
            .map(ResponseEntity::ok);
    }

    @PostMapping("/redeem")
    public Mono<ResponseEntity<PayoutResponse>> redeem(@RequestHeader(CALLER_HEADER) Address caller,
                                                       @RequestBody PayoutRequest request) {
        Address receiver = request.receiver() != null ? request.receiver() : caller;
        Address owner    = request.owner() != null ? request.owner() : caller;
        log.info("Redeem requested. caller={} owner={} receiver={} shares={}", caller, owner, receiver, request.amount());
        return Mono.fromCallable(() -> new PayoutResponse(
                vault.redeem(caller, request.amount(), receiver, owner), request.amount()))
            .map(ResponseEntity::ok);
    }

    @PostMapping("/shares/transfer")
    public Mono<ResponseEntity<Void>> transferShares(@RequestHeader(CALLER_HEADER) Address caller,
                                                     @RequestBody AmountRequest request) {
        return Mono.fromRunnable(() -> vault.transfer(caller, request.counterparty(), request.amount()))
            .then(Mono.just(ResponseEntity.ok().<Void>build()));
    }

    @PostMapping("/shares/approve")
    public Mono<ResponseEntity<Void>> approveShares(@RequestHeader(CALLER_HEADER) Address caller,
                                                    @RequestBody AmountRequest request) {
        return Mono.fromRunnable(() -> vault.approve(caller, request.counterparty(), request.amount()))
            .then(Mono.just(ResponseEntity.ok().<Void>build()));
    }

    @PutMapping("/fees")
    public Mono<ResponseEntity<VaultSnapshot>> setFees(@RequestHeader(CALLER_HEADER) Address caller,
                                                       @RequestBody FeesRequest request) {
        return Mono.fromCallable(() -> {
                vault.setFeesBips(caller, request.bips());
                return vault.snapshot();
            })
            .map(ResponseEntity::ok);
    }

    @PutMapping("/fees-recipient")
    public Mono<ResponseEntity<VaultSnapshot>> setFeesRecipient(@RequestHeader(CALLER_HEADER) Address caller,
                                                                @RequestBody AddressRequest request) {
        return Mono.fromCallable(() -> {
                vault.setFeesRecipient(caller, request.address());
                return vault.snapshot();
            })
            .map(ResponseEntity::ok);
    }

    @PutMapping("/admin")
    public Mono<ResponseEntity<VaultSnapshot>> transferAdmin(@RequestHeader(CALLER_HEADER) Address caller,
                                                             @RequestBody AddressRequest request) {
        return Mono.fromCallable(() -> {
                vault.transferAdmin(caller, request.address());
                return vault.snapshot();
            })
            .map(ResponseEntity::ok);
    }

    @GetMapping("/events")
    public Flux<VaultEventRecord> events(@RequestParam(defaultValue = "50") int limit) {
        if (limit < 1 || limit > MAX_EVENTS) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_EVENTS);
        }
        return events.findRecent(vault.address().toString(), limit);
    }
}
