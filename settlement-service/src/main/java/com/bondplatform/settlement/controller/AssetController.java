package com.bondplatform.settlement.controller;

import com.bondplatform.common.exception.BondException;
import com.bondplatform.common.exception.ErrorCode;
import com.bondplatform.common.ledger.InMemoryAssetLedger;
import com.bondplatform.common.model.Address;
import com.bondplatform.settlement.config.SettlementProperties;
import com.bondplatform.settlement.dto.AmountRequest;
import com.bondplatform.settlement.dto.BalanceResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * The settlement asset. Accounts approve the vault here before depositing.
 */
@RestController
@RequestMapping("/api/v1/assets")
public class AssetController {

    private static final Logger log = LoggerFactory.getLogger(AssetController.class);

    private final InMemoryAssetLedger ledger;
    private final Address assetAdmin;

    public AssetController(InMemoryAssetLedger ledger, SettlementProperties props) {
        this.ledger     = ledger;
        this.assetAdmin = Address.of(props.asset().admin());
    }

    @GetMapping("/balances/{account}")
    public Mono<ResponseEntity<BalanceResponse>> balance(@PathVariable Address account) {
        return Mono.fromCallable(() -> new BalanceResponse(account, ledger.balanceOf(account)))
            .map(ResponseEntity::ok);
    }

    @PostMapping("/approve")
    public Mono<ResponseEntity<Void>> approve(@RequestHeader(VaultController.CALLER_HEADER) Address caller,
                                              @RequestBody AmountRequest request) {
        return Mono.fromRunnable(() -> ledger.approve(caller, request.counterparty(), request.amount()))
            .then(Mono.just(ResponseEntity.ok().<Void>build()));
    }

    @PostMapping("/mint")
    public Mono<ResponseEntity<BalanceResponse>> mint(@RequestHeader(VaultController.CALLER_HEADER) Address caller,
                                                      @RequestBody AmountRequest request) {
        log.info("Asset mint requested. caller={} to={} amount={}", caller, request.counterparty(), request.amount());
        return Mono.fromCallable(() -> {
                if (!assetAdmin.equals(caller)) {
                    throw new BondException("AssetLedger", ErrorCode.ONLY_ADMIN, caller + " may not mint " + ledger.symbol());
                }
                ledger.mint(request.counterparty(), request.amount());
                return new BalanceResponse(request.counterparty(), ledger.balanceOf(request.counterparty()));
            })
            .map(ResponseEntity::ok);
    }
}
