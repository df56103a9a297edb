package com.bondplatform.settlement.config;

import com.bondplatform.common.aggregator.PriceAggregator;
import com.bondplatform.common.feed.RoundDataFeed;
import com.bondplatform.common.ledger.InMemoryAssetLedger;
import com.bondplatform.common.model.Address;
import com.bondplatform.common.model.Bytes32;
import com.bondplatform.common.oracle.ValuationOracle;
import com.bondplatform.common.registry.InMemoryBondRegistry;
import com.bondplatform.common.vault.BondTerms;
import com.bondplatform.common.vault.RepaymentVault;
import com.bondplatform.settlement.journal.VaultEventJournal;
import com.bondplatform.settlement.oracle.OracleDirectory;
import com.bondplatform.settlement.repository.VaultEventRepository;
import com.bondplatform.settlement.service.RelayInboxService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class SettlementConfig {

    private static final Logger log = LoggerFactory.getLogger(SettlementConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public OracleDirectory oracleDirectory(SettlementProperties props) {
        OracleDirectory directory = new OracleDirectory();
        for (SettlementProperties.Oracle o : props.oracles()) {
            ValuationOracle oracle = new ValuationOracle(
                Bytes32.of(o.sourceDomain()), Address.of(o.sourceSender()), o.decimals(), o.description());
            directory.register(o.name(), Address.of(o.address()), oracle);
        }
        log.info("Oracles deployed. names={}", directory.names());
        return directory;
    }

    @Bean
    @ConditionalOnProperty(name = "settlement.aggregator.enabled", havingValue = "true")
    public PriceAggregator priceAggregator(SettlementProperties props, OracleDirectory oracles) {
        SettlementProperties.Aggregator a = props.aggregator();
        return new PriceAggregator(oracles.byName(a.numerator()), oracles.byName(a.denominator()), a.decimals());
    }

    @Bean
    public RelayInboxService relayInboxService(SettlementProperties props, OracleDirectory oracles) {
        return new RelayInboxService(oracles, props.relayToken());
    }

    @Bean
    public InMemoryBondRegistry bondRegistry(SettlementProperties props) {
        InMemoryBondRegistry registry = new InMemoryBondRegistry();
        registry.mint(props.bond().id(), Address.of(props.bond().holder()));
        return registry;
    }

    @Bean
    public InMemoryAssetLedger assetLedger(SettlementProperties props) {
        SettlementProperties.Asset asset = props.asset();
        return new InMemoryAssetLedger(Address.of(asset.address()), asset.symbol(), asset.decimals());
    }

    @Bean
    public VaultEventJournal vaultEventJournal(SettlementProperties props, VaultEventRepository repository,
                                               ObjectMapper objectMapper, Clock clock) {
        return new VaultEventJournal(Address.of(props.vault().address()), repository, objectMapper, clock);
    }

    @Bean
    public RepaymentVault repaymentVault(SettlementProperties props, InMemoryBondRegistry registry,
                                         InMemoryAssetLedger ledger, OracleDirectory oracles,
                                         ObjectProvider<PriceAggregator> aggregator,
                                         VaultEventJournal journal, Clock clock) {
        SettlementProperties.Vault v = props.vault();
        RoundDataFeed priceFeed = SettlementProperties.AGGREGATOR_FEED.equals(v.priceFeed())
            ? aggregator.getIfAvailable()
            : oracles.byName(v.priceFeed());

        BondTerms terms = new BondTerms(
            Address.of(v.admin()), props.bond().id(), Address.of(v.debtor()), v.debtAmount(), v.maturity(),
            v.principalPaid(), v.principalRepaid(), v.feesBips(), Address.of(v.feesRecipient()));
        RepaymentVault vault = new RepaymentVault(Address.of(v.address()), terms, registry, ledger, priceFeed, clock);
        vault.addListener(journal);
        return vault;
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }
}
