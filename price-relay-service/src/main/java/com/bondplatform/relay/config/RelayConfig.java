package com.bondplatform.relay.config;

import com.bondplatform.common.feed.MockRoundDataFeed;
import com.bondplatform.common.model.Address;
import com.bondplatform.common.model.Bytes32;
import com.bondplatform.common.relay.PriceRelayer;
import com.bondplatform.relay.messenger.HttpCrossDomainMessenger;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.Map;

@Configuration
public class RelayConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MockRoundDataFeed localFeed(RelayProperties props, Clock clock) {
        RelayProperties.Feed feed = props.feed();
        if (feed.initialAnswer() == null) {
            return new MockRoundDataFeed(feed.decimals(), feed.description(), clock);
        }
        return new MockRoundDataFeed(feed.decimals(), feed.description(), clock, feed.initialAnswer());
    }

    @Bean
    public WebClient destinationClient(WebClient.Builder builder, RelayProperties props) {
        return builder.baseUrl(props.destination().baseUrl()).build();
    }

    @Bean
    public HttpCrossDomainMessenger crossDomainMessenger(RelayProperties props, WebClient destinationClient) {
        RelayProperties.Destination destination = props.destination();
        return new HttpCrossDomainMessenger(
            Bytes32.of(props.sourceDomain()),
            Map.of(Bytes32.of(destination.domain()), destinationClient),
            destination.token());
    }

    @Bean
    public PriceRelayer priceRelayer(RelayProperties props, MockRoundDataFeed localFeed,
                                     HttpCrossDomainMessenger messenger) {
        return new PriceRelayer(Address.of(props.address()), localFeed, messenger);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }
}
