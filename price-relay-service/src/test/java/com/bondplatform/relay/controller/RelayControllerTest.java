package com.bondplatform.relay.controller;

import com.bondplatform.common.feed.MockRoundDataFeed;
import com.bondplatform.common.model.Address;
import com.bondplatform.common.model.Bytes32;
import com.bondplatform.common.model.RelayEnvelope;
import com.bondplatform.common.relay.PriceRelayer;
import com.bondplatform.common.relay.QueuedRelayChannel;
import com.bondplatform.relay.config.ApiExceptionHandler;
import com.bondplatform.relay.config.RelayProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import java.util.Map;

import static com.bondplatform.relay.RelayFixtures.*;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.*;

class RelayControllerTest {

    private MockRoundDataFeed feed;
    private QueuedRelayChannel channel;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        RelayProperties props = properties();
        feed = new MockRoundDataFeed(8, "AVAX / USD", Clock.systemUTC());
        channel = new QueuedRelayChannel(Bytes32.of(SOURCE_DOMAIN));
        PriceRelayer relayer = new PriceRelayer(Address.of(RELAYER), feed, channel);
        client = WebTestClient
            .bindToController(new RelayController(relayer, props), new FeedController(feed))
            .controllerAdvice(new ApiExceptionHandler())
            .build();
    }

    // ── send ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("POST /api/v1/relay/send")
    class SendTests {

        @Test
        @DisplayName("empty body → configured destination, message id returned, envelope pending")
        void defaultsToConfiguredDestination() {
            feed.updateAnswer(BigInteger.valueOf(9_500));

            client.post().uri("/api/v1/relay/send")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{}")
                .exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.messageId").value(containsString("0x"));

            List<RelayEnvelope> pending = channel.pending();
            assertEquals(1, pending.size());
            assertEquals(Address.of(ORACLE), pending.get(0).destinationAddress());
            assertEquals(Bytes32.of(DESTINATION_DOMAIN), pending.get(0).destinationDomain());
            assertEquals(200_000L, pending.get(0).gasLimit());
        }

        @Test
        @DisplayName("explicit destination overrides the configured one")
        void explicitDestination() {
            feed.updateAnswer(BigInteger.valueOf(9_500));
            String other = "0x00000000000000000000000000000000000000aa";

            client.post().uri("/api/v1/relay/send")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("destinationAddress", other, "gasLimit", 50_000))
                .exchange()
                .expectStatus().isOk();

            assertEquals(Address.of(other), channel.pending().get(0).destinationAddress());
            assertEquals(50_000L, channel.pending().get(0).gasLimit());
        }

        @Test
        @DisplayName("empty local feed → 404 ROUND_NOT_FOUND")
        void emptyFeed() {
            client.post().uri("/api/v1/relay/send")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{}")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody().jsonPath("$.detail").value(containsString("ROUND_NOT_FOUND"));
            assertTrue(channel.pending().isEmpty());
        }

        @Test
        @DisplayName("fee without fee token → 400 ZERO_ADDRESS")
        void feeWithoutToken() {
            feed.updateAnswer(BigInteger.ONE);
            client.post().uri("/api/v1/relay/send")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("feeAmount", 10))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody().jsonPath("$.detail").value(containsString("ZERO_ADDRESS"));
        }
    }

    // ── reads and inbound ─────────────────────────────────────────────────

    @Test
    @DisplayName("GET /latest mirrors the local feed")
    void latest() {
        feed.updateAnswer(BigInteger.valueOf(777));
        client.get().uri("/api/v1/relay/latest")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.roundId").isEqualTo(1)
            .jsonPath("$.answer").isEqualTo(777);
    }

    @Test
    @DisplayName("POST /receive → 422 UNEXPECTED_MESSAGE")
    void inboundRejected() {
        RelayEnvelope envelope = new RelayEnvelope(Bytes32.ZERO, Bytes32.of(DESTINATION_DOMAIN),
            Address.of(ORACLE), Bytes32.of(SOURCE_DOMAIN), Address.of(RELAYER), null, 0L, "0x");

        client.post().uri("/api/v1/relay/receive")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(envelope)
            .exchange()
            .expectStatus().isEqualTo(422)
            .expectBody().jsonPath("$.detail").value(containsString("UNEXPECTED_MESSAGE"));
    }

    @Nested
    @DisplayName("/api/v1/feed")
    class FeedTests {

        @Test
        @DisplayName("POST /answer opens the next round")
        void pushAnswer() {
            feed.updateAnswer(BigInteger.TEN);
            client.post().uri("/api/v1/feed/answer")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("answer", 42))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.roundId").isEqualTo(2)
                .jsonPath("$.answer").isEqualTo(42);
        }

        @Test
        @DisplayName("POST /answer without answer → 400")
        void missingAnswer() {
            client.post().uri("/api/v1/feed/answer")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{}")
                .exchange()
                .expectStatus().isBadRequest();
        }

        @Test
        @DisplayName("GET /rounds/{id} for an unknown round → 404")
        void unknownRound() {
            client.get().uri("/api/v1/feed/rounds/9")
                .exchange()
                .expectStatus().isNotFound();
        }
    }
}
