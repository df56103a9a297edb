package com.bondplatform.settlement.controller;

import com.bondplatform.common.codec.PriceRoundCodec;
import com.bondplatform.common.model.Address;
import com.bondplatform.common.model.Bytes32;
import com.bondplatform.common.model.PriceRound;
import com.bondplatform.common.model.RelayEnvelope;
import com.bondplatform.common.model.RelayFee;
import com.bondplatform.common.oracle.ValuationOracle;
import com.bondplatform.settlement.config.ApiExceptionHandler;
import com.bondplatform.settlement.oracle.OracleDirectory;
import com.bondplatform.settlement.service.RelayInboxService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.math.BigInteger;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.*;

class RelayInboxControllerTest {

    private static final Bytes32 SOURCE_DOMAIN = Bytes32.of("0x" + "0".repeat(63) + "1");
    private static final Bytes32 DESTINATION_DOMAIN = Bytes32.of("0x" + "0".repeat(63) + "2");
    private static final Address RELAYER = Address.of("0x0000000000000000000000000000000000000051");
    private static final Address ORACLE = Address.of("0x0000000000000000000000000000000000000052");
    private static final String TOKEN = "secret";

    private ValuationOracle oracle;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        oracle = new ValuationOracle(SOURCE_DOMAIN, RELAYER, 8, "Proxied Price Feed");
        OracleDirectory directory = new OracleDirectory();
        directory.register("avax-usd", ORACLE, oracle);
        client = WebTestClient
            .bindToController(new RelayInboxController(new RelayInboxService(directory, TOKEN)),
                              new OracleController(directory))
            .controllerAdvice(new ApiExceptionHandler())
            .build();
    }

    private static RelayEnvelope envelope(Bytes32 source, Address sender, Address destination, String payload) {
        return new RelayEnvelope(Bytes32.of("0x" + "a".repeat(64)), source, sender,
            DESTINATION_DOMAIN, destination, RelayFee.NONE, 200_000L, payload);
    }

    private static String round(long roundId, long answer) {
        return PriceRoundCodec.encodeHex(new PriceRound(BigInteger.valueOf(roundId), BigInteger.valueOf(answer),
            1_700_000_000L, 1_700_000_100L, BigInteger.valueOf(roundId)));
    }

    private WebTestClient.ResponseSpec post(String token, RelayEnvelope envelope) {
        WebTestClient.RequestBodySpec spec = client.post().uri("/api/v1/relay/receive")
            .contentType(MediaType.APPLICATION_JSON);
        if (token != null) {
            spec = spec.header(RelayInboxController.RELAY_TOKEN_HEADER, token);
        }
        return spec.bodyValue(envelope).exchange();
    }

    // ── delivery ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("POST /api/v1/relay/receive")
    class ReceiveTests {

        @Test
        @DisplayName("authorized relay, allowed source → 202 and round stored")
        void accepted() {
            post(TOKEN, envelope(SOURCE_DOMAIN, RELAYER, ORACLE, round(3, 9_500_000_000_000L)))
                .expectStatus().isAccepted();

            assertEquals(BigInteger.valueOf(3), oracle.latestRoundId());
            assertEquals(BigInteger.valueOf(9_500_000_000_000L), oracle.getRoundData(BigInteger.valueOf(3)).answer());
        }

        @Test
        @DisplayName("missing token → 401 UNAUTHORIZED_RELAYER, nothing stored")
        void missingToken() {
            post(null, envelope(SOURCE_DOMAIN, RELAYER, ORACLE, round(1, 1)))
                .expectStatus().isUnauthorized()
                .expectBody().jsonPath("$.detail").value(containsString("UNAUTHORIZED_RELAYER"));
            assertEquals(0, oracle.roundCount());
        }

        @Test
        @DisplayName("wrong token → 401")
        void wrongToken() {
            post("guess", envelope(SOURCE_DOMAIN, RELAYER, ORACLE, round(1, 1)))
                .expectStatus().isUnauthorized();
            assertEquals(0, oracle.roundCount());
        }

        @Test
        @DisplayName("impersonated source sender → 422 INVALID_SOURCE")
        void impersonation() {
            Address mallory = Address.of("0x00000000000000000000000000000000000000ee");
            post(TOKEN, envelope(SOURCE_DOMAIN, mallory, ORACLE, round(1, 1)))
                .expectStatus().isEqualTo(422)
                .expectBody().jsonPath("$.detail").value(containsString("INVALID_SOURCE"));
            assertTrue(oracle.latestRoundData().isEmpty());
        }

        @Test
        @DisplayName("wrong source domain → 422 INVALID_SOURCE")
        void wrongDomain() {
            post(TOKEN, envelope(DESTINATION_DOMAIN, RELAYER, ORACLE, round(1, 1)))
                .expectStatus().isEqualTo(422);
        }

        @Test
        @DisplayName("no oracle at destination → 422 UNEXPECTED_MESSAGE")
        void unknownDestination() {
            post(TOKEN, envelope(SOURCE_DOMAIN, RELAYER, RELAYER, round(1, 1)))
                .expectStatus().isEqualTo(422)
                .expectBody().jsonPath("$.detail").value(containsString("UNEXPECTED_MESSAGE"));
        }

        @Test
        @DisplayName("truncated payload → 400 INVALID_PAYLOAD")
        void truncatedPayload() {
            post(TOKEN, envelope(SOURCE_DOMAIN, RELAYER, ORACLE, "0x0001"))
                .expectStatus().isBadRequest()
                .expectBody().jsonPath("$.detail").value(containsString("INVALID_PAYLOAD"));
        }
    }

    // ── oracle reads ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("GET /api/v1/oracles")
    class OracleReadTests {

        @Test
        @DisplayName("latest before any delivery is the empty round")
        void emptyLatest() {
            client.get().uri("/api/v1/oracles/avax-usd/latest")
                .exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.roundId").isEqualTo(0);
        }

        @Test
        @DisplayName("rounds are readable after delivery, in any order")
        void outOfOrder() {
            post(TOKEN, envelope(SOURCE_DOMAIN, RELAYER, ORACLE, round(5, 50))).expectStatus().isAccepted();
            post(TOKEN, envelope(SOURCE_DOMAIN, RELAYER, ORACLE, round(4, 40))).expectStatus().isAccepted();

            client.get().uri("/api/v1/oracles/avax-usd/rounds/5")
                .exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.answer").isEqualTo(50);
            client.get().uri("/api/v1/oracles/avax-usd/latest")
                .exchange()
                .expectBody().jsonPath("$.roundId").isEqualTo(4);
        }

        @Test
        @DisplayName("round never received → 404")
        void unknownRound() {
            client.get().uri("/api/v1/oracles/avax-usd/rounds/7")
                .exchange()
                .expectStatus().isNotFound();
        }

        @Test
        @DisplayName("unknown oracle name → 404")
        void unknownOracle() {
            client.get().uri("/api/v1/oracles/btc-usd/latest")
                .exchange()
                .expectStatus().isNotFound();
        }

        @Test
        @DisplayName("metadata")
        void info() {
            client.get().uri("/api/v1/oracles/avax-usd")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.description").isEqualTo("Proxied Price Feed")
                .jsonPath("$.decimals").isEqualTo(8)
                .jsonPath("$.version").isEqualTo(1);
        }
    }
}
