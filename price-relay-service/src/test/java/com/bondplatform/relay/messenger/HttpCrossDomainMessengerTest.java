package com.bondplatform.relay.messenger;

import com.bondplatform.common.exception.BondException;
import com.bondplatform.common.exception.ErrorCode;
import com.bondplatform.common.model.Address;
import com.bondplatform.common.model.Bytes32;
import com.bondplatform.common.model.RelayFee;
import com.bondplatform.common.relay.OutboundMessage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.bondplatform.relay.RelayFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class HttpCrossDomainMessengerTest {

    private static final Bytes32 SOURCE = Bytes32.of(SOURCE_DOMAIN);
    private static final Bytes32 DESTINATION = Bytes32.of(DESTINATION_DOMAIN);

    private final List<ClientRequest> captured = new ArrayList<>();

    private HttpCrossDomainMessenger messenger(ExchangeFunction exchange) {
        WebClient client = WebClient.builder()
            .baseUrl("http://settlement.local")
            .exchangeFunction(exchange)
            .build();
        return new HttpCrossDomainMessenger(SOURCE, Map.of(DESTINATION, client), "secret");
    }

    private static OutboundMessage message(Address to) {
        return new OutboundMessage(DESTINATION, to, RelayFee.NONE, 200_000L, "0x00");
    }

    @Test
    @DisplayName("posts the envelope to the destination inbox with relay token and message id")
    void postsEnvelope() {
        HttpCrossDomainMessenger messenger = messenger(request -> {
            captured.add(request);
            return Mono.just(ClientResponse.create(HttpStatus.ACCEPTED).build());
        });

        Bytes32 id = messenger.sendCrossDomainMessage(Address.of(RELAYER), message(Address.of(ORACLE)));

        assertEquals(1, captured.size());
        ClientRequest request = captured.get(0);
        assertEquals(HttpMethod.POST, request.method());
        assertEquals("/api/v1/relay/receive", request.url().getPath());
        assertEquals("secret", request.headers().getFirst(HttpCrossDomainMessenger.RELAY_TOKEN_HEADER));
        assertEquals(id.toString(), request.headers().getFirst(HttpCrossDomainMessenger.MESSAGE_ID_HEADER));
    }

    @Test
    @DisplayName("each send gets a fresh message id")
    void distinctIds() {
        HttpCrossDomainMessenger messenger = messenger(request ->
            Mono.just(ClientResponse.create(HttpStatus.ACCEPTED).build()));

        Bytes32 first = messenger.sendCrossDomainMessage(Address.of(RELAYER), message(Address.of(ORACLE)));
        Bytes32 second = messenger.sendCrossDomainMessage(Address.of(RELAYER), message(Address.of(ORACLE)));
        assertNotEquals(first, second);
    }

    @Test
    @DisplayName("unreachable destination: send still returns an id, the failure is only logged")
    void deliveryFailureIsNotSurfaced() {
        HttpCrossDomainMessenger messenger = messenger(request -> Mono.error(new ConnectException("refused")));

        assertNotNull(messenger.sendCrossDomainMessage(Address.of(RELAYER), message(Address.of(ORACLE))));
    }

    @Test
    @DisplayName("destination rejecting the envelope does not fail the send")
    void rejectionIsNotSurfaced() {
        HttpCrossDomainMessenger messenger = messenger(request ->
            Mono.just(ClientResponse.create(HttpStatus.UNAUTHORIZED).build()));

        assertNotNull(messenger.sendCrossDomainMessage(Address.of(RELAYER), message(Address.of(ORACLE))));
    }

    @Test
    @DisplayName("zero destination address → ZERO_ADDRESS, nothing posted")
    void zeroDestination() {
        HttpCrossDomainMessenger messenger = messenger(request -> {
            captured.add(request);
            return Mono.just(ClientResponse.create(HttpStatus.ACCEPTED).build());
        });

        BondException e = assertThrows(BondException.class,
            () -> messenger.sendCrossDomainMessage(Address.of(RELAYER), message(Address.ZERO)));
        assertEquals(ErrorCode.ZERO_ADDRESS, e.getCode());
        assertTrue(captured.isEmpty());
    }

    @Test
    @DisplayName("unknown destination domain → IllegalArgumentException")
    void unknownDomain() {
        HttpCrossDomainMessenger messenger = messenger(request ->
            Mono.just(ClientResponse.create(HttpStatus.ACCEPTED).build()));
        OutboundMessage elsewhere = new OutboundMessage(Bytes32.of("0x" + "0".repeat(63) + "9"),
            Address.of(ORACLE), RelayFee.NONE, 1L, "0x00");

        assertThrows(IllegalArgumentException.class,
            () -> messenger.sendCrossDomainMessage(Address.of(RELAYER), elsewhere));
    }
}
