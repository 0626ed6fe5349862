package com.mevshield.engine.alert;

import com.mevshield.common.exception.DispatchException;
import com.mevshield.common.model.OpportunityKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicReference;

import static com.mevshield.engine.support.Snapshots.T0;
import static com.mevshield.engine.support.Snapshots.opportunity;
import static org.junit.jupiter.api.Assertions.*;

class NotificationAlertSinkTest {

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    private NotificationAlertSink sink(HttpStatus status) {
        WebClient client = WebClient.builder()
            .baseUrl("http://notification")
            .exchangeFunction(request -> {
                lastRequest.set(request);
                return Mono.just(ClientResponse.create(status, ExchangeStrategies.withDefaults()).build());
            })
            .build();
        return new NotificationAlertSink(client);
    }

    @Test
    @DisplayName("posts the opportunity to the notify endpoint")
    void posts() {
        StepVerifier.create(sink(HttpStatus.ACCEPTED)
                .send(opportunity("pool-a", OpportunityKind.SANDWICH, 1.0, 0.9, 0.75, T0)))
            .verifyComplete();

        assertEquals(HttpMethod.POST, lastRequest.get().method());
        assertEquals("/api/v1/notify/opportunity", lastRequest.get().url().getPath());
    }

    @Test
    @DisplayName("non-2xx response → DispatchException")
    void failure() {
        StepVerifier.create(sink(HttpStatus.SERVICE_UNAVAILABLE)
                .send(opportunity("pool-a", OpportunityKind.SANDWICH, 1.0, 0.9, 0.75, T0)))
            .expectErrorSatisfies(e -> {
                assertInstanceOf(DispatchException.class, e);
                assertTrue(e.getMessage().contains("pool-a"));
            })
            .verify();
    }
}
