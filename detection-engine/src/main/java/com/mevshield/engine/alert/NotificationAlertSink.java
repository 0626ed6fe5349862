package com.mevshield.engine.alert;

import com.mevshield.common.exception.DispatchException;
import com.mevshield.common.model.Opportunity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Sends the full {@link Opportunity} record to notification-service
 * ({@code POST /api/v1/notify/opportunity}).
 */
@Component
public class NotificationAlertSink implements AlertSink {

    private static final Logger log = LoggerFactory.getLogger(NotificationAlertSink.class);

    private final WebClient notificationClient;

    public NotificationAlertSink(WebClient notificationClient) {
        this.notificationClient = notificationClient;
    }

    @Override
    public Mono<Void> send(Opportunity opportunity) {
        return notificationClient.post()
            .uri("/api/v1/notify/opportunity")
            .bodyValue(opportunity)
            .retrieve()
            .toBodilessEntity()
            .doOnSuccess(r -> log.debug("Alert delivered. poolId={} kind={} status={}",
                                        opportunity.poolId(), opportunity.kind(), r.getStatusCode()))
            .onErrorMap(e -> new DispatchException("NotificationAlertSink",
                "Alert delivery failed for poolId=" + opportunity.poolId() + ": " + e.getMessage(), e))
            .then();
    }
}
