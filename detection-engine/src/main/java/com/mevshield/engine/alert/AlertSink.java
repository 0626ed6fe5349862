package com.mevshield.engine.alert;

import com.mevshield.common.model.Opportunity;
import reactor.core.publisher.Mono;

/**
 * Receiver of high-risk opportunities.
 *
 * <p>Current implementation: {@link NotificationAlertSink}, HTTP to notification-service.
 * Implementations must be non-blocking and signal delivery failure as an error so the
 * dispatcher can count it; the dispatcher applies the send deadline.
 */
public interface AlertSink {

    Mono<Void> send(Opportunity opportunity);
}
