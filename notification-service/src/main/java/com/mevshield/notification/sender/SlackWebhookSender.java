package com.mevshield.notification.sender;

import com.mevshield.common.model.Opportunity;
import com.mevshield.common.model.OpportunityKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Map;

/**
 * Relays high-risk opportunity alerts to a Slack incoming webhook.
 * With Slack disabled or no URL configured, the alert is written to the log instead.
 */
@Component
public class SlackWebhookSender {

    private static final Logger log = LoggerFactory.getLogger(SlackWebhookSender.class);

    private final WebClient webClient;

    @Value("${notification.slack.webhook-url:}")
    private String slackWebhookUrl;

    @Value("${notification.slack.enabled:false}")
    private boolean slackEnabled;

    public SlackWebhookSender(WebClient.Builder builder) {
        this.webClient = builder.build();
    }

    public void sendOpportunity(Opportunity opportunity) {
        if (!slackEnabled || slackWebhookUrl == null || slackWebhookUrl.isBlank()) {
            log.info("Slack disabled. Logging alert. poolId={} kind={} value={} risk={} confidence={} block={} tx={}",
                     opportunity.poolId(), opportunity.kind(), opportunity.estimatedValue(),
                     opportunity.riskScore(), opportunity.confidence(),
                     opportunity.blockReference(), opportunity.transactionRef());
            return;
        }

        String message = buildOpportunityMessage(opportunity);

        webClient.post()
            .uri(slackWebhookUrl)
            .bodyValue(Map.of("text", message))
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("Slack alert sent. poolId={} kind={} status={}",
                                opportunity.poolId(), opportunity.kind(), r.getStatusCode()),
                err -> log.error("Slack alert failed. poolId={} kind={}",
                                 opportunity.poolId(), opportunity.kind(), err)
            );
    }

    String buildOpportunityMessage(Opportunity o) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("*%s MEV %s on `%s`* | block `%d`%n",
                                kindEmoji(o.kind()), o.kind().wireName(), o.poolId(), o.blockReference()));
        sb.append(String.format("Risk: *%.0f%%* | Confidence: %.0f%% | Est. value: %.4f%n",
                                o.riskScore() * 100, o.confidence() * 100, o.estimatedValue()));
        sb.append(String.format("Source: %s | Detected: %s", o.source(), o.detectedAt()));
        if (o.transactionRef() != null && !o.transactionRef().isBlank()) {
            sb.append(String.format("%nTx: `%s`", o.transactionRef()));
        }
        if (o.staleData()) {
            sb.append("\n_Derived from cached market data_");
        }
        return sb.toString();
    }

    private String kindEmoji(OpportunityKind kind) {
        return switch (kind) {
            case ARBITRAGE   -> "🔀";
            case SANDWICH    -> "🥪";
            case LIQUIDATION -> "💧";
        };
    }
}
