package com.mevshield.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mevshield.engine.enhance.CorrelationScoreEnhancer;
import com.mevshield.engine.enhance.ScoreEnhancer;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
@EnableConfigurationProperties(MevShieldProperties.class)
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Value("${services.market-data.base-url:http://localhost:8085}")
    private String marketDataUrl;

    @Value("${services.notification.base-url:http://localhost:8084}")
    private String notificationUrl;

    @Bean
    public WebClient marketDataClient(WebClient.Builder builder) {
        return builder.clone()
            .baseUrl(marketDataUrl)
            .clientConnector(new ReactorClientHttpConnector(timeoutHttpClient(5)))
            .filter(serverErrorFilter("Market data provider"))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public WebClient notificationClient(WebClient.Builder builder) {
        return builder.clone()
            .baseUrl(notificationUrl)
            .clientConnector(new ReactorClientHttpConnector(timeoutHttpClient(5)))
            .filter(serverErrorFilter("Notification service"))
            .build();
    }

    /**
     * Default in-process enhancer. Declare another {@link ScoreEnhancer} bean
     * named {@code scoreEnhancer} to route scoring through an external backend.
     */
    @Bean
    public ScoreEnhancer scoreEnhancer(MevShieldProperties properties) {
        return new CorrelationScoreEnhancer(properties.getCorrelation());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    // Per-call deadlines come from mevshield.*-timeout; these are the transport-level ceilings.
    private HttpClient timeoutHttpClient(int seconds) {
        return HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 3_000)
            .responseTimeout(Duration.ofSeconds(seconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(seconds, TimeUnit.SECONDS))
            );
    }

    private ExchangeFilterFunction serverErrorFilter(String target) {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().is5xxServerError()) {
                return Mono.error(new IllegalStateException(target + " error: " + clientResponse.statusCode()));
            }
            return Mono.just(clientResponse);
        });
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
