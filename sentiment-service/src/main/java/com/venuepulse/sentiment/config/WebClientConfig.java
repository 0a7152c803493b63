package com.venuepulse.sentiment.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    @Value("${sentiment.http.connect-timeout-ms:5000}")
    private int connectTimeoutMs;

    @Value("${sentiment.http.read-timeout-seconds:15}")
    private int readTimeoutSeconds;

    @Value("${sentiment.models.api-token:}")
    private String modelApiToken;

    @Value("${sentiment.content-source.base-url:http://localhost:8090}")
    private String contentSourceUrl;

    /** Shared client for remote inference endpoints; adapters pass absolute URLs. */
    @Bean
    public WebClient modelWebClient(WebClient.Builder builder) {
        WebClient.Builder configured = builder.clone()
            .clientConnector(new ReactorClientHttpConnector(httpClient()))
            .filter(loggingFilter());
        if (modelApiToken != null && !modelApiToken.isBlank()) {
            configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + modelApiToken);
        }
        return configured.build();
    }

    @Bean
    public WebClient contentSourceWebClient(WebClient.Builder builder) {
        return builder.clone()
            .baseUrl(contentSourceUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient()))
            .filter(loggingFilter())
            .build();
    }

    private HttpClient httpClient() {
        return HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
            .responseTimeout(Duration.ofSeconds(readTimeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(readTimeoutSeconds, TimeUnit.SECONDS))
            );
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
