package com.flagship.missed_call.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * WebClient configuration for the Twilio REST API.
 *
 * Timeouts are deliberately short: a send that does not complete fails the
 * send step, and nothing has been charged at that point.
 */
@Configuration
@Slf4j
public class WebClientConfig {

    @Bean(name = "twilioWebClient")
    public WebClient twilioWebClient(MissedCallProperties properties) {
        MissedCallProperties.Twilio twilio = properties.getTwilio();
        int readTimeoutMs = twilio.getReadTimeoutMs();

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, twilio.getConnectTimeoutMs())
                .responseTimeout(Duration.ofMillis(readTimeoutMs))
                .doOnConnected(conn ->
                        conn.addHandlerLast(new ReadTimeoutHandler(readTimeoutMs, TimeUnit.MILLISECONDS))
                                .addHandlerLast(new WriteTimeoutHandler(readTimeoutMs, TimeUnit.MILLISECONDS))
                );

        WebClient.Builder builder = WebClient.builder()
                .baseUrl(twilio.getApiBaseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .filter(logRequest())
                .filter(logResponse());

        if (twilio.getAccountSid() != null && !twilio.getAccountSid().isBlank()) {
            builder.defaultHeaders(headers ->
                    headers.setBasicAuth(twilio.getAccountSid(), twilio.getAuthToken()));
        }

        return builder.build();
    }

    private ExchangeFilterFunction logRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("-> Twilio API Request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }

    private ExchangeFilterFunction logResponse() {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            log.debug("<- Twilio API Response: {}", clientResponse.statusCode());
            return Mono.just(clientResponse);
        });
    }
}
