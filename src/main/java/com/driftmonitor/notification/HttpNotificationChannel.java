package com.driftmonitor.notification;

import com.driftmonitor.exception.DeliveryException;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

public abstract class HttpNotificationChannel implements NotificationChannel {

    protected WebClient buildClient(String baseUrl, int timeoutSeconds) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 3_000)
            .doOnConnected(conn -> conn.addHandlerLast(
                new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));
        return WebClient.builder()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader("Content-Type", "application/json")
            .build();
    }

    protected <T> Mono<T> post(WebClient client, String uri, Object body, Class<T> responseType) {
        return client.post().uri(uri)
            .bodyValue(body)
            .retrieve()
            .onStatus(HttpStatusCode::isError, resp -> resp.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(b -> new DeliveryException(name(), "HTTP " + resp.statusCode().value() + " " + b)))
            .bodyToMono(responseType)
            .onErrorMap(WebClientRequestException.class,
                ex -> new DeliveryException(name(), "unreachable: " + ex.getMessage(), ex));
    }

    protected static String formatValue(Double value) {
        return value == null ? "n/a" : String.format(Locale.ROOT, "%.4f", value);
    }
}
