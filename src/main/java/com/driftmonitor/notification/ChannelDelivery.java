package com.driftmonitor.notification;

import com.driftmonitor.exception.DeliveryException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs channel calls with a per-call timeout and exponential-backoff retries, and fans one payload
 * out to several channels. A channel that exhausts its retries yields a failed {@link ChannelResult};
 * it never fails the fan-out.
 */
@Slf4j
@Component
public class ChannelDelivery {

    @Value("${alerts.delivery.max-retries:3}")
    private int maxRetries;

    @Value("${alerts.delivery.initial-backoff-ms:1000}")
    private long initialBackoffMs;

    @Value("${alerts.delivery.timeout-ms:5000}")
    private long timeoutMs;

    @Value("${alerts.delivery.pool-size:8}")
    private int poolSize;

    private Scheduler scheduler;

    @PostConstruct
    void init() {
        scheduler = Schedulers.newBoundedElastic(Math.max(2, poolSize), 10_000, "alert-delivery");
    }

    @PreDestroy
    void shutdown() {
        if (scheduler != null) {
            scheduler.dispose();
        }
    }

    public Mono<DeliveryReport> fanOut(List<NotificationChannel> channels, AlertPayload payload) {
        if (channels.isEmpty()) {
            return Mono.just(DeliveryReport.empty());
        }
        return Flux.fromIterable(channels)
            .flatMapSequential(channel -> deliver(channel, payload).subscribeOn(scheduler))
            .collectList()
            .map(DeliveryReport::new);
    }

    public Mono<ChannelResult> deliver(NotificationChannel channel, AlertPayload payload) {
        AtomicInteger attempts = new AtomicInteger();
        return Mono.defer(() -> {
                attempts.incrementAndGet();
                return channel.deliver(payload);
            })
            .timeout(Duration.ofMillis(timeoutMs))
            .flatMap(receipt -> receipt.ok()
                ? Mono.just(receipt)
                : Mono.error(new DeliveryException(channel.name(), "rejected: " + receipt.ref())))
            .retryWhen(Retry.backoff(maxRetries, Duration.ofMillis(initialBackoffMs))
                .jitter(0)
                .doBeforeRetry(sig -> log.warn("Delivery retry | channel={} | model={} | metric={} | attempt={} | reason={}",
                    channel.name(), payload.getModelId(), payload.getMetricName(),
                    sig.totalRetries() + 1, describe(sig.failure())))
                .onRetryExhaustedThrow((spec, sig) -> sig.failure()))
            .map(receipt -> ChannelResult.delivered(channel.name(), receipt.ref(), attempts.get()))
            .onErrorResume(ex -> {
                log.error("Delivery failed | channel={} | model={} | metric={} | attempts={} | reason={}",
                          channel.name(), payload.getModelId(), payload.getMetricName(), attempts.get(), describe(ex));
                return Mono.just(ChannelResult.failed(channel.name(), describe(ex), attempts.get()));
            });
    }

    private static String describe(Throwable ex) {
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }
}
