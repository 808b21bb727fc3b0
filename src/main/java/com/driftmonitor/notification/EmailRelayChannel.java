package com.driftmonitor.notification;

import com.driftmonitor.exception.DeliveryException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * E-mail through an HTTP mail relay. CRITICAL alerts are sent immediately; anything else is queued
 * and sent as a single digest by {@link #flushDigest()}. The queue is bounded, and a batch that
 * keeps failing is dropped after {@code digest-max-attempts} flushes.
 */
@Slf4j
@Component
public class EmailRelayChannel extends HttpNotificationChannel {

    public static final String NAME = "email";

    @Value("${notification.email.enabled:false}")
    private boolean enabled;

    @Value("${notification.email.relay-url:}")
    private String relayUrl;

    @Value("${notification.email.from:drift-monitor@localhost}")
    private String from;

    @Value("${notification.email.recipients:}")
    private String recipients;

    @Value("${notification.email.timeout-seconds:5}")
    private int timeoutSeconds;

    @Value("${notification.email.digest-max-pending:500}")
    private int maxPending;

    @Value("${notification.email.digest-max-attempts:3}")
    private int maxFlushAttempts;

    private final ApplicationEventPublisher events;
    private WebClient webClient;
    private final ConcurrentLinkedQueue<AlertPayload> digest = new ConcurrentLinkedQueue<>();
    private final AtomicInteger failedFlushes = new AtomicInteger();

    public EmailRelayChannel(ApplicationEventPublisher events) {
        this.events = events;
    }

    @PostConstruct
    void init() {
        if (isEnabled()) {
            webClient = buildClient(relayUrl, timeoutSeconds);
            log.info("Email relay channel initialised → {}", relayUrl);
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isEnabled() {
        return enabled && relayUrl != null && !relayUrl.isBlank() && !recipientList().isEmpty();
    }

    @Override
    public Mono<DeliveryReceipt> deliver(AlertPayload payload) {
        if (!payload.isCritical()) {
            if (digest.size() >= maxPending) {
                return Mono.error(new DeliveryException(NAME, "digest queue full (" + maxPending + " pending)"));
            }
            digest.add(payload);
            return Mono.just(DeliveryReceipt.ok("digest-queued"));
        }
        return send("[" + payload.getSeverityLabel() + "] " + payload.getTitle(), List.of(payload))
            .map(ref -> DeliveryReceipt.ok("email:" + ref));
    }

    public int pendingDigestSize() {
        return digest.size();
    }

    /**
     * Sends every queued payload as one message. On failure the drained payloads are re-queued for
     * the next flush until the attempt limit is reached.
     */
    @Scheduled(fixedDelayString = "${notification.email.digest-interval-ms:3600000}",
               initialDelayString = "${notification.email.digest-interval-ms:3600000}")
    public void flushDigest() {
        if (!isEnabled()) {
            return;
        }
        List<AlertPayload> batch = new ArrayList<>();
        AlertPayload next;
        while ((next = digest.poll()) != null) {
            batch.add(next);
        }
        if (batch.isEmpty()) {
            return;
        }
        try {
            String ref = send("Drift monitor digest: " + batch.size() + " warning alert(s)", batch)
                .block(Duration.ofSeconds(timeoutSeconds + 1L));
            failedFlushes.set(0);
            log.info("Email digest sent | alerts={} | ref={}", batch.size(), ref);
        } catch (RuntimeException ex) {
            int attempts = failedFlushes.incrementAndGet();
            boolean drop = attempts >= maxFlushAttempts;
            if (drop) {
                failedFlushes.set(0);
                log.error("Email digest dropped | alerts={} | failedFlushes={} | reason={}",
                          batch.size(), attempts, ex.getMessage());
            } else {
                digest.addAll(batch);
                log.error("Email digest failed, re-queued | alerts={} | failedFlushes={}/{} | reason={}",
                          batch.size(), attempts, maxFlushAttempts, ex.getMessage());
            }
            events.publishEvent(new EmailDigestFailedEvent(batch.size(), attempts, drop, ex.getMessage()));
        }
    }

    private Mono<String> send(String subject, List<AlertPayload> payloads) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("from", from);
        body.put("to", recipientList());
        body.put("subject", subject);
        body.put("text", renderText(payloads));
        return post(webClient, "", body, String.class)
            .defaultIfEmpty("accepted")
            .map(String::trim);
    }

    String renderText(List<AlertPayload> payloads) {
        StringBuilder sb = new StringBuilder();
        for (AlertPayload p : payloads) {
            sb.append(p.getSeverityLabel()).append(": ").append(p.getTitle()).append('\n')
              .append("  model=").append(p.getModelId())
              .append(" metric=").append(p.getMetricName())
              .append(" value=").append(formatValue(p.getValue()))
              .append(" threshold=").append(formatValue(p.getThreshold())).append('\n')
              .append("  incident=").append(p.getIncidentRef()).append('\n');
            if (p.getAffectedGroups() != null && !p.getAffectedGroups().isEmpty()) {
                sb.append("  groups=").append(String.join(", ", p.getAffectedGroups())).append('\n');
            }
            if (p.getActionsLinks() != null) {
                p.getActionsLinks().forEach(link -> sb.append("  ").append(link).append('\n'));
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private List<String> recipientList() {
        if (recipients == null) {
            return List.of();
        }
        return Arrays.stream(recipients.split(","))
            .map(String::trim)
            .filter(r -> !r.isEmpty())
            .toList();
    }
}
