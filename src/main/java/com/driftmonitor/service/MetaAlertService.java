package com.driftmonitor.service;

import com.driftmonitor.model.Severity;
import com.driftmonitor.notification.AlertPayload;
import com.driftmonitor.notification.ChannelDelivery;
import com.driftmonitor.notification.ChannelRegistry;
import com.driftmonitor.notification.DeliveryReport;
import com.driftmonitor.notification.EmailDigestFailedEvent;
import com.driftmonitor.notification.NotificationChannel;
import lombok.RequiredArgsConstructor;
import com.driftmonitor.threshold.ThresholdTableRejectedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Infrastructure alerts about the monitoring system itself: configuration errors, analysis
 * timeouts, and CRITICAL alerts that no channel accepted. Never throws.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetaAlertService {

    private final ChannelRegistry channels;
    private final ChannelDelivery delivery;

    public CompletableFuture<DeliveryReport> raise(String modelId, String subject, String detail) {
        log.error("META-ALERT | model={} | subject={} | detail={}", modelId, subject, detail);
        List<NotificationChannel> targets = channels.forMetaAlerts();
        if (targets.isEmpty()) {
            log.warn("No channel available for meta-alerts | model={} | subject={}", modelId, subject);
            return CompletableFuture.completedFuture(DeliveryReport.empty());
        }
        AlertPayload payload = AlertPayload.builder()
            .title("Drift monitor failure: " + subject)
            .severityLabel(Severity.CRITICAL.name())
            .modelId(modelId)
            .metricName("monitoring_system")
            .affectedGroups(List.of())
            .incidentRef("meta: " + detail)
            .actionsLinks(List.of())
            .build();
        return delivery.fanOut(targets, payload)
            .doOnNext(report -> {
                if (report.allFailed()) {
                    log.error("Meta-alert undeliverable | model={} | subject={} | failures={}",
                              modelId, subject, report.failures());
                }
            })
            .toFuture();
    }

    @EventListener
    public void onThresholdTableRejected(ThresholdTableRejectedEvent event) {
        raise("*", "threshold table rejected",
            "source=" + event.source() + " reason=" + event.reason() + "; previous table kept");
    }

    @EventListener
    public void onEmailDigestFailed(EmailDigestFailedEvent event) {
        raise("*", event.dropped() ? "email digest dropped" : "email digest failed",
            event.alerts() + " warning alert(s), failed flushes=" + event.failedFlushes()
                + (event.dropped() ? ", batch discarded" : ", re-queued") + ": " + event.reason());
    }
}
