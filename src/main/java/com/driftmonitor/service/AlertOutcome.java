package com.driftmonitor.service;

import com.driftmonitor.entity.Alert;
import com.driftmonitor.notification.DeliveryReport;

import java.util.concurrent.CompletableFuture;

public record AlertOutcome(Status status, String reason, Alert alert, CompletableFuture<DeliveryReport> delivery) {

    public enum Status {
        CREATED,
        DEDUPLICATED,
        SUPPRESSED
    }

    static AlertOutcome suppressed(String reason) {
        return new AlertOutcome(Status.SUPPRESSED, reason, null, CompletableFuture.completedFuture(DeliveryReport.empty()));
    }

    static AlertOutcome deduplicated(Alert existing) {
        return new AlertOutcome(Status.DEDUPLICATED, "duplicate of alert " + existing.getId(), existing,
            CompletableFuture.completedFuture(DeliveryReport.empty()));
    }
}
