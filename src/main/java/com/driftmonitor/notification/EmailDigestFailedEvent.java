package com.driftmonitor.notification;

public record EmailDigestFailedEvent(int alerts, int failedFlushes, boolean dropped, String reason) {
}
