package com.driftmonitor.notification;

import reactor.core.publisher.Mono;

public interface NotificationChannel {

    /** Routing key used in {@code alerts.routing.*}. */
    String name();

    boolean isEnabled();

    Mono<DeliveryReceipt> deliver(AlertPayload payload);
}
