package com.driftmonitor.notification;

public record DeliveryReceipt(boolean ok, String ref) {

    public static DeliveryReceipt ok(String ref) {
        return new DeliveryReceipt(true, ref);
    }

    public static DeliveryReceipt failed(String reason) {
        return new DeliveryReceipt(false, reason);
    }
}
