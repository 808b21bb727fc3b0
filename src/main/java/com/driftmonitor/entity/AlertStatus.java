package com.driftmonitor.entity;

public enum AlertStatus {
    PENDING,
    ACKNOWLEDGED,
    RESOLVED
}
