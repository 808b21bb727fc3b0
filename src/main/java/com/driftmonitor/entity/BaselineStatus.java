package com.driftmonitor.entity;

public enum BaselineStatus {
    ACTIVE,
    ARCHIVED
}
