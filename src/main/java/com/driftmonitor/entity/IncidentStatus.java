package com.driftmonitor.entity;

import java.util.EnumSet;
import java.util.Set;

public enum IncidentStatus {
    OPEN,
    INVESTIGATING,
    RESOLVED,
    ACCEPTED_RISK;

    public Set<IncidentStatus> allowedTargets() {
        return switch (this) {
            case OPEN -> EnumSet.of(INVESTIGATING);
            case INVESTIGATING -> EnumSet.of(RESOLVED, ACCEPTED_RISK);
            case RESOLVED, ACCEPTED_RISK -> EnumSet.noneOf(IncidentStatus.class);
        };
    }

    public boolean canTransitionTo(IncidentStatus target) {
        return allowedTargets().contains(target);
    }

    public boolean isActive() {
        return this == OPEN || this == INVESTIGATING;
    }

    public static Set<IncidentStatus> active() {
        return EnumSet.of(OPEN, INVESTIGATING);
    }
}
