package com.driftmonitor.exception;

public class IllegalStateTransitionException extends DriftMonitorException {
    public IllegalStateTransitionException(String entity, Object id, Object from, Object to) {
        super("ILLEGAL_STATE_TRANSITION",
              entity + " '" + id + "' cannot move from " + from + " to " + to + ".");
    }
}
