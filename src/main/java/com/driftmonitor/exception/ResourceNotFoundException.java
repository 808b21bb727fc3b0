package com.driftmonitor.exception;

public class ResourceNotFoundException extends DriftMonitorException {
    public ResourceNotFoundException(String resource, Object id) {
        super(resource.toUpperCase().replace(' ', '_') + "_NOT_FOUND",
              resource + " with id '" + id + "' not found.");
    }
}
