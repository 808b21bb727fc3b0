package com.driftmonitor.service;

import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class AnalysisLockRegistry {

    private final Set<String> running = ConcurrentHashMap.newKeySet();

    public boolean tryAcquire(String modelId) {
        return running.add(modelId);
    }

    public void release(String modelId) {
        running.remove(modelId);
    }

    public boolean isRunning(String modelId) {
        return running.contains(modelId);
    }
}
