package com.driftmonitor.notification;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record DeliveryReport(List<ChannelResult> results) {

    public static DeliveryReport empty() {
        return new DeliveryReport(List.of());
    }

    public List<String> notified() {
        return results.stream().filter(ChannelResult::delivered).map(ChannelResult::channel).toList();
    }

    public Map<String, String> failures() {
        Map<String, String> out = new LinkedHashMap<>();
        results.stream().filter(r -> !r.delivered()).forEach(r -> out.put(r.channel(), r.error()));
        return out;
    }

    public Map<String, String> refs() {
        Map<String, String> out = new LinkedHashMap<>();
        results.stream()
            .filter(r -> r.delivered() && r.ref() != null)
            .forEach(r -> out.put(r.channel(), r.ref()));
        return out;
    }

    public boolean allFailed() {
        return !results.isEmpty() && results.stream().noneMatch(ChannelResult::delivered);
    }
}
