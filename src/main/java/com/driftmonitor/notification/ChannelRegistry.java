package com.driftmonitor.notification;

import com.driftmonitor.model.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class ChannelRegistry {

    private final Map<String, NotificationChannel> channels = new LinkedHashMap<>();

    @Value("${alerts.routing.warning:chat,email}")
    private String warningRoute;

    @Value("${alerts.routing.critical:chat,email,issue-tracker}")
    private String criticalRoute;

    @Value("${alerts.escalation.channels:chat,issue-tracker}")
    private String escalationRoute;

    @Value("${alerts.meta.channels:chat}")
    private String metaRoute;

    public ChannelRegistry(List<NotificationChannel> adapters) {
        adapters.forEach(a -> channels.put(a.name(), a));
    }

    public List<NotificationChannel> forSeverity(Severity severity) {
        return switch (severity) {
            case INFO -> List.of();
            case WARNING -> resolve(warningRoute);
            case CRITICAL -> resolve(criticalRoute);
        };
    }

    public List<NotificationChannel> forEscalation() {
        return resolve(escalationRoute);
    }

    public List<NotificationChannel> forMetaAlerts() {
        return resolve(metaRoute);
    }

    public List<NotificationChannel> resolve(String route) {
        List<NotificationChannel> out = new ArrayList<>();
        Arrays.stream(route.split(","))
            .map(String::trim)
            .filter(name -> !name.isEmpty())
            .forEach(name -> {
                NotificationChannel channel = channels.get(name);
                if (channel == null) {
                    log.warn("Unknown channel in route | channel={} | route={}", name, route);
                } else if (channel.isEnabled()) {
                    out.add(channel);
                } else {
                    log.debug("Channel disabled, skipping | channel={}", name);
                }
            });
        return out;
    }
}
