package com.driftmonitor.notification;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class ChatWebhookChannel extends HttpNotificationChannel {

    public static final String NAME = "chat";

    @Value("${notification.chat.enabled:false}")
    private boolean enabled;

    @Value("${notification.chat.webhook-url:}")
    private String webhookUrl;

    @Value("${notification.chat.timeout-seconds:5}")
    private int timeoutSeconds;

    private WebClient webClient;

    @PostConstruct
    void init() {
        if (isEnabled()) {
            webClient = buildClient(webhookUrl, timeoutSeconds);
            log.info("Chat channel initialised → {}", webhookUrl);
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isEnabled() {
        return enabled && webhookUrl != null && !webhookUrl.isBlank();
    }

    @Override
    public Mono<DeliveryReceipt> deliver(AlertPayload payload) {
        return post(webClient, "", buildMessage(payload), String.class)
            .defaultIfEmpty("")
            .map(body -> DeliveryReceipt.ok("chat:" + (body.isBlank() ? "accepted" : body.trim())));
    }

    Map<String, Object> buildMessage(AlertPayload payload) {
        List<Map<String, Object>> fields = new ArrayList<>();
        fields.add(field("Model", payload.getModelId(), true));
        fields.add(field("Metric", payload.getMetricName(), true));
        fields.add(field("Value", formatValue(payload.getValue()), true));
        fields.add(field("Threshold", formatValue(payload.getThreshold()), true));
        if (payload.getAffectedGroups() != null && !payload.getAffectedGroups().isEmpty()) {
            fields.add(field("Affected groups", String.join(", ", payload.getAffectedGroups()), false));
        }
        fields.add(field("Incident", payload.getIncidentRef(), false));

        Map<String, Object> attachment = new LinkedHashMap<>();
        attachment.put("color", payload.isCritical() ? "danger" : "warning");
        attachment.put("title", payload.getTitle());
        attachment.put("fields", fields);
        if (payload.getActionsLinks() != null && !payload.getActionsLinks().isEmpty()) {
            attachment.put("text", String.join("\n", payload.getActionsLinks()));
        }

        String prefix = payload.isCritical() ? "<!channel> " : "";
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("text", prefix + "[" + payload.getSeverityLabel() + "] " + payload.getTitle());
        message.put("attachments", List.of(attachment));
        return message;
    }

    private static Map<String, Object> field(String title, String value, boolean isShort) {
        return Map.of("title", title, "value", value == null ? "" : value, "short", isShort);
    }
}
