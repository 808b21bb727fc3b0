package com.driftmonitor.notification;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class IssueTrackerChannel extends HttpNotificationChannel {

    public static final String NAME = "issue-tracker";

    @Value("${notification.issue-tracker.enabled:false}")
    private boolean enabled;

    @Value("${notification.issue-tracker.base-url:https://api.github.com}")
    private String baseUrl;

    @Value("${notification.issue-tracker.repository:}")
    private String repository;

    @Value("${notification.issue-tracker.token:}")
    private String token;

    @Value("${notification.issue-tracker.timeout-seconds:5}")
    private int timeoutSeconds;

    private WebClient webClient;

    @PostConstruct
    void init() {
        if (isEnabled()) {
            webClient = buildClient(baseUrl, timeoutSeconds).mutate()
                .defaultHeader("Accept", "application/vnd.github+json")
                .defaultHeaders(h -> {
                    if (token != null && !token.isBlank()) {
                        h.setBearerAuth(token);
                    }
                })
                .build();
            log.info("Issue tracker channel initialised → {}/repos/{}", baseUrl, repository);
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isEnabled() {
        return enabled && repository != null && !repository.isBlank();
    }

    @Override
    public Mono<DeliveryReceipt> deliver(AlertPayload payload) {
        Map<String, Object> body = Map.of(
            "title", "[" + payload.getSeverityLabel() + "] " + payload.getTitle(),
            "body", renderBody(payload),
            "labels", List.of("model-drift", payload.getSeverityLabel().toLowerCase())
        );
        return post(webClient, "/repos/" + repository + "/issues", body, JsonNode.class)
            .map(json -> json.hasNonNull("html_url")
                ? DeliveryReceipt.ok(json.get("html_url").asText())
                : DeliveryReceipt.ok("issue:" + json.path("number").asText("unknown")));
    }

    String renderBody(AlertPayload payload) {
        StringBuilder sb = new StringBuilder();
        sb.append("## ").append(payload.getTitle()).append("\n\n");
        sb.append("| Field | Value |\n|---|---|\n");
        sb.append("| Model | `").append(payload.getModelId()).append("` |\n");
        sb.append("| Metric | `").append(payload.getMetricName()).append("` |\n");
        sb.append("| Severity | ").append(payload.getSeverityLabel()).append(" |\n");
        sb.append("| Value | ").append(formatValue(payload.getValue())).append(" |\n");
        sb.append("| Threshold | ").append(formatValue(payload.getThreshold())).append(" |\n");
        sb.append("| Incident | ").append(payload.getIncidentRef()).append(" |\n");
        if (payload.getAffectedGroups() != null && !payload.getAffectedGroups().isEmpty()) {
            sb.append("\n**Affected groups:** ").append(String.join(", ", payload.getAffectedGroups())).append('\n');
        }
        if (payload.getActionsLinks() != null) {
            sb.append('\n');
            payload.getActionsLinks().forEach(link -> sb.append("- ").append(link).append('\n'));
        }
        return sb.toString();
    }
}
