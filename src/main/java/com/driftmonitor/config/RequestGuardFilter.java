package com.driftmonitor.config;

import com.driftmonitor.dto.ApiError;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;
import java.util.Arrays;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

@Slf4j
@Component
public class RequestGuardFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String REQUEST_ID_ATTRIBUTE = RequestGuardFilter.class.getName() + ".requestId";

    @Value("${security.api-key.enabled:false}")
    private boolean apiKeyEnabled;

    @Value("${security.api-key.header:X-API-Key}")
    private String apiKeyHeader;

    @Value("${security.api-key.values:}")
    private String apiKeyValues;

    @Value("${security.rate-limit.enabled:false}")
    private boolean rateLimitEnabled;

    @Value("${security.rate-limit.requests-per-minute:120}")
    private int requestsPerMinute;

    private final ObjectMapper mapper;
    private final Clock clock;
    private final ConcurrentHashMap<String, WindowCounter> counters = new ConcurrentHashMap<>();

    public RequestGuardFilter(ObjectMapper mapper, Clock clock) {
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String requestId = resolveRequestId(request);
        request.setAttribute(REQUEST_ID_ATTRIBUTE, requestId);
        response.setHeader(REQUEST_ID_HEADER, requestId);
        MDC.put("requestId", requestId);
        try {
            String apiKey = request.getHeader(apiKeyHeader);
            if (apiKeyEnabled && !isValidApiKey(apiKey)) {
                writeError(response, HttpServletResponse.SC_UNAUTHORIZED, "Unauthorized",
                        "Missing or invalid API key", "UNAUTHORIZED", request.getRequestURI(), requestId);
                return;
            }
            if (rateLimitEnabled && !allowRequest(resolveClientKey(request, apiKey))) {
                writeError(response, 429, "Too Many Requests",
                        "Rate limit exceeded", "RATE_LIMITED", request.getRequestURI(), requestId);
                return;
            }
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove("requestId");
        }
    }

    public static String requestIdOf(HttpServletRequest request) {
        Object resolved = request.getAttribute(REQUEST_ID_ATTRIBUTE);
        return resolved != null ? resolved.toString() : resolveRequestId(request);
    }

    private boolean isValidApiKey(String provided) {
        if (provided == null || provided.isBlank()) {
            return false;
        }
        Set<String> allowed = Arrays.stream(apiKeyValues.split(","))
                .map(String::trim)
                .filter(v -> !v.isBlank())
                .collect(Collectors.toSet());
        return allowed.contains(provided);
    }

    private String resolveClientKey(HttpServletRequest request, String apiKey) {
        if (apiKey != null && !apiKey.isBlank()) {
            return "key:" + apiKey;
        }
        String forwardedFor = request.getHeader("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            return "ip:" + forwardedFor.split(",")[0].trim();
        }
        return "ip:" + request.getRemoteAddr();
    }

    private boolean allowRequest(String clientKey) {
        long window = clock.instant().getEpochSecond() / 60;
        WindowCounter counter = counters.compute(clientKey, (key, existing) -> {
            if (existing == null || existing.window != window) {
                return new WindowCounter(window, new AtomicInteger(1));
            }
            existing.count.incrementAndGet();
            return existing;
        });
        if (counters.size() > 10_000) {
            counters.entrySet().removeIf(e -> e.getValue().window < window - 2);
        }
        return counter.count.get() <= requestsPerMinute;
    }

    private static String resolveRequestId(HttpServletRequest request) {
        String existing = request.getHeader(REQUEST_ID_HEADER);
        return (existing != null && !existing.isBlank()) ? existing : UUID.randomUUID().toString();
    }

    private void writeError(HttpServletResponse response, int status, String error, String message,
                            String errorCode, String path, String requestId) throws IOException {
        response.setStatus(status);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        ApiError body = ApiError.builder()
                .status(status)
                .error(error)
                .message(message)
                .path(path)
                .requestId(requestId)
                .errorCode(errorCode)
                .timestamp(clock.instant())
                .build();
        mapper.writeValue(response.getWriter(), body);
        log.warn("{} | status={} | path={} | requestId={}", message, status, path, requestId);
    }

    private record WindowCounter(long window, AtomicInteger count) {
    }
}
