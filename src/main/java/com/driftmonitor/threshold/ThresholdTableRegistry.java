package com.driftmonitor.threshold;

import com.driftmonitor.exception.InvalidThresholdTableException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the threshold table in force. The table is re-read from {@code drift.thresholds.location}
 * when that file changes, on explicit reload, or replaced wholesale through the API. A table that
 * fails validation never replaces the current one and is announced as a
 * {@link ThresholdTableRejectedEvent}.
 */
@Slf4j
@Component
public class ThresholdTableRegistry {

    @Value("${drift.thresholds.location:classpath:thresholds.json}")
    private String location;

    private final ResourceLoader resourceLoader;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final ApplicationEventPublisher events;
    private final AtomicReference<Loaded> current = new AtomicReference<>();
    private final AtomicLong lastModified = new AtomicLong(-1);

    public ThresholdTableRegistry(ResourceLoader resourceLoader, ObjectMapper mapper, Clock clock,
                                  ApplicationEventPublisher events) {
        this.resourceLoader = resourceLoader;
        this.mapper = mapper;
        this.clock = clock;
        this.events = events;
    }

    @PostConstruct
    void init() {
        reload();
    }

    public ThresholdTable current() {
        Loaded loaded = current.get();
        if (loaded == null) {
            throw new InvalidThresholdTableException("No threshold table has been loaded");
        }
        return loaded.table();
    }

    public Instant loadedAt() {
        Loaded loaded = current.get();
        return loaded != null ? loaded.loadedAt() : null;
    }

    public String source() {
        Loaded loaded = current.get();
        return loaded != null ? loaded.source() : null;
    }

    public synchronized ThresholdTable reload() {
        Resource resource = resourceLoader.getResource(location);
        ThresholdTable table;
        try {
            table = read(resource).validate();
        } catch (InvalidThresholdTableException ex) {
            throw rejected(location, ex);
        }
        current.set(new Loaded(table, clock.instant(), location));
        lastModified.set(lastModifiedOf(resource));
        log.info("Threshold table loaded | source={} | rules={}", location, table.getRules().size());
        return table;
    }

    public synchronized ThresholdTable replace(ThresholdTable table, String actor) {
        if (table == null) {
            throw new InvalidThresholdTableException("Threshold table body is required");
        }
        try {
            table.validate();
        } catch (InvalidThresholdTableException ex) {
            throw rejected("api:" + actor, ex);
        }
        current.set(new Loaded(table, clock.instant(), "api:" + actor));
        log.info("Threshold table replaced | actor={} | rules={}", actor, table.getRules().size());
        return table;
    }

    @Scheduled(fixedDelayString = "${drift.thresholds.refresh-ms:30000}",
               initialDelayString = "${drift.thresholds.refresh-ms:30000}")
    public void refreshIfChanged() {
        Resource resource = resourceLoader.getResource(location);
        long modified = lastModifiedOf(resource);
        if (modified <= 0 || modified == lastModified.get()) {
            return;
        }
        try {
            reload();
        } catch (InvalidThresholdTableException ex) {
            lastModified.set(modified);
            log.warn("Changed threshold table ignored, keeping previous | source={}", location);
        }
    }

    private InvalidThresholdTableException rejected(String source, InvalidThresholdTableException ex) {
        log.error("Threshold table rejected | source={} | reason={}", source, ex.getMessage());
        events.publishEvent(new ThresholdTableRejectedEvent(source, ex.getMessage(), clock.instant()));
        return ex;
    }

    private ThresholdTable read(Resource resource) {
        if (!resource.exists()) {
            throw new InvalidThresholdTableException("Threshold table not found at " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            return mapper.readValue(in, ThresholdTable.class);
        } catch (IOException ex) {
            throw new InvalidThresholdTableException("Threshold table at " + location + " is unreadable", ex);
        }
    }

    private long lastModifiedOf(Resource resource) {
        try {
            return resource.isFile() ? resource.lastModified() : 0L;
        } catch (IOException ex) {
            return 0L;
        }
    }

    private record Loaded(ThresholdTable table, Instant loadedAt, String source) {
    }
}
