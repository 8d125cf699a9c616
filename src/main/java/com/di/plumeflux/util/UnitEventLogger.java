package com.di.plumeflux.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Writes one structured line per unit event ({@code DOAS_CALIBRATION_STARTED},
 * {@code EMISSION_RATE_FAILED}, ...) so station logs can be grepped per unit key.
 * <p>
 * Each station process gets its own {@code applicationId}; worker thread name and id are recorded
 * so that concurrent calibration and flux jobs can be told apart.
 */
@Slf4j
@Component
public class UnitEventLogger {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String applicationId;

    public UnitEventLogger(@Value("${spring.application.name:plumeflux}") String applicationName) {
        this.applicationId = applicationName + "-" + UUID.randomUUID().toString().substring(0, 8);
        log.info("[EVENT] UnitEventLogger initialized with applicationId: {}", applicationId);
    }

    public String getApplicationId() {
        return applicationId;
    }

    public void logEvent(String eventType, Map<String, Object> context, String unitKey,
                         String stage, Throwable exception) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("eventType", eventType);
        event.put("timestamp", Instant.now().toString());
        event.put("applicationId", applicationId);
        event.put("unitKey", unitKey != null ? unitKey : "unknown");
        event.put("threadName", Thread.currentThread().getName());
        if (stage != null && !stage.isEmpty()) {
            event.put("stage", stage);
        }
        if (context != null && !context.isEmpty()) {
            event.put("context", context);
        }
        if (exception != null) {
            event.put("stackTraceSummary", stackTraceSummary(exception, 5));
        }

        if (exception != null) {
            log.warn("[EVENT] {}", format(event));
        } else {
            log.info("[EVENT] {}", format(event));
        }
    }

    private String format(Map<String, Object> event) {
        try {
            return MAPPER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            return event.toString();
        }
    }

    private static String stackTraceSummary(Throwable exception, int maxLines) {
        StringWriter sw = new StringWriter();
        exception.printStackTrace(new PrintWriter(sw));
        String[] lines = sw.toString().split("\n");
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < Math.min(maxLines, lines.length); i++) {
            if (i > 0) sb.append(" | ");
            sb.append(lines[i].trim());
        }
        return sb.toString();
    }
}
