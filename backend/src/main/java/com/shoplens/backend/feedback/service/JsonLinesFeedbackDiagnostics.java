package com.shoplens.backend.feedback.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shoplens.backend.config.FeedbackProperties;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Appends feedback events as JSON lines to a file on a background executor.
 * Disabled unless {@code feedback.diagnostics-enabled} is set.
 */
@Component
@Slf4j
public class JsonLinesFeedbackDiagnostics implements FeedbackDiagnostics {

    private final FeedbackProperties properties;
    private final ObjectMapper objectMapper;
    private final Executor executor;
    private final Clock clock;

    public JsonLinesFeedbackDiagnostics(FeedbackProperties properties,
                                        ObjectMapper objectMapper,
                                        @Qualifier("generalTaskExecutor") Executor executor,
                                        Clock clock) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.clock = clock;
    }

    @Override
    public void record(String event, Map<String, Object> data) {
        if (!properties.isDiagnosticsEnabled()) {
            return;
        }

        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("event", event);
        entry.put("data", data == null ? Map.of() : data);
        entry.put("timestamp", clock.millis());

        try {
            executor.execute(() -> append(entry));
        } catch (RejectedExecutionException e) {
            log.warn("Dropped feedback diagnostic '{}': executor rejected it", event);
        }
    }

    void append(Map<String, Object> entry) {
        try {
            Path path = Path.of(properties.getDiagnosticsPath());
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            String line = objectMapper.writeValueAsString(entry) + System.lineSeparator();
            Files.writeString(path, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to write feedback diagnostic to {}: {}", properties.getDiagnosticsPath(), e.getMessage());
        }
    }
}
