package com.bulkops.service.report;

import com.bulkops.model.OperationReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

/**
 * Serializes operation reports as JSON Lines: one report per line, appended to {@code app.report.path}.
 * With no path configured, reports are only rendered, never written.
 */
@Component
@Slf4j
public class OperationReportWriter {

    private final ObjectMapper objectMapper;
    private final Path reportPath;

    public OperationReportWriter(ObjectMapper objectMapper, @Value("${app.report.path:}") String reportPath) {
        this.objectMapper = objectMapper;
        this.reportPath = reportPath == null || reportPath.isBlank() ? null : Path.of(reportPath);
        log.info("OperationReportWriter initialized, report file: {}", this.reportPath == null ? "none" : this.reportPath);
    }

    public Optional<Path> getReportPath() {
        return Optional.ofNullable(reportPath);
    }

    /**
     * Render a report as a single JSON line, without trailing newline.
     */
    public String toJsonLine(OperationReport report) {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Report " + report.operationId() + " cannot be serialized", e);
        }
    }

    /**
     * Append the report to the configured file. A no-op when no file is configured.
     *
     * @return the rendered line
     */
    public String write(OperationReport report) {
        String line = toJsonLine(report);
        if (reportPath == null) {
            return line;
        }
        synchronized (this) {
            try {
                Path parent = reportPath.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(reportPath, line + "\n", StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot append report to " + reportPath, e);
            }
        }
        log.info("Report {} appended to {}", report.operationId(), reportPath);
        return line;
    }
}
