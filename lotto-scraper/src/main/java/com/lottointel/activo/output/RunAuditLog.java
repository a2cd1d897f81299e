package com.lottointel.activo.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lottointel.activo.config.LottoScraperProperties;
import com.lottointel.activo.model.RunMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;

/**
 * Append-only history of every run, successful or not: one JSON object per line.
 * Default location: {outputDir}/runs/scrape_runs.jsonl
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RunAuditLog {

    private final ObjectMapper objectMapper;
    private final LottoScraperProperties properties;

    public void append(RunMetrics metrics) {
        Path auditFile = auditFile();
        try {
            Path parent = auditFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            String line = objectMapper.writeValueAsString(metrics) + System.lineSeparator();
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            log.debug("Audited run {} to {}", metrics.getRunId(), auditFile);
        } catch (IOException e) {
            log.warn("Failed to write scrape run {} to {}: {}", metrics.getRunId(), auditFile, e.getMessage());
        }
    }

    public Path auditFile() {
        LottoScraperProperties.Output output = properties.getOutput();
        if (output.getAuditFile() != null && !output.getAuditFile().isBlank()) {
            return Paths.get(output.getAuditFile());
        }
        return Paths.get(output.getOutputDir(), "runs", "scrape_runs.jsonl");
    }
}
