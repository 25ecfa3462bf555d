package com.repo.velocity.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.repo.velocity.pipeline.AnalysisReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes an {@link AnalysisReport} as self-describing JSON: a metadata block
 * followed by the report itself. Dates are ISO-8601 strings.
 */
public class ReportWriter {

    public static final String TOOL = "Velocity Analytics 1.0";

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ReportWriter() {
        this(Clock.systemUTC());
    }

    public ReportWriter(Clock clock) {
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(AnalysisReport report) throws JsonProcessingException {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("generatedAt", clock.instant().toString());
        metadata.put("tool", TOOL);
        metadata.put("description", "Churn, risk, DORA metrics and weekly forecasts for one batch of records");

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("metadata", metadata);
        document.put("report", report);
        return objectMapper.writeValueAsString(document);
    }

    public void write(AnalysisReport report, Path outputPath) throws IOException {
        Files.writeString(outputPath, toJson(report));
        log.debug("Wrote JSON report to {}", outputPath);
    }

    ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
