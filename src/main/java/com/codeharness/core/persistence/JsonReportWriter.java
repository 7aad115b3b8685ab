package com.codeharness.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serializes run reports to JSON.
 */
public class JsonReportWriter {

    private final ObjectMapper mapper;

    public JsonReportWriter() {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT));
    }

    public JsonReportWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String toJson(TestRunReport report) {
        return write(document(report));
    }

    /** JSON of just the files snapshot. */
    public String toJson(FilesSnapshot snapshot) {
        return write(snapshot);
    }

    public void writeTo(Path file, TestRunReport report) {
        try {
            if (file.toAbsolutePath().getParent() != null) {
                Files.createDirectories(file.toAbsolutePath().getParent());
            }
            mapper.writeValue(file.toFile(), document(report));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write report to " + file, e);
        }
    }

    private Map<String, Object> document(TestRunReport report) {
        var summary = report.summary();
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("sessionId", summary.sessionId());
        doc.put("kind", summary.kind());
        doc.put("state", summary.state());
        doc.put("requestedTests", summary.requestedTests());
        doc.put("passed", summary.passed());
        doc.put("failed", summary.failed());
        doc.put("allPassed", summary.allPassed());
        doc.put("elapsedSeconds", summary.elapsedSeconds());
        doc.put("startedAt", summary.startedAt());
        doc.put("finishedAt", summary.finishedAt());
        doc.put("statistics", summary.statistics());
        doc.put("tests", summary.recordsByTestNumber());
        doc.put("mismatchAnalysis", report.mismatchAnalysis());
        doc.put("files", report.filesSnapshot());
        return doc;
    }

    private String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize report", e);
        }
    }
}
