package org.fusionqa.io.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.fusionqa.app.api.dto.QualityReport;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes quality reports as pretty-printed JSON.
 * Non-finite values (an infinite PSNR, a NaN band) are written as the strings "Infinity" and "NaN".
 */
public final class QualityReportWriter {

    private final ObjectMapper mapper;

    public QualityReportWriter() {
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(QualityReport report) {
        Objects.requireNonNull(report, "report must not be null");
        try {
            return mapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize quality report", e);
        }
    }

    public void write(QualityReport report, Path target) {
        Objects.requireNonNull(report, "report must not be null");
        Objects.requireNonNull(target, "target must not be null");
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(target.toFile(), report);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write quality report to " + target, e);
        }
    }
}
