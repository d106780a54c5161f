package com.safepocket.consensus.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.safepocket.consensus.model.ComparisonReport;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ReportJsonWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportJsonWriter.class);

    private final ObjectMapper objectMapper;

    public ReportJsonWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(ComparisonReport report) {
        try {
            return objectMapper.writeValueAsString(ComparisonReportDocument.from(report));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to serialize comparison report", ex);
        }
    }

    public void write(ComparisonReport report, Path output) {
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(output.toFile(), ComparisonReportDocument.from(report));
            log.info("report_saved runId={} path={}", report.runId(), output.toAbsolutePath());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write report to " + output, ex);
        }
    }
}
