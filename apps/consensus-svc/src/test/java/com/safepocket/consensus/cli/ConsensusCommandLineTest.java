package com.safepocket.consensus.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.safepocket.consensus.TestDatasets;
import com.safepocket.consensus.comparison.ComparisonEngine;
import com.safepocket.consensus.data.CsvDatasetLoader;
import com.safepocket.consensus.data.DataLoadException;
import com.safepocket.consensus.data.JdbcDatasetLoader;
import com.safepocket.consensus.model.ComparisonReport;
import com.safepocket.consensus.model.Dataset;
import com.safepocket.consensus.model.DetectionResult;
import com.safepocket.consensus.model.DetectorCategory;
import com.safepocket.consensus.report.ReportBuilder;
import com.safepocket.consensus.report.ReportJsonWriter;
import com.safepocket.consensus.report.ReportTextFormatter;
import com.safepocket.consensus.service.ConsensusRunService;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.boot.DefaultApplicationArguments;

class ConsensusCommandLineTest {

    @Mock
    CsvDatasetLoader csvLoader;
    @Mock
    JdbcDatasetLoader jdbcLoader;
    @Mock
    ConsensusRunService runService;
    @Mock
    ReportJsonWriter jsonWriter;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private ConsensusCommandLine commandLine;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        commandLine = new ConsensusCommandLine(csvLoader, jdbcLoader, runService, jsonWriter, new ReportTextFormatter(),
                new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    @Test
    void producesReportAndExitsZeroEvenWithFailedDetectors() throws Exception {
        Dataset dataset = TestDatasets.withOutlier(20, 2);
        when(csvLoader.load(Path.of("data.csv"))).thenReturn(dataset);
        when(runService.run(dataset)).thenReturn(report(dataset));

        commandLine.run(new DefaultApplicationArguments("--csv=data.csv", "--output=out/report.json", "--compare"));

        assertThat(commandLine.getExitCode()).isEqualTo(ConsensusCommandLine.EXIT_OK);
        verify(jsonWriter).write(any(ComparisonReport.class), eq(Path.of("out/report.json")));
        assertThat(output()).contains("iqr", "FAILED", "Overlap", "Report saved");
    }

    @Test
    void databaseSourceUsesTable() throws Exception {
        Dataset dataset = TestDatasets.withOutlier(20, 2);
        when(jdbcLoader.load("ledger.db", "entries")).thenReturn(dataset);
        when(runService.run(dataset)).thenReturn(report(dataset));

        commandLine.run(new DefaultApplicationArguments("--db=ledger.db", "--table=entries"));

        assertThat(commandLine.getExitCode()).isEqualTo(ConsensusCommandLine.EXIT_OK);
        verify(jsonWriter, never()).write(any(), any());
    }

    @Test
    void dataLoadFailureExitsOneWithoutRunning() throws Exception {
        when(csvLoader.load(any(Path.class))).thenThrow(new DataLoadException("CSV file not found: missing.csv"));

        commandLine.run(new DefaultApplicationArguments("--csv=missing.csv"));

        assertThat(commandLine.getExitCode()).isEqualTo(ConsensusCommandLine.EXIT_DATA_LOAD_FAILED);
        verify(runService, never()).run(any());
        assertThat(output()).contains("Failed to load data");
    }

    @Test
    void usageErrorExitsTwo() throws Exception {
        commandLine.run(new DefaultApplicationArguments("--csv=a.csv", "--db=b.db"));

        assertThat(commandLine.getExitCode()).isEqualTo(ConsensusCommandLine.EXIT_USAGE);
        assertThat(output()).contains("Usage:");
    }

    @Test
    void doesNothingWithoutSourceOptions() throws Exception {
        commandLine.run(new DefaultApplicationArguments("--server.port=0"));

        assertThat(commandLine.getExitCode()).isEqualTo(ConsensusCommandLine.EXIT_OK);
        assertThat(output()).isEmpty();
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static ComparisonReport report(Dataset dataset) {
        List<DetectionResult> results = List.of(
                DetectionResult.success("iqr", DetectorCategory.TRADITIONAL, Set.of(2), Map.of(), Duration.ofMillis(1)),
                DetectionResult.success("z_score", DetectorCategory.TRADITIONAL, Set.of(2), Map.of(), Duration.ofMillis(1)),
                DetectionResult.failed("kmeans", DetectorCategory.LEARNED, Duration.ofMillis(1), "did not converge")
        );
        return new ReportBuilder().build(UUID.randomUUID(), Instant.now(), dataset, results,
                new ComparisonEngine().compare(results, 0.5d));
    }
}
