package com.safepocket.consensus.cli;

import com.safepocket.consensus.data.CsvDatasetLoader;
import com.safepocket.consensus.data.DataLoadException;
import com.safepocket.consensus.data.JdbcDatasetLoader;
import com.safepocket.consensus.model.ComparisonReport;
import com.safepocket.consensus.model.Dataset;
import com.safepocket.consensus.report.ReportJsonWriter;
import com.safepocket.consensus.report.ReportTextFormatter;
import com.safepocket.consensus.service.ConsensusRunService;
import java.io.PrintStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Command-line entry: load a dataset, run the comparison, print and optionally save the report.
 * Exit code 0 whenever a report is produced, even if some detectors failed.
 */
@Component
public class ConsensusCommandLine implements ApplicationRunner, ExitCodeGenerator {

    public static final int EXIT_OK = 0;
    public static final int EXIT_DATA_LOAD_FAILED = 1;
    public static final int EXIT_USAGE = 2;

    private static final Logger log = LoggerFactory.getLogger(ConsensusCommandLine.class);

    private final CsvDatasetLoader csvLoader;
    private final JdbcDatasetLoader jdbcLoader;
    private final ConsensusRunService runService;
    private final ReportJsonWriter jsonWriter;
    private final ReportTextFormatter textFormatter;
    private final PrintStream out;

    private int exitCode = EXIT_OK;

    @Autowired
    public ConsensusCommandLine(
            CsvDatasetLoader csvLoader,
            JdbcDatasetLoader jdbcLoader,
            ConsensusRunService runService,
            ReportJsonWriter jsonWriter,
            ReportTextFormatter textFormatter
    ) {
        this(csvLoader, jdbcLoader, runService, jsonWriter, textFormatter, System.out);
    }

    ConsensusCommandLine(
            CsvDatasetLoader csvLoader,
            JdbcDatasetLoader jdbcLoader,
            ConsensusRunService runService,
            ReportJsonWriter jsonWriter,
            ReportTextFormatter textFormatter,
            PrintStream out
    ) {
        this.csvLoader = csvLoader;
        this.jdbcLoader = jdbcLoader;
        this.runService = runService;
        this.jsonWriter = jsonWriter;
        this.textFormatter = textFormatter;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!CommandLineOptions.requested(args)) {
            return;
        }
        CommandLineOptions options;
        try {
            options = CommandLineOptions.parse(args);
        } catch (IllegalArgumentException ex) {
            out.println(ex.getMessage());
            out.println(CommandLineOptions.USAGE);
            exitCode = EXIT_USAGE;
            return;
        }

        Dataset dataset;
        try {
            dataset = options.csv().isPresent()
                    ? csvLoader.load(options.csv().get())
                    : jdbcLoader.load(options.db().get(), options.table());
        } catch (DataLoadException ex) {
            log.error("data_load_failed reason={}", ex.getMessage());
            out.println("Failed to load data: " + ex.getMessage());
            exitCode = EXIT_DATA_LOAD_FAILED;
            return;
        }

        ComparisonReport report = runService.run(dataset);
        out.print(textFormatter.summary(report));
        if (options.compare()) {
            out.println();
            out.print(textFormatter.comparison(report));
        }
        options.output().ifPresent(path -> {
            jsonWriter.write(report, path);
            out.println("Report saved: " + path);
        });
        exitCode = EXIT_OK;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
