package com.safepocket.consensus.controller;

import com.safepocket.consensus.data.CsvDatasetLoader;
import com.safepocket.consensus.model.ComparisonReport;
import com.safepocket.consensus.model.Dataset;
import com.safepocket.consensus.report.ComparisonReportDocument;
import com.safepocket.consensus.service.ConsensusRunService;
import java.io.StringReader;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/comparisons")
public class ComparisonController {

    private final CsvDatasetLoader csvLoader;
    private final ConsensusRunService runService;

    public ComparisonController(CsvDatasetLoader csvLoader, ConsensusRunService runService) {
        this.csvLoader = csvLoader;
        this.runService = runService;
    }

    @PostMapping(consumes = "text/csv", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ComparisonReportDocument> compare(
            @RequestBody String csv,
            @RequestParam(value = "source", required = false, defaultValue = "upload") String source
    ) {
        Dataset dataset = csvLoader.load(new StringReader(csv), source);
        ComparisonReport report = runService.run(dataset);
        return ResponseEntity.ok(ComparisonReportDocument.from(report));
    }
}
