package com.safepocket.consensus.comparison;

import com.safepocket.consensus.model.ComparisonReport.CategorySummary;
import com.safepocket.consensus.model.ComparisonReport.Consensus;
import com.safepocket.consensus.model.ComparisonReport.OverlapTable;
import com.safepocket.consensus.model.ComparisonReport.Statistics;
import java.util.List;
import java.util.Map;

/**
 * Cross-method agreement computed from one run's results.
 */
public record Agreement(
        OverlapTable overlap,
        Consensus consensus,
        Statistics statistics,
        Map<String, Integer> uniqueDetections,
        List<CategorySummary> categories
) {
}
