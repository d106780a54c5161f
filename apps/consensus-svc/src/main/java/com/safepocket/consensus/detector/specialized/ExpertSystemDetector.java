package com.safepocket.consensus.detector.specialized;

import com.safepocket.consensus.detector.DetectorSupport;
import com.safepocket.consensus.detector.NumericMatrix;
import com.safepocket.consensus.detector.ScoringDetector;
import com.safepocket.consensus.model.DetectionConfig;
import java.util.List;

/**
 * Small inference engine: weighted rules evaluated against per-column context. A rule fires
 * for a row when any feature column satisfies it; the row score is the mean confidence of the
 * rules that fired. Conditions receive NaN for missing cells.
 */
public class ExpertSystemDetector extends ScoringDetector {

    private final List<ExpertRule> rules;

    public ExpertSystemDetector() {
        this(defaultRules());
    }

    public ExpertSystemDetector(List<ExpertRule> rules) {
        super(0.3d);
        this.rules = List.copyOf(rules);
    }

    public static List<ExpertRule> defaultRules() {
        return List.of(
                new ExpertRule("far_from_median", 0.9d,
                        (value, ctx) -> ctx.std() > 0 && Math.abs(value - ctx.median()) > 3 * ctx.std()),
                new ExpertRule("outside_extreme_fence", 0.8d,
                        (value, ctx) -> value < ctx.q1() - 3 * ctx.iqr() || value > ctx.q3() + 3 * ctx.iqr()),
                new ExpertRule("missing_value", 0.5d,
                        (value, ctx) -> Double.isNaN(value))
        );
    }

    @Override
    public double[] score(NumericMatrix matrix, DetectionConfig config) {
        int rows = matrix.rowCount();
        ColumnContext[] contexts = new ColumnContext[matrix.width()];
        for (int j = 0; j < matrix.width(); j++) {
            contexts[j] = ColumnContext.of(matrix.column(j));
        }
        double[] scores = new double[rows];
        for (int i = 0; i < rows; i++) {
            double fired = 0d;
            int count = 0;
            for (ExpertRule rule : rules) {
                if (fires(rule, matrix, contexts, i)) {
                    fired += rule.confidence();
                    count++;
                }
            }
            scores[i] = count == 0 ? 0d : fired / count;
        }
        return scores;
    }

    private boolean fires(ExpertRule rule, NumericMatrix matrix, ColumnContext[] contexts, int row) {
        for (int j = 0; j < contexts.length; j++) {
            if (contexts[j] != null && rule.condition().test(matrix.value(row, j), contexts[j])) {
                return true;
            }
        }
        return false;
    }

    public record ExpertRule(String name, double confidence, Condition condition) {
        public ExpertRule {
            if (confidence < 0 || confidence > 1) {
                throw new IllegalArgumentException("confidence must be in [0, 1]");
            }
        }
    }

    @FunctionalInterface
    public interface Condition {
        boolean test(double value, ColumnContext context);
    }

    public record ColumnContext(double mean, double std, double median, double q1, double q3) {

        static ColumnContext of(double[] column) {
            double[] finite = DetectorSupport.finite(column);
            if (finite.length == 0) {
                return null;
            }
            return new ColumnContext(
                    DetectorSupport.mean(finite),
                    DetectorSupport.populationStd(finite),
                    DetectorSupport.percentile(finite, 50),
                    DetectorSupport.percentile(finite, 25),
                    DetectorSupport.percentile(finite, 75)
            );
        }

        public double iqr() {
            return q3 - q1;
        }
    }
}
