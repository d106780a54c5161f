package com.safepocket.consensus.detector;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

public final class DetectorSupport {

    static final double EPSILON = 1e-8;

    private DetectorSupport() {
    }

    public static double[] finite(double[] values) {
        return Arrays.stream(values).filter(v -> !Double.isNaN(v) && !Double.isInfinite(v)).toArray();
    }

    public static double mean(double[] values) {
        return new Mean().evaluate(values);
    }

    public static double populationStd(double[] values) {
        return new StandardDeviation(false).evaluate(values);
    }

    /**
     * Linearly interpolated percentile (same estimator as numpy/pandas defaults), {@code p} in (0, 100].
     */
    public static double percentile(double[] values, double p) {
        if (values.length == 0) {
            return Double.NaN;
        }
        return new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(values, p);
    }

    /**
     * Indices of the {@code ceil(fraction * n)} highest scores; ties resolved by lower row index.
     */
    public static List<Integer> topFraction(double[] scores, double fraction) {
        int count = (int) Math.ceil(fraction * scores.length);
        if (count <= 0) {
            return List.of();
        }
        return new ArrayList<>(IntStream.range(0, scores.length)
                .boxed()
                .sorted(Comparator.comparingDouble((Integer i) -> scores[i]).reversed()
                        .thenComparing(Comparator.naturalOrder()))
                .limit(count)
                .toList());
    }

    public static void checkInterrupted(String detectorName) {
        if (Thread.currentThread().isInterrupted()) {
            throw new DetectorExecutionException(detectorName + " interrupted");
        }
    }
}
