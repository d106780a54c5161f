package com.safepocket.consensus.detector.learned;

import com.safepocket.consensus.detector.Detector;
import com.safepocket.consensus.detector.DetectorSupport;
import com.safepocket.consensus.detector.NumericMatrix;
import com.safepocket.consensus.model.Dataset;
import com.safepocket.consensus.model.DetectionConfig;
import com.safepocket.consensus.model.DetectionOutput;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.ml.clustering.CentroidCluster;
import org.apache.commons.math3.ml.clustering.DoublePoint;
import org.apache.commons.math3.ml.clustering.KMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.random.Well19937c;

/**
 * Distance to the nearest k-means++ centroid over standardized features.
 */
public class KMeansDetector implements Detector {

    private static final int MAX_ITERATIONS = 100;

    @Override
    public DetectionOutput detect(Dataset dataset, DetectionConfig config) {
        NumericMatrix matrix = NumericMatrix.of(dataset, config.featureColumns());
        double[][] rows = matrix.standardized();
        int n = rows.length;
        if (n == 0) {
            return DetectionOutput.of(List.of());
        }
        List<DoublePoint> points = new ArrayList<>(n);
        for (double[] row : rows) {
            points.add(new DoublePoint(row));
        }
        int k = Math.min(clusterCount(n), n);
        EuclideanDistance distance = new EuclideanDistance();
        KMeansPlusPlusClusterer<DoublePoint> clusterer = new KMeansPlusPlusClusterer<>(
                k, MAX_ITERATIONS, distance, new Well19937c(config.randomSeed()));
        List<CentroidCluster<DoublePoint>> clusters = clusterer.cluster(points);
        DetectorSupport.checkInterrupted("kmeans");

        double[] distances = new double[n];
        Map<Integer, Double> confidence = new LinkedHashMap<>();
        double maxDistance = 0d;
        for (int i = 0; i < n; i++) {
            double nearest = Double.POSITIVE_INFINITY;
            for (CentroidCluster<DoublePoint> cluster : clusters) {
                nearest = Math.min(nearest, distance.compute(rows[i], cluster.getCenter().getPoint()));
            }
            distances[i] = nearest;
            maxDistance = Math.max(maxDistance, nearest);
        }
        for (int i = 0; i < n; i++) {
            confidence.put(i, maxDistance == 0 ? 0d : distances[i] / maxDistance);
        }
        return new DetectionOutput(DetectorSupport.topFraction(distances, config.contamination()), confidence);
    }

    static int clusterCount(int rows) {
        int k = (int) Math.round(Math.sqrt(rows / 2.0));
        return Math.max(3, Math.min(10, k));
    }
}
