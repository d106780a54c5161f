package com.safepocket.consensus.detector.learned;

import com.safepocket.consensus.detector.Detector;
import com.safepocket.consensus.detector.DetectorSupport;
import com.safepocket.consensus.detector.NumericMatrix;
import com.safepocket.consensus.model.Dataset;
import com.safepocket.consensus.model.DetectionConfig;
import com.safepocket.consensus.model.DetectionOutput;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Seeded isolation forest. Rows with the shortest average isolation path score highest;
 * the top {@code contamination} fraction is flagged.
 */
public class IsolationForestDetector implements Detector {

    private static final int TREES = 100;
    private static final int MAX_SAMPLES = 256;

    @Override
    public DetectionOutput detect(Dataset dataset, DetectionConfig config) {
        NumericMatrix matrix = NumericMatrix.of(dataset, config.featureColumns());
        double[][] rows = matrix.meanImputed();
        int n = rows.length;
        if (n == 0) {
            return DetectionOutput.of(List.of());
        }
        Random random = new Random(config.randomSeed());
        int sampleSize = Math.min(MAX_SAMPLES, n);
        int heightLimit = (int) Math.ceil(Math.log(Math.max(sampleSize, 2)) / Math.log(2));
        double[] pathSums = new double[n];
        for (int t = 0; t < TREES; t++) {
            DetectorSupport.checkInterrupted("isolation_forest");
            int[] sample = sample(n, sampleSize, random);
            Node root = build(rows, sample, 0, heightLimit, random);
            for (int i = 0; i < n; i++) {
                pathSums[i] += pathLength(root, rows[i], 0);
            }
        }
        double normaliser = averagePathLength(sampleSize);
        double[] scores = new double[n];
        Map<Integer, Double> confidence = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            double meanPath = pathSums[i] / TREES;
            scores[i] = normaliser == 0 ? 0.5 : Math.pow(2, -meanPath / normaliser);
            confidence.put(i, scores[i]);
        }
        return new DetectionOutput(DetectorSupport.topFraction(scores, config.contamination()), confidence);
    }

    private int[] sample(int n, int size, Random random) {
        int[] indices = new int[n];
        for (int i = 0; i < n; i++) {
            indices[i] = i;
        }
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(n - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
        }
        int[] sample = new int[size];
        System.arraycopy(indices, 0, sample, 0, size);
        return sample;
    }

    private Node build(double[][] rows, int[] members, int depth, int heightLimit, Random random) {
        if (depth >= heightLimit || members.length <= 1) {
            return Node.leaf(members.length);
        }
        int width = rows[0].length;
        int feature = random.nextInt(width);
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int index : members) {
            min = Math.min(min, rows[index][feature]);
            max = Math.max(max, rows[index][feature]);
        }
        if (min == max) {
            return Node.leaf(members.length);
        }
        double split = min + random.nextDouble() * (max - min);
        int leftCount = 0;
        for (int index : members) {
            if (rows[index][feature] < split) {
                leftCount++;
            }
        }
        int[] left = new int[leftCount];
        int[] right = new int[members.length - leftCount];
        int l = 0;
        int r = 0;
        for (int index : members) {
            if (rows[index][feature] < split) {
                left[l++] = index;
            } else {
                right[r++] = index;
            }
        }
        return new Node(feature, split,
                build(rows, left, depth + 1, heightLimit, random),
                build(rows, right, depth + 1, heightLimit, random),
                0);
    }

    private double pathLength(Node node, double[] row, int depth) {
        if (node.isLeaf()) {
            return depth + averagePathLength(node.size());
        }
        return row[node.feature()] < node.split()
                ? pathLength(node.left(), row, depth + 1)
                : pathLength(node.right(), row, depth + 1);
    }

    static double averagePathLength(int size) {
        if (size <= 1) {
            return 0;
        }
        if (size == 2) {
            return 1;
        }
        double harmonic = Math.log(size - 1.0) + 0.5772156649;
        return 2 * harmonic - 2.0 * (size - 1) / size;
    }

    private record Node(int feature, double split, Node left, Node right, int size) {
        static Node leaf(int size) {
            return new Node(-1, 0, null, null, size);
        }

        boolean isLeaf() {
            return left == null;
        }
    }
}
