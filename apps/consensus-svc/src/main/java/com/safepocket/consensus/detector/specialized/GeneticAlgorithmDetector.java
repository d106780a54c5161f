package com.safepocket.consensus.detector.specialized;

import com.safepocket.consensus.detector.DetectorSupport;
import com.safepocket.consensus.detector.NumericMatrix;
import com.safepocket.consensus.detector.ScoringDetector;
import com.safepocket.consensus.model.DetectionConfig;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Evolves feature weights and a cut-off so that about 5% of rows fall outside it, then scores
 * rows by the absolute weighted z-score relative to its 95th percentile.
 */
public class GeneticAlgorithmDetector extends ScoringDetector {

    private static final double TARGET_OUTLIER_RATIO = 0.05d;
    private static final double MUTATION_RATE = 0.1d;

    private final int populationSize;
    private final int generations;

    public GeneticAlgorithmDetector() {
        this(20, 10);
    }

    public GeneticAlgorithmDetector(int populationSize, int generations) {
        super(0.3d);
        if (populationSize < 2 || generations < 1) {
            throw new IllegalArgumentException("populationSize must be >= 2 and generations >= 1");
        }
        this.populationSize = populationSize;
        this.generations = generations;
    }

    @Override
    public double[] score(NumericMatrix matrix, DetectionConfig config) {
        double[][] features = matrix.standardized();
        if (features.length == 0) {
            return new double[0];
        }
        Individual best = evolve(features, new Random(config.randomSeed()));
        double[] scores = new double[features.length];
        for (int i = 0; i < features.length; i++) {
            scores[i] = Math.abs(dot(features[i], best.weights()));
        }
        double p95 = DetectorSupport.percentile(scores, 95);
        for (int i = 0; i < scores.length; i++) {
            scores[i] = Math.min(scores[i] / (p95 + 1e-8), 1d);
        }
        return scores;
    }

    private Individual evolve(double[][] features, Random random) {
        int width = features[0].length;
        List<Individual> population = new ArrayList<>(populationSize);
        for (int i = 0; i < populationSize; i++) {
            population.add(new Individual(dirichlet(width, random), 0.3 + random.nextDouble() * 0.4));
        }
        Individual best = null;
        double bestFitness = Double.NEGATIVE_INFINITY;
        for (int generation = 0; generation < generations; generation++) {
            DetectorSupport.checkInterrupted("genetic_algorithm");
            double[] fitness = new double[population.size()];
            for (int i = 0; i < population.size(); i++) {
                fitness[i] = fitness(population.get(i), features);
                if (fitness[i] > bestFitness) {
                    bestFitness = fitness[i];
                    best = population.get(i).copy();
                }
            }
            List<Individual> survivors = new ArrayList<>(populationSize);
            for (int i = 0; i < populationSize; i++) {
                int a = random.nextInt(population.size());
                int b = random.nextInt(population.size() - 1);
                if (b >= a) {
                    b++;
                }
                survivors.add((fitness[a] > fitness[b] ? population.get(a) : population.get(b)).copy());
            }
            List<Individual> next = new ArrayList<>(populationSize);
            for (int i = 0; i < survivors.size(); i += 2) {
                Individual first;
                Individual second;
                if (i + 1 < survivors.size()) {
                    first = crossover(survivors.get(i), survivors.get(i + 1), random);
                    second = crossover(survivors.get(i + 1), survivors.get(i), random);
                } else {
                    first = survivors.get(i).copy();
                    second = survivors.get(i).copy();
                }
                next.add(mutate(first, random));
                next.add(mutate(second, random));
            }
            population = new ArrayList<>(next.subList(0, populationSize));
        }
        return best;
    }

    private double fitness(Individual individual, double[][] features) {
        int outliers = 0;
        for (double[] row : features) {
            if (Math.abs(dot(row, individual.weights())) > individual.threshold()) {
                outliers++;
            }
        }
        return -Math.abs((double) outliers / features.length - TARGET_OUTLIER_RATIO);
    }

    private Individual crossover(Individual a, Individual b, Random random) {
        double[] weights = new double[a.weights().length];
        for (int i = 0; i < weights.length; i++) {
            weights[i] = random.nextDouble() < 0.5 ? a.weights()[i] : b.weights()[i];
        }
        return new Individual(normalised(weights), 0.5 * (a.threshold() + b.threshold()));
    }

    private Individual mutate(Individual individual, Random random) {
        double[] weights = individual.weights().clone();
        double threshold = individual.threshold();
        if (random.nextDouble() < MUTATION_RATE) {
            weights[random.nextInt(weights.length)] = random.nextDouble();
            weights = normalised(weights);
        }
        if (random.nextDouble() < MUTATION_RATE) {
            threshold = Math.max(0.1, Math.min(0.9, threshold + random.nextGaussian() * 0.05));
        }
        return new Individual(weights, threshold);
    }

    private static double[] dirichlet(int width, Random random) {
        double[] weights = new double[width];
        for (int i = 0; i < width; i++) {
            weights[i] = -Math.log(1 - random.nextDouble());
        }
        return normalised(weights);
    }

    private static double[] normalised(double[] weights) {
        double sum = 0d;
        for (double weight : weights) {
            sum += weight;
        }
        if (sum == 0) {
            double[] uniform = new double[weights.length];
            Arrays.fill(uniform, 1d / weights.length);
            return uniform;
        }
        double[] result = new double[weights.length];
        for (int i = 0; i < weights.length; i++) {
            result[i] = weights[i] / sum;
        }
        return result;
    }

    private static double dot(double[] row, double[] weights) {
        double sum = 0d;
        for (int i = 0; i < row.length; i++) {
            sum += row[i] * weights[i];
        }
        return sum;
    }

    private record Individual(double[] weights, double threshold) {
        Individual copy() {
            return new Individual(weights.clone(), threshold);
        }
    }
}
