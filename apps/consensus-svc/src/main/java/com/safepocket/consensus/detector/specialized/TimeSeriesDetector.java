package com.safepocket.consensus.detector.specialized;

import com.safepocket.consensus.detector.DetectorSupport;
import com.safepocket.consensus.detector.NumericMatrix;
import com.safepocket.consensus.detector.ScoringDetector;
import com.safepocket.consensus.model.DetectionConfig;

/**
 * Exponential smoothing forecast per column in row order; the score is the forecast error in
 * residual standard deviations, divided by 5 and capped at 1, averaged over columns.
 */
public class TimeSeriesDetector extends ScoringDetector {

    private final double alpha;

    public TimeSeriesDetector() {
        this(0.3d);
    }

    public TimeSeriesDetector(double alpha) {
        super(0.3d);
        if (alpha <= 0 || alpha > 1) {
            throw new IllegalArgumentException("alpha must be in (0, 1]");
        }
        this.alpha = alpha;
    }

    @Override
    public double[] score(NumericMatrix matrix, DetectionConfig config) {
        int rows = matrix.rowCount();
        int width = matrix.width();
        double[] scores = new double[rows];
        for (int j = 0; j < width; j++) {
            double[] series = forwardFilled(matrix.column(j));
            double[] forecast = smooth(series);
            double sigma = residualSigma(series, forecast);
            for (int i = 0; i < rows; i++) {
                double error = Math.abs(series[i] - forecast[i]);
                if (Double.isNaN(error)) {
                    continue;
                }
                scores[i] += Math.min(error / (sigma + 1e-8) / 5, 1d) / width;
            }
        }
        return scores;
    }

    private double[] forwardFilled(double[] series) {
        for (int i = 1; i < series.length; i++) {
            if (Double.isNaN(series[i]) && !Double.isNaN(series[i - 1])) {
                series[i] = series[i - 1];
            }
        }
        return series;
    }

    private double[] smooth(double[] series) {
        if (series.length < 2) {
            return series.clone();
        }
        double[] forecast = new double[series.length];
        forecast[0] = series[0];
        for (int t = 1; t < series.length; t++) {
            if (Double.isNaN(series[t])) {
                forecast[t] = forecast[t - 1];
            } else if (Double.isNaN(forecast[t - 1])) {
                forecast[t] = series[t];
            } else {
                forecast[t] = alpha * series[t] + (1 - alpha) * forecast[t - 1];
            }
        }
        return forecast;
    }

    private double residualSigma(double[] series, double[] forecast) {
        double[] residuals = new double[series.length];
        for (int i = 0; i < series.length; i++) {
            residuals[i] = series[i] - forecast[i];
        }
        double[] finite = DetectorSupport.finite(residuals);
        return finite.length == 0 ? 1d : DetectorSupport.populationStd(finite);
    }
}
