package com.safepocket.consensus.detector;

import com.safepocket.consensus.model.Dataset;
import java.util.List;

/**
 * Private, column-major copy of the feature columns of a dataset. Missing cells stay NaN
 * here; the derived row-major views impute or standardize on further copies.
 */
public final class NumericMatrix {

    private final List<String> columns;
    private final double[][] values;
    private final int rowCount;

    private NumericMatrix(List<String> columns, double[][] values, int rowCount) {
        this.columns = columns;
        this.values = values;
        this.rowCount = rowCount;
    }

    public static NumericMatrix of(Dataset dataset, List<String> featureColumns) {
        if (featureColumns == null || featureColumns.isEmpty()) {
            throw new DetectorExecutionException("no numeric feature columns available");
        }
        double[][] values = new double[featureColumns.size()][];
        for (int j = 0; j < featureColumns.size(); j++) {
            String column = featureColumns.get(j);
            if (!dataset.numericColumns().contains(column)) {
                throw new DetectorExecutionException("column '" + column + "' is not numeric");
            }
            values[j] = dataset.numericValues(column);
        }
        return new NumericMatrix(List.copyOf(featureColumns), values, dataset.rowCount());
    }

    public int rowCount() {
        return rowCount;
    }

    public int width() {
        return columns.size();
    }

    public List<String> columns() {
        return columns;
    }

    public double[] column(int index) {
        return values[index].clone();
    }

    public double value(int row, int column) {
        return values[column][row];
    }

    /**
     * Row-major copy with missing cells replaced by the column mean (0 for an all-missing column).
     */
    public double[][] meanImputed() {
        double[][] rows = new double[rowCount][width()];
        for (int j = 0; j < width(); j++) {
            double[] finite = DetectorSupport.finite(values[j]);
            double fill = finite.length == 0 ? 0d : DetectorSupport.mean(finite);
            for (int i = 0; i < rowCount; i++) {
                double v = values[j][i];
                rows[i][j] = Double.isNaN(v) ? fill : v;
            }
        }
        return rows;
    }

    /**
     * Row-major z-scores using population statistics; missing cells and constant columns map to 0.
     */
    public double[][] standardized() {
        double[][] rows = new double[rowCount][width()];
        for (int j = 0; j < width(); j++) {
            double[] finite = DetectorSupport.finite(values[j]);
            double mean = finite.length == 0 ? 0d : DetectorSupport.mean(finite);
            double std = finite.length == 0 ? 0d : DetectorSupport.populationStd(finite);
            for (int i = 0; i < rowCount; i++) {
                double v = values[j][i];
                rows[i][j] = Double.isNaN(v) || std == 0d ? 0d : (v - mean) / std;
            }
        }
        return rows;
    }
}
