package com.safepocket.consensus.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tabular input shared read-only by every detector of a run.
 * Rows, columns and the derived numeric column set are copied into unmodifiable
 * structures on construction; missing cells are kept as {@code null}.
 */
public record Dataset(
        String source,
        List<String> columns,
        List<Map<String, Object>> rows,
        Set<String> numericColumns
) {

    public Dataset {
        if (columns == null || rows == null || numericColumns == null) {
            throw new IllegalArgumentException("columns, rows and numericColumns must be provided");
        }
        columns = List.copyOf(columns);
        List<Map<String, Object>> copiedRows = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            copiedRows.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        rows = Collections.unmodifiableList(copiedRows);
        numericColumns = Collections.unmodifiableSet(new LinkedHashSet<>(numericColumns));
        if (!columns.containsAll(numericColumns)) {
            throw new IllegalArgumentException("numericColumns must be a subset of columns");
        }
    }

    public static Dataset of(String source, List<String> columns, List<Map<String, Object>> rows) {
        Set<String> numeric = new LinkedHashSet<>();
        for (String column : columns) {
            boolean seenValue = false;
            boolean allNumbers = true;
            for (Map<String, Object> row : rows) {
                Object value = row.get(column);
                if (value == null) {
                    continue;
                }
                seenValue = true;
                if (!(value instanceof Number)) {
                    allNumbers = false;
                    break;
                }
            }
            if (seenValue && allNumbers) {
                numeric.add(column);
            }
        }
        return new Dataset(source, columns, rows, numeric);
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columns.size();
    }

    /**
     * First {@code max} numeric columns in column order.
     */
    public List<String> featureColumns(int max) {
        return columns.stream()
                .filter(numericColumns::contains)
                .limit(Math.max(0, max))
                .toList();
    }

    /**
     * Fresh copy of a column as doubles; missing or non-numeric cells become NaN.
     */
    public double[] numericValues(String column) {
        double[] values = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            Object value = rows.get(i).get(column);
            values[i] = value instanceof Number number ? number.doubleValue() : Double.NaN;
        }
        return values;
    }

    public Object value(int rowIndex, String column) {
        return rows.get(rowIndex).get(column);
    }
}
