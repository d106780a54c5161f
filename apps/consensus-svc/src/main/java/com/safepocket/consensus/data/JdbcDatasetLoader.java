package com.safepocket.consensus.data;

import com.safepocket.consensus.model.Dataset;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.ResultSetMetaData;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.stereotype.Component;

/**
 * Loads a whole table through JDBC. A bare file path is opened as a SQLite database.
 */
@Component
public class JdbcDatasetLoader {

    private static final Logger log = LoggerFactory.getLogger(JdbcDatasetLoader.class);
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public Dataset load(String location, String table) {
        if (location == null || location.isBlank()) {
            throw new DataLoadException("database location must be provided");
        }
        if (table == null || !IDENTIFIER.matcher(table).matches()) {
            throw new DataLoadException("invalid table name '" + table + "'");
        }
        if (!location.startsWith("jdbc:") && !Files.isRegularFile(Path.of(location))) {
            throw new DataLoadException("database file not found: " + location);
        }
        String url = jdbcUrl(location);
        JdbcTemplate jdbcTemplate = new JdbcTemplate(new DriverManagerDataSource(url));
        try {
            Dataset dataset = jdbcTemplate.query("SELECT * FROM " + table, (ResultSetExtractor<Dataset>) rs -> {
                ResultSetMetaData meta = rs.getMetaData();
                List<String> columns = new ArrayList<>();
                for (int i = 1; i <= meta.getColumnCount(); i++) {
                    columns.add(meta.getColumnLabel(i));
                }
                List<Map<String, Object>> rows = new ArrayList<>();
                while (rs.next()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int i = 1; i <= columns.size(); i++) {
                        row.put(columns.get(i - 1), normalize(rs.getObject(i)));
                    }
                    rows.add(row);
                }
                return Dataset.of(location + ":" + table, columns, rows);
            });
            log.info("dataset_loaded source={} table={} rows={} columns={}",
                    location, table, dataset.rowCount(), dataset.columnCount());
            return dataset;
        } catch (DataAccessException ex) {
            throw new DataLoadException("Failed to load table " + table + " from " + location + ": " + ex.getMostSpecificCause().getMessage(), ex);
        }
    }

    static String jdbcUrl(String location) {
        return location.startsWith("jdbc:") ? location : "jdbc:sqlite:" + location;
    }

    static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger bigInteger) {
            return bigInteger.bitLength() < 64 ? (Object) bigInteger.longValue() : bigInteger.doubleValue();
        }
        if (value instanceof BigDecimal || value instanceof Float || value instanceof Double) {
            return ((Number) value).doubleValue();
        }
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        return value.toString();
    }
}
