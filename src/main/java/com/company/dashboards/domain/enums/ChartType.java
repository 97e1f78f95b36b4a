package com.company.dashboards.domain.enums;

import com.company.dashboards.domain.payload.CategoricalPayload;
import com.company.dashboards.domain.payload.ChartPayload;
import com.company.dashboards.domain.payload.KpiPayload;
import com.company.dashboards.domain.payload.TablePayload;
import com.company.dashboards.domain.payload.TimeSeriesPayload;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Supported chart kinds. Each kind owns the transform from raw query rows to its payload shape.
 * Rows are expected to keep column order (the engine adapters return {@link LinkedHashMap}s).
 */
public enum ChartType {
    LINE_CHART("line_chart") {
        @Override
        public ChartPayload transform(List<Map<String, Object>> rows, Map<String, Object> config) {
            return timeSeries(rows, config);
        }
    },
    AREA_CHART("area_chart") {
        @Override
        public ChartPayload transform(List<Map<String, Object>> rows, Map<String, Object> config) {
            return timeSeries(rows, config);
        }
    },
    BAR_CHART("bar_chart") {
        @Override
        public ChartPayload transform(List<Map<String, Object>> rows, Map<String, Object> config) {
            Map<String, Object> data = new LinkedHashMap<>();
            if (rows.isEmpty()) {
                return new CategoricalPayload(data, 0);
            }
            List<String> columns = columnsOf(rows);
            String label = resolveColumn(config, "x_axis", columns, 0);
            String value = resolveColumn(config, "y_axis", columns, 1);
            for (Map<String, Object> row : rows) {
                data.put(String.valueOf(row.get(label)), value != null ? row.get(value) : null);
            }
            return new CategoricalPayload(data, rows.size());
        }
    },
    KPI("kpi") {
        @Override
        public ChartPayload transform(List<Map<String, Object>> rows, Map<String, Object> config) {
            if (rows.isEmpty()) {
                return new KpiPayload(null, null, null, 0);
            }
            Map<String, Object> first = rows.get(0);
            String valueColumn = resolveColumn(config, "value_field", columnsOf(rows), 0);
            return new KpiPayload(
                    first.get(valueColumn),
                    optionalField(first, config, "trend_field"),
                    optionalField(first, config, "comparison_field"),
                    rows.size());
        }
    },
    TABLE("table") {
        @Override
        public ChartPayload transform(List<Map<String, Object>> rows, Map<String, Object> config) {
            if (rows.isEmpty()) {
                return new TablePayload(new ArrayList<>(), new ArrayList<>());
            }
            List<String> available = columnsOf(rows);
            List<String> columns = new ArrayList<>();
            Object configured = config != null ? config.get("columns") : null;
            if (configured instanceof List && !((List<?>) configured).isEmpty()) {
                for (Object column : (List<?>) configured) {
                    if (available.contains(String.valueOf(column))) {
                        columns.add(String.valueOf(column));
                    }
                }
            }
            if (columns.isEmpty()) {
                return new TablePayload(new ArrayList<>(rows), available);
            }

            List<Map<String, Object>> projected = new ArrayList<>(rows.size());
            for (Map<String, Object> row : rows) {
                Map<String, Object> slim = new LinkedHashMap<>();
                for (String column : columns) {
                    slim.put(column, row.get(column));
                }
                projected.add(slim);
            }
            return new TablePayload(projected, columns);
        }
    };

    private final String wireName;

    ChartType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Shapes query rows into this chart's payload. Never returns null; an empty row set
     * yields an empty payload of the right shape.
     */
    public abstract ChartPayload transform(List<Map<String, Object>> rows, Map<String, Object> config);

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static ChartType fromString(String value) {
        for (ChartType type : values()) {
            if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported chart type: " + value);
    }

    private static ChartPayload timeSeries(List<Map<String, Object>> rows, Map<String, Object> config) {
        List<List<Object>> points = new ArrayList<>(rows.size());
        if (rows.isEmpty()) {
            return new TimeSeriesPayload(points);
        }
        List<String> columns = columnsOf(rows);
        String x = resolveColumn(config, "x_axis", columns, 0);
        String y = resolveColumn(config, "y_axis", columns, 1);
        for (Map<String, Object> row : rows) {
            points.add(Arrays.asList(row.get(x), y != null ? row.get(y) : null));
        }
        return new TimeSeriesPayload(points);
    }

    private static List<String> columnsOf(List<Map<String, Object>> rows) {
        return rows.isEmpty() ? Collections.emptyList() : new ArrayList<>(rows.get(0).keySet());
    }

    private static String resolveColumn(Map<String, Object> config, String key,
                                        List<String> columns, int fallbackIndex) {
        Object configured = config != null ? config.get(key) : null;
        if (configured != null && columns.contains(configured.toString())) {
            return configured.toString();
        }
        return fallbackIndex < columns.size() ? columns.get(fallbackIndex) : null;
    }

    private static Object optionalField(Map<String, Object> row, Map<String, Object> config, String key) {
        Object field = config != null ? config.get(key) : null;
        return field != null ? row.get(field.toString()) : null;
    }
}
