package com.qqsuccubus.telemetry.station.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.qqsuccubus.telemetry.core.model.SeriesSnapshot;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flattens saved series into one CSV table.
 * <p>
 * Columns are {@code series}, {@code t_s} and then every qualified metric id seen across the
 * series, in first-seen order. Metrics a series did not record are left empty.
 * </p>
 */
public final class SeriesCsvExporter {
    public static final String SERIES_COLUMN = "series";
    public static final String TIME_COLUMN = "t_s";

    private static final CsvMapper MAPPER = new CsvMapper();

    static {
        MAPPER.enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING);
    }

    private SeriesCsvExporter() {
    }

    public static String toCsv(List<SeriesSnapshot> snapshots) {
        List<String> metricColumns = metricColumns(snapshots);

        CsvSchema.Builder schema = CsvSchema.builder()
            .addColumn(SERIES_COLUMN)
            .addColumn(TIME_COLUMN, CsvSchema.ColumnType.NUMBER);
        for (String column : metricColumns) {
            schema.addColumn(column, CsvSchema.ColumnType.NUMBER);
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        for (SeriesSnapshot snapshot : snapshots) {
            for (int i = 0; i < snapshot.size(); i++) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put(SERIES_COLUMN, snapshot.getName());
                row.put(TIME_COLUMN, snapshot.getTimes().get(i));
                for (String column : metricColumns) {
                    row.put(column, snapshot.valueAt(column, i));
                }
                rows.add(row);
            }
        }

        if (rows.isEmpty()) {
            // the generator only emits the header together with the first row
            List<String> header = new ArrayList<>();
            header.add(SERIES_COLUMN);
            header.add(TIME_COLUMN);
            header.addAll(metricColumns);
            return String.join(",", header) + "\n";
        }
        try {
            return MAPPER.writer(schema.setUseHeader(true).build()).writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to render series as CSV", e);
        }
    }

    static List<String> metricColumns(List<SeriesSnapshot> snapshots) {
        Set<String> columns = new LinkedHashSet<>();
        for (SeriesSnapshot snapshot : snapshots) {
            columns.addAll(snapshot.getMetricIds());
        }
        return new ArrayList<>(columns);
    }
}
