package com.qqsuccubus.telemetry.station.export;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.qqsuccubus.telemetry.core.model.SeriesSnapshot;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SeriesCsvExporterTest {

    private static List<Map<String, String>> parse(String csv) throws Exception {
        CsvMapper mapper = new CsvMapper();
        try (MappingIterator<Map<String, String>> rows = mapper.readerFor(Map.class)
            .with(CsvSchema.emptySchema().withHeader())
            .readValues(csv)) {
            return rows.readAll();
        }
    }

    private static SeriesSnapshot snapshot(String name, List<Double> times, Map<String, List<Double>> values) {
        return new SeriesSnapshot(name, times, values, new ArrayList<>(values.keySet()), Instant.EPOCH);
    }

    @Test
    void testHeader_UnionOfMetricsInFirstSeenOrder() throws Exception {
        Map<String, List<Double>> first = new LinkedHashMap<>();
        first.put("SensorMov:dist_m", Arrays.asList(1.0, 2.0));
        Map<String, List<Double>> second = new LinkedHashMap<>();
        second.put("SensorLux:Lux", Collections.singletonList(300.0));
        second.put("SensorMov:dist_m", Collections.singletonList(5.0));

        String csv = SeriesCsvExporter.toCsv(Arrays.asList(
            snapshot("Series 1", Arrays.asList(0.0, 0.25), first),
            snapshot("Series 2", Collections.singletonList(0.0), second)
        ));

        assertTrue(csv.startsWith("series,t_s,SensorMov:dist_m,SensorLux:Lux"));
        List<Map<String, String>> rows = parse(csv);
        assertEquals(3, rows.size());
        assertEquals("Series 1", rows.get(1).get("series"));
        assertEquals(0.25, Double.parseDouble(rows.get(1).get("t_s")));
        assertEquals("", rows.get(1).get("SensorLux:Lux"));
        assertEquals(300.0, Double.parseDouble(rows.get(2).get("SensorLux:Lux")));
    }

    @Test
    void testMissingValues_Empty() throws Exception {
        Map<String, List<Double>> values = new HashMap<>();
        values.put("SensorLux:Lux", Arrays.asList(null, 4.0));

        List<Map<String, String>> rows = parse(SeriesCsvExporter.toCsv(Collections.singletonList(
            snapshot("Series 1", Arrays.asList(0.0, 0.25), values))));

        assertEquals("", rows.get(0).get("SensorLux:Lux"));
        assertEquals(4.0, Double.parseDouble(rows.get(1).get("SensorLux:Lux")));
    }

    @Test
    void testNoSeries_HeaderOnly() {
        String csv = SeriesCsvExporter.toCsv(Collections.emptyList());

        assertEquals("series,t_s", csv.trim());
    }
}
