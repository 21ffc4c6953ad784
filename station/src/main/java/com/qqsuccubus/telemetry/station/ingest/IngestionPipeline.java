package com.qqsuccubus.telemetry.station.ingest;

import com.qqsuccubus.telemetry.core.catalog.MetricCatalog;
import com.qqsuccubus.telemetry.core.model.MetricDef;
import com.qqsuccubus.telemetry.core.model.QualifiedMetricId;
import com.qqsuccubus.telemetry.core.model.SensorProfile;
import com.qqsuccubus.telemetry.core.util.Coercions;
import com.qqsuccubus.telemetry.station.state.ActiveSelection;
import com.qqsuccubus.telemetry.station.state.LastValueCache;
import com.qqsuccubus.telemetry.station.state.MeasurementSession;
import com.qqsuccubus.telemetry.station.state.TelemetryStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns inbound sensor payloads into cached values and, while a session is running, buffer rows.
 * <p>
 * Validation and scaling happen outside the state lock; caching and appending happen in one
 * locked step so a concurrent reader never sees a time row without its values.
 * </p>
 * <p>
 * Malformed telemetry is expected: every failure path is a silent drop reported through the
 * returned {@link IngestOutcome}, never an exception.
 * </p>
 */
public class IngestionPipeline {
    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);

    private final TelemetryStateStore store;
    private final MetricCatalog catalog;

    public IngestionPipeline(TelemetryStateStore store, MetricCatalog catalog) {
        this.store = store;
        this.catalog = catalog;
    }

    /**
     * Ingests one sample.
     *
     * @param sensorId   Sensor that published the sample
     * @param rawFields  Decoded payload fields
     * @param receivedAt Arrival time
     * @return Outcome of the sample
     */
    public IngestOutcome onSample(String sensorId, Map<String, Object> rawFields, Instant receivedAt) {
        SensorProfile profile = catalog.profileFor(sensorId);
        IngestOutcome rejection = validate(profile, rawFields);

        Map<String, Double> scaled = rejection == null ? scale(profile, rawFields) : null;
        Integer droppedCount = rejection == null && profile.getDroppedCountField() != null
            ? Coercions.toInt(rawFields.get(profile.getDroppedCountField()))
            : null;

        IngestOutcome outcome = store.withLock(() -> {
            ActiveSelection selection = store.getSelection();
            if (!selection.isSelected(sensorId)) {
                return IngestOutcome.UNSELECTED;
            }
            if (rejection != null) {
                return rejection;
            }
            return apply(sensorId, profile, selection, scaled, droppedCount, receivedAt);
        });

        if (!outcome.isAccepted()) {
            log.debug("Dropped sample from {}: {}", sensorId, outcome);
        }
        return outcome;
    }

    private static IngestOutcome validate(SensorProfile profile, Map<String, Object> rawFields) {
        if (rawFields == null) {
            return IngestOutcome.MALFORMED;
        }
        for (String field : profile.getRequiredFields()) {
            if (!rawFields.containsKey(field)) {
                return IngestOutcome.MISSING_FIELD;
            }
        }
        if (Coercions.toLong(rawFields.get(profile.getTimestampField())) == null) {
            return IngestOutcome.BAD_TIMESTAMP;
        }
        return null;
    }

    /**
     * Scaled value per metric id; uncoercible or missing fields map to {@code null}, never zero.
     */
    private static Map<String, Double> scale(SensorProfile profile, Map<String, Object> rawFields) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (MetricDef metric : profile.getMetrics()) {
            Double raw = Coercions.toDouble(rawFields.get(metric.getSourceKey()));
            values.put(metric.getId(), raw != null ? raw * metric.getScale() : null);
        }
        return values;
    }

    private IngestOutcome apply(String sensorId,
                                SensorProfile profile,
                                ActiveSelection selection,
                                Map<String, Double> scaled,
                                Integer droppedCount,
                                Instant receivedAt) {
        LastValueCache cache = store.getLastValues();

        Map<String, Double> fresh = new HashMap<>();
        scaled.forEach((metricId, value) -> {
            if (selection.isChannelActive(sensorId, metricId)) {
                fresh.put(QualifiedMetricId.of(sensorId, metricId), value);
            }
        });

        fresh.forEach(cache::put);
        cache.setLastDroppedCount(droppedCount);
        cache.setLastReceivedAt(receivedAt);

        MeasurementSession session = store.getSession();
        if (!session.isRunning()) {
            return IngestOutcome.CACHED;
        }

        double period = profile.getSamplePeriodSeconds() != null
            ? profile.getSamplePeriodSeconds()
            : store.getDefaultSamplePeriodSeconds();
        double time = session.advance(period);
        cache.setLastElapsedSeconds(time);

        // Sensors that did not publish on this tick carry their last value forward
        Map<String, Double> row = new HashMap<>();
        for (String qualifiedId : selection.getActiveQualifiedIds()) {
            row.put(qualifiedId, fresh.containsKey(qualifiedId) ? fresh.get(qualifiedId) : cache.get(qualifiedId));
        }
        store.getSeries().append(time, row);
        return IngestOutcome.RECORDED;
    }
}
