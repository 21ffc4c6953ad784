package com.qqsuccubus.telemetry.station.selection;

import com.qqsuccubus.telemetry.core.catalog.MetricCatalog;
import com.qqsuccubus.telemetry.core.error.InvalidSelectionException;
import com.qqsuccubus.telemetry.core.error.SubscriptionException;
import com.qqsuccubus.telemetry.core.model.MetricDef;
import com.qqsuccubus.telemetry.core.model.QualifiedMetricId;
import com.qqsuccubus.telemetry.core.model.SensorProfile;
import com.qqsuccubus.telemetry.core.msg.Topics;
import com.qqsuccubus.telemetry.station.metrics.MetricsService;
import com.qqsuccubus.telemetry.station.mqtt.ITelemetryTransport;
import com.qqsuccubus.telemetry.station.state.ActiveSelection;
import com.qqsuccubus.telemetry.station.state.TelemetryStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Owns the active sensor/metric selection and keeps transport subscriptions in line with it.
 * <p>
 * Responsibilities:
 * - Normalize sensor selections and reset measurement state when the sensor set changes
 * - Resolve qualified metric ids through the catalog, honoring channel restrictions
 * - Diff data topics and drive subscribe/unsubscribe on the transport
 * </p>
 * <p>
 * Subscription failures are logged and counted; the selection is updated optimistically and
 * the failed topic is only retried when the measurement connection (re)connects.
 * </p>
 * <p>
 * Topic diffs are computed and sent to the transport under a dedicated subscription lock, so
 * transport calls from concurrent selection changes reach the broker in the order the
 * selections were installed. Lock order is subscription lock, then the state lock; transport
 * calls never run under the state lock.
 * </p>
 */
public class SelectionManager {
    private static final Logger log = LoggerFactory.getLogger(SelectionManager.class);

    private final TelemetryStateStore store;
    private final MetricCatalog catalog;
    private final ITelemetryTransport transport;
    private final MetricsService metricsService;
    private final String topicPrefix;
    private final ReentrantLock subscriptionLock = new ReentrantLock();

    public SelectionManager(TelemetryStateStore store,
                            MetricCatalog catalog,
                            ITelemetryTransport transport,
                            MetricsService metricsService,
                            String topicPrefix) {
        this.store = store;
        this.catalog = catalog;
        this.transport = transport;
        this.metricsService = metricsService;
        this.topicPrefix = topicPrefix;
    }

    /**
     * Replaces the selected sensors.
     * <p>
     * Duplicates and blank ids are dropped, first-seen order is kept. An empty result is ignored.
     * If the resulting <i>set</i> differs from the current one, live buffers, the last-value cache
     * and the session are reset before the new selection is installed.
     * </p>
     *
     * @param sensorIds Sensors to observe
     */
    public void setSensors(List<String> sensorIds) {
        List<String> normalized = normalize(sensorIds);
        if (normalized.isEmpty()) {
            log.debug("Ignoring empty sensor selection");
            return;
        }
        applySensors(previous -> normalized);
    }

    /**
     * Removes sensors from the selection, e.g. after discovery evicted them as stale.
     * May leave the selection empty.
     *
     * @param sensorIds Sensors to drop; ids that are not selected are ignored
     */
    public void dropSensors(Collection<String> sensorIds) {
        Set<String> dropped = new HashSet<>(sensorIds);
        applySensors(previous -> {
            List<String> remaining = new ArrayList<>(previous);
            remaining.removeAll(dropped);
            return remaining;
        });
    }

    /**
     * Restricts the active metrics of a selected sensor.
     * <p>
     * Never resets the session: a running recording continues and only buffer columns are added
     * or removed. Ids unknown to the sensor's profile are ignored.
     * </p>
     *
     * @param sensorId  Selected sensor
     * @param metricIds Metric ids (unqualified) to keep active
     * @throws InvalidSelectionException if the sensor is not selected or no known metric remains;
     *                                   the previous selection is kept
     */
    public void setChannels(String sensorId, Collection<String> metricIds) {
        SensorProfile profile = catalog.profileFor(sensorId);
        Set<String> requested = metricIds != null ? new HashSet<>(metricIds) : new HashSet<>();
        Set<String> resolved = new LinkedHashSet<>();
        for (MetricDef metric : profile.getMetrics()) {
            if (requested.contains(metric.getId())) {
                resolved.add(metric.getId());
            }
        }

        store.runLocked(() -> {
            ActiveSelection current = store.getSelection();
            if (!current.isSelected(sensorId)) {
                throw new InvalidSelectionException("Sensor " + sensorId + " is not selected");
            }
            if (resolved.isEmpty()) {
                throw new InvalidSelectionException(
                    "Sensor " + sensorId + " must keep at least one active metric, requested " + requested);
            }
            Map<String, Set<String>> channels = new LinkedHashMap<>(current.getChannelMap());
            channels.put(sensorId, resolved);
            store.install(resolve(current.getSelectedSensors(), channels));
        });
        log.info("Channels for {} set to {}", sensorId, resolved);
    }

    /**
     * @return Currently selected sensors, in selection order
     */
    public List<String> selectedSensors() {
        return store.withLock(() -> store.getSelection().getSelectedSensors());
    }

    /**
     * @return Data topics the measurement connection should be subscribed to
     */
    public List<String> currentTopics() {
        return store.withLock(() -> new ArrayList<>(store.getSelection().getTopics().values()));
    }

    /**
     * @return Catalog metrics of a sensor with their current active flag
     */
    public List<ChannelState> channelsFor(String sensorId) {
        SensorProfile profile = catalog.profileFor(sensorId);
        ActiveSelection selection = store.withLock(store::getSelection);
        List<ChannelState> channels = new ArrayList<>();
        for (MetricDef metric : profile.getMetrics()) {
            boolean active = selection.isSelected(sensorId) && selection.isChannelActive(sensorId, metric.getId());
            channels.add(new ChannelState(metric, active));
        }
        return channels;
    }

    /**
     * Subscribes every current data topic again. Called after the measurement connection
     * (re)connects, which is the only retry path for earlier subscription failures.
     */
    public void resubscribeAll() {
        subscriptionLock.lock();
        try {
            List<String> topics = currentTopics();
            log.info("Restoring {} data subscriptions", topics.size());
            for (String topic : topics) {
                subscribe(topic);
            }
        } finally {
            subscriptionLock.unlock();
        }
    }

    private void applySensors(UnaryOperator<List<String>> nextSensors) {
        subscriptionLock.lock();
        try {
            applyDiff(installSensors(nextSensors));
        } finally {
            subscriptionLock.unlock();
        }
    }

    private TopicDiff installSensors(UnaryOperator<List<String>> nextSensors) {
        return store.withLock(() -> {
            ActiveSelection previous = store.getSelection();
            List<String> next = nextSensors.apply(previous.getSelectedSensors());
            boolean setChanged = !new HashSet<>(previous.getSelectedSensors()).equals(new HashSet<>(next));
            if (setChanged) {
                store.resetMeasurement();
                metricsService.recordSelectionReset();
                log.info("Sensor set changed {} -> {}, measurement state reset",
                    previous.getSelectedSensors(), next);
            }

            Map<String, Set<String>> channels = new LinkedHashMap<>();
            for (String sensorId : next) {
                Set<String> restriction = previous.getChannelMap().get(sensorId);
                if (restriction != null) {
                    channels.put(sensorId, restriction);
                }
            }
            ActiveSelection installed = resolve(next, channels);
            store.install(installed);
            return TopicDiff.between(previous.getTopics().values(), installed.getTopics().values());
        });
    }

    private ActiveSelection resolve(List<String> sensors, Map<String, Set<String>> channels) {
        Map<String, String> topics = new LinkedHashMap<>();
        List<String> qualifiedIds = new ArrayList<>();
        for (String sensorId : sensors) {
            topics.put(sensorId, Topics.dataTopicFor(topicPrefix, sensorId));
            Set<String> restriction = channels.get(sensorId);
            for (MetricDef metric : catalog.profileFor(sensorId).getMetrics()) {
                if (restriction == null || restriction.contains(metric.getId())) {
                    qualifiedIds.add(QualifiedMetricId.of(sensorId, metric.getId()));
                }
            }
        }
        return new ActiveSelection(sensors, channels, topics, qualifiedIds);
    }

    private void applyDiff(TopicDiff diff) {
        if (diff.isEmpty()) {
            return;
        }
        log.info("Subscription diff: unsubscribe={}, subscribe={}", diff.getToUnsubscribe(), diff.getToSubscribe());
        for (String topic : diff.getToUnsubscribe()) {
            try {
                transport.unsubscribe(topic);
            } catch (SubscriptionException e) {
                metricsService.recordUnsubscribeFailure();
                log.warn("Failed to unsubscribe from {}", topic, e);
            }
        }
        for (String topic : diff.getToSubscribe()) {
            subscribe(topic);
        }
    }

    private void subscribe(String topic) {
        try {
            transport.subscribe(topic);
        } catch (SubscriptionException e) {
            metricsService.recordSubscribeFailure();
            log.warn("Failed to subscribe to {}", topic, e);
        }
    }

    private static List<String> normalize(List<String> sensorIds) {
        Set<String> unique = new LinkedHashSet<>();
        if (sensorIds != null) {
            for (String sensorId : sensorIds) {
                if (sensorId != null && !sensorId.isBlank()) {
                    unique.add(sensorId);
                }
            }
        }
        return new ArrayList<>(unique);
    }
}
