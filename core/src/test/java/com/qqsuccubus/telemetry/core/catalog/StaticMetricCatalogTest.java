package com.qqsuccubus.telemetry.core.catalog;

import com.qqsuccubus.telemetry.core.model.MetricDef;
import com.qqsuccubus.telemetry.core.model.SensorProfile;
import com.qqsuccubus.telemetry.core.util.JsonUtils;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StaticMetricCatalogTest {

    private final StaticMetricCatalog catalog = StaticMetricCatalog.fromClasspath(StaticMetricCatalog.DEFAULT_RESOURCE);

    @Test
    void testSensorType_StripsSensorPrefix() {
        assertEquals("Mov", SensorTypes.typeOf("SensorMov"));
        assertEquals("Sensor", SensorTypes.typeOf("Sensor"));
        assertEquals("Thermo", SensorTypes.typeOf("Thermo"));
    }

    @Test
    void testMovProfile_LoadedFromResource() {
        SensorProfile profile = catalog.profileFor("SensorMov");

        assertEquals(Arrays.asList("t_ms", "cm", "v_cm_s", "a_cm_s2"),
            Arrays.asList(profile.getRequiredFields().toArray()));
        assertEquals(Arrays.asList("dist_m", "vel_m_s", "acc_m_s2"), profile.metricIds());
        assertEquals(Arrays.asList("dist_m"), profile.defaultMetricIds());

        MetricDef dist = profile.metric("dist_m").orElseThrow();
        assertEquals("cm", dist.getSourceKey());
        assertEquals(0.01, dist.getScale(), 1e-12);
        assertEquals("Sensor de Movimiento", catalog.displayNameFor("SensorMov"));
    }

    @Test
    void testRequiredFields_KeepDeclarationOrder() {
        SensorProfile profile = JsonUtils.readValue(
            "{\"requiredFields\": [\"zeta\", \"cm\", \"alpha\", \"t_ms\", \"mid\", \"cm\"]}",
            SensorProfile.class);

        assertEquals(Arrays.asList("t_ms", "zeta", "cm", "alpha", "mid"),
            Arrays.asList(profile.getRequiredFields().toArray()));
        assertEquals(Arrays.asList("t_ms", "temp_c", "ax", "ay", "az", "gx", "gy", "gz"),
            Arrays.asList(catalog.profileFor("SensorGyro").getRequiredFields().toArray()));
    }

    @Test
    void testUnknownType_FallsBackToTimestampOnlyProfile() {
        SensorProfile profile = catalog.profileFor("SensorUnknown");

        assertTrue(profile.getMetrics().isEmpty());
        assertEquals(1, profile.getRequiredFields().size());
        assertTrue(profile.getRequiredFields().contains("t_ms"));
        assertEquals("avg_dropped", profile.getDroppedCountField());
        assertEquals("SensorUnknown", catalog.displayNameFor("SensorUnknown"));
    }

    @Test
    void testMetricDefaults_ScaleOneAndEnabled() {
        MetricDef metric = MetricDef.builder().id("x").build();

        assertEquals(1.0, metric.getScale());
        assertEquals("x", metric.getSourceKey());
        assertTrue(metric.isDefaultEnabled());
    }

    @Test
    void testDuplicateMetricIds_Rejected() {
        SensorProfile duplicated = SensorProfile.builder()
            .metric(MetricDef.builder().id("a").build())
            .metric(MetricDef.builder().id("a").build())
            .build();

        assertThrows(IllegalArgumentException.class,
            () -> new StaticMetricCatalog(Map.of("Dup", duplicated), null));
    }

    @Test
    void testMissingResource_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> StaticMetricCatalog.fromClasspath("nope.json"));
    }
}
