package com.qqsuccubus.telemetry.station.selection;

import com.qqsuccubus.telemetry.core.model.MetricDef;
import lombok.Value;

/**
 * A catalog metric of a sensor together with whether it is currently active.
 */
@Value
public class ChannelState {
    MetricDef metric;
    boolean active;
}
