package com.qqsuccubus.telemetry.station.selection;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Subscriptions to drop and to add when moving from one topic set to another. Topics present in
 * both are left alone so in-flight messages on them are never lost.
 */
@Value
public class TopicDiff {
    List<String> toUnsubscribe;
    List<String> toSubscribe;

    public static TopicDiff between(Collection<String> before, Collection<String> after) {
        Set<String> beforeSet = new HashSet<>(before);
        Set<String> afterSet = new HashSet<>(after);

        List<String> removed = new ArrayList<>();
        for (String topic : before) {
            if (!afterSet.contains(topic) && !removed.contains(topic)) {
                removed.add(topic);
            }
        }
        List<String> added = new ArrayList<>();
        for (String topic : after) {
            if (!beforeSet.contains(topic) && !added.contains(topic)) {
                added.add(topic);
            }
        }
        return new TopicDiff(Collections.unmodifiableList(removed), Collections.unmodifiableList(added));
    }

    public boolean isEmpty() {
        return toUnsubscribe.isEmpty() && toSubscribe.isEmpty();
    }
}
