package com.tracelink.metrics;

import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Label set identifying one series of an instrument. Two label sets with the
 * same entries are equal regardless of insertion order.
 */
public final class Labels {

    private static final Labels EMPTY = new Labels(new TreeMap<>());

    private final SortedMap<String, String> entries;

    private Labels(SortedMap<String, String> entries) {
        this.entries = Collections.unmodifiableSortedMap(entries);
    }

    public static Labels empty() {
        return EMPTY;
    }

    public static Labels of(Map<String, String> labels) {
        if (labels == null || labels.isEmpty()) {
            return EMPTY;
        }
        SortedMap<String, String> copy = new TreeMap<>();
        labels.forEach((k, v) -> {
            if (k == null || v == null) {
                throw new IllegalArgumentException("label keys and values must not be null: " + labels);
            }
            copy.put(k, v);
        });
        return new Labels(copy);
    }

    public static Labels of(String... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("labels need key/value pairs");
        }
        SortedMap<String, String> copy = new TreeMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            copy.put(keyValues[i], keyValues[i + 1]);
        }
        return new Labels(copy);
    }

    public Map<String, String> asMap() {
        return entries;
    }

    Tags toTags() {
        List<Tag> tags = new ArrayList<>(entries.size());
        entries.forEach((k, v) -> tags.add(Tag.of(k, v)));
        return Tags.of(tags);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Labels other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
