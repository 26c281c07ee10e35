package com.glottocatalog.service;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Field level changes of one import run: reference id -> field name -> [old, new].
 * Serializes to exactly that JSON object. An absent value is written as an empty string.
 */
public class ChangeLog {

    private final Map<String, Map<String, List<String>>> entries = new LinkedHashMap<>();

    public void record(String referenceId, String field, Object oldValue, Object newValue) {
        entries.computeIfAbsent(referenceId, k -> new LinkedHashMap<>())
            .put(field, List.of(stringValue(oldValue), stringValue(newValue)));
    }

    public boolean contains(String referenceId) {
        return entries.containsKey(referenceId);
    }

    public Map<String, List<String>> changesFor(String referenceId) {
        return entries.getOrDefault(referenceId, Map.of());
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @JsonValue
    public Map<String, Map<String, List<String>>> asMap() {
        return Collections.unmodifiableMap(entries);
    }

    private static String stringValue(Object value) {
        return value != null ? value.toString() : "";
    }
}
