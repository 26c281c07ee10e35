package com.glottocatalog.service;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Counters and change log of one import run.
 */
public class ImportSummary {

    private int processed;
    private int created;
    private int changed;
    private int skippedSparse;
    private int skippedKnown;
    private final Map<String, Map<String, Integer>> unresolved = new TreeMap<>();
    private final ChangeLog changeLog = new ChangeLog();

    void recordProcessed() { processed++; }
    void recordCreated() { created++; }
    void recordChanged() { changed++; }
    void recordSkippedSparse() { skippedSparse++; }
    void recordSkippedKnown() { skippedKnown++; }

    void recordUnresolved(String kind, String tag) {
        unresolved.computeIfAbsent(kind, k -> new TreeMap<>()).merge(tag, 1, Integer::sum);
    }

    public int getProcessed() { return processed; }
    public int getCreated() { return created; }
    public int getChanged() { return changed; }
    public int getSkippedSparse() { return skippedSparse; }
    public int getSkippedKnown() { return skippedKnown; }
    public ChangeLog getChangeLog() { return changeLog; }

    /**
     * Tags that matched no vocabulary entry: kind (macroarea, provider, doctype, languoid)
     * -> tag -> number of occurrences.
     */
    public Map<String, Map<String, Integer>> getUnresolved() {
        return Collections.unmodifiableMap(unresolved);
    }

    public int unresolvedCount(String kind) {
        return unresolved.getOrDefault(kind, Map.of()).values().stream().mapToInt(Integer::intValue).sum();
    }

    @Override
    public String toString() {
        return "ImportSummary{processed=" + processed + ", created=" + created + ", changed=" + changed
            + ", skippedSparse=" + skippedSparse + ", skippedKnown=" + skippedKnown
            + ", unresolved=" + unresolved + "}";
    }
}
