package com.glottocatalog.model;

import java.util.Map;

/**
 * A raw entry from a bibliographic source: entry type, citation key and its fields.
 * Field names are lower case, values are the raw (still escaped) text.
 */
public record BibRecord(
    String type,
    String key,
    Map<String, String> fields
) {
    public String get(String field) {
        return fields.get(field);
    }

    public int populatedFieldCount() {
        int count = 0;
        for (String value : fields.values()) {
            if (value != null && !value.isBlank()) count++;
        }
        return count;
    }
}
