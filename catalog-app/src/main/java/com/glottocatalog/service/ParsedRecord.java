package com.glottocatalog.service;

import com.glottocatalog.model.ReferenceField;

import java.util.Map;

/**
 * A source record mapped onto the canonical schema, ready to be merged.
 *
 * @param pk      permanent identifier of the reference
 * @param values  canonical values, typed as declared by each {@link ReferenceField}
 * @param sideBag fields without a canonical target, always including "bibtexkey"
 */
public record ParsedRecord(
    long pk,
    Map<ReferenceField, Object> values,
    Map<String, String> sideBag
) {
    public String get(ReferenceField field) {
        Object value = values.get(field);
        return value != null ? value.toString() : null;
    }

    public String sideBagValue(String key) {
        return sideBag.getOrDefault(key, "");
    }
}
