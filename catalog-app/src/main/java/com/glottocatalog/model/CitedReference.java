package com.glottocatalog.model;

/**
 * A reference cited as justification for a classification.
 */
public record CitedReference(
    Long refPk,
    String name,
    Integer yearInt,
    String description
) {
    public int sortYear() {
        return yearInt != null ? yearInt : 0;
    }
}
