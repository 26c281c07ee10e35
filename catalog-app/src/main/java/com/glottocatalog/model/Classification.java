package com.glottocatalog.model;

import java.util.List;

/**
 * Reference backed assertion supporting the placement of a languoid in the tree.
 */
public record Classification(
    Long languoidPk,
    ClassificationKind kind,
    String description,
    List<CitedReference> references
) {
    public boolean hasDescription() {
        return description != null && !description.isBlank();
    }
}
