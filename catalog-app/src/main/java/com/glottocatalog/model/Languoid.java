package com.glottocatalog.model;

/**
 * A node of the genealogical language tree.
 *
 * fatherPk is null only for top-level families. familyPk points at the root of the
 * father chain and is null for the roots themselves.
 */
public record Languoid(
    Long pk,
    String id,
    String name,
    LanguoidLevel level,
    String hid,
    boolean active,
    boolean bookkeeping,
    Long fatherPk,
    Long familyPk,
    String macroareas,
    Integer childLanguageCount
) {
    /**
     * The pk of the top-level family this languoid belongs to, itself for roots.
     */
    public Long rootPk() {
        return familyPk != null ? familyPk : pk;
    }
}
