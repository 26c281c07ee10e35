package com.glottocatalog.model;

/**
 * An institution or catalog that supplied bibliographic records.
 * The id is a slug and doubles as the lookup key for the "src" field of a record.
 */
public record Provider(
    String id,
    String name,
    String description,
    String abbr,
    String url
) {}
