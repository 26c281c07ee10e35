package com.glottocatalog.model;

/**
 * Coarse geographic region tag, e.g. "Eurasia" or "South America".
 */
public record MacroArea(
    String id,
    String name,
    String description
) {}
