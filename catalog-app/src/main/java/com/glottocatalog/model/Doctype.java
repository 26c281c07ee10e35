package com.glottocatalog.model;

public record Doctype(
    String id,
    String name,
    String abbr,
    Integer ord
) {}
