package com.glottocatalog.model;

import java.util.Locale;

public enum LanguoidLevel {
    FAMILY,
    LANGUAGE,
    DIALECT;

    public static LanguoidLevel fromValue(String value) {
        if (value == null) {
            return null;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
