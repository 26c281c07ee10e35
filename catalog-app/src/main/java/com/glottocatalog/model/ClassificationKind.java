package com.glottocatalog.model;

public enum ClassificationKind {
    FAMILY("fc"),
    SUB("sc");

    private final String code;

    ClassificationKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
