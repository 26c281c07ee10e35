package com.glottocatalog.service;

public enum ImportMode {
    /** Only references with unknown keys are created, known keys are skipped. */
    INSERT,
    /** Every reference is created or diffed against its stored version. */
    UPDATE
}
