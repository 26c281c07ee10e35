package com.glottocatalog.service;

/**
 * How links between a reference and a vocabulary are reconciled with a newly computed set.
 */
public enum ReconciliationPolicy {

    /**
     * New members are appended, existing links are never removed. Tags accumulate across
     * import runs so that one incomplete provider file cannot erase curated links.
     */
    ADDITIVE_ONLY
}
