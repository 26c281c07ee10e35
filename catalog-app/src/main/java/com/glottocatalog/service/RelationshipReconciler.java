package com.glottocatalog.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Set based reconciliation of many-to-many links.
 */
public final class RelationshipReconciler {

    private RelationshipReconciler() {
    }

    public static <T> Reconciliation<T> reconcile(Collection<T> existing, Collection<T> desired) {
        return reconcile(existing, desired, ReconciliationPolicy.ADDITIVE_ONLY);
    }

    /**
     * Computes the members of {@code desired} missing from {@code existing}, in the order
     * of {@code desired} and without duplicates, and whether {@code existing} holds members
     * that {@code desired} lacks.
     */
    public static <T> Reconciliation<T> reconcile(Collection<T> existing, Collection<T> desired,
                                                  ReconciliationPolicy policy) {
        Set<T> present = new LinkedHashSet<>(existing);
        Set<T> wanted = new LinkedHashSet<>(desired);

        List<T> added = new ArrayList<>();
        for (T member : wanted) {
            if (member != null && !present.contains(member)) {
                added.add(member);
            }
        }
        boolean removed = false;
        for (T member : present) {
            if (!wanted.contains(member)) {
                removed = true;
                break;
            }
        }
        return switch (policy) {
            case ADDITIVE_ONLY -> new Reconciliation<>(added, removed);
        };
    }

    /**
     * @param added   members to link
     * @param removed true if some existing link is not wanted any more; informational only
     */
    public record Reconciliation<T>(List<T> added, boolean removed) {

        public boolean hasAdditions() {
            return !added.isEmpty();
        }
    }
}
