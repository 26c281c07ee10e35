package com.glottocatalog.service;

import com.glottocatalog.service.RelationshipReconciler.Reconciliation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RelationshipReconcilerTest {

    @Test
    void addsMissingMembersAndKeepsExistingOnes() {
        Reconciliation<String> result = RelationshipReconciler.reconcile(List.of("A", "B"), List.of("B", "C"));

        assertThat(result.added()).containsExactly("C");
        assertThat(result.removed()).isTrue();
    }

    @Test
    void reportsNothingWhenDesiredIsAlreadyPresent() {
        Reconciliation<String> result = RelationshipReconciler.reconcile(List.of("A", "B"), List.of("A", "B"));

        assertThat(result.hasAdditions()).isFalse();
        assertThat(result.removed()).isFalse();
    }

    @Test
    void neverRemovesWhenDesiredIsEmpty() {
        Reconciliation<String> result = RelationshipReconciler.reconcile(List.of("A"), List.of());

        assertThat(result.added()).isEmpty();
        assertThat(result.removed()).isTrue();
        assertThat(result.hasAdditions()).isFalse();
    }

    @Test
    void deduplicatesInDesiredOrder() {
        Reconciliation<String> result = RelationshipReconciler.reconcile(
                List.of(), List.of("C", "A", "C", "B", "A"), ReconciliationPolicy.ADDITIVE_ONLY);

        assertThat(result.added()).containsExactly("C", "A", "B");
    }
}
