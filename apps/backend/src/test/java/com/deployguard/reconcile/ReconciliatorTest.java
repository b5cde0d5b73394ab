package com.deployguard.reconcile;

import com.deployguard.model.Dataset;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.deployguard.Fixtures.customers;
import static com.deployguard.Fixtures.dataset;
import static org.assertj.core.api.Assertions.assertThat;

class ReconciliatorTest {

    private final Reconciliator reconciliator = new Reconciliator();

    @Test
    void reconcilingADatasetWithItselfIsEmpty() {
        Dataset a = dataset(customers(25));
        ReconciliationReport report = reconciliator.reconcile(a, a);
        assertThat(report.added()).isEmpty();
        assertThat(report.removed()).isEmpty();
        assertThat(report.changed()).isEmpty();
    }

    @Test
    void onlyDifferingLeafPathsAreReported() {
        Map<String, Object> before = new LinkedHashMap<>();
        before.put("id", 1);
        before.put("address", Map.of("city", "Oslo", "zip", "0150"));
        before.put("items", List.of(Map.of("sku", "a", "qty", 1), Map.of("sku", "b", "qty", 2)));
        before.put("note", "x");

        Map<String, Object> after = new LinkedHashMap<>();
        after.put("id", 1);
        after.put("address", Map.of("city", "Bergen", "zip", "0150"));
        after.put("items", List.of(Map.of("sku", "a", "qty", 1), Map.of("sku", "b", "qty", 3), Map.of("sku", "c", "qty", 1)));
        after.put("tag", "new");

        ReconciliationReport report = reconciliator.reconcile(dataset(List.of(before)), dataset(List.of(after)));

        assertThat(report.changed()).singleElement().satisfies(c -> assertThat(c.fieldDiffs()).containsExactly(
                new FieldDiff("address.city", FieldDiff.Kind.MODIFIED, "Oslo", "Bergen"),
                new FieldDiff("items[1].qty", FieldDiff.Kind.MODIFIED, 2, 3),
                new FieldDiff("items[2]", FieldDiff.Kind.ADDED, null, Map.of("sku", "c", "qty", 1)),
                new FieldDiff("note", FieldDiff.Kind.REMOVED, "x", null),
                new FieldDiff("tag", FieldDiff.Kind.ADDED, null, "new")));
    }

    @Test
    void numericallyEqualValuesAreNotChanges() {
        Dataset a = dataset(List.of(Map.of("id", 1, "v", 10)));
        Dataset b = dataset(List.of(Map.of("id", 1, "v", 10.0)));
        assertThat(reconciliator.reconcile(a, b).isEmpty()).isTrue();
    }

    @Test
    void addedAndRemovedAreSortedIdentities() {
        ReconciliationReport report = reconciliator.reconcile(dataset(customers(3)),
                dataset(List.of(customers(5).get(4), customers(5).get(3), customers(3).get(0))));
        assertThat(report.added()).containsExactly("4", "5");
        assertThat(report.removed()).containsExactly("2", "3");
        assertThat(report.differenceCount()).isEqualTo(4);
    }

    @Test
    void checksumReconciliationHasNoFieldDiffs() {
        ReconciliationReport report = reconciliator.reconcileChecksums(
                Map.of("1", "aa", "2", "bb"), Map.of("2", "cc", "3", "dd"));
        assertThat(report.added()).containsExactly("3");
        assertThat(report.removed()).containsExactly("1");
        assertThat(report.changed()).containsExactly(new RecordChange("2", List.of()));
    }
}
