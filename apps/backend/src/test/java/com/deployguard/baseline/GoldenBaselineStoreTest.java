package com.deployguard.baseline;

import com.deployguard.Fixtures;
import com.deployguard.config.IntegrityProperties;
import com.deployguard.model.Dataset;
import com.deployguard.reconcile.FieldDiff;
import com.deployguard.reconcile.ReconciliationReport;
import com.deployguard.storage.impl.FileSystemAppendOnlyStore;
import com.deployguard.storage.impl.InMemoryAppendOnlyStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.deployguard.Fixtures.customer;
import static com.deployguard.Fixtures.customers;
import static com.deployguard.Fixtures.dataset;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GoldenBaselineStoreTest {

    @Test
    void versionsGrowMonotonicallyPerName() {
        GoldenBaselineStore store = new Fixtures(new InMemoryAppendOnlyStore()).baselines;
        GoldenBaseline v1 = store.create("orders", dataset(customers(3)), "first");
        GoldenBaseline v2 = store.create("orders", dataset(customers(4)), "second");
        GoldenBaseline other = store.create("users", dataset(customers(1)), "other");

        assertThat(v1.version()).isEqualTo(1);
        assertThat(v2.version()).isEqualTo(2);
        assertThat(other.version()).isEqualTo(1);
        assertThat(store.versions("orders")).containsExactly(1, 2);
        assertThat(store.names()).containsExactly("orders", "users");
    }

    @Test
    void namesDifferingOnlyInPunctuationAreSeparateBaselines() {
        GoldenBaselineStore store = new Fixtures(new InMemoryAppendOnlyStore()).baselines;
        GoldenBaseline slash = store.create("orders/eu", dataset(customers(2)), "slash");
        GoldenBaseline underscore = store.create("orders_eu", dataset(customers(5)), "underscore");

        assertThat(slash.version()).isEqualTo(1);
        assertThat(underscore.version()).isEqualTo(1);
        assertThat(store.get("orders_eu").name()).isEqualTo("orders_eu");
        assertThat(store.get("orders/eu").description()).isEqualTo("slash");
        assertThat(store.names()).containsExactlyInAnyOrder("orders/eu", "orders_eu");
    }

    @Test
    void getReturnsLatestOrRequestedVersion() {
        GoldenBaselineStore store = new Fixtures(new InMemoryAppendOnlyStore()).baselines;
        store.create("orders", dataset(customers(3)), "first");
        store.create("orders", dataset(customers(4)), "second");

        assertThat(store.get("orders").description()).isEqualTo("second");
        assertThat(store.get("orders", 1).description()).isEqualTo("first");
        assertThat(store.get("orders", 1).leafChecksums()).hasSize(3);
        assertThatThrownBy(() -> store.get("orders", 3)).isInstanceOf(BaselineNotFoundException.class);
        assertThatThrownBy(() -> store.get("missing")).isInstanceOf(BaselineNotFoundException.class);
    }

    @Test
    void baselinesSurviveReopeningTheStore(@TempDir Path dir) {
        Dataset d = dataset(customers(5));
        GoldenBaseline created = new Fixtures(new FileSystemAppendOnlyStore(dir)).baselines
                .create("orders", d, "persisted");

        GoldenBaseline loaded = new Fixtures(new FileSystemAppendOnlyStore(dir)).baselines.get("orders");

        assertThat(loaded.rootChecksum()).isEqualTo(created.rootChecksum());
        assertThat(loaded.leafChecksums()).isEqualTo(created.leafChecksums());
        assertThat(loaded.stats()).isEqualTo(created.stats());
        assertThat(loaded.createdAt()).isEqualTo(created.createdAt());
        assertThat(loaded.records()).containsOnlyKeys("1", "2", "3", "4", "5");
    }

    @Test
    void compareReportsFieldLevelDifferences() {
        GoldenBaselineStore store = new Fixtures(new InMemoryAppendOnlyStore()).baselines;
        GoldenBaseline baseline = store.create("orders", dataset(customers(3)), "gold");

        List<Map<String, Object>> rows = new ArrayList<>(customers(3));
        rows.set(1, customer(2, "inactive", 102));
        rows.remove(2);
        rows.add(customer(9, "active", 109));

        ReconciliationReport report = store.compare(dataset(rows), baseline);

        assertThat(report.added()).containsExactly("9");
        assertThat(report.removed()).containsExactly("3");
        assertThat(report.changed()).singleElement().satisfies(c -> {
            assertThat(c.identity()).isEqualTo("2");
            assertThat(c.fieldDiffs()).containsExactly(
                    new FieldDiff("status", FieldDiff.Kind.MODIFIED, "active", "inactive"));
        });
        assertThat(store.compare(dataset(customers(3)), baseline).isEmpty()).isTrue();
    }

    @Test
    void checksumOnlyBaselinesCompareByLeaves() {
        IntegrityProperties props = new IntegrityProperties();
        props.getBaseline().setStoreRecords(false);
        GoldenBaselineStore store = new Fixtures(new InMemoryAppendOnlyStore(), props).baselines;
        GoldenBaseline baseline = store.create("orders", dataset(customers(3)), "gold");

        List<Map<String, Object>> rows = new ArrayList<>(customers(3));
        rows.set(0, customer(1, "inactive", 101));
        ReconciliationReport report = store.compare(dataset(rows), baseline);

        assertThat(baseline.hasRecords()).isFalse();
        assertThat(report.changed()).singleElement().satisfies(c -> {
            assertThat(c.identity()).isEqualTo("1");
            assertThat(c.fieldDiffs()).isEmpty();
        });
    }
}
