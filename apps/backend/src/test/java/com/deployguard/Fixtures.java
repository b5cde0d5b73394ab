package com.deployguard;

import com.deployguard.anomaly.AnomalyDetector;
import com.deployguard.audit.AuditChainRegistry;
import com.deployguard.baseline.GoldenBaselineStore;
import com.deployguard.checksum.ChecksumEngine;
import com.deployguard.config.IntegrityProperties;
import com.deployguard.harness.SnapshotStore;
import com.deployguard.model.Dataset;
import com.deployguard.pipeline.ValidationPipelineFactory;
import com.deployguard.reconcile.Reconciliator;
import com.deployguard.schema.SchemaValidator;
import com.deployguard.storage.AppendOnlyStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Hand-wired components over one store, without a Spring context.
 */
public final class Fixtures {

    public final IntegrityProperties props;
    public final AppendOnlyStore store;
    public final ObjectMapper mapper = new ObjectMapper();
    public final Clock clock = Clock.systemUTC();
    public final List<Object> events = new CopyOnWriteArrayList<>();
    public final ApplicationEventPublisher publisher = events::add;

    public final ChecksumEngine checksums;
    public final SchemaValidator schemaValidator = new SchemaValidator();
    public final Reconciliator reconciliator = new Reconciliator();
    public final AnomalyDetector anomalyDetector;
    public final AuditChainRegistry chains;
    public final GoldenBaselineStore baselines;
    public final SnapshotStore snapshots;
    public final ValidationPipelineFactory pipelines;

    public Fixtures(AppendOnlyStore store) {
        this(store, new IntegrityProperties());
    }

    public Fixtures(AppendOnlyStore store, IntegrityProperties props) {
        this.store = store;
        this.props = props;
        this.checksums = new ChecksumEngine(mapper, props);
        this.anomalyDetector = new AnomalyDetector(props);
        this.chains = new AuditChainRegistry(store, mapper, props, publisher, clock);
        this.baselines = new GoldenBaselineStore(store, checksums, reconciliator, mapper, props, clock);
        this.snapshots = new SnapshotStore(store, mapper, clock);
        this.pipelines = new ValidationPipelineFactory(chains, schemaValidator, checksums,
                anomalyDetector, reconciliator, baselines, snapshots, props, clock);
    }

    public <E extends ApplicationEvent> List<E> events(Class<E> type) {
        List<E> out = new ArrayList<>();
        for (Object e : events) {
            if (type.isInstance(e)) out.add(type.cast(e));
        }
        return out;
    }

    /** {@code n} customer rows with ids 1..n. */
    public static List<Map<String, Object>> customers(int n) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 1; i <= n; i++) rows.add(customer(i, "active", 100 + i));
        return rows;
    }

    public static Map<String, Object> customer(int id, String status, int balance) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", id);
        row.put("email", "user" + id + "@example.com");
        row.put("status", status);
        row.put("balance", balance);
        return row;
    }

    public static Dataset dataset(List<Map<String, Object>> rows) {
        return Dataset.of("id", "test", rows);
    }
}
