package com.deployguard.pipeline;

import com.deployguard.anomaly.AnomalyDetector;
import com.deployguard.audit.AuditChainRegistry;
import com.deployguard.baseline.GoldenBaselineStore;
import com.deployguard.checksum.ChecksumEngine;
import com.deployguard.config.IntegrityProperties;
import com.deployguard.harness.SnapshotStore;
import com.deployguard.model.Dataset;
import com.deployguard.reconcile.Reconciliator;
import com.deployguard.schema.SchemaValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Creates one {@link ValidationPipeline} per deployment session. Sessions on different chains
 * run fully in parallel; sessions sharing a chain id are serialized by that chain's lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ValidationPipelineFactory {

    private final AuditChainRegistry chains;
    private final SchemaValidator schemaValidator;
    private final ChecksumEngine checksums;
    private final AnomalyDetector anomalyDetector;
    private final Reconciliator reconciliator;
    private final GoldenBaselineStore baselines;
    private final SnapshotStore snapshots;
    private final IntegrityProperties props;
    private final Clock clock;

    /** New session on its own chain {@code session-<id>}. */
    public ValidationPipeline create() {
        String sessionId = UUID.randomUUID().toString();
        return create("session-" + sessionId, sessionId);
    }

    /** New session appending to the shared chain {@code chainId}. */
    public ValidationPipeline create(String chainId) {
        return create(chainId, UUID.randomUUID().toString());
    }

    /** Dataset keyed by the configured {@code integrity.pipeline.identity-field}. */
    public Dataset dataset(String source, List<Map<String, Object>> rows) {
        return Dataset.of(props.getPipeline().getIdentityField(), source, rows);
    }

    private ValidationPipeline create(String chainId, String sessionId) {
        log.debug("[PIPELINE] new session={} chain={}", sessionId, chainId);
        return new ValidationPipeline(sessionId, chains.chain(chainId), schemaValidator, checksums,
                anomalyDetector, reconciliator, baselines, snapshots, props, clock);
    }
}
