package com.deployguard.pipeline;

import com.deployguard.anomaly.AnomalyDetector;
import com.deployguard.anomaly.AnomalyFinding;
import com.deployguard.anomaly.AnomalyThresholds;
import com.deployguard.audit.AuditChain;
import com.deployguard.audit.AuditEntry;
import com.deployguard.audit.dto.AuditVerifyReport;
import com.deployguard.baseline.BaselineNotFoundException;
import com.deployguard.baseline.GoldenBaseline;
import com.deployguard.baseline.GoldenBaselineStore;
import com.deployguard.checksum.ChangeStatus;
import com.deployguard.checksum.ChecksumDiff;
import com.deployguard.checksum.ChecksumEngine;
import com.deployguard.checksum.DatasetDigest;
import com.deployguard.checksum.DatasetStats;
import com.deployguard.config.IntegrityProperties;
import com.deployguard.harness.SnapshotComparison;
import com.deployguard.harness.SnapshotStore;
import com.deployguard.harness.TestHarness;
import com.deployguard.harness.TestResult;
import com.deployguard.harness.TestRunReport;
import com.deployguard.model.DataRecord;
import com.deployguard.model.Dataset;
import com.deployguard.model.Finding;
import com.deployguard.model.FindingCategory;
import com.deployguard.model.Severity;
import com.deployguard.model.ValidationResult;
import com.deployguard.reconcile.Reconciliator;
import com.deployguard.schema.DatasetSchema;
import com.deployguard.schema.SchemaValidator;
import com.deployguard.storage.StorageFailureException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Two-phase validation around one deployment action, for one session and one audit chain.
 * <p>
 * PRE validates the input and remembers its checksums and statistics; POST compares the
 * action's output against them and decides whether to roll back. Each phase appends exactly one
 * audit entry, on the calling thread, summarizing every finding gathered, including when a hard
 * failure cut the phase short. Baselines and snapshots are written on the calling thread once
 * PRE's checks have finished in time, never by a check that was abandoned on timeout. The
 * pipeline never performs the rollback itself.
 * <p>
 * Instances come from {@link ValidationPipelineFactory}; phases of one instance are serialized.
 */
@Slf4j
public class ValidationPipeline {

    private final String sessionId;
    private final AuditChain audit;
    private final SchemaValidator schemaValidator;
    private final ChecksumEngine checksums;
    private final AnomalyDetector anomalyDetector;
    private final Reconciliator reconciliator;
    private final GoldenBaselineStore baselines;
    private final SnapshotStore snapshots;
    private final IntegrityProperties.Pipeline props;
    private final String defaultActor;
    private final Clock clock;

    private volatile PipelineState state = PipelineState.IDLE;

    // captured by a passing PRE phase
    private PreOptions preOptions;
    private DatasetDigest preDigest;
    private DatasetStats preStats;
    private Map<String, DataRecord> preRecords;

    ValidationPipeline(String sessionId,
                       AuditChain audit,
                       SchemaValidator schemaValidator,
                       ChecksumEngine checksums,
                       AnomalyDetector anomalyDetector,
                       Reconciliator reconciliator,
                       GoldenBaselineStore baselines,
                       SnapshotStore snapshots,
                       IntegrityProperties props,
                       Clock clock) {
        this.sessionId = sessionId;
        this.audit = audit;
        this.schemaValidator = schemaValidator;
        this.checksums = checksums;
        this.anomalyDetector = anomalyDetector;
        this.reconciliator = reconciliator;
        this.baselines = baselines;
        this.snapshots = snapshots;
        this.props = props.getPipeline();
        this.defaultActor = props.getAudit().getDefaultActor();
        this.clock = clock;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getChainId() {
        return audit.getChainId();
    }

    public PipelineState getState() {
        return state;
    }

    // ---------------------------------------------------------------- PRE

    public PhaseReport runPre(Dataset dataset) {
        return runPre(dataset, PreOptions.defaults());
    }

    public PhaseReport runPre(Dataset dataset, Set<String> scope) {
        return runPre(dataset, PreOptions.builder().scope(scope).build());
    }

    public synchronized PhaseReport runPre(Dataset dataset, PreOptions options) {
        requireState(PipelineState.IDLE, "runPre");
        PreOptions opts = options == null ? PreOptions.defaults() : options;
        Instant started = clock.instant();
        log.info("[PIPELINE] session={} PRE start: {} record(s) from '{}', scope={}",
                sessionId, dataset.size(), dataset.source(), opts.scope().size());
        try {
            PhaseWork work = timed(() -> preChecks(dataset, opts),
                    firstNonNull(opts.timeout(), props.getPreTimeout()), Phase.PRE);
            if (!work.timedOut && !work.hardStop()) {
                capture(dataset, opts, work);
            }
            PipelineState next = work.status() == PhaseStatus.PASSED ? PipelineState.READY : PipelineState.ABORTED;
            PhaseReport report = finish(Phase.PRE, work, actorOf(opts.actor()), started, next);
            if (next == PipelineState.READY) {
                preOptions = opts;
                preDigest = work.digest;
                preStats = work.stats;
                preRecords = dataset.byIdentity();
            }
            return report;
        } catch (StorageFailureException e) {
            throw abort(Phase.PRE, e);
        }
    }

    public Mono<PhaseReport> runPreAsync(Dataset dataset, PreOptions options) {
        return Mono.fromCallable(() -> runPre(dataset, options))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private PhaseWork preChecks(Dataset dataset, PreOptions opts) {
        PhaseWork w = new PhaseWork();

        if (opts.schema() != null) {
            w.add(schemaValidator.validate(dataset, opts.schema()));
            if (w.hardStop()) return w;
        }

        w.digest = checksums.digest(dataset);

        checkCompleteness(dataset, requiredFields(dataset, opts), w);
        if (w.hardStop()) return w;

        for (String id : w.digest.duplicates()) {
            w.error(Finding.error(FindingCategory.DUPLICATE_IDENTITY, id,
                    "identity '" + id + "' occurs more than once"));
        }
        if (w.hardStop()) return w;

        runHarness(opts.harness(), dataset, w);

        w.stats = checksums.stats(dataset);
        return w;
    }

    /** Baseline and snapshot writes of a PRE whose checks completed. */
    private void capture(Dataset dataset, PreOptions opts, PhaseWork w) {
        if (opts.createBaseline() && opts.baselineName() != null) {
            if (w.errors.isEmpty()) {
                baselines.create(opts.baselineName(), dataset,
                        opts.baselineDescription() == null ? "captured by session " + sessionId : opts.baselineDescription());
            } else {
                log.warn("[PIPELINE] session={} not creating baseline '{}': PRE has {} error(s)",
                        sessionId, opts.baselineName(), w.errors.size());
            }
        }

        if (opts.snapshotName() != null) {
            List<Object> values = recordValues(dataset);
            if (!snapshots.createIfAbsent(opts.snapshotName(), values)) {
                SnapshotComparison cmp = snapshots.compare(opts.snapshotName(), values);
                if (!cmp.matches()) w.warning(snapshotMismatch(cmp));
            }
        }
    }

    // ---------------------------------------------------------------- POST

    public PhaseReport runPost(Dataset result) {
        return runPost(result, PostOptions.defaults());
    }

    public synchronized PhaseReport runPost(Dataset result, PostOptions options) {
        requireState(PipelineState.READY, "runPost");
        PostOptions opts = options == null ? PostOptions.defaults() : options;
        Instant started = clock.instant();
        log.info("[PIPELINE] session={} POST start: {} record(s) from '{}'", sessionId, result.size(), result.source());
        try {
            PhaseWork work = timed(() -> postChecks(result, opts),
                    firstNonNull(opts.timeout(), props.getPostTimeout()), Phase.POST);
            return finishPost(work, opts, started);
        } catch (StorageFailureException e) {
            throw abort(Phase.POST, e);
        }
    }

    public Mono<PhaseReport> runPostAsync(Dataset result, PostOptions options) {
        return Mono.fromCallable(() -> runPost(result, options))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private PhaseWork postChecks(Dataset result, PostOptions opts) {
        PhaseWork w = new PhaseWork();

        DatasetSchema schema = firstNonNull(opts.schema(), preOptions.schema());
        if (schema != null) {
            w.add(schemaValidator.validate(result, schema));
            if (w.hardStop()) return w;
        }

        w.digest = checksums.digest(result);
        for (String id : w.digest.duplicates()) {
            w.warning(Finding.warning(FindingCategory.DUPLICATE_IDENTITY, id,
                    "identity '" + id + "' occurs more than once in the result"));
        }

        w.diff = checksums.diff(preDigest, w.digest, preOptions.scope());
        for (ChecksumDiff.Entry e : w.diff.violations()) {
            String what = e.status() == ChangeStatus.REMOVED ? "removed" : "changed";
            w.error(Finding.error(FindingCategory.CHECKSUM_SCOPE_VIOLATION, e.identity(),
                    "record " + what + " outside declared scope"));
        }
        for (ChecksumDiff.Entry e : w.diff.unscopedAdditions()) {
            if (props.isUnscopedAdditionsAreViolations()) {
                w.error(Finding.error(FindingCategory.CHECKSUM_SCOPE_VIOLATION, e.identity(),
                        "record added outside declared scope"));
            } else {
                w.warning(Finding.warning(FindingCategory.UNSCOPED_ADDITION, e.identity(),
                        "record added outside declared scope"));
            }
        }

        w.reconciliation = reconciliator.reconcile(preRecords, result.byIdentity());

        w.stats = checksums.stats(result);
        AnomalyThresholds thresholds = firstNonNull(opts.thresholds(), anomalyDetector.defaults());
        for (AnomalyFinding a : anomalyDetector.detect(preStats, w.stats, thresholds)) {
            w.anomalies.add(a);
            if (a.severity() == Severity.CRITICAL) {
                w.error(Finding.error(FindingCategory.ANOMALY_CRITICAL, a.metric(), describe(a)));
            } else if (a.severity() == Severity.WARNING) {
                w.warning(Finding.warning(FindingCategory.ANOMALY_WARNING, a.metric(), describe(a)));
            }
        }

        String baselineName = firstNonNull(opts.compareBaseline(), preOptions.baselineName());
        if (baselineName != null) {
            try {
                GoldenBaseline baseline = baselines.get(baselineName, opts.baselineVersion());
                w.baselineComparison = baselines.compare(result, baseline);
                if (!w.baselineComparison.isEmpty()) {
                    w.warning(Finding.warning(FindingCategory.BASELINE_DRIFT, baseline.key(),
                            w.baselineComparison.differenceCount() + " difference(s) from baseline"));
                }
            } catch (BaselineNotFoundException e) {
                w.warning(Finding.warning(FindingCategory.BASELINE_DRIFT, baselineName, e.getMessage()));
            }
        }

        AuditVerifyReport chain = audit.verify();
        if (!chain.ok()) {
            w.error(Finding.error(FindingCategory.AUDIT_TAMPER_DETECTED, audit.getChainId(),
                    "audit chain broken at index " + chain.brokenAtIndex()
                            + " (" + chain.breaks().size() + " break(s))"));
            return w;
        }

        runHarness(firstNonNull(opts.harness(), preOptions.harness()), result, w);

        if (opts.snapshotName() != null) {
            SnapshotComparison cmp = snapshots.compare(opts.snapshotName(), recordValues(result));
            if (!cmp.matches()) w.warning(snapshotMismatch(cmp));
        }
        return w;
    }

    private PhaseReport finishPost(PhaseWork work, PostOptions opts, Instant started) {
        PhaseStatus status = work.status();
        PipelineState next = RollbackPolicy.shouldRollBack(status, work.errors)
                ? PipelineState.ROLLED_BACK : PipelineState.COMPLETED;
        return finish(Phase.POST, work, actorOf(firstNonNull(opts.actor(), preOptions.actor())), started, next);
    }

    // ---------------------------------------------------------------- whole run

    public PipelineRun execute(Dataset dataset, DeploymentAction action, PreOptions pre) {
        return execute(dataset, action, pre, PostOptions.defaults());
    }

    /**
     * PRE, then {@code action} on the validated dataset, then POST on its output. The action is
     * not invoked unless PRE reached READY; an action that throws produces a rolled-back POST
     * report carrying a DEPLOYMENT_FAILURE.
     */
    public PipelineRun execute(Dataset dataset, DeploymentAction action, PreOptions pre, PostOptions post) {
        PhaseReport preReport = runPre(dataset, pre);
        if (state != PipelineState.READY) {
            log.warn("[PIPELINE] session={} deployment blocked: PRE ended {}", sessionId, preReport.status());
            return new PipelineRun(preReport, null, null, state);
        }

        Dataset output;
        try {
            output = action.apply(dataset);
        } catch (Exception e) {
            if (e instanceof InterruptedException) Thread.currentThread().interrupt();
            log.error("[PIPELINE] session={} deployment action failed", sessionId, e);
            return new PipelineRun(preReport, deploymentFailed(e.toString(), post), null, state);
        }
        if (output == null) {
            return new PipelineRun(preReport, deploymentFailed("deployment action returned no dataset", post), null, state);
        }
        return new PipelineRun(preReport, runPost(output, post), output, state);
    }

    private synchronized PhaseReport deploymentFailed(String cause, PostOptions post) {
        requireState(PipelineState.READY, "runPost");
        PostOptions opts = post == null ? PostOptions.defaults() : post;
        Instant started = clock.instant();
        PhaseWork w = new PhaseWork();
        w.digest = preDigest;
        w.error(Finding.error(FindingCategory.DEPLOYMENT_FAILURE, cause));
        try {
            return finishPost(w, opts, started);
        } catch (StorageFailureException e) {
            throw abort(Phase.POST, e);
        }
    }

    // ---------------------------------------------------------------- helpers

    private PhaseReport finish(Phase phase, PhaseWork w, String actor, Instant started, PipelineState next) {
        ValidationResult result = ValidationResult.of(w.errors, w.warnings);
        PhaseStatus status = w.status();

        AuditEntry entry = audit.append(actor, phase.auditName(), w.root(), w.findings(), result.riskScore());

        boolean rollback = phase == Phase.POST && next == PipelineState.ROLLED_BACK;
        List<String> reasons = rollback ? RollbackPolicy.reasons(status, w.errors) : List.of();
        state = next;

        PhaseReport report = new PhaseReport(sessionId, audit.getChainId(), phase, status,
                status == PhaseStatus.PASSED, result.errors(), result.warnings(), w.anomalies,
                w.root(), w.diff, w.reconciliation, w.baselineComparison, w.testReport,
                audit.getChainId() + "#" + entry.sequence(), entry.selfHash(),
                rollback, reasons, result.riskScore(), next,
                started, Duration.between(started, clock.instant()).toMillis());

        if (rollback) {
            log.warn("[PIPELINE] session={} POST {} -> ROLLBACK ({} reason(s)): {}",
                    sessionId, status, reasons.size(), reasons);
        } else {
            log.info("[PIPELINE] session={} {} {} -> {} (errors={}, warnings={}, risk={})",
                    sessionId, phase, status, next, w.errors.size(), w.warnings.size(), result.riskScore());
        }
        return report;
    }

    private PhaseWork timed(Supplier<PhaseWork> checks, Duration timeout, Phase phase) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return checks.get();
        }
        return Mono.fromSupplier(checks)
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(timeout)
                .onErrorResume(TimeoutException.class, ex -> {
                    log.warn("[PIPELINE] session={} {} timed out after {}", sessionId, phase, timeout);
                    return Mono.just(PhaseWork.timedOut(phase, timeout));
                })
                .block();
    }

    private void checkCompleteness(Dataset dataset, Set<String> required, PhaseWork w) {
        List<DataRecord> records = dataset.records();
        for (int i = 0; i < records.size(); i++) {
            DataRecord r = records.get(i);
            String id = r.identity(dataset.identityField());
            String label = id == null ? "#" + i : id;
            for (String field : required) {
                if (!r.hasValue(field)) {
                    w.error(Finding.error(FindingCategory.INCOMPLETE_RECORD, label + "." + field,
                            "required field '" + field + "' is missing or empty"));
                }
            }
        }
    }

    private static Set<String> requiredFields(Dataset dataset, PreOptions opts) {
        Set<String> fields = new LinkedHashSet<>();
        fields.add(dataset.identityField());
        if (opts.schema() != null) fields.addAll(opts.schema().required());
        fields.addAll(opts.requiredFields());
        return fields;
    }

    private void runHarness(TestHarness harness, Dataset dataset, PhaseWork w) {
        if (harness == null || harness.size() == 0) return;
        TestRunReport report = harness.run(dataset);
        w.testReport = report;
        for (TestResult r : report.results()) {
            if (r.passed()) continue;
            String msg = r.message() == null ? "test failed" : r.message();
            if (r.required()) {
                w.error(Finding.error(FindingCategory.TEST_FAILURE, r.name(), msg));
            } else {
                w.warning(Finding.warning(FindingCategory.TEST_FAILURE, r.name(), msg));
            }
        }
    }

    private static List<Object> recordValues(Dataset dataset) {
        return dataset.records().stream().map(r -> (Object) r.fields()).toList();
    }

    private static Finding snapshotMismatch(SnapshotComparison cmp) {
        String msg = cmp.found()
                ? "value differs from snapshot v" + cmp.snapshotVersion()
                : "no snapshot to compare against";
        return Finding.warning(FindingCategory.SNAPSHOT_MISMATCH, cmp.name(), msg);
    }

    private static String describe(AnomalyFinding a) {
        return a.metric() + " moved " + percent(a.deltaPercent()) + ", drift " + percent(a.magnitudePercent())
                + " (" + a.baselineValue() + " -> " + a.candidateValue() + ", threshold " + a.threshold() + "%)";
    }

    private static String percent(double value) {
        return Double.isInfinite(value) ? "unbounded" : value + "%";
    }

    private StorageFailureException abort(Phase phase, StorageFailureException e) {
        state = PipelineState.ABORTED;
        log.error("[PIPELINE] session={} {} aborted: storage failure on {}", sessionId, phase, e.getStreamId(), e);
        return e;
    }

    private void requireState(PipelineState expected, String op) {
        if (state != expected) {
            throw new IllegalStateException(op + " requires state " + expected + " but session "
                    + sessionId + " is " + state);
        }
    }

    private String actorOf(String actor) {
        return actor == null || actor.isBlank() ? defaultActor : actor;
    }

    private static <T> T firstNonNull(T a, T b) {
        return a != null ? a : b;
    }
}
