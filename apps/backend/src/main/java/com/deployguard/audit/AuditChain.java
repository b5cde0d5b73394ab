package com.deployguard.audit;

import com.deployguard.audit.dto.AuditIssue;
import com.deployguard.audit.dto.AuditVerifyReport;
import com.deployguard.config.IntegrityProperties;
import com.deployguard.model.Finding;
import com.deployguard.storage.AppendOnlyStore;
import com.deployguard.storage.StorageFailureException;
import com.deployguard.storage.StreamIds;
import com.deployguard.util.StoredJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only, hash-linked event log persisted to one store stream.
 * <p>
 * Appends are serialized by a per-chain lock; every append reads the tail, links to its
 * selfHash and is durable before it returns. Use {@link AuditChainRegistry} to obtain chains so
 * that a chain id maps to exactly one instance (and one lock) per process.
 */
@Slf4j
public class AuditChain {

    private final String chainId;
    private final String streamId;
    private final AppendOnlyStore store;
    private final ObjectMapper mapper;
    private final IntegrityProperties.Audit props;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<AuditAlert> alerts = new CopyOnWriteArrayList<>();

    // guarded by lock; null until first use
    private Tail tail;

    public AuditChain(String chainId, AppendOnlyStore store, ObjectMapper mapper,
                      IntegrityProperties.Audit props, ApplicationEventPublisher publisher, Clock clock) {
        this.chainId = Objects.requireNonNull(chainId, "chainId");
        this.streamId = StreamIds.audit(chainId);
        this.store = store;
        this.mapper = AuditHasher.entryMapper(mapper);
        this.props = props;
        this.publisher = publisher;
        this.clock = clock;
    }

    public String getChainId() {
        return chainId;
    }

    public String getStreamId() {
        return streamId;
    }

    public AuditEntry append(String actor, String phase, String rootChecksum,
                             List<Finding> findings, double riskScore) {
        lock.lock();
        try {
            Tail t = currentTail();
            Instant now = clock.instant();
            var payload = AuditHasher.buildEntryPayload(t.nextSequence(), now, actor, phase,
                    rootChecksum, findings, riskScore);
            var chain = AuditHasher.link(t.hash(), AuditHasher.canonicalize(mapper, payload));
            AuditEntry entry = new AuditEntry(t.nextSequence(), now, actor, phase, rootChecksum,
                    findings, riskScore, chain.prev(), chain.hash());

            try {
                store.append(streamId, StoredJson.write(mapper, entry));
            } catch (StorageFailureException e) {
                // the row may have landed anyway; reload the tail on the next append
                tail = null;
                throw e;
            }
            tail = new Tail(entry.sequence() + 1, entry.selfHash());
            log.info("[AUDIT] chain={} seq={} actor={} phase={} risk={} hash={}",
                    chainId, entry.sequence(), actor, phase, riskScore, entry.selfHash());

            raiseAlertIfNeeded(entry);
            return entry;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Walks the chain from index 0 re-deriving each hash. Reports every break; never repairs.
     */
    public AuditVerifyReport verify() {
        List<String> rows = store.readAll(streamId);
        List<AuditIssue> breaks = new ArrayList<>();
        String expectedPrev = AuditHasher.GENESIS_HASH;
        String tailHash = null;

        for (int i = 0; i < rows.size(); i++) {
            AuditEntry e = tryParse(rows.get(i));
            if (e == null) {
                breaks.add(new AuditIssue(i, null, expectedPrev, null, null, null, "unreadable entry"));
                String stored = storedSelfHash(rows.get(i));
                tailHash = stored;
                expectedPrev = stored;
                continue;
            }
            String recomputed = AuditHasher.recompute(mapper, e);
            boolean prevOk = Objects.equals(e.prevHash(), expectedPrev);
            boolean hashOk = Objects.equals(e.selfHash(), recomputed);
            boolean seqOk = e.sequence() == i;
            if (!(prevOk && hashOk && seqOk)) {
                List<String> reasons = new ArrayList<>();
                if (!prevOk) reasons.add("prevHash does not link to previous entry");
                if (!hashOk) reasons.add("selfHash does not match content");
                if (!seqOk) reasons.add("sequence " + e.sequence() + " at index " + i);
                breaks.add(new AuditIssue(i, e.sequence(), expectedPrev, e.prevHash(),
                        recomputed, e.selfHash(), String.join("; ", reasons)));
            }
            // advance along the stored chain so later breaks are localized independently
            tailHash = e.selfHash();
            expectedPrev = e.selfHash();
        }

        Integer firstBad = breaks.isEmpty() ? null : breaks.get(0).index();
        AuditVerifyReport report = new AuditVerifyReport(chainId, rows.size(), breaks.isEmpty(),
                firstBad, breaks, tailHash);
        if (!report.ok()) {
            log.error("[AUDIT] tamper detected on chain={} brokenAtIndex={} breaks={}",
                    chainId, firstBad, breaks.size());
            if (publisher != null) publisher.publishEvent(new AuditTamperDetectedEvent(report));
        } else {
            log.debug("[AUDIT] chain={} verified {} entries", chainId, rows.size());
        }
        return report;
    }

    /** Every readable entry in chain order. */
    public List<AuditEntry> entries() {
        List<AuditEntry> out = new ArrayList<>();
        List<String> rows = store.readAll(streamId);
        for (int i = 0; i < rows.size(); i++) {
            AuditEntry e = tryParse(rows.get(i));
            if (e == null) {
                log.warn("[AUDIT] skipping unreadable entry {} of chain={}", i, chainId);
                continue;
            }
            out.add(e);
        }
        return out;
    }

    public List<AuditEntry> query(AuditQuery q) {
        var stream = entries().stream().filter(q::matches);
        if (q.limit() != null && q.limit() >= 0) stream = stream.limit(q.limit());
        return stream.toList();
    }

    public long size() {
        return store.size(streamId);
    }

    public List<AuditAlert> alerts() {
        return List.copyOf(alerts);
    }

    private Tail currentTail() {
        if (tail != null) return tail;
        List<String> rows = store.readAll(streamId);
        if (rows.isEmpty()) {
            tail = new Tail(0, AuditHasher.GENESIS_HASH);
        } else {
            String last = storedSelfHash(rows.get(rows.size() - 1));
            if (last == null) {
                throw new StorageFailureException(streamId, "tail entry has no selfHash", null);
            }
            tail = new Tail(rows.size(), last);
        }
        return tail;
    }

    private void raiseAlertIfNeeded(AuditEntry entry) {
        if (props == null || entry.riskScore() <= props.getAlertThreshold()) return;
        AuditAlert.Level level = entry.riskScore() > props.getCriticalAlertThreshold()
                ? AuditAlert.Level.CRITICAL : AuditAlert.Level.HIGH;
        AuditAlert alert = new AuditAlert(
                "ALERT-" + chainId + "-" + entry.sequence(),
                chainId, entry.sequence(), entry.timestamp(), level,
                entry.actor(), entry.phase(), entry.riskScore(),
                "High-risk " + entry.phase() + " phase by " + entry.actor());
        alerts.add(alert);
        log.warn("[AUDIT ALERT] {} ({}, risk={})", alert.message(), level, entry.riskScore());
        if (publisher != null) publisher.publishEvent(new AuditAlertRaisedEvent(alert));
    }

    private AuditEntry tryParse(String row) {
        try {
            return mapper.readValue(row, AuditEntry.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return null;
        }
    }

    private String storedSelfHash(String row) {
        try {
            JsonNode n = mapper.readTree(row);
            JsonNode h = n == null ? null : n.get("selfHash");
            return h == null || h.isNull() ? null : h.asText();
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private record Tail(long nextSequence, String hash) {}
}
