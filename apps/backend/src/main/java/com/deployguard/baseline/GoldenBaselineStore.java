package com.deployguard.baseline;

import com.deployguard.checksum.ChecksumEngine;
import com.deployguard.checksum.DatasetDigest;
import com.deployguard.config.IntegrityProperties;
import com.deployguard.model.DataRecord;
import com.deployguard.model.Dataset;
import com.deployguard.reconcile.ReconciliationReport;
import com.deployguard.reconcile.Reconciliator;
import com.deployguard.storage.AppendOnlyStore;
import com.deployguard.storage.StorageFailureException;
import com.deployguard.storage.StreamIds;
import com.deployguard.util.StoredJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.IntStream;

/**
 * Named, versioned golden baselines on top of an {@link AppendOnlyStore}. Version {@code n} of
 * a name is entry {@code n - 1} of stream {@code baseline/<name>}; nothing is ever overwritten.
 */
@Slf4j
@Service
public class GoldenBaselineStore {

    private final AppendOnlyStore store;
    private final ChecksumEngine checksums;
    private final Reconciliator reconciliator;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final boolean storeRecords;

    private final Cache<String, GoldenBaseline> cache;
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public GoldenBaselineStore(AppendOnlyStore store,
                               ChecksumEngine checksums,
                               Reconciliator reconciliator,
                               ObjectMapper objectMapper,
                               IntegrityProperties props,
                               Clock clock) {
        this.store = store;
        this.checksums = checksums;
        this.reconciliator = reconciliator;
        this.mapper = StoredJson.mapper(objectMapper);
        this.clock = clock;
        this.storeRecords = props.getBaseline().isStoreRecords();
        this.cache = Caffeine.newBuilder()
                .maximumSize(props.getBaseline().getCacheMaxSize())
                .build();
    }

    public GoldenBaseline create(String name, Dataset dataset, String description) {
        String streamId = StreamIds.baseline(name);
        DatasetDigest digest = checksums.digest(dataset);
        var stats = checksums.stats(dataset);
        Map<String, DataRecord> records = storeRecords ? dataset.byIdentity() : null;

        ReentrantLock lock = locks.computeIfAbsent(name, k -> new ReentrantLock());
        lock.lock();
        try {
            int version = (int) store.size(streamId) + 1;
            GoldenBaseline baseline = new GoldenBaseline(name, version, clock.instant(), description,
                    dataset.identityField(), digest.root(), digest.leaves(), stats, records);
            long position = store.append(streamId, StoredJson.write(mapper, baseline));
            if (position != version - 1) {
                throw new StorageFailureException(streamId,
                        "baseline '" + name + "' written at position " + position + ", expected " + (version - 1), null);
            }
            cache.put(baseline.key(), baseline);
            log.info("[BASELINE] created {} v{} ({} records, root={})",
                    name, version, digest.recordCount(), digest.root());
            return baseline;
        } finally {
            lock.unlock();
        }
    }

    /** Latest version. */
    public GoldenBaseline get(String name) {
        return get(name, null);
    }

    public GoldenBaseline get(String name, Integer version) {
        List<String> rows = store.readAll(StreamIds.baseline(name));
        if (rows.isEmpty()) throw new BaselineNotFoundException(name, version);
        int v = version == null ? rows.size() : version;
        if (v < 1 || v > rows.size()) throw new BaselineNotFoundException(name, version);
        return cache.get(name + "@" + v, k -> parse(name, rows.get(v - 1)));
    }

    public List<Integer> versions(String name) {
        int n = (int) store.size(StreamIds.baseline(name));
        return IntStream.rangeClosed(1, n).boxed().toList();
    }

    public List<String> names() {
        return store.streams(StreamIds.BASELINE).stream()
                .map(s -> StreamIds.name(StreamIds.BASELINE, s))
                .toList();
    }

    /**
     * Differences from {@code baseline} to {@code dataset}. Field-level when the baseline kept
     * its records, checksum-level otherwise.
     */
    public ReconciliationReport compare(Dataset dataset, GoldenBaseline baseline) {
        ReconciliationReport report;
        if (baseline.hasRecords()) {
            report = reconciliator.reconcile(baseline.records(), dataset.byIdentity());
        } else {
            report = reconciliator.reconcileChecksums(baseline.leafChecksums(), checksums.digest(dataset).leaves());
        }
        log.debug("[BASELINE] compare against {}: {} difference(s)", baseline.key(), report.differenceCount());
        return report;
    }

    private GoldenBaseline parse(String name, String row) {
        try {
            return mapper.readValue(row, GoldenBaseline.class);
        } catch (JsonProcessingException e) {
            throw new StorageFailureException(StreamIds.baseline(name), "unreadable baseline entry", e);
        }
    }
}
