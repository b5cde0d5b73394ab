package com.deployguard.harness;

import com.deployguard.storage.AppendOnlyStore;
import com.deployguard.storage.StorageFailureException;
import com.deployguard.storage.StreamIds;
import com.deployguard.util.Fingerprint;
import com.deployguard.util.JsonCanonicalizer;
import com.deployguard.util.StoredJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Digests of arbitrary values kept under a name. A name is created once; later values are
 * only compared until {@link #update} explicitly accepts a new one. Every accepted value is a
 * new entry of stream {@code snapshot/<name>}.
 */
@Slf4j
@Service
public class SnapshotStore {

    private final AppendOnlyStore store;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public SnapshotStore(AppendOnlyStore store, ObjectMapper objectMapper, Clock clock) {
        this.store = store;
        this.mapper = StoredJson.mapper(objectMapper);
        this.clock = clock;
    }

    /** @throws SnapshotExistsException when {@code name} already has a snapshot */
    public Snapshot create(String name, Object value) {
        return write(name, value, false);
    }

    /**
     * Creates the first snapshot of {@code name} unless one exists, atomically with respect to
     * other writers of this store.
     *
     * @return true when this call created it
     */
    public boolean createIfAbsent(String name, Object value) {
        ReentrantLock lock = lockFor(name);
        lock.lock();
        try {
            if (store.size(StreamIds.snapshot(name)) > 0) return false;
            write(name, value, false);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** Accepts {@code value} as the new reference for {@code name}, creating it if needed. */
    public Snapshot update(String name, Object value) {
        return write(name, value, true);
    }

    public Optional<Snapshot> latest(String name) {
        List<String> rows = store.readAll(StreamIds.snapshot(name));
        if (rows.isEmpty()) return Optional.empty();
        return Optional.of(parse(name, rows.get(rows.size() - 1)));
    }

    public SnapshotComparison compare(String name, Object value) {
        String actual = hash(value);
        Optional<Snapshot> saved = latest(name);
        if (saved.isEmpty()) {
            log.debug("[SNAPSHOT] '{}' not found", name);
            return new SnapshotComparison(name, false, false, null, null, actual, null);
        }
        Snapshot s = saved.get();
        boolean matches = s.hash().equals(actual);
        if (!matches) log.info("[SNAPSHOT] '{}' v{} differs: expected={} actual={}", name, s.version(), s.hash(), actual);
        return new SnapshotComparison(name, true, matches, s.version(), s.hash(), actual, s.createdAt());
    }

    public String hash(Object value) {
        return Fingerprint.sha256(JsonCanonicalizer.canonicalize(mapper, toTree(value)));
    }

    private Snapshot write(String name, Object value, boolean allowExisting) {
        String streamId = StreamIds.snapshot(name);
        ReentrantLock lock = lockFor(name);
        lock.lock();
        try {
            long existing = store.size(streamId);
            if (existing > 0 && !allowExisting) throw new SnapshotExistsException(name);
            JsonNode tree = toTree(value);
            Snapshot s = new Snapshot(name, (int) existing + 1,
                    Fingerprint.sha256(JsonCanonicalizer.canonicalize(mapper, tree)), clock.instant(), tree);
            store.append(streamId, StoredJson.write(mapper, s));
            log.info("[SNAPSHOT] {} '{}' v{} hash={}", existing == 0 ? "created" : "updated", name, s.version(), s.hash());
            return s;
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock lockFor(String name) {
        return locks.computeIfAbsent(name, k -> new ReentrantLock());
    }

    private JsonNode toTree(Object value) {
        return value instanceof JsonNode n ? n : mapper.valueToTree(value);
    }

    private Snapshot parse(String name, String row) {
        try {
            return mapper.readValue(row, Snapshot.class);
        } catch (JsonProcessingException e) {
            throw new StorageFailureException(StreamIds.snapshot(name), "unreadable snapshot entry", e);
        }
    }
}
