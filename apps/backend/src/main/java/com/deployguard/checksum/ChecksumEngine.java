package com.deployguard.checksum;

import com.deployguard.config.IntegrityProperties;
import com.deployguard.model.DataRecord;
import com.deployguard.model.Dataset;
import com.deployguard.util.Fingerprint;
import com.deployguard.util.JsonCanonicalizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.IntStream;

/**
 * Content-addressed checksums over canonical record serializations.
 * <p>
 * Leaf = SHA-256 of the canonical JSON of a record. Root = SHA-256 of the concatenated, sorted
 * leaf list, so the root ignores record order but reacts to any addition, removal or edit.
 */
@Component
@Slf4j
public class ChecksumEngine {

    private final ObjectMapper mapper;
    private final int parallelThreshold;

    @Autowired
    public ChecksumEngine(ObjectMapper mapper, IntegrityProperties props) {
        this(mapper, props.getChecksum().getParallelThreshold());
    }

    public ChecksumEngine(ObjectMapper mapper, int parallelThreshold) {
        this.mapper = mapper;
        this.parallelThreshold = Math.max(1, parallelThreshold);
    }

    public DatasetDigest digest(Dataset dataset) {
        List<Leaf> leaves = hashRecords(dataset);

        Map<String, String> byIdentity = new LinkedHashMap<>();
        Set<String> duplicates = new LinkedHashSet<>();
        List<String> all = new ArrayList<>(leaves.size());
        for (Leaf leaf : leaves) {
            all.add(leaf.checksum());
            if (leaf.identity() == null) continue;
            if (byIdentity.putIfAbsent(leaf.identity(), leaf.checksum()) != null) {
                duplicates.add(leaf.identity());
            }
        }
        String root = rootOf(all);
        log.debug("Digest of '{}': {} record(s), root={}", dataset.source(), leaves.size(), root);
        return new DatasetDigest(root, byIdentity, List.copyOf(duplicates), leaves.size());
    }

    /** Leaf checksum of a single record. */
    public String checksum(DataRecord record) {
        return Fingerprint.sha256(canonical(record));
    }

    /** Root over an arbitrary leaf collection. */
    public String rootOf(Collection<String> leafChecksums) {
        List<String> sorted = new ArrayList<>(leafChecksums);
        sorted.sort(null);
        return Fingerprint.sha256(String.join("", sorted));
    }

    /**
     * Classifies every identity of either digest. A changed identity is expected only when it
     * is a member of {@code scope}; with an empty scope every change is unexpected.
     */
    public ChecksumDiff diff(DatasetDigest before, DatasetDigest after, Set<String> scope) {
        Set<String> declared = scope == null ? Set.of() : scope;
        Set<String> ids = new TreeSet<>(before.leaves().keySet());
        ids.addAll(after.leaves().keySet());

        List<ChecksumDiff.Entry> entries = new ArrayList<>(ids.size());
        for (String id : ids) {
            String b = before.leaves().get(id);
            String a = after.leaves().get(id);
            boolean inScope = declared.contains(id);
            ChangeStatus status;
            if (b == null) {
                status = ChangeStatus.ADDED;
            } else if (a == null) {
                status = ChangeStatus.REMOVED;
            } else if (b.equals(a)) {
                status = ChangeStatus.UNCHANGED;
            } else {
                status = inScope ? ChangeStatus.EXPECTED_CHANGED : ChangeStatus.UNEXPECTED_CHANGED;
            }
            entries.add(new ChecksumDiff.Entry(id, status, inScope));
        }
        return new ChecksumDiff(entries, declared);
    }

    public DatasetStats stats(Dataset dataset) {
        List<Leaf> leaves = hashRecords(dataset);
        double meanSize = leaves.stream().mapToInt(Leaf::size).average().orElse(0d);

        Map<String, List<Double>> numeric = new TreeMap<>();
        Set<String> nonNumeric = new HashSet<>();
        for (DataRecord r : dataset.records()) {
            r.fields().forEach((field, value) -> {
                if (value instanceof Number n && Double.isFinite(n.doubleValue())) {
                    numeric.computeIfAbsent(field, k -> new ArrayList<>()).add(n.doubleValue());
                } else if (value != null) {
                    nonNumeric.add(field);
                }
            });
        }

        Map<String, DatasetStats.FieldStats> fields = new TreeMap<>();
        numeric.forEach((field, values) -> {
            if (nonNumeric.contains(field)) return;
            double mean = values.stream().mapToDouble(Double::doubleValue).average().orElse(0d);
            double variance = values.stream().mapToDouble(v -> (v - mean) * (v - mean)).average().orElse(0d);
            fields.put(field, new DatasetStats.FieldStats(values.size(), mean, Math.sqrt(variance)));
        });
        return new DatasetStats(dataset.size(), meanSize, fields);
    }

    private List<Leaf> hashRecords(Dataset dataset) {
        List<DataRecord> records = dataset.records();
        IntStream indexes = IntStream.range(0, records.size());
        if (records.size() >= parallelThreshold) {
            indexes = indexes.parallel();
        }
        String idField = dataset.identityField();
        // ordered collection keeps leaves aligned with record order
        return indexes.mapToObj(i -> {
            DataRecord r = records.get(i);
            String canonical = canonical(r);
            return new Leaf(r.identity(idField), Fingerprint.sha256(canonical),
                    canonical.getBytes(StandardCharsets.UTF_8).length);
        }).toList();
    }

    private String canonical(DataRecord record) {
        return JsonCanonicalizer.canonicalize(mapper, record.fields());
    }

    private record Leaf(String identity, String checksum, int size) {}
}
