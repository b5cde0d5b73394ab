package com.deployguard.audit;

import com.deployguard.model.Finding;
import com.deployguard.util.Fingerprint;
import com.deployguard.util.JsonCanonicalizer;
import com.deployguard.util.StoredJson;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class AuditHasher {
    private AuditHasher() {}

    /** prevHash of the first entry of every chain: SHA-256 of the empty string. */
    public static final String GENESIS_HASH = sha256Hex("");

    public static String sha256Hex(String s) {
        return Fingerprint.sha256(s);
    }

    public static String canonicalize(ObjectMapper om, Object payload) {
        return JsonCanonicalizer.canonicalize(om, payload);
    }

    /** Chain hash: hash = SHA256(prevHash + canonical). */
    public static Chain link(String prev, String canonical) {
        String p = prev == null ? GENESIS_HASH : prev;
        return new Chain(p, sha256Hex(p + canonical), canonical);
    }

    public record Chain(String prev, String hash, String canonical) {}

    /** Every field of an entry except the two hashes. */
    public static Map<String, Object> buildEntryPayload(
            long sequence, Instant timestamp, String actor, String phase,
            String datasetRootChecksum, List<Finding> findings, double riskScore) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("sequence", sequence);
        m.put("ts", timestamp == null ? null : timestamp.toString());
        m.put("actor", actor);
        m.put("phase", phase);
        m.put("datasetRootChecksum", datasetRootChecksum);
        List<Map<String, Object>> fs = new ArrayList<>();
        if (findings != null) {
            for (Finding f : findings) {
                Map<String, Object> fm = new LinkedHashMap<>();
                fm.put("category", f.category() == null ? null : f.category().name());
                fm.put("severity", f.severity() == null ? null : f.severity().name());
                fm.put("subject", f.subject());
                fm.put("message", f.message());
                fs.add(fm);
            }
        }
        m.put("findings", fs);
        m.put("riskScore", riskScore);
        return m;
    }

    public static Map<String, Object> buildEntryPayload(AuditEntry e) {
        return buildEntryPayload(e.sequence(), e.timestamp(), e.actor(), e.phase(),
                e.datasetRootChecksum(), e.findings(), e.riskScore());
    }

    /** Recomputes the self hash of {@code e} from its stored prevHash and content. */
    public static String recompute(ObjectMapper om, AuditEntry e) {
        return link(e.prevHash(), canonicalize(om, buildEntryPayload(e))).hash();
    }

    /** Mapper used to persist entries: ISO-8601 instants, independent of the caller's settings. */
    public static ObjectMapper entryMapper(ObjectMapper base) {
        return StoredJson.mapper(base);
    }
}
