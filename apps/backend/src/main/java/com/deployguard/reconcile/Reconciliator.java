package com.deployguard.reconcile;

import com.deployguard.model.DataRecord;
import com.deployguard.model.Dataset;
import com.deployguard.util.JsonCanonicalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Record-level diff keyed by identity. Only differing leaf paths are reported, so a report
 * grows with the volume of change rather than with the size of the datasets.
 */
@Slf4j
@Component
public class Reconciliator {

    public ReconciliationReport reconcile(Dataset before, Dataset after) {
        return reconcile(before.byIdentity(), after.byIdentity());
    }

    public ReconciliationReport reconcile(Map<String, DataRecord> before, Map<String, DataRecord> after) {
        List<String> added = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        List<RecordChange> changed = new ArrayList<>();

        TreeSet<String> ids = new TreeSet<>(before.keySet());
        ids.addAll(after.keySet());
        for (String id : ids) {
            DataRecord b = before.get(id);
            DataRecord a = after.get(id);
            if (b == null) {
                added.add(id);
            } else if (a == null) {
                removed.add(id);
            } else {
                List<FieldDiff> diffs = new ArrayList<>();
                compare("", b.fields(), a.fields(), diffs);
                if (!diffs.isEmpty()) changed.add(new RecordChange(id, diffs));
            }
        }
        log.debug("Reconciled {} identities: +{} -{} ~{}", ids.size(), added.size(), removed.size(), changed.size());
        return new ReconciliationReport(added, removed, changed);
    }

    /**
     * Comparison when only leaf checksums are known on at least one side: changed records carry
     * no field diffs.
     */
    public ReconciliationReport reconcileChecksums(Map<String, String> before, Map<String, String> after) {
        List<String> added = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        List<RecordChange> changed = new ArrayList<>();

        TreeSet<String> ids = new TreeSet<>(before.keySet());
        ids.addAll(after.keySet());
        for (String id : ids) {
            String b = before.get(id);
            String a = after.get(id);
            if (b == null) added.add(id);
            else if (a == null) removed.add(id);
            else if (!b.equals(a)) changed.add(new RecordChange(id, List.of()));
        }
        return new ReconciliationReport(added, removed, changed);
    }

    private void compare(String path, Object before, Object after, List<FieldDiff> out) {
        if (before instanceof Map<?, ?> bm && after instanceof Map<?, ?> am) {
            TreeSet<String> keys = new TreeSet<>();
            bm.keySet().forEach(k -> keys.add(String.valueOf(k)));
            am.keySet().forEach(k -> keys.add(String.valueOf(k)));
            for (String k : keys) {
                String child = path.isEmpty() ? k : path + "." + k;
                boolean inB = bm.containsKey(k);
                boolean inA = am.containsKey(k);
                if (!inA) out.add(new FieldDiff(child, FieldDiff.Kind.REMOVED, bm.get(k), null));
                else if (!inB) out.add(new FieldDiff(child, FieldDiff.Kind.ADDED, null, am.get(k)));
                else compare(child, bm.get(k), am.get(k), out);
            }
            return;
        }
        if (before instanceof List<?> bl && after instanceof List<?> al) {
            int n = Math.max(bl.size(), al.size());
            for (int i = 0; i < n; i++) {
                String child = path + "[" + i + "]";
                if (i >= al.size()) out.add(new FieldDiff(child, FieldDiff.Kind.REMOVED, bl.get(i), null));
                else if (i >= bl.size()) out.add(new FieldDiff(child, FieldDiff.Kind.ADDED, null, al.get(i)));
                else compare(child, bl.get(i), al.get(i), out);
            }
            return;
        }
        if (!sameLeaf(before, after)) {
            out.add(new FieldDiff(path, FieldDiff.Kind.MODIFIED, before, after));
        }
    }

    // 1 and 1.0 are the same value, as they are for the checksums
    private static boolean sameLeaf(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            try {
                return new BigDecimal(JsonCanonicalizer.scalarText(a))
                        .compareTo(new BigDecimal(JsonCanonicalizer.scalarText(b))) == 0;
            } catch (NumberFormatException e) {
                return Objects.equals(String.valueOf(a), String.valueOf(b));
            }
        }
        return Objects.equals(a, b);
    }
}
