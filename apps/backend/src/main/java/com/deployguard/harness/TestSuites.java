package com.deployguard.harness;

import com.deployguard.model.DataRecord;
import com.deployguard.model.Dataset;
import com.deployguard.util.JsonCanonicalizer;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Built-in suite generators. Each returns a fresh {@link TestHarness} whose tests are required;
 * combine them with {@link TestHarness#include}.
 */
public final class TestSuites {
    private TestSuites() {}

    /** Failure messages list at most this many offending records. */
    static final int MAX_REPORTED = 5;

    /** Non-empty, no duplicate identities, no null critical fields. */
    public static TestHarness basicIntegrity(List<String> criticalFields) {
        return new TestHarness()
                .register("Data is not empty", d -> TestOutcome.of(!d.isEmpty(), "dataset has no records"))
                .register("No duplicate identities", d -> {
                    Set<String> seen = new HashSet<>();
                    List<String> dups = new ArrayList<>();
                    for (String id : d.identities()) {
                        if (id != null && !seen.add(id)) dups.add(id);
                    }
                    return TestOutcome.of(dups.isEmpty(), "duplicate identities " + head(dups));
                })
                .register("No null values in critical fields", d -> {
                    List<String> bad = offenders(d, r -> criticalFields.stream().allMatch(r::hasValue));
                    return TestOutcome.of(bad.isEmpty(), "records missing critical fields " + head(bad));
                });
    }

    /** Every required field present and non-null on every record. */
    public static TestHarness completeness(Collection<String> requiredFields) {
        TestHarness h = new TestHarness();
        for (String field : requiredFields) {
            h.register("Field '" + field + "' exists in all records", d -> {
                List<String> bad = offenders(d, r -> r.has(field));
                return TestOutcome.of(bad.isEmpty(), "missing on " + head(bad));
            });
            h.register("Field '" + field + "' has no null values", d -> {
                List<String> bad = offenders(d, r -> !r.has(field) || r.hasValue(field));
                return TestOutcome.of(bad.isEmpty(), "null or empty on " + head(bad));
            });
        }
        return h;
    }

    /** Absent values are skipped; completeness covers presence. */
    public static TestHarness format(Map<String, FieldFormat> formats) {
        TestHarness h = new TestHarness();
        formats.forEach((field, format) -> h.register(
                "Field '" + field + "' has valid " + format.name().toLowerCase() + " format",
                d -> {
                    List<String> bad = offenders(d, r -> r.get(field) == null || format.accepts(r.get(field)));
                    return TestOutcome.of(bad.isEmpty(), "invalid " + format + " on " + head(bad));
                }));
        return h;
    }

    public static TestHarness pattern(String field, String regex) {
        Pattern p = Pattern.compile(regex);
        return new TestHarness().register("Field '" + field + "' matches /" + regex + "/", d -> {
            List<String> bad = offenders(d, r -> r.get(field) == null
                    || p.matcher(JsonCanonicalizer.scalarText(r.get(field))).find());
            return TestOutcome.of(bad.isEmpty(), "no match on " + head(bad));
        });
    }

    public static TestHarness oneOf(String field, Collection<?> allowed) {
        Set<String> texts = new HashSet<>();
        for (Object a : allowed) texts.add(JsonCanonicalizer.scalarText(a));
        return new TestHarness().register("Field '" + field + "' is one of " + allowed, d -> {
            List<String> bad = offenders(d, r -> r.get(field) == null
                    || texts.contains(JsonCanonicalizer.scalarText(r.get(field))));
            return TestOutcome.of(bad.isEmpty(), "unexpected value on " + head(bad));
        });
    }

    /**
     * Referential integrity: {@code field} of every record resolves to a {@code targetField}
     * value of the related dataset (the tested dataset itself when {@code target} is null).
     */
    public static TestHarness relationship(String field, Dataset target, String targetField, boolean nullable) {
        String name = "Relationship: " + field + " -> "
                + (target == null ? "" : target.source() + ".")
                + (targetField == null ? "<identity>" : targetField);
        return new TestHarness().register(name, d -> {
            Dataset t = target == null ? d : target;
            String tf = targetField == null ? t.identityField() : targetField;
            Set<String> keys = new HashSet<>();
            for (DataRecord r : t.records()) {
                if (r.get(tf) != null) keys.add(JsonCanonicalizer.scalarText(r.get(tf)));
            }
            List<String> bad = offenders(d, r -> {
                Object v = r.get(field);
                if (v == null) return nullable;
                return keys.contains(JsonCanonicalizer.scalarText(v));
            });
            return TestOutcome.of(bad.isEmpty(), "dangling references on " + head(bad));
        });
    }

    public static TestHarness relationship(String field, boolean nullable) {
        return relationship(field, null, null, nullable);
    }

    /** Caller-supplied predicate per record. */
    public static TestHarness businessRule(String name, Predicate<DataRecord> rule) {
        return new TestHarness().register("Business rule: " + name, d -> {
            List<String> bad = offenders(d, rule);
            return TestOutcome.of(bad.isEmpty(), "violated by " + head(bad));
        });
    }

    /** Cross-record invariant over the whole record list. */
    public static TestHarness consistency(String name, Predicate<List<DataRecord>> rule) {
        return new TestHarness().register("Consistency rule: " + name,
                d -> TestOutcome.of(rule.test(d.records()), name + " does not hold"));
    }

    /**
     * Values of {@code field} never decrease (strictly increase when {@code strict}) in record
     * order. Numbers compare numerically, anything else by text.
     */
    public static TestHarness monotonic(String field, boolean strict) {
        String name = "Consistency rule: '" + field + "' is " + (strict ? "strictly increasing" : "non-decreasing");
        return new TestHarness().register(name, d -> {
            Object prev = null;
            int i = 0;
            for (DataRecord r : d.records()) {
                Object v = r.get(field);
                if (prev != null && v != null) {
                    int c = compare(prev, v);
                    if (c > 0 || (strict && c == 0)) {
                        return TestOutcome.fail("order broken at record #" + i + " (" + prev + " then " + v + ")");
                    }
                }
                if (v != null) prev = v;
                i++;
            }
            return TestOutcome.pass();
        });
    }

    private static int compare(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return new BigDecimal(JsonCanonicalizer.scalarText(a))
                    .compareTo(new BigDecimal(JsonCanonicalizer.scalarText(b)));
        }
        return String.valueOf(a).compareTo(String.valueOf(b));
    }

    /** Labels (identity or #index) of records that do not satisfy {@code ok}. */
    private static List<String> offenders(Dataset d, Predicate<DataRecord> ok) {
        List<String> bad = new ArrayList<>();
        List<DataRecord> records = d.records();
        for (int i = 0; i < records.size(); i++) {
            DataRecord r = records.get(i);
            if (!ok.test(r)) {
                String id = r.identity(d.identityField());
                bad.add(id == null ? "#" + i : id);
            }
        }
        return bad;
    }

    private static String head(List<String> items) {
        if (items.size() <= MAX_REPORTED) return items.toString();
        return items.subList(0, MAX_REPORTED) + " and " + (items.size() - MAX_REPORTED) + " more";
    }
}
