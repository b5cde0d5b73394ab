package com.deployguard.util;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Canonical JSON form used for every checksum in the system:
 * object keys sorted recursively, numbers rewritten as plain decimals without trailing zeros
 * (so {@code 1}, {@code 1L} and {@code 1.0} serialize identically).
 */
public final class JsonCanonicalizer {

    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .configure(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN, true);

    private JsonCanonicalizer() {}

    public static JsonNode normalize(ObjectMapper mapper, JsonNode node, Set<String> ignore) {
        if (node == null || node.isNull() || node.isMissingNode()) return NullNode.getInstance();

        if (node.isObject()) {
            ObjectNode dst = mapper.createObjectNode();
            List<String> fields = new ArrayList<>();
            node.fieldNames().forEachRemaining(fields::add);
            Collections.sort(fields);
            for (String f : fields) {
                if (ignore.contains(f)) continue;
                dst.set(f, normalize(mapper, node.get(f), ignore));
            }
            return dst;
        }
        if (node.isArray()) {
            ArrayNode arr = mapper.createArrayNode();
            for (JsonNode it : node) arr.add(normalize(mapper, it, ignore));
            return arr;
        }
        if (node.isNumber()) {
            return normalizeNumber(node);
        }
        return node;
    }

    public static String canonicalize(ObjectMapper mapper, JsonNode node, Set<String> ignore) {
        JsonNode norm = normalize(mapper, node, ignore);
        try {
            return CANONICAL.writeValueAsString(norm);
        } catch (Exception e) {
            throw new IllegalStateException("Cannot canonicalize value", e);
        }
    }

    /** Converts any Jackson-serializable value (maps, lists, records, scalars) to canonical JSON. */
    public static String canonicalize(ObjectMapper mapper, Object payload) {
        JsonNode node = (payload instanceof JsonNode j) ? j
                : mapper.valueToTree(payload == null ? Map.of() : payload);
        return canonicalize(mapper, node, Set.of());
    }

    /** Stable text for a scalar, matching what {@link #canonicalize} would embed for it. */
    public static String scalarText(Object value) {
        if (value == null) return "null";
        if (value instanceof BigDecimal bd) return plain(bd);
        if (value instanceof Number n) {
            if (value instanceof Double d && (d.isNaN() || d.isInfinite())) return d.toString();
            if (value instanceof Float f && (f.isNaN() || f.isInfinite())) return f.toString();
            return plain(new BigDecimal(n.toString()));
        }
        return String.valueOf(value);
    }

    private static JsonNode normalizeNumber(JsonNode node) {
        if (node.isDouble() || node.isFloat()) {
            double d = node.doubleValue();
            // NaN and infinities have no decimal form
            if (Double.isNaN(d) || Double.isInfinite(d)) return TextNode.valueOf(Double.toString(d));
        }
        BigDecimal normalized = node.decimalValue().stripTrailingZeros();
        if (normalized.signum() == 0) normalized = BigDecimal.ZERO;
        return DecimalNode.valueOf(normalized);
    }

    private static String plain(BigDecimal bd) {
        BigDecimal normalized = bd.stripTrailingZeros();
        return normalized.signum() == 0 ? "0" : normalized.toPlainString();
    }
}
