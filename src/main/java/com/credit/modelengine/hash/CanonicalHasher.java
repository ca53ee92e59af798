package com.credit.modelengine.hash;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Content hash over the canonical JSON form of a value.
 *
 * <p>
 * Canonical form:
 * <ul>
 * <li>object keys sorted lexicographically at every depth; array order kept</li>
 * <li>{@link #NON_DETERMINISTIC_FIELDS} removed at every depth</li>
 * <li>numbers written as plain decimals without trailing zeros, so {@code 1}
 * and {@code 1.0} hash alike; non-finite numbers as strings</li>
 * </ul>
 *
 * <p>
 * The value is first converted to a tree, so an object reached twice through a
 * shared reference hashes the same as two equal copies. Thread-safe.
 */
public final class CanonicalHasher {

    /** Wall-clock fields that never contribute to a content hash. */
    public static final Set<String> NON_DETERMINISTIC_FIELDS = Set.of(
            "generatedAt", "createdAt", "updatedAt", "computedAt", "finishedAt", "timestamp");

    private static final JsonNodeFactory NODES = JsonNodeFactory.withExactBigDecimals(true);

    private final ObjectMapper mapper;
    private final ObjectWriter writer;

    public CanonicalHasher() {
        this(new ObjectMapper());
    }

    public CanonicalHasher(ObjectMapper mapper) {
        this.mapper = mapper;
        this.writer = mapper.writer().with(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);
    }

    /** Lower-case hex SHA-256 of {@link #canonicalJson(Object)}. */
    public String hash(Object value) {
        return sha256Hex(canonicalJson(value));
    }

    public String canonicalJson(Object value) {
        JsonNode canonical = canonicalize(mapper.valueToTree(value));
        try {
            return writer.writeValueAsString(canonical);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value cannot be serialized for hashing", e);
        }
    }

    JsonNode canonicalize(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode())
            return NODES.nullNode();
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            for (Iterator<String> it = node.fieldNames(); it.hasNext();) {
                String name = it.next();
                if (!NON_DETERMINISTIC_FIELDS.contains(name))
                    names.add(name);
            }
            Collections.sort(names);
            ObjectNode sorted = NODES.objectNode();
            for (String name : names)
                sorted.set(name, canonicalize(node.get(name)));
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode array = NODES.arrayNode(node.size());
            for (JsonNode element : node)
                array.add(canonicalize(element));
            return array;
        }
        if (node.isNumber())
            return canonicalNumber(node);
        return node;
    }

    private static JsonNode canonicalNumber(JsonNode node) {
        if (node.isFloatingPointNumber() && !node.isBigDecimal()) {
            double d = node.doubleValue();
            if (!Double.isFinite(d))
                return NODES.textNode(Double.toString(d));
            return NODES.numberNode(strip(BigDecimal.valueOf(d)));
        }
        return NODES.numberNode(strip(node.decimalValue()));
    }

    private static BigDecimal strip(BigDecimal value) {
        return value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
    }

    static String sha256Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
