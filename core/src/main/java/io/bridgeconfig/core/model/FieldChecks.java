package io.bridgeconfig.core.model;

import io.bridgeconfig.core.error.ConfigIssue;
import io.bridgeconfig.core.error.SchemaViolationException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Collects static constraint violations of one record so that the record reports every bad
 * field at once instead of stopping at the first.
 */
final class FieldChecks {

    /** Upper bound of every ppm-denominated field. */
    static final long MAX_PPM = 999_999;

    private final List<ConfigIssue> issues = new ArrayList<>();

    FieldChecks atLeast(String field, long value, long min) {
        if (value < min) {
            issues.add(ConfigIssue.field(field, "must be at least " + min + ", got " + value));
        }
        return this;
    }

    FieldChecks ppm(String field, long value) {
        atLeast(field, value, 0);
        if (value > MAX_PPM) {
            issues.add(ConfigIssue.field(field, "must be at most " + MAX_PPM + ", got " + value));
        }
        return this;
    }

    FieldChecks nonNegative(String field, BigInteger value) {
        Objects.requireNonNull(value, field + " must not be null");
        if (value.signum() < 0) {
            issues.add(ConfigIssue.field(field, "must be at least 0, got " + value));
        }
        return this;
    }

    FieldChecks chainIds(String field, Set<Long> chainIds) {
        for (Long chainId : chainIds) {
            if (chainId < 1) {
                issues.add(new ConfigIssue(
                        ConfigIssue.child(ConfigIssue.child(ConfigIssue.ROOT, field), chainId.toString()),
                        "chain id must be at least 1, got " + chainId));
            }
        }
        return this;
    }

    void throwIfAny() {
        if (!issues.isEmpty()) {
            throw new SchemaViolationException(issues);
        }
    }

    /** Insertion-ordered, unmodifiable copy. Rejects null keys and values. */
    static <K, V> Map<K, V> orderedCopy(Map<K, V> map, String field) {
        Objects.requireNonNull(map, field + " must not be null");
        Map<K, V> copy = new LinkedHashMap<>();
        map.forEach((key, value) -> {
            Objects.requireNonNull(key, field + " must not contain null keys");
            Objects.requireNonNull(value, field + " must not contain null values");
            copy.put(key, value);
        });
        return Collections.unmodifiableMap(copy);
    }

    /** Insertion-ordered, unmodifiable copy; duplicates keep their first position. */
    static Set<String> orderedCopy(Set<String> set, String field) {
        Objects.requireNonNull(set, field + " must not be null");
        Set<String> copy = new LinkedHashSet<>();
        for (String element : set) {
            copy.add(Objects.requireNonNull(element, field + " must not contain null"));
        }
        return Collections.unmodifiableSet(copy);
    }

    private FieldChecks() {}

    static FieldChecks start() {
        return new FieldChecks();
    }
}
