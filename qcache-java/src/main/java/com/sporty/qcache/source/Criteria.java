package com.sporty.qcache.source;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable conjunction of field equality conditions, kept in declaration order.
 * <p>
 * Sample Code:
 * <pre>
 * Criteria.where("team", "red").and("age", 30);
 * </pre>
 */
public final class Criteria {
    private static final Criteria EMPTY = new Criteria(Collections.emptyMap());

    private final Map<String, Object> conditions;

    private Criteria(final Map<String, Object> conditions) {
        this.conditions = conditions;
    }

    public static Criteria empty() {
        return EMPTY;
    }

    public static Criteria where(final String field, final Object value) {
        return EMPTY.and(field, value);
    }

    public static Criteria of(final Map<String, ?> conditions) {
        if (conditions == null || conditions.isEmpty()) {
            return EMPTY;
        }
        conditions.keySet().forEach(Criteria::requireField);
        return new Criteria(Collections.unmodifiableMap(new LinkedHashMap<>(conditions)));
    }

    public Criteria and(final String field, final Object value) {
        requireField(field);
        final Map<String, Object> merged = new LinkedHashMap<>(conditions);
        merged.put(field, value);
        return new Criteria(Collections.unmodifiableMap(merged));
    }

    public Map<String, Object> conditions() {
        return conditions;
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    private static void requireField(final String field) {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("field is null or blank");
        }
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof Criteria criteria)) return false;
        return conditions.equals(criteria.conditions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(conditions);
    }

    @Override
    public String toString() {
        return "Criteria" + conditions;
    }
}
