package com.example.accessgate.condition;

import java.util.List;

/**
 * Attribute condition checked against a request context. The path is a dot-separated lookup
 * into the context map, e.g. {@code principal.department}.
 */
public sealed interface Condition permits Condition.Equals, Condition.InSet, Condition.Range {

    String path();

    record Equals(String path, Object expected) implements Condition {
    }

    record InSet(String path, List<Object> values) implements Condition {
        public InSet {
            values = List.copyOf(values);
        }
    }

    /**
     * Inclusive range over numbers, instants, dates or times of day.
     */
    record Range(String path, Object low, Object high) implements Condition {
    }
}
