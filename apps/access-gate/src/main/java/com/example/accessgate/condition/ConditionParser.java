package com.example.accessgate.condition;

import com.example.accessgate.exception.ValidationException;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts the loose key/value condition maps used in stored documents and admin input
 * into typed {@link Condition}s, and back.
 *
 * <ul>
 *   <li>scalar value: {@link Condition.Equals}</li>
 *   <li>list value, or {@code {"in": [...]}}: {@link Condition.InSet}</li>
 *   <li>{@code {"range": [lo, hi]}}: {@link Condition.Range}</li>
 * </ul>
 */
public final class ConditionParser {

    public static final String IN = "in";
    public static final String RANGE = "range";

    private ConditionParser() {}

    @NonNull
    public static List<Condition> parse(@Nullable Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        List<Condition> conditions = new ArrayList<>(raw.size());
        raw.forEach((path, expected) -> conditions.add(parseEntry(path, expected)));
        return List.copyOf(conditions);
    }

    @NonNull
    public static Map<String, Object> toMap(@Nullable List<Condition> conditions) {
        Map<String, Object> map = new LinkedHashMap<>();
        if (conditions == null) {
            return map;
        }
        for (Condition condition : conditions) {
            if (condition instanceof Condition.Equals eq) {
                map.put(eq.path(), eq.expected());
            } else if (condition instanceof Condition.InSet in) {
                map.put(in.path(), in.values());
            } else if (condition instanceof Condition.Range range) {
                List<Object> bounds = new ArrayList<>(2);
                bounds.add(range.low());
                bounds.add(range.high());
                map.put(range.path(), Map.of(RANGE, bounds));
            }
        }
        return map;
    }

    private static Condition parseEntry(String path, Object expected) {
        if (path == null || path.isBlank()) {
            throw new ValidationException("Condition path must not be blank");
        }
        if (expected instanceof Collection<?> values) {
            return new Condition.InSet(path, new ArrayList<>(values));
        }
        if (expected instanceof Map<?, ?> operator) {
            if (operator.size() != 1) {
                throw new ValidationException("Condition operator for '" + path + "' must have exactly one key");
            }
            Object in = operator.get(IN);
            if (in instanceof Collection<?> values) {
                return new Condition.InSet(path, new ArrayList<>(values));
            }
            Object range = operator.get(RANGE);
            if (range instanceof List<?> bounds && bounds.size() == 2) {
                return new Condition.Range(path, bounds.get(0), bounds.get(1));
            }
            throw new ValidationException("Unsupported condition operator for '" + path + "': " + operator.keySet());
        }
        return new Condition.Equals(path, expected);
    }
}
