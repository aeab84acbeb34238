package com.example.accessgate.condition;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Interpreter for {@link Condition} lists. All conditions must hold (logical AND); an empty
 * list always holds. Never throws: a missing attribute, a failed nested lookup or an
 * incomparable value is a non-match.
 */
@Slf4j
@Component
public class ConditionEvaluator {

    public boolean evaluate(@Nullable Collection<Condition> conditions, @NonNull Map<String, ?> context) {
        if (conditions == null || conditions.isEmpty()) {
            return true;
        }
        for (Condition condition : conditions) {
            if (!matches(condition, context)) {
                log.debug("Condition not satisfied: {}", condition.path());
                return false;
            }
        }
        return true;
    }

    public boolean matches(@NonNull Condition condition, @NonNull Map<String, ?> context) {
        try {
            Optional<Object> actual = resolve(context, condition.path());
            if (actual.isEmpty()) {
                return false;
            }
            Object value = actual.get();
            if (condition instanceof Condition.Equals eq) {
                return valueEquals(value, eq.expected());
            }
            if (condition instanceof Condition.InSet in) {
                return in.values().stream().anyMatch(candidate -> valueEquals(value, candidate));
            }
            if (condition instanceof Condition.Range range) {
                return inRange(value, range.low(), range.high());
            }
            return false;
        } catch (RuntimeException e) {
            log.debug("Condition {} evaluated to false: {}", condition.path(), e.getMessage());
            return false;
        }
    }

    /**
     * Resolves a dot-separated path against nested maps.
     */
    @NonNull
    public static Optional<Object> resolve(@NonNull Map<String, ?> context, @NonNull String path) {
        Object current = context;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map) || !map.containsKey(segment)) {
                return Optional.empty();
            }
            current = map.get(segment);
        }
        return Optional.ofNullable(current);
    }

    private static boolean valueEquals(Object actual, Object expected) {
        if (actual instanceof Number a && expected instanceof Number e) {
            return toDecimal(a).compareTo(toDecimal(e)) == 0;
        }
        if (actual instanceof Collection<?> values) {
            return values.stream().anyMatch(v -> valueEquals(v, expected));
        }
        if (actual instanceof Enum<?> e) {
            return e.name().equals(String.valueOf(expected));
        }
        return Objects.equals(actual, expected);
    }

    private static boolean inRange(Object value, Object low, Object high) {
        if (value instanceof Number && low instanceof Number && high instanceof Number) {
            BigDecimal v = toDecimal((Number) value);
            return v.compareTo(toDecimal((Number) low)) >= 0 && v.compareTo(toDecimal((Number) high)) <= 0;
        }
        Instant instant = toInstant(value);
        if (instant != null) {
            Instant lo = toInstant(low);
            Instant hi = toInstant(high);
            return lo != null && hi != null && !instant.isBefore(lo) && !instant.isAfter(hi);
        }
        LocalDate date = toDate(value);
        if (date != null) {
            LocalDate lo = toDate(low);
            LocalDate hi = toDate(high);
            return lo != null && hi != null && !date.isBefore(lo) && !date.isAfter(hi);
        }
        LocalTime time = toTime(value);
        if (time != null) {
            LocalTime lo = toTime(low);
            LocalTime hi = toTime(high);
            return lo != null && hi != null && !time.isBefore(lo) && !time.isAfter(hi);
        }
        return false;
    }

    private static BigDecimal toDecimal(Number number) {
        return number instanceof BigDecimal bd ? bd : new BigDecimal(number.toString());
    }

    @Nullable
    private static Instant toInstant(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toInstant();
        }
        if (value instanceof String s && s.contains("T")) {
            try {
                return OffsetDateTime.parse(s).toInstant();
            } catch (DateTimeParseException e) {
                return null;
            }
        }
        return null;
    }

    @Nullable
    private static LocalDate toDate(Object value) {
        if (value instanceof LocalDate date) {
            return date;
        }
        if (value instanceof String s && s.length() == 10) {
            try {
                return LocalDate.parse(s);
            } catch (DateTimeParseException e) {
                return null;
            }
        }
        return null;
    }

    @Nullable
    private static LocalTime toTime(Object value) {
        if (value instanceof LocalTime time) {
            return time;
        }
        if (value instanceof String s && s.indexOf(':') > 0 && !s.contains("T")) {
            try {
                return LocalTime.parse(s);
            } catch (DateTimeParseException e) {
                return null;
            }
        }
        return null;
    }
}
