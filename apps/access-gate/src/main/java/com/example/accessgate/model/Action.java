package com.example.accessgate.model;

import com.example.accessgate.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.lang.Nullable;

import java.util.Arrays;
import java.util.Locale;

public enum Action {
    CREATE("create"),
    READ("read"),
    UPDATE("update"),
    DELETE("delete"),
    EXECUTE("execute"),
    APPROVE("approve"),
    REJECT("reject");

    private final String value;

    Action(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Parses an action name. {@code write} is accepted as an alias of {@link #UPDATE}.
     *
     * @throws ValidationException for unknown or blank actions
     */
    @JsonCreator
    public static Action fromValue(@Nullable String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("Action must not be blank");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        if ("write".equals(normalized)) {
            return UPDATE;
        }
        return Arrays.stream(values())
                .filter(a -> a.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new ValidationException("Unknown action: " + raw));
    }
}
