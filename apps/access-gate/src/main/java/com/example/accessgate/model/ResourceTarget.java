package com.example.accessgate.model;

import com.example.accessgate.exception.ValidationException;
import org.springframework.lang.Nullable;

/**
 * Resource named by a caller: a type plus an id, a path, or both.
 */
public record ResourceTarget(String type, @Nullable String id, @Nullable String path) {

    public static ResourceTarget ofId(String type, String id) {
        return new ResourceTarget(type, id, null);
    }

    public static ResourceTarget ofPath(String type, String path) {
        return new ResourceTarget(type, null, path);
    }

    /**
     * Parses {@code type:id}, e.g. {@code doc:123}.
     */
    public static ResourceTarget parse(String ref) {
        if (ref == null) {
            throw new ValidationException("Resource reference must not be null");
        }
        int idx = ref.indexOf(':');
        if (idx <= 0 || idx == ref.length() - 1) {
            throw new ValidationException("Resource reference must look like type:id, got " + ref);
        }
        return ofId(ref.substring(0, idx), ref.substring(idx + 1));
    }

    /**
     * @throws ValidationException when the type is missing or neither id nor path is given
     */
    public ResourceTarget validate() {
        if (type == null || type.isBlank()) {
            throw new ValidationException("Resource type must not be blank");
        }
        if (isBlank(id) && isBlank(path)) {
            throw new ValidationException("Resource " + type + " needs an id or a path");
        }
        return this;
    }

    /**
     * Stable identity used for cache keys, grants and duplicate request detection.
     */
    public String key() {
        return type + ":" + (isBlank(id) ? path : id);
    }

    public String locator() {
        return isBlank(id) ? path : id;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
