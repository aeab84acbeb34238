package com.example.accessgate.rbac;

import com.example.accessgate.model.Permission;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Resource matching shared by permission aggregation and approval chain lookup.
 *
 * <p>Glob patterns support {@code *} (any run of characters, including separators) and
 * {@code ?} (one character). A pattern matches a resource when it matches the resource's
 * materialized path, its type, or its {@code type:id} reference.
 */
@Component
public class ResourceMatcher {

    private final Map<String, Pattern> compiled = new ConcurrentHashMap<>();

    /**
     * Whether the permission's locator covers the resource. Actions and conditions are not checked.
     */
    public boolean matches(@NonNull Permission permission, @NonNull MatchTarget target) {
        if (permission.resourceType() != null && !permission.resourceType().equals(target.type())) {
            return false;
        }
        if (permission.resourceId() != null) {
            return permission.resourceId().equals(target.id());
        }
        if (permission.resourcePath() != null) {
            return matchesPattern(permission.resourcePath(), target);
        }
        return true;
    }

    public boolean matchesPattern(@Nullable String pattern, @NonNull MatchTarget target) {
        if (pattern == null || pattern.isBlank()) {
            return true;
        }
        Pattern regex = compiled.computeIfAbsent(pattern, ResourceMatcher::toRegex);
        return matches(regex, target.path())
                || matches(regex, target.type())
                || (target.id() != null && matches(regex, target.type() + ":" + target.id()));
    }

    private static boolean matches(Pattern regex, @Nullable String candidate) {
        return candidate != null && regex.matcher(candidate).matches();
    }

    static Pattern toRegex(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() + 8);
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (!literal.isEmpty()) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (!literal.isEmpty()) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString());
    }

    /**
     * Resource fields relevant to matching.
     */
    public record MatchTarget(String type, @Nullable String id, @Nullable String path) {
    }
}
