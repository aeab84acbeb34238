package com.example.accessgate.rbac;

import com.example.accessgate.model.Action;
import com.example.accessgate.model.Permission;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.example.accessgate.util.AccessModelTestBuilder.aPermission;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ResourceMatcher")
class ResourceMatcherTest {

    private final ResourceMatcher matcher = new ResourceMatcher();

    private final ResourceMatcher.MatchTarget invoice =
            new ResourceMatcher.MatchTarget("invoice", "inv-42", "/acme/finance/inv-42");

    @Test
    @DisplayName("should match an exact resource id only")
    void shouldMatchExactId() {
        Permission exact = aPermission("p1", "invoice", Action.READ).resourceId("inv-42").build();
        Permission other = aPermission("p2", "invoice", Action.READ).resourceId("inv-43").build();

        assertThat(matcher.matches(exact, invoice)).isTrue();
        assertThat(matcher.matches(other, invoice)).isFalse();
    }

    @Test
    @DisplayName("should treat a permission without locator as type-wide")
    void shouldMatchTypeWide() {
        Permission typeWide = aPermission("p1", "invoice", Action.READ).build();
        Permission otherType = aPermission("p2", "contract", Action.READ).build();

        assertThat(matcher.matches(typeWide, invoice)).isTrue();
        assertThat(matcher.matches(otherType, invoice)).isFalse();
    }

    @Test
    @DisplayName("should match path globs with star and question mark")
    void shouldMatchPathGlobs() {
        assertThat(matcher.matches(aPermission("p1", "invoice", Action.READ)
                .resourcePath("/acme/finance/*").build(), invoice)).isTrue();
        assertThat(matcher.matches(aPermission("p2", "invoice", Action.READ)
                .resourcePath("/acme/*/inv-4?").build(), invoice)).isTrue();
        assertThat(matcher.matches(aPermission("p3", "invoice", Action.READ)
                .resourcePath("/acme/hr/*").build(), invoice)).isFalse();
    }

    @Test
    @DisplayName("should treat regex metacharacters in a glob literally")
    void shouldQuoteRegexCharacters() {
        ResourceMatcher.MatchTarget dotted = new ResourceMatcher.MatchTarget("file", "f1", "/docs/a.b/file");

        assertThat(matcher.matchesPattern("/docs/a.b/*", dotted)).isTrue();
        assertThat(matcher.matchesPattern("/docs/aXb/*", dotted)).isFalse();
    }

    @Test
    @DisplayName("should match chain patterns against type and type:id references")
    void shouldMatchTypeReferences() {
        ResourceMatcher.MatchTarget noPath = new ResourceMatcher.MatchTarget("doc", "123", null);

        assertThat(matcher.matchesPattern("doc:*", noPath)).isTrue();
        assertThat(matcher.matchesPattern("doc", noPath)).isTrue();
        assertThat(matcher.matchesPattern("invoice:*", noPath)).isFalse();
        assertThat(matcher.matchesPattern(null, noPath)).isTrue();
    }
}
