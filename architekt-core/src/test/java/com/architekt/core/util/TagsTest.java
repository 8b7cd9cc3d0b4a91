package com.architekt.core.util;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link Tags}.
 */
class TagsTest {

    @Test
    void normalize_trimsDropsBlanksAndDeduplicates() {
        List<String> tags = Tags.normalize(Arrays.asList(" checkout ", "payments", "", null, "checkout", "  "));

        assertThat(tags).containsExactly("checkout", "payments");
    }

    @Test
    void normalize_withNull_returnsEmptyList() {
        assertThat(Tags.normalize(null)).isEmpty();
    }

    @Test
    void normalize_resultIsUnmodifiable() {
        List<String> tags = Tags.normalize(List.of("a"));

        assertThatThrownBy(() -> tags.add("b")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void split_acceptsCommasAndNewlines() {
        assertThat(Tags.split("draft, published\narchived,draft")).containsExactly("draft", "published", "archived");
    }

    @Test
    void containsAll_withNoRequiredTags_matchesEverything() {
        assertThat(Tags.containsAll(List.of(), List.of())).isTrue();
        assertThat(Tags.containsAll(List.of("a", "b"), List.of("b"))).isTrue();
        assertThat(Tags.containsAll(List.of("a"), List.of("a", "c"))).isFalse();
    }
}
