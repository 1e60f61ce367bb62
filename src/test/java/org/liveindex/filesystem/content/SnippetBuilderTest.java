package org.liveindex.filesystem.content;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SnippetBuilderTest {

    @Test
    void build_returnsShortLineWhole() {
        assertThat(SnippetBuilder.build("foobar", "foo", 240)).isEqualTo("foobar");
    }

    @Test
    void build_expandsTabs() {
        assertThat(SnippetBuilder.build("\tfoo", "foo", 240)).isEqualTo("    foo");
    }

    @Test
    void build_windowsAroundMatchWithEllipses() {
        String line = "x".repeat(100) + "Needle" + "y".repeat(200);

        String snippet = SnippetBuilder.build(line, "needle", 240);

        assertThat(snippet).startsWith("…").endsWith("…").contains("Needle");
        assertThat(snippet).hasSize(1 + SnippetBuilder.PRE_CONTEXT + "Needle".length() + SnippetBuilder.POST_CONTEXT + 1);
    }

    @Test
    void build_truncatesWhenQueryNotLiterallyPresent() {
        String line = "z".repeat(50);

        String snippet = SnippetBuilder.build(line, "fuzzy", 20);

        assertThat(snippet).hasSize(20).endsWith("…");
    }

    @Test
    void build_emptyLineGivesEmptySnippet() {
        assertThat(SnippetBuilder.build("", "foo", 240)).isEmpty();
    }
}
