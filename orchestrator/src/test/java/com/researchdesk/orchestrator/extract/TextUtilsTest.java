package com.researchdesk.orchestrator.extract;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextUtilsTest {

    @Test
    void safeTruncate_shortTextIsUnchanged() {
        assertThat(TextUtils.safeTruncate("short", 100)).isEqualTo("short");
    }

    @Test
    void safeTruncate_prefersParagraphBoundaryInSecondHalf() {
        String text = "a".repeat(80) + "\n\n" + "b".repeat(200);

        String truncated = TextUtils.safeTruncate(text, 150);

        assertThat(truncated).isEqualTo("a".repeat(80) + "\n\n" + TextUtils.TRUNCATION_NOTICE);
    }

    @Test
    void safeTruncate_cutsHardWhenNoBoundaryIsClose() {
        String text = "c".repeat(300);

        String truncated = TextUtils.safeTruncate(text, 100);

        assertThat(truncated).isEqualTo("c".repeat(100) + "...\n" + TextUtils.TRUNCATION_NOTICE);
    }

    @Test
    void normalizeWhitespace_collapsesRuns() {
        assertThat(TextUtils.normalizeWhitespace("  a \n\t b  ")).isEqualTo("a b");
        assertThat(TextUtils.normalizeWhitespace(null)).isEmpty();
    }
}
