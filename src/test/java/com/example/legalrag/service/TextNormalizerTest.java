package com.example.legalrag.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    @Test
    void cleanReplacesNonBreakingSpacesAndCollapsesBlankLines() {
        assertThat(TextNormalizer.clean("  (1)\u00A0Text \t cu   spații\r\n\n\n\nfinal  "))
            .isEqualTo("(1) Text cu spații\n\nfinal");
    }

    @Test
    void singleLineCollapsesEveryWhitespaceRun() {
        assertThat(TextNormalizer.singleLine("a\n\n b \tc ")).isEqualTo("a b c");
    }

    @Test
    void nullBecomesEmpty() {
        assertThat(TextNormalizer.clean(null)).isEmpty();
        assertThat(TextNormalizer.singleLine(null)).isEmpty();
    }
}
