package com.jreinhal.legaldoc.util;

import static org.assertj.core.api.Assertions.assertThat;

import com.jreinhal.legaldoc.constant.StopWords;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TextTokenizerTest {

    @Nested
    @DisplayName("terms()")
    class TermsTest {
        @Test
        @DisplayName("Should lower-case, drop stop words and keep document order")
        void shouldNormalizeTokens() {
            assertThat(TextTokenizer.terms("What does the Constitution say about Parliament?"))
                    .containsExactly("constitution", "say", "parliament")
                    .doesNotContain("what", "the");
        }

        @Test
        @DisplayName("Should keep numbers, including single digits")
        void shouldKeepNumbers() {
            assertThat(TextTokenizer.terms("Article 21 and Section 5")).containsExactly("article", "21", "section", "5");
        }

        @Test
        @DisplayName("Should cut possessives at the apostrophe")
        void shouldCutPossessives() {
            assertThat(TextTokenizer.terms("the president's powers")).containsExactly("president", "power");
        }

        @Test
        @DisplayName("Should return an empty list for null or blank text")
        void shouldHandleBlank() {
            assertThat(TextTokenizer.terms(null)).isEmpty();
            assertThat(TextTokenizer.terms("   ")).isEmpty();
        }

        @Test
        @DisplayName("Should honour the stop word set it is given")
        void shouldUseGivenStopWords() {
            assertThat(TextTokenizer.terms("explain the rights", StopWords.RETRIEVAL)).containsExactly("right");
            assertThat(TextTokenizer.terms("explain the rights", StopWords.RERANKER)).containsExactly("explain", "right");
        }
    }

    @Nested
    @DisplayName("stem()")
    class StemTest {
        @Test
        @DisplayName("Should map plural and inflected forms onto one term")
        void shouldStripSuffixes() {
            assertThat(TextTokenizer.stem("rights")).isEqualTo("right");
            assertThat(TextTokenizer.stem("liberties")).isEqualTo("liberty");
            assertThat(TextTokenizer.stem("amended")).isEqualTo("amend");
            assertThat(TextTokenizer.stem("guaranteeing")).isEqualTo("guarantee");
            assertThat(TextTokenizer.stem("clauses")).isEqualTo("clause");
        }

        @Test
        @DisplayName("Should leave short words and protected endings alone")
        void shouldKeepProtectedWords() {
            assertThat(TextTokenizer.stem("acts")).isEqualTo("acts");
            assertThat(TextTokenizer.stem("status")).isEqualTo("status");
            assertThat(TextTokenizer.stem("basis")).isEqualTo("basis");
            assertThat(TextTokenizer.stem("address")).isEqualTo("address");
        }
    }

    @Test
    void termFrequenciesCountRepeats() {
        Map<String, Integer> tf = TextTokenizer.termFrequencies(List.of("court", "appeal", "court"));
        assertThat(tf).containsEntry("court", 2).containsEntry("appeal", 1);
    }

    @Test
    void numbersExtractsWholeNumbersOnly() {
        assertThat(TextTokenizer.numbers("Article 21A, Section 5(1) of the 1950 Act"))
                .containsExactly("5", "1", "1950");
    }
}
