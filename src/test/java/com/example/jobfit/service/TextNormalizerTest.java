package com.example.jobfit.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    private final TextNormalizer normalizer = new TextNormalizer();

    @Nested
    @DisplayName("tokenize")
    class Tokenize {

        @Test
        @DisplayName("should lowercase, strip punctuation and drop short words and stopwords")
        void basicNormalization() {
            Set<String> tokens = normalizer.tokenize("TypeScript, React and the Node.js API!");

            assertThat(tokens).containsExactly("typescript", "react", "node", "api");
        }

        @Test
        @DisplayName("should return an empty set for null, empty and blank input")
        void emptyInput() {
            assertThat(normalizer.tokenize(null)).isEmpty();
            assertThat(normalizer.tokenize("")).isEmpty();
            assertThat(normalizer.tokenize("   \n\t ")).isEmpty();
        }

        @Test
        @DisplayName("should deduplicate tokens after stemming, keeping first-occurrence order")
        void deduplicates() {
            Set<String> tokens = normalizer.tokenize("testing tests testing java");

            assertThat(tokens).containsExactly("test", "java");
        }

        @Test
        @DisplayName("should keep German umlauts inside words")
        void keepsUmlauts() {
            Set<String> tokens = normalizer.tokenize("Führung und Größe");

            assertThat(tokens).contains("führ", "größ");
        }

        @Test
        @DisplayName("should produce identical, lowercase, stopword-free tokens for the same text")
        void repeatable() {
            String text = "We expect 5+ years of Experience with Kubernetes and the AWS Cloud";

            Set<String> first = normalizer.tokenize(text);
            Set<String> second = normalizer.tokenize(text);

            assertThat(second).isEqualTo(first);
            assertThat(first).allSatisfy(token -> {
                assertThat(token).isEqualTo(token.toLowerCase());
                assertThat(normalizer.isStopword(token)).isFalse();
            });
        }
    }

    @Nested
    @DisplayName("stem")
    class Stem {

        @Test
        @DisplayName("should never strip -er")
        void keepsEr() {
            assertThat(normalizer.stem("developer")).isEqualTo("developer");
            assertThat(normalizer.stem("manager")).isEqualTo("manager");
        }

        @Test
        @DisplayName("should leave words of four characters or fewer alone")
        void shortWords() {
            assertThat(normalizer.stem("uses")).isEqualTo("uses");
            assertThat(normalizer.stem("java")).isEqualTo("java");
        }

        @Test
        @DisplayName("should strip the first matching English suffix")
        void englishSuffixes() {
            assertThat(normalizer.stem("building")).isEqualTo("build");
            assertThat(normalizer.stem("migration")).isEqualTo("migra");
            assertThat(normalizer.stem("services")).isEqualTo("service");
            assertThat(normalizer.stem("deployed")).isEqualTo("deploy");
        }

        @Test
        @DisplayName("should fall back to German suffixes")
        void germanSuffixes() {
            assertThat(normalizer.stem("erfahrung")).isEqualTo("erfahr");
            assertThat(normalizer.stem("datenbank")).isEqualTo("datenbank");
            assertThat(normalizer.stem("kenntnisse")).isEqualTo("kenntniss");
        }

        @Test
        @DisplayName("should not strip a suffix when too little of the word would remain")
        void minimumRemainder() {
            // stripping "ing" would leave only "sl"
            assertThat(normalizer.stem("sling")).isEqualTo("sling");
        }
    }

    @Test
    @DisplayName("words() should keep order and duplicates but drop stopwords")
    void words() {
        assertThat(normalizer.words("Data engineering with data pipelines"))
                .containsExactly("data", "engineering", "data", "pipelines");
    }

    @Test
    @DisplayName("containsPhrase() should match multi-word phrases through their normalized tokens")
    void containsPhrase() {
        Set<String> tokens = normalizer.tokenize("Built a data pipeline on AWS");

        assertThat(normalizer.containsPhrase(tokens, "data pipeline")).isTrue();
        assertThat(normalizer.containsPhrase(tokens, "aws")).isTrue();
        assertThat(normalizer.containsPhrase(tokens, "google cloud")).isFalse();
        assertThat(normalizer.containsPhrase(tokens, "ts")).isFalse();
    }
}
