package com.example.jobfit.analyzer;

import com.example.jobfit.model.JobRequirements;
import com.example.jobfit.service.TextNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JobRequirementExtractorTest {

    private final JobRequirementExtractor extractor = new JobRequirementExtractor(new TextNormalizer());

    @Nested
    @DisplayName("with section headers")
    class WithHeaders {

        @Test
        @DisplayName("should read bullets under a German must-have header")
        void germanMustHave() {
            JobRequirements requirements = extractor.parseJobRequirements("Anforderungen:\n- TypeScript\n- React");

            assertThat(requirements.mustHave()).containsExactly("TypeScript", "React");
            assertThat(requirements.niceToHave()).isEmpty();
            assertThat(requirements.responsibilities()).isEmpty();
        }

        @Test
        @DisplayName("should split must-have, nice-to-have and responsibilities sections")
        void allSections() {
            String posting = """
                    Backend Developer

                    Requirements:
                    - Java
                    1. Spring Boot
                      SQL databases
                    not a bullet

                    Nice to have:
                    * Kafka

                    Responsibilities:
                    • Build services
                    """;

            JobRequirements requirements = extractor.parseJobRequirements(posting);

            assertThat(requirements.mustHave()).containsExactly("Java", "Spring Boot", "SQL databases");
            assertThat(requirements.niceToHave()).containsExactly("Kafka");
            assertThat(requirements.responsibilities()).containsExactly("Build services");
        }

        @Test
        @DisplayName("should recognize headers regardless of case and language")
        void caseAndLanguage() {
            String posting = "WIR ERWARTEN\n- Python\nWünschenswert:\n- Docker\nAufgaben\n- APIs entwickeln";

            JobRequirements requirements = extractor.parseJobRequirements(posting);

            assertThat(requirements.mustHave()).containsExactly("Python");
            assertThat(requirements.niceToHave()).containsExactly("Docker");
            assertThat(requirements.responsibilities()).containsExactly("APIs entwickeln");
        }
    }

    @Nested
    @DisplayName("without section headers")
    class Fallback {

        @Test
        @DisplayName("should fall back to phrases from the top of the posting as must-haves")
        void phrases() {
            String posting = "OUR COMPANY PROFILE\n"
                    + "Backend Developer position\n"
                    + "We are looking for an experienced Java engineer who enjoys clean code";

            JobRequirements requirements = extractor.parseJobRequirements(posting);

            assertThat(requirements.mustHave())
                    .contains("backend developer", "developer position", "Backend Developer position")
                    .doesNotContain("company profile")
                    .hasSizeLessThanOrEqualTo(30);
            assertThat(requirements.niceToHave()).isEmpty();
        }
    }

    @Test
    @DisplayName("should return empty lists for blank input")
    void blank() {
        assertThat(extractor.parseJobRequirements(null).mustHave()).isEmpty();
        assertThat(extractor.parseJobRequirements("  \n ").matchableCount()).isZero();
    }

    @Test
    @DisplayName("parseBullets() should skip empty and unmarked lines")
    void parseBullets() {
        String[] lines = {"- one", "", "plain", "    indented", "2. two"};

        assertThat(JobRequirementExtractor.parseBullets(lines, 0, lines.length))
                .containsExactly("one", "indented", "two");
    }
}
