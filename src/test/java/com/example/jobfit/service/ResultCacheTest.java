package com.example.jobfit.service;

import com.example.jobfit.model.AnalysisResult;
import com.example.jobfit.model.CandidateProfile;
import com.example.jobfit.model.ExperienceEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultCacheTest {

    private static AnalysisResult result() {
        return new AnalysisResult(null, null, List.of(), null, null, List.of());
    }

    @Nested
    @DisplayName("storage")
    class Storage {

        @Test
        @DisplayName("should evict the oldest inserted entry once full")
        void fifoEviction() {
            ResultCache cache = new ResultCache(2);
            AnalysisResult first = result();
            AnalysisResult second = result();
            AnalysisResult third = result();

            cache.put("a", first);
            cache.put("b", second);
            cache.get("a"); // reads do not refresh
            cache.put("c", third);

            assertThat(cache.size()).isEqualTo(2);
            assertThat(cache.get("a")).isNull();
            assertThat(cache.get("b")).isSameAs(second);
            assertThat(cache.get("c")).isSameAs(third);
        }

        @Test
        @DisplayName("should reject a non-positive capacity")
        void invalidCapacity() {
            assertThatThrownBy(() -> new ResultCache(0))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("clear() should drop every entry")
        void clear() {
            ResultCache cache = new ResultCache(5);
            cache.put("a", result());
            cache.clear();

            assertThat(cache.size()).isZero();
            assertThat(cache.maxEntries()).isEqualTo(5);
        }
    }

    @Nested
    @DisplayName("key")
    class Key {

        private final CandidateProfile profile = new CandidateProfile(
                "Backend developer",
                List.of(new ExperienceEntry("Acme", "Developer", "01/2020", "current", "Built APIs")),
                List.of(),
                "Java, SQL",
                null);

        @Test
        @DisplayName("should be a stable 32-character hex digest for equal inputs")
        void deterministic() {
            CandidateProfile copy = new CandidateProfile(
                    "Backend developer",
                    List.of(new ExperienceEntry("Acme", "Developer", "01/2020", "current", "Built APIs")),
                    List.of(),
                    "Java, SQL",
                    "");

            String key = ResultCache.key(profile, "Java developer wanted");

            assertThat(key).hasSize(32).matches("[0-9a-f]+");
            assertThat(ResultCache.key(copy, "Java developer wanted")).isEqualTo(key);
        }

        @Test
        @DisplayName("should ignore surrounding whitespace of the posting")
        void trimsPosting() {
            assertThat(ResultCache.key(profile, "  Java developer wanted \n"))
                    .isEqualTo(ResultCache.key(profile, "Java developer wanted"));
        }

        @Test
        @DisplayName("should change when either input changes")
        void sensitiveToContent() {
            String key = ResultCache.key(profile, "Java developer wanted");

            assertThat(ResultCache.key(profile, "Python developer wanted")).isNotEqualTo(key);
            assertThat(ResultCache.key(profile.withSkills("Java, SQL, Docker"), "Java developer wanted"))
                    .isNotEqualTo(key);
        }
    }
}
