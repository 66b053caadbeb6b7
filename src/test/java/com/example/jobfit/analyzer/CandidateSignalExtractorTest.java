package com.example.jobfit.analyzer;

import com.example.jobfit.model.CandidateProfile;
import com.example.jobfit.model.CandidateSignals;
import com.example.jobfit.model.ExperienceEntry;
import com.example.jobfit.service.TextNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class CandidateSignalExtractorTest {

    private final CandidateSignalExtractor extractor = new CandidateSignalExtractor(new TextNormalizer());

    @Test
    @DisplayName("should separate skill tokens from experience tokens")
    void tokens() {
        CandidateProfile profile = new CandidateProfile(
                "Tech lead at Acme.",
                List.of(new ExperienceEntry("Acme", "Senior Backend Engineer", "01/2019", "current",
                        "Led a team of 4 and mentored juniors. 5+ years experience with microservices.")),
                List.of(),
                "Java, SQL",
                null);

        CandidateSignals signals = extractor.extractCandidateSignals(profile);

        assertThat(signals.skillsTokens()).containsExactly("java", "sql");
        assertThat(signals.experienceTokens()).contains("senior", "backend", "engineer", "tech", "lead");
        assertThat(signals.experienceTokens()).doesNotContain("java");
        assertThat(signals.senioritySignals())
                .contains("senior", "lead", "tech lead", "5 years experience", "senior backend");
    }

    @Test
    @DisplayName("should return empty signals for a missing profile")
    void nullProfile() {
        CandidateSignals signals = extractor.extractCandidateSignals(null);

        assertThat(signals.allTokens()).isEmpty();
    }

    @Test
    @DisplayName("should detect German seniority vocabulary with word boundaries")
    void german() {
        Set<String> signals = extractor.extractSenioritySignals("Teamleiter mit Führung und 3 Jahre Erfahrung");

        assertThat(signals).contains("teamleiter", "führung", "jahre", "erfahrung", "3 years experience");
        assertThat(extractor.extractSenioritySignals("Leadership-free")).contains("leadership");
        assertThat(extractor.extractSenioritySignals("misleading")).doesNotContain("leading");
    }

    @Test
    @DisplayName("containsSeniorityKeyword() should accept raw and stemmed keywords")
    void containsSeniorityKeyword() {
        assertThat(extractor.containsSeniorityKeyword(Set.of("java", "leadership"))).isTrue();
        assertThat(extractor.containsSeniorityKeyword(Set.of("führ"))).isTrue();
        assertThat(extractor.containsSeniorityKeyword(Set.of("java", "sql"))).isFalse();
    }
}
