package com.example.jobfit.analyzer;

import com.example.jobfit.model.CandidateSignals;
import com.example.jobfit.model.MatchStatus;
import com.example.jobfit.model.Relevance;
import com.example.jobfit.model.RequirementMatch;
import com.example.jobfit.service.AnalysisWarnings;
import com.example.jobfit.service.SynonymIndex;
import com.example.jobfit.service.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Scores each requirement against the candidate's tokens in three tiers:
 * exact token match, synonym match, then plain token overlap.
 */
@Service
public class RequirementMatcher {

    private static final Logger log = LoggerFactory.getLogger(RequirementMatcher.class);

    static final int MAX_REQUIREMENTS = 1_000;
    static final int WARNING_THRESHOLD = 500;

    /** Similarity at or above which a requirement counts as met. */
    static final double MET_THRESHOLD = 0.7;
    /** Similarity at or above which an overlap counts as partial. */
    static final double PARTIAL_THRESHOLD = 0.3;
    /** Similarity above which relevance is high even without an exact or synonym match. */
    static final double HIGH_RELEVANCE_THRESHOLD = 0.8;
    static final double MEDIUM_RELEVANCE_THRESHOLD = 0.5;

    static final String NO_SIGNALS = "No candidate signals provided";
    static final String NO_TOKENS = "Requirement contains no valid tokens after normalization";
    static final String NO_MATCH = "No matching tokens found";

    private final TextNormalizer normalizer;
    private final SynonymIndex synonyms;

    public RequirementMatcher(TextNormalizer normalizer, SynonymIndex synonyms) {
        this.normalizer = normalizer;
        this.synonyms = synonyms;
    }

    public List<RequirementMatch> matchRequirements(List<String> requirements, CandidateSignals signals) {
        if (requirements == null || requirements.isEmpty()) return List.of();

        List<String> input = requirements;
        if (input.size() > MAX_REQUIREMENTS) {
            AnalysisWarnings.report("matchRequirements", "Requirements list size (%d) exceeds limit (%d), truncated"
                    .formatted(input.size(), MAX_REQUIREMENTS));
            input = input.subList(0, MAX_REQUIREMENTS);
        } else if (input.size() > WARNING_THRESHOLD) {
            AnalysisWarnings.report("matchRequirements", "Large requirements list (%d), processing may take longer"
                    .formatted(input.size()));
        }

        if (signals == null) {
            return input.stream()
                    .map(req -> RequirementMatch.missing(req, NO_SIGNALS))
                    .toList();
        }

        Set<String> candidateTokens = signals.allTokens();
        List<RequirementMatch> results = new ArrayList<>(input.size());
        for (String requirement : input) {
            if (requirement == null || requirement.isBlank()) continue;
            results.add(match(requirement, candidateTokens));
        }

        log.debug("Matched {} requirements", results.size());
        return results;
    }

    private RequirementMatch match(String requirement, Set<String> candidateTokens) {
        List<String> tokens = List.copyOf(normalizer.tokenize(requirement));
        if (tokens.isEmpty()) {
            return RequirementMatch.missing(requirement, NO_TOKENS);
        }

        // 1. Exact
        String joined = String.join(" ", tokens);
        if (candidateTokens.contains(joined)) {
            return new RequirementMatch(requirement, MatchStatus.MET, 1.0, Relevance.HIGH,
                    "Found in skills/experience: " + joined);
        }
        if (candidateTokens.containsAll(tokens)) {
            return new RequirementMatch(requirement, MatchStatus.MET, 1.0, Relevance.HIGH,
                    "Found all tokens: " + String.join(", ", tokens));
        }

        // 2. Synonym: applies once at least one token is covered by a genuine equivalent
        int matched = 0;
        List<String> viaSynonym = new ArrayList<>();
        for (String token : tokens) {
            if (candidateTokens.contains(token)) {
                matched++;
                continue;
            }
            for (String synonym : synonyms.getSynonyms(token)) {
                if (!synonym.equals(token) && normalizer.containsPhrase(candidateTokens, synonym)) {
                    matched++;
                    viaSynonym.add(token + " → " + synonym);
                    break;
                }
            }
        }
        if (!viaSynonym.isEmpty()) {
            double similarity = (double) matched / tokens.size();
            MatchStatus status = similarity >= MET_THRESHOLD ? MatchStatus.MET : MatchStatus.PARTIAL;
            return new RequirementMatch(requirement, status, similarity, Relevance.HIGH,
                    "Found via synonym: " + String.join(", ", viaSynonym));
        }

        // 3. Overlap
        double similarity = overlap(tokens, candidateTokens);
        MatchStatus status;
        if (similarity >= MET_THRESHOLD) {
            status = MatchStatus.MET;
        } else if (similarity >= PARTIAL_THRESHOLD) {
            status = MatchStatus.PARTIAL;
        } else {
            status = MatchStatus.MISSING;
        }
        String evidence = similarity > 0
                ? "Partial match: %d%% token overlap".formatted(Math.round(similarity * 100))
                : NO_MATCH;
        return new RequirementMatch(requirement, status, similarity, relevance(similarity), evidence);
    }

    static double overlap(List<String> tokens, Set<String> candidateTokens) {
        if (tokens.isEmpty()) return 0.0;
        long hits = tokens.stream().filter(candidateTokens::contains).count();
        return (double) hits / tokens.size();
    }

    static Relevance relevance(double similarity) {
        if (similarity > HIGH_RELEVANCE_THRESHOLD) return Relevance.HIGH;
        if (similarity >= MEDIUM_RELEVANCE_THRESHOLD) return Relevance.MEDIUM;
        return Relevance.LOW;
    }
}
