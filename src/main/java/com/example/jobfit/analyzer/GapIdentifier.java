package com.example.jobfit.analyzer;

import com.example.jobfit.model.CandidateSignals;
import com.example.jobfit.model.GapActionCard;
import com.example.jobfit.model.MatchStatus;
import com.example.jobfit.model.RecommendedAction;
import com.example.jobfit.model.Relevance;
import com.example.jobfit.model.RequirementMatch;
import com.example.jobfit.service.SynonymIndex;
import com.example.jobfit.service.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Turns partial and missing requirements into remediation cards.
 * Low-relevance gaps are not worth acting on and never appear in the output.
 */
@Service
public class GapIdentifier {

    private static final Logger log = LoggerFactory.getLogger(GapIdentifier.class);

    private final TextNormalizer normalizer;
    private final SynonymIndex synonyms;

    public GapIdentifier(TextNormalizer normalizer, SynonymIndex synonyms) {
        this.normalizer = normalizer;
        this.synonyms = synonyms;
    }

    public List<GapActionCard> identifyGaps(List<RequirementMatch> matches, CandidateSignals signals) {
        if (matches == null || matches.isEmpty() || signals == null) return List.of();

        Set<String> candidateTokens = signals.allTokens();
        List<GapActionCard> cards = new ArrayList<>();
        int ignored = 0;

        for (RequirementMatch match : matches) {
            if (match.status() == MatchStatus.MET) continue;
            if (match.relevance() == Relevance.LOW) {
                ignored++;
                continue;
            }

            boolean synonymMatch = hasSynonymMatch(match.requirement(), candidateTokens);
            RecommendedAction action;
            if (match.status() == MatchStatus.PARTIAL) {
                action = RecommendedAction.REPHRASE;
            } else if (synonymMatch) {
                action = RecommendedAction.EVIDENCE;
            } else {
                action = RecommendedAction.LEARN;
            }

            String suggestionType = null;
            if (synonymMatch) {
                suggestionType = GapActionCard.SYNONYM_MATCH;
            } else if (action == RecommendedAction.REPHRASE) {
                suggestionType = GapActionCard.PARTIAL_MATCH;
            }

            cards.add(new GapActionCard(match.requirement(), match.relevance(), match.status(), action, suggestionType));
        }

        log.debug("Identified {} gaps ({} low-relevance gaps ignored)", cards.size(), ignored);
        return cards;
    }

    /** True when any token of the requirement, or any of its equivalents, is among the candidate tokens. */
    private boolean hasSynonymMatch(String requirement, Set<String> candidateTokens) {
        for (String token : normalizer.tokenize(requirement)) {
            for (String synonym : synonyms.getSynonyms(token)) {
                if (normalizer.containsPhrase(candidateTokens, synonym)) return true;
            }
        }
        return false;
    }
}
