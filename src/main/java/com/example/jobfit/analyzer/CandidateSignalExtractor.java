package com.example.jobfit.analyzer;

import com.example.jobfit.model.CandidateProfile;
import com.example.jobfit.model.CandidateSignals;
import com.example.jobfit.model.ExperienceEntry;
import com.example.jobfit.service.InputLimits;
import com.example.jobfit.service.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a candidate profile into normalized token sets plus seniority signals.
 */
@Service
public class CandidateSignalExtractor {

    private static final Logger log = LoggerFactory.getLogger(CandidateSignalExtractor.class);

    /** Leadership, seniority and experience vocabulary (EN/DE). */
    public static final Set<String> SENIORITY_KEYWORDS = Collections.unmodifiableSet(new LinkedHashSet<>(List.of(
            "lead", "leader", "leading", "leadership", "manage", "manager", "management",
            "direct", "director", "directing", "head", "chief", "senior", "principal",
            "architect", "architecting", "strategic", "strategy", "strategist",
            "executive", "exec", "vp", "vice president", "c-level", "cto", "cfo", "ceo",
            "team lead", "tech lead", "engineering lead", "product lead",
            "mentor", "mentoring", "coach", "coaching", "supervise", "supervisor",
            "oversee", "overseeing", "responsible", "responsibility", "accountable",
            "decision", "decisions", "decision-making", "stakeholder", "stakeholders",

            "führen", "führung", "führend", "leiten", "leitung", "leitend",
            "direktor", "direktorin", "geschäftsführer", "geschäftsführerin",
            "abteilungsleiter", "abteilungsleiterin", "teamleiter", "teamleiterin",
            "projektleiter", "projektleiterin", "verantwortlich", "verantwortung",
            "verantwortlichkeiten", "strategisch", "strategie",
            "entscheidung", "entscheidungen", "entscheidungsfindung", "stakeholdern",

            "years", "jahr", "jahre", "jahren", "experience", "erfahrung",
            "experienced", "erfahren", "expert", "expertise", "expertin",
            "veteran", "veteranin", "seasoned"
    )));

    private static final List<KeywordPattern> KEYWORD_PATTERNS = SENIORITY_KEYWORDS.stream()
            .map(k -> new KeywordPattern(k, Pattern.compile(
                    "\\b" + Pattern.quote(k) + "\\b",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS)))
            .toList();

    private static final Pattern YEARS = Pattern.compile(
            "\\b(\\d+)\\+?\\s*(years?|jahr|jahre|jahren)\\s*(of\\s*)?(experience|erfahrung)?",
            Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> ROLE_PATTERNS = List.of(
            Pattern.compile("\\b(lead|senior|principal|chief|head|director|manager|vp|executive)\\s+\\w+",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b\\w+\\s+(lead|manager|director|architect|executive)\\b",
                    Pattern.CASE_INSENSITIVE)
    );

    private static final int ROLE_MIN_LENGTH_EXCLUSIVE = 3;
    private static final int ROLE_MAX_LENGTH_EXCLUSIVE = 50;

    private final TextNormalizer normalizer;

    public CandidateSignalExtractor(TextNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public CandidateSignals extractCandidateSignals(CandidateProfile profile) {
        if (profile == null) return CandidateSignals.empty();

        int textLength = InputLimits.profileTextLength(profile);
        if (textLength > InputLimits.MAX_PROFILE_TEXT_LENGTH) {
            log.warn("Profile text length ({}) exceeds limit ({}), processing may be slow",
                    textLength, InputLimits.MAX_PROFILE_TEXT_LENGTH);
        }

        Set<String> skillsTokens = new LinkedHashSet<>(normalizer.tokenize(profile.skills()));

        Set<String> experienceTokens = new LinkedHashSet<>();
        for (ExperienceEntry experience : profile.experiences()) {
            experienceTokens.addAll(normalizer.tokenize(experience.role()));
            experienceTokens.addAll(normalizer.tokenize(experience.description()));
        }
        experienceTokens.addAll(normalizer.tokenize(profile.summary()));
        experienceTokens.addAll(normalizer.tokenize(profile.projects()));

        Set<String> seniority = extractSenioritySignals(profile.allText());

        log.debug("Candidate signals: skills={}, experience={}, seniority={}",
                skillsTokens.size(), experienceTokens.size(), seniority.size());
        return new CandidateSignals(skillsTokens, experienceTokens, seniority);
    }

    /**
     * Keyword hits, "N years experience" phrases and lowercased role phrases such as
     * "senior engineer" or "engineering manager".
     */
    public Set<String> extractSenioritySignals(String text) {
        Set<String> signals = new LinkedHashSet<>();
        if (text == null || text.isBlank()) return signals;

        String lower = text.toLowerCase(Locale.ROOT);
        for (KeywordPattern keyword : KEYWORD_PATTERNS) {
            if (keyword.pattern().matcher(lower).find()) {
                signals.add(keyword.keyword());
            }
        }

        Matcher years = YEARS.matcher(text);
        while (years.find()) {
            signals.add(years.group(1) + " years experience");
        }

        for (Pattern rolePattern : ROLE_PATTERNS) {
            Matcher role = rolePattern.matcher(text);
            while (role.find()) {
                String phrase = role.group().trim();
                if (phrase.length() > ROLE_MIN_LENGTH_EXCLUSIVE && phrase.length() < ROLE_MAX_LENGTH_EXCLUSIVE) {
                    signals.add(phrase.toLowerCase(Locale.ROOT));
                }
            }
        }
        return signals;
    }

    /**
     * True when any seniority keyword appears in the given tokens, either as-is or in its
     * stemmed form.
     */
    public boolean containsSeniorityKeyword(Set<String> tokens) {
        for (String keyword : SENIORITY_KEYWORDS) {
            if (tokens.contains(keyword) || tokens.contains(normalizer.stem(keyword))) {
                return true;
            }
        }
        return false;
    }

    private record KeywordPattern(String keyword, Pattern pattern) {}
}
