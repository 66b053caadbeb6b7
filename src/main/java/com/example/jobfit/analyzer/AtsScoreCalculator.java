package com.example.jobfit.analyzer;

import com.example.jobfit.model.AtsAnalysis;
import com.example.jobfit.model.AtsBreakdown;
import com.example.jobfit.model.CandidateProfile;
import com.example.jobfit.model.ExperienceEntry;
import com.example.jobfit.service.AnalysisWarnings;
import com.example.jobfit.service.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Estimates how well an applicant tracking system would parse and rank the profile.
 * <p>
 * Four sub-scores, each 0-100:
 * <ul>
 *   <li><b>structure</b>: required experience fields present, bullet-formatted descriptions</li>
 *   <li><b>coverage</b>: requirement (or common tech) terms found anywhere in the profile</li>
 *   <li><b>placement</b>: those terms found inside experience entries rather than only in skills</li>
 *   <li><b>context</b>: descriptions with action verbs and quantified outcomes</li>
 * </ul>
 */
@Service
public class AtsScoreCalculator {

    private static final Logger log = LoggerFactory.getLogger(AtsScoreCalculator.class);

    static final int MAX_MUST_HAVE = 500;
    static final int MUST_HAVE_WARNING_THRESHOLD = 200;

    // Weights of the overall score
    static final double STRUCTURE_WEIGHT = 0.25;
    static final double COVERAGE_WEIGHT = 0.30;
    static final double PLACEMENT_WEIGHT = 0.25;
    static final double CONTEXT_WEIGHT = 0.20;

    private static final double REQUIRED_FIELDS_POINTS = 40;
    private static final double FORMATTING_POINTS = 60;
    private static final double ACTION_VERB_POINTS = 50;
    private static final double OUTCOME_POINTS = 50;
    private static final int EXPECTED_TECH_TERMS = 5;
    private static final double MAX_PLACEMENT_BONUS = 1.2;
    private static final double PLACEMENT_BONUS_FACTOR = 0.2;

    /** Sub-scores below this value produce a todo. */
    static final int TODO_THRESHOLD = 70;

    static final String TODO_FIELDS = "Add missing employer, role, and date fields to all experience entries";
    static final String TODO_BULLETS = "Use bullet points (• or -) in experience descriptions for better ATS parsing";
    static final String TODO_KEYWORDS = "Include more relevant keywords in skills/experience sections";
    static final String TODO_PLACEMENT = "Move key terms from skills section to experience descriptions for better ATS parsing";
    static final String TODO_ACTION_VERBS = "Add action verbs (e.g., 'developed', 'led', 'implemented') to experience descriptions";
    static final String TODO_OUTCOMES = "Include quantifiable outcomes (numbers, percentages) in experience descriptions";
    static final String WELL_OPTIMIZED = "Profile is well-optimized for ATS. Continue maintaining current format and content quality.";
    static final String PROFILE_MISSING = "Profile data is missing. Please add profile information.";

    private static final Pattern BULLET_LINE = Pattern.compile("^\\s*[-•*]\\s|^\\s*\\d+[.)]\\s", Pattern.MULTILINE);
    private static final Pattern NUMBER = Pattern.compile("\\d+");

    private static final List<String> ACTION_VERBS = List.of(
            "developed", "implemented", "led", "managed", "created", "built", "designed",
            "architected", "optimized", "improved", "increased", "reduced", "delivered",
            "achieved", "established", "launched", "maintained", "supported", "collaborated",
            "coordinated", "executed", "performed", "analyzed", "evaluated", "resolved",
            "enhanced", "streamlined", "transformed", "initiated", "spearheaded", "orchestrated",
            "facilitated", "supervised", "mentored", "trained", "guided", "influenced",
            "negotiated", "presented", "communicated", "documented", "tested", "debugged",
            "deployed", "monitored", "troubleshot", "upgraded", "migrated", "integrated"
    );

    private static final Pattern ACTION_VERB = Pattern.compile(
            "\\b(" + String.join("|", ACTION_VERBS) + ")\\w*\\b");

    private static final Pattern OUTCOME_WORD = Pattern.compile(
            "\\b(improved|increased|reduced|optimized|enhanced|decreased|boosted|accelerated|expanded|scaled|grew|achieved)\\b");

    private static final List<String> COMMON_TECH_TERMS = List.of(
            "typescript", "javascript", "react", "node", "python", "java", "sql",
            "database", "api", "rest", "aws", "docker", "kubernetes", "git",
            "testing", "agile", "scrum", "ci/cd", "devops", "frontend", "backend"
    );

    private final TextNormalizer normalizer;
    private final Set<String> commonTechTokens;

    public AtsScoreCalculator(TextNormalizer normalizer) {
        this.normalizer = normalizer;
        // Compared in normalized form, like every other token in the profile
        Set<String> techTokens = new LinkedHashSet<>();
        for (String term : COMMON_TECH_TERMS) {
            techTokens.addAll(normalizer.tokenize(term));
        }
        this.commonTechTokens = Set.copyOf(techTokens);
    }

    public AtsAnalysis computeAtsScore(CandidateProfile profile, List<String> mustHave) {
        if (profile == null) {
            return new AtsAnalysis(0, AtsBreakdown.zero(), List.of(PROFILE_MISSING));
        }

        List<String> requirements = mustHave != null ? mustHave : List.of();
        if (requirements.size() > MAX_MUST_HAVE) {
            AnalysisWarnings.report("computeAtsScore", "Must-have list size (%d) exceeds limit (%d), truncated"
                    .formatted(requirements.size(), MAX_MUST_HAVE));
            requirements = requirements.subList(0, MAX_MUST_HAVE);
        } else if (requirements.size() > MUST_HAVE_WARNING_THRESHOLD) {
            AnalysisWarnings.report("computeAtsScore", "Large must-have list (%d), processing may take longer"
                    .formatted(requirements.size()));
        }

        Set<String> terms = requirements.isEmpty() ? commonTechTokens : requirementTokens(requirements);

        AtsBreakdown breakdown = new AtsBreakdown(
                structureScore(profile),
                coverageScore(profile, requirements, terms),
                placementScore(profile, terms),
                contextScore(profile)
        );
        int score = overallScore(breakdown);
        List<String> todos = todos(breakdown);

        log.debug("ATS score {} (structure={}, coverage={}, placement={}, context={})",
                score, breakdown.structure(), breakdown.coverage(), breakdown.placement(), breakdown.context());
        return new AtsAnalysis(score, breakdown, todos);
    }

    // ── Sub-scores ──

    int structureScore(CandidateProfile profile) {
        List<ExperienceEntry> experiences = profile.experiences();
        if (experiences.isEmpty()) return 0;

        int presentFields = 0;
        int formattedEntries = 0;
        for (ExperienceEntry exp : experiences) {
            if (!exp.employer().isBlank()) presentFields++;
            if (!exp.role().isBlank()) presentFields++;
            if (!exp.startDate().isBlank()) presentFields++;
            if (!exp.endDate().isBlank()) presentFields++;
            if (BULLET_LINE.matcher(exp.description()).find()) formattedEntries++;
        }

        double fields = (double) presentFields / (experiences.size() * 4) * REQUIRED_FIELDS_POINTS;
        double formatting = (double) formattedEntries / experiences.size() * FORMATTING_POINTS;
        return (int) Math.round(fields + formatting);
    }

    int coverageScore(CandidateProfile profile, List<String> requirements, Set<String> terms) {
        String allText = profile.allText();
        if (allText.isBlank()) return 0;

        Set<String> profileTokens = normalizer.tokenize(allText);
        if (requirements.isEmpty()) {
            long hits = terms.stream().filter(profileTokens::contains).count();
            return (int) Math.min(100, Math.round((double) hits / EXPECTED_TECH_TERMS * 100));
        }

        if (terms.isEmpty()) return 0;
        long hits = terms.stream().filter(profileTokens::contains).count();
        return (int) Math.round((double) hits / terms.size() * 100);
    }

    int placementScore(CandidateProfile profile, Set<String> terms) {
        List<ExperienceEntry> experiences = profile.experiences();
        if (experiences.isEmpty() || terms.isEmpty()) return 0;

        Set<String> termsInExperience = new LinkedHashSet<>();
        int entriesWithTerms = 0;
        for (ExperienceEntry exp : experiences) {
            Set<String> expTokens = normalizer.tokenize(exp.text());
            boolean hasTerm = false;
            for (String term : terms) {
                if (expTokens.contains(term)) {
                    termsInExperience.add(term);
                    hasTerm = true;
                }
            }
            if (hasTerm) entriesWithTerms++;
        }

        double base = (double) termsInExperience.size() / terms.size() * 100;
        double bonus = Math.min(MAX_PLACEMENT_BONUS,
                1 + (double) entriesWithTerms / experiences.size() * PLACEMENT_BONUS_FACTOR);
        return (int) Math.min(100, Math.round(base * bonus));
    }

    int contextScore(CandidateProfile profile) {
        int entries = 0;
        int withActionVerb = 0;
        int withOutcome = 0;
        for (ExperienceEntry exp : profile.experiences()) {
            String description = exp.description();
            if (description.isBlank()) continue;
            entries++;

            String lower = description.toLowerCase(Locale.ROOT);
            if (ACTION_VERB.matcher(lower).find()) withActionVerb++;
            if (NUMBER.matcher(description).find() || OUTCOME_WORD.matcher(lower).find()) withOutcome++;
        }
        if (entries == 0) return 0;

        double verbs = (double) withActionVerb / entries * ACTION_VERB_POINTS;
        double outcomes = (double) withOutcome / entries * OUTCOME_POINTS;
        return (int) Math.round(verbs + outcomes);
    }

    static int overallScore(AtsBreakdown b) {
        return (int) Math.round(b.structure() * STRUCTURE_WEIGHT
                + b.coverage() * COVERAGE_WEIGHT
                + b.placement() * PLACEMENT_WEIGHT
                + b.context() * CONTEXT_WEIGHT);
    }

    // ── Todos ──

    private enum Category { STRUCTURE, COVERAGE, PLACEMENT, CONTEXT }

    private record SubScore(Category category, int score) {}

    /**
     * Weakest sub-score first; ties keep the declaration order structure, coverage,
     * placement, context.
     */
    static List<String> todos(AtsBreakdown b) {
        List<SubScore> ordered = List.of(
                        new SubScore(Category.STRUCTURE, b.structure()),
                        new SubScore(Category.COVERAGE, b.coverage()),
                        new SubScore(Category.PLACEMENT, b.placement()),
                        new SubScore(Category.CONTEXT, b.context()))
                .stream()
                .sorted(Comparator.comparingInt(SubScore::score))
                .toList();

        List<String> todos = new ArrayList<>();
        for (SubScore sub : ordered) {
            if (sub.score() >= TODO_THRESHOLD) continue;
            switch (sub.category()) {
                case STRUCTURE -> {
                    if (sub.score() < 40) todos.add(TODO_FIELDS);
                    if (sub.score() < 60) todos.add(TODO_BULLETS);
                }
                case COVERAGE -> todos.add(TODO_KEYWORDS);
                case PLACEMENT -> todos.add(TODO_PLACEMENT);
                case CONTEXT -> {
                    if (sub.score() < 50) todos.add(TODO_ACTION_VERBS);
                    todos.add(TODO_OUTCOMES);
                }
            }
        }

        if (todos.isEmpty()) todos.add(WELL_OPTIMIZED);
        return todos;
    }

    private Set<String> requirementTokens(List<String> requirements) {
        return requirements.stream()
                .flatMap(req -> normalizer.tokenize(req).stream())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
