package com.example.jobfit.analyzer;

import com.example.jobfit.model.JobRequirements;
import com.example.jobfit.service.AnalysisWarnings;
import com.example.jobfit.service.InputLimits;
import com.example.jobfit.service.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a free-text job posting into must-have, nice-to-have and responsibility lists.
 * <p>
 * Section headers are recognized by bilingual (EN/DE) start-of-line keywords. Lines under a header
 * are kept when they look like bullets. Postings without any recognizable header fall back to
 * n-gram phrases from the top of the text, all treated as must-haves.
 */
@Service
public class JobRequirementExtractor {

    private static final Logger log = LoggerFactory.getLogger(JobRequirementExtractor.class);

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final List<Pattern> MUST_HAVE_HEADERS = compileAll(
            "^anforderungen", "^must-have", "^must have", "^erforderlich", "^wir erwarten",
            "^voraussetzungen", "^requirements", "^required", "^we expect"
    );
    private static final List<Pattern> NICE_TO_HAVE_HEADERS = compileAll(
            "^nice-to-have", "^nice to have", "^wünschenswert", "^wunschkriterien",
            "^preferred", "^bonus", "^zusätzlich"
    );
    private static final List<Pattern> RESPONSIBILITY_HEADERS = compileAll(
            "^aufgaben", "^verantwortlichkeiten", "^responsibilities", "^tätigkeiten", "^beschreibung"
    );

    private static final Pattern BULLET = Pattern.compile("^[-*•]\\s+(.+)$");
    private static final Pattern NUMBERED = Pattern.compile("^\\d+\\.\\s+(.+)$");
    private static final Pattern LEADING_MARKER = Pattern.compile("^[-*•\\d]");

    private static final int MIN_INDENT = 2;

    // Fallback n-gram extraction
    private static final int FALLBACK_SCAN_LINES = 15;
    private static final int FALLBACK_MIN_LINE_LENGTH = 10;
    private static final int FALLBACK_HEADER_MAX_LENGTH = 30;
    private static final int FALLBACK_TRIGRAM_SET_LIMIT = 20;
    private static final int FALLBACK_MAX_RESULTS = 30;
    private static final int FALLBACK_WHOLE_LINE_MIN = 20;
    private static final int FALLBACK_WHOLE_LINE_MAX_EXCLUSIVE = 200;

    private enum Section { MUST_HAVE, NICE_TO_HAVE, RESPONSIBILITIES }

    private final TextNormalizer normalizer;

    public JobRequirementExtractor(TextNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public JobRequirements parseJobRequirements(String jobPostingText) {
        if (jobPostingText == null || jobPostingText.isBlank()) {
            return JobRequirements.empty();
        }

        String text = jobPostingText;
        if (text.length() > InputLimits.MAX_JOB_TEXT_LENGTH) {
            AnalysisWarnings.report("parseJobRequirements", "Input truncated from %d to %d characters"
                    .formatted(text.length(), InputLimits.MAX_JOB_TEXT_LENGTH));
            text = text.substring(0, InputLimits.MAX_JOB_TEXT_LENGTH);
        }

        String[] lines = text.split("\n", -1);
        List<String> mustHave = new ArrayList<>();
        List<String> niceToHave = new ArrayList<>();
        List<String> responsibilities = new ArrayList<>();

        Section current = null;
        int sectionStart = -1;
        boolean foundAnySection = false;

        for (int i = 0; i < lines.length; i++) {
            Section detected = detectSection(lines[i]);
            if (detected == null) continue;

            if (current != null) {
                target(current, mustHave, niceToHave, responsibilities)
                        .addAll(parseBullets(lines, sectionStart, i));
            }
            current = detected;
            sectionStart = i + 1;
            foundAnySection = true;
        }

        if (current != null) {
            target(current, mustHave, niceToHave, responsibilities)
                    .addAll(parseBullets(lines, sectionStart, lines.length));
        }

        if (!foundAnySection) {
            List<String> fallback = extractFallback(lines);
            log.debug("No section headers found, {} fallback phrases extracted", fallback.size());
            mustHave.addAll(fallback);
        }

        log.debug("Extracted requirements: mustHave={}, niceToHave={}, responsibilities={}",
                mustHave.size(), niceToHave.size(), responsibilities.size());
        return new JobRequirements(mustHave, niceToHave, responsibilities);
    }

    // ── Section detection ──

    private static Section detectSection(String line) {
        String normalized = line.trim().toLowerCase(Locale.ROOT);
        if (matchesAny(MUST_HAVE_HEADERS, normalized)) return Section.MUST_HAVE;
        if (matchesAny(NICE_TO_HAVE_HEADERS, normalized)) return Section.NICE_TO_HAVE;
        if (matchesAny(RESPONSIBILITY_HEADERS, normalized)) return Section.RESPONSIBILITIES;
        return null;
    }

    private static boolean matchesAny(List<Pattern> patterns, String line) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(line).find()) return true;
        }
        return false;
    }

    private static List<String> target(Section section, List<String> mustHave,
                                       List<String> niceToHave, List<String> responsibilities) {
        return switch (section) {
            case MUST_HAVE -> mustHave;
            case NICE_TO_HAVE -> niceToHave;
            case RESPONSIBILITIES -> responsibilities;
        };
    }

    // ── Bullet parsing ──

    /**
     * Keeps lines in [from, to) that carry a bullet marker, a list number or at least two
     * characters of indentation. Markers are stripped.
     */
    static List<String> parseBullets(String[] lines, int from, int to) {
        List<String> items = new ArrayList<>();
        for (int i = from; i < to; i++) {
            String line = lines[i];
            String trimmed = line.trim();
            if (trimmed.isEmpty()) continue;

            String cleaned = null;
            Matcher bullet = BULLET.matcher(trimmed);
            Matcher numbered = NUMBERED.matcher(trimmed);
            if (bullet.matches()) {
                cleaned = bullet.group(1).trim();
            } else if (numbered.matches()) {
                cleaned = numbered.group(1).trim();
            } else if (line.length() - trimmed.length() >= MIN_INDENT) {
                cleaned = trimmed;
            }

            if (cleaned != null && !cleaned.isEmpty()) {
                items.add(cleaned);
            }
        }
        return items;
    }

    // ── Fallback ──

    private List<String> extractFallback(String[] lines) {
        Set<String> phrases = new LinkedHashSet<>();
        int scan = Math.min(FALLBACK_SCAN_LINES, lines.length);

        for (int i = 0; i < scan; i++) {
            String trimmed = lines[i].trim();
            if (trimmed.length() < FALLBACK_MIN_LINE_LENGTH) continue;
            // Short all-caps lines are headings, not requirements
            if (trimmed.length() < FALLBACK_HEADER_MAX_LENGTH
                    && trimmed.equals(trimmed.toUpperCase(Locale.ROOT))) continue;

            List<String> words = normalizer.words(trimmed);
            if (words.size() >= 2) {
                for (int w = 0; w < words.size() - 1; w++) {
                    String bigram = words.get(w) + " " + words.get(w + 1);
                    if (bigram.length() > 5) phrases.add(bigram);
                }
                if (words.size() >= 3 && phrases.size() < FALLBACK_TRIGRAM_SET_LIMIT) {
                    for (int w = 0; w < words.size() - 2; w++) {
                        String trigram = words.get(w) + " " + words.get(w + 1) + " " + words.get(w + 2);
                        if (trigram.length() > 8) phrases.add(trigram);
                    }
                }
            }

            if (trimmed.length() >= FALLBACK_WHOLE_LINE_MIN
                    && trimmed.length() < FALLBACK_WHOLE_LINE_MAX_EXCLUSIVE
                    && !LEADING_MARKER.matcher(trimmed).find()) {
                phrases.add(trimmed);
            }
        }

        return phrases.stream().limit(FALLBACK_MAX_RESULTS).toList();
    }

    private static List<Pattern> compileAll(String... regexes) {
        List<Pattern> patterns = new ArrayList<>(regexes.length);
        for (String regex : regexes) {
            patterns.add(Pattern.compile(regex, FLAGS));
        }
        return List.copyOf(patterns);
    }
}
