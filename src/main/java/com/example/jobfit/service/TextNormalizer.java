package com.example.jobfit.service;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns free text into normalized tokens: lowercase, no punctuation, no stopwords,
 * lightly stemmed and deduplicated.
 * <p>
 * The stemmer is conservative: it only touches words longer than four characters,
 * strips the first matching suffix and never strips "-er", so "developer" stays "developer".
 */
@Component
public class TextNormalizer {

    /** Everything that is not a letter, digit, underscore or whitespace becomes a separator. */
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}_\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /** Tokens of this length or shorter are dropped. */
    private static final int MIN_TOKEN_LENGTH_EXCLUSIVE = 2;

    /** Words of this length or shorter are never stemmed. */
    private static final int STEM_MIN_LENGTH_EXCLUSIVE = 4;

    private static final List<String> ENGLISH_SUFFIXES = List.of(
            "ing", "tion", "sion", "ness", "ment", "able", "ible",
            "est", "ful", "less", "ly", "ed", "s"
    );

    private static final List<String> GERMAN_SUFFIXES = List.of(
            "ung", "en", "es", "e", "n"
    );

    private static final Set<String> STOPWORDS = Set.of(
            // German
            "der", "die", "das", "und", "oder", "aber", "mit", "von", "zu", "in", "auf",
            "für", "ist", "sind", "war", "waren", "wird", "werden", "hat", "haben",
            "ein", "eine", "einer", "eines", "einem", "einen", "als", "auch", "nicht",
            "sich", "dass", "kann", "können", "muss", "müssen", "bei", "nach", "über",
            "durch", "um", "am", "im", "zum", "zur", "vom", "beim", "ans", "aufs",
            "des", "dem", "den", "wir", "sie", "er", "es", "ihr", "du", "ich",
            "sein", "seine", "seiner", "seines", "ihnen", "uns", "euch", "dich", "mich",
            "dieser", "diese", "dieses", "jener", "jene", "jenes", "welcher", "welche",
            "alle", "alles", "einige", "mehrere", "viele", "wenige", "andere",
            "mehr", "weniger", "sehr", "so", "wie", "wenn", "dann", "weil", "da",
            "noch", "nur", "schon", "bereits", "immer", "nie", "oft", "manchmal",
            // English
            "the", "a", "an", "and", "or", "but", "with", "from", "to", "on",
            "for", "is", "are", "was", "were", "will", "be", "has", "have", "had",
            "as", "also", "not", "can", "must", "should", "would", "could", "may",
            "at", "by", "of", "about", "into", "through", "during", "before", "after",
            "above", "below", "between", "under", "over", "again", "further", "then",
            "once", "here", "there", "when", "where", "why", "how", "all", "both",
            "each", "few", "more", "most", "other", "some", "such", "no", "nor",
            "only", "own", "same", "than", "too", "very", "that", "these",
            "those", "this", "what", "which", "who", "whom", "whose", "if", "because",
            "while", "doing", "been", "being", "does", "did", "having", "do",
            "we", "you", "they", "he", "she", "it", "our", "your", "their", "his",
            "her", "its", "my", "me", "him", "them", "us", "myself", "yourself",
            "himself", "herself", "itself", "ourselves", "yourselves", "themselves"
    );

    /**
     * Tokenizes text into a deduplicated set of normalized, stemmed tokens.
     *
     * @param text arbitrary text, may be null
     * @return tokens in first-occurrence order; empty for null or blank input
     */
    public Set<String> tokenize(String text) {
        List<String> words = words(text);
        if (words.isEmpty()) return Collections.emptySet();

        Set<String> tokens = new LinkedHashSet<>();
        for (String word : words) {
            tokens.add(stem(word));
        }
        return tokens;
    }

    /**
     * Lowercased, punctuation-free words with short words and stopwords removed. Not stemmed,
     * not deduplicated.
     */
    public List<String> words(String text) {
        if (text == null || text.isBlank()) return List.of();

        String cleaned = NON_WORD.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
        List<String> words = new ArrayList<>();
        for (String word : WHITESPACE.split(cleaned.strip())) {
            if (word.length() > MIN_TOKEN_LENGTH_EXCLUSIVE && !STOPWORDS.contains(word)) {
                words.add(word);
            }
        }
        return words;
    }

    /**
     * Strips one recognized English or German suffix. English suffixes are tried first.
     */
    public String stem(String word) {
        if (word.length() <= STEM_MIN_LENGTH_EXCLUSIVE) return word;

        String stripped = stripFirst(word, ENGLISH_SUFFIXES);
        if (stripped != null) return stripped;
        stripped = stripFirst(word, GERMAN_SUFFIXES);
        return stripped != null ? stripped : word;
    }

    /**
     * True when the phrase is one of the tokens itself or, for multi-word or inflected phrases,
     * when every one of its normalized tokens is.
     */
    public boolean containsPhrase(Set<String> tokens, String phrase) {
        if (tokens.contains(phrase)) return true;
        Set<String> parts = tokenize(phrase);
        return !parts.isEmpty() && tokens.containsAll(parts);
    }

    public boolean isStopword(String word) {
        return STOPWORDS.contains(word);
    }

    private static String stripFirst(String word, List<String> suffixes) {
        for (String suffix : suffixes) {
            if (word.endsWith(suffix) && word.length() > suffix.length() + 2) {
                return word.substring(0, word.length() - suffix.length());
            }
        }
        return null;
    }
}
