package com.example.jobfit.service;

import com.example.jobfit.model.PerformanceWarning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-request accumulator for performance warnings raised by the pipeline stages.
 * Stored in an InheritableThreadLocal so helper threads started by a request share its context.
 * Warnings are always logged; they are only collected while an accumulator is active.
 */
public final class AnalysisWarnings {

    private static final Logger log = LoggerFactory.getLogger(AnalysisWarnings.class);

    private static final InheritableThreadLocal<AnalysisWarnings> CONTEXT =
            new InheritableThreadLocal<>() {
                @Override
                protected AnalysisWarnings childValue(AnalysisWarnings parent) {
                    return parent;
                }
            };

    private final List<PerformanceWarning> warnings = Collections.synchronizedList(new ArrayList<>());

    private AnalysisWarnings() {}

    public static AnalysisWarnings start() {
        AnalysisWarnings acc = new AnalysisWarnings();
        CONTEXT.set(acc);
        return acc;
    }

    public static AnalysisWarnings current() {
        return CONTEXT.get();
    }

    public static void clear() {
        CONTEXT.remove();
    }

    /**
     * Logs a warning at WARN and records it in the current request's accumulator, if any.
     */
    public static void report(String source, String message) {
        log.warn("[{}] {}", source, message);
        AnalysisWarnings acc = CONTEXT.get();
        if (acc != null) {
            acc.warnings.add(new PerformanceWarning(source, message));
        }
    }

    public int count() {
        return warnings.size();
    }

    public List<PerformanceWarning> warnings() {
        synchronized (warnings) {
            return List.copyOf(warnings);
        }
    }

    /**
     * Compact single-line representation for HTTP headers.
     * Hard-capped to avoid overlong headers.
     */
    public String asHeaderValue(int maxChars) {
        String joined = warnings().stream()
                .map(w -> "source=%s;message=%s".formatted(headerSafe(w.source()), headerSafe(w.message())))
                .reduce((a, b) -> a + " || " + b)
                .orElse("");
        if (joined.length() <= maxChars) return joined;
        return joined.substring(0, Math.max(0, maxChars - 3)) + "...";
    }

    /**
     * HTTP header-safe ASCII representation (printable US-ASCII only).
     */
    private static String headerSafe(String s) {
        if (s == null || s.isBlank()) return "";
        StringBuilder out = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c >= 32 && c <= 126 && c != ';') {
                out.append(c);
            } else {
                out.append(' ');
            }
        }
        return out.toString().replaceAll("\\s+", " ").trim();
    }
}
