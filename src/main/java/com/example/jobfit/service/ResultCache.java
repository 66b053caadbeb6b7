package com.example.jobfit.service;

import com.example.jobfit.model.AnalysisResult;
import com.example.jobfit.model.CandidateProfile;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bounded in-process cache of analysis results keyed by a content hash of the inputs.
 * Eviction is FIFO: once full, the oldest inserted entry is dropped. Reads do not refresh entries.
 */
public class ResultCache {

    /** Canonical JSON for hashing: sorted properties and map keys, no indentation. */
    private static final JsonMapper KEY_MAPPER = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.INDENT_OUTPUT)
            .build();

    private final int maxEntries;
    private final Map<String, AnalysisResult> entries;

    public ResultCache(int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive, got " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.entries = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, AnalysisResult> eldest) {
                return size() > ResultCache.this.maxEntries;
            }
        };
    }

    /**
     * MD5 hex digest of the profile's sorted-key JSON followed by the trimmed job text.
     * Equal inputs always produce the same key.
     */
    public static String key(CandidateProfile profile, String jobPostingText) {
        String profileJson;
        try {
            profileJson = KEY_MAPPER.writeValueAsString(profile);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize profile for cache key", e);
        }
        String job = jobPostingText != null ? jobPostingText.trim() : "";
        String material = profileJson + "\n---\n" + job;
        return DigestUtils.md5DigestAsHex(material.getBytes(StandardCharsets.UTF_8));
    }

    public synchronized AnalysisResult get(String key) {
        return entries.get(key);
    }

    public synchronized void put(String key, AnalysisResult result) {
        entries.put(key, result);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }

    public int maxEntries() {
        return maxEntries;
    }
}
