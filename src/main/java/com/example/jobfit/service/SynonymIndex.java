package com.example.jobfit.service;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Bilingual (EN/DE) table of equivalent technical terms.
 * Built once; read-only afterwards, so a single instance is shared by all requests.
 */
@Component
public class SynonymIndex {

    private static final Map<String, List<String>> SYNONYMS = buildTable();

    private final Map<String, List<String>> reverseIndex;

    public SynonymIndex() {
        Map<String, List<String>> reverse = new LinkedHashMap<>();
        SYNONYMS.forEach((key, values) -> {
            for (String value : values) {
                reverse.computeIfAbsent(value, v -> new ArrayList<>()).add(key);
            }
        });
        reverse.replaceAll((value, keys) -> List.copyOf(keys));
        this.reverseIndex = Collections.unmodifiableMap(reverse);
    }

    /**
     * Returns the term itself, its direct equivalents, every key that lists it as an equivalent
     * and those keys' equivalents. Order is stable; duplicates are removed.
     */
    public Set<String> getSynonyms(String term) {
        if (term == null || term.isBlank()) return Set.of();

        String normalized = term.toLowerCase(Locale.ROOT).trim();
        Set<String> result = new LinkedHashSet<>();
        result.add(normalized);
        result.addAll(SYNONYMS.getOrDefault(normalized, List.of()));
        for (String key : reverseIndex.getOrDefault(normalized, List.of())) {
            result.add(key);
            result.addAll(SYNONYMS.getOrDefault(key, List.of()));
        }
        return Collections.unmodifiableSet(result);
    }

    public boolean hasSynonyms(String term) {
        return getSynonyms(term).size() > 1;
    }

    private static Map<String, List<String>> buildTable() {
        Map<String, List<String>> table = new LinkedHashMap<>();

        // Data & databases
        table.put("etl", List.of("data pipeline", "data processing", "extract transform load", "datenverarbeitung"));
        table.put("data pipeline", List.of("etl", "data processing", "extract transform load"));
        table.put("sql", List.of("database", "relational database", "rdbms", "datenbank"));
        table.put("database", List.of("sql", "rdbms", "relational database", "datenbank"));
        table.put("nosql", List.of("document database", "mongodb", "cassandra", "key-value store"));
        table.put("mongodb", List.of("nosql", "document database", "mongo"));

        // APIs
        table.put("rest", List.of("api", "restful", "web service", "rest api"));
        table.put("api", List.of("rest", "restful", "web service", "application programming interface", "webservice"));
        table.put("graphql", List.of("api", "query language", "graph query"));
        table.put("soap", List.of("web service", "xml api"));

        // Frontend
        table.put("react", List.of("reactjs", "react.js", "frontend framework"));
        table.put("vue", List.of("vuejs", "vue.js", "frontend framework"));
        table.put("angular", List.of("angularjs", "angular.js", "frontend framework"));
        table.put("typescript", List.of("ts", "typed javascript"));
        table.put("javascript", List.of("js", "ecmascript"));

        // Backend
        table.put("node.js", List.of("node", "nodejs", "server-side javascript"));
        table.put("node", List.of("node.js", "nodejs"));
        table.put("python", List.of("py", "python3"));
        table.put("java", List.of("jvm", "java programming"));
        table.put("c#", List.of("csharp", "dotnet", ".net"));
        table.put(".net", List.of("dotnet", "c#", "csharp"));

        // Cloud & DevOps
        table.put("aws", List.of("amazon web services", "amazon cloud"));
        table.put("azure", List.of("microsoft azure", "azure cloud"));
        table.put("gcp", List.of("google cloud platform", "google cloud"));
        table.put("docker", List.of("container", "containerization"));
        table.put("kubernetes", List.of("k8s", "container orchestration"));
        table.put("ci/cd", List.of("continuous integration", "continuous deployment", "devops"));
        table.put("devops", List.of("ci/cd", "continuous integration", "infrastructure"));

        // Testing
        table.put("testing", List.of("test", "qa", "quality assurance", "testen"));
        table.put("unit test", List.of("unit testing", "test", "testing"));
        table.put("integration test", List.of("integration testing", "e2e test", "end-to-end test"));

        // German
        table.put("datenbank", List.of("sql", "database", "relational database"));
        table.put("datenverarbeitung", List.of("etl", "data processing", "data pipeline"));
        table.put("webservice", List.of("api", "rest", "web service"));
        table.put("testen", List.of("testing", "test", "qa"));

        return Collections.unmodifiableMap(table);
    }
}
