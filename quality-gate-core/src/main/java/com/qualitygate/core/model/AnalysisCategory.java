package com.qualitygate.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of analysis categories that contribute to the overall score.
 *
 * <p>Each category carries the identifier used in reports and configuration
 * ({@link #id()}) and the analyzer type key its built-in analyzer is registered under
 * ({@link #analyzerType()}). Enumeration order is the category-generation order used
 * when recommendations share a priority.
 */
public enum AnalysisCategory {
    CODE_QUALITY("codeQuality", "codeQuality", "Code Quality"),
    TEST_COVERAGE("testCoverage", "coverage", "Test Coverage"),
    ARCHITECTURE("architecture", "architecture", "Architecture"),
    SECURITY("security", "security", "Security");

    private final String id;
    private final String analyzerType;
    private final String displayName;

    AnalysisCategory(String id, String analyzerType, String displayName) {
        this.id = id;
        this.analyzerType = analyzerType;
        this.displayName = displayName;
    }

    public String id() {
        return id;
    }

    public String analyzerType() {
        return analyzerType;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Finds the category whose built-in analyzer is registered under the given type key.
     *
     * @param analyzerType analyzer type key (e.g. "coverage")
     * @return matching category, or empty for third-party types
     */
    public static Optional<AnalysisCategory> fromAnalyzerType(String analyzerType) {
        return Arrays.stream(values())
            .filter(category -> category.analyzerType.equals(analyzerType))
            .findFirst();
    }
}
