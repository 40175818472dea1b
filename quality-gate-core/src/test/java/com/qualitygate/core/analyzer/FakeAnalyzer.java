package com.qualitygate.core.analyzer;

import com.qualitygate.core.model.AnalysisCategory;
import com.qualitygate.core.model.AnalysisResult;
import com.qualitygate.core.model.Finding;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Scriptable analyzer for orchestrator and registry tests.
 */
public class FakeAnalyzer implements Analyzer {

    private final String type;
    private final AnalysisCategory category;
    private final AnalyzerSettings settings;
    private final Function<Integer, AnalysisResult> behavior;
    private final AtomicInteger invocations = new AtomicInteger();

    /**
     * @param category reported category
     * @param settings analyzer settings
     * @param behavior receives the 1-based invocation number and returns the result or throws
     */
    public FakeAnalyzer(AnalysisCategory category, AnalyzerSettings settings,
                        Function<Integer, AnalysisResult> behavior) {
        this("fake", category, settings, behavior);
    }

    public FakeAnalyzer(String type, AnalysisCategory category, AnalyzerSettings settings,
                        Function<Integer, AnalysisResult> behavior) {
        this.type = type;
        this.category = category;
        this.settings = settings;
        this.behavior = behavior;
    }

    public static FakeAnalyzer scoring(AnalysisCategory category, double score, Finding... findings) {
        return new FakeAnalyzer(category, AnalyzerSettings.defaults(category.displayName()),
            attempt -> result(category, score, findings));
    }

    public static FakeAnalyzer failing(AnalysisCategory category, String message) {
        return new FakeAnalyzer(category, new AnalyzerSettings(category.displayName(), true, Duration.ofSeconds(5), 0),
            attempt -> {
                throw new AnalysisException(message);
            });
    }

    public static AnalysisResult result(AnalysisCategory category, double score, Finding... findings) {
        return new AnalysisResult(category, score, null, List.of(findings), null, null);
    }

    public int getInvocations() {
        return invocations.get();
    }

    @Override
    public String getType() {
        return type;
    }

    @Override
    public AnalysisCategory getCategory() {
        return category;
    }

    @Override
    public AnalyzerSettings getSettings() {
        return settings;
    }

    @Override
    public boolean validate() {
        return settings.enabled() && !settings.timeout().isZero() && !settings.timeout().isNegative();
    }

    @Override
    public AnalysisResult analyze(AnalysisContext context) {
        return behavior.apply(invocations.incrementAndGet());
    }
}
