package com.qualitygate.core.analyzer;

import com.qualitygate.core.model.AnalysisCategory;

/**
 * Provider registered through {@code META-INF/services} to exercise provider discovery.
 */
public class FakeAnalyzerProvider implements AnalyzerProvider {

    public static final String TYPE = "fake";

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public Analyzer create(AnalyzerSettings settings) {
        return new FakeAnalyzer(TYPE, AnalysisCategory.SECURITY, settings,
            attempt -> FakeAnalyzer.result(AnalysisCategory.SECURITY, 100));
    }
}
