package com.qualitygate.core.analyzer;

/**
 * Service provider for third-party analyzers.
 *
 * <p>Implementations are discovered with {@link java.util.ServiceLoader} by
 * {@link AnalyzerRegistry#loadProviders()}. A provider whose type equals a built-in type
 * replaces the built-in analyzer.
 *
 * <p><b>Registration:</b> list implementations in
 * {@code META-INF/services/com.qualitygate.core.analyzer.AnalyzerProvider}
 */
public interface AnalyzerProvider {

    /**
     * @return type key to register the analyzer under
     */
    String getType();

    /**
     * Creates a new analyzer instance.
     *
     * @param settings settings for the instance
     * @return new analyzer
     */
    Analyzer create(AnalyzerSettings settings);
}
