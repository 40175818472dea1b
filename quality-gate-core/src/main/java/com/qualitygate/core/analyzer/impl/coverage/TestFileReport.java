package com.qualitygate.core.analyzer.impl.coverage;

/**
 * Cached test counts for one test file.
 *
 * @param file project-relative path
 * @param tests detected test cases ({@code it(} / {@code test(})
 * @param assertions detected assertions ({@code expect(} / {@code assert*(})
 */
public record TestFileReport(String file, int tests, int assertions) {}
