package com.qualitygate.core.analyzer;

import com.qualitygate.core.analyzer.impl.architecture.ArchitectureAnalyzer;
import com.qualitygate.core.analyzer.impl.coverage.CoverageAnalyzer;
import com.qualitygate.core.model.AnalysisCategory;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link AnalyzerRegistry}.
 */
class AnalyzerRegistryTest {

    @Test
    void withBuiltIns_registersFourCategoriesInOrder() {
        AnalyzerRegistry registry = AnalyzerRegistry.withBuiltIns();

        assertThat(registry.registeredTypes())
            .containsExactly("codeQuality", "coverage", "architecture", "security");
    }

    @Test
    void create_builtInType_returnsFreshConfiguredInstance() {
        AnalyzerRegistry registry = AnalyzerRegistry.withBuiltIns();
        AnalyzerSettings settings = new AnalyzerSettings("Coverage", true, Duration.ofSeconds(5), 2);

        Analyzer first = registry.create("coverage", settings);
        Analyzer second = registry.create("coverage", settings);

        assertThat(first).isInstanceOf(CoverageAnalyzer.class).isNotSameAs(second);
        assertThat(first.getCategory()).isEqualTo(AnalysisCategory.TEST_COVERAGE);
        assertThat(first.getName()).isEqualTo("Coverage");
        assertThat(first.getTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(first.getRetryAttempts()).isEqualTo(2);
    }

    @Test
    void create_unknownType_throwsListingRegisteredTypes() {
        AnalyzerRegistry registry = AnalyzerRegistry.withBuiltIns();

        assertThatThrownBy(() -> registry.create("performance", AnalyzerSettings.defaults("perf")))
            .isInstanceOf(UnknownAnalyzerTypeException.class)
            .hasMessage("Unknown analyzer type: performance. "
                + "Registered types: codeQuality, coverage, architecture, security");
    }

    @Test
    void getInstance_memoizesUntilCleared() {
        AnalyzerRegistry registry = AnalyzerRegistry.withBuiltIns();
        AnalyzerSettings settings = AnalyzerSettings.defaults(ArchitectureAnalyzer.DEFAULT_NAME);

        Analyzer first = registry.getInstance("architecture", settings);
        Analyzer second = registry.getInstance("architecture", settings);
        registry.clearInstances();
        Analyzer third = registry.getInstance("architecture", settings);

        assertThat(second).isSameAs(first);
        assertThat(third).isNotSameAs(first);
    }

    @Test
    void register_existingType_overwritesAndDropsInstance() {
        AnalyzerRegistry registry = AnalyzerRegistry.withBuiltIns();
        AnalyzerSettings settings = AnalyzerSettings.defaults("Security");
        Analyzer builtIn = registry.getInstance("security", settings);

        registry.register("security", s -> new FakeAnalyzer(AnalysisCategory.SECURITY, s,
            attempt -> FakeAnalyzer.result(AnalysisCategory.SECURITY, 90)));

        assertThat(registry.registeredTypes()).hasSize(4);
        assertThat(registry.getInstance("security", settings))
            .isInstanceOf(FakeAnalyzer.class)
            .isNotSameAs(builtIn);
    }

    @Test
    void loadProviders_discoversServiceLoaderProviders() {
        AnalyzerRegistry registry = AnalyzerRegistry.withBuiltIns().loadProviders();

        assertThat(registry.isRegistered(FakeAnalyzerProvider.TYPE)).isTrue();
        assertThat(registry.registeredTypes()).endsWith(FakeAnalyzerProvider.TYPE);
        assertThat(registry.create(FakeAnalyzerProvider.TYPE, AnalyzerSettings.defaults("fake")))
            .isInstanceOf(FakeAnalyzer.class);
    }

    @Test
    void createAll_appliesSettingsPerType() {
        AnalyzerRegistry registry = AnalyzerRegistry.withBuiltIns();

        List<Analyzer> analyzers = registry.createAll(type ->
            new AnalyzerSettings(type + "-analyzer", !type.equals("security"), null, 0));

        assertThat(analyzers).extracting(Analyzer::getName).containsExactly(
            "codeQuality-analyzer", "coverage-analyzer", "architecture-analyzer", "security-analyzer");
        assertThat(analyzers).extracting(Analyzer::getType)
            .containsExactly("codeQuality", "coverage", "architecture", "security");
        assertThat(analyzers.get(3).validate()).isFalse();
        assertThat(analyzers.get(0).validate()).isTrue();
    }
}
