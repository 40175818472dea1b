package com.qualitygate.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate architectural rules and design patterns.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Analyzers extend the shared base classes</li>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>Base classes don't depend on implementations</li>
 *   <li>The model stays free of pipeline components</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.qualitygate.core");
    }

    /**
     * Verifies all built-in analyzers extend AbstractAnalyzer or one of its subclasses,
     * so timing, exception wrapping and per-file caching behave the same everywhere.
     */
    @Test
    void analyzers_shouldExtendAbstractAnalyzer() {
        ArchRule rule = classes()
            .that().resideInAPackage("..analyzer.impl..")
            .and().haveSimpleNameEndingWith("Analyzer")
            .should().beAssignableTo("com.qualitygate.core.analyzer.base.AbstractAnalyzer");

        rule.check(classes);
    }

    /**
     * Verifies all domain models in the model package are records, apart from enums and the
     * metrics marker interface.
     */
    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .and().areNotInterfaces()
            .should().beRecords();

        rule.check(classes);
    }

    /**
     * Verifies base analyzer classes don't depend on implementation classes.
     */
    @Test
    void baseAnalyzers_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..analyzer.base..")
            .should().dependOnClassesThat().resideInAPackage("..analyzer.impl..");

        rule.check(classes);
    }

    /**
     * Verifies utility classes don't depend on analyzers.
     */
    @Test
    void utilities_shouldNotDependOnAnalyzers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAPackage("..analyzer..");

        rule.check(classes);
    }

    /**
     * Verifies the model does not reach into the components that produce or consume it.
     */
    @Test
    void models_shouldNotDependOnPipelineComponents() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..analyzer..", "..orchestrator..", "..scoring..", "..cache..", "..pipeline..");

        rule.check(classes);
    }

    /**
     * Verifies only the pipeline wires the orchestrator, scoring engine and trend storage together.
     */
    @Test
    void scoring_shouldNotDependOnPipeline() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..scoring..", "..orchestrator..", "..trend..", "..monitor..")
            .should().dependOnClassesThat().resideInAPackage("..pipeline..");

        rule.check(classes);
    }
}
