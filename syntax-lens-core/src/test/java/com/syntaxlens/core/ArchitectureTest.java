package com.syntaxlens.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * ArchUnit tests to validate architectural rules and design patterns.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Analyzers extend the common base class</li>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>Grammar layers stay independent of analyzers and renderers</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.syntaxlens.core");
    }

    @Test
    void analyzers_shouldExtendAbstractSourceAnalyzer() {
        ArchRule rule = classes()
            .that().resideInAPackage("..analyzer.impl..")
            .and().haveSimpleNameEndingWith("Analyzer")
            .should().beAssignableTo("com.syntaxlens.core.analyzer.base.AbstractSourceAnalyzer");

        rule.check(classes);
    }

    @Test
    void analyzers_shouldBeInLanguagePackages() {
        ArchRule rule = classes()
            .that().resideInAPackage("..analyzer.impl..")
            .should().resideInAnyPackage("..impl.css..", "..impl.javascript..");

        rule.check(classes);
    }

    /**
     * Records give the models immutability and value equality.
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

    @Test
    void baseAnalyzers_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..analyzer.base..")
            .should().dependOnClassesThat().resideInAPackage("..analyzer.impl..");

        rule.check(classes);
    }

    @Test
    void utilClasses_shouldNotDependOnGrammarsOrAnalyzers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAnyPackage("..javascript..", "..css..", "..analyzer..");

        rule.check(classes);
    }

    @Test
    void models_shouldNotDependOnOtherLayers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..analyzer..", "..renderer..", "..javascript..", "..css..", "..config..");

        rule.check(classes);
    }

    @Test
    void grammars_shouldNotDependOnAnalyzersOrRenderers() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..core.javascript..", "..core.css..", "..core.syntax..")
            .should().dependOnClassesThat().resideInAnyPackage("..analyzer..", "..renderer..");

        rule.check(classes);
    }
}
