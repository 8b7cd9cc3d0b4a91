package com.architekt.core;

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
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>Models depend on nothing but utilities</li>
 *   <li>Engine packages (system, attribute, flow, component) stay free of storage concerns</li>
 *   <li>Only the store drives the engines and the repository together</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.architekt.core");
    }

    /**
     * Verifies all domain models in the model package are implemented as Java records.
     * Sealed interfaces such as {@code Constraint} group record variants and are exempt.
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
     * Verifies the model layer has no dependencies on engines, persistence or the store.
     */
    @Test
    void models_shouldNotDependOnEngines() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..system..", "..attribute..", "..flow..", "..component..", "..store..", "..persistence..");

        rule.check(classes);
    }

    @Test
    void engines_shouldNotDependOnStorage() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..core.system..", "..core.attribute..", "..core.flow..", "..core.component..")
            .should().dependOnClassesThat().resideInAnyPackage("..store..", "..persistence..", "..config..");

        rule.check(classes);
    }

    /**
     * Verifies utility classes don't depend on domain packages.
     * Utilities should be low-level, reusable components with no domain dependencies.
     */
    @Test
    void utilClasses_shouldNotDependOnDomain() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..model..", "..system..", "..attribute..", "..flow..", "..component..", "..store..", "..persistence..");

        rule.check(classes);
    }

    @Test
    void persistence_shouldNotDependOnStore() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..persistence..")
            .should().dependOnClassesThat().resideInAPackage("..store..");

        rule.check(classes);
    }
}
