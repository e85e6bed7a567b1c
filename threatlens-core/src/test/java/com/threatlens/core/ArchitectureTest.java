package com.threatlens.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests for package layering.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Rules extend the shared base class and are grouped by category</li>
 *   <li>Domain models are immutable records</li>
 *   <li>Low-level packages stay independent of the pipeline</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.threatlens.core");
    }

    @Test
    void rules_shouldExtendAbstractRule() {
        ArchRule rule = classes()
            .that().resideInAPackage("..rule.impl..")
            .and().haveSimpleNameEndingWith("Rule")
            .should().beAssignableTo("com.threatlens.core.rule.base.AbstractRule");

        rule.check(classes);
    }

    /**
     * Rule implementations live in one package per threat category.
     */
    @Test
    void rules_shouldBeInCategoryPackages() {
        ArchRule rule = classes()
            .that().resideInAPackage("..rule.impl..")
            .and().haveSimpleNameEndingWith("Rule")
            .should().resideInAnyPackage("..auth..", "..secrets..", "..transport..", "..injection..");

        rule.check(classes);
    }

    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void baseRules_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..rule.base..")
            .should().dependOnClassesThat().resideInAPackage("..rule.impl..");

        rule.check(classes);
    }

    @Test
    void models_shouldNotDependOnPipeline() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..rule..", "..scanner..", "..policy..", "..advisory..", "..service..", "..report..");

        rule.check(classes);
    }

    @Test
    void utilClasses_shouldNotDependOnPipeline() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAnyPackage("..scanner..", "..service..", "..advisory..");

        rule.check(classes);
    }

    /**
     * Only the service layer and reporting see the request/response types.
     */
    @Test
    void pipelineStages_shouldNotDependOnService() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..diff..", "..rule..", "..scanner..", "..policy..", "..evaluation..", "..advisory..")
            .should().dependOnClassesThat().resideInAPackage("..service..");

        rule.check(classes);
    }

    @Test
    void core_shouldNotDependOnCli() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("com.threatlens.core..")
            .should().dependOnClassesThat().resideInAPackage("com.threatlens.cli..");

        rule.check(classes);
    }
}
