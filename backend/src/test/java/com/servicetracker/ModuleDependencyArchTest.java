package com.servicetracker;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: domain and common at the bottom, chain adapters and run trigger beside each other,
 * subscription engine above them, REST on top.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.servicetracker");
    }

    @Test
    void domain_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.servicetracker.domain..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.servicetracker.common..", "com.servicetracker.config..", "com.servicetracker.irita..",
                        "com.servicetracker.run..", "com.servicetracker.subscription..", "com.servicetracker.api..");
        rule.check(classes);
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.servicetracker.common..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.servicetracker.domain..", "com.servicetracker.irita..", "com.servicetracker.run..",
                        "com.servicetracker.subscription..", "com.servicetracker.api..");
        rule.check(classes);
    }

    @Test
    void irita_must_not_depend_on_run_subscription_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.servicetracker.irita..")
                .should().dependOnClassesThat().resideInAnyPackage("com.servicetracker.run..", "com.servicetracker.subscription..", "com.servicetracker.api..");
        rule.check(classes);
    }

    @Test
    void run_must_not_depend_on_irita_subscription_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.servicetracker.run..")
                .should().dependOnClassesThat().resideInAnyPackage("com.servicetracker.irita..", "com.servicetracker.subscription..", "com.servicetracker.api..");
        rule.check(classes);
    }

    @Test
    void subscription_must_not_depend_on_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.servicetracker.subscription..")
                .should().dependOnClassesThat().resideInAPackage("com.servicetracker.api..");
        rule.check(classes);
    }

    @Test
    void subscription_engine_must_not_see_tendermint_or_webclient_adapters() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.servicetracker.subscription..")
                .should().dependOnClassesThat().resideInAnyPackage("com.servicetracker.irita.tendermint..")
                .orShould().dependOnClassesThat().haveSimpleNameStartingWith("WebClient");
        rule.check(classes);
    }

    @Test
    void api_should_not_import_repository_classes() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.servicetracker.api..")
                .should().dependOnClassesThat().haveSimpleNameEndingWith("Repository");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.servicetracker.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
