package com.vidnyan.pyguard;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * Layering guardrails: the domain knows nothing about Spring or the outer layers,
 * and the application layer reaches adapters only through its ports.
 */
@AnalyzeClasses(
        packages = "com.vidnyan.pyguard",
        importOptions = {ImportOption.DoNotIncludeTests.class})
class ArchitectureTest {

    @ArchTest
    static final ArchRule domainIsFrameworkFree = noClasses()
            .that().resideInAPackage("com.vidnyan.pyguard.domain..")
            .should().dependOnClassesThat().resideInAnyPackage("org.springframework..", "com.fasterxml.jackson..")
            .because("rules and traversal run without a container");

    @ArchTest
    static final ArchRule domainIgnoresOuterLayers = noClasses()
            .that().resideInAPackage("com.vidnyan.pyguard.domain..")
            .should().dependOnClassesThat().resideInAnyPackage(
                    "com.vidnyan.pyguard.adapter..",
                    "com.vidnyan.pyguard.application..",
                    "com.vidnyan.pyguard.config..");

    @ArchTest
    static final ArchRule applicationUsesPortsOnly = noClasses()
            .that().resideInAPackage("com.vidnyan.pyguard.application..")
            .should().dependOnClassesThat().resideInAnyPackage(
                    "com.vidnyan.pyguard.adapter..",
                    "com.vidnyan.pyguard.config..");

    @ArchTest
    static final ArchRule detectorsStayOffTheHook = noClasses()
            .that().resideInAPackage("com.vidnyan.pyguard.adapter.out..")
            .should().dependOnClassesThat().resideInAPackage("com.vidnyan.pyguard.adapter.in..");
}
