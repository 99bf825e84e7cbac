package dev.pagereader.architecture;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

@AnalyzeClasses(packages = "dev.pagereader", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

    // The pipeline packages know nothing about the HTTP adapter.
    @ArchTest
    static final ArchRule pipeline_should_not_depend_on_api =
        noClasses().that().resideInAnyPackage("..fetch..", "..extract..", "..batch..")
            .should().dependOnClassesThat().resideInAPackage("..api..");

    // Fetching is transport only; it never reaches into extraction or batching.
    @ArchTest
    static final ArchRule fetch_should_not_depend_on_later_stages =
        noClasses().that().resideInAPackage("..fetch..")
            .should().dependOnClassesThat().resideInAnyPackage("..extract..", "..batch..");

    @ArchTest
    static final ArchRule extract_should_not_depend_on_batch =
        noClasses().that().resideInAPackage("..extract..")
            .should().dependOnClassesThat().resideInAPackage("..batch..");

    @ArchTest
    static final ArchRule config_should_not_depend_on_api =
        noClasses().that().resideInAPackage("..config..")
            .should().dependOnClassesThat().resideInAPackage("..api..");

    // No cyclic dependencies between top-level packages
    @ArchTest
    static final ArchRule no_package_cycles =
        slices().matching("dev.pagereader.(*)..").should().beFreeOfCycles();
}
