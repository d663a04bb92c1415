package com.ebdgraph.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate the layering of the core module.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>The table and graph models are immutable records</li>
 *   <li>Models don't depend on conversion, validation or generation</li>
 *   <li>Generators depend on the graph, never on the table model's conversion</li>
 *   <li>Utilities stay free of domain dependencies</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.ebdgraph.core");
    }

    /**
     * Graph nodes and edges are records so that graphs can be compared structurally.
     */
    @Test
    void graphModel_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..graph..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .and().areNotInterfaces()
            .should().beAssignableTo(Record.class);

        rule.check(classes);
    }

    @Test
    void tableModel_shouldBeRecordsExceptValidator() {
        ArchRule rule = classes()
            .that().resideInAPackage("..table..")
            .and().areTopLevelClasses()
            .and().areNotInterfaces()
            .and().doNotHaveSimpleName("TableValidator")
            .should().beAssignableTo(Record.class);

        rule.check(classes);
    }

    @Test
    void models_shouldNotDependOnProcessing() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..table..", "..graph..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..conversion..", "..validation..", "..generator..", "..loader..", "..config..");

        rule.check(classes);
    }

    @Test
    void generators_shouldNotDependOnConversion() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..generator..")
            .should().dependOnClassesThat().resideInAnyPackage("..conversion..", "..loader..");

        rule.check(classes);
    }

    @Test
    void utilClasses_shouldNotDependOnDomain() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAnyPackage("..table..", "..graph..", "..generator..");

        rule.check(classes);
    }

    @Test
    void generatorImplementations_shouldResideInImplPackage() {
        ArchRule rule = classes()
            .that().implement(com.ebdgraph.core.generator.DiagramGenerator.class)
            .and().areNotInterfaces()
            .should().resideInAPackage("..generator.impl..");

        rule.check(classes);
    }
}
