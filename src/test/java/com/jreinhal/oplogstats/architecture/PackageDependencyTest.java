package com.jreinhal.oplogstats.architecture;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Changes flow one way: oplog, then service, then pipeline, then the runner. Lower layers must
 * not reach back up.
 */
class PackageDependencyTest {

    private static final JavaClasses CLASSES = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.jreinhal.oplogstats");

    @Test
    @DisplayName("model package must not depend on oplog, service or pipeline")
    void modelShouldStayLeaf() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..oplogstats.model..")
                .should().dependOnClassesThat()
                .resideInAnyPackage("..oplogstats.oplog..", "..oplogstats.service..", "..oplogstats.pipeline..",
                        "..oplogstats.config..");
        rule.check(CLASSES);
    }

    @Test
    @DisplayName("oplog package must not depend on service or pipeline")
    void oplogShouldNotDependOnConsumers() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..oplogstats.oplog..")
                .should().dependOnClassesThat()
                .resideInAnyPackage("..oplogstats.service..", "..oplogstats.pipeline..", "..oplogstats.config..");
        rule.check(CLASSES);
    }

    @Test
    @DisplayName("service package must not depend on oplog or pipeline")
    void serviceShouldNotDependOnTailing() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..oplogstats.service..")
                .should().dependOnClassesThat()
                .resideInAnyPackage("..oplogstats.oplog..", "..oplogstats.pipeline..");
        rule.check(CLASSES);
    }

    @Test
    @DisplayName("pipeline package must not depend on Spring configuration")
    void pipelineShouldNotDependOnConfig() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..oplogstats.pipeline..")
                .should().dependOnClassesThat()
                .resideInAPackage("..oplogstats.config..");
        rule.check(CLASSES);
    }

    @Test
    @DisplayName("exception and util packages must not depend on application packages")
    void sharedPackagesShouldStayLeaf() {
        ArchRule rule = noClasses()
                .that().resideInAnyPackage("..oplogstats.exception..", "..oplogstats.util..")
                .should().dependOnClassesThat()
                .resideInAnyPackage("..oplogstats.oplog..", "..oplogstats.service..", "..oplogstats.pipeline..",
                        "..oplogstats.config..", "..oplogstats.model..");
        rule.check(CLASSES);
    }
}
