package com.pipekit.core.dependency;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DependencyChecker} and {@link ClasspathPackageResolver}.
 */
class DependencyCheckerTest {

    @Test
    void unavailable_classpath_returnsOnlyUnresolvableNamesOnce() {
        DependencyChecker checker = DependencyChecker.classpath();

        Set<String> missing = checker.unavailable(List.of("java.io", "made_up_pkg_x", "made_up_pkg_x"));

        assertThat(missing).containsExactly("made_up_pkg_x");
    }

    @Test
    void unavailable_emptyInput_returnsEmptySet() {
        assertThat(DependencyChecker.classpath().unavailable(List.of())).isEmpty();
        assertThat(DependencyChecker.classpath().unavailable(null)).isEmpty();
    }

    @Test
    void unavailable_injectedResolver_isConsultedOncePerName() {
        // Given: a resolver that only knows "present" and records every lookup
        List<String> lookups = new ArrayList<>();
        DependencyChecker checker = new DependencyChecker(name -> {
            lookups.add(name);
            return name.equals("present");
        });

        // When: the same names are checked twice
        Set<String> first = checker.unavailable(List.of("present", "absent", "absent"));
        Set<String> second = checker.unavailable(List.of("absent", "present"));

        // Then: results agree and each name was looked up exactly once
        assertThat(first).containsExactly("absent");
        assertThat(second).containsExactly("absent");
        assertThat(lookups).containsExactly("present", "absent");
    }

    @Test
    void classpathResolver_resolvesClassesPackagesAndModules() {
        ClasspathPackageResolver resolver = new ClasspathPackageResolver();

        assertThat(resolver.resolves("com.fasterxml.jackson.databind.ObjectMapper"))
            .as("class on the class path").isTrue();
        assertThat(resolver.resolves("java.util.concurrent"))
            .as("package of a boot module").isTrue();
        assertThat(resolver.resolves("java.base"))
            .as("boot module name").isTrue();
        assertThat(resolver.resolves("org.slf4j"))
            .as("package directory on the class path").isTrue();
    }

    @Test
    void classpathResolver_unknownOrBlankName_doesNotResolve() {
        ClasspathPackageResolver resolver = new ClasspathPackageResolver();

        assertThat(resolver.resolves("made.up.pkg.Nothing")).isFalse();
        assertThat(resolver.resolves("")).isFalse();
        assertThat(resolver.resolves(null)).isFalse();
    }
}
