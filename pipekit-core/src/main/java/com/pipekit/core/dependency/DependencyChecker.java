package com.pipekit.core.dependency;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Determines which declared requirements are unavailable.
 *
 * <p>Lookup results are cached per checker; a requirement's availability does not change
 * during a process lifetime.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DependencyChecker checker = DependencyChecker.classpath();
 * Set<String> missing = checker.unavailable(List.of("java.io", "made.up.pkg"));  // {"made.up.pkg"}
 * }</pre>
 */
public class DependencyChecker {

    private static final Logger log = LoggerFactory.getLogger(DependencyChecker.class);

    private final PackageResolver resolver;
    private final Map<String, Boolean> availability = new ConcurrentHashMap<>();

    public DependencyChecker(PackageResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
    }

    /**
     * Creates a checker probing the running JVM's class path.
     *
     * @return classpath-backed checker
     */
    public static DependencyChecker classpath() {
        return new DependencyChecker(new ClasspathPackageResolver());
    }

    /**
     * Returns the requirements that fail to resolve.
     *
     * <p>Duplicates in the input are collapsed. Never throws for a failed resolution.
     *
     * @param requirementNames requirement names, may contain duplicates
     * @return unmodifiable set of unavailable names
     */
    public Set<String> unavailable(Collection<String> requirementNames) {
        if (requirementNames == null || requirementNames.isEmpty()) {
            return Set.of();
        }
        Set<String> missing = new LinkedHashSet<>();
        for (String name : new LinkedHashSet<>(requirementNames)) {
            if (!availability.computeIfAbsent(name, resolver::resolves)) {
                missing.add(name);
            }
        }
        if (!missing.isEmpty()) {
            log.debug("Unavailable requirements: {}", missing);
        }
        return Collections.unmodifiableSet(missing);
    }
}
