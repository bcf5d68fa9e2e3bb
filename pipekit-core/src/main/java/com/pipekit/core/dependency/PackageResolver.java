package com.pipekit.core.dependency;

/**
 * Capability check deciding whether a requirement is available in the current environment.
 *
 * <p>Implementations must not throw for an unresolvable name; returning {@code false}
 * is the expected signal. Tests inject deterministic resolvers instead of depending on
 * the real classpath.
 *
 * @see ClasspathPackageResolver
 */
@FunctionalInterface
public interface PackageResolver {

    /**
     * Checks whether the named requirement resolves.
     *
     * @param name requirement name (class or package name)
     * @return true if the requirement is available
     */
    boolean resolves(String name);
}
