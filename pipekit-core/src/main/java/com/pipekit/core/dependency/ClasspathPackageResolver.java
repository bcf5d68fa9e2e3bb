package com.pipekit.core.dependency;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves requirement names against the running JVM.
 *
 * <p>A name resolves when any of the following holds:
 * <ol>
 *   <li>it loads as a class (without initialization)</li>
 *   <li>it names a module of the boot layer or one of its packages</li>
 *   <li>the class loader already defined a package of that name</li>
 *   <li>it exists as a resource directory on the class path</li>
 * </ol>
 */
public class ClasspathPackageResolver implements PackageResolver {

    private static final Logger log = LoggerFactory.getLogger(ClasspathPackageResolver.class);

    private final ClassLoader classLoader;

    public ClasspathPackageResolver() {
        this(defaultClassLoader());
    }

    public ClasspathPackageResolver(ClassLoader classLoader) {
        this.classLoader = classLoader == null ? defaultClassLoader() : classLoader;
    }

    @Override
    public boolean resolves(String name) {
        if (name == null || name.isBlank()) {
            return false;
        }
        boolean resolved = isLoadableClass(name)
            || isBootLayerName(name)
            || classLoader.getDefinedPackage(name) != null
            || classLoader.getResource(name.replace('.', '/') + "/") != null;
        log.debug("Requirement '{}' {}", name, resolved ? "resolved" : "not found");
        return resolved;
    }

    private boolean isLoadableClass(String name) {
        try {
            Class.forName(name, false, classLoader);
            return true;
        } catch (ClassNotFoundException | LinkageError e) {
            log.trace("'{}' is not a loadable class: {}", name, e.toString());
            return false;
        }
    }

    private static boolean isBootLayerName(String name) {
        return ModuleLayer.boot().modules().stream()
            .anyMatch(module -> module.getName().equals(name) || module.getPackages().contains(name));
    }

    private static ClassLoader defaultClassLoader() {
        ClassLoader contextLoader = Thread.currentThread().getContextClassLoader();
        return contextLoader != null ? contextLoader : ClasspathPackageResolver.class.getClassLoader();
    }
}
