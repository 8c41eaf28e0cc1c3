package org.pxdforge.generator.api;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * Maps dotted module paths to {@code .pxd} file paths. A module that is also the
 * package of another module is written as the package's {@code __init__.pxd}.
 */
public final class PackageLayout {

    public static final String EXTENSION = ".pxd";
    public static final String PACKAGE_MODULE = "__init__" + EXTENSION;

    private PackageLayout() {
    }

    /**
     * @param modulePaths Every module written by the run.
     * @return The relative file path per module, in the given order.
     */
    public static Map<String, String> filesOf(Collection<String> modulePaths) {
        NavigableSet<String> sorted = new TreeSet<>(modulePaths);
        Map<String, String> files = new LinkedHashMap<>();
        for (String module : modulePaths) {
            String base = module.replace('.', '/');
            String successor = sorted.higher(module + ".");
            boolean isPackage = successor != null && successor.startsWith(module + ".");
            files.put(module, isPackage ? base + "/" + PACKAGE_MODULE : base + EXTENSION);
        }
        return files;
    }
}
