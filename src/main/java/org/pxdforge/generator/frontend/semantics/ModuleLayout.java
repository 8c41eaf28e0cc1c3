package org.pxdforge.generator.frontend.semantics;

import java.nio.file.Path;

import org.pxdforge.generator.frontend.decl.QualifiedNames;

/**
 * Decides which module a declaration is written to.
 */
public enum ModuleLayout {

    /**
     * One module per C++ namespace; the global namespace is named after the header.
     * Used when generating a single header.
     */
    NAMESPACE {
        @Override
        public String modulePath(String namespace, String relativeHeader) {
            if (namespace == null || namespace.isEmpty()) {
                return stem(Path.of(relativeHeader).getFileName().toString());
            }
            return QualifiedNames.dotted(namespace);
        }
    },

    /**
     * One module per header, mirroring its path below the include base.
     * Used when generating a directory of headers.
     */
    HEADER {
        @Override
        public String modulePath(String namespace, String relativeHeader) {
            String normalized = relativeHeader.replace('\\', '/');
            while (normalized.startsWith("./") || normalized.startsWith("/")) {
                normalized = normalized.substring(normalized.startsWith("./") ? 2 : 1);
            }
            return stem(normalized).replace('/', '.');
        }
    };

    /**
     * @param namespace      The namespace of the scope being written.
     * @param relativeHeader The header path relative to the include base.
     * @return The dotted module path.
     */
    public abstract String modulePath(String namespace, String relativeHeader);

    public static ModuleLayout parse(String name) {
        return valueOf(name.trim().toUpperCase());
    }

    private static String stem(String fileName) {
        int slash = fileName.lastIndexOf('/');
        int dot = fileName.lastIndexOf('.');
        return dot > slash ? fileName.substring(0, dot) : fileName;
    }
}
