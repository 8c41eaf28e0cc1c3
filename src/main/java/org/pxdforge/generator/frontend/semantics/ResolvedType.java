package org.pxdforge.generator.frontend.semantics;

import org.pxdforge.generator.frontend.decl.QualifiedNames;

/**
 * Resolution record of one qualified type name.
 *
 * @param qualifiedName The C++ qualified name, e.g. {@code A::Outer::Inner}.
 * @param namespace     The enclosing namespaces, e.g. {@code A}.
 * @param modulePath    The dotted module declaring the type; empty while unknown.
 * @param file          The header declaring the type, if known.
 * @param definition    Whether the registration came from a definition rather than a
 *                      forward declaration.
 */
public record ResolvedType(String qualifiedName, String namespace, String modulePath, String file, boolean definition) {

    static ResolvedType pending(String qualifiedName) {
        return new ResolvedType(qualifiedName, "", "", null, false);
    }

    public String basename() {
        return QualifiedNames.basename(qualifiedName);
    }

    /**
     * Dotted path from the namespace down to the type: {@code Outer.Inner}.
     */
    public String localPath() {
        return QualifiedNames.dotted(QualifiedNames.relativeTo(qualifiedName, namespace));
    }

    /**
     * First segment of {@link #localPath()}: the symbol a module exports.
     */
    public String topLevelSymbol() {
        String local = localPath();
        int dot = local.indexOf('.');
        return dot < 0 ? local : local.substring(0, dot);
    }
}
