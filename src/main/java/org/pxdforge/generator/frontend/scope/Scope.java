package org.pxdforge.generator.frontend.scope;

import java.util.List;
import java.util.Set;

import org.pxdforge.generator.frontend.decl.Declaration;

/**
 * The filtered declarations sharing one qualified path.
 *
 * @param path        Qualified path, empty for the global scope.
 * @param namespace   Enclosing namespaces of the path; equals {@code path} unless the
 *                    scope is opened by a class.
 * @param children    Deduplicated declarations in AST order.
 * @param originFiles Files allowed to contribute declarations in restricted mode.
 * @param classSpace  Whether the scope is opened by a C++ class and holds its static
 *                    members.
 * @param restricted  Whether declarations from other files were filtered out.
 * @param header      The main header the scope was collected from.
 */
public record Scope(String path,
                    String namespace,
                    List<Declaration> children,
                    Set<String> originFiles,
                    boolean classSpace,
                    boolean restricted,
                    String header) {

    public Scope {
        children = List.copyOf(children);
        originFiles = Set.copyOf(originFiles);
    }

    public boolean hasDeclarations() {
        return !children.isEmpty();
    }

    public boolean isGlobal() {
        return path.isEmpty();
    }

    public boolean isOrigin(String file) {
        return file != null && originFiles.contains(file);
    }
}
