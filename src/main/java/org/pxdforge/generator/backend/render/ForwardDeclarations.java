package org.pxdforge.generator.backend.render;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.pxdforge.generator.frontend.decl.Aggregate;
import org.pxdforge.generator.frontend.decl.Declaration;
import org.pxdforge.generator.frontend.decl.Declarations;
import org.pxdforge.generator.frontend.scope.Scope;
import org.pxdforge.generator.frontend.semantics.StandardTypes;

/**
 * Empty-bodied declarations for types a restricted scope refers to but does not
 * declare.
 */
public final class ForwardDeclarations {

    private ForwardDeclarations() {
    }

    /**
     * Referenced types declared outside the scope's origin files, excluding anonymous,
     * builtin and standard types.
     *
     * @param scope A restricted scope.
     * @return The types, sorted by qualified name.
     */
    public static List<Declaration> outOfOrigin(Scope scope) {
        Map<String, Declaration> result = new LinkedHashMap<>();
        for (Declaration child : scope.children()) {
            for (Declaration referenced : child.associatedTypes()) {
                if (referenced.isAnonymous() || scope.isOrigin(referenced.file())
                        || StandardTypes.isStandard(referenced.address())) {
                    continue;
                }
                result.putIfAbsent(referenced.key(), referenced);
            }
        }
        List<Declaration> sorted = new ArrayList<>(result.values());
        sorted.sort(Comparator.comparing(Declaration::address));
        return sorted;
    }

    /**
     * An empty declaration of the type under its simple name.
     */
    public static List<String> stub(Declaration declaration) {
        String header = declaration instanceof Aggregate aggregate
                ? aggregate.header(declaration.name(), false)
                : "ctypedef struct " + declaration.name() + ":";
        return List.of(header, Declarations.INDENT + "pass");
    }
}
