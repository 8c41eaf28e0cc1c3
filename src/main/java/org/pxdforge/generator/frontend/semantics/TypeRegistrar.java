package org.pxdforge.generator.frontend.semantics;

import java.util.ArrayDeque;
import java.util.Deque;

import org.pxdforge.generator.frontend.decl.Aggregate;
import org.pxdforge.generator.frontend.decl.AssociatedTypes;
import org.pxdforge.generator.frontend.decl.Declaration;
import org.pxdforge.generator.frontend.decl.DeclarationKind;
import org.pxdforge.generator.frontend.scope.Scope;

/**
 * The registration pass over a scope: declares every named type the scope writes and
 * checks every type its declarations refer to.
 */
public class TypeRegistrar {

    private final TypeResolver resolver;

    public TypeRegistrar(TypeResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * @param scope      The aggregated scope.
     * @param modulePath The module the scope is written to.
     */
    public void register(Scope scope, String modulePath) {
        Deque<Declaration> stack = new ArrayDeque<>();
        for (int i = scope.children().size() - 1; i >= 0; i--) {
            stack.push(scope.children().get(i));
        }
        while (!stack.isEmpty()) {
            Declaration declaration = stack.pop();
            if (declaresType(declaration)) {
                resolver.registerDeclared(declaration.address(), declaration.namespace(), modulePath,
                        declaration.file(), !declaration.isForwardDeclaration());
            }
            if (declaration instanceof Aggregate aggregate) {
                for (Declaration member : aggregate.members()) {
                    stack.push(member);
                }
            }
        }

        for (Declaration child : scope.children()) {
            AssociatedTypes associated = AssociatedTypes.of(child);
            for (Declaration referenced : associated.declarations()) {
                if (referenced.isAnonymous()) {
                    continue;
                }
                if (scope.restricted() && !scope.isOrigin(referenced.file())) {
                    // written as a stub by the renderer
                    continue;
                }
                resolver.processReference(referenced.address(), scope.namespace());
            }
            for (String name : associated.undeclaredNames()) {
                resolver.processReference(name, scope.namespace());
            }
        }
    }

    private static boolean declaresType(Declaration declaration) {
        if (declaration.isAnonymous() || declaration.name().isEmpty()) {
            return false;
        }
        DeclarationKind kind = declaration.kind();
        return kind == DeclarationKind.STRUCT || kind == DeclarationKind.UNION
                || kind == DeclarationKind.ENUMERATION || kind == DeclarationKind.TYPEDEF;
    }
}
