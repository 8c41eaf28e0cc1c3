package org.pxdforge.generator.frontend.decl;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.pxdforge.generator.frontend.ast.Cursor;
import org.pxdforge.generator.frontend.ast.TypeDescriptor;
import org.pxdforge.generator.frontend.ast.TypeKind;
import org.pxdforge.generator.frontend.dialect.DialectConverter;

/**
 * The types a declaration refers to.
 *
 * <p>Walks type descriptors with an explicit work-list, so arbitrarily nested template
 * arguments cannot exhaust the call stack. Aggregates contribute the types of their
 * members; a member aggregate is visited once per key.</p>
 */
public final class AssociatedTypes {

    private final Map<String, Declaration> declarations;
    private final Set<String> undeclaredNames;

    private AssociatedTypes(Map<String, Declaration> declarations, Set<String> undeclaredNames) {
        this.declarations = declarations;
        this.undeclaredNames = undeclaredNames;
    }

    /**
     * Collects the associated types of a declaration.
     *
     * @param root The declaration to inspect.
     * @return Declared types keyed by qualified address, plus qualified names of types
     *         the AST spells without a declaration.
     */
    public static AssociatedTypes of(Declaration root) {
        Map<String, Declaration> declarations = new LinkedHashMap<>();
        Set<String> undeclared = new LinkedHashSet<>();
        Set<String> expanded = new HashSet<>();
        Deque<Declaration> owners = new ArrayDeque<>();
        Deque<TypeDescriptor> types = new ArrayDeque<>();

        owners.push(root);
        expanded.add(root.key());
        while (!owners.isEmpty()) {
            Declaration owner = owners.pop();
            pushAll(types, owner.referencedTypes());
            while (!types.isEmpty()) {
                TypeDescriptor type = types.pop();
                switch (type.kind()) {
                    case RECORD, ENUM, TYPEDEF -> {
                        Optional<Cursor> cursor = owner.unit().declarationOf(type);
                        if (cursor.isPresent()) {
                            Declaration declaration = Declarations.specialize(cursor.get(), owner.unit());
                            declarations.putIfAbsent(declaration.key(), declaration);
                        } else {
                            undeclared.add(undeclaredName(type));
                        }
                        pushAll(types, type.templateArguments());
                    }
                    case FUNCTION_PROTO -> {
                        push(types, type.result());
                        pushAll(types, type.arguments());
                    }
                    case TEMPLATE_PARAMETER, BUILTIN, DEPENDENT, UNEXPOSED -> {
                        // nothing to import
                    }
                    default -> push(types, type.target());
                }
            }
            if (owner instanceof Aggregate aggregate) {
                for (Declaration member : aggregate.members()) {
                    if (expanded.add(member.key())) {
                        owners.push(member);
                    }
                }
            }
        }
        declarations.remove(root.key());
        return new AssociatedTypes(declarations, undeclared);
    }

    private static String undeclaredName(TypeDescriptor type) {
        String spelling = DialectConverter.stripTemplateArguments(DialectConverter.stripElaboration(type.spelling()));
        return spelling.startsWith("const ") ? spelling.substring("const ".length()) : spelling;
    }

    private static void pushAll(Deque<TypeDescriptor> stack, List<TypeDescriptor> types) {
        for (int i = types.size() - 1; i >= 0; i--) {
            push(stack, types.get(i));
        }
    }

    private static void push(Deque<TypeDescriptor> stack, TypeDescriptor type) {
        if (type != null && type.kind() != TypeKind.TEMPLATE_PARAMETER) {
            stack.push(type);
        }
    }

    public Set<Declaration> declarations() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(declarations.values()));
    }

    public Set<String> undeclaredNames() {
        return Collections.unmodifiableSet(undeclaredNames);
    }
}
