package org.pxdforge.generator.frontend.scope;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.pxdforge.generator.frontend.ast.Cursor;
import org.pxdforge.generator.frontend.ast.CursorKind;
import org.pxdforge.generator.frontend.ast.TranslationUnit;
import org.pxdforge.generator.frontend.decl.QualifiedNames;

/**
 * Groups the scope-opening cursors of a translation unit by qualified path.
 *
 * <p>The translation unit opens the global scope {@code ""}. Every namespace opens its
 * qualified path; a namespace split over several blocks or headers contributes one root
 * per block. Inline and anonymous namespaces merge into their parent. Defined C++
 * classes open a scope for their static members.</p>
 */
public final class ScopeFinder {

    private ScopeFinder() {
    }

    /**
     * @param unit The unit to scan.
     * @return Roots per qualified path, global scope first, then in AST order.
     */
    public static Map<String, List<Cursor>> find(TranslationUnit unit) {
        Map<String, List<Cursor>> scopes = new LinkedHashMap<>();
        Deque<Cursor> stack = new ArrayDeque<>();
        stack.push(unit.root());
        while (!stack.isEmpty()) {
            Cursor current = stack.pop();
            if (opensScope(current)) {
                scopes.computeIfAbsent(QualifiedNames.scopePath(current), k -> new ArrayList<>()).add(current);
            }
            List<Cursor> children = current.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                Cursor child = children.get(i);
                if (child.kind() == CursorKind.NAMESPACE || (child.kind().isCppClass() && child.isDefinition())) {
                    stack.push(child);
                }
            }
        }
        return scopes;
    }

    private static boolean opensScope(Cursor cursor) {
        return switch (cursor.kind()) {
            case TRANSLATION_UNIT, NAMESPACE -> true;
            case CLASS_DECL, CLASS_TEMPLATE -> cursor.isDefinition() && !cursor.spelling().isEmpty();
            default -> false;
        };
    }
}
